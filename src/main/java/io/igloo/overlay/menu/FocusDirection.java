package io.igloo.overlay.menu;

import java.util.Locale;

public enum FocusDirection {
    FIRST,
    LAST,
    UP,
    DOWN;

    /** Unknown or missing names move to the first option. */
    public static FocusDirection fromName(String name) {
        if (name == null) {
            return FIRST;
        }

        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "last" -> LAST;
            case "up" -> UP;
            case "down" -> DOWN;
            default -> FIRST;
        };
    }
}
