package io.igloo.overlay.menu;

import java.util.Optional;

/** Keys the menu trigger reacts to, by their DOM-style key names. */
public enum MenuKey {
    ENTER("Enter"),
    SPACE(" "),
    ARROW_DOWN("ArrowDown"),
    ARROW_UP("ArrowUp"),
    ESCAPE("Escape"),
    TAB("Tab"),
    HOME("Home"),
    END("End");

    private final String keyName;

    MenuKey(String keyName) {
        this.keyName = keyName;
    }

    public String keyName() {
        return keyName;
    }

    /** Key names are matched exactly; space is the single space character. */
    public static Optional<MenuKey> fromKeyName(String keyName) {
        if (keyName == null) {
            return Optional.empty();
        }

        for (MenuKey value : values()) {
            if (value.keyName.equals(keyName)) {
                return Optional.of(value);
            }
        }

        return Optional.empty();
    }
}
