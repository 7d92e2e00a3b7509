package io.igloo.overlay.position;

import java.util.Locale;
import java.util.Optional;

/** Placement of the overlay along the anchor edge it is attached to. */
public enum Alignment {
    START("start"),
    CENTER("center"),
    END("end");

    private final String id;

    Alignment(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<Alignment> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }

        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Alignment value : values()) {
            if (value.id.equals(normalized)) {
                return Optional.of(value);
            }
        }

        return Optional.empty();
    }
}
