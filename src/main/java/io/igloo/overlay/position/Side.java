package io.igloo.overlay.position;

import java.util.Locale;
import java.util.Optional;

public enum Side {
    TOP("top"),
    RIGHT("right"),
    BOTTOM("bottom"),
    LEFT("left");

    private final String id;

    Side(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public Side opposite() {
        return switch (this) {
            case TOP -> BOTTOM;
            case BOTTOM -> TOP;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
        };
    }

    public boolean isVertical() {
        return this == TOP || this == BOTTOM;
    }

    public static Optional<Side> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }

        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Side value : values()) {
            if (value.id.equals(normalized)) {
                return Optional.of(value);
            }
        }

        return Optional.empty();
    }
}
