package io.igloo.overlay.position;

import java.util.Objects;

/**
 * Preferred or resolved overlay placement, written as {@code side} or {@code side-alignment}
 * (for example {@code bottom-end}).
 *
 * @param side Side of the anchor the overlay renders on.
 * @param alignment Alignment along that side; {@code CENTER} when the text names a side only.
 */
public record Placement(Side side, Alignment alignment) {
    public static final Placement DEFAULT = new Placement(Side.TOP, Alignment.CENTER);

    public Placement {
        side = Objects.requireNonNull(side, "side");
        alignment = Objects.requireNonNull(alignment, "alignment");
    }

    public static Placement of(Side side) {
        return new Placement(side, Alignment.CENTER);
    }

    /** Parses placement text, degrading to {@link #DEFAULT} when it is not recognized. */
    public static Placement parse(String text) {
        if (text == null || text.isBlank()) {
            return DEFAULT;
        }

        String trimmed = text.trim();
        int separator = trimmed.indexOf('-');
        if (separator < 0) {
            return Side.fromId(trimmed).map(Placement::of).orElse(DEFAULT);
        }

        Side side = Side.fromId(trimmed.substring(0, separator)).orElse(null);
        Alignment alignment = Alignment.fromId(trimmed.substring(separator + 1)).orElse(null);
        if (side == null || alignment == null) {
            return DEFAULT;
        }

        return new Placement(side, alignment);
    }

    public Placement withSide(Side newSide) {
        return new Placement(newSide, alignment);
    }

    public String asText() {
        if (alignment == Alignment.CENTER) {
            return side.id();
        }
        return side.id() + "-" + alignment.id();
    }
}
