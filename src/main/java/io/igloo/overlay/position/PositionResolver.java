package io.igloo.overlay.position;

/**
 * Chooses the side of an anchor an overlay renders on.
 *
 * <p>The preferred side is kept unless the overlay does not fit there and does fit on the opposite
 * side. There is no fallback to a perpendicular side and no clamping to the viewport: when neither
 * side fits, the preferred side is returned and the overlay may overflow.
 */
public final class PositionResolver {
    private PositionResolver() {}

    public static Side resolveSide(Rect overlay, Rect anchor, Viewport viewport, Side preferred) {
        if (preferred == null) {
            return Side.TOP;
        }

        return switch (preferred) {
            case TOP ->
                    !fitsTop(overlay, anchor) && fitsBottom(overlay, anchor, viewport)
                            ? Side.BOTTOM
                            : Side.TOP;
            case BOTTOM ->
                    !fitsBottom(overlay, anchor, viewport) && fitsTop(overlay, anchor)
                            ? Side.TOP
                            : Side.BOTTOM;
            case LEFT ->
                    !fitsLeft(overlay, anchor) && fitsRight(overlay, anchor, viewport)
                            ? Side.RIGHT
                            : Side.LEFT;
            case RIGHT ->
                    !fitsRight(overlay, anchor, viewport) && fitsLeft(overlay, anchor)
                            ? Side.LEFT
                            : Side.RIGHT;
        };
    }

    /** Resolves a side given by name; unknown names resolve as {@link Side#TOP}. */
    public static Side resolveSide(
            Rect overlay, Rect anchor, Viewport viewport, String preferredSideId) {
        Side preferred = Side.fromId(preferredSideId).orElse(null);
        return resolveSide(overlay, anchor, viewport, preferred);
    }

    /** Flips the side of {@code preferred} when needed; the alignment is carried over. */
    public static Placement resolvePlacement(
            Rect overlay, Rect anchor, Viewport viewport, Placement preferred) {
        Placement effective = preferred == null ? Placement.DEFAULT : preferred;
        Side side = resolveSide(overlay, anchor, viewport, effective.side());
        return effective.withSide(side);
    }

    static boolean fitsTop(Rect overlay, Rect anchor) {
        return anchor.top() >= overlay.height();
    }

    static boolean fitsBottom(Rect overlay, Rect anchor, Viewport viewport) {
        return overlay.height() <= viewport.height() - anchor.bottom();
    }

    static boolean fitsLeft(Rect overlay, Rect anchor) {
        return anchor.left() >= overlay.width();
    }

    static boolean fitsRight(Rect overlay, Rect anchor, Viewport viewport) {
        return overlay.width() <= viewport.width() - anchor.right();
    }
}
