package io.igloo.overlay.position;

/**
 * Measured rectangle in viewport coordinates.
 *
 * <p>Values are taken as measured; physically implausible rectangles are not rejected.
 */
public record Rect(
        double top, double right, double bottom, double left, double width, double height) {

    public static Rect of(double left, double top, double width, double height) {
        return new Rect(top, left + width, top + height, left, width, height);
    }

    /** Rectangle carrying only a size, for overlays whose position is not yet decided. */
    public static Rect ofSize(double width, double height) {
        return of(0.0D, 0.0D, width, height);
    }
}
