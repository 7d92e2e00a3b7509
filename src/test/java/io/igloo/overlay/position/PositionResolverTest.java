package io.igloo.overlay.position;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class PositionResolverTest {
    private static final Viewport VIEWPORT = new Viewport(1000, 800);
    private static final Rect OVERLAY = Rect.ofSize(200, 100);

    @Test
    void flipsTopToBottomWhenOnlyBottomFits() {
        Rect anchor = Rect.of(400, 10, 80, 40);

        assertEquals(
                Side.BOTTOM, PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, Side.TOP));
    }

    @Test
    void keepsTopWhenItFitsEvenIfBottomFitsToo() {
        Rect anchor = Rect.of(400, 150, 80, 40);

        assertEquals(Side.TOP, PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, Side.TOP));
    }

    @Test
    void keepsPreferredSideWhenNeitherSideFits() {
        Rect anchor = new Rect(5, 480, 795, 400, 80, 790);

        assertEquals(Side.TOP, PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, Side.TOP));
        assertEquals(
                Side.BOTTOM, PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, Side.BOTTOM));
    }

    @Test
    void flipsBottomToTopNearViewportBottom() {
        Rect anchor = Rect.of(400, 720, 80, 40);

        assertEquals(
                Side.TOP, PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, Side.BOTTOM));
    }

    @Test
    void bottomFitsExactlyAtBoundary() {
        // 800 - 700 leaves exactly the overlay height.
        Rect anchor = Rect.of(400, 660, 80, 40);

        assertEquals(
                Side.BOTTOM, PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, Side.BOTTOM));
    }

    @Test
    void flipsHorizontallyOnlyToTheOppositeSide() {
        Rect nearLeftEdge = Rect.of(50, 400, 80, 40);
        Rect nearRightEdge = Rect.of(900, 400, 80, 40);

        assertEquals(
                Side.RIGHT,
                PositionResolver.resolveSide(OVERLAY, nearLeftEdge, VIEWPORT, Side.LEFT));
        assertEquals(
                Side.LEFT,
                PositionResolver.resolveSide(OVERLAY, nearRightEdge, VIEWPORT, Side.RIGHT));
    }

    @Test
    void neverFallsBackToPerpendicularSide() {
        Viewport narrow = new Viewport(300, 800);
        Rect anchor = Rect.of(100, 400, 100, 40);

        assertEquals(Side.LEFT, PositionResolver.resolveSide(OVERLAY, anchor, narrow, Side.LEFT));
        assertEquals(Side.RIGHT, PositionResolver.resolveSide(OVERLAY, anchor, narrow, Side.RIGHT));
    }

    @Test
    void unknownOrMissingPreferredSideDefaultsToTop() {
        Rect anchor = Rect.of(400, 10, 80, 40);

        assertEquals(
                Side.TOP, PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, (Side) null));
        assertEquals(Side.TOP, PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, "diagonal"));
        assertEquals(Side.LEFT, PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, " Left "));
    }

    @Test
    void repeatedCallsGiveTheSameAnswer() {
        Rect anchor = Rect.of(400, 10, 80, 40);
        Side first = PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, Side.TOP);

        for (int i = 0; i < 5; i++) {
            assertEquals(first, PositionResolver.resolveSide(OVERLAY, anchor, VIEWPORT, Side.TOP));
        }
    }

    @Test
    void placementKeepsAlignmentWhenFlipping() {
        Rect anchor = Rect.of(400, 720, 80, 40);

        Placement resolved =
                PositionResolver.resolvePlacement(
                        OVERLAY, anchor, VIEWPORT, Placement.parse("bottom-end"));

        assertEquals(new Placement(Side.TOP, Alignment.END), resolved);
        assertEquals("top-end", resolved.asText());
    }
}
