package io.igloo.overlay;

import io.igloo.overlay.config.OverlayConfig;
import io.igloo.overlay.position.PositionResolver;
import io.igloo.overlay.position.Rect;
import io.igloo.overlay.position.Side;
import io.igloo.overlay.position.Viewport;

/** Tooltip positioning around its anchor. */
public final class Tooltip {
    private final Side preferredSide;

    public Tooltip(Side preferredSide) {
        this.preferredSide = preferredSide == null ? Side.TOP : preferredSide;
    }

    public static Tooltip fromConfig(OverlayConfig config) {
        return new Tooltip(config.parsedTooltipSide());
    }

    public Side preferredSide() {
        return preferredSide;
    }

    public Side visibleSide(Rect tooltip, Rect anchor, Viewport viewport) {
        return PositionResolver.resolveSide(tooltip, anchor, viewport, preferredSide);
    }
}
