package io.igloo.overlay.config;

import io.igloo.overlay.menu.ClosePolicy;
import io.igloo.overlay.position.Placement;
import io.igloo.overlay.position.Side;
import java.util.Locale;

public final class OverlayConfig {
    public static final String CLOSE_ON_SELECT_ALWAYS = "ALWAYS";
    public static final String CLOSE_ON_SELECT_NEVER = "NEVER";
    public static final String DEFAULT_MENU_PLACEMENT = "bottom-end";
    public static final String DEFAULT_TOOLTIP_SIDE = "top";

    public boolean menuInitiallyOpen;
    public String closeOnSelect = CLOSE_ON_SELECT_ALWAYS;
    public String menuPlacement = DEFAULT_MENU_PLACEMENT;
    public String tooltipSide = DEFAULT_TOOLTIP_SIDE;

    public static OverlayConfig defaults() {
        OverlayConfig config = new OverlayConfig();
        config.menuInitiallyOpen = false;
        config.closeOnSelect = CLOSE_ON_SELECT_ALWAYS;
        config.menuPlacement = DEFAULT_MENU_PLACEMENT;
        config.tooltipSide = DEFAULT_TOOLTIP_SIDE;
        return config;
    }

    public void sanitize() {
        if (closeOnSelect == null || closeOnSelect.isBlank()) {
            closeOnSelect = CLOSE_ON_SELECT_ALWAYS;
        } else {
            closeOnSelect = closeOnSelect.trim().toUpperCase(Locale.ROOT);
        }

        if (!CLOSE_ON_SELECT_ALWAYS.equals(closeOnSelect)
                && !CLOSE_ON_SELECT_NEVER.equals(closeOnSelect)) {
            closeOnSelect = CLOSE_ON_SELECT_ALWAYS;
        }

        // Unparseable placements are rewritten to the parser's fallback.
        menuPlacement =
                menuPlacement == null || menuPlacement.isBlank()
                        ? DEFAULT_MENU_PLACEMENT
                        : Placement.parse(menuPlacement).asText();

        tooltipSide = Side.fromId(tooltipSide).orElse(Side.TOP).id();
    }

    public ClosePolicy closePolicy() {
        return ClosePolicy.fromName(closeOnSelect);
    }

    public Placement parsedMenuPlacement() {
        return Placement.parse(menuPlacement);
    }

    public Side parsedTooltipSide() {
        return Side.fromId(tooltipSide).orElse(Side.TOP);
    }
}
