package io.igloo.overlay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.igloo.overlay.config.OverlayConfig;
import io.igloo.overlay.menu.ClosePolicy;
import io.igloo.overlay.menu.MenuCallbacks;
import io.igloo.overlay.menu.MenuKey;
import io.igloo.overlay.menu.MenuOption;
import io.igloo.overlay.position.Alignment;
import io.igloo.overlay.position.Placement;
import io.igloo.overlay.position.Rect;
import io.igloo.overlay.position.Side;
import io.igloo.overlay.position.Viewport;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ActionMenuTest {
    private static final List<MenuOption> OPTIONS =
            List.of(MenuOption.of("edit", "Edit"), MenuOption.of("delete", "Delete"));
    private static final Viewport VIEWPORT = new Viewport(1280, 720);

    @Test
    void buildsControllerFromConfig() {
        OverlayConfig config = OverlayConfig.defaults();
        config.menuInitiallyOpen = true;
        config.closeOnSelect = OverlayConfig.CLOSE_ON_SELECT_NEVER;
        List<String> selected = new ArrayList<>();

        ActionMenu menu =
                ActionMenu.fromConfig(
                        config,
                        OPTIONS,
                        MenuCallbacks.none()
                                .withOnOptionSelect(option -> selected.add(option.id())));
        menu.controller().handleKey(MenuKey.HOME);
        menu.controller().handleKey(MenuKey.ENTER);

        assertTrue(menu.controller().isOpen());
        assertEquals(List.of("edit"), selected);
        assertEquals(new Placement(Side.BOTTOM, Alignment.END), menu.preferredPlacement());
    }

    @Test
    void explicitClosePolicyOverridesConfig() {
        ActionMenu menu =
                ActionMenu.fromConfig(
                        OverlayConfig.defaults(),
                        OPTIONS,
                        ClosePolicy.matching(option -> option.id().equals("delete")),
                        MenuCallbacks.none());
        menu.controller().toggle(true);

        menu.controller().selectOption(OPTIONS.get(0));
        assertTrue(menu.controller().isOpen());

        menu.controller().selectOption(OPTIONS.get(1));
        assertFalse(menu.controller().isOpen());
    }

    @Test
    void menuFlipsAboveTriggerNearViewportBottom() {
        ActionMenu menu =
                ActionMenu.fromConfig(OverlayConfig.defaults(), OPTIONS, MenuCallbacks.none());
        Rect overlay = Rect.ofSize(160, 96);

        assertEquals(
                new Placement(Side.BOTTOM, Alignment.END),
                menu.placementFor(overlay, Rect.of(600, 100, 32, 32), VIEWPORT));
        assertEquals(
                new Placement(Side.TOP, Alignment.END),
                menu.placementFor(overlay, Rect.of(600, 660, 32, 32), VIEWPORT));
    }

    @Test
    void tooltipResolvesConfiguredSide() {
        OverlayConfig config = OverlayConfig.defaults();
        Tooltip tooltip = Tooltip.fromConfig(config);
        Rect body = Rect.ofSize(120, 40);

        assertEquals(Side.TOP, tooltip.preferredSide());
        assertEquals(Side.BOTTOM, tooltip.visibleSide(body, Rect.of(50, 8, 24, 24), VIEWPORT));
        assertEquals(Side.TOP, tooltip.visibleSide(body, Rect.of(50, 300, 24, 24), VIEWPORT));
        assertEquals(Side.TOP, new Tooltip(null).preferredSide());
    }
}
