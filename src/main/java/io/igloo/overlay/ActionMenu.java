package io.igloo.overlay;

import io.igloo.overlay.config.OverlayConfig;
import io.igloo.overlay.menu.ClosePolicy;
import io.igloo.overlay.menu.MenuCallbacks;
import io.igloo.overlay.menu.MenuController;
import io.igloo.overlay.menu.MenuOption;
import io.igloo.overlay.position.Placement;
import io.igloo.overlay.position.PositionResolver;
import io.igloo.overlay.position.Rect;
import io.igloo.overlay.position.Viewport;
import java.util.List;
import java.util.Objects;

/**
 * Dropdown action menu: a {@link MenuController} plus the placement its overlay prefers.
 *
 * <p>The controller and the position resolver do not know about each other; this class is where
 * they meet.
 */
public final class ActionMenu {
    private final MenuController controller;
    private final Placement preferredPlacement;

    public ActionMenu(MenuController controller, Placement preferredPlacement) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.preferredPlacement = Objects.requireNonNull(preferredPlacement, "preferredPlacement");
    }

    public static ActionMenu fromConfig(
            OverlayConfig config, List<MenuOption> options, MenuCallbacks callbacks) {
        return fromConfig(config, options, config.closePolicy(), callbacks);
    }

    /** Uses {@code closePolicy} in place of the configured one, e.g. for predicate policies. */
    public static ActionMenu fromConfig(
            OverlayConfig config,
            List<MenuOption> options,
            ClosePolicy closePolicy,
            MenuCallbacks callbacks) {
        MenuController controller =
                new MenuController(options, config.menuInitiallyOpen, closePolicy, callbacks);
        return new ActionMenu(controller, config.parsedMenuPlacement());
    }

    public MenuController controller() {
        return controller;
    }

    public Placement preferredPlacement() {
        return preferredPlacement;
    }

    /** Placement for the current measurements; call again on open, resize and scroll. */
    public Placement placementFor(Rect overlay, Rect anchor, Viewport viewport) {
        return PositionResolver.resolvePlacement(overlay, anchor, viewport, preferredPlacement);
    }
}
