package io.igloo.overlay.menu;

import java.util.function.Consumer;

/**
 * Optional notifications raised by a {@link MenuController}. Any of them may be {@code null}, in
 * which case it is skipped.
 *
 * @param onMenuOpen Called on every {@code toggle(true)}.
 * @param onMenuClose Called on every {@code toggle(false)}.
 * @param onOptionSelect Called with each selected option.
 * @param onOptionHover Called with each hovered option.
 */
public record MenuCallbacks(
        Runnable onMenuOpen,
        Runnable onMenuClose,
        Consumer<MenuOption> onOptionSelect,
        Consumer<MenuOption> onOptionHover) {
    private static final MenuCallbacks NONE = new MenuCallbacks(null, null, null, null);

    public static MenuCallbacks none() {
        return NONE;
    }

    public MenuCallbacks withOnMenuOpen(Runnable callback) {
        return new MenuCallbacks(callback, onMenuClose, onOptionSelect, onOptionHover);
    }

    public MenuCallbacks withOnMenuClose(Runnable callback) {
        return new MenuCallbacks(onMenuOpen, callback, onOptionSelect, onOptionHover);
    }

    public MenuCallbacks withOnOptionSelect(Consumer<MenuOption> callback) {
        return new MenuCallbacks(onMenuOpen, onMenuClose, callback, onOptionHover);
    }

    public MenuCallbacks withOnOptionHover(Consumer<MenuOption> callback) {
        return new MenuCallbacks(onMenuOpen, onMenuClose, onOptionSelect, callback);
    }

    void menuOpened() {
        if (onMenuOpen != null) {
            onMenuOpen.run();
        }
    }

    void menuClosed() {
        if (onMenuClose != null) {
            onMenuClose.run();
        }
    }

    void optionSelected(MenuOption option) {
        if (onOptionSelect != null) {
            onOptionSelect.accept(option);
        }
    }

    void optionHovered(MenuOption option) {
        if (onOptionHover != null) {
            onOptionHover.accept(option);
        }
    }
}
