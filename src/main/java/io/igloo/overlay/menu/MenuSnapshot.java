package io.igloo.overlay.menu;

import java.util.Objects;
import java.util.Optional;

/** Menu state as handed to renderers. */
public record MenuSnapshot(boolean open, Optional<MenuOption> focusedOption) {
    public MenuSnapshot {
        focusedOption = Objects.requireNonNull(focusedOption, "focusedOption");
    }
}
