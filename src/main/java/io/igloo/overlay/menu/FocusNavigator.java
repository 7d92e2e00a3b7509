package io.igloo.overlay.menu;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keyboard focus over an ordered option list, skipping disabled options and wrapping at both ends.
 *
 * <p>The focused option is held by id and is always resolved against the current list. Navigation
 * never lands on a disabled option; {@link #setFocus(MenuOption)} is the one unchecked path and is
 * meant for pointer hover over options the renderer already shows as enabled.
 */
public final class FocusNavigator {
    private List<MenuOption> options;
    private List<MenuOption> enabledOptions;
    private MenuOption focused;

    public FocusNavigator(List<MenuOption> options) {
        replaceOptions(options);
    }

    public List<MenuOption> options() {
        return options;
    }

    /** Options eligible for keyboard focus, in list order. */
    public List<MenuOption> enabledOptions() {
        return enabledOptions;
    }

    public Optional<MenuOption> focusedOption() {
        return Optional.ofNullable(focused);
    }

    /**
     * Replaces the option list.
     *
     * <p>Focus follows the focused id into the new list and is cleared when that id is gone or now
     * disabled.
     *
     * @return whether the focused option changed
     */
    public boolean setOptions(List<MenuOption> newOptions) {
        MenuOption previous = focused;
        replaceOptions(newOptions);

        if (previous == null) {
            return false;
        }

        focused = findEnabled(previous.id()).orElse(null);
        return !Objects.equals(previous, focused);
    }

    /** Focuses {@code option} as given, without checking whether it is enabled. */
    public void setFocus(MenuOption option) {
        focused = option;
    }

    public void clearFocus() {
        focused = null;
    }

    /**
     * Moves focus among the enabled options. Does nothing when no option is enabled.
     *
     * <p>Moving down without a current focus lands on the first enabled option.
     *
     * @return whether the focused option changed
     */
    public boolean moveFocus(FocusDirection direction) {
        if (enabledOptions.isEmpty()) {
            return false;
        }

        int count = enabledOptions.size();
        int currentIndex = indexOfFocused();
        MenuOption next =
                switch (direction == null ? FocusDirection.FIRST : direction) {
                    case FIRST -> enabledOptions.get(0);
                    case LAST -> enabledOptions.get(count - 1);
                    case UP -> enabledOptions.get(currentIndex > 0 ? currentIndex - 1 : count - 1);
                    case DOWN -> enabledOptions.get((currentIndex + 1) % count);
                };

        boolean changed = !Objects.equals(focused, next);
        focused = next;
        return changed;
    }

    public boolean isDisabled(MenuOption option) {
        return option != null && option.disabled();
    }

    /** Index of the focused option among the enabled options, or -1. */
    int indexOfFocused() {
        if (focused == null) {
            return -1;
        }

        for (int i = 0; i < enabledOptions.size(); i++) {
            if (enabledOptions.get(i).sameIdAs(focused)) {
                return i;
            }
        }

        return -1;
    }

    private Optional<MenuOption> findEnabled(String id) {
        return enabledOptions.stream().filter(option -> option.id().equals(id)).findFirst();
    }

    private void replaceOptions(List<MenuOption> newOptions) {
        options = List.copyOf(Objects.requireNonNull(newOptions, "options"));

        List<MenuOption> enabled = new ArrayList<>(options.size());
        for (MenuOption option : options) {
            if (!isDisabled(option)) {
                enabled.add(option);
            }
        }
        enabledOptions = List.copyOf(enabled);
    }
}
