package io.igloo.overlay.menu;

import java.util.Objects;

/**
 * One entry of a navigable option list.
 *
 * @param id Stable identity used for focus lookups; two options with the same {@code value} stay
 *     distinct as long as their ids differ.
 * @param value Value handed to selection callbacks.
 * @param label Display text.
 * @param disabled Whether the option is skipped by keyboard navigation.
 */
public record MenuOption(String id, String value, String label, boolean disabled) {
    public MenuOption {
        id = Objects.requireNonNull(id, "id");
        value = Objects.requireNonNull(value, "value");
        label = Objects.requireNonNull(label, "label");
    }

    /** Enabled option whose id is its value. */
    public static MenuOption of(String value, String label) {
        return new MenuOption(value, value, label, false);
    }

    public static MenuOption disabled(String value, String label) {
        return new MenuOption(value, value, label, true);
    }

    public boolean sameIdAs(MenuOption other) {
        return other != null && id.equals(other.id);
    }
}
