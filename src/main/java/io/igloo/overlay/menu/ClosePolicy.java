package io.igloo.overlay.menu;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/** Decides whether selecting an option also closes the menu. */
public sealed interface ClosePolicy
        permits ClosePolicy.Always, ClosePolicy.Never, ClosePolicy.Matching {

    boolean shouldClose(MenuOption option);

    static ClosePolicy always() {
        return Always.INSTANCE;
    }

    static ClosePolicy never() {
        return Never.INSTANCE;
    }

    static ClosePolicy matching(Predicate<MenuOption> predicate) {
        return new Matching(predicate);
    }

    /** Maps {@code ALWAYS} or {@code NEVER}; anything else is {@code ALWAYS}. */
    static ClosePolicy fromName(String name) {
        if (name != null && "NEVER".equals(name.trim().toUpperCase(Locale.ROOT))) {
            return never();
        }
        return always();
    }

    record Always() implements ClosePolicy {
        private static final Always INSTANCE = new Always();

        @Override
        public boolean shouldClose(MenuOption option) {
            return true;
        }
    }

    record Never() implements ClosePolicy {
        private static final Never INSTANCE = new Never();

        @Override
        public boolean shouldClose(MenuOption option) {
            return false;
        }
    }

    record Matching(Predicate<MenuOption> predicate) implements ClosePolicy {
        public Matching {
            predicate = Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public boolean shouldClose(MenuOption option) {
            return predicate.test(option);
        }
    }
}
