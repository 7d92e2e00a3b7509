package io.igloo.overlay.menu;

@FunctionalInterface
public interface MenuStateListener {
    void onMenuStateChanged(MenuSnapshot snapshot);

    /** Handle returned by {@link MenuController#subscribe(MenuStateListener)}. */
    @FunctionalInterface
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
