package io.igloo.overlay.menu;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Open/closed state of one menu plus keyboard focus over its options.
 *
 * <p>{@link #toggle(boolean)} is level-triggered: the open or close callback fires on every call,
 * whether or not the state changes. Callbacks and listeners run synchronously on the calling
 * thread. A callback that calls back into the controller re-enters it immediately; there is no
 * guard, so such callers must bound the recursion themselves.
 *
 * <p>Instances are confined to the UI thread and are not safe for concurrent use.
 */
public final class MenuController {
    private static final Logger LOGGER = LoggerFactory.getLogger(MenuController.class);

    private final FocusNavigator navigator;
    private final ClosePolicy closePolicy;
    private final MenuCallbacks callbacks;
    private final List<MenuStateListener> listeners = new ArrayList<>();

    private boolean open;

    public MenuController(
            List<MenuOption> options,
            boolean initiallyOpen,
            ClosePolicy closePolicy,
            MenuCallbacks callbacks) {
        this.navigator = new FocusNavigator(options);
        this.open = initiallyOpen;
        this.closePolicy = Objects.requireNonNull(closePolicy, "closePolicy");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
    }

    /** Closed menu that closes on every selection. */
    public MenuController(List<MenuOption> options, MenuCallbacks callbacks) {
        this(options, false, ClosePolicy.always(), callbacks);
    }

    public boolean isOpen() {
        return open;
    }

    public Optional<MenuOption> focusedOption() {
        return navigator.focusedOption();
    }

    public List<MenuOption> options() {
        return navigator.options();
    }

    public ClosePolicy closePolicy() {
        return closePolicy;
    }

    public MenuSnapshot snapshot() {
        return new MenuSnapshot(open, navigator.focusedOption());
    }

    public MenuStateListener.Subscription subscribe(MenuStateListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Sets the open state and fires the matching callback, even when nothing changed. */
    public void toggle(boolean requestedOpen) {
        LOGGER.debug("Menu toggled {} (was {})", requestedOpen ? "open" : "closed", open);
        open = requestedOpen;
        notifyListeners();

        if (!requestedOpen) {
            callbacks.menuClosed();
        } else {
            callbacks.menuOpened();
        }
    }

    /** Trigger click: flips the current state. */
    public void click() {
        toggle(!open);
    }

    /** Outside click or other dismissal reported by the overlay. */
    public void dismiss() {
        toggle(false);
    }

    public void selectOption(MenuOption option) {
        callbacks.optionSelected(option);

        if (closePolicy.shouldClose(option)) {
            toggle(false);
        }
    }

    /** Pointer hover; focuses the option without an enabled check. */
    public void hoverOption(MenuOption option) {
        navigator.setFocus(option);
        notifyListeners();
        callbacks.optionHovered(option);
    }

    public void moveFocus(FocusDirection direction) {
        if (navigator.moveFocus(direction)) {
            notifyListeners();
        }
    }

    public void setOptions(List<MenuOption> options) {
        navigator.setOptions(options);
        notifyListeners();
    }

    public boolean isOptionDisabled(MenuOption option) {
        return navigator.isDisabled(option);
    }

    /**
     * Dispatches a key by its DOM-style name. Unknown keys are ignored.
     *
     * @return whether the event was consumed and default handling should be suppressed
     */
    public boolean handleKey(String keyName) {
        Optional<MenuKey> key = MenuKey.fromKeyName(keyName);
        if (key.isEmpty()) {
            LOGGER.debug("Ignored key {}", keyName);
            return false;
        }
        return handleKey(key.get());
    }

    /**
     * Dispatches a key press against the state the menu had when the key arrived.
     *
     * <p>Escape and Tab call {@code toggle} with the current open state, so on an open menu they
     * re-fire the open callback and leave the menu open.
     *
     * @return whether the event was consumed and default handling should be suppressed
     */
    public boolean handleKey(MenuKey key) {
        boolean wasOpen = open;

        switch (key) {
            case ESCAPE, TAB -> {
                if (wasOpen) {
                    toggle(wasOpen);
                }
                return false;
            }
            case ENTER -> {
                MenuOption focusedOption = navigator.focusedOption().orElse(null);
                if (focusedOption != null) {
                    selectOption(focusedOption);
                }
                if ((focusedOption == null && wasOpen) || !wasOpen) {
                    toggle(!wasOpen);
                }
                return true;
            }
            case SPACE -> {
                if (!wasOpen) {
                    toggle(true);
                }
                return false;
            }
            case ARROW_UP -> {
                moveFocus(FocusDirection.UP);
                return true;
            }
            case ARROW_DOWN -> {
                moveFocus(FocusDirection.DOWN);
                return true;
            }
            case HOME -> {
                moveFocus(FocusDirection.FIRST);
                return true;
            }
            case END -> {
                moveFocus(FocusDirection.LAST);
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    private void notifyListeners() {
        if (listeners.isEmpty()) {
            return;
        }

        MenuSnapshot snapshot = snapshot();
        for (MenuStateListener listener : List.copyOf(listeners)) {
            listener.onMenuStateChanged(snapshot);
        }
    }
}
