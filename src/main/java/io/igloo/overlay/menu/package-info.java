/**
 * Menu open state and keyboard navigation.
 *
 * <p>{@code MenuController} owns the state of a single menu and embeds a {@code FocusNavigator}
 * for its options. Renderers read {@code MenuSnapshot}s through {@code MenuStateListener} and
 * forward key names and pointer events back to the controller.
 */
package io.igloo.overlay.menu;
