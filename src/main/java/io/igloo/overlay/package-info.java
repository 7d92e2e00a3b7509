/**
 * Overlay components built on the interaction engines.
 *
 * <p>{@code ActionMenu} and {@code Tooltip} compose the stateless {@code position} package with
 * the stateful {@code menu} package. Settings come from {@code config.OverlayConfig}.
 */
package io.igloo.overlay;
