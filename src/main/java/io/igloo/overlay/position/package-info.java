/**
 * Overlay positioning against already-measured rectangles.
 *
 * <p>Measurement is done by the rendering layer, which calls {@code PositionResolver} again
 * whenever an overlay opens or the viewport is resized or scrolled. Nothing here holds state.
 */
package io.igloo.overlay.position;
