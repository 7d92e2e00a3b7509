package io.igloo.overlay.position;

/** Visible client area the overlay has to fit in. */
public record Viewport(double width, double height) {}
