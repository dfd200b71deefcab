package io.imagexform.core.geometry;

/** Top-left position of an element inside a box, in pixels. */
public record Offset(int x, int y) {}
