package io.gridsync.core.model;

/** Viewport scroll offsets in pixels. */
public record ScrollPosition(int left, int top) {}
