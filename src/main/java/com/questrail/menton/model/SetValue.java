package com.questrail.menton.model;

/**
 * Sets the current register to {@code value}.
 */
public record SetValue(int lineNumber, long value) implements Statement {}
