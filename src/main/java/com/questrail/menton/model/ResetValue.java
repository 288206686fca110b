package com.questrail.menton.model;

/**
 * Sets the current register to zero.
 */
public record ResetValue(int lineNumber) implements Statement {}
