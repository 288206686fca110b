package com.questrail.menton.model;

/**
 * Subtracts {@code amount} from the current register.
 */
public record SubtractValue(int lineNumber, long amount) implements Statement {}
