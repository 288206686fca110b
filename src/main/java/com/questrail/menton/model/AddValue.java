package com.questrail.menton.model;

/**
 * Adds {@code amount} to the current register.
 */
public record AddValue(int lineNumber, long amount) implements Statement {}
