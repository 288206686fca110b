package com.questrail.menton.model;

import java.util.Objects;

/**
 * Test applied to the current register by {@code if} and {@code while}.
 */
public record Condition(long operand, Comparison comparison)
{
    public Condition {
        Objects.requireNonNull(comparison, "comparison");
    }

    public boolean test(long current) {
        return comparison.test(current, operand);
    }
}
