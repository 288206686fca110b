package com.questrail.menton.model;

import java.util.Objects;

/**
 * Multiplies the current register by a literal or by another register's value.
 */
public record MultiplyValue(int lineNumber, Operand factor) implements Statement
{
    public MultiplyValue {
        Objects.requireNonNull(factor, "factor");
    }
}
