package com.questrail.menton.model;

import java.util.Objects;

/**
 * Right-hand side of an arithmetic statement.
 */
public sealed interface Operand permits Operand.Literal, Operand.RegisterRef
{
    record Literal(long value) implements Operand {}

    record RegisterRef(Register register) implements Operand
    {
        public RegisterRef {
            Objects.requireNonNull(register, "register");
        }
    }
}
