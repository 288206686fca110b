package com.questrail.menton.model;

import java.util.Objects;

/**
 * Makes {@code register} the current register.
 */
public record SelectRegister(int lineNumber, Register register) implements Statement
{
    public SelectRegister {
        Objects.requireNonNull(register, "register");
    }
}
