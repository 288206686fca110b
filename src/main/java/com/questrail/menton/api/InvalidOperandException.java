package com.questrail.menton.api;

import java.util.Objects;

/**
 * A statement operand could not be read as a numeral, register or comparator.
 */
public final class InvalidOperandException extends MentonException
{
    private final String operand;

    public InvalidOperandException(int lineNumber, String operand, String message) {
        super(ErrorKind.INVALID_OPERAND, lineNumber, message + ": '" + operand + "'");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public String operand() {
        return operand;
    }
}
