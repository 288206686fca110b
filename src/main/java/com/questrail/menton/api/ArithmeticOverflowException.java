package com.questrail.menton.api;

/**
 * Register arithmetic overflowed the signed 64-bit range.
 */
public final class ArithmeticOverflowException extends MentonException
{
    public ArithmeticOverflowException(int lineNumber, ArithmeticException cause) {
        super(ErrorKind.ARITHMETIC_OVERFLOW, lineNumber, "register value overflow", cause);
    }
}
