package com.questrail.menton.api;

/**
 * Input ended while an {@code if} or {@code while} block was still open.
 */
public final class UnterminatedBlockException extends MentonException
{
    public UnterminatedBlockException(int openingLine, String blockKind) {
        super(ErrorKind.UNTERMINATED_BLOCK, openingLine,
                blockKind + " block opened here is never closed");
    }
}
