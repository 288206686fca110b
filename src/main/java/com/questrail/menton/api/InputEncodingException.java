package com.questrail.menton.api;

/**
 * The source is not well-formed text: malformed UTF-8 bytes or an unpaired
 * UTF-16 surrogate.
 */
public final class InputEncodingException extends MentonException
{
    public InputEncodingException(int lineNumber, String message) {
        super(ErrorKind.INPUT_ENCODING, lineNumber, message);
    }

    public InputEncodingException(String message, Throwable cause) {
        super(ErrorKind.INPUT_ENCODING, 0, message, cause);
    }
}
