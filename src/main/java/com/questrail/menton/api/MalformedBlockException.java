package com.questrail.menton.api;

/**
 * A marker or statement line appeared in a parser state that does not accept
 * it, for example an end marker with no open utterance or a start marker
 * inside one.
 */
public final class MalformedBlockException extends MentonException
{
    public MalformedBlockException(int lineNumber, String message) {
        super(ErrorKind.MALFORMED_BLOCK, lineNumber, message);
    }
}
