package com.questrail.menton.api;

/**
 * Input ended while an utterance was still open.
 *
 * <p>The reported line is the one holding the utterance's start marker.</p>
 */
public final class UnterminatedUtteranceException extends MentonException
{
    public UnterminatedUtteranceException(int startLine) {
        super(ErrorKind.UNTERMINATED_UTTERANCE, startLine,
                "utterance opened here is never closed");
    }
}
