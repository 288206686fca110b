package com.questrail.menton.exec;

/**
 * Append-only output of a single run.
 *
 * <p>Text is only ever appended in execution order; it is surfaced as one
 * string when the run completes and discarded when the run fails.</p>
 */
final class OutputBuffer
{
    private final StringBuilder text = new StringBuilder();

    void appendCharacter(int codePoint) {
        text.appendCodePoint(codePoint);
    }

    void appendNumber(long value) {
        text.append(value);
    }

    int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
