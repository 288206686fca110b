package com.questrail.menton.api;

/**
 * Classification of every failure a Menton run can report.
 *
 * <p>Each kind maps to exactly one {@link MentonException} subtype. Hosts that
 * render errors for a human can switch on the kind rather than on the
 * exception class.</p>
 */
public enum ErrorKind
{
    /** Source is not well-formed text. */
    INPUT_ENCODING,

    /** A marker or statement appeared where the grammar does not allow it. */
    MALFORMED_BLOCK,

    /** Input ended inside an open utterance. */
    UNTERMINATED_UTTERANCE,

    /** Input ended inside an open {@code if} or {@code while} block. */
    UNTERMINATED_BLOCK,

    /** A character line has no entry in the symbol table. */
    UNKNOWN_GLYPH_PATTERN,

    /** A statement operand is not a numeral, register or comparator. */
    INVALID_OPERAND,

    /** Register arithmetic left the signed 64-bit range. */
    ARITHMETIC_OVERFLOW,

    /** The run executed more statements than the configured limit. */
    STEP_LIMIT_EXCEEDED
}
