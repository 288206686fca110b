package com.questrail.menton.model;

/**
 * How the lines of an utterance turn into output. Chosen by the end marker.
 */
public enum OutputMode
{
    /** Each line resolves through the symbol table to one character. */
    CHARACTER,

    /** Each line is a register or numeral printed in decimal. */
    NUMERIC
}
