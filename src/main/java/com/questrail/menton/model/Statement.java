package com.questrail.menton.model;

/**
 * Canonical parsed form of one executable unit of a Menton program.
 *
 * <p>Statements are produced only by the block parser and consumed only by
 * the executor. They carry no marker text, keyword text or comment; all of
 * that is resolved before a statement is created.</p>
 *
 * <p>Every statement remembers the 1-based source line it started on, so
 * execution failures can be reported against the source.</p>
 */
public sealed interface Statement
        permits Utterance, SelectRegister, SetValue, ResetValue,
                AddValue, SubtractValue, MultiplyValue, IfBlock, WhileBlock {

    /**
     * Returns the 1-based source line the statement starts on.
     */
    int lineNumber();
}
