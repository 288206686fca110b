package com.questrail.menton.model;

import java.util.List;
import java.util.Objects;

/**
 * Loop whose condition is re-tested against the current register before
 * every iteration.
 */
public record WhileBlock(
        int lineNumber,
        Condition condition,
        List<Statement> body
) implements Statement
{
    public WhileBlock {
        Objects.requireNonNull(condition, "condition");
        body = List.copyOf(Objects.requireNonNull(body, "body"));
    }
}
