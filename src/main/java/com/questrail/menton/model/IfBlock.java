package com.questrail.menton.model;

import java.util.List;
import java.util.Objects;

/**
 * Conditional block. Exactly one branch runs; an absent else branch is empty.
 */
public record IfBlock(
        int lineNumber,
        Condition condition,
        List<Statement> thenBranch,
        List<Statement> elseBranch
) implements Statement
{
    public IfBlock {
        Objects.requireNonNull(condition, "condition");
        thenBranch = List.copyOf(Objects.requireNonNull(thenBranch, "thenBranch"));
        elseBranch = List.copyOf(Objects.requireNonNull(elseBranch, "elseBranch"));
    }
}
