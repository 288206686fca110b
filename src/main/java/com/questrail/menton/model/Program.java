package com.questrail.menton.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Parsed program: top-level statements in source order.
 */
public record Program(List<Statement> statements)
{
    public Program {
        statements = List.copyOf(Objects.requireNonNull(statements, "statements"));
    }

    /**
     * Returns every utterance, including those nested in blocks, in source order.
     */
    public List<Utterance> utterances() {
        List<Utterance> out = new ArrayList<>();

        // Walked with an explicit stack; nesting depth is unbounded.
        Deque<Iterator<Statement>> pending = new ArrayDeque<>();
        pending.push(statements.iterator());
        while (!pending.isEmpty()) {
            Iterator<Statement> it = pending.peek();
            if (!it.hasNext()) {
                pending.pop();
                continue;
            }
            Statement statement = it.next();
            if (statement instanceof Utterance u) {
                out.add(u);
            }
            else if (statement instanceof IfBlock block) {
                pending.push(block.elseBranch().iterator());
                pending.push(block.thenBranch().iterator());
            }
            else if (statement instanceof WhileBlock block) {
                pending.push(block.body().iterator());
            }
        }
        return Collections.unmodifiableList(out);
    }
}
