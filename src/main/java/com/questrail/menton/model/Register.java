package com.questrail.menton.model;

import java.util.Objects;

/**
 * One of the interpreter's fixed registers.
 *
 * @param index dense 0-based index into a register file
 * @param token exact source spelling that selects the register
 */
public record Register(int index, String token)
{
    public Register {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0 (was " + index + ")");
        }
        Objects.requireNonNull(token, "token");
    }
}
