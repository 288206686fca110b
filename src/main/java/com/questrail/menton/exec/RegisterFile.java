package com.questrail.menton.exec;

import com.questrail.menton.model.Register;
import com.questrail.menton.model.Registers;

import java.util.Objects;

/**
 * Register values for a single run.
 *
 * <p>All registers start at zero with {@link Registers#initial()} selected.
 * A register file is never shared between runs.</p>
 */
final class RegisterFile
{
    private final long[] values = new long[Registers.count()];
    private Register current = Registers.initial();

    void select(Register register) {
        this.current = Objects.requireNonNull(register, "register");
    }

    long currentValue() {
        return values[current.index()];
    }

    void setCurrentValue(long value) {
        values[current.index()] = value;
    }

    long valueOf(Register register) {
        return values[register.index()];
    }
}
