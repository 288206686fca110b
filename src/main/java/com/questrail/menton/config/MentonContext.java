package com.questrail.menton.config;

import com.questrail.menton.symbol.StandardSymbolTable;
import com.questrail.menton.symbol.SymbolTable;

import java.util.Objects;

/**
 * Immutable context handed to every run: the symbol table and configuration.
 *
 * <p>Building a context is the only "load once" step. Runs never mutate it,
 * so one context may back any number of sequential or concurrent runs.</p>
 */
public record MentonContext(
    SymbolTable symbolTable,
    MentonConfig config
) {
    public MentonContext {
        Objects.requireNonNull(symbolTable, "symbolTable");
        Objects.requireNonNull(config, "config");
    }

    /**
     * Returns a context with the standard symbol table and default configuration.
     */
    public static MentonContext standard() {
        return new MentonContext(StandardSymbolTable.get(), MentonConfig.defaults());
    }

    public MentonContext withConfig(MentonConfig config) {
        return new MentonContext(symbolTable, config);
    }

    public MentonContext withSymbolTable(SymbolTable symbolTable) {
        return new MentonContext(symbolTable, config);
    }
}
