/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api.exceptions;

import com.arbor.grammar.api.model.SymbolKind;

import java.util.Locale;

/**
 * Thrown in strict mode when a rule references a symbol that the grammar does not define.
 */
public class UnresolvedSymbolException extends CompilationException {

    private final String ruleName;
    private final String symbolName;
    private final SymbolKind symbolKind;

    public UnresolvedSymbolException(String ruleName, String symbolName, SymbolKind symbolKind) {
        super("Rule '" + ruleName + "' references undefined " + symbolKind.name().toLowerCase(Locale.ROOT)
                + " symbol '" + symbolName + "'");
        this.ruleName = ruleName;
        this.symbolName = symbolName;
        this.symbolKind = symbolKind;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getSymbolName() {
        return symbolName;
    }

    public SymbolKind getSymbolKind() {
        return symbolKind;
    }
}
