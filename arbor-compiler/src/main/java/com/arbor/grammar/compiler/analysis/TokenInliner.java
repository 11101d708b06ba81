/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.analysis;

import com.arbor.grammar.api.model.Rule;
import com.arbor.grammar.api.model.Rules;

import java.util.Map;

/**
 * Substitutes auxiliary symbols back by the token definitions they name.
 * This is the inverse of token extraction.
 */
public final class TokenInliner {

    private TokenInliner() {
    }

    /**
     * Replaces each AUXILIARY symbol whose name is a key of {@code tokens} by its
     * definition. Substituted definitions are not themselves inlined again.
     * Other symbols are left untouched.
     */
    public static Rule inline(Rule rule, Map<String, Rule> tokens) {
        return Rules.rebuild(rule, leaf -> {
            if (leaf instanceof Rule.Symbol && ((Rule.Symbol) leaf).isAuxiliary()) {
                Rule definition = tokens.get(((Rule.Symbol) leaf).name());
                if (definition != null) {
                    return definition;
                }
            }
            return leaf;
        });
    }
}
