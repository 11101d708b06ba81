/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api.model;

import java.util.Objects;

/**
 * Result of token extraction: the structural grammar and the pool of token definitions.
 *
 * @param syntacticGrammar structural rules, keeping the input start rule; literal and
 *                         pattern leaves are replaced by auxiliary symbol references
 * @param lexicalGrammar   token definitions; it has no start rule
 */
public record ExtractedGrammars(PreparedGrammar syntacticGrammar, PreparedGrammar lexicalGrammar) {

    public ExtractedGrammars {
        Objects.requireNonNull(syntacticGrammar, "syntacticGrammar");
        Objects.requireNonNull(lexicalGrammar, "lexicalGrammar");
    }

    /**
     * @return the number of token definitions, named and auxiliary
     */
    public int tokenCount() {
        return lexicalGrammar.size();
    }
}
