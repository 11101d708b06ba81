/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.prepare;

import com.arbor.grammar.api.model.Rule;

/**
 * Decides whether a rule, taken as a whole, is purely lexical.
 *
 * <p>Classification is shallow: only a rule whose top-level node is a STRING or
 * a PATTERN is a token. A choice between two patterns is not; the
 * {@link TokenExtractor} hoists its leaves one by one instead.
 */
public final class TokenClassifier {

    private TokenClassifier() {
    }

    public static boolean isToken(Rule rule) {
        return switch (rule.kind()) {
            case STRING, PATTERN -> true;
            case BLANK, SYMBOL, SEQ, CHOICE, REPEAT -> false;
        };
    }
}
