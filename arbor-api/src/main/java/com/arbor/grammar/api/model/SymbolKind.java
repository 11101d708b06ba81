/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api.model;

import java.util.Locale;

/**
 * Namespace a {@link Rule.Symbol} resolves in.
 */
public enum SymbolKind {
    /** A grammar-author-visible rule. */
    NORMAL,
    /** A rule synthesized by a compiler pass. */
    AUXILIARY,
    /** A token produced outside the generated lexer. */
    EXTERNAL;

    public static SymbolKind fromString(String text) {
        if (text == null) return null;
        try {
            return SymbolKind.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
