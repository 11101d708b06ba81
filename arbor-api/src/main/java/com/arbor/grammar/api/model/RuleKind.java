/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api.model;

import java.util.Locale;

/**
 * The closed set of rule variants. Every {@link Rule} reports exactly one kind,
 * and switch expressions over this enum are checked for exhaustiveness.
 */
public enum RuleKind {
    BLANK,
    STRING,
    PATTERN,
    SYMBOL,
    SEQ,
    CHOICE,
    REPEAT;

    /**
     * Safely converts a string to a RuleKind.
     * @param text The kind name (e.g., "SEQ"), case-insensitive.
     * @return The corresponding RuleKind, or null if not found.
     */
    public static RuleKind fromString(String text) {
        if (text == null) return null;
        try {
            return RuleKind.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null; // Unknown kind
        }
    }

    /**
     * @return true for the kinds that carry child rules
     */
    public boolean isComposite() {
        return this == SEQ || this == CHOICE || this == REPEAT;
    }
}
