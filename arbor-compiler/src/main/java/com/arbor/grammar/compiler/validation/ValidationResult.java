/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.validation;

import java.util.List;

/**
 * Outcome of a successful validation. Errors are thrown, so only warnings remain.
 *
 * @param warnings human-readable findings that did not stop compilation
 */
public record ValidationResult(List<String> warnings) {

    public ValidationResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
