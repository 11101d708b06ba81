/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api.exceptions;

/**
 * Exception thrown when grammar compilation fails.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the compiler stages, while still providing clear error messages
 * for compilation failures.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }

    public CompilationException(Throwable cause) {
        super(cause);
    }
}
