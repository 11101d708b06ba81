/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api;

import com.arbor.grammar.api.model.ExtractedGrammars;
import com.arbor.grammar.api.model.PreparedGrammar;

import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for preparing a grammar: validating it and splitting it into a
 * syntactic grammar and a lexical grammar.
 */
public interface IGrammarCompiler {

    /**
     * Compiles a grammar from a JSON file.
     *
     * @param grammarPath path to JSON grammar file
     * @return the syntactic and lexical grammars
     * @throws IOException if the file cannot be read
     */
    ExtractedGrammars compile(Path grammarPath) throws IOException;

    /**
     * Compiles an already-built grammar.
     *
     * @param grammar the grammar to prepare
     * @return the syntactic and lexical grammars
     */
    ExtractedGrammars compile(PreparedGrammar grammar);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
