/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 * Allows tooling and monitoring systems to track compilation progress.
 *
 * <p>The compilation pipeline consists of up to 4 stages:
 * <ol>
 *   <li>LOADING - Read and parse the JSON grammar (only when compiling from a file)</li>
 *   <li>VALIDATION - Check rule names, tree shape and symbol references</li>
 *   <li>TOKEN_EXTRACTION - Split the grammar into syntactic and lexical grammars</li>
 *   <li>VERIFICATION - Check the coverage and round-trip laws (only when enabled)</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * CompilationListener listener = new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d ms%n", stageName, result.durationMillis());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 *
 * IGrammarCompiler compiler = new GrammarCompiler(tracer);
 * compiler.setCompilationListener(listener);
 * ExtractedGrammars result = compiler.compile(grammarPath);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "LOADING", "VALIDATION")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages in this run
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage fails. The exception is re-thrown to the caller afterwards.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "ruleCount", "extractedTokenCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        /**
         * Returns the duration in milliseconds.
         */
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }

        /**
         * Returns the duration in microseconds.
         */
        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
