/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler;

import com.arbor.grammar.api.CompilationListener;
import com.arbor.grammar.api.IGrammarCompiler;
import com.arbor.grammar.api.exceptions.CompilationException;
import com.arbor.grammar.api.model.ExtractedGrammars;
import com.arbor.grammar.api.model.PreparedGrammar;
import com.arbor.grammar.api.model.Rule;
import com.arbor.grammar.api.model.Rules;
import com.arbor.grammar.compiler.analysis.ExtractionVerifier;
import com.arbor.grammar.compiler.config.CompilerConfig;
import com.arbor.grammar.compiler.loader.GrammarLoader;
import com.arbor.grammar.compiler.prepare.GrammarSplitter;
import com.arbor.grammar.compiler.prepare.TokenClassifier;
import com.arbor.grammar.compiler.prepare.TokenExtractor;
import com.arbor.grammar.compiler.validation.GrammarValidator;
import com.arbor.grammar.compiler.validation.ValidationResult;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Prepares grammars for the table- and lexer-building stages.
 *
 * <p>The pipeline runs these stages in order:
 * <ol>
 *   <li>LOADING - parse the JSON grammar file (file input only).</li>
 *   <li>VALIDATION - reject malformed rules, report unresolved symbols.</li>
 *   <li>TOKEN_EXTRACTION - split into a syntactic and a lexical grammar,
 *       hoisting every literal and pattern into a deduplicated token.</li>
 *   <li>VERIFICATION - check that the split preserved the grammar (only when
 *       {@link CompilerConfig#isVerifyOutput()} is set).</li>
 * </ol>
 *
 * <p>Each stage runs in its own span under a {@code compile-grammar} span and is
 * reported to the {@link CompilationListener}, if one is set. Failures are
 * recorded on the span, reported through {@link CompilationListener#onError},
 * and re-thrown.
 */
public class GrammarCompiler implements IGrammarCompiler {
    private static final Logger logger = Logger.getLogger(GrammarCompiler.class.getName());

    public static final String STAGE_LOADING = "LOADING";
    public static final String STAGE_VALIDATION = "VALIDATION";
    public static final String STAGE_TOKEN_EXTRACTION = "TOKEN_EXTRACTION";
    public static final String STAGE_VERIFICATION = "VERIFICATION";

    private final CompilerConfig config;
    private final GrammarLoader loader = new GrammarLoader();
    private final GrammarValidator validator;
    private final GrammarSplitter splitter;
    private final ExtractionVerifier verifier = new ExtractionVerifier();

    private volatile Tracer tracer;
    private volatile CompilationListener listener;

    public GrammarCompiler(Tracer tracer) {
        this(tracer, CompilerConfig.defaults());
    }

    public GrammarCompiler(Tracer tracer, CompilerConfig config) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.config = Objects.requireNonNull(config, "config");
        this.validator = new GrammarValidator(config.getMaxRuleDepth(), config.isStrictSymbols());
        this.splitter = new GrammarSplitter(new TokenExtractor(config.getMaxRuleDepth()));
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    public CompilerConfig getConfig() {
        return config;
    }

    /**
     * Loads a JSON grammar file and prepares it.
     *
     * @throws IOException If the grammar file cannot be read.
     * @throws CompilationException If the grammar is invalid.
     */
    @Override
    public ExtractedGrammars compile(Path grammarPath) throws IOException, CompilationException {
        Objects.requireNonNull(grammarPath, "grammarPath");
        Span span = tracer.spanBuilder("compile-grammar").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("grammarFilePath", grammarPath.toString());
            int totalStages = config.isVerifyOutput() ? 4 : 3;

            PreparedGrammar grammar = runStage(STAGE_LOADING, 1, totalStages, metrics -> {
                PreparedGrammar loaded = loader.load(grammarPath);
                metrics.put("ruleCount", loaded.rules().size());
                metrics.put("auxRuleCount", loaded.auxRules().size());
                return loaded;
            });

            return compileStages(grammar, 2, totalStages, span);
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Prepares an already-built grammar.
     *
     * @throws CompilationException If the grammar is invalid.
     */
    @Override
    public ExtractedGrammars compile(PreparedGrammar grammar) throws CompilationException {
        Objects.requireNonNull(grammar, "grammar");
        Span span = tracer.spanBuilder("compile-grammar").startSpan();
        try (Scope scope = span.makeCurrent()) {
            int totalStages = config.isVerifyOutput() ? 3 : 2;
            return compileStages(grammar, 1, totalStages, span);
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private ExtractedGrammars compileStages(PreparedGrammar grammar, int firstStage, int totalStages, Span span) {
        long startTime = System.nanoTime();
        span.setAttribute("ruleCount", grammar.rules().size());
        span.setAttribute("auxRuleCount", grammar.auxRules().size());

        int stage = firstStage;
        runStage(STAGE_VALIDATION, stage++, totalStages, metrics -> {
            ValidationResult validation = validator.validate(grammar);
            metrics.put("warningCount", validation.warnings().size());
            return validation;
        });

        ExtractedGrammars result = runStage(STAGE_TOKEN_EXTRACTION, stage++, totalStages, metrics -> {
            ExtractedGrammars split = splitter.split(grammar);
            recordExtractionMetrics(grammar, split, metrics);
            return split;
        });

        if (config.isVerifyOutput()) {
            runStage(STAGE_VERIFICATION, stage, totalStages, metrics -> {
                verifier.verify(grammar, result);
                metrics.put("verifiedRuleCount", grammar.size());
                return result;
            });
        }

        long compilationTime = System.nanoTime() - startTime;
        span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));
        span.setAttribute("tokenCount", result.tokenCount());

        logger.info(String.format("Compiled grammar '%s' in %d ms: %d syntactic rules, %d tokens",
                grammar.startRuleName(),
                TimeUnit.NANOSECONDS.toMillis(compilationTime),
                result.syntacticGrammar().size(),
                result.tokenCount()));
        return result;
    }

    private void recordExtractionMetrics(PreparedGrammar grammar, ExtractedGrammars split, Map<String, Object> metrics) {
        int shallowAuxTokens = 0;
        for (Rule rule : grammar.auxRules().values()) {
            if (TokenClassifier.isToken(rule)) shallowAuxTokens++;
        }
        int lexicalLeaves = 0;
        for (Rule rule : grammar.rules().values()) {
            if (!TokenClassifier.isToken(rule)) lexicalLeaves += Rules.lexicalLeaves(rule).size();
        }
        for (Rule rule : grammar.auxRules().values()) {
            if (!TokenClassifier.isToken(rule)) lexicalLeaves += Rules.lexicalLeaves(rule).size();
        }

        PreparedGrammar lexical = split.lexicalGrammar();
        int extractedTokens = lexical.auxRules().size() - shallowAuxTokens;

        metrics.put("syntacticRuleCount", split.syntacticGrammar().size());
        metrics.put("shallowTokenCount", lexical.rules().size() + shallowAuxTokens);
        metrics.put("extractedTokenCount", extractedTokens);
        metrics.put("lexicalLeafCount", lexicalLeaves);
        metrics.put("deduplicatedLeafCount", lexicalLeaves - extractedTokens);
        metrics.put("tokenCount", split.tokenCount());
    }

    /**
     * Body of a single pipeline stage. Stage metrics are written into the supplied map.
     */
    @FunctionalInterface
    private interface StageBody<T, E extends Exception> {
        T run(Map<String, Object> metrics) throws E;
    }

    private <T, E extends Exception> T runStage(String stageName, int stageNumber, int totalStages,
                                                StageBody<T, E> body) throws E {
        CompilationListener currentListener = listener;
        if (currentListener != null) {
            currentListener.onStageStart(stageName, stageNumber, totalStages);
        }

        Span span = tracer.spanBuilder(stageName.toLowerCase(Locale.ROOT).replace('_', '-')).startSpan();
        long stageStart = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            Map<String, Object> metrics = new LinkedHashMap<>();
            T result = body.run(metrics);
            CompilationListener.StageResult stageResult = new CompilationListener.StageResult(
                    stageName, System.nanoTime() - stageStart, Collections.unmodifiableMap(metrics));

            logger.fine(() -> String.format("Stage %s (%d/%d) completed in %d us: %s",
                    stageName, stageNumber, totalStages, stageResult.durationMicros(), stageResult.metrics()));
            if (currentListener != null) {
                currentListener.onStageComplete(stageName, stageResult);
            }
            return result;
        } catch (Exception e) {
            span.recordException(e);
            if (currentListener != null) {
                currentListener.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }
}
