/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.config;

import com.arbor.grammar.compiler.prepare.TokenExtractor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the grammar compiler.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables using the pattern
 * {@code GRAMMAR_<PROPERTY_NAME>}:
 * <pre>
 * GRAMMAR_VERIFY_OUTPUT=true
 * GRAMMAR_STRICT_SYMBOLS=true
 * GRAMMAR_MAX_RULE_DEPTH=5000
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Defaults only
 * CompilerConfig config = CompilerConfig.defaults();
 *
 * // Properties file, then environment
 * CompilerConfig config = CompilerConfig.loadFromProperties("grammar-compiler.properties");
 *
 * // Explicit values
 * CompilerConfig config = CompilerConfig.builder()
 *     .verifyOutput(true)
 *     .strictSymbols(true)
 *     .build();
 * }</pre>
 */
public final class CompilerConfig {

    private static final Logger logger = Logger.getLogger(CompilerConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE AND PROPERTY KEYS
    // ========================================================================

    static final String ENV_VERIFY_OUTPUT = "GRAMMAR_VERIFY_OUTPUT";
    static final String ENV_STRICT_SYMBOLS = "GRAMMAR_STRICT_SYMBOLS";
    static final String ENV_MAX_RULE_DEPTH = "GRAMMAR_MAX_RULE_DEPTH";

    static final String PROP_VERIFY_OUTPUT = "grammar.verify.output";
    static final String PROP_STRICT_SYMBOLS = "grammar.strict.symbols";
    static final String PROP_MAX_RULE_DEPTH = "grammar.max.rule.depth";

    private final boolean verifyOutput;
    private final boolean strictSymbols;
    private final int maxRuleDepth;

    private CompilerConfig(Builder builder) {
        this.verifyOutput = builder.verifyOutput;
        this.strictSymbols = builder.strictSymbols;
        this.maxRuleDepth = builder.maxRuleDepth;

        validate();
    }

    private void validate() {
        if (maxRuleDepth < 1) {
            throw new IllegalArgumentException("maxRuleDepth must be positive, got: " + maxRuleDepth);
        }
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Built-in defaults, ignoring the environment.
     */
    public static CompilerConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by {@code GRAMMAR_*} environment variables.
     */
    public static CompilerConfig fromEnvironment() {
        return builder().applyEnvironment(System.getenv()).build();
    }

    /**
     * Load configuration from a properties file.
     *
     * <p>Searches for the file in:
     * <ol>
     *   <li>Classpath root</li>
     *   <li>File system (absolute or relative path)</li>
     * </ol>
     *
     * <p>Environment variables override properties file values.
     *
     * <p><b>Example grammar-compiler.properties:</b>
     * <pre>
     * grammar.verify.output=true
     * grammar.strict.symbols=false
     * grammar.max.rule.depth=2000
     * </pre>
     *
     * @param propertiesPath Path to properties file
     * @return Configuration loaded from properties file
     */
    public static CompilerConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading compiler configuration from: " + propertiesPath);

        Properties props = new Properties();

        // Try classpath first
        try (InputStream is = CompilerConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        // Try file system if not found in classpath
        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        return fromProperties(props, System.getenv());
    }

    /**
     * Properties first, then environment variables on top.
     */
    static CompilerConfig fromProperties(Properties props, Map<String, String> environment) {
        Builder builder = builder();

        String verify = props.getProperty(PROP_VERIFY_OUTPUT);
        if (verify != null) {
            builder.verifyOutput = Boolean.parseBoolean(verify.trim());
        }

        String strict = props.getProperty(PROP_STRICT_SYMBOLS);
        if (strict != null) {
            builder.strictSymbols = Boolean.parseBoolean(strict.trim());
        }

        String depth = props.getProperty(PROP_MAX_RULE_DEPTH);
        if (depth != null) {
            builder.maxRuleDepth = parseInt(PROP_MAX_RULE_DEPTH, depth);
        }

        return builder.applyEnvironment(environment).build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    /**
     * @return whether the compiler checks the coverage and round-trip laws after splitting
     */
    public boolean isVerifyOutput() {
        return verifyOutput;
    }

    /**
     * @return whether unresolved symbol references are errors rather than warnings
     */
    public boolean isStrictSymbols() {
        return strictSymbols;
    }

    public int getMaxRuleDepth() {
        return maxRuleDepth;
    }

    @Override
    public String toString() {
        return "CompilerConfig{" +
                "verifyOutput=" + verifyOutput +
                ", strictSymbols=" + strictSymbols +
                ", maxRuleDepth=" + maxRuleDepth +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .verifyOutput(verifyOutput)
                .strictSymbols(strictSymbols)
                .maxRuleDepth(maxRuleDepth);
    }

    public static class Builder {

        private boolean verifyOutput = false;
        private boolean strictSymbols = false;
        private int maxRuleDepth = TokenExtractor.DEFAULT_MAX_DEPTH;

        private Builder() {
        }

        /**
         * Apply environment variable overrides. Unset variables leave values unchanged.
         */
        Builder applyEnvironment(Map<String, String> environment) {
            getEnv(environment, ENV_VERIFY_OUTPUT).ifPresent(val -> this.verifyOutput = Boolean.parseBoolean(val));
            getEnv(environment, ENV_STRICT_SYMBOLS).ifPresent(val -> this.strictSymbols = Boolean.parseBoolean(val));
            getEnv(environment, ENV_MAX_RULE_DEPTH).ifPresent(val -> this.maxRuleDepth = parseInt(ENV_MAX_RULE_DEPTH, val));
            return this;
        }

        private static Optional<String> getEnv(Map<String, String> environment, String key) {
            String value = environment.get(key);
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(value.trim());
        }

        public Builder verifyOutput(boolean enable) {
            this.verifyOutput = enable;
            return this;
        }

        public Builder strictSymbols(boolean enable) {
            this.strictSymbols = enable;
            return this;
        }

        public Builder maxRuleDepth(int depth) {
            this.maxRuleDepth = depth;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }
    }
}
