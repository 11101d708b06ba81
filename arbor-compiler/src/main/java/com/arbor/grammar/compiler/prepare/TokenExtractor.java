/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.prepare;

import com.arbor.grammar.api.exceptions.MalformedRuleException;
import com.arbor.grammar.api.model.Rule;
import com.arbor.grammar.api.model.Rules;

import java.util.List;
import java.util.Objects;

/**
 * Rewrites a rule tree so that every STRING and PATTERN leaf is replaced by an
 * auxiliary symbol naming a token in a shared {@link TokenPool}.
 *
 * <p>The rewrite keeps the shape of the tree: sequences stay sequences, choices
 * stay choices (rebuilt through {@link Rule#choice(List)}), repeats stay repeats.
 * BLANK and SYMBOL leaves are returned unchanged. Symbols are never followed;
 * each named rule is rewritten when the splitter reaches it.
 *
 * <p>Example, with an empty pool:
 * <pre>
 * SEQ(SYMBOL(expr), SEQ(STRING("+"), SYMBOL(expr)))
 *   becomes
 * SEQ(SYMBOL(expr), SEQ(SYMBOL(token1, AUXILIARY), SYMBOL(expr)))
 * </pre>
 * and the pool then holds {@code token1 -> STRING("+")}.
 *
 * <p>The walk is iterative, so the depth limit is the only bound on nesting.
 * Instances are stateless apart from that limit and can be shared.
 */
public final class TokenExtractor {

    public static final int DEFAULT_MAX_DEPTH = 2_000;

    private final int maxDepth;

    public TokenExtractor() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth deepest nesting accepted before failing with {@link MalformedRuleException}
     */
    public TokenExtractor(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Max depth must be positive, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Rewrites {@code rule}, adding any newly seen tokens to {@code pool}.
     *
     * @throws MalformedRuleException if a choice has no alternatives or the tree is too deep;
     *                                the exception does not name the owning rule
     */
    public Rule extract(Rule rule, TokenPool pool) {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(pool, "pool");
        return Rules.rebuild(rule, maxDepth, leaf -> hoist(leaf, pool));
    }

    private Rule hoist(Rule leaf, TokenPool pool) {
        if (!TokenClassifier.isToken(leaf)) {
            return leaf;
        }
        return Rule.auxiliary(pool.addToken(leaf));
    }
}
