/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.prepare;

import com.arbor.grammar.api.model.Rule;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Insertion-ordered set of extracted tokens, keyed by synthesized name.
 *
 * <p>Names are {@code token1}, {@code token2}, ... in insertion order. Downstream
 * stages refer to auxiliary tokens by these names, so the scheme is fixed.
 * A name the grammar already uses for an auxiliary rule is reserved and
 * skipped, so the next token takes the following free number.
 *
 * <p>Deduplication is by structural equality. The reverse index is a hash map
 * keyed by the rule itself, and a lookup only hits when {@code equals} confirms
 * the match, so rules with colliding hashes are never merged.
 *
 * <p>Not thread-safe. A pool belongs to a single grammar split.
 */
public final class TokenPool {

    static final String TOKEN_NAME_PREFIX = "token";

    private final Map<String, Rule> tokens = new LinkedHashMap<>();
    private final Map<Rule, String> namesByRule = new HashMap<>();
    private final Set<String> reservedNames;
    private int nextIndex = 1;
    private int requestCount;

    public TokenPool() {
        this(Set.of());
    }

    /**
     * @param reservedNames names no token may take
     */
    public TokenPool(Set<String> reservedNames) {
        this.reservedNames = Set.copyOf(reservedNames);
    }

    /**
     * Returns the name of the token equal to {@code candidate}, registering it
     * under a fresh name if no such token exists yet.
     */
    public String addToken(Rule candidate) {
        Objects.requireNonNull(candidate, "candidate");
        requestCount++;

        String existing = namesByRule.get(candidate);
        if (existing != null) {
            return existing;
        }

        String name;
        do {
            name = TOKEN_NAME_PREFIX + nextIndex++;
        } while (reservedNames.contains(name));
        tokens.put(name, candidate);
        namesByRule.put(candidate, name);
        return name;
    }

    public Rule get(String name) {
        return tokens.get(name);
    }

    public boolean contains(String name) {
        return tokens.containsKey(name);
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * @return how many leaves were offered to the pool, including those that were deduplicated
     */
    public int requestCount() {
        return requestCount;
    }

    /**
     * @return a read-only, insertion-ordered view of the pooled tokens
     */
    public Map<String, Rule> entries() {
        return Collections.unmodifiableMap(tokens);
    }
}
