/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api.model;

import com.arbor.grammar.api.exceptions.CompilationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A grammar as handed between compiler stages: a start rule name plus two
 * insertion-ordered maps of named rules.
 *
 * <p>{@code rules} holds the rules the grammar author named; {@code auxRules}
 * holds rules synthesized by earlier stages. Iteration order of both maps is
 * the insertion order, and downstream naming depends on it.
 *
 * <p>Instances are immutable. The maps are defensively copied and exposed read-only.
 */
public record PreparedGrammar(
        String startRuleName,
        Map<String, Rule> rules,
        Map<String, Rule> auxRules
) {

    /** Start rule name of grammars that are not parsed top-down, such as a lexical grammar. */
    public static final String NO_START_RULE = "";

    public PreparedGrammar {
        Objects.requireNonNull(startRuleName, "Start rule name cannot be null (use NO_START_RULE)");
        rules = copyOf(rules, "rules");
        auxRules = copyOf(auxRules, "auxRules");
    }

    public PreparedGrammar(String startRuleName, Map<String, Rule> rules) {
        this(startRuleName, rules, Map.of());
    }

    private static Map<String, Rule> copyOf(Map<String, Rule> source, String label) {
        Objects.requireNonNull(source, label + " cannot be null");
        Map<String, Rule> copy = new LinkedHashMap<>();
        source.forEach((name, rule) -> {
            Objects.requireNonNull(name, "Rule name in " + label + " cannot be null");
            Objects.requireNonNull(rule, "Rule '" + name + "' in " + label + " cannot be null");
            copy.put(name, rule);
        });
        return Collections.unmodifiableMap(copy);
    }

    public Rule rule(String name) {
        return rules.get(name);
    }

    public Rule auxRule(String name) {
        return auxRules.get(name);
    }

    public boolean hasStartRule() {
        return !startRuleName.isEmpty();
    }

    /**
     * @return the number of rules plus auxiliary rules
     */
    public int size() {
        return rules.size() + auxRules.size();
    }

    public static Builder builder(String startRuleName) {
        return new Builder(startRuleName);
    }

    /**
     * Builder that preserves insertion order and rejects duplicate names.
     */
    public static final class Builder {
        private final String startRuleName;
        private final Map<String, Rule> rules = new LinkedHashMap<>();
        private final Map<String, Rule> auxRules = new LinkedHashMap<>();

        private Builder(String startRuleName) {
            this.startRuleName = startRuleName;
        }

        public Builder rule(String name, Rule rule) {
            put(rules, name, rule);
            return this;
        }

        public Builder auxRule(String name, Rule rule) {
            put(auxRules, name, rule);
            return this;
        }

        private static void put(Map<String, Rule> target, String name, Rule rule) {
            if (target.containsKey(name)) {
                throw new CompilationException("Duplicate rule name: " + name);
            }
            target.put(name, rule);
        }

        public PreparedGrammar build() {
            return new PreparedGrammar(startRuleName, rules, auxRules);
        }
    }
}
