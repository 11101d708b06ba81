/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.prepare;

import com.arbor.grammar.api.exceptions.MalformedRuleException;
import com.arbor.grammar.api.model.ExtractedGrammars;
import com.arbor.grammar.api.model.PreparedGrammar;
import com.arbor.grammar.api.model.Rule;
import com.arbor.grammar.api.model.Rules;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Splits a grammar into a syntactic grammar and a lexical grammar.
 *
 * <p>Routing, per rule and in insertion order:
 * <ul>
 *   <li>A rule that is a token at its top level ({@link TokenClassifier#isToken})
 *       moves unchanged, under its own name, into the lexical grammar.</li>
 *   <li>Any other rule stays in the syntactic grammar, rewritten by the
 *       {@link TokenExtractor}.</li>
 * </ul>
 * Named rules route to {@code rules}, auxiliary rules to {@code auxRules}. The
 * tokens hoisted by the extractor are always auxiliary and are appended to the
 * lexical {@code auxRules} after every rule has been processed. Their names skip
 * any auxiliary name the input already defines or references.
 *
 * <p>One {@link TokenPool} is created per {@link #split} call, so identical
 * literals in different rules share one token while separate calls stay
 * independent. Instances hold no per-call state and are thread-safe.
 */
public final class GrammarSplitter {

    private static final Logger logger = Logger.getLogger(GrammarSplitter.class.getName());

    private final TokenExtractor extractor;

    public GrammarSplitter() {
        this(new TokenExtractor());
    }

    public GrammarSplitter(TokenExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /**
     * @throws MalformedRuleException if a rule tree is malformed; the exception names the rule
     */
    public ExtractedGrammars split(PreparedGrammar grammar) {
        Objects.requireNonNull(grammar, "grammar");

        TokenPool pool = new TokenPool(auxiliaryNamesInUse(grammar));
        Map<String, Rule> syntaxRules = new LinkedHashMap<>();
        Map<String, Rule> syntaxAuxRules = new LinkedHashMap<>();
        Map<String, Rule> lexicalRules = new LinkedHashMap<>();
        Map<String, Rule> lexicalAuxRules = new LinkedHashMap<>();

        route(grammar.rules(), syntaxRules, lexicalRules, pool);
        route(grammar.auxRules(), syntaxAuxRules, lexicalAuxRules, pool);

        lexicalAuxRules.putAll(pool.entries());

        logger.fine(() -> String.format(
                "Split %d rules: %d syntactic, %d shallow tokens, %d tokens extracted from %d leaves",
                grammar.size(),
                syntaxRules.size() + syntaxAuxRules.size(),
                lexicalRules.size() + lexicalAuxRules.size() - pool.size(),
                pool.size(),
                pool.requestCount()));

        return new ExtractedGrammars(
                new PreparedGrammar(grammar.startRuleName(), syntaxRules, syntaxAuxRules),
                new PreparedGrammar(PreparedGrammar.NO_START_RULE, lexicalRules, lexicalAuxRules));
    }

    /**
     * Auxiliary names the grammar already claims: every auxiliary rule it defines
     * and every AUXILIARY symbol it references, resolved or not. Hoisted tokens
     * are never named after one of these.
     */
    public static Set<String> auxiliaryNamesInUse(PreparedGrammar grammar) {
        Set<String> names = new HashSet<>(grammar.auxRules().keySet());
        Consumer<Rule> collector = node -> {
            if (node instanceof Rule.Symbol && ((Rule.Symbol) node).isAuxiliary()) {
                names.add(((Rule.Symbol) node).name());
            }
        };
        grammar.rules().values().forEach(rule -> Rules.forEachNode(rule, collector));
        grammar.auxRules().values().forEach(rule -> Rules.forEachNode(rule, collector));
        return names;
    }

    private void route(Map<String, Rule> source,
                       Map<String, Rule> syntactic,
                       Map<String, Rule> lexical,
                       TokenPool pool) {
        for (Map.Entry<String, Rule> entry : source.entrySet()) {
            String name = entry.getKey();
            Rule rule = entry.getValue();
            if (TokenClassifier.isToken(rule)) {
                lexical.put(name, rule);
                continue;
            }
            try {
                syntactic.put(name, extractor.extract(rule, pool));
            } catch (MalformedRuleException e) {
                throw e.forRule(name);
            }
        }
    }
}
