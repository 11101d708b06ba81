/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.validation;

import com.arbor.grammar.api.exceptions.CompilationException;
import com.arbor.grammar.api.exceptions.MalformedRuleException;
import com.arbor.grammar.api.exceptions.UnresolvedSymbolException;
import com.arbor.grammar.api.model.PreparedGrammar;
import com.arbor.grammar.api.model.Rule;
import com.arbor.grammar.compiler.prepare.TokenExtractor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Validates a grammar before it enters token extraction.
 *
 * <p>This step ensures that every rule is well-formed so that later stages can
 * fail only on genuine bugs. Validations include:
 * <ul>
 *   <li>Non-blank rule names, and no name defined both as a rule and as an auxiliary rule.</li>
 *   <li>A start rule that names one of the grammar's rules.</li>
 *   <li>Choices with at least one alternative and symbols with a non-blank name.</li>
 *   <li>Nesting no deeper than the configured maximum.</li>
 *   <li>Symbol references that resolve: NORMAL symbols against {@code rules},
 *       AUXILIARY symbols against {@code auxRules}. EXTERNAL symbols are not checked.</li>
 * </ul>
 *
 * <p>Unresolved references are warnings by default and errors in strict mode.
 * Trees are walked iteratively, so deep grammars are rejected with a message
 * rather than a stack overflow.
 */
public class GrammarValidator {
    private static final Logger logger = Logger.getLogger(GrammarValidator.class.getName());

    private final int maxDepth;
    private final boolean strictSymbols;

    public GrammarValidator() {
        this(TokenExtractor.DEFAULT_MAX_DEPTH, false);
    }

    public GrammarValidator(int maxDepth, boolean strictSymbols) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Max depth must be positive, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.strictSymbols = strictSymbols;
    }

    /**
     * @return the warnings found
     * @throws CompilationException on the first error found
     */
    public ValidationResult validate(PreparedGrammar grammar) throws CompilationException {
        if (grammar.rules().isEmpty()) {
            throw new CompilationException("Grammar must define at least one rule");
        }
        if (grammar.startRuleName().isBlank()) {
            throw new CompilationException("Grammar has missing or empty start rule name");
        }
        if (!grammar.rules().containsKey(grammar.startRuleName())) {
            throw new CompilationException("Start rule '" + grammar.startRuleName() + "' is not defined");
        }

        checkNames(grammar.rules(), "Rule");
        checkNames(grammar.auxRules(), "Auxiliary rule");
        for (String name : grammar.auxRules().keySet()) {
            if (grammar.rules().containsKey(name)) {
                throw new CompilationException("Duplicate rule name: '" + name
                        + "' is defined both as a rule and as an auxiliary rule");
            }
        }

        List<String> warnings = new ArrayList<>();
        grammar.rules().forEach((name, rule) -> checkTree(name, rule, grammar, warnings));
        grammar.auxRules().forEach((name, rule) -> checkTree(name, rule, grammar, warnings));
        return new ValidationResult(warnings);
    }

    private void checkNames(Map<String, Rule> rules, String label) {
        int index = 0;
        for (String name : rules.keySet()) {
            if (name.isBlank()) {
                throw new CompilationException(label + " at index " + index + " has missing or empty name");
            }
            index++;
        }
    }

    private void checkTree(String ruleName, Rule root, PreparedGrammar grammar, List<String> warnings) {
        record Frame(Rule rule, int depth) {}

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 1));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.depth() > maxDepth) {
                throw new MalformedRuleException(ruleName, "nesting exceeds maximum depth of " + maxDepth);
            }
            Rule rule = frame.rule();
            switch (rule.kind()) {
                case SEQ -> {
                    Rule.Seq seq = (Rule.Seq) rule;
                    stack.push(new Frame(seq.right(), frame.depth() + 1));
                    stack.push(new Frame(seq.left(), frame.depth() + 1));
                }
                case CHOICE -> {
                    List<Rule> alternatives = ((Rule.Choice) rule).alternatives();
                    if (alternatives.isEmpty()) {
                        throw new MalformedRuleException(ruleName, "Choice must have at least one alternative");
                    }
                    for (Rule alternative : alternatives) {
                        stack.push(new Frame(alternative, frame.depth() + 1));
                    }
                }
                case REPEAT -> stack.push(new Frame(((Rule.Repeat) rule).content(), frame.depth() + 1));
                case SYMBOL -> checkReference(ruleName, (Rule.Symbol) rule, grammar, warnings);
                case BLANK, STRING, PATTERN -> {
                    // nothing to check
                }
            }
        }
    }

    private void checkReference(String ruleName, Rule.Symbol symbol, PreparedGrammar grammar, List<String> warnings) {
        if (symbol.name().isBlank()) {
            throw new MalformedRuleException(ruleName, "Symbol has missing or empty name");
        }

        boolean resolved = switch (symbol.symbolKind()) {
            case NORMAL -> grammar.rules().containsKey(symbol.name());
            case AUXILIARY -> grammar.auxRules().containsKey(symbol.name());
            case EXTERNAL -> true;
        };
        if (resolved) {
            return;
        }

        if (strictSymbols) {
            throw new UnresolvedSymbolException(ruleName, symbol.name(), symbol.symbolKind());
        }
        String warning = "Rule '" + ruleName + "' references undefined "
                + symbol.symbolKind().name().toLowerCase(Locale.ROOT) + " symbol '" + symbol.name() + "'";
        logger.warning(warning);
        warnings.add(warning);
    }
}
