/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.analysis;

import com.arbor.grammar.api.exceptions.CompilationException;
import com.arbor.grammar.api.model.ExtractedGrammars;
import com.arbor.grammar.api.model.PreparedGrammar;
import com.arbor.grammar.api.model.Rule;
import com.arbor.grammar.api.model.Rules;
import com.arbor.grammar.compiler.prepare.GrammarSplitter;
import com.arbor.grammar.compiler.prepare.TokenClassifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks that a split preserved the grammar.
 *
 * <p>Given the input grammar and the split result, every input rule must be
 * accounted for:
 * <ul>
 *   <li>A shallow token rule appears unchanged in the lexical grammar under the same name.</li>
 *   <li>Any other rule appears in the syntactic grammar with no STRING or PATTERN leaf left.</li>
 *   <li>Every auxiliary symbol the split introduced resolves to a lexical auxiliary rule.
 *       References the input already made are left to the validator.</li>
 *   <li>Inlining those symbols reproduces the input rule, rebuilt through the
 *       {@link Rule} factories (round-trip law).</li>
 * </ul>
 *
 * <p>Verification is O(grammar size) and intended for tests and diagnostic
 * builds; the compiler runs it only when configured to.
 */
public class ExtractionVerifier {

    /**
     * @throws CompilationException describing the first violation found
     */
    public void verify(PreparedGrammar original, ExtractedGrammars result) throws CompilationException {
        PreparedGrammar syntactic = result.syntacticGrammar();
        PreparedGrammar lexical = result.lexicalGrammar();

        if (!syntactic.startRuleName().equals(original.startRuleName())) {
            throw new CompilationException("Start rule changed from '" + original.startRuleName()
                    + "' to '" + syntactic.startRuleName() + "'");
        }
        if (lexical.hasStartRule()) {
            throw new CompilationException("Lexical grammar must not have a start rule, got '"
                    + lexical.startRuleName() + "'");
        }

        Map<String, Rule> extractedTokens = new LinkedHashMap<>(lexical.auxRules());
        extractedTokens.keySet().removeAll(original.auxRules().keySet());

        Set<String> knownAuxNames = GrammarSplitter.auxiliaryNamesInUse(original);
        knownAuxNames.addAll(extractedTokens.keySet());

        verifyRules(original.rules(), syntactic.rules(), lexical.rules(), extractedTokens, knownAuxNames);
        verifyRules(original.auxRules(), syntactic.auxRules(), lexical.auxRules(), extractedTokens, knownAuxNames);
    }

    private void verifyRules(Map<String, Rule> originalRules,
                             Map<String, Rule> syntacticRules,
                             Map<String, Rule> lexicalRules,
                             Map<String, Rule> extractedTokens,
                             Set<String> knownAuxNames) {
        for (Map.Entry<String, Rule> entry : originalRules.entrySet()) {
            String name = entry.getKey();
            Rule rule = entry.getValue();

            if (TokenClassifier.isToken(rule)) {
                if (!rule.equals(lexicalRules.get(name))) {
                    throw new CompilationException("Token rule '" + name + "' was not moved unchanged to the lexical grammar");
                }
                if (syntacticRules.containsKey(name)) {
                    throw new CompilationException("Token rule '" + name + "' also appears in the syntactic grammar");
                }
                continue;
            }

            Rule rewritten = syntacticRules.get(name);
            if (rewritten == null) {
                throw new CompilationException("Rule '" + name + "' is missing from the syntactic grammar");
            }

            List<Rule> leftovers = Rules.lexicalLeaves(rewritten);
            if (!leftovers.isEmpty()) {
                throw new CompilationException("Rule '" + name + "' still contains lexical leaf " + leftovers.get(0));
            }

            Rules.forEachNode(rewritten, node -> {
                if (node instanceof Rule.Symbol && ((Rule.Symbol) node).isAuxiliary()
                        && !knownAuxNames.contains(((Rule.Symbol) node).name())) {
                    throw new CompilationException("Rule '" + name + "' references unknown token '"
                            + ((Rule.Symbol) node).name() + "'");
                }
            });

            Rule restored = TokenInliner.inline(rewritten, extractedTokens);
            if (!Rules.structurallyEqual(restored, Rules.normalize(rule))) {
                throw new CompilationException("Rule '" + name + "' does not round-trip: expected "
                        + rule + " but inlining tokens gives " + restored);
            }
        }
    }
}
