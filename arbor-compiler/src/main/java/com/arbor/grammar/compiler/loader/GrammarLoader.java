/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.loader;

import com.arbor.grammar.api.exceptions.CompilationException;
import com.arbor.grammar.api.exceptions.MalformedRuleException;
import com.arbor.grammar.api.model.PreparedGrammar;
import com.arbor.grammar.api.model.Rule;
import com.arbor.grammar.api.model.RuleKind;
import com.arbor.grammar.api.model.SymbolKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loads a grammar from its JSON form into a {@link PreparedGrammar}.
 *
 * <p>Document shape:
 * <pre>{@code
 * {
 *   "name": "arithmetic",
 *   "start": "expr",
 *   "rules": {
 *     "expr": { "type": "CHOICE", "members": [
 *       { "type": "SYMBOL", "name": "sum" },
 *       { "type": "SYMBOL", "name": "number" } ] },
 *     "sum": { "type": "SEQ", "members": [
 *       { "type": "SYMBOL", "name": "expr" },
 *       { "type": "STRING", "value": "+" },
 *       { "type": "SYMBOL", "name": "expr" } ] },
 *     "number": { "type": "PATTERN", "value": "\\d+" }
 *   },
 *   "aux_rules": {}
 * }
 * }</pre>
 *
 * <p>SEQ members fold into right-nested binary sequences; CHOICE members go
 * through {@link Rule#choice(List)}. {@code start} defaults to the first rule.
 * Properties this stage does not use (such as {@code extras}) are ignored, and
 * duplicate keys are rejected.
 */
public class GrammarLoader {
    private static final Logger logger = Logger.getLogger(GrammarLoader.class.getName());

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /**
     * @throws IOException if the file cannot be read
     * @throws CompilationException if the document is not a valid grammar
     */
    public PreparedGrammar load(Path grammarPath) throws IOException {
        String content = Files.readString(grammarPath);
        logger.fine(() -> "Loading grammar from " + grammarPath);
        return parse(content);
    }

    /**
     * @throws CompilationException if the document is not a valid grammar
     */
    public PreparedGrammar parse(String json) throws CompilationException {
        GrammarDefinition definition;
        try {
            definition = objectMapper.readValue(json, GrammarDefinition.class);
        } catch (JsonProcessingException e) {
            throw new CompilationException("Invalid grammar JSON: " + e.getOriginalMessage(), e);
        }
        if (definition == null) {
            throw new CompilationException("Grammar document is empty");
        }
        if (definition.rules() == null) {
            throw new CompilationException("Grammar has no 'rules' object");
        }

        PreparedGrammar.Builder builder = PreparedGrammar.builder(startRuleName(definition));
        for (Map.Entry<String, RuleNode> entry : definition.rules().entrySet()) {
            builder.rule(entry.getKey(), toRule(entry.getKey(), entry.getValue()));
        }
        for (Map.Entry<String, RuleNode> entry : definition.auxRules().entrySet()) {
            builder.auxRule(entry.getKey(), toRule(entry.getKey(), entry.getValue()));
        }

        PreparedGrammar grammar = builder.build();
        logger.fine(() -> String.format("Loaded grammar '%s': %d rules, %d auxiliary rules",
                definition.name(), grammar.rules().size(), grammar.auxRules().size()));
        return grammar;
    }

    private String startRuleName(GrammarDefinition definition) {
        if (definition.start() != null) {
            return definition.start();
        }
        return definition.rules().keySet().stream().findFirst().orElse(PreparedGrammar.NO_START_RULE);
    }

    private Rule toRule(String ruleName, RuleNode node) {
        if (node == null) {
            throw new MalformedRuleException(ruleName, "rule node is null");
        }
        if (node.type() == null) {
            throw new MalformedRuleException(ruleName, "rule node has no 'type'");
        }
        RuleKind kind = RuleKind.fromString(node.type());
        if (kind == null) {
            throw new MalformedRuleException(ruleName, "unknown rule type: " + node.type());
        }

        return switch (kind) {
            case BLANK -> Rule.blank();
            case STRING -> Rule.string(requireValue(ruleName, node, kind));
            case PATTERN -> Rule.pattern(requireValue(ruleName, node, kind));
            case SYMBOL -> toSymbol(ruleName, node);
            case SEQ -> Rule.seq(toMembers(ruleName, node, kind));
            case CHOICE -> {
                List<Rule> members = toMembers(ruleName, node, kind);
                if (members.isEmpty()) {
                    throw new MalformedRuleException(ruleName, "Choice must have at least one alternative");
                }
                yield Rule.choice(members);
            }
            case REPEAT -> {
                if (node.content() == null) {
                    throw new MalformedRuleException(ruleName, "REPEAT requires 'content'");
                }
                yield Rule.repeat(toRule(ruleName, node.content()));
            }
        };
    }

    private String requireValue(String ruleName, RuleNode node, RuleKind kind) {
        if (node.value() == null) {
            throw new MalformedRuleException(ruleName, kind + " requires a 'value'");
        }
        return node.value();
    }

    private Rule toSymbol(String ruleName, RuleNode node) {
        if (node.name() == null || node.name().isBlank()) {
            throw new MalformedRuleException(ruleName, "SYMBOL requires a non-empty 'name'");
        }
        if (node.kind() == null) {
            return Rule.symbol(node.name());
        }
        SymbolKind symbolKind = SymbolKind.fromString(node.kind());
        if (symbolKind == null) {
            throw new MalformedRuleException(ruleName, "unknown symbol kind: " + node.kind());
        }
        return Rule.symbol(node.name(), symbolKind);
    }

    private List<Rule> toMembers(String ruleName, RuleNode node, RuleKind kind) {
        if (node.members() == null) {
            throw new MalformedRuleException(ruleName, kind + " requires a 'members' array");
        }
        List<Rule> members = new ArrayList<>(node.members().size());
        for (RuleNode member : node.members()) {
            members.add(toRule(ruleName, member));
        }
        return members;
    }
}
