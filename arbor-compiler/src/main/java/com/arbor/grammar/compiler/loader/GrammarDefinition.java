/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.loader;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * JSON representation of a grammar for deserialization.
 * This is a simple Data Transfer Object (DTO) used only for loading;
 * Jackson keeps the key order of both rule maps.
 */
public record GrammarDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("start") String start,
        @JsonProperty("rules") Map<String, RuleNode> rules,
        @JsonProperty("aux_rules") Map<String, RuleNode> auxRules
) {

    public Map<String, RuleNode> auxRules() {
        return auxRules != null ? auxRules : Map.of();
    }
}
