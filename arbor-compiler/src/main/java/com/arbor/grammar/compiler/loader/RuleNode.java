/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.compiler.loader;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of one rule node for deserialization.
 * Which fields are used depends on {@code type}:
 * <ul>
 *   <li>STRING, PATTERN: {@code value}</li>
 *   <li>SYMBOL: {@code name}, optional {@code kind}</li>
 *   <li>SEQ, CHOICE: {@code members}</li>
 *   <li>REPEAT: {@code content}</li>
 * </ul>
 */
public record RuleNode(
        @JsonProperty("type") String type,
        @JsonProperty("value") String value,
        @JsonProperty("name") String name,
        @JsonProperty("kind") String kind,
        @JsonProperty("members") List<RuleNode> members,
        @JsonProperty("content") RuleNode content
) {}
