/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api.exceptions;

/**
 * Thrown when a rule tree violates a structural precondition, such as a
 * choice with no alternatives or a symbol without a name.
 *
 * <p>The offending rule name is attached when known. Stages that detect the
 * problem deep inside a tree (where the owning rule is not in scope) throw
 * without a name, and the caller re-attributes it with {@link #forRule(String)}.
 */
public class MalformedRuleException extends CompilationException {

    private final String ruleName;
    private final String detail;

    public MalformedRuleException(String detail) {
        super(detail);
        this.ruleName = null;
        this.detail = detail;
    }

    public MalformedRuleException(String ruleName, String detail) {
        super("Rule '" + ruleName + "' is malformed: " + detail);
        this.ruleName = ruleName;
        this.detail = detail;
    }

    private MalformedRuleException(String ruleName, String detail, Throwable cause) {
        super("Rule '" + ruleName + "' is malformed: " + detail, cause);
        this.ruleName = ruleName;
        this.detail = detail;
    }

    /**
     * Returns a copy of this exception attributed to the given rule.
     * An exception that already names a rule is returned unchanged.
     */
    public MalformedRuleException forRule(String name) {
        if (ruleName != null) {
            return this;
        }
        return new MalformedRuleException(name, detail, this);
    }

    /**
     * @return the name of the offending rule, or null if not yet attributed
     */
    public String getRuleName() {
        return ruleName;
    }

    /**
     * @return the description of the violation, without the rule name
     */
    public String getDetail() {
        return detail;
    }
}
