/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api.model;

import com.arbor.grammar.api.exceptions.MalformedRuleException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A grammar expression: an immutable value tree built from seven variants.
 *
 * <p>Each variant is a record, so {@code equals} and {@code hashCode} compare
 * trees structurally: kinds must match and payloads and children must be
 * recursively equal, in order. Code that dispatches over variants switches on
 * {@link #kind()} so that the compiler reports any kind left unhandled.
 *
 * <h2>Construction</h2>
 * <p>The static factories ({@link #seq}, {@link #choice}, ...) are the
 * preferred way to build trees. {@link #choice(List)} flattens operands that
 * are themselves choices, so a tree rebuilt through the factories is equal to
 * the tree it was rebuilt from.
 *
 * <pre>{@code
 * Rule plusExpr = Rule.seq(
 *         Rule.symbol("expr"),
 *         Rule.seq(Rule.string("+"), Rule.symbol("expr")));
 * }</pre>
 */
public interface Rule {

    RuleKind kind();

    // ========================================================================
    // FACTORIES
    // ========================================================================

    static Rule blank() {
        return Blank.INSTANCE;
    }

    static Rule string(String value) {
        return new Literal(value);
    }

    static Rule pattern(String value) {
        return new Pattern(value);
    }

    static Rule symbol(String name) {
        return new Symbol(name, SymbolKind.NORMAL);
    }

    static Rule symbol(String name, SymbolKind kind) {
        return new Symbol(name, kind);
    }

    static Rule auxiliary(String name) {
        return new Symbol(name, SymbolKind.AUXILIARY);
    }

    static Rule external(String name) {
        return new Symbol(name, SymbolKind.EXTERNAL);
    }

    static Rule seq(Rule left, Rule right) {
        return new Seq(left, right);
    }

    /**
     * Folds a member list into nested binary sequences, associating to the right.
     * {@code [a, b, c]} becomes {@code Seq(a, Seq(b, c))}; a single member is
     * returned as-is and an empty list yields {@link #blank()}.
     */
    static Rule seq(List<Rule> members) {
        Objects.requireNonNull(members, "members");
        if (members.isEmpty()) {
            return blank();
        }
        Rule result = members.get(members.size() - 1);
        for (int i = members.size() - 2; i >= 0; i--) {
            result = new Seq(members.get(i), result);
        }
        return result;
    }

    static Rule seq(Rule first, Rule second, Rule... rest) {
        List<Rule> members = new ArrayList<>(rest.length + 2);
        members.add(first);
        members.add(second);
        members.addAll(Arrays.asList(rest));
        return seq(members);
    }

    /**
     * Builds an ordered choice. Alternatives that are themselves choices are
     * spliced into the resulting alternative list.
     *
     * @throws MalformedRuleException if there are no alternatives
     */
    static Rule choice(List<Rule> alternatives) {
        Objects.requireNonNull(alternatives, "alternatives");
        if (alternatives.isEmpty()) {
            throw new MalformedRuleException("Choice must have at least one alternative");
        }
        List<Rule> flattened = new ArrayList<>(alternatives.size());
        for (Rule alternative : alternatives) {
            if (alternative instanceof Choice) {
                flattened.addAll(((Choice) alternative).alternatives());
            } else {
                flattened.add(alternative);
            }
        }
        return new Choice(flattened);
    }

    static Rule choice(Rule... alternatives) {
        return choice(Arrays.asList(alternatives));
    }

    static Rule repeat(Rule content) {
        return new Repeat(content);
    }

    // ========================================================================
    // VARIANTS
    // ========================================================================

    /**
     * Matches the empty input.
     */
    record Blank() implements Rule {
        static final Blank INSTANCE = new Blank();

        @Override
        public RuleKind kind() {
            return RuleKind.BLANK;
        }

        @Override
        public String toString() {
            return "BLANK";
        }
    }

    /**
     * Matches exactly {@code value}. This is the STRING variant.
     */
    record Literal(String value) implements Rule {
        public Literal {
            Objects.requireNonNull(value, "String rule value cannot be null");
        }

        @Override
        public RuleKind kind() {
            return RuleKind.STRING;
        }

        @Override
        public String toString() {
            return "STRING(\"" + value + "\")";
        }
    }

    /**
     * Matches according to an external pattern matcher. The pattern text is opaque here.
     */
    record Pattern(String value) implements Rule {
        public Pattern {
            Objects.requireNonNull(value, "Pattern rule value cannot be null");
        }

        @Override
        public RuleKind kind() {
            return RuleKind.PATTERN;
        }

        @Override
        public String toString() {
            return "PATTERN(/" + value + "/)";
        }
    }

    /**
     * A reference to another named rule.
     */
    record Symbol(String name, SymbolKind symbolKind) implements Rule {
        public Symbol {
            Objects.requireNonNull(name, "Symbol name cannot be null");
            Objects.requireNonNull(symbolKind, "Symbol kind cannot be null");
        }

        public boolean isAuxiliary() {
            return symbolKind == SymbolKind.AUXILIARY;
        }

        @Override
        public RuleKind kind() {
            return RuleKind.SYMBOL;
        }

        @Override
        public String toString() {
            return symbolKind == SymbolKind.NORMAL
                    ? "SYMBOL(" + name + ")"
                    : "SYMBOL(" + name + ", " + symbolKind + ")";
        }
    }

    /**
     * Ordered concatenation of two rules.
     */
    record Seq(Rule left, Rule right) implements Rule {
        public Seq {
            Objects.requireNonNull(left, "Seq left operand cannot be null");
            Objects.requireNonNull(right, "Seq right operand cannot be null");
        }

        @Override
        public RuleKind kind() {
            return RuleKind.SEQ;
        }

        @Override
        public String toString() {
            return "SEQ(" + left + ", " + right + ")";
        }
    }

    /**
     * Ordered alternation. The constructor accepts an empty list so that
     * hand-built malformed trees can reach validation, which rejects them
     * with the owning rule's name; {@link Rule#choice(List)} rejects them immediately.
     */
    record Choice(List<Rule> alternatives) implements Rule {
        public Choice {
            alternatives = List.copyOf(alternatives);
        }

        @Override
        public RuleKind kind() {
            return RuleKind.CHOICE;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("CHOICE(");
            for (int i = 0; i < alternatives.size(); i++) {
                if (i > 0) sb.append(" | ");
                sb.append(alternatives.get(i));
            }
            return sb.append(')').toString();
        }
    }

    /**
     * Zero or more repetitions of {@code content}.
     */
    record Repeat(Rule content) implements Rule {
        public Repeat {
            Objects.requireNonNull(content, "Repeat content cannot be null");
        }

        @Override
        public RuleKind kind() {
            return RuleKind.REPEAT;
        }

        @Override
        public String toString() {
            return "REPEAT(" + content + ")";
        }
    }
}
