/*
 * Copyright (c) 2025 Arbor Grammar Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.grammar.api.model;

import com.arbor.grammar.api.exceptions.MalformedRuleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Static helpers over {@link Rule} trees.
 *
 * <p>Traversals here are iterative so that very deep trees cannot overflow the stack.
 * No traversal follows a {@link Rule.Symbol}: a symbol is a leaf of the tree that contains it.
 */
public final class Rules {

    private Rules() {
    }

    /**
     * Deep, order-sensitive comparison of two rule trees.
     * Gives the same answer as {@code Objects.equals(a, b)} on the record variants
     * without recursing, so it is safe on arbitrarily deep trees.
     */
    public static boolean structurallyEqual(Rule a, Rule b) {
        if (a == null || b == null) {
            return a == b;
        }
        Deque<Rule> left = new ArrayDeque<>();
        Deque<Rule> right = new ArrayDeque<>();
        left.push(a);
        right.push(b);
        while (!left.isEmpty()) {
            Rule x = left.pop();
            Rule y = right.pop();
            if (x == y) {
                continue;
            }
            if (x.kind() != y.kind()) {
                return false;
            }
            if (!x.kind().isComposite()) {
                if (!x.equals(y)) {
                    return false;
                }
                continue;
            }
            List<Rule> xs = children(x);
            List<Rule> ys = children(y);
            if (xs.size() != ys.size()) {
                return false;
            }
            for (int i = 0; i < xs.size(); i++) {
                left.push(xs.get(i));
                right.push(ys.get(i));
            }
        }
        return true;
    }

    /**
     * Visits every node of the tree in pre-order (left to right).
     */
    public static void forEachNode(Rule root, Consumer<Rule> visitor) {
        Deque<Rule> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Rule rule = stack.pop();
            visitor.accept(rule);
            switch (rule.kind()) {
                case SEQ -> {
                    Rule.Seq seq = (Rule.Seq) rule;
                    stack.push(seq.right());
                    stack.push(seq.left());
                }
                case CHOICE -> {
                    List<Rule> alternatives = ((Rule.Choice) rule).alternatives();
                    for (int i = alternatives.size() - 1; i >= 0; i--) {
                        stack.push(alternatives.get(i));
                    }
                }
                case REPEAT -> stack.push(((Rule.Repeat) rule).content());
                case BLANK, STRING, PATTERN, SYMBOL -> {
                    // leaf
                }
            }
        }
    }

    /**
     * Returns the STRING and PATTERN leaves of the tree, in pre-order, duplicates included.
     */
    public static List<Rule> lexicalLeaves(Rule root) {
        List<Rule> leaves = new ArrayList<>();
        forEachNode(root, rule -> {
            if (rule.kind() == RuleKind.STRING || rule.kind() == RuleKind.PATTERN) {
                leaves.add(rule);
            }
        });
        return leaves;
    }

    /**
     * Returns the number of nodes on the longest root-to-leaf path. A leaf has depth 1.
     */
    public static int depth(Rule root) {
        record Frame(Rule rule, int depth) {}

        int max = 0;
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 1));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            max = Math.max(max, frame.depth());
            for (Rule child : children(frame.rule())) {
                stack.push(new Frame(child, frame.depth() + 1));
            }
        }
        return max;
    }

    /**
     * Returns the direct children of a rule, in order. Leaves have none.
     */
    public static List<Rule> children(Rule rule) {
        return switch (rule.kind()) {
            case SEQ -> List.of(((Rule.Seq) rule).left(), ((Rule.Seq) rule).right());
            case CHOICE -> ((Rule.Choice) rule).alternatives();
            case REPEAT -> List.of(((Rule.Repeat) rule).content());
            case BLANK, STRING, PATTERN, SYMBOL -> List.of();
        };
    }

    /**
     * Rebuilds a tree through the {@link Rule} factories. A tree that was built
     * through the factories comes back structurally equal; a hand-built tree
     * with nested choices comes back with those choices flattened.
     */
    public static Rule normalize(Rule rule) {
        return rebuild(rule, UnaryOperator.identity());
    }

    /**
     * Rebuilds a tree bottom-up through the {@link Rule} factories, replacing
     * every leaf by {@code leafMapper.apply(leaf)}. Leaves are mapped in
     * pre-order, left to right.
     *
     * @throws MalformedRuleException if a choice has no alternatives
     */
    public static Rule rebuild(Rule root, UnaryOperator<Rule> leafMapper) {
        return rebuild(root, Integer.MAX_VALUE, leafMapper);
    }

    /**
     * Same as {@link #rebuild(Rule, UnaryOperator)}, failing once a node lies
     * deeper than {@code maxDepth}. The root has depth 1.
     *
     * @throws MalformedRuleException if a choice has no alternatives or the tree is too deep;
     *                                the exception does not name the owning rule
     */
    public static Rule rebuild(Rule root, int maxDepth, UnaryOperator<Rule> leafMapper) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(leafMapper, "leafMapper");
        if (!root.kind().isComposite()) {
            return leafMapper.apply(root);
        }

        Deque<RebuildFrame> stack = new ArrayDeque<>();
        stack.push(new RebuildFrame(root));
        while (true) {
            RebuildFrame frame = stack.peek();
            if (frame.rebuilt.size() < frame.children.size()) {
                if (stack.size() + 1 > maxDepth) {
                    throw new MalformedRuleException("Rule nesting exceeds maximum depth of " + maxDepth);
                }
                Rule child = frame.children.get(frame.rebuilt.size());
                if (child.kind().isComposite()) {
                    stack.push(new RebuildFrame(child));
                } else {
                    frame.rebuilt.add(leafMapper.apply(child));
                }
                continue;
            }

            stack.pop();
            Rule built = assemble(frame.rule, frame.rebuilt);
            if (stack.isEmpty()) {
                return built;
            }
            stack.peek().rebuilt.add(built);
        }
    }

    private static Rule assemble(Rule rule, List<Rule> children) {
        return switch (rule.kind()) {
            case SEQ -> Rule.seq(children.get(0), children.get(1));
            case CHOICE -> Rule.choice(children);
            case REPEAT -> Rule.repeat(children.get(0));
            case BLANK, STRING, PATTERN, SYMBOL -> rule;
        };
    }

    /** A composite node whose children are being rebuilt, left to right. */
    private static final class RebuildFrame {
        private final Rule rule;
        private final List<Rule> children;
        private final List<Rule> rebuilt;

        private RebuildFrame(Rule rule) {
            this.rule = rule;
            this.children = children(rule);
            this.rebuilt = new ArrayList<>(children.size());
        }
    }
}
