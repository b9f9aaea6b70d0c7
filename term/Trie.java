/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.term;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A prefix tree keyed by symbol sequences. Entries are never removed, only superseded by a
 * later insertion of the same key; callers filter stale values with a predicate at lookup.
 */
public class Trie<VALUE> {

    private final Node<VALUE> root;

    public Trie() {
        this.root = new Node<>();
    }

    /**
     * Maps {@code key} to {@code value}, returning the value it supersedes, if any.
     */
    public Optional<VALUE> insert(List<Symbol> key, VALUE value) {
        Node<VALUE> node = root;
        for (Symbol symbol : key) node = node.children.computeIfAbsent(symbol, s -> new Node<>());
        VALUE previous = node.value;
        node.value = value;
        return Optional.ofNullable(previous);
    }

    /**
     * The value stored under exactly {@code key}, which may have gone stale.
     */
    public Optional<VALUE> get(List<Symbol> key) {
        Node<VALUE> node = root;
        for (Symbol symbol : key) {
            node = node.children.get(symbol);
            if (node == null) return Optional.empty();
        }
        return Optional.ofNullable(node.value);
    }

    /**
     * Shortest match: the value of the shortest key accepted by {@code filter} that is a prefix
     * of {@code term[from...]}.
     */
    public Optional<VALUE> find(List<Symbol> term, int from, Predicate<VALUE> filter) {
        Node<VALUE> node = root;
        for (int i = from; i < term.size(); i++) {
            node = node.children.get(term.get(i));
            if (node == null) return Optional.empty();
            if (node.value != null && filter.test(node.value)) return Optional.of(node.value);
        }
        return Optional.empty();
    }

    /**
     * Visits the value of every key that is a prefix of {@code term[from...]}, then, if the
     * whole of {@code term[from...]} is a key prefix, every value stored below it. These are
     * exactly the keys that overlap the term at {@code from}.
     */
    public void findAll(List<Symbol> term, int from, Consumer<VALUE> visitor) {
        Node<VALUE> node = root;
        for (int i = from; i < term.size(); i++) {
            node = node.children.get(term.get(i));
            if (node == null) return;
            if (node.value != null) visitor.accept(node.value);
        }
        visitBelow(node, visitor);
    }

    private void visitBelow(Node<VALUE> start, Consumer<VALUE> visitor) {
        Deque<Node<VALUE>> frontier = new ArrayDeque<>(start.children.values());
        while (!frontier.isEmpty()) {
            Node<VALUE> node = frontier.removeFirst();
            if (node.value != null) visitor.accept(node.value);
            frontier.addAll(node.children.values());
        }
    }

    private static class Node<VALUE> {

        private final Map<Symbol, Node<VALUE>> children = new LinkedHashMap<>();
        @Nullable
        private VALUE value;
    }
}
