/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.term;

import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * An immutable sequence of symbols denoting a dependent-type path. Terms are created and
 * interned by a {@link RewriteContext}; use {@link MutableTerm} to edit one.
 */
public class Term implements Iterable<Symbol> {

    private final List<Symbol> symbols;
    private final int hash;

    Term(List<Symbol> symbols) {
        this.symbols = ImmutableList.copyOf(symbols);
        this.hash = this.symbols.hashCode();
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Symbol get(int index) {
        return symbols.get(index);
    }

    public Symbol back() {
        return symbols.get(symbols.size() - 1);
    }

    /**
     * Shortlex order: shorter terms are smaller, terms of equal length compare symbol-wise.
     */
    public int compare(Term other, ProtocolGraph graph) {
        return compare(symbols, other.symbols, graph);
    }

    static int compare(List<Symbol> first, List<Symbol> second, ProtocolGraph graph) {
        if (first.size() != second.size()) return Integer.compare(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            int result = first.get(i).compare(second.get(i), graph);
            if (result != 0) return result;
        }
        return 0;
    }

    /**
     * The protocols this term is rooted in: the protocol of a leading protocol symbol, the
     * protocols of a leading associated type symbol, and none for any other term.
     */
    public Set<String> rootProtocols() {
        return rootProtocols(symbols);
    }

    static Set<String> rootProtocols(List<Symbol> symbols) {
        if (symbols.isEmpty()) return Collections.emptySet();
        Symbol first = symbols.get(0);
        if (first.kind() == Symbol.Kind.PROTOCOL || first.kind() == Symbol.Kind.ASSOCIATED_TYPE) {
            return new TreeSet<>(first.protocols());
        }
        return Collections.emptySet();
    }

    @Override
    public Iterator<Symbol> iterator() {
        return symbols.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Term that = (Term) o;
        return hash == that.hash && symbols.equals(that.symbols);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return toString(symbols);
    }

    static String toString(List<Symbol> symbols) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < symbols.size(); i++) {
            if (i > 0) builder.append(".");
            builder.append(symbols.get(i));
        }
        return builder.toString();
    }
}
