/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.term;

import com.vaticle.requirement.common.exception.RequirementMachineException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import static com.vaticle.requirement.common.exception.ErrorMessage.Term.EMPTY_TERM;
import static com.vaticle.requirement.common.exception.ErrorMessage.Term.TERM_INDEX_OUT_OF_BOUNDS;

/**
 * An editable sequence of symbols, owned by whoever constructed it. Convert to a canonical
 * {@link Term} with {@link RewriteContext#term(MutableTerm)}.
 */
public class MutableTerm implements Iterable<Symbol> {

    private final List<Symbol> symbols;

    public MutableTerm() {
        this.symbols = new ArrayList<>();
    }

    public MutableTerm(Term term) {
        this.symbols = new ArrayList<>(term.symbols());
    }

    public MutableTerm(MutableTerm term) {
        this.symbols = new ArrayList<>(term.symbols);
    }

    public MutableTerm(List<Symbol> symbols) {
        this.symbols = new ArrayList<>(symbols);
    }

    public static MutableTerm of(Symbol... symbols) {
        return new MutableTerm(Arrays.asList(symbols));
    }

    public List<Symbol> symbols() {
        return Collections.unmodifiableList(symbols);
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

    public void set(int index, Symbol symbol) {
        symbols.set(index, symbol);
    }

    public Symbol back() {
        if (symbols.isEmpty()) throw RequirementMachineException.of(EMPTY_TERM);
        return symbols.get(symbols.size() - 1);
    }

    public void setBack(Symbol symbol) {
        if (symbols.isEmpty()) throw RequirementMachineException.of(EMPTY_TERM);
        symbols.set(symbols.size() - 1, symbol);
    }

    public void add(Symbol symbol) {
        symbols.add(symbol);
    }

    public void append(Term other) {
        symbols.addAll(other.symbols());
    }

    public void append(MutableTerm other) {
        symbols.addAll(other.symbols);
    }

    public void append(List<Symbol> other) {
        symbols.addAll(other);
    }

    /**
     * Returns a copy of the symbols in {@code [from, to)}.
     */
    public MutableTerm subTerm(int from, int to) {
        checkRange(from, to);
        return new MutableTerm(symbols.subList(from, to));
    }

    /**
     * Whether {@code pattern} occurs in this term starting at {@code offset}.
     */
    public boolean containsAt(int offset, Term pattern) {
        if (offset < 0 || offset + pattern.size() > symbols.size()) return false;
        return symbols.subList(offset, offset + pattern.size()).equals(pattern.symbols());
    }

    public boolean startsWith(MutableTerm prefix) {
        return prefix.size() <= symbols.size() && symbols.subList(0, prefix.size()).equals(prefix.symbols);
    }

    /**
     * Replaces the symbols in {@code [from, to)} with {@code replacement}.
     */
    public void rewriteSubTerm(int from, int to, Term replacement) {
        checkRange(from, to);
        List<Symbol> range = symbols.subList(from, to);
        range.clear();
        range.addAll(replacement.symbols());
    }

    public int compare(MutableTerm other, ProtocolGraph graph) {
        return Term.compare(symbols, other.symbols, graph);
    }

    public Set<String> rootProtocols() {
        return Term.rootProtocols(symbols);
    }

    private void checkRange(int from, int to) {
        if (from < 0 || to > symbols.size() || from > to) {
            throw RequirementMachineException.of(TERM_INDEX_OUT_OF_BOUNDS, from, to, symbols.size());
        }
    }

    @Override
    public Iterator<Symbol> iterator() {
        return symbols().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MutableTerm that = (MutableTerm) o;
        return symbols.equals(that.symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return Term.toString(symbols);
    }
}
