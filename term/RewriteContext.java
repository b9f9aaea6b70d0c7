/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.term;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import com.vaticle.requirement.common.exception.RequirementMachineException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.vaticle.requirement.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;
import static com.vaticle.requirement.common.exception.ErrorMessage.Term.INVALID_ASSOCIATED_TYPE_MERGE;

/**
 * Creates and interns symbols and terms. A context may be shared by several rewrite systems;
 * its interners are safe for concurrent use.
 */
public class RewriteContext {

    private final Interner<Symbol> symbols;
    private final Interner<Term> terms;

    public RewriteContext() {
        this.symbols = Interners.newStrongInterner();
        this.terms = Interners.newStrongInterner();
    }

    Symbol intern(Symbol symbol) {
        return symbols.intern(symbol);
    }

    public Term term(MutableTerm term) {
        return terms.intern(new Term(term.symbols()));
    }

    public Term term(List<Symbol> symbols) {
        return terms.intern(new Term(symbols));
    }

    public Term term(Symbol... symbols) {
        return term(Arrays.asList(symbols));
    }

    public Symbol name(String name) {
        return intern(new Symbol(Symbol.Kind.NAME, name, Collections.emptyList(), 0, 0, Collections.emptyList()));
    }

    public Symbol protocol(String protocol) {
        return intern(new Symbol(Symbol.Kind.PROTOCOL, null, ImmutableList.of(protocol), 0, 0, Collections.emptyList()));
    }

    public Symbol associatedType(String protocol, String name) {
        return associatedType(ImmutableList.of(protocol), name);
    }

    /**
     * An associated type declared by, or merged across, {@code protocols}. The list is taken as
     * given; callers merging symbols go through {@link #mergeAssociatedTypes}.
     */
    public Symbol associatedType(List<String> protocols, String name) {
        if (protocols.isEmpty()) throw RequirementMachineException.of(ILLEGAL_ARGUMENT, protocols);
        return intern(new Symbol(Symbol.Kind.ASSOCIATED_TYPE, name, protocols, 0, 0, Collections.emptyList()));
    }

    public Symbol genericParam(int depth, int index) {
        return intern(new Symbol(Symbol.Kind.GENERIC_PARAM, null, Collections.emptyList(), depth, index, Collections.emptyList()));
    }

    public Symbol layout(String layout) {
        return intern(new Symbol(Symbol.Kind.LAYOUT, layout, Collections.emptyList(), 0, 0, Collections.emptyList()));
    }

    public Symbol superclass(String type, List<Term> substitutions) {
        return intern(new Symbol(Symbol.Kind.SUPERCLASS, type, Collections.emptyList(), 0, 0, substitutions));
    }

    public Symbol concreteType(String type, List<Term> substitutions) {
        return intern(new Symbol(Symbol.Kind.CONCRETE_TYPE, type, Collections.emptyList(), 0, 0, substitutions));
    }

    /**
     * Merges two same-named associated type symbols into {@code [P1&P2:T]}. The merged symbol
     * carries the union of both protocol lists, minus every protocol another member of the
     * union inherits from, in the linear order of {@code graph}.
     */
    public Symbol mergeAssociatedTypes(Symbol first, Symbol second, ProtocolGraph graph) {
        if (first.kind() != Symbol.Kind.ASSOCIATED_TYPE || second.kind() != Symbol.Kind.ASSOCIATED_TYPE ||
                !first.name().equals(second.name())) {
            throw RequirementMachineException.of(INVALID_ASSOCIATED_TYPE_MERGE, first, second);
        }

        Set<String> union = new LinkedHashSet<>(first.protocols());
        union.addAll(second.protocols());

        List<String> minimal = new ArrayList<>();
        for (String protocol : union) {
            boolean implied = false;
            for (String other : union) {
                if (!other.equals(protocol) && graph.inheritsFrom(other, protocol)) {
                    implied = true;
                    break;
                }
            }
            if (!implied) minimal.add(protocol);
        }
        minimal.sort(graph::compareProtocols);
        return associatedType(minimal, first.name());
    }
}
