/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.term;

import com.google.common.collect.ImmutableList;
import com.vaticle.requirement.common.exception.RequirementMachineException;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import static com.vaticle.requirement.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.requirement.common.exception.ErrorMessage.Term.ILLEGAL_SYMBOL_ACCESS;

/**
 * An atomic element of a {@link Term}. Symbols are immutable values; a {@link RewriteContext}
 * interns them so that terms built from the same context share instances.
 */
public class Symbol {

    /**
     * Symbol kinds, declared in order of precedence in the linear order over symbols.
     */
    public enum Kind {
        PROTOCOL,
        ASSOCIATED_TYPE,
        GENERIC_PARAM,
        NAME,
        LAYOUT,
        SUPERCLASS,
        CONCRETE_TYPE;

        public boolean isProperty() {
            return this == PROTOCOL || this == LAYOUT || this == SUPERCLASS || this == CONCRETE_TYPE;
        }

        public boolean hasSubstitutions() {
            return this == SUPERCLASS || this == CONCRETE_TYPE;
        }
    }

    private final Kind kind;
    private final String name;
    private final List<String> protocols;
    private final int depth;
    private final int index;
    private final List<Term> substitutions;
    private final int hash;

    Symbol(Kind kind, @Nullable String name, List<String> protocols, int depth, int index, List<Term> substitutions) {
        this.kind = kind;
        this.name = name;
        this.protocols = ImmutableList.copyOf(protocols);
        this.depth = depth;
        this.index = index;
        this.substitutions = ImmutableList.copyOf(substitutions);
        this.hash = Objects.hash(kind.ordinal(), name, this.protocols, depth, index, this.substitutions);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isProperty() {
        return kind.isProperty();
    }

    public boolean hasSubstitutions() {
        return kind.hasSubstitutions();
    }

    /**
     * The identifier of a name or associated type, the layout of a layout constraint, or the
     * type constructor of a superclass or concrete type.
     */
    public String name() {
        if (kind == Kind.PROTOCOL || kind == Kind.GENERIC_PARAM) {
            throw RequirementMachineException.of(ILLEGAL_SYMBOL_ACCESS, this, kind, "name");
        }
        return name;
    }

    public String protocol() {
        if (kind != Kind.PROTOCOL) throw RequirementMachineException.of(ILLEGAL_SYMBOL_ACCESS, this, kind, "protocol");
        return protocols.get(0);
    }

    public List<String> protocols() {
        if (kind != Kind.PROTOCOL && kind != Kind.ASSOCIATED_TYPE) {
            throw RequirementMachineException.of(ILLEGAL_SYMBOL_ACCESS, this, kind, "protocols");
        }
        return protocols;
    }

    public int depth() {
        if (kind != Kind.GENERIC_PARAM) throw RequirementMachineException.of(ILLEGAL_SYMBOL_ACCESS, this, kind, "depth");
        return depth;
    }

    public int index() {
        if (kind != Kind.GENERIC_PARAM) throw RequirementMachineException.of(ILLEGAL_SYMBOL_ACCESS, this, kind, "index");
        return index;
    }

    public List<Term> substitutions() {
        if (!hasSubstitutions()) throw RequirementMachineException.of(ILLEGAL_SYMBOL_ACCESS, this, kind, "substitutions");
        return substitutions;
    }

    /**
     * Returns a symbol of the same kind and type constructor whose substitutions have been
     * mapped through {@code fn}.
     */
    public Symbol transformSubstitutions(Function<Term, Term> fn, RewriteContext context) {
        ImmutableList.Builder<Term> transformed = ImmutableList.builder();
        boolean changed = false;
        for (Term substitution : substitutions()) {
            Term result = fn.apply(substitution);
            changed |= !result.equals(substitution);
            transformed.add(result);
        }
        if (!changed) return this;
        return context.intern(new Symbol(kind, name, protocols, depth, index, transformed.build()));
    }

    public Symbol prependPrefixToSubstitutions(MutableTerm prefix, RewriteContext context) {
        return transformSubstitutions(substitution -> {
            MutableTerm prefixed = new MutableTerm(prefix);
            prefixed.append(substitution);
            return context.term(prefixed);
        }, context);
    }

    /**
     * Compares two symbols under the linear order: kind precedence first, then the structure
     * of each kind. Protocols are ordered by their position in the protocol graph.
     */
    public int compare(Symbol other, ProtocolGraph graph) {
        if (this == other) return 0;
        if (kind != other.kind) return Integer.compare(kind.ordinal(), other.kind.ordinal());

        switch (kind) {
            case PROTOCOL:
                return graph.compareProtocols(protocol(), other.protocol());
            case ASSOCIATED_TYPE: {
                // Merged associated types with more protocols precede the ones they replace.
                if (protocols.size() != other.protocols.size()) {
                    return protocols.size() > other.protocols.size() ? -1 : 1;
                }
                for (int i = 0; i < protocols.size(); i++) {
                    int result = graph.compareProtocols(protocols.get(i), other.protocols.get(i));
                    if (result != 0) return result;
                }
                return name.compareTo(other.name);
            }
            case GENERIC_PARAM:
                if (depth != other.depth) return Integer.compare(depth, other.depth);
                return Integer.compare(index, other.index);
            case NAME:
            case LAYOUT:
                return name.compareTo(other.name);
            case SUPERCLASS:
            case CONCRETE_TYPE: {
                int result = name.compareTo(other.name);
                if (result != 0) return result;
                if (substitutions.size() != other.substitutions.size()) {
                    return Integer.compare(substitutions.size(), other.substitutions.size());
                }
                for (int i = 0; i < substitutions.size(); i++) {
                    result = substitutions.get(i).compare(other.substitutions.get(i), graph);
                    if (result != 0) return result;
                }
                return 0;
            }
            default:
                throw RequirementMachineException.of(ILLEGAL_STATE);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol that = (Symbol) o;
        return hash == that.hash && kind == that.kind && depth == that.depth && index == that.index &&
                Objects.equals(name, that.name) && protocols.equals(that.protocols) &&
                substitutions.equals(that.substitutions);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        switch (kind) {
            case PROTOCOL:
                return "[" + protocols.get(0) + "]";
            case ASSOCIATED_TYPE:
                return "[" + String.join("&", protocols) + ":" + name + "]";
            case GENERIC_PARAM:
                return "τ_" + depth + "_" + index;
            case NAME:
                return name;
            case LAYOUT:
                return "[layout: " + name + "]";
            case SUPERCLASS:
                return "[superclass: " + name + substitutionsToString() + "]";
            case CONCRETE_TYPE:
                return "[concrete: " + name + substitutionsToString() + "]";
            default:
                throw RequirementMachineException.of(ILLEGAL_STATE);
        }
    }

    private String substitutionsToString() {
        if (substitutions.isEmpty()) return "";
        StringBuilder builder = new StringBuilder(" with <");
        for (int i = 0; i < substitutions.size(); i++) {
            if (i > 0) builder.append(", ");
            builder.append(substitutions.get(i));
        }
        return builder.append(">").toString();
    }
}
