/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.rewrite.property;

import com.vaticle.requirement.common.collection.Pair;
import com.vaticle.requirement.term.MutableTerm;
import com.vaticle.requirement.term.Symbol;
import com.vaticle.requirement.term.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Properties of canonical type terms, read off the rules of the form {@code T.[p] => T} of a
 * completed rewrite system.
 */
public class PropertyMap {

    private static final Logger LOG = LoggerFactory.getLogger(PropertyMap.class);

    private final Map<Term, Entry> entries;

    public PropertyMap() {
        this.entries = new LinkedHashMap<>();
    }

    public void clear() {
        entries.clear();
    }

    public Optional<Entry> lookup(Term key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Collection<Entry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    /**
     * Records {@code property} on {@code key}. Two superclass or concrete type properties with
     * the same type constructor unify: a rule equating each pair of differing substitutions is
     * added to {@code inducedRules}.
     */
    public void addProperty(Term key, Symbol property, List<Pair<MutableTerm, MutableTerm>> inducedRules) {
        assert property.isProperty();
        Entry entry = entries.computeIfAbsent(key, Entry::new);
        switch (property.kind()) {
            case PROTOCOL:
                entry.conformsTo.add(property.protocol());
                break;
            case LAYOUT:
                if (entry.layout == null) entry.layout = property;
                else if (!entry.layout.equals(property)) entry.addConflict(property);
                break;
            case SUPERCLASS:
                if (entry.superclass == null) entry.superclass = property;
                else unify(entry, entry.superclass, property, inducedRules);
                break;
            case CONCRETE_TYPE:
                if (entry.concreteType == null) entry.concreteType = property;
                else unify(entry, entry.concreteType, property, inducedRules);
                break;
            default:
                assert false;
        }
    }

    private static void unify(Entry entry, Symbol existing, Symbol property,
                              List<Pair<MutableTerm, MutableTerm>> inducedRules) {
        if (existing.equals(property)) return;
        if (!existing.name().equals(property.name()) ||
                existing.substitutions().size() != property.substitutions().size()) {
            entry.addConflict(property);
            return;
        }
        for (int i = 0; i < existing.substitutions().size(); i++) {
            Term first = existing.substitutions().get(i);
            Term second = property.substitutions().get(i);
            if (first.equals(second) || first.isEmpty() || second.isEmpty()) continue;
            inducedRules.add(new Pair<>(new MutableTerm(first), new MutableTerm(second)));
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        entries.values().forEach(entry -> builder.append(entry).append("\n"));
        return builder.toString();
    }

    public static class Entry {

        private final Term key;
        private final Set<String> conformsTo;
        private final List<Symbol> conflicts;
        @Nullable
        private Symbol layout;
        @Nullable
        private Symbol superclass;
        @Nullable
        private Symbol concreteType;

        private Entry(Term key) {
            this.key = key;
            this.conformsTo = new LinkedHashSet<>();
            this.conflicts = new ArrayList<>();
        }

        private void addConflict(Symbol property) {
            LOG.debug("Conflicting property {} on {}", property, key);
            conflicts.add(property);
        }

        public Term key() {
            return key;
        }

        public Set<String> conformsTo() {
            return Collections.unmodifiableSet(conformsTo);
        }

        public Optional<Symbol> layout() {
            return Optional.ofNullable(layout);
        }

        public Optional<Symbol> superclass() {
            return Optional.ofNullable(superclass);
        }

        public Optional<Symbol> concreteType() {
            return Optional.ofNullable(concreteType);
        }

        public List<Symbol> conflicts() {
            return Collections.unmodifiableList(conflicts);
        }

        public boolean hasConflicts() {
            return !conflicts.isEmpty();
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder(key.toString()).append(" => {");
            if (!conformsTo.isEmpty()) builder.append(" conforms_to: [").append(String.join(", ", conformsTo)).append("]");
            if (layout != null) builder.append(" layout: ").append(layout);
            if (superclass != null) builder.append(" superclass: ").append(superclass);
            if (concreteType != null) builder.append(" concrete_type: ").append(concreteType);
            if (!conflicts.isEmpty()) builder.append(" conflicts: ").append(conflicts);
            return builder.append(" }").toString();
        }
    }
}
