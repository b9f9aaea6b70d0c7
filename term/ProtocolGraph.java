/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.term;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.vaticle.requirement.common.exception.RequirementMachineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vaticle.requirement.common.exception.ErrorMessage.Term.PROTOCOL_INHERITANCE_CYCLE;
import static com.vaticle.requirement.common.exception.ErrorMessage.Term.UNKNOWN_PROTOCOL;

/**
 * The protocols transitively referenced by a set of requirements, with their inheritance
 * relation. Immutable once built; it fixes the linear order used to compare protocol and
 * associated type symbols.
 */
public class ProtocolGraph {

    private static final Logger LOG = LoggerFactory.getLogger(ProtocolGraph.class);

    private final Map<String, ProtocolInfo> info;
    private final List<String> linearOrder;

    private ProtocolGraph(Map<String, ProtocolInfo> info, List<String> linearOrder) {
        this.info = info;
        this.linearOrder = linearOrder;
    }

    public static ProtocolGraph empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> protocols() {
        return linearOrder;
    }

    public boolean contains(String protocol) {
        return info.containsKey(protocol);
    }

    public Set<String> inheritedProtocols(String protocol) {
        return info(protocol).allInherited;
    }

    /**
     * Whether {@code protocol} inherits, directly or transitively, from {@code other}.
     */
    public boolean inheritsFrom(String protocol, String other) {
        return info(protocol).allInherited.contains(other);
    }

    public int depth(String protocol) {
        return info(protocol).depth;
    }

    /**
     * Deeper protocols come first; protocols of equal depth are ordered by name.
     */
    public int compareProtocols(String first, String second) {
        return Integer.compare(info(first).index, info(second).index);
    }

    private ProtocolInfo info(String protocol) {
        ProtocolInfo protocolInfo = info.get(protocol);
        if (protocolInfo == null) throw RequirementMachineException.of(UNKNOWN_PROTOCOL, protocol);
        return protocolInfo;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (String protocol : linearOrder) {
            ProtocolInfo protocolInfo = info.get(protocol);
            builder.append(protocol).append(" (depth ").append(protocolInfo.depth).append(")");
            if (!protocolInfo.inherited.isEmpty()) builder.append(" : ").append(String.join(", ", protocolInfo.inherited));
            builder.append("\n");
        }
        return builder.toString();
    }

    private static class ProtocolInfo {

        private final Set<String> inherited;
        private Set<String> allInherited;
        private int depth;
        private int index;

        private ProtocolInfo(Set<String> inherited) {
            this.inherited = inherited;
        }
    }

    public static class Builder {

        private final Map<String, Set<String>> inheritance = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder protocol(String protocol, String... inherited) {
            Set<String> direct = inheritance.computeIfAbsent(protocol, p -> new LinkedHashSet<>());
            direct.addAll(Arrays.asList(inherited));
            for (String parent : inherited) inheritance.computeIfAbsent(parent, p -> new LinkedHashSet<>());
            return this;
        }

        public ProtocolGraph build() {
            Map<String, ProtocolInfo> info = new HashMap<>();
            inheritance.forEach((protocol, inherited) -> info.put(protocol, new ProtocolInfo(ImmutableSet.copyOf(inherited))));
            for (String protocol : inheritance.keySet()) computeClosure(protocol, info, new LinkedHashSet<>());

            List<String> order = new ArrayList<>(info.keySet());
            order.sort(Comparator.<String>comparingInt(protocol -> -info.get(protocol).depth).thenComparing(Comparator.naturalOrder()));
            for (int i = 0; i < order.size(); i++) info.get(order.get(i)).index = i;

            LOG.debug("Built protocol graph with linear order {}", order);
            return new ProtocolGraph(info, ImmutableList.copyOf(order));
        }

        private static void computeClosure(String protocol, Map<String, ProtocolInfo> info, Set<String> visiting) {
            ProtocolInfo protocolInfo = info.get(protocol);
            if (protocolInfo.allInherited != null) return;
            if (!visiting.add(protocol)) throw RequirementMachineException.of(PROTOCOL_INHERITANCE_CYCLE, protocol);

            Set<String> all = new LinkedHashSet<>();
            int depth = 0;
            for (String parent : protocolInfo.inherited) {
                computeClosure(parent, info, visiting);
                ProtocolInfo parentInfo = info.get(parent);
                all.add(parent);
                all.addAll(parentInfo.allInherited);
                depth = Math.max(depth, parentInfo.depth + 1);
            }
            visiting.remove(protocol);
            protocolInfo.allInherited = ImmutableSet.copyOf(all);
            protocolInfo.depth = depth;
        }
    }
}
