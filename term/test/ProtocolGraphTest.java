/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.term.test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.vaticle.requirement.term.ProtocolGraph;
import org.junit.Test;

import static com.vaticle.requirement.common.exception.ErrorMessage.Term.PROTOCOL_INHERITANCE_CYCLE;
import static com.vaticle.requirement.common.exception.ErrorMessage.Term.UNKNOWN_PROTOCOL;
import static com.vaticle.requirement.common.test.Util.assertThrowsRequirementMachineException;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProtocolGraphTest {

    @Test
    public void inheritance_is_transitive() {
        ProtocolGraph graph = ProtocolGraph.builder()
                .protocol("Collection", "Sequence")
                .protocol("BidirectionalCollection", "Collection")
                .build();
        assertTrue(graph.inheritsFrom("BidirectionalCollection", "Sequence"));
        assertFalse(graph.inheritsFrom("Sequence", "Collection"));
        assertEquals(ImmutableSet.of("Collection", "Sequence"), graph.inheritedProtocols("BidirectionalCollection"));
        assertEquals(2, graph.depth("BidirectionalCollection"));
        assertEquals(0, graph.depth("Sequence"));
    }

    @Test
    public void linear_order_puts_deeper_protocols_first_then_sorts_by_name() {
        ProtocolGraph graph = ProtocolGraph.builder()
                .protocol("Zeta")
                .protocol("Beta", "Alpha")
                .protocol("Alpha")
                .build();
        assertEquals(ImmutableList.of("Beta", "Alpha", "Zeta"), graph.protocols());
        assertTrue(graph.compareProtocols("Beta", "Alpha") < 0);
        assertTrue(graph.compareProtocols("Alpha", "Zeta") < 0);
    }

    @Test
    public void cycles_are_rejected() {
        assertThrowsRequirementMachineException(
                () -> ProtocolGraph.builder().protocol("A", "B").protocol("B", "A").build(),
                PROTOCOL_INHERITANCE_CYCLE
        );
    }

    @Test
    public void unknown_protocols_are_rejected() {
        ProtocolGraph graph = ProtocolGraph.builder().protocol("A").build();
        assertFalse(graph.contains("B"));
        assertThrowsRequirementMachineException(() -> graph.compareProtocols("A", "B"), UNKNOWN_PROTOCOL);
    }
}
