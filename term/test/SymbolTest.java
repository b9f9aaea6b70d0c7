/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.term.test;

import com.google.common.collect.ImmutableList;
import com.vaticle.requirement.term.MutableTerm;
import com.vaticle.requirement.term.ProtocolGraph;
import com.vaticle.requirement.term.RewriteContext;
import com.vaticle.requirement.term.Symbol;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.vaticle.requirement.common.exception.ErrorMessage.Term.ILLEGAL_SYMBOL_ACCESS;
import static com.vaticle.requirement.common.exception.ErrorMessage.Term.INVALID_ASSOCIATED_TYPE_MERGE;
import static com.vaticle.requirement.common.test.Util.assertThrowsRequirementMachineException;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class SymbolTest {

    private RewriteContext context;
    private ProtocolGraph graph;

    @Before
    public void setUp() {
        context = new RewriteContext();
        graph = ProtocolGraph.builder().protocol("P1").protocol("P2").protocol("Q", "P1").build();
    }

    @Test
    public void kinds_are_ordered_by_precedence() {
        List<Symbol> expected = Arrays.asList(
                context.protocol("P1"),
                context.associatedType("P1", "T"),
                context.genericParam(0, 0),
                context.name("A"),
                context.layout("AnyObject"),
                context.superclass("C", Collections.emptyList()),
                context.concreteType("Int", Collections.emptyList())
        );
        List<Symbol> shuffled = new ArrayList<>(expected);
        Collections.reverse(shuffled);
        shuffled.sort((first, second) -> first.compare(second, graph));
        assertEquals(expected, shuffled);
    }

    @Test
    public void deeper_protocols_come_first() {
        assertTrue(context.protocol("Q").compare(context.protocol("P1"), graph) < 0);
        assertTrue(context.protocol("P1").compare(context.protocol("P2"), graph) < 0);
    }

    @Test
    public void merged_associated_types_precede_their_components() {
        Symbol merged = context.associatedType(ImmutableList.of("P1", "P2"), "T");
        assertTrue(merged.compare(context.associatedType("P1", "T"), graph) < 0);
        assertTrue(merged.compare(context.associatedType("P2", "T"), graph) < 0);
    }

    @Test
    public void associated_types_compare_protocols_before_names() {
        Symbol p1U = context.associatedType("P1", "U");
        Symbol p2T = context.associatedType("P2", "T");
        assertTrue(p1U.compare(p2T, graph) < 0);
        assertTrue(context.associatedType("P1", "T").compare(p1U, graph) < 0);
    }

    @Test
    public void generic_params_compare_depth_then_index() {
        assertTrue(context.genericParam(0, 1).compare(context.genericParam(1, 0), graph) < 0);
        assertTrue(context.genericParam(1, 0).compare(context.genericParam(1, 1), graph) < 0);
    }

    @Test
    public void symbols_are_interned() {
        assertSame(context.name("A"), context.name("A"));
        assertSame(context.associatedType("P1", "T"), context.associatedType(ImmutableList.of("P1"), "T"));
        assertSame(context.concreteType("Array", ImmutableList.of(context.term(context.name("A")))),
                   context.concreteType("Array", ImmutableList.of(context.term(context.name("A")))));
    }

    @Test
    public void symbols_render_by_kind() {
        assertEquals("[P1]", context.protocol("P1").toString());
        assertEquals("[P1&P2:T]", context.associatedType(ImmutableList.of("P1", "P2"), "T").toString());
        assertEquals("τ_0_1", context.genericParam(0, 1).toString());
        assertEquals("[layout: AnyObject]", context.layout("AnyObject").toString());
        assertEquals("[concrete: Array with <τ_0_0>]",
                     context.concreteType("Array", ImmutableList.of(context.term(context.genericParam(0, 0)))).toString());
    }

    @Test
    public void accessing_a_field_the_kind_does_not_carry_throws() {
        assertThrowsRequirementMachineException(() -> context.protocol("P1").name(), ILLEGAL_SYMBOL_ACCESS);
        assertThrowsRequirementMachineException(() -> context.name("A").depth(), ILLEGAL_SYMBOL_ACCESS);
        assertThrowsRequirementMachineException(() -> context.layout("L").substitutions(), ILLEGAL_SYMBOL_ACCESS);
    }

    @Test
    public void prefix_is_prepended_to_every_substitution() {
        Symbol concrete = context.concreteType("Pair", ImmutableList.of(
                context.term(context.name("A")), context.term(context.name("B"))));
        Symbol adjusted = concrete.prependPrefixToSubstitutions(
                MutableTerm.of(context.genericParam(0, 0)), context);
        assertEquals("[concrete: Pair with <τ_0_0.A, τ_0_0.B>]", adjusted.toString());
    }

    @Test
    public void merging_drops_inherited_protocols_and_sorts() {
        Symbol merged = context.mergeAssociatedTypes(context.associatedType("P2", "T"), context.associatedType("P1", "T"), graph);
        assertEquals(ImmutableList.of("P1", "P2"), merged.protocols());

        Symbol implied = context.mergeAssociatedTypes(context.associatedType("P1", "T"), context.associatedType("Q", "T"), graph);
        assertEquals(ImmutableList.of("Q"), implied.protocols());
    }

    @Test
    public void merging_differently_named_associated_types_throws() {
        assertThrowsRequirementMachineException(
                () -> context.mergeAssociatedTypes(context.associatedType("P1", "T"), context.associatedType("P2", "U"), graph),
                INVALID_ASSOCIATED_TYPE_MERGE
        );
    }
}
