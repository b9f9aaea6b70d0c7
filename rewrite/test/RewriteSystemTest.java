/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.rewrite.test;

import com.google.common.collect.ImmutableList;
import com.vaticle.requirement.common.collection.Pair;
import com.vaticle.requirement.rewrite.RewritePath;
import com.vaticle.requirement.rewrite.RewriteSystem;
import com.vaticle.requirement.rewrite.Rule;
import com.vaticle.requirement.term.MutableTerm;
import com.vaticle.requirement.term.ProtocolGraph;
import com.vaticle.requirement.term.RewriteContext;
import com.vaticle.requirement.term.Symbol;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.SYSTEM_ALREADY_INITIALISED;
import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.SYSTEM_NOT_INITIALISED;
import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.UNKNOWN_RULE_ID;
import static com.vaticle.requirement.common.exception.ErrorMessage.RuleWrite.RULE_ALREADY_DELETED;
import static com.vaticle.requirement.common.exception.ErrorMessage.RuleWrite.RULE_NOT_ORIENTED;
import static com.vaticle.requirement.common.exception.ErrorMessage.Term.EMPTY_TERM;
import static com.vaticle.requirement.common.test.Util.assertThrowsRequirementMachineException;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class RewriteSystemTest {

    private RewriteContext context;
    private RewriteSystem system;
    private Symbol a;
    private Symbol b;
    private Symbol c;
    private Symbol d;
    private Symbol e;

    @Before
    public void setUp() {
        context = new RewriteContext();
        system = new RewriteSystem(context);
        a = context.name("a");
        b = context.name("b");
        c = context.name("c");
        d = context.name("d");
        e = context.name("e");
    }

    private static Pair<MutableTerm, MutableTerm> rule(MutableTerm lhs, MutableTerm rhs) {
        return new Pair<>(lhs, rhs);
    }

    @Test
    public void initial_rules_are_oriented() {
        system.initialize(ImmutableList.of(rule(MutableTerm.of(c), MutableTerm.of(a, b))), ProtocolGraph.empty());
        Rule rule = system.rule(0);
        assertSame(context.term(a, b), rule.lhs());
        assertSame(context.term(c), rule.rhs());
        assertEquals(0, system.ruleID(rule));
    }

    @Test
    public void initializing_twice_throws() {
        system.initialize(Collections.emptyList(), ProtocolGraph.empty());
        assertThrowsRequirementMachineException(
                () -> system.initialize(Collections.emptyList(), ProtocolGraph.empty()), SYSTEM_ALREADY_INITIALISED
        );
    }

    @Test
    public void adding_rules_before_initializing_throws() {
        assertThrowsRequirementMachineException(
                () -> system.addRule(MutableTerm.of(a, b), MutableTerm.of(c)), SYSTEM_NOT_INITIALISED
        );
    }

    @Test
    public void empty_sides_are_rejected() {
        system.initialize(Collections.emptyList(), ProtocolGraph.empty());
        assertThrowsRequirementMachineException(() -> system.addRule(new MutableTerm(), MutableTerm.of(c)), EMPTY_TERM);
    }

    @Test
    public void rule_that_simplifies_to_identity_is_not_added() {
        system.initialize(ImmutableList.of(rule(MutableTerm.of(a, b), MutableTerm.of(c))), ProtocolGraph.empty());
        assertFalse(system.addRule(MutableTerm.of(a, b), MutableTerm.of(c)));
        assertFalse(system.addRule(MutableTerm.of(c), MutableTerm.of(a, b)));
        assertEquals(1, system.rules().size());
    }

    @Test
    public void add_rule_leaves_its_arguments_untouched() {
        system.initialize(ImmutableList.of(rule(MutableTerm.of(a, b), MutableTerm.of(c))), ProtocolGraph.empty());
        MutableTerm lhs = MutableTerm.of(a, b, d);
        assertTrue(system.addRule(lhs, MutableTerm.of(e)));
        assertEquals(MutableTerm.of(a, b, d), lhs);
        assertSame(context.term(c, d), system.rule(1).lhs());
    }

    @Test
    public void simplify_rewrites_to_normal_form() {
        system.initialize(ImmutableList.of(
                rule(MutableTerm.of(a, b), MutableTerm.of(c)),
                rule(MutableTerm.of(c, d), MutableTerm.of(e))
        ), ProtocolGraph.empty());

        MutableTerm term = MutableTerm.of(a, b, d);
        RewritePath path = new RewritePath();
        assertTrue(system.simplify(term, path));
        assertEquals(MutableTerm.of(e), term);
        assertEquals(2, path.size());

        MutableTerm replayed = MutableTerm.of(a, b, d);
        path.apply(replayed, system);
        assertEquals(term, replayed);
    }

    @Test
    public void simplify_is_idempotent() {
        system.initialize(ImmutableList.of(rule(MutableTerm.of(a, b), MutableTerm.of(c))), ProtocolGraph.empty());
        MutableTerm term = MutableTerm.of(d, a, b, a, b);
        assertTrue(system.simplify(term));
        assertEquals(MutableTerm.of(d, c, c), term);
        RewritePath path = new RewritePath();
        assertFalse(system.simplify(term, path));
        assertTrue(path.isEmpty());
    }

    @Test
    public void random_rules_are_oriented_and_simplification_is_idempotent() {
        Random random = new Random(42);
        Symbol[] alphabet = {a, b, c};
        ProtocolGraph graph = ProtocolGraph.empty();

        List<Pair<MutableTerm, MutableTerm>> initial = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            MutableTerm lhs = randomTerm(random, alphabet);
            MutableTerm rhs = randomTerm(random, alphabet);
            if (!lhs.equals(rhs)) initial.add(rule(lhs, rhs));
        }
        system.initialize(initial, graph);
        for (int i = 0; i < 20; i++) {
            MutableTerm lhs = randomTerm(random, alphabet);
            MutableTerm rhs = randomTerm(random, alphabet);
            if (!lhs.equals(rhs)) system.addRule(lhs, rhs);
        }

        for (Rule rule : system.rules()) {
            assertTrue(rule.toString(), rule.lhs().compare(rule.rhs(), graph) > 0);
        }

        for (int i = 0; i < 50; i++) {
            MutableTerm original = randomTerm(random, alphabet);
            MutableTerm term = new MutableTerm(original);
            RewritePath path = new RewritePath();
            system.simplify(term, path);

            MutableTerm again = new MutableTerm(term);
            assertFalse(system.simplify(again));
            assertEquals(term, again);

            MutableTerm replayed = new MutableTerm(original);
            path.apply(replayed, system);
            assertEquals(term, replayed);
        }
    }

    private static MutableTerm randomTerm(Random random, Symbol[] alphabet) {
        MutableTerm term = new MutableTerm();
        int length = 1 + random.nextInt(4);
        for (int i = 0; i < length; i++) term.add(alphabet[random.nextInt(alphabet.length)]);
        return term;
    }

    @Test
    public void deleted_rules_are_never_applied() {
        system.initialize(ImmutableList.of(rule(MutableTerm.of(a, b), MutableTerm.of(c))), ProtocolGraph.empty());
        system.rule(0).markDeleted();
        MutableTerm term = MutableTerm.of(a, b);
        assertFalse(system.simplify(term));
        assertEquals(MutableTerm.of(a, b), term);
        assertThrowsRequirementMachineException(() -> system.rule(0).markDeleted(), RULE_ALREADY_DELETED);
    }

    @Test
    public void deleted_rule_left_hand_side_can_be_reused() {
        system.initialize(ImmutableList.of(rule(MutableTerm.of(a, b), MutableTerm.of(c))), ProtocolGraph.empty());
        system.rule(0).markDeleted();
        assertTrue(system.addRule(MutableTerm.of(a, b), MutableTerm.of(d)));
        MutableTerm term = MutableTerm.of(a, b);
        system.simplify(term);
        assertEquals(MutableTerm.of(d), term);
    }

    @Test
    public void unknown_rule_ids_throw() {
        system.initialize(Collections.emptyList(), ProtocolGraph.empty());
        assertThrowsRequirementMachineException(() -> system.rule(3), UNKNOWN_RULE_ID);
    }

    @Test
    public void rules_must_be_oriented() {
        assertThrowsRequirementMachineException(
                () -> Rule.of(context.term(c), context.term(a, b), ProtocolGraph.empty()), RULE_NOT_ORIENTED
        );
    }

    @Test
    public void left_reducible_rules_are_replaced() {
        system.initialize(ImmutableList.of(
                rule(MutableTerm.of(a, b, c), MutableTerm.of(d)),
                rule(MutableTerm.of(b, c), MutableTerm.of(e))
        ), ProtocolGraph.empty());

        assertTrue(system.simplifyRewriteSystem());
        assertTrue(system.rule(0).isDeleted());
        assertFalse(system.rule(1).isDeleted());
        Rule replacement = system.rule(2);
        assertSame(context.term(a, e), replacement.lhs());
        assertSame(context.term(d), replacement.rhs());

        RewritePath derivation = system.derivation(2).get();
        MutableTerm term = new MutableTerm(replacement.lhs());
        derivation.apply(term, system);
        assertEquals(new MutableTerm(replacement.rhs()), term);
    }

    @Test
    public void right_hand_sides_are_reduced() {
        system.initialize(ImmutableList.of(
                rule(MutableTerm.of(a, b, c), MutableTerm.of(d, e)),
                rule(MutableTerm.of(d, e), MutableTerm.of(a))
        ), ProtocolGraph.empty());

        assertTrue(system.simplifyRewriteSystem());
        assertTrue(system.rule(0).isDeleted());
        assertSame(context.term(a, b, c), system.rule(2).lhs());
        assertSame(context.term(a), system.rule(2).rhs());
        assertFalse(system.simplifyRewriteSystem());

        MutableTerm term = MutableTerm.of(a, b, c);
        system.simplify(term);
        assertEquals(MutableTerm.of(a), term);
    }

    @Test
    public void dump_lists_rules_with_their_ids() {
        system.initialize(ImmutableList.of(rule(MutableTerm.of(a, b), MutableTerm.of(c))), ProtocolGraph.empty());
        system.rule(0).markDeleted();
        String dump = system.toString();
        assertTrue(dump.startsWith("Rewrite system: {"));
        assertTrue(dump.contains("[0] a.b => c [deleted]"));
    }
}
