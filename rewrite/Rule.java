/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.rewrite;

import com.vaticle.requirement.common.exception.RequirementMachineException;
import com.vaticle.requirement.term.ProtocolGraph;
import com.vaticle.requirement.term.Term;

import static com.vaticle.requirement.common.exception.ErrorMessage.RuleWrite.RULE_ALREADY_DELETED;
import static com.vaticle.requirement.common.exception.ErrorMessage.RuleWrite.RULE_NOT_ORIENTED;

/**
 * A rewrite rule that replaces occurrences of its left hand side with its right hand side.
 * The left hand side is always greater than the right hand side in the linear order over
 * terms, so every application strictly decreases the term it rewrites.
 */
public class Rule {

    private final Term lhs;
    private final Term rhs;
    private boolean deleted;

    private Rule(Term lhs, Term rhs) {
        this.lhs = lhs;
        this.rhs = rhs;
        this.deleted = false;
    }

    public static Rule of(Term lhs, Term rhs, ProtocolGraph protocols) {
        if (lhs.compare(rhs, protocols) <= 0) throw RequirementMachineException.of(RULE_NOT_ORIENTED, lhs, rhs);
        return new Rule(lhs, rhs);
    }

    public Term lhs() {
        return lhs;
    }

    public Term rhs() {
        return rhs;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * Removes the rule from consideration in simplification and completion. The rule stays in
     * the rule table so that rule ids recorded in rewrite paths remain valid.
     */
    public void markDeleted() {
        if (deleted) throw RequirementMachineException.of(RULE_ALREADY_DELETED, this);
        deleted = true;
    }

    public int depth() {
        return lhs.size();
    }

    @Override
    public String toString() {
        return lhs + " => " + rhs + (deleted ? " [deleted]" : "");
    }
}
