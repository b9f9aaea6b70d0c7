/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.rewrite;

import com.vaticle.requirement.common.exception.RequirementMachineException;
import com.vaticle.requirement.term.MutableTerm;
import com.vaticle.requirement.term.RewriteContext;
import com.vaticle.requirement.term.Symbol;
import com.vaticle.requirement.term.Term;

import java.util.Objects;

import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.INVALID_ADJUSTMENT;
import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.INVALID_REWRITE_STEP;
import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.STEP_OFFSET_OVERFLOW;
import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.STEP_RULE_ID_OVERFLOW;

/**
 * Records one elementary edit of a term. Formally this is a whiskered, oriented rewrite rule:
 * given the rule {@code X => Y} and the term {@code A.X.B}, the application at offset 1
 * yields {@code A.Y.B}, written {@code A.(X => Y).B}. The inverse step goes from
 * {@code A.Y.B} back to {@code A.X.B}.
 */
public class RewriteStep {

    public static final int MAX_OFFSET = (1 << 15) - 1;
    public static final int MAX_RULE_ID = (1 << 15) - 1;

    public enum Kind {
        /**
         * Apply a rewrite rule at the stored offset.
         */
        APPLY_REWRITE_RULE,

        /**
         * Prepend the first {@code offset} symbols of the term to each substitution of its
         * last symbol, or strip them when inverse.
         */
        ADJUST_CONCRETE_TYPE
    }

    private final Kind kind;
    private final int offset;
    private final int ruleID;
    private final boolean inverse;

    private RewriteStep(Kind kind, int offset, int ruleID, boolean inverse) {
        if (offset < 0 || offset > MAX_OFFSET) throw RequirementMachineException.of(STEP_OFFSET_OVERFLOW, offset, MAX_OFFSET);
        if (ruleID < 0 || ruleID > MAX_RULE_ID) throw RequirementMachineException.of(STEP_RULE_ID_OVERFLOW, ruleID, MAX_RULE_ID);
        this.kind = kind;
        this.offset = offset;
        this.ruleID = ruleID;
        this.inverse = inverse;
    }

    public static RewriteStep forRewriteRule(int offset, int ruleID, boolean inverse) {
        return new RewriteStep(Kind.APPLY_REWRITE_RULE, offset, ruleID, inverse);
    }

    public static RewriteStep forAdjustment(int offset, boolean inverse) {
        return new RewriteStep(Kind.ADJUST_CONCRETE_TYPE, offset, 0, inverse);
    }

    public Kind kind() {
        return kind;
    }

    public int offset() {
        return offset;
    }

    public int ruleID() {
        return ruleID;
    }

    public boolean isInverse() {
        return inverse;
    }

    public RewriteStep inverse() {
        return new RewriteStep(kind, offset, ruleID, !inverse);
    }

    public void apply(MutableTerm term, RewriteSystem system) {
        switch (kind) {
            case APPLY_REWRITE_RULE:
                applyRewriteRule(term, system);
                break;
            case ADJUST_CONCRETE_TYPE:
                applyAdjustment(term, system);
                break;
        }
    }

    public AppliedRewriteStep applyRewriteRule(MutableTerm term, RewriteSystem system) {
        assert kind == Kind.APPLY_REWRITE_RULE;
        Rule rule = system.rule(ruleID);
        Term lhs = inverse ? rule.rhs() : rule.lhs();
        Term rhs = inverse ? rule.lhs() : rule.rhs();

        if (!term.containsAt(offset, lhs)) {
            throw RequirementMachineException.of(INVALID_REWRITE_STEP, rule, term, lhs, offset);
        }

        MutableTerm prefix = term.subTerm(0, offset);
        MutableTerm suffix = term.subTerm(offset + lhs.size(), term.size());
        term.rewriteSubTerm(offset, offset + lhs.size(), rhs);
        return new AppliedRewriteStep(lhs, rhs, prefix, suffix);
    }

    /**
     * Returns the prefix that was added to, or removed from, each substitution.
     */
    public MutableTerm applyAdjustment(MutableTerm term, RewriteSystem system) {
        assert kind == Kind.ADJUST_CONCRETE_TYPE;
        if (term.isEmpty() || offset > term.size() || !term.back().hasSubstitutions()) {
            throw RequirementMachineException.of(INVALID_ADJUSTMENT, term, offset);
        }

        RewriteContext context = system.context();
        MutableTerm prefix = term.subTerm(0, offset);
        Symbol adjusted;
        if (inverse) {
            adjusted = term.back().transformSubstitutions(substitution -> {
                MutableTerm mutable = new MutableTerm(substitution);
                if (!mutable.startsWith(prefix)) throw RequirementMachineException.of(INVALID_ADJUSTMENT, term, prefix);
                return context.term(mutable.subTerm(prefix.size(), mutable.size()));
            }, context);
        } else {
            adjusted = term.back().prependPrefixToSubstitutions(prefix, context);
        }
        term.setBack(adjusted);
        return prefix;
    }

    /**
     * Renders this step as applied to {@code term}, and advances {@code term} past it.
     */
    public String toString(MutableTerm term, RewriteSystem system) {
        switch (kind) {
            case APPLY_REWRITE_RULE:
                return applyRewriteRule(term, system).toString();
            case ADJUST_CONCRETE_TYPE: {
                MutableTerm prefix = applyAdjustment(term, system);
                return "(σ" + (inverse ? " - " : " + ") + prefix + ")";
            }
            default:
                return toString();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RewriteStep that = (RewriteStep) o;
        return kind == that.kind && offset == that.offset && ruleID == that.ruleID && inverse == that.inverse;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind.ordinal(), offset, ruleID, inverse);
    }

    @Override
    public String toString() {
        if (kind == Kind.ADJUST_CONCRETE_TYPE) return "adjust@" + offset + (inverse ? "⁻¹" : "");
        return "rule " + ruleID + "@" + offset + (inverse ? "⁻¹" : "");
    }
}
