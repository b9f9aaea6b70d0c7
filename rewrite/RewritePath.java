/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.rewrite;

import com.vaticle.requirement.term.MutableTerm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A sequence of zero or more rewrite steps taking a source term to a target term.
 */
public class RewritePath implements Iterable<RewriteStep> {

    private final List<RewriteStep> steps;

    public RewritePath() {
        this.steps = new ArrayList<>(3);
    }

    public RewritePath(RewritePath other) {
        this.steps = new ArrayList<>(other.steps);
    }

    public static RewritePath of(RewriteStep... steps) {
        RewritePath path = new RewritePath();
        for (RewriteStep step : steps) path.add(step);
        return path;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    public List<RewriteStep> steps() {
        return Collections.unmodifiableList(steps);
    }

    public void add(RewriteStep step) {
        steps.add(step);
    }

    /**
     * Horizontal composition. Adjacent steps that cancel each other are kept.
     */
    public void append(RewritePath other) {
        steps.addAll(other.steps);
    }

    public void invert() {
        Collections.reverse(steps);
        steps.replaceAll(RewriteStep::inverse);
    }

    public RewritePath inverse() {
        RewritePath inverse = new RewritePath(this);
        inverse.invert();
        return inverse;
    }

    /**
     * Returns a copy with every adjacent pair of mutually inverse steps removed, repeatedly, so
     * that a path composed with its own inverse reduces to the empty path.
     */
    public RewritePath cancelInverses() {
        List<RewriteStep> stack = new ArrayList<>();
        for (RewriteStep step : steps) {
            if (!stack.isEmpty() && stack.get(stack.size() - 1).equals(step.inverse())) {
                stack.remove(stack.size() - 1);
            } else {
                stack.add(step);
            }
        }
        RewritePath cancelled = new RewritePath();
        cancelled.steps.addAll(stack);
        return cancelled;
    }

    /**
     * Replays every step against {@code term}, which ends up as the target of the path.
     */
    public void apply(MutableTerm term, RewriteSystem system) {
        for (RewriteStep step : steps) step.apply(term, system);
    }

    /**
     * Renders the path as replayed from {@code term}; the argument is left untouched.
     */
    public String toString(MutableTerm term, RewriteSystem system) {
        MutableTerm current = new MutableTerm(term);
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < steps.size(); i++) {
            if (i > 0) builder.append(" ⊗ ");
            builder.append(steps.get(i).toString(current, system));
        }
        return builder.toString();
    }

    @Override
    public Iterator<RewriteStep> iterator() {
        return steps().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return steps.equals(((RewritePath) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return steps.toString();
    }
}
