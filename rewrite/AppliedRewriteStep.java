/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.rewrite;

import com.vaticle.requirement.term.MutableTerm;
import com.vaticle.requirement.term.Term;

/**
 * The context of one rule application: the term was {@code prefix.lhs.suffix} before the
 * step and is {@code prefix.rhs.suffix} after it.
 */
public class AppliedRewriteStep {

    private final Term lhs;
    private final Term rhs;
    private final MutableTerm prefix;
    private final MutableTerm suffix;

    AppliedRewriteStep(Term lhs, Term rhs, MutableTerm prefix, MutableTerm suffix) {
        this.lhs = lhs;
        this.rhs = rhs;
        this.prefix = prefix;
        this.suffix = suffix;
    }

    public Term lhs() {
        return lhs;
    }

    public Term rhs() {
        return rhs;
    }

    public MutableTerm prefix() {
        return prefix;
    }

    public MutableTerm suffix() {
        return suffix;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (!prefix.isEmpty()) builder.append(prefix).append(".");
        builder.append("(").append(lhs).append(" => ").append(rhs).append(")");
        if (!suffix.isEmpty()) builder.append(".").append(suffix);
        return builder.toString();
    }
}
