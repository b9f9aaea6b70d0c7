/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.rewrite;

import com.vaticle.requirement.term.MutableTerm;
import com.vaticle.requirement.term.Term;

/**
 * A rewrite path that takes its basepoint back to itself. Each one witnesses that some rule
 * is derivable from the others; generic signature minimization consumes them.
 */
public class HomotopyGenerator {

    private final Term basepoint;
    private final RewritePath path;

    HomotopyGenerator(Term basepoint, RewritePath path) {
        this.basepoint = basepoint;
        this.path = path;
    }

    public Term basepoint() {
        return basepoint;
    }

    public RewritePath path() {
        return path;
    }

    /**
     * Replays the path from the basepoint and returns the term it ends on.
     */
    public MutableTerm replay(RewriteSystem system) {
        MutableTerm term = new MutableTerm(basepoint);
        path.apply(term, system);
        return term;
    }

    public String toString(RewriteSystem system) {
        return basepoint + ": " + path.toString(new MutableTerm(basepoint), system);
    }

    @Override
    public String toString() {
        return basepoint + ": " + path;
    }
}
