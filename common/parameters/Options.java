/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.common.parameters;

import com.vaticle.requirement.common.exception.RequirementMachineException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.INVALID_COMPLETION_LIMIT;

public abstract class Options<PARENT extends Options<?, ?>, SELF extends Options<?, ?>> {

    public static final int DEFAULT_MAX_ITERATIONS = 4000;
    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final boolean DEFAULT_VERIFY = false;

    private PARENT parent;
    private Integer maxIterations = null;
    private Integer maxDepth = null;
    private Boolean verify = null;
    private Set<DebugFlag> debug = null;

    abstract SELF getThis();

    public SELF parent(PARENT parent) {
        this.parent = parent;
        return getThis();
    }

    public int maxIterations() {
        if (maxIterations != null) return maxIterations;
        else if (parent != null) return parent.maxIterations();
        else return DEFAULT_MAX_ITERATIONS;
    }

    public SELF maxIterations(int maxIterations) {
        if (maxIterations < 1) throw RequirementMachineException.of(INVALID_COMPLETION_LIMIT, "maxIterations", maxIterations);
        this.maxIterations = maxIterations;
        return getThis();
    }

    public int maxDepth() {
        if (maxDepth != null) return maxDepth;
        else if (parent != null) return parent.maxDepth();
        else return DEFAULT_MAX_DEPTH;
    }

    public SELF maxDepth(int maxDepth) {
        if (maxDepth < 1) throw RequirementMachineException.of(INVALID_COMPLETION_LIMIT, "maxDepth", maxDepth);
        this.maxDepth = maxDepth;
        return getThis();
    }

    /**
     * Whether rules and homotopy generators are re-verified after every completion.
     */
    public boolean verify() {
        if (verify != null) return verify;
        else if (parent != null) return parent.verify();
        else return DEFAULT_VERIFY;
    }

    public SELF verify(boolean verify) {
        this.verify = verify;
        return getThis();
    }

    public boolean debug(DebugFlag flag) {
        if (debug != null) return debug.contains(flag);
        else if (parent != null) return parent.debug(flag);
        else return false;
    }

    public SELF debugFlags(DebugFlag... flags) {
        this.debug = EnumSet.noneOf(DebugFlag.class);
        this.debug.addAll(Arrays.asList(flags));
        return getThis();
    }

    public static class Machine extends Options<Options<?, ?>, Machine> {

        @Override
        Machine getThis() {
            return this;
        }
    }

    public static class Completion extends Options<Machine, Completion> {

        @Override
        Completion getThis() {
            return this;
        }
    }
}
