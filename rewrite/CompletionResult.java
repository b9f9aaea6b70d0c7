/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.rewrite;

public enum CompletionResult {

    /**
     * Confluent completion was computed successfully.
     */
    SUCCESS,

    /**
     * The maximum number of completion rounds was reached. The rule set is usable, but is not
     * known to be confluent.
     */
    MAX_ITERATIONS,

    /**
     * Completion produced a rule whose left hand side is longer than the limit. The rule set is
     * usable, but is not known to be confluent.
     */
    MAX_DEPTH;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
