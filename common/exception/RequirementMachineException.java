/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.common.exception;

import java.util.Objects;

/**
 * Raised when an internal invariant of the rewrite system is violated. These are programming
 * errors in completion or in its caller and are never recovered from.
 */
public class RequirementMachineException extends RuntimeException {

    private final ErrorMessage error;

    private RequirementMachineException(ErrorMessage error, Throwable cause) {
        super(error.message(cause), cause);
        assert !getMessage().contains("%s");
        this.error = error;
    }

    private RequirementMachineException(ErrorMessage error, Object... parameters) {
        super(error.message(parameters));
        assert !getMessage().contains("%s");
        this.error = error;
    }

    public static RequirementMachineException of(ErrorMessage errorMessage, Throwable cause) {
        return new RequirementMachineException(errorMessage, cause);
    }

    public static RequirementMachineException of(ErrorMessage errorMessage, Object... parameters) {
        return new RequirementMachineException(errorMessage, parameters);
    }

    public ErrorMessage errorMessage() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequirementMachineException that = (RequirementMachineException) o;
        return error.equals(that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(error);
    }
}
