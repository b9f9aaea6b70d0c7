/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.common.test;

import com.vaticle.requirement.common.exception.ErrorMessage;
import com.vaticle.requirement.common.exception.RequirementMachineException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class Util {

    public static void assertThrowsRequirementMachineException(Runnable function, ErrorMessage error) {
        assertThrowsRequirementMachineException(function, error.code());
    }

    public static void assertThrowsRequirementMachineException(Runnable function, String errorCode) {
        try {
            function.run();
            fail();
        } catch (RequirementMachineException e) {
            assertEquals(errorCode, e.errorMessage().code());
        }
    }

    public static void assertNotThrows(Runnable function) {
        try {
            function.run();
        } catch (Exception e) {
            // fail but we want to see the exception
            throw e;
        }
    }
}
