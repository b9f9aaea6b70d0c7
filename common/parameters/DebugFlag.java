/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.common.parameters;

/**
 * Selects which parts of the rewrite system emit debug logging.
 */
public enum DebugFlag {
    SIMPLIFY,
    ADD,
    MERGE,
    COMPLETION,
    PROPERTY_MAP
}
