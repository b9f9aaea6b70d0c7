/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.common.exception;

import java.util.HashMap;
import java.util.Map;

import static com.vaticle.requirement.common.exception.ErrorMessage.Internal.JAVA_ERROR;

public abstract class ErrorMessage {

    private static final Map<String, Map<Integer, ErrorMessage>> knownErrors = new HashMap<>();
    private static int maxCodeNumber = 0;
    private static int maxCodeDigits = 0;

    private final String codePrefix;
    private final int codeNumber;
    private final String messagePrefix;
    private final String messageBody;
    private String code = null;

    private ErrorMessage(String codePrefix, int codeNumber, String messagePrefix, String messageBody) {
        this.codePrefix = codePrefix;
        this.codeNumber = codeNumber;
        this.messagePrefix = messagePrefix;
        this.messageBody = messageBody;

        assert knownErrors.get(codePrefix) == null || knownErrors.get(codePrefix).get(codeNumber) == null;
        knownErrors.computeIfAbsent(codePrefix, prefix -> new HashMap<>()).put(codeNumber, this);
        maxCodeNumber = Math.max(codeNumber, maxCodeNumber);
        maxCodeDigits = (int) Math.ceil(Math.log10(maxCodeNumber + 1));
    }

    public static void loadConstants() {
        for (Class<?> innerClass : ErrorMessage.class.getDeclaredClasses()) {
            try {
                Class.forName(innerClass.getName(), true, innerClass.getClassLoader());
            } catch (ClassNotFoundException e) {
                throw RequirementMachineException.of(JAVA_ERROR, e);
            }
        }
    }

    public String code() {
        if (code != null) return code;
        StringBuilder zeros = new StringBuilder();
        for (int digits = (int) Math.ceil(Math.log10(codeNumber + 1)); digits < maxCodeDigits; digits++) {
            zeros.append("0");
        }
        code = codePrefix + zeros + codeNumber;
        return code;
    }

    public String message(Object... parameters) {
        return String.format(toString(), parameters);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", code(), messagePrefix, messageBody);
    }

    public static class Internal extends ErrorMessage {
        public static final Internal ILLEGAL_STATE =
                new Internal(1, "Illegal internal state!");
        public static final Internal ILLEGAL_ARGUMENT =
                new Internal(2, "Illegal argument provided: '%s'.");
        public static final Internal JAVA_ERROR =
                new Internal(3, "Received Java error:\n%s");

        private static final String codePrefix = "INT";
        private static final String messagePrefix = "Invalid Internal State";

        Internal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Term extends ErrorMessage {
        public static final Term EMPTY_TERM =
                new Term(1, "A non-empty term was expected.");
        public static final Term ILLEGAL_SYMBOL_ACCESS =
                new Term(2, "The symbol '%s' of kind '%s' does not carry a '%s'.");
        public static final Term INVALID_ASSOCIATED_TYPE_MERGE =
                new Term(3, "The associated type symbols '%s' and '%s' cannot be merged.");
        public static final Term PROTOCOL_INHERITANCE_CYCLE =
                new Term(4, "The protocol '%s' inherits from itself.");
        public static final Term UNKNOWN_PROTOCOL =
                new Term(5, "The protocol '%s' is not part of the protocol graph.");
        public static final Term TERM_INDEX_OUT_OF_BOUNDS =
                new Term(6, "The range [%s, %s) is out of bounds for a term of length %s.");

        private static final String codePrefix = "TRM";
        private static final String messagePrefix = "Invalid Term Operation";

        Term(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class RuleWrite extends ErrorMessage {
        public static final RuleWrite RULE_NOT_ORIENTED =
                new RuleWrite(1, "The rule '%s => %s' is not oriented: the left hand side must be greater than the right hand side.");
        public static final RuleWrite RULE_ALREADY_DELETED =
                new RuleWrite(2, "The rule '%s' has already been deleted.");
        public static final RuleWrite DUPLICATE_RULE =
                new RuleWrite(3, "The rule '%s' duplicates the left hand side of the live rule '%s'.");
        public static final RuleWrite RULE_TABLE_OVERFLOW =
                new RuleWrite(4, "The rule table cannot hold more than '%s' rules.");

        private static final String codePrefix = "RLW";
        private static final String messagePrefix = "Invalid Rule Write";

        RuleWrite(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Rewrite extends ErrorMessage {
        public static final Rewrite SYSTEM_ALREADY_INITIALISED =
                new Rewrite(1, "The rewrite system has already been initialised.");
        public static final Rewrite SYSTEM_NOT_INITIALISED =
                new Rewrite(2, "The rewrite system has not been initialised.");
        public static final Rewrite INVALID_REWRITE_STEP =
                new Rewrite(3, "Cannot apply '%s' to '%s': expected '%s' at offset '%s'.");
        public static final Rewrite INVALID_ADJUSTMENT =
                new Rewrite(4, "Cannot adjust the substitutions of '%s' by the prefix '%s'.");
        public static final Rewrite STEP_OFFSET_OVERFLOW =
                new Rewrite(5, "The rewrite step offset '%s' exceeds the maximum of '%s'.");
        public static final Rewrite STEP_RULE_ID_OVERFLOW =
                new Rewrite(6, "The rewrite step rule id '%s' exceeds the maximum of '%s'.");
        public static final Rewrite UNKNOWN_RULE_ID =
                new Rewrite(7, "There is no rule with id '%s'.");
        public static final Rewrite INVALID_COMPLETION_LIMIT =
                new Rewrite(8, "The completion limit '%s' must be at least 1, but was '%s'.");

        private static final String codePrefix = "RWS";
        private static final String messagePrefix = "Invalid Rewrite Operation";

        Rewrite(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Verification extends ErrorMessage {
        public static final Verification RULE_NOT_DECREASING =
                new Verification(1, "The rule '%s' does not decrease under the term order.");
        public static final Verification RULE_SYMBOL_MISPLACED =
                new Verification(2, "The rule '%s' contains the symbol '%s' at an illegal position '%s'.");
        public static final Verification RULE_DOMAIN_MISMATCH =
                new Verification(3, "The two sides of the rule '%s' are rooted in different protocols: '%s' and '%s'.");
        public static final Verification RULE_NOT_INDEXED =
                new Verification(4, "The rule '%s' with id '%s' is not reachable through the rule index.");
        public static final Verification HOMOTOPY_GENERATOR_NOT_A_LOOP =
                new Verification(5, "The homotopy generator at '%s' rewrites its basepoint to '%s'.");

        private static final String codePrefix = "VRF";
        private static final String messagePrefix = "Rewrite System Verification Failure";

        Verification(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }
}
