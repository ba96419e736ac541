package com.skanga.wpdb.db;

/**
 * Result of checking a caller-supplied SQL string against the read-only policy.
 *
 * @param approved true when the statement may be executed
 * @param reason The rule that rejected the statement, null when approved
 * @param message Human-readable rejection message, null when approved
 */
public record ValidationOutcome(boolean approved, RejectionReason reason, String message) {
    private static final ValidationOutcome APPROVED = new ValidationOutcome(true, null, null);

    public enum RejectionReason {
        MULTIPLE_STATEMENTS("multiple-statements"),
        DISALLOWED_VERB("disallowed-verb"),
        DISALLOWED_KEYWORD("disallowed-keyword"),
        SYSTEM_SCHEMA_ACCESS("system-schema-access");

        private final String code;

        RejectionReason(String code) {
            this.code = code;
        }

        /** Stable, caller-facing name of the rule. */
        public String code() {
            return code;
        }
    }

    public static ValidationOutcome accept() {
        return APPROVED;
    }

    public static ValidationOutcome rejected(RejectionReason reason, String message) {
        return new ValidationOutcome(false, reason, message);
    }
}
