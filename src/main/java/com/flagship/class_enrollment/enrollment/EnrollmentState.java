package com.flagship.class_enrollment.enrollment;

/**
 * Steps of one enrollment attempt, in the order they run.
 *
 * Everything from PRICING through COMMITTING happens in a single database
 * transaction. A step that has nothing to do (no promotion, no credit, a free
 * purchase) is still entered so the visited list always reads the same way.
 */
public enum EnrollmentState {
    /** Request checks before any transaction opens. */
    VALIDATING,

    PRICING,

    APPLYING_PROMOTION,

    APPLYING_CREDIT,

    APPLYING_REFERRAL,

    PERSISTING_ENROLLMENTS,

    /** External charge; once it succeeds, a rollback must reverse it. */
    CHARGING,

    PERSISTING_TRANSACTION,

    COMMITTING,

    /** After commit: the staged event is handed to the outbox publisher. */
    EMITTING_EVENT,

    /** Terminal. */
    COMPLETED,

    /** Terminal. Nothing written by the attempt is visible. */
    ROLLED_BACK;

    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK;
    }
}
