package dao.tron.anchor.model;

/**
 * Ledger submission state of a batch.
 *
 * Moves forward only: UNSUBMITTED -> SUBMITTED -> CONFIRMED. FAILED can be entered
 * from UNSUBMITTED or SUBMITTED and left only back to UNSUBMITTED for a retry.
 */
public enum BatchStatus {
    UNSUBMITTED,
    SUBMITTED,
    CONFIRMED,
    FAILED;

    public boolean canTransitionTo(BatchStatus next) {
        return switch (this) {
            case UNSUBMITTED -> next == SUBMITTED || next == FAILED;
            case SUBMITTED -> next == CONFIRMED || next == FAILED;
            case CONFIRMED -> false;
            case FAILED -> next == UNSUBMITTED;
        };
    }
}
