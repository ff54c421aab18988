package dao.tron.anchor.fsck;

public enum FindingType {
    /** Stored members no longer hash to the batch root. */
    CORRUPT_BATCH(true),
    /** A batch member is missing from the digest table or points at another batch. */
    MEMBERSHIP_MISMATCH(true),
    /** Pending for far longer than the flush period. */
    STUCK_DIGEST(true),
    /** Submitted longer ago than the resubmit timeout and still unconfirmed. */
    OVERDUE_CONFIRMATION(true),
    /** The ledger disagrees with a stored confirmation. */
    CONFIRMATION_MISMATCH(true),
    /** A submitted batch was found confirmed and advanced. */
    CONFIRMATION_ADVANCED(false),
    /** The ledger could not be queried for a submitted batch. */
    LEDGER_UNREACHABLE(false);

    private final boolean anomaly;

    FindingType(boolean anomaly) {
        this.anomaly = anomaly;
    }

    public boolean isAnomaly() {
        return anomaly;
    }
}
