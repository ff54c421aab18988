package dao.tron.anchor.model;

/**
 * Ledger view of an anchor transaction. Height and timestamp (unix seconds) are
 * only meaningful when confirmed.
 */
public record LedgerConfirmation(boolean confirmed, long height, long timestamp) {

    public static LedgerConfirmation unconfirmed() {
        return new LedgerConfirmation(false, 0L, 0L);
    }

    public static LedgerConfirmation confirmed(long height, long timestamp) {
        return new LedgerConfirmation(true, height, timestamp);
    }
}
