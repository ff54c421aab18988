package dao.tron.anchor.exception;

/**
 * Ledger submission or query failed. Always treated as transient.
 */
public class LedgerUnavailableException extends AnchorException {

    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
