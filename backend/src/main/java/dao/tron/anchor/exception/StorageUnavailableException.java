package dao.tron.anchor.exception;

/**
 * The database could not be reached or the transaction could not be started.
 * Callers retry with backoff.
 */
public class StorageUnavailableException extends AnchorException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
