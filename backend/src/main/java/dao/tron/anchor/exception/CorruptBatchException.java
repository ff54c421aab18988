package dao.tron.anchor.exception;

/**
 * A stored member list no longer hashes to its batch root.
 */
public class CorruptBatchException extends IntegrityException {

    public CorruptBatchException(String message) {
        super(message);
    }

    public CorruptBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
