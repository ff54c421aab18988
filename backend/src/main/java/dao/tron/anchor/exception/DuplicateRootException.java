package dao.tron.anchor.exception;

/**
 * A new batch hashed to a root that is already stored for a different batch.
 */
public class DuplicateRootException extends IntegrityException {

    public DuplicateRootException(String message) {
        super(message);
    }

    public DuplicateRootException(String message, Throwable cause) {
        super(message, cause);
    }
}
