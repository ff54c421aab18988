package dao.tron.anchor.exception;

/**
 * A confirmed batch was confirmed again with a different height or time.
 */
public class ConflictingConfirmationException extends IntegrityException {

    public ConflictingConfirmationException(String message) {
        super(message);
    }

    public ConflictingConfirmationException(String message, Throwable cause) {
        super(message, cause);
    }
}
