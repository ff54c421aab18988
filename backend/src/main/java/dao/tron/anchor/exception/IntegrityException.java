package dao.tron.anchor.exception;

/**
 * Unexpected constraint violation or illegal state transition. The operation is
 * aborted; the process keeps running.
 */
public class IntegrityException extends AnchorException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
