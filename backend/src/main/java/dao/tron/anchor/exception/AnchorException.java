package dao.tron.anchor.exception;

/**
 * Base type for every failure raised by the anchoring engine.
 */
public class AnchorException extends RuntimeException {

    public AnchorException(String message) {
        super(message);
    }

    public AnchorException(String message, Throwable cause) {
        super(message, cause);
    }
}
