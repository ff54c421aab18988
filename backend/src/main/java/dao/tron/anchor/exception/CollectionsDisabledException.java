package dao.tron.anchor.exception;

/**
 * Collection queries were requested while {@code anchor.enable-collections} is off.
 */
public class CollectionsDisabledException extends AnchorException {

    public CollectionsDisabledException(String message) {
        super(message);
    }

    public CollectionsDisabledException(String message, Throwable cause) {
        super(message, cause);
    }
}
