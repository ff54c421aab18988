package dao.tron.anchor.exception;

public class BatchNotFoundException extends AnchorException {

    public BatchNotFoundException(String message) {
        super(message);
    }

    public BatchNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
