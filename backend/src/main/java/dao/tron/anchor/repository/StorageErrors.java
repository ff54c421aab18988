package dao.tron.anchor.repository;

import dao.tron.anchor.exception.IntegrityException;
import dao.tron.anchor.exception.StorageUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.TransactionException;

import java.util.function.Supplier;

/**
 * Translates Spring data-access failures into the engine's error taxonomy.
 */
public final class StorageErrors {
    private StorageErrors() {}

    public static <T> T guard(String operation, Supplier<T> body) {
        try {
            return body.get();
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityException(operation + " violated a constraint: " + e.getMostSpecificCause().getMessage(), e);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException(operation + " failed: " + e.getMessage(), e);
        }
    }

    public static void run(String operation, Runnable body) {
        guard(operation, () -> {
            body.run();
            return null;
        });
    }
}
