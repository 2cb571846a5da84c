package de.bsommerfeld.storygraph.db;

/**
 * Thrown when the underlying store fails to execute an operation, e.g. an
 * I/O or SQL error. Never used for missing rows; those are reported as
 * {@code null} or zero affected rows.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
