package in.lockvault.domain.exception;

/**
 * The backing store failed. The surrounding transaction has been rolled back.
 */
public class VaultStorageException extends RuntimeException {

    public VaultStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
