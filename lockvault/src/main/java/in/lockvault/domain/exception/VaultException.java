package in.lockvault.domain.exception;

import in.lockvault.domain.common.VaultErrorCode;

/**
 * A vault operation was rejected. The call made no change.
 */
public class VaultException extends RuntimeException {

    private final VaultErrorCode code;

    public VaultException(VaultErrorCode code, String message) {
        super(String.format("[%s] %s", code.name(), message));
        this.code = code;
    }

    public VaultException(VaultErrorCode code, String message, Throwable cause) {
        super(String.format("[%s] %s", code.name(), message), cause);
        this.code = code;
    }

    public VaultErrorCode getCode() {
        return code;
    }
}
