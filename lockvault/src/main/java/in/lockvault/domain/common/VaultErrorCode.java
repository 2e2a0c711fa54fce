package in.lockvault.domain.common;

/**
 * Failure codes reported by vault operations.
 */
public enum VaultErrorCode {
    // Input validation
    ZERO_AMOUNT(Kind.VALIDATION),
    INVALID_LOCK_PERIOD(Kind.VALIDATION),
    INVALID_INDEX(Kind.VALIDATION),
    INVALID_ACCOUNT(Kind.VALIDATION),

    // State conflicts
    LOCK_NOT_EXPIRED(Kind.STATE_CONFLICT),
    ALREADY_WITHDRAWN(Kind.STATE_CONFLICT),

    // Authorization
    NOT_OWNER(Kind.AUTHORIZATION),

    // External effects
    TRANSFER_FAILED(Kind.EXTERNAL);

    private final Kind kind;

    VaultErrorCode(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public enum Kind {
        VALIDATION,
        STATE_CONFLICT,
        AUTHORIZATION,
        EXTERNAL
    }
}
