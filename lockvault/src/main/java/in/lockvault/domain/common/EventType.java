package in.lockvault.domain.common;

/**
 * Event types appended to the vault event log.
 */
public enum EventType {
    // Ledger
    DEPOSITED,
    WITHDRAWN,

    // Roles
    ROLE_GRANTED,
    TEMP_ROLE_GRANTED,
    TEMP_ROLE_REFRESHED,
    TEMP_ROLE_EXPIRED,

    // Expiry trigger
    SWEEP_COMPLETED,

    // Admin
    OWNERSHIP_TRANSFERRED
}
