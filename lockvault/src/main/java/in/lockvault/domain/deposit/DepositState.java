package in.lockvault.domain.deposit;

/**
 * Cached lock state of a deposit record.
 * LOCKED advances to UNLOCKED lazily, the first time the record is touched at or after its lockUntil.
 */
public enum DepositState {
    LOCKED,
    UNLOCKED
}
