package in.lockvault.domain.deposit;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One slot in an account's append-only deposit list.
 *
 * Slots are never removed. A withdrawal zeroes the slot in place (amount 0, timestamps at the
 * epoch, UNLOCKED, withdrawn) so every index handed out earlier stays valid.
 */
public record DepositRecord(
    int index,
    BigDecimal amount,
    Instant createdAt,
    Instant lockUntil,
    DepositState state,
    boolean withdrawn
) {
    /**
     * New LOCKED record. The index is assigned by the store on append.
     */
    public static DepositRecord open(BigDecimal amount, Instant createdAt, LockPeriod lockPeriod) {
        return new DepositRecord(-1, amount, createdAt, createdAt.plus(lockPeriod.getDuration()),
                                 DepositState.LOCKED, false);
    }

    public DepositRecord withIndex(int newIndex) {
        return new DepositRecord(newIndex, amount, createdAt, lockUntil, state, withdrawn);
    }

    public boolean isLockExpiredAt(Instant now) {
        return !now.isBefore(lockUntil);
    }

    /**
     * Advance LOCKED to UNLOCKED if the lock has run out; otherwise return this record unchanged.
     */
    public DepositRecord advanceState(Instant now) {
        if (state == DepositState.LOCKED && isLockExpiredAt(now)) {
            return new DepositRecord(index, amount, createdAt, lockUntil, DepositState.UNLOCKED, withdrawn);
        }
        return this;
    }

    /**
     * Terminal zeroed slot.
     */
    public DepositRecord zeroed() {
        return new DepositRecord(index, BigDecimal.ZERO, Instant.EPOCH, Instant.EPOCH, DepositState.UNLOCKED, true);
    }

    /**
     * Still holding funds that cannot be withdrawn yet.
     */
    public boolean isActiveAt(Instant now) {
        return !withdrawn && !isLockExpiredAt(now);
    }
}
