package in.lockvault.domain.deposit;

import in.lockvault.domain.common.VaultErrorCode;
import in.lockvault.domain.exception.VaultException;

import java.time.Duration;

/**
 * The three lock durations a deposit may choose.
 *
 * Matching is exact: a duration one second off any of these is rejected.
 */
public enum LockPeriod {
    SHORT(Duration.ofDays(180)),
    MEDIUM(Duration.ofDays(365)),
    LONG(Duration.ofDays(5 * 365));

    private final Duration duration;

    LockPeriod(Duration duration) {
        this.duration = duration;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Resolve a requested duration to its lock period.
     *
     * @throws VaultException INVALID_LOCK_PERIOD if the duration is null or not one of the three
     */
    public static LockPeriod fromDuration(Duration requested) {
        if (requested != null) {
            for (LockPeriod period : values()) {
                if (period.duration.equals(requested)) {
                    return period;
                }
            }
        }
        throw new VaultException(VaultErrorCode.INVALID_LOCK_PERIOD,
            "Lock period must be exactly 180, 365 or 1825 days, got " + requested);
    }
}
