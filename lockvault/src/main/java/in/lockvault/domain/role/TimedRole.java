package in.lockvault.domain.role;

import java.time.Duration;
import java.time.Instant;

/**
 * An account's temporary role instance.
 *
 * Created on the first qualifying deposit, refreshed on later activity, switched inactive by the
 * expiry sweep. Never deleted.
 */
public record TimedRole(
    String account,
    boolean active,
    Instant lastActive,
    Instant expiry
) {
    public static TimedRole activate(String account, Instant now, Duration window) {
        return new TimedRole(account, true, now, now.plus(window));
    }

    public TimedRole refresh(Instant now, Duration window) {
        return new TimedRole(account, active, now, now.plus(window));
    }

    public TimedRole deactivate() {
        return new TimedRole(account, false, lastActive, expiry);
    }

    /**
     * Active and past its expiry, i.e. due for the sweep.
     */
    public boolean isLapsedAt(Instant now) {
        return active && now.isAfter(expiry);
    }
}
