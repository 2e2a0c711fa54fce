package in.lockvault.infrastructure.metrics;

import in.lockvault.domain.common.VaultErrorCode;
import in.lockvault.domain.deposit.LockPeriod;
import in.lockvault.domain.role.Role;

import java.math.BigDecimal;

/**
 * Vault metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Deposits per lock period
 * - Withdrawal outcomes
 * - Locked total
 * - Roles granted and expired
 * - Expiry backlog seen by the last probe
 */
public interface VaultMetrics {

    void recordDeposit(LockPeriod lockPeriod, BigDecimal amount);

    void recordWithdrawal(BigDecimal amount);

    /**
     * Record a rejected call (validation, state conflict, failed payout).
     */
    void recordRejection(String operation, VaultErrorCode code);

    void updateTotalLocked(BigDecimal totalLocked);

    void recordRoleGranted(Role role);

    /**
     * @param candidates accounts the probe reported as due
     */
    void recordProbe(int candidates);

    void recordSweep(int expired);

    /**
     * No-op implementation for wiring without a registry.
     */
    VaultMetrics NOOP = new VaultMetrics() {
        @Override public void recordDeposit(LockPeriod lockPeriod, BigDecimal amount) {}
        @Override public void recordWithdrawal(BigDecimal amount) {}
        @Override public void recordRejection(String operation, VaultErrorCode code) {}
        @Override public void updateTotalLocked(BigDecimal totalLocked) {}
        @Override public void recordRoleGranted(Role role) {}
        @Override public void recordProbe(int candidates) {}
        @Override public void recordSweep(int expired) {}
    };
}
