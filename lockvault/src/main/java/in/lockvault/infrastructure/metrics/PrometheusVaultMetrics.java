package in.lockvault.infrastructure.metrics;

import in.lockvault.domain.common.VaultErrorCode;
import in.lockvault.domain.deposit.LockPeriod;
import in.lockvault.domain.role.Role;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Prometheus implementation of VaultMetrics.
 *
 * Key Metrics:
 * - vault_deposits_total{lock_period} - Deposits recorded
 * - vault_deposited_amount_total{lock_period} - Currency deposited
 * - vault_withdrawals_total - Successful withdrawals
 * - vault_rejections_total{operation, code} - Rejected calls
 * - vault_total_locked - Current locked total
 * - vault_roles_granted_total{role} - Roles granted (temporary grants count on (re)activation)
 * - vault_expiry_candidates - Candidates reported by the last probe
 * - vault_roles_expired_total - Temporary roles deactivated by sweeps
 *
 * Usage:
 * <pre>
 * PrometheusVaultMetrics metrics = new PrometheusVaultMetrics();
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusVaultMetrics implements VaultMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusVaultMetrics.class);

    private final CollectorRegistry registry;

    private final Counter depositCounter;
    private final Counter depositedAmount;
    private final Counter withdrawalCounter;
    private final Counter withdrawnAmount;
    private final Counter rejectionCounter;
    private final Gauge totalLocked;
    private final Counter rolesGranted;
    private final Gauge expiryCandidates;
    private final Counter rolesExpired;

    public PrometheusVaultMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusVaultMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.depositCounter = Counter.build()
            .name("vault_deposits_total")
            .help("Total number of deposits recorded")
            .labelNames("lock_period")
            .register(registry);

        this.depositedAmount = Counter.build()
            .name("vault_deposited_amount_total")
            .help("Total currency deposited")
            .labelNames("lock_period")
            .register(registry);

        this.withdrawalCounter = Counter.build()
            .name("vault_withdrawals_total")
            .help("Total number of successful withdrawals")
            .register(registry);

        this.withdrawnAmount = Counter.build()
            .name("vault_withdrawn_amount_total")
            .help("Total currency paid out by withdrawals")
            .register(registry);

        this.rejectionCounter = Counter.build()
            .name("vault_rejections_total")
            .help("Total number of rejected vault calls")
            .labelNames("operation", "code")
            .register(registry);

        this.totalLocked = Gauge.build()
            .name("vault_total_locked")
            .help("Currency currently locked in the vault")
            .register(registry);

        this.rolesGranted = Counter.build()
            .name("vault_roles_granted_total")
            .help("Total number of roles granted")
            .labelNames("role")
            .register(registry);

        this.expiryCandidates = Gauge.build()
            .name("vault_expiry_candidates")
            .help("Lapsed temporary roles reported by the last probe")
            .register(registry);

        this.rolesExpired = Counter.build()
            .name("vault_roles_expired_total")
            .help("Total number of temporary roles deactivated by sweeps")
            .register(registry);

        log.info("[PrometheusVaultMetrics] Vault metrics registered");
    }

    @Override
    public void recordDeposit(LockPeriod lockPeriod, BigDecimal amount) {
        depositCounter.labels(lockPeriod.name()).inc();
        depositedAmount.labels(lockPeriod.name()).inc(amount.doubleValue());
    }

    @Override
    public void recordWithdrawal(BigDecimal amount) {
        withdrawalCounter.inc();
        withdrawnAmount.inc(amount.doubleValue());
    }

    @Override
    public void recordRejection(String operation, VaultErrorCode code) {
        rejectionCounter.labels(operation, code.name()).inc();
    }

    @Override
    public void updateTotalLocked(BigDecimal value) {
        totalLocked.set(value.doubleValue());
    }

    @Override
    public void recordRoleGranted(Role role) {
        rolesGranted.labels(role.name()).inc();
    }

    @Override
    public void recordProbe(int candidates) {
        expiryCandidates.set(candidates);
    }

    @Override
    public void recordSweep(int expired) {
        if (expired > 0) {
            rolesExpired.inc(expired);
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
