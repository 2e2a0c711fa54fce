package in.lockvault.integration;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.lockvault.application.port.output.FundsTransfer;
import in.lockvault.application.service.DepositLedger;
import in.lockvault.application.service.ExpiryScheduler;
import in.lockvault.application.service.ExpirySweepJob;
import in.lockvault.application.service.RoleEngine;
import in.lockvault.domain.common.EventType;
import in.lockvault.domain.common.VaultEvent;
import in.lockvault.domain.deposit.DepositRecord;
import in.lockvault.domain.deposit.LockPeriod;
import in.lockvault.domain.exception.TransferFailedException;
import in.lockvault.domain.role.Role;
import in.lockvault.infrastructure.metrics.PrometheusVaultMetrics;
import in.lockvault.infrastructure.persistence.PostgresVaultRepository;
import in.lockvault.migration.VaultSchemaMigration;
import in.lockvault.service.core.EventService;
import in.lockvault.support.MutableClock;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Full vault lifecycle over the JDBC store (H2 in PostgreSQL mode).
 *
 * Flow tested:
 * 1. Deposits across accounts and lock periods
 * 2. Role grants from the rule chain
 * 3. A refused payout that must roll back
 * 4. Successful withdrawals
 * 5. Temporary-role expiry through the sweep job
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Vault lifecycle on the JDBC store")
public class VaultLifecycleIntegrationTest {

    @Mock
    private FundsTransfer fundsTransfer;

    private HikariDataSource dataSource;
    private MutableClock clock;
    private CollectorRegistry registry;
    private EventService eventService;
    private RoleEngine roleEngine;
    private DepositLedger ledger;
    private ExpiryScheduler scheduler;

    @BeforeEach
    public void setUp() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:lifecycle-" + UUID.randomUUID()
            + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        config.setUsername("sa");
        config.setPassword("");
        config.setMaximumPoolSize(4);
        dataSource = new HikariDataSource(config);
        new VaultSchemaMigration(dataSource).migrate();

        PostgresVaultRepository repository = new PostgresVaultRepository(dataSource);
        registry = new CollectorRegistry();
        PrometheusVaultMetrics metrics = new PrometheusVaultMetrics(registry);
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

        eventService = new EventService(repository);
        roleEngine = new RoleEngine(repository, eventService, metrics);
        ledger = new DepositLedger(repository, roleEngine, fundsTransfer, eventService, metrics, clock);
        scheduler = new ExpiryScheduler(repository, eventService, metrics, clock, "it-trigger");
    }

    @AfterEach
    public void tearDown() {
        dataSource.close();
    }

    @Test
    public void testFullLifecycle() {
        // 1. Deposits
        DepositRecord a0 = ledger.deposit("alice", BigDecimal.ONE, LockPeriod.SHORT);
        ledger.deposit("alice", new BigDecimal("2"), LockPeriod.LONG);
        ledger.deposit("bob", new BigDecimal("0.002"), LockPeriod.SHORT);
        assertEquals(0, new BigDecimal("3.002").compareTo(ledger.getTotalLocked()));

        // 2. Roles
        assertTrue(roleEngine.hasRole("alice", Role.LONG_TERM_COMMITTER));
        assertTrue(roleEngine.hasRole("alice", Role.ACTIVE_PARTICIPANT));
        assertTrue(roleEngine.hasRole("bob", Role.ACTIVE_PARTICIPANT));

        // 3. Refused payout rolls back
        clock.set(a0.lockUntil());
        when(fundsTransfer.transfer(eq("alice"), any())).thenReturn(false);
        long seqBefore = eventService.currentSeq();
        assertThrows(TransferFailedException.class, () -> ledger.withdraw("alice", 0));
        assertEquals(seqBefore, eventService.currentSeq());
        assertFalse(ledger.getDepositByIndex("alice", 0).withdrawn());
        assertEquals(0, new BigDecimal("3.002").compareTo(ledger.getTotalLocked()));

        // 4. Successful withdrawal
        when(fundsTransfer.transfer(eq("alice"), any())).thenReturn(true);
        assertEquals(0, BigDecimal.ONE.compareTo(ledger.withdraw("alice", 0)));
        assertTrue(ledger.getDepositByIndex("alice", 0).withdrawn());
        assertFalse(ledger.getDepositByIndex("alice", 1).withdrawn());
        assertEquals(0, new BigDecimal("2.002").compareTo(ledger.getTotalLocked()));

        // 5. Both temporary roles have lapsed by now; alice's was refreshed by the withdrawal
        int expired = new ExpirySweepJob(scheduler, Duration.ofMinutes(1), clock).runOnce();
        assertEquals(1, expired);
        assertFalse(roleEngine.hasRole("bob", Role.ACTIVE_PARTICIPANT));
        assertTrue(roleEngine.hasRole("alice", Role.ACTIVE_PARTICIPANT));

        List<EventType> types = new ArrayList<>();
        for (VaultEvent e : eventService.listAfter(0, 100)) {
            types.add(e.type());
        }
        assertTrue(types.contains(EventType.WITHDRAWN));
        assertTrue(types.contains(EventType.TEMP_ROLE_EXPIRED));
        assertTrue(types.contains(EventType.SWEEP_COMPLETED));

        Double locked = registry.getSampleValue("vault_total_locked");
        assertNotNull(locked);
        assertEquals(2.002, locked, 1e-9);
    }

    @Test
    public void testBatchCapOnJdbcStore() {
        for (int i = 0; i < 150; i++) {
            ledger.deposit("holder-" + i, new BigDecimal("0.01"), LockPeriod.SHORT);
        }
        clock.advance(Duration.ofDays(9));

        ExpirySweepJob job = new ExpirySweepJob(scheduler, Duration.ofMinutes(1), clock);
        assertEquals(100, job.runOnce());
        assertEquals(50, job.runOnce());
        assertEquals(0, job.runOnce());
        assertEquals(150, job.getTotalExpired());
    }
}
