package in.lockvault.application.service;

import in.lockvault.domain.common.EventType;
import in.lockvault.domain.deposit.LockPeriod;
import in.lockvault.domain.role.ExpiryProbeResult;
import in.lockvault.domain.role.Role;
import in.lockvault.domain.role.TimedRole;
import in.lockvault.infrastructure.metrics.VaultMetrics;
import in.lockvault.infrastructure.persistence.InMemoryVaultRepository;
import in.lockvault.infrastructure.transfer.BookEntryFundsTransfer;
import in.lockvault.service.core.EventService;
import in.lockvault.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Expiry probe and sweep")
class ExpirySchedulerTest {

    private static final BigDecimal SMALL = new BigDecimal("0.002");
    private static final String TRIGGER = "test-trigger";

    private MutableClock clock;
    private EventService eventService;
    private RoleEngine roleEngine;
    private DepositLedger ledger;
    private ExpiryScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-06-01T00:00:00Z");
        InMemoryVaultRepository repository = new InMemoryVaultRepository();
        eventService = new EventService(repository);
        roleEngine = new RoleEngine(repository, eventService, VaultMetrics.NOOP);
        ledger = new DepositLedger(repository, roleEngine, new BookEntryFundsTransfer(), eventService,
            VaultMetrics.NOOP, clock);
        scheduler = new ExpiryScheduler(repository, eventService, VaultMetrics.NOOP, clock, TRIGGER);
    }

    @Test
    @DisplayName("Nothing to do on an empty registry")
    void emptyProbe() {
        ExpiryProbeResult result = scheduler.probe();

        assertFalse(result.workNeeded());
        assertTrue(result.candidates().isEmpty());
        assertEquals(0, scheduler.sweep(List.of()));
    }

    @Test
    @DisplayName("A role lapses strictly after its expiry and the sweep deactivates it")
    void lapseAndSweep() {
        ledger.deposit("idle", SMALL, LockPeriod.SHORT);

        clock.advance(Duration.ofDays(8));
        assertFalse(scheduler.probe().workNeeded());

        clock.advance(Duration.ofSeconds(1));
        ExpiryProbeResult result = scheduler.probe();
        assertEquals(List.of("idle"), result.candidates());

        assertEquals(1, scheduler.sweep(result.candidates()));
        assertFalse(roleEngine.hasRole("idle", Role.ACTIVE_PARTICIPANT));
        assertFalse(scheduler.probe().workNeeded());

        assertTrue(eventService.listAfter(0, 100).stream()
            .anyMatch(e -> e.type() == EventType.TEMP_ROLE_EXPIRED && "idle".equals(e.account())
                && TRIGGER.equals(e.createdBy())));
    }

    @Test
    @DisplayName("A later deposit pushes the expiry eight days past that deposit")
    void depositRefreshes() {
        ledger.deposit("busy", SMALL, LockPeriod.SHORT);
        clock.advance(Duration.ofDays(5));
        Instant refreshAt = clock.instant();
        ledger.deposit("busy", SMALL, LockPeriod.SHORT);

        TimedRole role = roleEngine.getRoles("busy").timedRole();
        assertEquals(refreshAt.plus(Duration.ofDays(8)), role.expiry());

        clock.advance(Duration.ofDays(7));
        assertFalse(scheduler.probe().workNeeded());

        clock.advance(Duration.ofDays(1).plusSeconds(1));
        assertEquals(List.of("busy"), scheduler.probe().candidates());
    }

    @Test
    @DisplayName("A withdrawal refreshes an active temporary role")
    void withdrawalRefreshes() {
        ledger.deposit("saver", BigDecimal.ONE, LockPeriod.SHORT);
        clock.advance(Duration.ofDays(175));
        ledger.deposit("saver", SMALL, LockPeriod.SHORT);

        clock.advance(Duration.ofDays(5));
        Instant withdrawAt = clock.instant();
        ledger.withdraw("saver", 0);

        assertEquals(withdrawAt.plus(Duration.ofDays(8)), roleEngine.getRoles("saver").timedRole().expiry());
    }

    @Test
    @DisplayName("150 lapsed holders take two probe/sweep rounds")
    void batchCap() {
        for (int i = 0; i < 150; i++) {
            ledger.deposit("acct-" + i, SMALL, LockPeriod.SHORT);
        }
        clock.advance(Duration.ofDays(9));

        ExpiryProbeResult first = scheduler.probe();
        assertTrue(first.workNeeded());
        assertEquals(ExpiryScheduler.MAX_BATCH, first.candidates().size());
        assertEquals(100, scheduler.sweep(first.candidates()));

        ExpiryProbeResult second = scheduler.probe();
        assertEquals(50, second.candidates().size());
        assertEquals(50, scheduler.sweep(second.candidates()));

        assertFalse(scheduler.probe().workNeeded());
    }

    @Test
    @DisplayName("Sweep processes at most one batch even if handed more")
    void sweepBounded() {
        List<String> all = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            ledger.deposit("bulk-" + i, SMALL, LockPeriod.SHORT);
            all.add("bulk-" + i);
        }
        clock.advance(Duration.ofDays(9));

        assertEquals(100, scheduler.sweep(all));
        assertEquals(20, scheduler.probe().candidates().size());
    }

    @Test
    @DisplayName("Stale, unknown, duplicate and null candidates are skipped")
    void sweepRevalidates() {
        ledger.deposit("lapsed", SMALL, LockPeriod.SHORT);
        ledger.deposit("fresh", SMALL, LockPeriod.SHORT);
        clock.advance(Duration.ofDays(9));
        ledger.deposit("fresh", SMALL, LockPeriod.SHORT);

        int expired = scheduler.sweep(Arrays.asList("lapsed", "lapsed", "fresh", "nobody", null));

        assertEquals(1, expired);
        assertTrue(roleEngine.hasRole("fresh", Role.ACTIVE_PARTICIPANT));
        assertEquals(0, scheduler.sweep(List.of("lapsed")));
    }

    @Test
    @DisplayName("Count limits how much of the list is read")
    void sweepCount() {
        ledger.deposit("a", SMALL, LockPeriod.SHORT);
        ledger.deposit("b", SMALL, LockPeriod.SHORT);
        clock.advance(Duration.ofDays(9));

        assertEquals(1, scheduler.sweep(List.of("a", "b"), 1));
        assertEquals(List.of("b"), scheduler.probe().candidates());
        assertThrows(IllegalArgumentException.class, () -> scheduler.sweep(List.of("b"), -1));
        assertEquals(1, scheduler.sweep(List.of("b"), 10));
    }

    @Test
    @DisplayName("A swept account can re-qualify without a second registry entry")
    void reactivation() {
        ledger.deposit("returning", SMALL, LockPeriod.SHORT);
        clock.advance(Duration.ofDays(9));
        scheduler.sweep(scheduler.probe().candidates());

        ledger.deposit("returning", SMALL, LockPeriod.SHORT);

        assertTrue(roleEngine.hasRole("returning", Role.ACTIVE_PARTICIPANT));
        clock.advance(Duration.ofDays(9));
        assertEquals(List.of("returning"), scheduler.probe().candidates());
    }
}
