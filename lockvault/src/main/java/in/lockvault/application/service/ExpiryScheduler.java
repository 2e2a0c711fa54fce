package in.lockvault.application.service;

import in.lockvault.application.port.output.VaultRepository;
import in.lockvault.application.port.output.VaultTransaction;
import in.lockvault.domain.common.EventType;
import in.lockvault.domain.role.ExpiryProbeResult;
import in.lockvault.domain.role.Role;
import in.lockvault.domain.role.TimedRole;
import in.lockvault.infrastructure.metrics.VaultMetrics;
import in.lockvault.service.core.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expiry Scheduler - probe/sweep pair driven by an external trigger.
 *
 * PROBE: read-only scan of the temp-role registry, returns at most {@link #MAX_BATCH} lapsed holders.
 * SWEEP: deactivates the candidates it is handed, re-checking each one against current state.
 *
 * The sweep trusts nothing in the candidate list. Anyone may call it; stale, duplicate or
 * unknown entries are skipped.
 */
public final class ExpiryScheduler {
    private static final Logger log = LoggerFactory.getLogger(ExpiryScheduler.class);

    public static final int MAX_BATCH = 100;

    private final VaultRepository repository;
    private final EventService eventService;
    private final VaultMetrics metrics;
    private final Clock clock;
    private final String triggerId;

    public ExpiryScheduler(VaultRepository repository, EventService eventService, VaultMetrics metrics,
                           Clock clock, String triggerId) {
        this.repository = repository;
        this.eventService = eventService;
        this.metrics = metrics;
        this.clock = clock;
        this.triggerId = triggerId;
    }

    // ═══════════════════════════════════════════════════════════════
    // PROBE
    // ═══════════════════════════════════════════════════════════════

    public ExpiryProbeResult probe() {
        Instant now = now();
        List<String> candidates = repository.readOnly(tx -> collectLapsed(tx, now));
        metrics.recordProbe(candidates.size());
        if (!candidates.isEmpty()) {
            log.debug("Expiry probe: {} lapsed temporary roles", candidates.size());
        }
        return ExpiryProbeResult.of(candidates);
    }

    private List<String> collectLapsed(VaultTransaction tx, Instant now) {
        List<String> lapsed = new ArrayList<>();
        for (String account : tx.tempRoleHolders()) {
            if (lapsed.size() == MAX_BATCH) {
                break;
            }
            tx.findTimedRole(account)
                .filter(role -> role.isLapsedAt(now))
                .ifPresent(role -> lapsed.add(account));
        }
        return lapsed;
    }

    // ═══════════════════════════════════════════════════════════════
    // SWEEP
    // ═══════════════════════════════════════════════════════════════

    public int sweep(List<String> candidates) {
        return sweep(candidates, candidates == null ? 0 : candidates.size());
    }

    /**
     * Deactivate the first {@code count} candidates that are still active and past expiry.
     *
     * @return number of roles deactivated
     */
    public int sweep(List<String> candidates, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
        if (candidates == null || candidates.isEmpty() || count == 0) {
            return 0;
        }

        int limit = Math.min(Math.min(count, candidates.size()), MAX_BATCH);
        if (limit < count) {
            log.warn("Sweep asked for {} entries, processing {}", count, limit);
        }

        Set<String> batch = new LinkedHashSet<>(candidates.subList(0, limit));
        Instant now = now();

        int expired = repository.inTransaction(tx -> {
            int deactivated = 0;
            for (String account : batch) {
                if (account == null) {
                    continue;
                }
                TimedRole role = tx.findTimedRole(account).orElse(null);
                if (role == null || !role.isLapsedAt(now)) {
                    log.debug("Sweep skipped {}: not lapsed", account);
                    continue;
                }
                tx.saveTimedRole(role.deactivate());
                eventService.emit(tx, EventType.TEMP_ROLE_EXPIRED, account, expiredPayload(role), now, triggerId);
                deactivated++;
            }

            if (deactivated > 0) {
                Map<String, Object> summary = new LinkedHashMap<>();
                summary.put("requested", limit);
                summary.put("expired", deactivated);
                eventService.emitGlobal(tx, EventType.SWEEP_COMPLETED, summary, now, triggerId);
            }
            return deactivated;
        });

        metrics.recordSweep(expired);
        if (expired > 0) {
            log.info("Expiry sweep: {} of {} candidates deactivated", expired, limit);
        }
        return expired;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static Map<String, Object> expiredPayload(TimedRole role) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("account", role.account());
        payload.put("role", Role.ACTIVE_PARTICIPANT.getDisplayName());
        payload.put("expiry", role.expiry().toString());
        return payload;
    }
}
