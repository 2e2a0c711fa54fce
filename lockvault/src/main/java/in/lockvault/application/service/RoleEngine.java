package in.lockvault.application.service;

import in.lockvault.application.port.output.VaultRepository;
import in.lockvault.application.port.output.VaultTransaction;
import in.lockvault.domain.common.EventType;
import in.lockvault.domain.deposit.LockPeriod;
import in.lockvault.domain.role.AccountRoles;
import in.lockvault.domain.role.Role;
import in.lockvault.domain.role.RoleRule;
import in.lockvault.domain.role.TimedRole;
import in.lockvault.infrastructure.metrics.VaultMetrics;
import in.lockvault.service.core.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Role Engine - issues reputation roles from deposit behaviour.
 *
 * RULES (first match wins, see {@link RoleRule}):
 * 1. amount >= 1 and LONG lock → LongTermCommitter
 * 2. amount >= 1 and 3rd+ deposit → FrequentDepositor
 * 3. amount >= 5 → BigDepositor
 * 4. amount > 0.001 → ActiveParticipant (temporary, 8-day rolling window)
 *
 * OWNERSHIP:
 * Sole writer of permanent roles, timed roles and the temp-role registry, except that the
 * expiry sweep clears the active flag. All writes happen inside the caller's transaction.
 */
public final class RoleEngine {
    private static final Logger log = LoggerFactory.getLogger(RoleEngine.class);

    public static final Duration TEMP_ROLE_WINDOW = Duration.ofDays(8);

    private final VaultRepository repository;
    private final EventService eventService;
    private final VaultMetrics metrics;

    public RoleEngine(VaultRepository repository, EventService eventService, VaultMetrics metrics) {
        this.repository = repository;
        this.eventService = eventService;
        this.metrics = metrics;
    }

    /**
     * Evaluate one deposit against the rule chain and apply the outcome.
     *
     * @param depositCount the account's record count including this deposit
     * @return the role matched, empty if the amount is at or below the activity floor
     */
    public Optional<Role> evaluate(VaultTransaction tx, String account, BigDecimal amount,
                                   LockPeriod lockPeriod, int depositCount, Instant now) {
        RoleRule.DepositContext ctx = new RoleRule.DepositContext(amount, lockPeriod, depositCount);

        for (RoleRule rule : RoleRule.values()) {
            if (!rule.matches(ctx)) {
                continue;
            }
            Role role = rule.getRole();
            if (role.isPermanent()) {
                grantPermanent(tx, account, role, now);
            } else {
                grantTemporary(tx, account, now);
            }
            return Optional.of(role);
        }

        log.debug("No role for {}: amount {} at or below activity floor", account, amount.toPlainString());
        return Optional.empty();
    }

    /**
     * Push the temporary role's window forward if the account currently holds it.
     *
     * @return true if a timed role was refreshed
     */
    public boolean refreshActivity(VaultTransaction tx, String account, Instant now) {
        Optional<TimedRole> current = tx.findTimedRole(account).filter(TimedRole::active);
        if (current.isEmpty()) {
            return false;
        }

        TimedRole refreshed = current.get().refresh(now, TEMP_ROLE_WINDOW);
        if (refreshed.equals(current.get())) {
            return false;
        }
        tx.saveTimedRole(refreshed);
        eventService.emit(tx, EventType.TEMP_ROLE_REFRESHED, account,
            timedRolePayload(refreshed), now, account);
        log.debug("Temporary role refreshed for {} until {}", account, refreshed.expiry());
        return true;
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════

    public AccountRoles getRoles(String account) {
        return repository.readOnly(tx -> new AccountRoles(
            account,
            tx.findRoles(account),
            tx.findTimedRole(account).orElse(null)
        ));
    }

    public boolean hasRole(String account, Role role) {
        return getRoles(account).hasRole(role);
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private void grantPermanent(VaultTransaction tx, String account, Role role, Instant now) {
        if (!tx.grantRole(account, role)) {
            log.debug("{} already holds {}", account, role.getDisplayName());
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("account", account);
        payload.put("role", role.getDisplayName());
        eventService.emit(tx, EventType.ROLE_GRANTED, account, payload, now, account);
        tx.afterCommit(() -> metrics.recordRoleGranted(role));

        log.info("Role granted: {} → {}", account, role.getDisplayName());
    }

    private void grantTemporary(VaultTransaction tx, String account, Instant now) {
        boolean wasActive = tx.findTimedRole(account).map(TimedRole::active).orElse(false);

        TimedRole timedRole = TimedRole.activate(account, now, TEMP_ROLE_WINDOW);
        tx.saveTimedRole(timedRole);
        boolean newMember = tx.registerTempRoleHolder(account);

        if (wasActive) {
            eventService.emit(tx, EventType.TEMP_ROLE_REFRESHED, account, timedRolePayload(timedRole), now, account);
            log.debug("Temporary role renewed by deposit for {} until {}", account, timedRole.expiry());
            return;
        }

        eventService.emit(tx, EventType.TEMP_ROLE_GRANTED, account, timedRolePayload(timedRole), now, account);
        tx.afterCommit(() -> metrics.recordRoleGranted(Role.ACTIVE_PARTICIPANT));
        log.info("Temporary role granted: {} → {} until {} (registry {})",
            account, Role.ACTIVE_PARTICIPANT.getDisplayName(), timedRole.expiry(),
            newMember ? "appended" : "already listed");
    }

    private static Map<String, Object> timedRolePayload(TimedRole timedRole) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("account", timedRole.account());
        payload.put("role", Role.ACTIVE_PARTICIPANT.getDisplayName());
        payload.put("lastActive", timedRole.lastActive().toString());
        payload.put("expiry", timedRole.expiry().toString());
        return payload;
    }
}
