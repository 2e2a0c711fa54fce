package in.lockvault.application.port.output;

import in.lockvault.domain.common.VaultEvent;
import in.lockvault.domain.deposit.DepositRecord;
import in.lockvault.domain.role.Role;
import in.lockvault.domain.role.TimedRole;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * View of vault state inside one transaction.
 */
public interface VaultTransaction {

    // ═══════════════════════════════════════════════════════════════
    // DEPOSITS
    // ═══════════════════════════════════════════════════════════════

    /**
     * All slots for an account in index order, withdrawn ones included.
     */
    List<DepositRecord> findDeposits(String account);

    Optional<DepositRecord> findDeposit(String account, int index);

    int depositCount(String account);

    /**
     * Append a slot; the returned copy carries its assigned index.
     */
    DepositRecord appendDeposit(String account, DepositRecord record);

    /**
     * Overwrite the slot at {@code record.index()}.
     */
    void replaceDeposit(String account, DepositRecord record);

    // ═══════════════════════════════════════════════════════════════
    // TOTALS
    // ═══════════════════════════════════════════════════════════════

    BigDecimal totalLocked();

    void adjustTotalLocked(BigDecimal delta);

    /**
     * Sum of original deposit amounts, unaffected by withdrawals.
     */
    BigDecimal lifetimeDeposited(String account);

    void addLifetimeDeposited(String account, BigDecimal amount);

    // ═══════════════════════════════════════════════════════════════
    // ROLES
    // ═══════════════════════════════════════════════════════════════

    Set<Role> findRoles(String account);

    /**
     * @return false if the account already held the role
     */
    boolean grantRole(String account, Role role);

    Optional<TimedRole> findTimedRole(String account);

    void saveTimedRole(TimedRole timedRole);

    /**
     * Accounts that ever held the temporary role, in first-qualification order.
     */
    List<String> tempRoleHolders();

    /**
     * Idempotent append to the temp-role registry.
     *
     * @return false if the account was already registered
     */
    boolean registerTempRoleHolder(String account);

    // ═══════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Append to the event log; the returned copy carries its sequence number.
     */
    VaultEvent appendEvent(VaultEvent event);

    List<VaultEvent> listEventsAfter(long afterSeq, int limit);

    long latestEventSeq();

    /**
     * Register work to run once this transaction has committed. Dropped on rollback.
     */
    void afterCommit(Runnable hook);
}
