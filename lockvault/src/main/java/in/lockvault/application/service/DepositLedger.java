package in.lockvault.application.service;

import in.lockvault.application.port.output.FundsTransfer;
import in.lockvault.application.port.output.VaultRepository;
import in.lockvault.application.port.output.VaultTransaction;
import in.lockvault.domain.common.EventType;
import in.lockvault.domain.common.VaultErrorCode;
import in.lockvault.domain.deposit.DepositRecord;
import in.lockvault.domain.deposit.DepositState;
import in.lockvault.domain.deposit.LockPeriod;
import in.lockvault.domain.exception.TransferFailedException;
import in.lockvault.domain.exception.VaultException;
import in.lockvault.infrastructure.metrics.VaultMetrics;
import in.lockvault.service.core.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Deposit Ledger - time-locked deposits and their withdrawals.
 *
 * FLOW:
 * deposit  → append LOCKED slot → totals → DEPOSITED event → role evaluation → activity refresh
 * withdraw → advance state → checks → zero slot → totals → WITHDRAWN event → payout → activity refresh
 *
 * Every mutating call runs in one repository transaction. If the payout fails the whole
 * withdrawal rolls back, including its event.
 */
public final class DepositLedger {
    private static final Logger log = LoggerFactory.getLogger(DepositLedger.class);

    private final VaultRepository repository;
    private final RoleEngine roleEngine;
    private final FundsTransfer fundsTransfer;
    private final EventService eventService;
    private final VaultMetrics metrics;
    private final Clock clock;

    public DepositLedger(VaultRepository repository, RoleEngine roleEngine, FundsTransfer fundsTransfer,
                         EventService eventService, VaultMetrics metrics, Clock clock) {
        this.repository = repository;
        this.roleEngine = roleEngine;
        this.fundsTransfer = fundsTransfer;
        this.eventService = eventService;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // DEPOSIT
    // ═══════════════════════════════════════════════════════════════

    /**
     * Lock {@code amount} for exactly one of the supported durations.
     *
     * @throws VaultException ZERO_AMOUNT, then INVALID_LOCK_PERIOD
     */
    public DepositRecord deposit(String account, BigDecimal amount, Duration lockDuration) {
        return rejectionsCounted("deposit", () -> {
            requireAccount(account);
            requirePositive(amount);
            LockPeriod lockPeriod = LockPeriod.fromDuration(lockDuration);
            return repository.inTransaction(tx -> applyDeposit(tx, account, amount, lockPeriod));
        });
    }

    public DepositRecord deposit(String account, BigDecimal amount, LockPeriod lockPeriod) {
        return rejectionsCounted("deposit", () -> {
            requireAccount(account);
            requirePositive(amount);
            if (lockPeriod == null) {
                throw new VaultException(VaultErrorCode.INVALID_LOCK_PERIOD, "Lock period is required");
            }
            return repository.inTransaction(tx -> applyDeposit(tx, account, amount, lockPeriod));
        });
    }

    private DepositRecord applyDeposit(VaultTransaction tx, String account, BigDecimal amount,
                                       LockPeriod lockPeriod) {
        Instant now = now();

        DepositRecord record = tx.appendDeposit(account, DepositRecord.open(amount, now, lockPeriod));
        tx.adjustTotalLocked(amount);
        tx.addLifetimeDeposited(account, amount);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("account", account);
        payload.put("index", record.index());
        payload.put("amount", amount.toPlainString());
        payload.put("lockPeriod", lockPeriod.name());
        payload.put("lockUntil", record.lockUntil().toString());
        eventService.emit(tx, EventType.DEPOSITED, account, payload, now, account);

        roleEngine.evaluate(tx, account, amount, lockPeriod, tx.depositCount(account), now);
        roleEngine.refreshActivity(tx, account, now);

        BigDecimal totalLocked = tx.totalLocked();
        tx.afterCommit(() -> {
            metrics.recordDeposit(lockPeriod, amount);
            metrics.updateTotalLocked(totalLocked);
        });

        log.info("Deposit #{} by {}: {} locked {} until {}",
            record.index(), account, amount.toPlainString(), lockPeriod, record.lockUntil());
        return record;
    }

    // ═══════════════════════════════════════════════════════════════
    // WITHDRAW
    // ═══════════════════════════════════════════════════════════════

    /**
     * Release one expired deposit back to its owner.
     *
     * @return the amount paid out
     * @throws VaultException INVALID_INDEX, LOCK_NOT_EXPIRED, ALREADY_WITHDRAWN
     * @throws TransferFailedException if the payout fails; nothing is changed
     */
    public BigDecimal withdraw(String account, int index) {
        return rejectionsCounted("withdraw", () -> {
            requireAccount(account);
            return repository.inTransaction(tx -> applyWithdrawal(tx, account, index));
        });
    }

    private BigDecimal applyWithdrawal(VaultTransaction tx, String account, int index) {
        Instant now = now();

        DepositRecord current = tx.findDeposit(account, index)
            .orElseThrow(() -> invalidIndex(account, index));

        DepositRecord advanced = current.advanceState(now);
        if (advanced.state() == DepositState.LOCKED) {
            throw new VaultException(VaultErrorCode.LOCK_NOT_EXPIRED,
                String.format("Deposit #%d of %s is locked until %s", index, account, advanced.lockUntil()));
        }
        if (advanced.withdrawn()) {
            throw new VaultException(VaultErrorCode.ALREADY_WITHDRAWN,
                String.format("Deposit #%d of %s was already withdrawn", index, account));
        }

        BigDecimal amount = advanced.amount();
        tx.replaceDeposit(account, advanced.zeroed());
        tx.adjustTotalLocked(amount.negate());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("account", account);
        payload.put("index", index);
        payload.put("amount", amount.toPlainString());
        payload.put("timestamp", now.toString());
        eventService.emit(tx, EventType.WITHDRAWN, account, payload, now, account);

        roleEngine.refreshActivity(tx, account, now);

        BigDecimal totalLocked = tx.totalLocked();
        tx.afterCommit(() -> {
            metrics.recordWithdrawal(amount);
            metrics.updateTotalLocked(totalLocked);
        });

        // Last step before commit: nothing after this point may touch the store.
        payOut(account, index, amount);

        log.info("Withdrawal of deposit #{} by {}: {} released", index, account, amount.toPlainString());
        return amount;
    }

    private void payOut(String account, int index, BigDecimal amount) {
        boolean delivered;
        try {
            delivered = fundsTransfer.transfer(account, amount);
        } catch (RuntimeException e) {
            throw new TransferFailedException(account, index, amount, e.getMessage(), e);
        }
        if (!delivered) {
            throw new TransferFailedException(account, index, amount, "transfer was refused");
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════

    public BigDecimal getTotalLocked() {
        return repository.readOnly(VaultTransaction::totalLocked);
    }

    /**
     * Every slot of the account in index order, withdrawn (zeroed) ones included.
     */
    public List<DepositRecord> getUserDeposits(String account) {
        return repository.readOnly(tx -> tx.findDeposits(account));
    }

    public DepositRecord getDepositByIndex(String account, int index) {
        return repository.readOnly(tx -> tx.findDeposit(account, index))
            .orElseThrow(() -> invalidIndex(account, index));
    }

    public BigDecimal getLifetimeDeposited(String account) {
        return repository.readOnly(tx -> tx.lifetimeDeposited(account));
    }

    /**
     * Sum of deposits neither withdrawn nor past their lock at the time of the call.
     */
    public BigDecimal getActiveDeposited(String account) {
        Instant now = now();
        return getUserDeposits(account).stream()
            .filter(d -> d.isActiveAt(now))
            .map(DepositRecord::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public int getDepositCount(String account) {
        return repository.readOnly(tx -> tx.depositCount(account));
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private <T> T rejectionsCounted(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (TransferFailedException e) {
            metrics.recordRejection(operation, e.getCode());
            log.error("{} of deposit #{} rolled back: {}", operation, e.getDepositIndex(), e.getMessage(), e);
            throw e;
        } catch (VaultException e) {
            metrics.recordRejection(operation, e.getCode());
            log.warn("{} rejected: {}", operation, e.getMessage());
            throw e;
        }
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new VaultException(VaultErrorCode.INVALID_ACCOUNT, "Account is required");
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new VaultException(VaultErrorCode.ZERO_AMOUNT, "Deposit amount must be greater than zero");
        }
    }

    private static VaultException invalidIndex(String account, int index) {
        return new VaultException(VaultErrorCode.INVALID_INDEX,
            String.format("%s has no deposit #%d", account, index));
    }
}
