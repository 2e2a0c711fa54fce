package in.lockvault.infrastructure.persistence;

import in.lockvault.application.port.output.VaultRepository;
import in.lockvault.application.port.output.VaultTransaction;
import in.lockvault.domain.common.VaultEvent;
import in.lockvault.domain.deposit.DepositRecord;
import in.lockvault.domain.role.Role;
import in.lockvault.domain.role.TimedRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * In-memory vault store.
 *
 * ATOMICITY:
 * One write lock serializes all transactions. Each mutation pushes its inverse onto an undo
 * journal; if the work throws, the journal is replayed newest-first and the exception rethrown,
 * so the state is exactly what it was before the call.
 *
 * READS:
 * Read-only views share the read lock and reject every mutating call.
 */
public final class InMemoryVaultRepository implements VaultRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryVaultRepository.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    // account → slots in index order
    private final Map<String, List<DepositRecord>> deposits = new HashMap<>();
    private final Map<String, BigDecimal> lifetimeDeposited = new HashMap<>();
    private BigDecimal totalLocked = BigDecimal.ZERO;

    private final Map<String, Set<Role>> roles = new HashMap<>();
    private final Map<String, TimedRole> timedRoles = new HashMap<>();

    // Temp-role registry: ordered list + membership set
    private final List<String> tempRoleRegistry = new ArrayList<>();
    private final Set<String> tempRoleMembers = new HashSet<>();

    private final List<VaultEvent> events = new ArrayList<>();
    private long eventSeq = 0;

    @Override
    public <T> T inTransaction(Function<VaultTransaction, T> work) {
        Tx tx = new Tx(false);
        T result;
        lock.writeLock().lock();
        try {
            result = work.apply(tx);
        } catch (RuntimeException | Error e) {
            tx.rollback();
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
        tx.runAfterCommitHooks();
        return result;
    }

    @Override
    public <T> T readOnly(Function<VaultTransaction, T> query) {
        lock.readLock().lock();
        try {
            return query.apply(new Tx(true));
        } finally {
            lock.readLock().unlock();
        }
    }

    private final class Tx implements VaultTransaction {
        private final boolean readOnly;
        private final Deque<Runnable> undo = new ArrayDeque<>();
        private final List<Runnable> afterCommit = new ArrayList<>();

        Tx(boolean readOnly) {
            this.readOnly = readOnly;
        }

        private void requireWritable() {
            if (readOnly) {
                throw new IllegalStateException("Mutation attempted on a read-only vault view");
            }
        }

        void rollback() {
            int steps = undo.size();
            while (!undo.isEmpty()) {
                undo.pop().run();
            }
            afterCommit.clear();
            log.debug("In-memory transaction rolled back ({} steps)", steps);
        }

        void runAfterCommitHooks() {
            for (Runnable hook : afterCommit) {
                hook.run();
            }
        }

        @Override
        public List<DepositRecord> findDeposits(String account) {
            List<DepositRecord> slots = deposits.get(account);
            return slots == null ? List.of() : List.copyOf(slots);
        }

        @Override
        public Optional<DepositRecord> findDeposit(String account, int index) {
            List<DepositRecord> slots = deposits.get(account);
            if (slots == null || index < 0 || index >= slots.size()) {
                return Optional.empty();
            }
            return Optional.of(slots.get(index));
        }

        @Override
        public int depositCount(String account) {
            List<DepositRecord> slots = deposits.get(account);
            return slots == null ? 0 : slots.size();
        }

        @Override
        public DepositRecord appendDeposit(String account, DepositRecord record) {
            requireWritable();
            boolean created = !deposits.containsKey(account);
            List<DepositRecord> slots = deposits.computeIfAbsent(account, k -> new ArrayList<>());
            DepositRecord indexed = record.withIndex(slots.size());
            slots.add(indexed);
            undo.push(() -> {
                slots.remove(slots.size() - 1);
                if (created) {
                    deposits.remove(account);
                }
            });
            return indexed;
        }

        @Override
        public void replaceDeposit(String account, DepositRecord record) {
            requireWritable();
            List<DepositRecord> slots = deposits.get(account);
            if (slots == null || record.index() < 0 || record.index() >= slots.size()) {
                throw new IllegalArgumentException("No deposit slot " + record.index() + " for " + account);
            }
            DepositRecord previous = slots.set(record.index(), record);
            undo.push(() -> slots.set(record.index(), previous));
        }

        @Override
        public BigDecimal totalLocked() {
            return totalLocked;
        }

        @Override
        public void adjustTotalLocked(BigDecimal delta) {
            requireWritable();
            BigDecimal previous = totalLocked;
            totalLocked = totalLocked.add(delta);
            undo.push(() -> totalLocked = previous);
        }

        @Override
        public BigDecimal lifetimeDeposited(String account) {
            return lifetimeDeposited.getOrDefault(account, BigDecimal.ZERO);
        }

        @Override
        public void addLifetimeDeposited(String account, BigDecimal amount) {
            requireWritable();
            BigDecimal previous = lifetimeDeposited.get(account);
            lifetimeDeposited.put(account, previous == null ? amount : previous.add(amount));
            undo.push(() -> {
                if (previous == null) {
                    lifetimeDeposited.remove(account);
                } else {
                    lifetimeDeposited.put(account, previous);
                }
            });
        }

        @Override
        public Set<Role> findRoles(String account) {
            Set<Role> held = roles.get(account);
            return held == null ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(held));
        }

        @Override
        public boolean grantRole(String account, Role role) {
            requireWritable();
            Set<Role> held = roles.computeIfAbsent(account, k -> EnumSet.noneOf(Role.class));
            if (!held.add(role)) {
                return false;
            }
            undo.push(() -> {
                held.remove(role);
                if (held.isEmpty()) {
                    roles.remove(account);
                }
            });
            return true;
        }

        @Override
        public Optional<TimedRole> findTimedRole(String account) {
            return Optional.ofNullable(timedRoles.get(account));
        }

        @Override
        public void saveTimedRole(TimedRole timedRole) {
            requireWritable();
            TimedRole previous = timedRoles.put(timedRole.account(), timedRole);
            undo.push(() -> {
                if (previous == null) {
                    timedRoles.remove(timedRole.account());
                } else {
                    timedRoles.put(timedRole.account(), previous);
                }
            });
        }

        @Override
        public List<String> tempRoleHolders() {
            return List.copyOf(tempRoleRegistry);
        }

        @Override
        public boolean registerTempRoleHolder(String account) {
            requireWritable();
            if (!tempRoleMembers.add(account)) {
                return false;
            }
            tempRoleRegistry.add(account);
            undo.push(() -> {
                tempRoleRegistry.remove(tempRoleRegistry.size() - 1);
                tempRoleMembers.remove(account);
            });
            return true;
        }

        @Override
        public VaultEvent appendEvent(VaultEvent event) {
            requireWritable();
            long previousSeq = eventSeq;
            VaultEvent persisted = event.withSeq(++eventSeq);
            events.add(persisted);
            undo.push(() -> {
                events.remove(events.size() - 1);
                eventSeq = previousSeq;
            });
            return persisted;
        }

        @Override
        public List<VaultEvent> listEventsAfter(long afterSeq, int limit) {
            List<VaultEvent> page = new ArrayList<>();
            for (VaultEvent e : events) {
                if (e.seq() > afterSeq) {
                    page.add(e);
                    if (page.size() >= limit) {
                        break;
                    }
                }
            }
            return page;
        }

        @Override
        public long latestEventSeq() {
            return eventSeq;
        }

        @Override
        public void afterCommit(Runnable hook) {
            requireWritable();
            afterCommit.add(hook);
        }
    }
}
