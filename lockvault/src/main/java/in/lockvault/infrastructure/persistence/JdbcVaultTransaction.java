package in.lockvault.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.lockvault.application.port.output.VaultTransaction;
import in.lockvault.domain.common.EventType;
import in.lockvault.domain.common.VaultEvent;
import in.lockvault.domain.deposit.DepositRecord;
import in.lockvault.domain.deposit.DepositState;
import in.lockvault.domain.exception.VaultStorageException;
import in.lockvault.domain.role.Role;
import in.lockvault.domain.role.TimedRole;
import in.lockvault.migration.VaultSchemaMigration;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * VaultTransaction bound to one JDBC connection with auto-commit off.
 * Commit and rollback belong to {@link PostgresVaultRepository}.
 */
final class JdbcVaultTransaction implements VaultTransaction {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Connection conn;
    private final boolean readOnly;
    private final List<Runnable> afterCommit = new ArrayList<>();

    JdbcVaultTransaction(Connection conn, boolean readOnly) {
        this.conn = conn;
        this.readOnly = readOnly;
    }

    /**
     * Take the writer lock. Blocks until every other writer has committed or rolled back.
     */
    void lockTotals() throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT total_locked FROM vault_totals WHERE id = ? FOR UPDATE")) {
            ps.setInt(1, VaultSchemaMigration.TOTALS_ROW_ID);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("vault_totals row missing, run VaultSchemaMigration first");
                }
            }
        }
    }

    void runAfterCommitHooks() {
        for (Runnable hook : afterCommit) {
            hook.run();
        }
    }

    private void requireWritable() {
        if (readOnly) {
            throw new IllegalStateException("Mutation attempted on a read-only vault view");
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // DEPOSITS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public List<DepositRecord> findDeposits(String account) {
        String sql = """
            SELECT * FROM vault_deposits
            WHERE account_id = ?
            ORDER BY deposit_index
            """;

        List<DepositRecord> records = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, account);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapDeposit(rs));
                }
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to find deposits for " + account, e);
        }
        return records;
    }

    @Override
    public Optional<DepositRecord> findDeposit(String account, int index) {
        String sql = """
            SELECT * FROM vault_deposits
            WHERE account_id = ? AND deposit_index = ?
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, account);
            ps.setInt(2, index);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapDeposit(rs));
                }
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to find deposit " + account + "#" + index, e);
        }
        return Optional.empty();
    }

    @Override
    public int depositCount(String account) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COUNT(*) FROM vault_deposits WHERE account_id = ?")) {
            ps.setString(1, account);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to count deposits for " + account, e);
        }
    }

    @Override
    public DepositRecord appendDeposit(String account, DepositRecord record) {
        requireWritable();
        String sql = """
            INSERT INTO vault_deposits (
                account_id, deposit_index, amount, created_at, lock_until, deposit_state, withdrawn
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        DepositRecord indexed = record.withIndex(depositCount(account));
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, account);
            ps.setInt(2, indexed.index());
            ps.setBigDecimal(3, indexed.amount());
            setInstant(ps, 4, indexed.createdAt());
            setInstant(ps, 5, indexed.lockUntil());
            ps.setString(6, indexed.state().name());
            ps.setBoolean(7, indexed.withdrawn());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to append deposit for " + account, e);
        }
        return indexed;
    }

    @Override
    public void replaceDeposit(String account, DepositRecord record) {
        requireWritable();
        String sql = """
            UPDATE vault_deposits
            SET amount = ?, created_at = ?, lock_until = ?, deposit_state = ?, withdrawn = ?
            WHERE account_id = ? AND deposit_index = ?
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setBigDecimal(1, record.amount());
            setInstant(ps, 2, record.createdAt());
            setInstant(ps, 3, record.lockUntil());
            ps.setString(4, record.state().name());
            ps.setBoolean(5, record.withdrawn());
            ps.setString(6, account);
            ps.setInt(7, record.index());
            if (ps.executeUpdate() == 0) {
                throw new IllegalArgumentException("No deposit slot " + record.index() + " for " + account);
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to update deposit " + account + "#" + record.index(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // TOTALS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public BigDecimal totalLocked() {
        try (PreparedStatement ps = conn.prepareStatement("SELECT total_locked FROM vault_totals WHERE id = ?")) {
            ps.setInt(1, VaultSchemaMigration.TOTALS_ROW_ID);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getBigDecimal(1) : BigDecimal.ZERO;
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to read total locked", e);
        }
    }

    @Override
    public void adjustTotalLocked(BigDecimal delta) {
        requireWritable();
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE vault_totals SET total_locked = total_locked + ? WHERE id = ?")) {
            ps.setBigDecimal(1, delta);
            ps.setInt(2, VaultSchemaMigration.TOTALS_ROW_ID);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to adjust total locked", e);
        }
    }

    @Override
    public BigDecimal lifetimeDeposited(String account) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT lifetime_deposited FROM vault_account_totals WHERE account_id = ?")) {
            ps.setString(1, account);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getBigDecimal(1) : BigDecimal.ZERO;
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to read lifetime deposited for " + account, e);
        }
    }

    @Override
    public void addLifetimeDeposited(String account, BigDecimal amount) {
        requireWritable();
        try (PreparedStatement update = conn.prepareStatement(
                "UPDATE vault_account_totals SET lifetime_deposited = lifetime_deposited + ? WHERE account_id = ?")) {
            update.setBigDecimal(1, amount);
            update.setString(2, account);
            if (update.executeUpdate() > 0) {
                return;
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to update lifetime deposited for " + account, e);
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO vault_account_totals (account_id, lifetime_deposited) VALUES (?, ?)")) {
            insert.setString(1, account);
            insert.setBigDecimal(2, amount);
            insert.executeUpdate();
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to insert lifetime deposited for " + account, e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // ROLES
    // ═══════════════════════════════════════════════════════════════

    @Override
    public Set<Role> findRoles(String account) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT role_name FROM vault_account_roles WHERE account_id = ?")) {
            ps.setString(1, account);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    roles.add(Role.valueOf(rs.getString(1)));
                }
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to find roles for " + account, e);
        }
        return Collections.unmodifiableSet(roles);
    }

    @Override
    public boolean grantRole(String account, Role role) {
        requireWritable();
        if (findRoles(account).contains(role)) {
            return false;
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO vault_account_roles (account_id, role_name) VALUES (?, ?)")) {
            ps.setString(1, account);
            ps.setString(2, role.name());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to grant " + role + " to " + account, e);
        }
        return true;
    }

    @Override
    public Optional<TimedRole> findTimedRole(String account) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM vault_timed_roles WHERE account_id = ?")) {
            ps.setString(1, account);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new TimedRole(
                        rs.getString("account_id"),
                        rs.getBoolean("active"),
                        getInstant(rs, "last_active"),
                        getInstant(rs, "expiry")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to find timed role for " + account, e);
        }
        return Optional.empty();
    }

    @Override
    public void saveTimedRole(TimedRole timedRole) {
        requireWritable();
        String updateSql = """
            UPDATE vault_timed_roles
            SET active = ?, last_active = ?, expiry = ?
            WHERE account_id = ?
            """;
        String insertSql = """
            INSERT INTO vault_timed_roles (active, last_active, expiry, account_id)
            VALUES (?, ?, ?, ?)
            """;

        try {
            if (writeTimedRole(updateSql, timedRole) == 0) {
                writeTimedRole(insertSql, timedRole);
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to save timed role for " + timedRole.account(), e);
        }
    }

    private int writeTimedRole(String sql, TimedRole timedRole) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setBoolean(1, timedRole.active());
            setInstant(ps, 2, timedRole.lastActive());
            setInstant(ps, 3, timedRole.expiry());
            ps.setString(4, timedRole.account());
            return ps.executeUpdate();
        }
    }

    @Override
    public List<String> tempRoleHolders() {
        List<String> holders = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT account_id FROM vault_temp_role_registry ORDER BY registry_position");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                holders.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to read temp-role registry", e);
        }
        return holders;
    }

    @Override
    public boolean registerTempRoleHolder(String account) {
        requireWritable();
        try {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT COUNT(*) FROM vault_temp_role_registry WHERE account_id = ?")) {
                ps.setString(1, account);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next() && rs.getInt(1) > 0) {
                        return false;
                    }
                }
            }

            int position;
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT COALESCE(MAX(registry_position), -1) FROM vault_temp_role_registry");
                 ResultSet rs = ps.executeQuery()) {
                position = rs.next() ? rs.getInt(1) + 1 : 0;
            }

            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO vault_temp_role_registry (registry_position, account_id) VALUES (?, ?)")) {
                ps.setInt(1, position);
                ps.setString(2, account);
                ps.executeUpdate();
            }
            return true;
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to register temp-role holder " + account, e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public VaultEvent appendEvent(VaultEvent event) {
        requireWritable();
        String sql = """
            INSERT INTO vault_events (seq, event_type, account_id, payload, ts, created_by)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

        VaultEvent persisted = event.withSeq(latestEventSeq() + 1);
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, persisted.seq());
            ps.setString(2, persisted.type().name());
            ps.setString(3, persisted.account());
            ps.setString(4, MAPPER.writeValueAsString(persisted.payload()));
            setInstant(ps, 5, persisted.ts());
            ps.setString(6, persisted.createdBy());
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new VaultStorageException("Failed to append " + event.type() + " event", e);
        }
        return persisted;
    }

    @Override
    public List<VaultEvent> listEventsAfter(long afterSeq, int limit) {
        String sql = """
            SELECT * FROM vault_events
            WHERE seq > ?
            ORDER BY seq
            LIMIT ?
            """;

        List<VaultEvent> events = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, afterSeq);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(new VaultEvent(
                        rs.getLong("seq"),
                        EventType.valueOf(rs.getString("event_type")),
                        rs.getString("account_id"),
                        MAPPER.readTree(rs.getString("payload")),
                        getInstant(rs, "ts"),
                        rs.getString("created_by")
                    ));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new VaultStorageException("Failed to list events after " + afterSeq, e);
        }
        return events;
    }

    @Override
    public long latestEventSeq() {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COALESCE(MAX(seq), 0) FROM vault_events");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new VaultStorageException("Failed to read latest event seq", e);
        }
    }

    @Override
    public void afterCommit(Runnable hook) {
        requireWritable();
        afterCommit.add(hook);
    }

    private DepositRecord mapDeposit(ResultSet rs) throws SQLException {
        return new DepositRecord(
            rs.getInt("deposit_index"),
            rs.getBigDecimal("amount").stripTrailingZeros(),
            getInstant(rs, "created_at"),
            getInstant(rs, "lock_until"),
            DepositState.valueOf(rs.getString("deposit_state")),
            rs.getBoolean("withdrawn")
        );
    }

    // Columns are TIMESTAMP WITH TIME ZONE; always bind and read in UTC.
    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        ps.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
