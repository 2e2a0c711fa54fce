package in.lockvault.migration;

import in.lockvault.domain.exception.VaultStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Vault Schema Migration - creates the vault tables on startup.
 *
 * Tables:
 * - vault_totals: single row (id = 1) holding the global locked total; also the writer lock row
 * - vault_deposits: per-account deposit slots, keyed by (account_id, deposit_index)
 * - vault_account_totals: lifetime deposited per account
 * - vault_account_roles: permanent roles
 * - vault_timed_roles: temporary role instances
 * - vault_temp_role_registry: ordered temp-role holders, one row per account
 * - vault_events: append-only event log
 */
public final class VaultSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(VaultSchemaMigration.class);

    public static final int TOTALS_ROW_ID = 1;

    private static final String[] DDL = {
        """
        CREATE TABLE IF NOT EXISTS vault_totals (
            id INT PRIMARY KEY,
            total_locked NUMERIC(38, 18) NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS vault_deposits (
            account_id VARCHAR(128) NOT NULL,
            deposit_index INT NOT NULL,
            amount NUMERIC(38, 18) NOT NULL,
            created_at TIMESTAMP WITH TIME ZONE NOT NULL,
            lock_until TIMESTAMP WITH TIME ZONE NOT NULL,
            deposit_state VARCHAR(16) NOT NULL,
            withdrawn BOOLEAN NOT NULL,
            PRIMARY KEY (account_id, deposit_index)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS vault_account_totals (
            account_id VARCHAR(128) PRIMARY KEY,
            lifetime_deposited NUMERIC(38, 18) NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS vault_account_roles (
            account_id VARCHAR(128) NOT NULL,
            role_name VARCHAR(32) NOT NULL,
            PRIMARY KEY (account_id, role_name)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS vault_timed_roles (
            account_id VARCHAR(128) PRIMARY KEY,
            active BOOLEAN NOT NULL,
            last_active TIMESTAMP WITH TIME ZONE NOT NULL,
            expiry TIMESTAMP WITH TIME ZONE NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS vault_temp_role_registry (
            registry_position INT PRIMARY KEY,
            account_id VARCHAR(128) NOT NULL UNIQUE
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS vault_events (
            seq BIGINT PRIMARY KEY,
            event_type VARCHAR(32) NOT NULL,
            account_id VARCHAR(128),
            payload TEXT NOT NULL,
            ts TIMESTAMP WITH TIME ZONE NOT NULL,
            created_by VARCHAR(128)
        )
        """
    };

    private final DataSource dataSource;

    public VaultSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates missing tables and seeds the totals row. Safe to run repeatedly.
     */
    public void migrate() {
        log.info("[VAULT MIGRATION] Starting vault schema migration");

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                for (String ddl : DDL) {
                    stmt.execute(ddl);
                }
            }
            seedTotalsRow(conn);
            conn.commit();
            log.info("[VAULT MIGRATION] Migration completed successfully");
        } catch (SQLException e) {
            log.error("[VAULT MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new VaultStorageException("Vault schema migration failed", e);
        }
    }

    private void seedTotalsRow(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM vault_totals WHERE id = ?")) {
            ps.setInt(1, TOTALS_ROW_ID);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next() && rs.getInt(1) > 0) {
                    log.info("[VAULT MIGRATION] vault_totals row already present");
                    return;
                }
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO vault_totals (id, total_locked) VALUES (?, 0)")) {
            ps.setInt(1, TOTALS_ROW_ID);
            ps.executeUpdate();
        }
        log.info("[VAULT MIGRATION] ✓ vault_totals row seeded");
    }
}
