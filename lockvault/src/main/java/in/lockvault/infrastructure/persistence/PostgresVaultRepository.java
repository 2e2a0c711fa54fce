package in.lockvault.infrastructure.persistence;

import in.lockvault.application.port.output.VaultRepository;
import in.lockvault.application.port.output.VaultTransaction;
import in.lockvault.domain.exception.VaultStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.Function;

/**
 * PostgreSQL implementation of VaultRepository.
 *
 * One JDBC transaction per vault operation. Writers take a row lock on the vault_totals row
 * first, which serializes every mutating call across all service instances.
 */
public final class PostgresVaultRepository implements VaultRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresVaultRepository.class);

    private final DataSource dataSource;

    public PostgresVaultRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public <T> T inTransaction(Function<VaultTransaction, T> work) {
        JdbcVaultTransaction tx;
        T result;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                tx = new JdbcVaultTransaction(conn, false);
                tx.lockTotals();
                result = work.apply(tx);
                conn.commit();
            } catch (RuntimeException | Error e) {
                rollbackQuietly(conn, e);
                throw e;
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw new VaultStorageException("Vault transaction failed", e);
            }
        } catch (SQLException e) {
            log.error("Vault transaction failed: {}", e.getMessage());
            throw new VaultStorageException("Vault transaction failed", e);
        }

        tx.runAfterCommitHooks();
        return result;
    }

    @Override
    public <T> T readOnly(Function<VaultTransaction, T> query) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            conn.setReadOnly(true);
            try {
                return query.apply(new JdbcVaultTransaction(conn, true));
            } finally {
                conn.rollback();
                conn.setReadOnly(false);
            }
        } catch (SQLException e) {
            log.error("Vault query failed: {}", e.getMessage());
            throw new VaultStorageException("Vault query failed", e);
        }
    }

    private static void rollbackQuietly(Connection conn, Throwable cause) {
        try {
            conn.rollback();
            log.debug("Vault transaction rolled back: {}", cause.getMessage());
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
            log.error("Rollback failed after '{}': {}", cause.getMessage(), rollbackError.getMessage());
        }
    }
}
