package in.lockvault.infrastructure.persistence;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.lockvault.application.port.output.VaultRepository;
import in.lockvault.domain.deposit.DepositRecord;
import in.lockvault.domain.deposit.LockPeriod;
import in.lockvault.domain.role.TimedRole;
import in.lockvault.migration.VaultSchemaMigration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.TimeZone;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the repository contract over JDBC against H2 in PostgreSQL mode.
 */
class PostgresVaultRepositoryTest extends VaultRepositoryContract {

    private HikariDataSource dataSource;

    @Override
    protected VaultRepository createRepository() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:vault-" + UUID.randomUUID()
            + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        config.setUsername("sa");
        config.setPassword("");
        config.setMaximumPoolSize(4);
        config.setPoolName("vault-test");
        dataSource = new HikariDataSource(config);

        new VaultSchemaMigration(dataSource).migrate();
        return new PostgresVaultRepository(dataSource);
    }

    @AfterEach
    void closePool() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    @Test
    void migrationIsRepeatable() {
        repository.inTransaction(tx -> {
            tx.adjustTotalLocked(new BigDecimal("2.5"));
            return null;
        });

        new VaultSchemaMigration(dataSource).migrate();

        assertEquals(0, new BigDecimal("2.5").compareTo(repository.readOnly(tx -> tx.totalLocked())));
    }

    @Test
    void decimalsSurviveTheRoundTrip() {
        repository.inTransaction(tx -> {
            tx.adjustTotalLocked(new BigDecimal("0.000000000000000001"));
            tx.addLifetimeDeposited("a", new BigDecimal("0.002"));
            return null;
        });

        assertEquals(0, new BigDecimal("0.000000000000000001").compareTo(repository.readOnly(tx -> tx.totalLocked())));
        assertEquals("0.002", repository.readOnly(tx -> tx.lifetimeDeposited("a")).toPlainString());
    }

    @Test
    void instantsSurviveDaylightSavingOverlap() {
        TimeZone original = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
        try {
            // Both are 01:30 local time on the night New York falls back.
            Instant firstPass = Instant.parse("2024-11-03T05:30:00Z");
            Instant secondPass = Instant.parse("2024-11-03T06:30:00Z");

            repository.inTransaction(tx -> {
                tx.appendDeposit("a", DepositRecord.open(BigDecimal.ONE, firstPass, LockPeriod.SHORT));
                tx.appendDeposit("a", DepositRecord.open(BigDecimal.ONE, secondPass, LockPeriod.SHORT));
                tx.saveTimedRole(TimedRole.activate("a", firstPass, Duration.ofHours(1)));
                return null;
            });

            List<DepositRecord> deposits = repository.readOnly(tx -> tx.findDeposits("a"));
            assertEquals(firstPass, deposits.get(0).createdAt());
            assertEquals(secondPass, deposits.get(1).createdAt());
            assertEquals(secondPass.plus(LockPeriod.SHORT.getDuration()), deposits.get(1).lockUntil());

            TimedRole stored = repository.readOnly(tx -> tx.findTimedRole("a")).orElseThrow();
            assertEquals(secondPass, stored.expiry());
        } finally {
            TimeZone.setDefault(original);
        }
    }
}
