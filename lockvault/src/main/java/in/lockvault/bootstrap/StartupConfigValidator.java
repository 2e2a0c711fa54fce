package in.lockvault.bootstrap;

import in.lockvault.config.VaultConfig;
import in.lockvault.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Validates configuration at startup before the system initializes.
 * Throws IllegalStateException if configuration is invalid; the service refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(VaultConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Network: {}, storage: {}", config.network(), config.storage());

        if (config.sweepPollInterval() == null || config.sweepPollInterval().isNegative()
                || config.sweepPollInterval().isZero()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: SWEEP_POLL_INTERVAL_SECONDS must be positive, got " + config.sweepPollInterval()
            );
        }
        log.info("✓ Sweep poll interval {}s", config.sweepPollInterval().toSeconds());

        if (config.triggerRegistryId() == null || config.triggerRegistryId().isBlank()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: TRIGGER_REGISTRY_ID is blank\n" +
                "Either:\n" +
                "  1. Set TRIGGER_REGISTRY_ID explicitly\n" +
                "  2. Choose a NETWORK with a default registry (local, testnet, mainnet)"
            );
        }
        log.info("✓ Trigger registry {}", config.triggerRegistryId());

        if (!new InputValidator().isValidAccount(config.owner())) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: VAULT_OWNER is missing or malformed: " + config.owner()
            );
        }
        log.info("✓ Vault owner {}", config.owner());

        if (config.storage() == VaultConfig.StorageType.POSTGRES
                && (config.dbUrl() == null || config.dbUrl().isBlank())) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: STORAGE=POSTGRES requires DB_URL\n" +
                "Either:\n" +
                "  1. Set DB_URL (and DB_USER / DB_PASS)\n" +
                "  2. Set STORAGE=MEMORY for local runs"
            );
        }

        if (config.storage() == VaultConfig.StorageType.MEMORY) {
            log.warn("⚠️  In-memory storage: state is lost on restart");
        }
        if (!config.selfScheduledSweep()) {
            log.info("Expiry sweep relies on the external trigger (SELF_SCHEDULED_SWEEP=false)");
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
