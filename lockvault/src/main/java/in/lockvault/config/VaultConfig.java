package in.lockvault.config;

import in.lockvault.util.Env;

import java.time.Duration;

/**
 * Service configuration, read once at startup.
 */
public record VaultConfig(
    int port,
    StorageType storage,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,
    String owner,
    NetworkProfile network,
    String triggerRegistryId,
    Duration sweepPollInterval,
    boolean selfScheduledSweep
) {
    public enum StorageType { MEMORY, POSTGRES }

    public static VaultConfig fromEnv() {
        NetworkProfile network = Env.getEnum("NETWORK", NetworkProfile.class, NetworkProfile.LOCAL);
        long pollSeconds = Env.getLong("SWEEP_POLL_INTERVAL_SECONDS", network.getDefaultPollInterval().toSeconds());

        return new VaultConfig(
            Env.getInt("PORT", 9090),
            Env.getEnum("STORAGE", StorageType.class, StorageType.MEMORY),
            Env.get("DB_URL", null),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10),
            Env.get("VAULT_OWNER", "vault-admin"),
            network,
            Env.get("TRIGGER_REGISTRY_ID", network.getDefaultRegistryId()),
            Duration.ofSeconds(pollSeconds),
            Env.getBool("SELF_SCHEDULED_SWEEP", false)
        );
    }

    /**
     * Local in-memory defaults, used by tests.
     */
    public static VaultConfig defaults() {
        NetworkProfile network = NetworkProfile.LOCAL;
        return new VaultConfig(9090, StorageType.MEMORY, null, "postgres", "postgres", 10,
            "vault-admin", network, network.getDefaultRegistryId(), network.getDefaultPollInterval(), false);
    }
}
