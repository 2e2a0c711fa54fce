package in.lockvault.config;

import java.time.Duration;

/**
 * Deployment targets and the external-trigger defaults each one ships with.
 */
public enum NetworkProfile {
    LOCAL("local-trigger-registry", Duration.ofSeconds(60)),
    TESTNET("testnet-trigger-registry", Duration.ofMinutes(5)),
    MAINNET("mainnet-trigger-registry", Duration.ofMinutes(15));

    private final String defaultRegistryId;
    private final Duration defaultPollInterval;

    NetworkProfile(String defaultRegistryId, Duration defaultPollInterval) {
        this.defaultRegistryId = defaultRegistryId;
        this.defaultPollInterval = defaultPollInterval;
    }

    public String getDefaultRegistryId() {
        return defaultRegistryId;
    }

    public Duration getDefaultPollInterval() {
        return defaultPollInterval;
    }
}
