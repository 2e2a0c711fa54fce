package in.lockvault.service.core;

import in.lockvault.domain.common.VaultEvent;

/**
 * Receives committed vault events.
 */
@FunctionalInterface
public interface VaultEventListener {
    void onEvent(VaultEvent event);
}
