package in.lockvault.application.service;

import in.lockvault.application.port.output.VaultRepository;
import in.lockvault.domain.common.EventType;
import in.lockvault.domain.common.VaultErrorCode;
import in.lockvault.domain.exception.VaultException;
import in.lockvault.security.InputValidator;
import in.lockvault.service.core.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Holds the vault's administrative owner. Only the current owner may hand it on.
 * Ownership gates no deposit, withdrawal or sweep path.
 */
public final class OwnershipService {
    private static final Logger log = LoggerFactory.getLogger(OwnershipService.class);

    private final VaultRepository repository;
    private final EventService eventService;
    private final InputValidator validator;
    private final Clock clock;

    private final Object lock = new Object();
    private volatile String owner;

    public OwnershipService(VaultRepository repository, EventService eventService, InputValidator validator,
                            Clock clock, String initialOwner) {
        this.repository = repository;
        this.eventService = eventService;
        this.validator = validator;
        this.clock = clock;
        this.owner = validator.validateAccount(initialOwner);
    }

    public String getOwner() {
        return owner;
    }

    /**
     * @throws VaultException NOT_OWNER if {@code caller} is not the current owner,
     *                        INVALID_ACCOUNT if {@code newOwner} is malformed
     */
    public void transferOwnership(String caller, String newOwner) {
        synchronized (lock) {
            if (caller == null || !caller.equals(owner)) {
                log.warn("Ownership transfer rejected: {} is not the owner", caller);
                throw new VaultException(VaultErrorCode.NOT_OWNER, "Caller is not the vault owner: " + caller);
            }
            validator.validateAccount(newOwner);

            String previous = owner;
            Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            repository.inTransaction(tx -> {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("previousOwner", previous);
                payload.put("newOwner", newOwner);
                return eventService.emitGlobal(tx, EventType.OWNERSHIP_TRANSFERRED, payload, now, caller);
            });
            owner = newOwner;

            log.info("Vault ownership transferred: {} → {}", previous, newOwner);
        }
    }
}
