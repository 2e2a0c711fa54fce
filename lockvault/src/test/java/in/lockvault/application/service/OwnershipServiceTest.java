package in.lockvault.application.service;

import in.lockvault.domain.common.EventType;
import in.lockvault.domain.common.VaultErrorCode;
import in.lockvault.domain.common.VaultEvent;
import in.lockvault.domain.exception.VaultException;
import in.lockvault.infrastructure.persistence.InMemoryVaultRepository;
import in.lockvault.security.InputValidator;
import in.lockvault.service.core.EventService;
import in.lockvault.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Vault ownership")
class OwnershipServiceTest {

    private EventService eventService;
    private OwnershipService ownership;

    @BeforeEach
    void setUp() {
        InMemoryVaultRepository repository = new InMemoryVaultRepository();
        eventService = new EventService(repository);
        ownership = new OwnershipService(repository, eventService, new InputValidator(),
            MutableClock.startingAt("2024-01-01T00:00:00Z"), "vault-admin");
    }

    @Test
    @DisplayName("The owner can hand ownership on")
    void transfer() {
        ownership.transferOwnership("vault-admin", "ops-team");

        assertEquals("ops-team", ownership.getOwner());
        List<VaultEvent> events = eventService.listAfter(0, 10);
        assertEquals(1, events.size());
        assertEquals(EventType.OWNERSHIP_TRANSFERRED, events.get(0).type());
        assertEquals("ops-team", events.get(0).payload().get("newOwner").asText());
    }

    @Test
    @DisplayName("Anyone else is refused")
    void notOwner() {
        VaultException e = assertThrows(VaultException.class,
            () -> ownership.transferOwnership("intruder", "intruder"));

        assertEquals(VaultErrorCode.NOT_OWNER, e.getCode());
        assertEquals("vault-admin", ownership.getOwner());

        ownership.transferOwnership("vault-admin", "ops-team");
        assertThrows(VaultException.class, () -> ownership.transferOwnership("vault-admin", "vault-admin"));
    }

    @Test
    @DisplayName("A malformed new owner is refused")
    void malformedOwner() {
        VaultException e = assertThrows(VaultException.class,
            () -> ownership.transferOwnership("vault-admin", "not an account!"));

        assertEquals(VaultErrorCode.INVALID_ACCOUNT, e.getCode());
        assertTrue(eventService.listAfter(0, 10).isEmpty());
    }
}
