package in.lockvault.service.core;

import in.lockvault.domain.common.EventType;
import in.lockvault.domain.common.VaultEvent;
import in.lockvault.infrastructure.persistence.InMemoryVaultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventServiceTest {

    private static final Instant TS = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private VaultEventListener listener;

    private InMemoryVaultRepository repository;
    private EventService eventService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryVaultRepository();
        eventService = new EventService(repository);
        eventService.addListener(listener);
    }

    @Test
    void broadcastsOnlyAfterCommit() {
        repository.inTransaction(tx -> {
            eventService.emit(tx, EventType.DEPOSITED, "a", Map.of("amount", "1"), TS, "a");
            verifyNoInteractions(listener);
            return null;
        });

        ArgumentCaptor<VaultEvent> captor = ArgumentCaptor.forClass(VaultEvent.class);
        verify(listener).onEvent(captor.capture());
        assertEquals(1L, captor.getValue().seq());
        assertEquals("1", captor.getValue().payload().get("amount").asText());
    }

    @Test
    void rolledBackEventsAreNeitherStoredNorBroadcast() {
        assertThrows(IllegalStateException.class, () -> repository.inTransaction(tx -> {
            eventService.emit(tx, EventType.DEPOSITED, "a", Map.of("amount", "1"), TS, "a");
            throw new IllegalStateException("abort");
        }));

        verifyNoInteractions(listener);
        assertEquals(0L, eventService.currentSeq());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        VaultEventListener second = mock(VaultEventListener.class);
        eventService.addListener(second);
        doThrow(new RuntimeException("listener down")).when(listener).onEvent(any());

        repository.inTransaction(tx ->
            eventService.emitGlobal(tx, EventType.SWEEP_COMPLETED, Map.of("expired", 2), TS, "trigger"));

        verify(second).onEvent(any());
        assertEquals(1, eventService.listAfter(0, 10).size());
        assertNull(eventService.listAfter(0, 10).get(0).account());
    }
}
