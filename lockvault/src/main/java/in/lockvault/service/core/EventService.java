package in.lockvault.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.lockvault.application.port.output.VaultRepository;
import in.lockvault.application.port.output.VaultTransaction;
import in.lockvault.domain.common.EventType;
import in.lockvault.domain.common.VaultEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event Service.
 * Reliability rule: append to the log inside the caller's transaction, push to listeners only
 * after that transaction commits. A rolled-back call leaves no event behind.
 */
public final class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final VaultRepository repository;
    private final List<VaultEventListener> listeners = new CopyOnWriteArrayList<>();

    public EventService(VaultRepository repository) {
        this.repository = repository;
    }

    public void addListener(VaultEventListener listener) {
        listeners.add(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // EMISSION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Emit an account-scoped event within an open transaction.
     */
    public VaultEvent emit(VaultTransaction tx, EventType type, String account, Object payloadPojo,
                           Instant ts, String createdBy) {
        JsonNode payload = MAPPER.valueToTree(payloadPojo);
        VaultEvent persisted = tx.appendEvent(new VaultEvent(0, type, account, payload, ts, createdBy));
        tx.afterCommit(() -> broadcast(persisted));
        return persisted;
    }

    /**
     * Emit a vault-wide event within an open transaction.
     */
    public VaultEvent emitGlobal(VaultTransaction tx, EventType type, Object payloadPojo,
                                 Instant ts, String createdBy) {
        return emit(tx, type, null, payloadPojo, ts, createdBy);
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════

    public List<VaultEvent> listAfter(long afterSeq, int limit) {
        return repository.readOnly(tx -> tx.listEventsAfter(afterSeq, limit));
    }

    public long currentSeq() {
        return repository.readOnly(VaultTransaction::latestEventSeq);
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private void broadcast(VaultEvent e) {
        log.debug("Event emitted: seq={}, type={}, account={}", e.seq(), e.type(), e.account());
        for (VaultEventListener listener : listeners) {
            try {
                listener.onEvent(e);
            } catch (RuntimeException ex) {
                // Already committed: log and keep notifying the rest.
                log.error("Listener {} failed on event seq={}: {}",
                          listener.getClass().getSimpleName(), e.seq(), ex.getMessage(), ex);
            }
        }
    }
}
