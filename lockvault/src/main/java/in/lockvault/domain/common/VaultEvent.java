package in.lockvault.domain.common;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Entry in the append-only vault event log.
 */
public record VaultEvent(
    long seq,
    EventType type,
    String account,          // null for vault-wide events
    JsonNode payload,
    Instant ts,
    String createdBy
) {
    public VaultEvent withSeq(long newSeq) {
        return new VaultEvent(newSeq, type, account, payload, ts, createdBy);
    }
}
