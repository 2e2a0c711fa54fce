package in.lockvault.domain.role;

import java.util.List;

/**
 * Answer to the external trigger's "is work needed" probe.
 *
 * @param candidates lapsed temporary-role holders, at most one batch
 */
public record ExpiryProbeResult(boolean workNeeded, List<String> candidates) {

    public static ExpiryProbeResult of(List<String> candidates) {
        return new ExpiryProbeResult(!candidates.isEmpty(), List.copyOf(candidates));
    }
}
