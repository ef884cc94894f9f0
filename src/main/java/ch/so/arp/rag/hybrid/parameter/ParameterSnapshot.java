package ch.so.arp.rag.hybrid.parameter;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Consistent, read-only view of all parameters used by one retrieval. Queries
 * keep working against their snapshot while updates commit new versions.
 */
public record ParameterSnapshot(Map<String, VersionedParameter> parameters, Instant takenAt) {

    public ParameterSnapshot {
        parameters = Map.copyOf(parameters);
    }

    public Optional<VersionedParameter> find(String key) {
        return Optional.ofNullable(parameters.get(key));
    }

    public double scalar(String key, double fallback) {
        VersionedParameter parameter = parameters.get(key);
        return parameter == null ? fallback : parameter.value();
    }

    public double[] values(String key) {
        VersionedParameter parameter = parameters.get(key);
        return parameter == null ? new double[0] : parameter.values();
    }

    /**
     * Versions of every parameter, sorted by key, recorded in retrieval traces.
     */
    public Map<String, Long> versions() {
        Map<String, Long> versions = new TreeMap<>();
        parameters.forEach((key, parameter) -> versions.put(key, parameter.version()));
        return versions;
    }
}
