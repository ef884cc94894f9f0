package ch.so.arp.rag.hybrid.learning;

import java.time.Instant;

/**
 * Outcome of one decay sweep.
 *
 * @param examined traversal weights looked at
 * @param decayed  weights that received a new version
 */
public record DecayReport(Instant sweptAt, int examined, int decayed) {
}
