package ch.so.arp.rag.hybrid.retrieval;

import ch.so.arp.rag.hybrid.bridge.BridgeMapping;

/**
 * Chunk scored by one strategy.
 *
 * @param graphScore best {@code link weight × node score}, or the neutral score
 *                   when {@link #linked()} is false
 * @param link       bridge mapping that produced the graph score, {@code null}
 *                   when no link reached an anchor
 * @param path       graph path behind {@link #link()}, {@code null} alike
 */
public record ScoredCandidate(
        String chunkId,
        double vectorScore,
        double graphScore,
        double alpha,
        double finalScore,
        boolean linked,
        BridgeMapping link,
        GraphPath path) {
}
