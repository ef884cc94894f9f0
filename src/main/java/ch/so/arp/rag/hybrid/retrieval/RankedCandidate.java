package ch.so.arp.rag.hybrid.retrieval;

/**
 * Entry of the combined ranking returned to the caller.
 */
public record RankedCandidate(int rank, String chunkId, double score, RerankFeatures features) {
}
