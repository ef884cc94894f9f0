package ch.so.arp.rag.hybrid.retrieval;

/**
 * Chunk returned by the vector searcher.
 *
 * @param score cosine similarity mapped to [0,1]
 */
public record VectorMatch(String chunkId, String contentType, double score) {
}
