package ch.so.arp.rag.hybrid.retrieval;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.InputValidationException;
import ch.so.arp.rag.hybrid.catalog.Chunk;
import ch.so.arp.rag.hybrid.catalog.ContentCatalog;

/**
 * Exact cosine search over the chunks of the {@link ContentCatalog}. Similarity
 * is reported as {@code (cos + 1) / 2}; a zero vector on either side scores 0.5.
 */
public class InMemoryVectorIndex implements VectorSimilaritySearcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private static final Comparator<VectorMatch> RANKING = Comparator.comparingDouble(VectorMatch::score).reversed()
            .thenComparing(VectorMatch::chunkId);

    private final ContentCatalog catalog;

    public InMemoryVectorIndex(ContentCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public List<VectorMatch> search(float[] embedding, int topN, Set<String> contentTypes) {
        if (embedding == null || embedding.length != catalog.embeddingDimensions()) {
            throw new InputValidationException("Query embedding must have " + catalog.embeddingDimensions()
                    + " dimensions");
        }
        if (topN <= 0) {
            return List.of();
        }
        boolean filtered = contentTypes != null && !contentTypes.isEmpty();
        double queryNorm = norm(embedding);
        List<VectorMatch> matches = catalog.chunks().stream()
                .filter(chunk -> !filtered || contentTypes.contains(chunk.contentType()))
                .map(chunk -> new VectorMatch(chunk.id(), chunk.contentType(), similarity(embedding, queryNorm, chunk)))
                .sorted(RANKING)
                .limit(topN)
                .toList();
        LOGGER.debug("Vector search returned {} of at most {} chunks", matches.size(), topN);
        return matches;
    }

    private static double similarity(float[] query, double queryNorm, Chunk chunk) {
        float[] candidate = chunk.embedding();
        double candidateNorm = norm(candidate);
        if (queryNorm == 0.0d || candidateNorm == 0.0d) {
            return 0.5d;
        }
        double dot = 0.0d;
        for (int i = 0; i < query.length; i++) {
            dot += (double) query[i] * candidate[i];
        }
        double cosine = Math.max(-1.0d, Math.min(1.0d, dot / (queryNorm * candidateNorm)));
        return (cosine + 1.0d) / 2.0d;
    }

    private static double norm(float[] vector) {
        double sum = 0.0d;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }
}
