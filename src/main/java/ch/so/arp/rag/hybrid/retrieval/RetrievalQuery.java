package ch.so.arp.rag.hybrid.retrieval;

import java.util.List;
import java.util.Set;

/**
 * Structured query as produced by upstream preprocessing.
 *
 * @param anchorNodes     graph nodes recognised in the query, may be empty
 * @param contentTypes    optional content type filter
 * @param continueTraceId trace to extend with a follow-up iteration, or
 *                        {@code null} to start a new one
 */
public record RetrievalQuery(
        float[] embedding,
        List<String> anchorNodes,
        String domain,
        int topK,
        Set<String> contentTypes,
        String continueTraceId) {

    public RetrievalQuery {
        embedding = embedding == null ? null : embedding.clone();
        anchorNodes = anchorNodes == null ? List.of() : List.copyOf(anchorNodes);
        contentTypes = contentTypes == null ? Set.of() : Set.copyOf(contentTypes);
    }

    public static RetrievalQuery of(float[] embedding, List<String> anchorNodes, String domain, int topK) {
        return new RetrievalQuery(embedding, anchorNodes, domain, topK, Set.of(), null);
    }
}
