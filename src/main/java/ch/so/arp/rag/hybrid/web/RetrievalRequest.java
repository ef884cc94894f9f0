package ch.so.arp.rag.hybrid.web;

import java.util.List;
import java.util.Set;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Incoming payload for retrieval requests.
 */
public record RetrievalRequest(
        @NotNull float[] queryEmbedding,
        List<String> anchorNodes,
        String domain,
        @Min(1) Integer topK,
        Set<String> contentTypes,
        String continueTraceId) {
}
