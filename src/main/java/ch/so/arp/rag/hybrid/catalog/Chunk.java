package ch.so.arp.rag.hybrid.catalog;

import java.util.Objects;

/**
 * Content chunk produced by the ingestion pipeline. Chunks are immutable; the
 * embedding array is copied on the way in.
 */
public record Chunk(String id, float[] embedding, String contentType) {

    public Chunk {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(embedding, "embedding");
        embedding = embedding.clone();
        contentType = contentType == null ? "" : contentType;
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }
}
