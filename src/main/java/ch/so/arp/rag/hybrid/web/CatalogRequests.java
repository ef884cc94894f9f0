package ch.so.arp.rag.hybrid.web;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Payloads of the ingestion endpoints.
 */
public final class CatalogRequests {

    private CatalogRequests() {
    }

    public record ChunkRequest(@NotBlank String id, @NotNull float[] embedding, @NotBlank String contentType) {
    }

    public record NodeRequest(@NotBlank String id, @NotBlank String type, List<@Valid RelationshipRequest> relationships) {
    }

    public record RelationshipRequest(@NotBlank String relationType, @NotBlank String targetId) {
    }

    /**
     * Seed structure for a bridge link. Weight defaults to 0.5 and confidence to
     * 1; re-sending a mapping keeps its learned weight.
     */
    public record MappingRequest(
            @NotBlank String chunkId,
            @NotBlank String nodeId,
            @NotBlank String relationType,
            @DecimalMin("0.0") @DecimalMax("1.0") Double initialWeight,
            @DecimalMin("0.0") @DecimalMax("1.0") Double confidence) {
    }
}
