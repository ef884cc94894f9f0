package ch.so.arp.rag.hybrid.web;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

import ch.so.arp.rag.hybrid.bridge.BridgeIndex;
import ch.so.arp.rag.hybrid.bridge.BridgeMapping;
import ch.so.arp.rag.hybrid.catalog.Chunk;
import ch.so.arp.rag.hybrid.catalog.ContentCatalog;
import ch.so.arp.rag.hybrid.catalog.GraphNode;
import ch.so.arp.rag.hybrid.catalog.Relationship;

/**
 * Ingestion of externally produced chunks, graph nodes and seed bridge
 * mappings.
 */
@RestController
@RequestMapping(path = "/api/catalog", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class CatalogController {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogController.class);

    private static final double DEFAULT_INITIAL_WEIGHT = 0.5d;
    private static final double DEFAULT_CONFIDENCE = 1.0d;

    private final ContentCatalog contentCatalog;
    private final BridgeIndex bridgeIndex;

    public CatalogController(ContentCatalog contentCatalog, BridgeIndex bridgeIndex) {
        this.contentCatalog = contentCatalog;
        this.bridgeIndex = bridgeIndex;
    }

    @PostMapping(path = "/chunks", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Chunk putChunk(@Valid @RequestBody CatalogRequests.ChunkRequest request) {
        Chunk chunk = new Chunk(request.id(), request.embedding(), request.contentType());
        contentCatalog.putChunk(chunk);
        return chunk;
    }

    @PostMapping(path = "/nodes", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public GraphNode putNode(@Valid @RequestBody CatalogRequests.NodeRequest request) {
        List<Relationship> relationships = request.relationships() == null ? List.of()
                : request.relationships().stream()
                        .map(edge -> new Relationship(edge.relationType(), edge.targetId()))
                        .toList();
        GraphNode node = new GraphNode(request.id(), request.type(), relationships);
        contentCatalog.putNode(node);
        LOGGER.debug("Stored graph node {} with {} relationships", node.id(), relationships.size());
        return node;
    }

    @PostMapping(path = "/mappings", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BridgeMapping putMapping(@Valid @RequestBody CatalogRequests.MappingRequest request) {
        return bridgeIndex.upsertMapping(request.chunkId(), request.nodeId(), request.relationType(),
                request.initialWeight() != null ? request.initialWeight() : DEFAULT_INITIAL_WEIGHT,
                request.confidence() != null ? request.confidence() : DEFAULT_CONFIDENCE);
    }

    @GetMapping("/chunks/{chunkId}/mappings")
    public List<BridgeMapping> mappingsOfChunk(@PathVariable String chunkId) {
        return bridgeIndex.getNodesForChunk(chunkId);
    }

    @GetMapping("/nodes/{nodeId}/mappings")
    public List<BridgeMapping> mappingsOfNode(@PathVariable String nodeId,
            @RequestParam(required = false) String relationType) {
        return bridgeIndex.getChunksForNode(nodeId, relationType);
    }
}
