package ch.so.arp.rag.hybrid.web;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

import ch.so.arp.rag.hybrid.HybridRetrievalProperties;
import ch.so.arp.rag.hybrid.retrieval.HybridRetrievalService;
import ch.so.arp.rag.hybrid.retrieval.RetrievalQuery;
import ch.so.arp.rag.hybrid.retrieval.RetrievalResult;

/**
 * REST endpoint running a hybrid retrieval for a preprocessed query.
 */
@RestController
@RequestMapping(path = "/api/retrieve", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class RetrievalController {

    private final HybridRetrievalService retrievalService;
    private final HybridRetrievalProperties properties;

    public RetrievalController(HybridRetrievalService retrievalService, HybridRetrievalProperties properties) {
        this.retrievalService = retrievalService;
        this.properties = properties;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public RetrievalResult retrieve(@Valid @RequestBody RetrievalRequest request) {
        int topK = request.topK() != null ? request.topK() : properties.getRetrieval().getDefaultTopK();
        return retrievalService.retrieve(new RetrievalQuery(request.queryEmbedding(), request.anchorNodes(),
                request.domain(), topK, request.contentTypes(), request.continueTraceId()));
    }
}
