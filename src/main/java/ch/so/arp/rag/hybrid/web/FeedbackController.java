package ch.so.arp.rag.hybrid.web;

import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

import ch.so.arp.rag.hybrid.feedback.FeedbackAck;
import ch.so.arp.rag.hybrid.feedback.FeedbackEvent;
import ch.so.arp.rag.hybrid.feedback.FeedbackService;

/**
 * REST endpoints ingesting feedback and its later consensus validation.
 */
@RestController
@RequestMapping(path = "/api/feedback", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class FeedbackController {

    private final FeedbackService feedbackService;

    public FeedbackController(FeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public FeedbackAck ingest(@RequestBody FeedbackEvent event) {
        return feedbackService.ingest(event);
    }

    @PostMapping(path = "/{feedbackId}/validation", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> validate(@PathVariable String feedbackId,
            @Valid @RequestBody ValidationRequest request) {
        feedbackService.validate(feedbackId, request.confirmed());
        return ResponseEntity.accepted().body(Map.of("feedbackId", feedbackId, "levels", request.confirmed().keySet()));
    }
}
