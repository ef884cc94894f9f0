package ch.so.arp.rag.hybrid.feedback;

import java.time.Instant;

/**
 * Structured feedback on one retrieval trace. Every layer judgment is optional.
 */
public record FeedbackEvent(
        String id,
        String traceId,
        String userId,
        Instant timestamp,
        RetrievalJudgment retrieval,
        ReasoningJudgment reasoning,
        SynthesisJudgment synthesis) {
}
