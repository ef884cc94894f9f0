package ch.so.arp.rag.hybrid.feedback;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Judgment of the final answer and of the ranking it was built from.
 *
 * @param preferredChunkId chunk that should have been ranked first, must have
 *                         been presented in the trace
 */
public record SynthesisJudgment(
        @JsonDeserialize(using = JudgmentScoreDeserializer.class) Double finalAnswerCorrect,
        @JsonDeserialize(using = JudgmentScoreDeserializer.class) Double rankingCorrect,
        String preferredChunkId) {
}
