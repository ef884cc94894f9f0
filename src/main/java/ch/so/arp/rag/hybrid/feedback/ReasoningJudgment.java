package ch.so.arp.rag.hybrid.feedback;

import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Judgment of the strategies' contributions.
 *
 * @param strategyCorrect   correctness per strategy id; strategies without an
 *                          entry count as 0.5
 * @param preferredStrategy strategy the user considers best, used as supervised
 *                          gating target when present
 */
public record ReasoningJudgment(
        @JsonDeserialize(contentUsing = JudgmentScoreDeserializer.class) Map<String, Double> strategyCorrect,
        @JsonDeserialize(using = JudgmentScoreDeserializer.class) Double reasoningCoherent,
        String preferredStrategy) {

    public ReasoningJudgment {
        strategyCorrect = strategyCorrect == null ? Map.of() : Map.copyOf(strategyCorrect);
    }
}
