package ch.so.arp.rag.hybrid.feedback;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Judgment of the retrieved sources. Missing values count as 0.5.
 */
public record RetrievalJudgment(
        @JsonDeserialize(using = JudgmentScoreDeserializer.class) Double sourcesRelevant,
        @JsonDeserialize(using = JudgmentScoreDeserializer.class) Double sourcesComplete,
        @JsonDeserialize(using = JudgmentScoreDeserializer.class) Double rankingQuality) {
}
