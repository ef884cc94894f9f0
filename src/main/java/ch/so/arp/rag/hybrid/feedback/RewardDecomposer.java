package ch.so.arp.rag.hybrid.feedback;

import java.util.List;
import java.util.Objects;

import ch.so.arp.rag.hybrid.parameter.Strategy;
import ch.so.arp.rag.hybrid.parameter.WeightSchema;
import ch.so.arp.rag.hybrid.retrieval.TraceIteration;

/**
 * Turns one feedback event into a reward per level:
 * <ul>
 * <li>retrieval = 0.4 · sourcesRelevant + 0.3 · sourcesComplete + 0.3 · rankingQuality</li>
 * <li>reasoning = 0.6 · Σ gate(s) · correct(s) + 0.4 · reasoningCoherent</li>
 * <li>synthesis = 0.6 · finalAnswerCorrect + 0.4 · rankingCorrect</li>
 * </ul>
 * Missing judgments count as {@value #NEUTRAL}.
 */
public class RewardDecomposer {

    public static final double NEUTRAL = 0.5d;

    private final WeightSchema schema;

    public RewardDecomposer(WeightSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    /**
     * @param iteration the iteration the final answer was built from; its gate
     *                  weighs the per-strategy correctness
     */
    public LayerRewards decompose(FeedbackEvent event, TraceIteration iteration) {
        RetrievalJudgment retrieval = event.retrieval();
        double rRetrieval = retrieval == null ? NEUTRAL
                : 0.4d * orNeutral(retrieval.sourcesRelevant())
                        + 0.3d * orNeutral(retrieval.sourcesComplete())
                        + 0.3d * orNeutral(retrieval.rankingQuality());

        ReasoningJudgment reasoning = event.reasoning();
        double rReasoning;
        if (reasoning == null) {
            rReasoning = NEUTRAL;
        } else {
            double[] gate = iteration.gate();
            List<Strategy> strategies = schema.strategies();
            double agreement = 0.0d;
            for (int i = 0; i < strategies.size() && i < gate.length; i++) {
                agreement += gate[i] * orNeutral(reasoning.strategyCorrect().get(strategies.get(i).id()));
            }
            rReasoning = 0.6d * agreement + 0.4d * orNeutral(reasoning.reasoningCoherent());
        }

        SynthesisJudgment synthesis = event.synthesis();
        double rSynthesis = synthesis == null ? NEUTRAL
                : 0.6d * orNeutral(synthesis.finalAnswerCorrect()) + 0.4d * orNeutral(synthesis.rankingCorrect());

        return new LayerRewards(clamp(rRetrieval), clamp(rReasoning), clamp(rSynthesis));
    }

    private static double orNeutral(Double value) {
        return value == null ? NEUTRAL : value;
    }

    private static double clamp(double value) {
        return Math.max(0.0d, Math.min(1.0d, value));
    }
}
