package ch.so.arp.rag.hybrid.learning;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.DanglingReferenceException;
import ch.so.arp.rag.hybrid.NotFoundException;
import ch.so.arp.rag.hybrid.authority.AuthorityCalculator;
import ch.so.arp.rag.hybrid.authority.FeedbackLevel;
import ch.so.arp.rag.hybrid.bridge.BridgeIndex;
import ch.so.arp.rag.hybrid.bridge.BridgeMapping;
import ch.so.arp.rag.hybrid.feedback.FeedbackEvent;
import ch.so.arp.rag.hybrid.feedback.LayerRewards;
import ch.so.arp.rag.hybrid.gating.GatingNetwork;
import ch.so.arp.rag.hybrid.parameter.ParameterKeys;
import ch.so.arp.rag.hybrid.parameter.ParameterStore;
import ch.so.arp.rag.hybrid.parameter.ParameterWriter;
import ch.so.arp.rag.hybrid.parameter.VersionedParameter;
import ch.so.arp.rag.hybrid.parameter.WeightSchema;
import ch.so.arp.rag.hybrid.retrieval.GraphPath;
import ch.so.arp.rag.hybrid.retrieval.RankedCandidate;
import ch.so.arp.rag.hybrid.retrieval.RerankFeatures;
import ch.so.arp.rag.hybrid.retrieval.RerankModel;
import ch.so.arp.rag.hybrid.retrieval.RetrievalTrace;
import ch.so.arp.rag.hybrid.retrieval.ScoredCandidate;
import ch.so.arp.rag.hybrid.retrieval.StrategyOutcome;
import ch.so.arp.rag.hybrid.retrieval.TraceIteration;

/**
 * REINFORCE-style updates of every parameter a trace touched:
 * {@code Δθ = lr · authority · (R - baseline) · clip(∇θ log π)}.
 *
 * <p>Retrieval feedback moves traversal weights, alphas and bridge link weights
 * behind the presented candidates, reasoning feedback moves the gating matrix
 * and synthesis feedback the rerank weights. A preferred strategy or chunk in the
 * feedback turns the respective update into a supervised step with advantage 1.
 */
public class PolicyGradientUpdater {

    private static final Logger LOGGER = LoggerFactory.getLogger(PolicyGradientUpdater.class);

    private static final double MIN_WEIGHT = 1.0e-3d;

    private final WeightSchema schema;
    private final ParameterStore parameterStore;
    private final ParameterWriter parameterWriter;
    private final BridgeIndex bridgeIndex;
    private final GatingNetwork gatingNetwork;
    private final RerankModel rerankModel;
    private final AuthorityCalculator authorityCalculator;
    private final RewardBaseline baseline;
    private final LearningSettings settings;

    public PolicyGradientUpdater(WeightSchema schema, ParameterStore parameterStore, ParameterWriter parameterWriter,
            BridgeIndex bridgeIndex, GatingNetwork gatingNetwork, RerankModel rerankModel,
            AuthorityCalculator authorityCalculator, RewardBaseline baseline, LearningSettings settings) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.parameterStore = Objects.requireNonNull(parameterStore, "parameterStore");
        this.parameterWriter = Objects.requireNonNull(parameterWriter, "parameterWriter");
        this.bridgeIndex = Objects.requireNonNull(bridgeIndex, "bridgeIndex");
        this.gatingNetwork = Objects.requireNonNull(gatingNetwork, "gatingNetwork");
        this.rerankModel = Objects.requireNonNull(rerankModel, "rerankModel");
        this.authorityCalculator = Objects.requireNonNull(authorityCalculator, "authorityCalculator");
        this.baseline = Objects.requireNonNull(baseline, "baseline");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public UpdateSummary update(FeedbackEvent event, RetrievalTrace trace, LayerRewards rewards,
            Set<FeedbackLevel> judged) {
        return update(event, trace, rewards, judged, new UpdateProgress());
    }

    /**
     * Apply the event, skipping whatever {@code progress} records as committed by
     * an earlier attempt. On failure {@code progress} holds everything that did
     * get committed, so the update can be resumed without counting twice.
     *
     * @param judged levels the event carried a judgment for; other levels are
     *               left untouched
     */
    public UpdateSummary update(FeedbackEvent event, RetrievalTrace trace, LayerRewards rewards,
            Set<FeedbackLevel> judged, UpdateProgress progress) {
        double[] credits = settings.iterationCredits(trace.iterations().size());
        List<String> keys = new ArrayList<>();
        int links = 0;
        if (judged.contains(FeedbackLevel.RETRIEVAL)) {
            double scale = scale(event, trace, FeedbackLevel.RETRIEVAL,
                    advantage(progress, FeedbackLevel.RETRIEVAL, rewards.retrieval()));
            if (scale != 0.0d) {
                links = updateRetrieval(event, trace, credits, scale, keys, progress);
            }
        }
        if (judged.contains(FeedbackLevel.REASONING)) {
            double advantage = advantage(progress, FeedbackLevel.REASONING, rewards.reasoning());
            String preferred = event.reasoning().preferredStrategy();
            double scale = scale(event, trace, FeedbackLevel.REASONING, preferred != null ? 1.0d : advantage);
            if (scale != 0.0d) {
                updateGating(event, trace, credits, scale, preferred, keys, progress);
            }
        }
        if (judged.contains(FeedbackLevel.SYNTHESIS)) {
            double advantage = advantage(progress, FeedbackLevel.SYNTHESIS, rewards.synthesis());
            String preferred = event.synthesis().preferredChunkId();
            double scale = scale(event, trace, FeedbackLevel.SYNTHESIS, preferred != null ? 1.0d : advantage);
            if (scale != 0.0d) {
                updateRerank(event, trace, credits, scale, preferred, keys, progress);
            }
        }
        LOGGER.info("Feedback {} on trace {} updated {} parameters and {} bridge links", event.id(), trace.traceId(),
                keys.size(), links);
        return new UpdateSummary(event.id(), keys, links);
    }

    private double advantage(UpdateProgress progress, FeedbackLevel level, double reward) {
        return progress.advantage(level, () -> baseline.advantage(level, reward));
    }

    private double scale(FeedbackEvent event, RetrievalTrace trace, FeedbackLevel level, double advantage) {
        double authority = authorityCalculator.getAuthority(event.userId(), level, trace.domain());
        return settings.learningRate() * authority * advantage;
    }

    private int updateRetrieval(FeedbackEvent event, RetrievalTrace trace, double[] credits, double scale,
            List<String> keys, UpdateProgress progress) {
        Map<String, Double> gradients = new TreeMap<>();
        Map<BridgeMapping.Key, Double> linkGradients = new LinkedHashMap<>();
        for (int i = 0; i < credits.length; i++) {
            TraceIteration iteration = trace.iterations().get(i);
            Set<String> presented = new HashSet<>();
            iteration.combined().forEach(candidate -> presented.add(candidate.chunkId()));
            for (StrategyOutcome outcome : iteration.strategies().values()) {
                if (!outcome.succeeded()) {
                    continue;
                }
                double share = credits[i] * outcome.gate();
                for (ScoredCandidate candidate : outcome.candidates()) {
                    if (!presented.contains(candidate.chunkId())) {
                        continue;
                    }
                    if (candidate.path() != null) {
                        for (GraphPath.Step step : candidate.path().steps()) {
                            gradients.merge(ParameterKeys.traverse(outcome.strategyId(), step.relationType()),
                                    share / Math.max(step.weight(), MIN_WEIGHT), Double::sum);
                        }
                    }
                    if (candidate.finalScore() > 0.0d) {
                        gradients.merge(ParameterKeys.alpha(outcome.strategyId()),
                                share * (candidate.vectorScore() - candidate.graphScore()) / candidate.finalScore(),
                                Double::sum);
                    }
                    if (candidate.link() != null) {
                        linkGradients.merge(candidate.link().key(),
                                share / Math.max(candidate.link().weight(), MIN_WEIGHT), Double::sum);
                    }
                }
            }
        }
        gradients.forEach((key, gradient) -> commit(key, new double[] { scale * clip(gradient) }, event, keys,
                progress));
        int links = 0;
        for (Map.Entry<BridgeMapping.Key, Double> entry : linkGradients.entrySet()) {
            BridgeMapping.Key key = entry.getKey();
            if (progress.isCommitted(key)) {
                continue;
            }
            try {
                bridgeIndex.updateWeight(key.chunkId(), key.nodeId(), key.relationType(),
                        scale * clip(entry.getValue()));
                links++;
            } catch (NotFoundException | DanglingReferenceException ex) {
                LOGGER.warn("Skipping bridge link {} of feedback {}: {}", key, event.id(), ex.getMessage());
            }
            progress.committed(key);
        }
        return links;
    }

    private void updateGating(FeedbackEvent event, RetrievalTrace trace, double[] credits, double scale,
            String preferred, List<String> keys, UpdateProgress progress) {
        double[] gradient = null;
        for (int i = 0; i < credits.length; i++) {
            TraceIteration iteration = trace.iterations().get(i);
            double[] gate = iteration.gate();
            int action = preferred != null ? schema.indexOf(preferred) : argMax(gate);
            double[] step = gatingNetwork.logProbabilityGradient(iteration.embedding(), gate, action);
            if (gradient == null) {
                gradient = new double[step.length];
            }
            for (int j = 0; j < step.length; j++) {
                gradient[j] += credits[i] * step[j];
            }
        }
        if (gradient == null) {
            return;
        }
        for (int j = 0; j < gradient.length; j++) {
            gradient[j] = scale * clip(gradient[j]);
        }
        commit(ParameterKeys.GATING, gradient, event, keys, progress);
    }

    private void updateRerank(FeedbackEvent event, RetrievalTrace trace, double[] credits, double scale,
            String preferred, List<String> keys, UpdateProgress progress) {
        if (progress.isCommitted(ParameterKeys.RERANK)) {
            return;
        }
        VersionedParameter rerank = parameterStore.find(ParameterKeys.RERANK).orElse(null);
        if (rerank == null) {
            LOGGER.warn("Rerank parameters are missing, skipping synthesis update of feedback {}", event.id());
            return;
        }
        double[] weights = rerank.values();
        double[] gradient = new double[RerankFeatures.SIZE];
        for (int i = 0; i < credits.length; i++) {
            List<RankedCandidate> combined = trace.iterations().get(i).combined();
            int action = 0;
            if (preferred != null) {
                action = indexOf(combined, preferred);
                if (action < 0) {
                    continue;
                }
            }
            List<RerankFeatures> presented = combined.stream().map(RankedCandidate::features).toList();
            double[] step = rerankModel.logProbabilityGradient(weights, presented, action);
            for (int j = 0; j < step.length; j++) {
                gradient[j] += credits[i] * step[j];
            }
        }
        for (int j = 0; j < gradient.length; j++) {
            gradient[j] = scale * clip(gradient[j]);
        }
        commit(ParameterKeys.RERANK, gradient, event, keys, progress);
    }

    private void commit(String key, double[] delta, FeedbackEvent event, List<String> keys,
            UpdateProgress progress) {
        if (progress.isCommitted(key)) {
            return;
        }
        VersionedParameter before = parameterStore.find(key).orElse(null);
        if (before == null) {
            LOGGER.warn("Skipping update of unknown parameter {}", key);
            return;
        }
        if (parameterWriter.add(key, delta, event.id()).version() != before.version()) {
            keys.add(key);
        }
        progress.committed(key);
    }

    private double clip(double gradient) {
        double limit = settings.gradientClip();
        return Math.max(-limit, Math.min(limit, gradient));
    }

    private static int argMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }

    private static int indexOf(List<RankedCandidate> combined, String chunkId) {
        for (int i = 0; i < combined.size(); i++) {
            if (combined.get(i).chunkId().equals(chunkId)) {
                return i;
            }
        }
        return -1;
    }
}
