package ch.so.arp.rag.hybrid;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the hybrid retrieval and learning core, bound from the
 * {@code hybrid} prefix.
 */
@ConfigurationProperties(prefix = "hybrid")
public class HybridRetrievalProperties {

    private final Persistence persistence = new Persistence();
    private final Retrieval retrieval = new Retrieval();
    private final Gating gating = new Gating();
    private final Authority authority = new Authority();
    private final Learning learning = new Learning();
    private final Decay decay = new Decay();
    private final Trace trace = new Trace();

    /**
     * Strategy table. Order defines the rows of the gating matrix and must stay
     * stable once parameters have been learned.
     */
    private List<StrategyProperties> strategies = new ArrayList<>();

    public Persistence getPersistence() {
        return persistence;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Gating getGating() {
        return gating;
    }

    public Authority getAuthority() {
        return authority;
    }

    public Learning getLearning() {
        return learning;
    }

    public Decay getDecay() {
        return decay;
    }

    public Trace getTrace() {
        return trace;
    }

    public List<StrategyProperties> getStrategies() {
        return strategies;
    }

    public void setStrategies(List<StrategyProperties> strategies) {
        this.strategies = strategies;
    }

    public static class Persistence {

        /**
         * Store parameters, bridge mappings and authority in the database instead
         * of in memory.
         */
        private boolean jdbc = false;

        public boolean isJdbc() {
            return jdbc;
        }

        public void setJdbc(boolean jdbc) {
            this.jdbc = jdbc;
        }
    }

    public static class Retrieval {

        /**
         * Maximum number of hops followed from an anchor node.
         */
        private int hopLimit = 3;

        /**
         * Vector candidates fetched per requested result.
         */
        private int overRetrieveFactor = 3;

        /**
         * Graph score of chunks without bridge links, or of every chunk when the
         * query has no anchors.
         */
        private double neutralGraphScore = 0.5d;

        /**
         * Deadline shared by the per-strategy tasks of one query.
         */
        private Duration strategyTimeout = Duration.ofSeconds(2);

        /**
         * Follow relationships against their direction as well.
         */
        private boolean bidirectionalTraversal = true;

        private int defaultTopK = 10;

        private double alphaLowerBound = 0.3d;

        private double alphaUpperBound = 0.9d;

        /**
         * Threads of the retrieval executor.
         */
        private int threads = 8;

        public int getHopLimit() {
            return hopLimit;
        }

        public void setHopLimit(int hopLimit) {
            this.hopLimit = hopLimit;
        }

        public int getOverRetrieveFactor() {
            return overRetrieveFactor;
        }

        public void setOverRetrieveFactor(int overRetrieveFactor) {
            this.overRetrieveFactor = overRetrieveFactor;
        }

        public double getNeutralGraphScore() {
            return neutralGraphScore;
        }

        public void setNeutralGraphScore(double neutralGraphScore) {
            this.neutralGraphScore = neutralGraphScore;
        }

        public Duration getStrategyTimeout() {
            return strategyTimeout;
        }

        public void setStrategyTimeout(Duration strategyTimeout) {
            this.strategyTimeout = strategyTimeout;
        }

        public boolean isBidirectionalTraversal() {
            return bidirectionalTraversal;
        }

        public void setBidirectionalTraversal(boolean bidirectionalTraversal) {
            this.bidirectionalTraversal = bidirectionalTraversal;
        }

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public double getAlphaLowerBound() {
            return alphaLowerBound;
        }

        public void setAlphaLowerBound(double alphaLowerBound) {
            this.alphaLowerBound = alphaLowerBound;
        }

        public double getAlphaUpperBound() {
            return alphaUpperBound;
        }

        public void setAlphaUpperBound(double alphaUpperBound) {
            this.alphaUpperBound = alphaUpperBound;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    public static class Gating {

        /**
         * Dimension of query and chunk embeddings.
         */
        private int embeddingDimensions = 384;

        /**
         * Softmax temperature of the gating network.
         */
        private double temperature = 0.25d;

        public int getEmbeddingDimensions() {
            return embeddingDimensions;
        }

        public void setEmbeddingDimensions(int embeddingDimensions) {
            this.embeddingDimensions = embeddingDimensions;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }

    public static class Authority {

        private double baselineWeight = 0.3d;

        private double trackRecordWeight = 0.5d;

        private double recentPerformanceWeight = 0.2d;

        /**
         * Number of validated events that make up the recent performance.
         */
        private int recentWindow = 20;

        /**
         * Authority of unseen users and value of missing history terms.
         */
        private double neutralPrior = 0.5d;

        public double getBaselineWeight() {
            return baselineWeight;
        }

        public void setBaselineWeight(double baselineWeight) {
            this.baselineWeight = baselineWeight;
        }

        public double getTrackRecordWeight() {
            return trackRecordWeight;
        }

        public void setTrackRecordWeight(double trackRecordWeight) {
            this.trackRecordWeight = trackRecordWeight;
        }

        public double getRecentPerformanceWeight() {
            return recentPerformanceWeight;
        }

        public void setRecentPerformanceWeight(double recentPerformanceWeight) {
            this.recentPerformanceWeight = recentPerformanceWeight;
        }

        public int getRecentWindow() {
            return recentWindow;
        }

        public void setRecentWindow(int recentWindow) {
            this.recentWindow = recentWindow;
        }

        public double getNeutralPrior() {
            return neutralPrior;
        }

        public void setNeutralPrior(double neutralPrior) {
            this.neutralPrior = neutralPrior;
        }
    }

    public static class Learning {

        private double learningRate = 0.01d;

        /**
         * Per-entry bound of the policy gradient.
         */
        private double gradientClip = 0.1d;

        /**
         * Number of recent rewards averaged into the baseline of each level.
         */
        private int baselineWindow = 100;

        /**
         * Credit decay across the iterations of one trace; 1 gives equal credit.
         */
        private double iterationCreditDecay = 0.5d;

        /**
         * Softmax temperature of the rerank policy.
         */
        private double rerankTemperature = 0.1d;

        private int conflictRetryAttempts = 5;

        private Duration conflictRetryBackoff = Duration.ofMillis(10);

        /**
         * Queue parameter updates instead of applying them while the feedback
         * request waits.
         */
        private boolean asyncUpdates = false;

        /**
         * How long processed feedback ids are remembered for duplicate detection.
         */
        private Duration processedFeedbackRetention = Duration.ofDays(7);

        private long processedFeedbackMaxSize = 100_000L;

        public double getLearningRate() {
            return learningRate;
        }

        public void setLearningRate(double learningRate) {
            this.learningRate = learningRate;
        }

        public double getGradientClip() {
            return gradientClip;
        }

        public void setGradientClip(double gradientClip) {
            this.gradientClip = gradientClip;
        }

        public int getBaselineWindow() {
            return baselineWindow;
        }

        public void setBaselineWindow(int baselineWindow) {
            this.baselineWindow = baselineWindow;
        }

        public double getIterationCreditDecay() {
            return iterationCreditDecay;
        }

        public void setIterationCreditDecay(double iterationCreditDecay) {
            this.iterationCreditDecay = iterationCreditDecay;
        }

        public double getRerankTemperature() {
            return rerankTemperature;
        }

        public void setRerankTemperature(double rerankTemperature) {
            this.rerankTemperature = rerankTemperature;
        }

        public int getConflictRetryAttempts() {
            return conflictRetryAttempts;
        }

        public void setConflictRetryAttempts(int conflictRetryAttempts) {
            this.conflictRetryAttempts = conflictRetryAttempts;
        }

        public Duration getConflictRetryBackoff() {
            return conflictRetryBackoff;
        }

        public void setConflictRetryBackoff(Duration conflictRetryBackoff) {
            this.conflictRetryBackoff = conflictRetryBackoff;
        }

        public boolean isAsyncUpdates() {
            return asyncUpdates;
        }

        public void setAsyncUpdates(boolean asyncUpdates) {
            this.asyncUpdates = asyncUpdates;
        }

        public Duration getProcessedFeedbackRetention() {
            return processedFeedbackRetention;
        }

        public void setProcessedFeedbackRetention(Duration processedFeedbackRetention) {
            this.processedFeedbackRetention = processedFeedbackRetention;
        }

        public long getProcessedFeedbackMaxSize() {
            return processedFeedbackMaxSize;
        }

        public void setProcessedFeedbackMaxSize(long processedFeedbackMaxSize) {
            this.processedFeedbackMaxSize = processedFeedbackMaxSize;
        }
    }

    public static class Decay {

        private boolean enabled = true;

        private double rate = 0.995d;

        private Duration interval = Duration.ofDays(1);

        /**
         * Weights reinforced more recently than this are left alone.
         */
        private Duration reinforcementGrace = Duration.ofDays(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getRate() {
            return rate;
        }

        public void setRate(double rate) {
            this.rate = rate;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getReinforcementGrace() {
            return reinforcementGrace;
        }

        public void setReinforcementGrace(Duration reinforcementGrace) {
            this.reinforcementGrace = reinforcementGrace;
        }
    }

    public static class Trace {

        /**
         * How long a trace accepts follow-up iterations and feedback.
         */
        private Duration retention = Duration.ofHours(24);

        private long maxSize = 50_000L;

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public long getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(long maxSize) {
            this.maxSize = maxSize;
        }
    }

    public static class StrategyProperties {

        private String id;

        /**
         * Prior traversal weight per relation type.
         */
        private Map<String, Double> relationPriors = new LinkedHashMap<>();

        private double defaultRelationWeight = 0.5d;

        /**
         * Relation types this strategy follows. Defaults to the relations with a
         * prior.
         */
        private Set<String> allowedRelations = new LinkedHashSet<>();

        private double alphaPrior = 0.7d;

        private double gatingPrior = 0.25d;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public Map<String, Double> getRelationPriors() {
            return relationPriors;
        }

        public void setRelationPriors(Map<String, Double> relationPriors) {
            this.relationPriors = relationPriors;
        }

        public double getDefaultRelationWeight() {
            return defaultRelationWeight;
        }

        public void setDefaultRelationWeight(double defaultRelationWeight) {
            this.defaultRelationWeight = defaultRelationWeight;
        }

        public Set<String> getAllowedRelations() {
            return allowedRelations;
        }

        public void setAllowedRelations(Set<String> allowedRelations) {
            this.allowedRelations = allowedRelations;
        }

        public double getAlphaPrior() {
            return alphaPrior;
        }

        public void setAlphaPrior(double alphaPrior) {
            this.alphaPrior = alphaPrior;
        }

        public double getGatingPrior() {
            return gatingPrior;
        }

        public void setGatingPrior(double gatingPrior) {
            this.gatingPrior = gatingPrior;
        }
    }
}
