package ch.so.arp.rag.hybrid.parameter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static strategy table and the priors every learnable parameter starts from.
 * Strategy order is significant: it defines the rows of the gating matrix.
 */
public class WeightSchema {

    private static final Logger LOGGER = LoggerFactory.getLogger(WeightSchema.class);

    /**
     * Rerank feature weights: gated score, best vector score, best graph score,
     * cross-strategy agreement.
     */
    public static final double[] RERANK_PRIORS = { 0.7d, 0.2d, 0.2d, 0.1d };

    static final double GATING_WEIGHT_PRIOR = 0.5d;

    private final List<Strategy> strategies;
    private final double alphaLowerBound;
    private final double alphaUpperBound;
    private final int embeddingDimensions;

    public WeightSchema(List<Strategy> strategies, double alphaLowerBound, double alphaUpperBound,
            int embeddingDimensions) {
        Objects.requireNonNull(strategies, "strategies");
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one strategy is required");
        }
        Set<String> ids = new HashSet<>();
        for (Strategy strategy : strategies) {
            if (!ids.add(strategy.id())) {
                throw new IllegalArgumentException("duplicate strategy '" + strategy.id() + "'");
            }
        }
        if (embeddingDimensions <= 0) {
            throw new IllegalArgumentException("embeddingDimensions must be positive");
        }
        this.strategies = List.copyOf(strategies);
        this.alphaLowerBound = alphaLowerBound;
        this.alphaUpperBound = alphaUpperBound;
        this.embeddingDimensions = embeddingDimensions;
    }

    public List<Strategy> strategies() {
        return strategies;
    }

    public int size() {
        return strategies.size();
    }

    public int embeddingDimensions() {
        return embeddingDimensions;
    }

    public Optional<Strategy> find(String strategyId) {
        return strategies.stream().filter(strategy -> strategy.id().equals(strategyId)).findFirst();
    }

    public int indexOf(String strategyId) {
        for (int i = 0; i < strategies.size(); i++) {
            if (strategies.get(i).id().equals(strategyId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Current traversal weight of a relation for a strategy, falling back to its
     * prior when the snapshot does not hold the key yet.
     */
    public double traversalWeight(ParameterSnapshot snapshot, Strategy strategy, String relationType) {
        return snapshot.scalar(ParameterKeys.traverse(strategy.id(), relationType), strategy.priorFor(relationType));
    }

    public double alpha(ParameterSnapshot snapshot, Strategy strategy) {
        double prior = Math.max(alphaLowerBound, Math.min(alphaUpperBound, strategy.alphaPrior()));
        return snapshot.scalar(ParameterKeys.alpha(strategy.id()), prior);
    }

    /**
     * Every parameter at its prior value, version 0.
     */
    public List<VersionedParameter> initialParameters(Instant now) {
        List<VersionedParameter> parameters = new ArrayList<>();
        for (Strategy strategy : strategies) {
            for (String relation : new TreeSet<>(strategy.allowedRelations())) {
                parameters.add(VersionedParameter.scalar(ParameterKeys.traverse(strategy.id(), relation),
                        strategy.priorFor(relation), 0.0d, 1.0d, now));
            }
            parameters.add(VersionedParameter.scalar(ParameterKeys.alpha(strategy.id()), strategy.alphaPrior(),
                    alphaLowerBound, alphaUpperBound, now));
        }
        parameters.add(VersionedParameter.initial(ParameterKeys.GATING, gatingPriors(), 0.0d, 1.0d, now));
        parameters.add(VersionedParameter.initial(ParameterKeys.RERANK, RERANK_PRIORS, 0.0d, 1.0d, now));
        return parameters;
    }

    /**
     * Create missing parameters from their priors. Existing keys keep their
     * learned values.
     *
     * @return number of keys created
     */
    public int bootstrap(ParameterStore store, Clock clock) {
        int created = 0;
        for (VersionedParameter parameter : initialParameters(clock.instant())) {
            VersionedParameter existing = store.find(parameter.key()).orElse(null);
            if (existing != null && existing.size() != parameter.size()) {
                throw new IllegalStateException("Stored parameter '" + parameter.key() + "' has " + existing.size()
                        + " values but the schema expects " + parameter.size());
            }
            if (existing == null && store.initializeIfAbsent(parameter)) {
                created++;
            }
        }
        LOGGER.info("Bootstrapped {} parameters for {} strategies", created, strategies.size());
        return created;
    }

    /**
     * Row-major S×(D+1) matrix; the last column holds the bias.
     */
    private double[] gatingPriors() {
        int columns = embeddingDimensions + 1;
        double[] priors = new double[strategies.size() * columns];
        for (int row = 0; row < strategies.size(); row++) {
            for (int column = 0; column < embeddingDimensions; column++) {
                priors[row * columns + column] = GATING_WEIGHT_PRIOR;
            }
            priors[row * columns + embeddingDimensions] = strategies.get(row).gatingPrior();
        }
        return priors;
    }
}
