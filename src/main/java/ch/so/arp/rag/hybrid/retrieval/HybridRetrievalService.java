package ch.so.arp.rag.hybrid.retrieval;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.InputValidationException;
import ch.so.arp.rag.hybrid.NotFoundException;
import ch.so.arp.rag.hybrid.RetrievalFailedException;
import ch.so.arp.rag.hybrid.gating.GatingNetwork;
import ch.so.arp.rag.hybrid.parameter.ParameterKeys;
import ch.so.arp.rag.hybrid.parameter.ParameterSnapshot;
import ch.so.arp.rag.hybrid.parameter.ParameterStore;
import ch.so.arp.rag.hybrid.parameter.Strategy;
import ch.so.arp.rag.hybrid.parameter.WeightSchema;

/**
 * Coordinates one retrieval: gating, a shared vector search, one graph scoring
 * task per strategy, fusion and reranking. The run reads a single parameter
 * snapshot and records what it used in a {@link RetrievalTrace}.
 */
public class HybridRetrievalService {

    private static final Logger LOGGER = LoggerFactory.getLogger(HybridRetrievalService.class);

    private static final Comparator<RankedCandidate> COMBINED_ORDER = Comparator
            .comparingDouble(RankedCandidate::score).reversed()
            .thenComparing(RankedCandidate::chunkId);

    private final WeightSchema schema;
    private final ParameterStore parameterStore;
    private final GatingNetwork gatingNetwork;
    private final VectorSimilaritySearcher vectorSearcher;
    private final GraphTraversalScorer graphScorer;
    private final HybridScoreCombiner combiner;
    private final RerankModel rerankModel;
    private final TraceRepository traceRepository;
    private final Executor retrievalExecutor;
    private final Duration strategyTimeout;
    private final int overRetrieveFactor;
    private final Clock clock;

    public HybridRetrievalService(WeightSchema schema, ParameterStore parameterStore, GatingNetwork gatingNetwork,
            VectorSimilaritySearcher vectorSearcher, GraphTraversalScorer graphScorer, HybridScoreCombiner combiner,
            RerankModel rerankModel, TraceRepository traceRepository, Executor retrievalExecutor,
            Duration strategyTimeout, int overRetrieveFactor, Clock clock) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.parameterStore = Objects.requireNonNull(parameterStore, "parameterStore");
        this.gatingNetwork = Objects.requireNonNull(gatingNetwork, "gatingNetwork");
        this.vectorSearcher = Objects.requireNonNull(vectorSearcher, "vectorSearcher");
        this.graphScorer = Objects.requireNonNull(graphScorer, "graphScorer");
        this.combiner = Objects.requireNonNull(combiner, "combiner");
        this.rerankModel = Objects.requireNonNull(rerankModel, "rerankModel");
        this.traceRepository = Objects.requireNonNull(traceRepository, "traceRepository");
        this.retrievalExecutor = Objects.requireNonNull(retrievalExecutor, "retrievalExecutor");
        this.strategyTimeout = Objects.requireNonNull(strategyTimeout, "strategyTimeout");
        if (overRetrieveFactor < 1) {
            throw new IllegalArgumentException("overRetrieveFactor must be at least 1");
        }
        this.overRetrieveFactor = overRetrieveFactor;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RetrievalResult retrieve(RetrievalQuery query) {
        validate(query);
        String domain = query.domain();
        if (query.continueTraceId() != null) {
            domain = traceRepository.find(query.continueTraceId())
                    .orElseThrow(() -> new NotFoundException("Unknown retrieval trace '" + query.continueTraceId()
                            + "'"))
                    .domain();
        }

        ParameterSnapshot snapshot = parameterStore.snapshot();
        double[] gate = gatingNetwork.forward(snapshot, query.embedding());
        int overRetrieved = (int) Math.min((long) query.topK() * overRetrieveFactor, Integer.MAX_VALUE);
        List<VectorMatch> matches = vectorSearcher.search(query.embedding(), overRetrieved, query.contentTypes());

        Map<String, StrategyOutcome> outcomes = runStrategies(query, snapshot, gate, matches);
        List<StrategyOutcome> succeeded = outcomes.values().stream().filter(StrategyOutcome::succeeded).toList();
        if (succeeded.isEmpty()) {
            throw new RetrievalFailedException("All " + outcomes.size() + " retrieval strategies failed");
        }
        if (succeeded.size() < outcomes.size()) {
            LOGGER.warn("Returning partial result: {} of {} strategies completed", succeeded.size(), outcomes.size());
        }

        List<RankedCandidate> combined = rank(matches, succeeded, snapshot, query.topK());
        Map<String, List<ScoredCandidate>> perStrategy = new LinkedHashMap<>();
        for (StrategyOutcome outcome : succeeded) {
            perStrategy.put(outcome.strategyId(),
                    outcome.candidates().stream().limit(query.topK()).toList());
        }

        RetrievalTrace trace;
        if (query.continueTraceId() == null) {
            TraceIteration iteration = iteration(0, query, gate, outcomes, combined, snapshot);
            trace = new RetrievalTrace(UUID.randomUUID().toString(), domain, clock.instant(), List.of(iteration));
            traceRepository.save(trace);
        } else {
            trace = traceRepository.append(query.continueTraceId(),
                    current -> iteration(current.iterations().size(), query, gate, outcomes, combined, snapshot));
        }
        TraceIteration recorded = trace.latest();
        LOGGER.debug("Trace {} iteration {}: {} candidates, gate {}", trace.traceId(), recorded.iteration(),
                combined.size(), gate);
        return new RetrievalResult(trace.traceId(), recorded.iteration(), perStrategy, combined, recorded);
    }

    private Map<String, StrategyOutcome> runStrategies(RetrievalQuery query, ParameterSnapshot snapshot,
            double[] gate, List<VectorMatch> matches) {
        List<Strategy> strategies = schema.strategies();
        List<FutureTask<List<ScoredCandidate>>> tasks = new ArrayList<>(strategies.size());
        for (Strategy strategy : strategies) {
            FutureTask<List<ScoredCandidate>> task = new FutureTask<>(() -> {
                Map<String, GraphPath> nodeScores = graphScorer.score(query.anchorNodes(), strategy, snapshot);
                return combiner.combine(matches, nodeScores, !query.anchorNodes().isEmpty(),
                        schema.alpha(snapshot, strategy));
            });
            tasks.add(task);
            try {
                retrievalExecutor.execute(task);
            } catch (RejectedExecutionException ex) {
                task.cancel(false);
                LOGGER.warn("Strategy {} was rejected by the retrieval executor", strategy.id());
            }
        }

        long deadline = System.nanoTime() + strategyTimeout.toNanos();
        Map<String, StrategyOutcome> outcomes = new LinkedHashMap<>();
        for (int i = 0; i < strategies.size(); i++) {
            Strategy strategy = strategies.get(i);
            double alpha = schema.alpha(snapshot, strategy);
            FutureTask<List<ScoredCandidate>> task = tasks.get(i);
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                List<ScoredCandidate> candidates = task.get(remaining, TimeUnit.NANOSECONDS);
                outcomes.put(strategy.id(), new StrategyOutcome(strategy.id(), StrategyOutcome.Status.OK, gate[i],
                        alpha, candidates, null));
            } catch (TimeoutException ex) {
                task.cancel(true);
                LOGGER.warn("Strategy {} exceeded the {} ms deadline", strategy.id(), strategyTimeout.toMillis());
                outcomes.put(strategy.id(), new StrategyOutcome(strategy.id(), StrategyOutcome.Status.TIMED_OUT,
                        gate[i], alpha, List.of(), "deadline of " + strategyTimeout.toMillis() + " ms exceeded"));
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                LOGGER.warn("Strategy {} failed: {}", strategy.id(), cause.getMessage(), cause);
                outcomes.put(strategy.id(), new StrategyOutcome(strategy.id(), StrategyOutcome.Status.FAILED,
                        gate[i], alpha, List.of(), String.valueOf(cause.getMessage())));
            } catch (CancellationException ex) {
                outcomes.put(strategy.id(), new StrategyOutcome(strategy.id(), StrategyOutcome.Status.FAILED,
                        gate[i], alpha, List.of(), "rejected"));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                tasks.forEach(pending -> pending.cancel(true));
                throw new RetrievalFailedException("Retrieval was interrupted", ex);
            }
        }
        return outcomes;
    }

    private List<RankedCandidate> rank(List<VectorMatch> matches, List<StrategyOutcome> succeeded,
            ParameterSnapshot snapshot, int topK) {
        double gateMass = succeeded.stream().mapToDouble(StrategyOutcome::gate).sum();
        Map<String, Double> gated = new HashMap<>();
        Map<String, Double> bestGraph = new HashMap<>();
        Map<String, Integer> topKVotes = new HashMap<>();
        for (StrategyOutcome outcome : succeeded) {
            double share = gateMass > 0.0d ? outcome.gate() / gateMass : 1.0d / succeeded.size();
            List<ScoredCandidate> candidates = outcome.candidates();
            for (int position = 0; position < candidates.size(); position++) {
                ScoredCandidate candidate = candidates.get(position);
                gated.merge(candidate.chunkId(), share * candidate.finalScore(), Double::sum);
                bestGraph.merge(candidate.chunkId(), candidate.graphScore(), Math::max);
                if (position < topK) {
                    topKVotes.merge(candidate.chunkId(), 1, Integer::sum);
                }
            }
        }

        double[] weights = snapshot.values(ParameterKeys.RERANK);
        if (weights.length != RerankFeatures.SIZE) {
            weights = WeightSchema.RERANK_PRIORS.clone();
        }
        List<RankedCandidate> scored = new ArrayList<>(matches.size());
        Set<String> seen = new HashSet<>();
        for (VectorMatch match : matches) {
            if (!seen.add(match.chunkId())) {
                continue;
            }
            RerankFeatures features = new RerankFeatures(
                    gated.getOrDefault(match.chunkId(), 0.0d),
                    match.score(),
                    bestGraph.getOrDefault(match.chunkId(), 0.0d),
                    topKVotes.getOrDefault(match.chunkId(), 0) / (double) succeeded.size());
            scored.add(new RankedCandidate(0, match.chunkId(), rerankModel.score(weights, features), features));
        }
        scored.sort(COMBINED_ORDER);
        List<RankedCandidate> ranked = new ArrayList<>(Math.min(topK, scored.size()));
        for (int i = 0; i < scored.size() && i < topK; i++) {
            RankedCandidate candidate = scored.get(i);
            ranked.add(new RankedCandidate(i + 1, candidate.chunkId(), candidate.score(), candidate.features()));
        }
        return ranked;
    }

    private TraceIteration iteration(int index, RetrievalQuery query, double[] gate,
            Map<String, StrategyOutcome> outcomes, List<RankedCandidate> combined, ParameterSnapshot snapshot) {
        return new TraceIteration(index, clock.instant(), query.embedding(), query.anchorNodes(), query.topK(),
                query.contentTypes(), gate, outcomes, combined, snapshot.versions());
    }

    private void validate(RetrievalQuery query) {
        Objects.requireNonNull(query, "query");
        if (query.embedding() == null || query.embedding().length != schema.embeddingDimensions()) {
            throw new InputValidationException("Query embedding must have " + schema.embeddingDimensions()
                    + " dimensions");
        }
        if (query.topK() < 1) {
            throw new InputValidationException("topK must be at least 1");
        }
        if (query.anchorNodes().stream().anyMatch(anchor -> anchor == null || anchor.isBlank())) {
            throw new InputValidationException("Anchor node ids must not be blank");
        }
    }
}
