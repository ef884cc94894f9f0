package ch.so.arp.rag.hybrid.feedback;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import ch.so.arp.rag.hybrid.ConcurrencyConflictException;
import ch.so.arp.rag.hybrid.InputValidationException;
import ch.so.arp.rag.hybrid.NotFoundException;
import ch.so.arp.rag.hybrid.authority.AuthorityCalculator;
import ch.so.arp.rag.hybrid.authority.FeedbackLevel;
import ch.so.arp.rag.hybrid.authority.UserAuthority;
import ch.so.arp.rag.hybrid.authority.ValidationOutcome;
import ch.so.arp.rag.hybrid.learning.PolicyGradientUpdater;
import ch.so.arp.rag.hybrid.learning.UpdateProgress;
import ch.so.arp.rag.hybrid.parameter.WeightSchema;
import ch.so.arp.rag.hybrid.retrieval.RetrievalTrace;
import ch.so.arp.rag.hybrid.retrieval.TraceRepository;

/**
 * Entry point for feedback: validates the event against its trace, decomposes
 * it into rewards and hands it to the {@link PolicyGradientUpdater}. Event ids
 * are remembered so that a re-sent event is acknowledged without counting its
 * reward twice. An update that fails part way keeps its ledger entry; it is
 * re-queued on conflicts in asynchronous mode, and re-sending the event resumes
 * it from what was already committed.
 */
public class FeedbackService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedbackService.class);

    private static final int QUEUED_ATTEMPTS = 3;

    private final TraceRepository traceRepository;
    private final WeightSchema schema;
    private final RewardDecomposer rewardDecomposer;
    private final PolicyGradientUpdater updater;
    private final AuthorityCalculator authorityCalculator;
    private final Executor updateExecutor;
    private final boolean asyncUpdates;
    private final Clock clock;
    private final Cache<String, LedgerEntry> ledger;

    public FeedbackService(TraceRepository traceRepository, WeightSchema schema, RewardDecomposer rewardDecomposer,
            PolicyGradientUpdater updater, AuthorityCalculator authorityCalculator, Executor updateExecutor,
            boolean asyncUpdates, Duration ledgerRetention, long ledgerSize, Clock clock) {
        this.traceRepository = Objects.requireNonNull(traceRepository, "traceRepository");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.rewardDecomposer = Objects.requireNonNull(rewardDecomposer, "rewardDecomposer");
        this.updater = Objects.requireNonNull(updater, "updater");
        this.authorityCalculator = Objects.requireNonNull(authorityCalculator, "authorityCalculator");
        this.updateExecutor = Objects.requireNonNull(updateExecutor, "updateExecutor");
        this.asyncUpdates = asyncUpdates;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ledger = Caffeine.newBuilder()
                .expireAfterWrite(ledgerRetention)
                .maximumSize(ledgerSize)
                .build();
    }

    public FeedbackAck ingest(FeedbackEvent event) {
        Objects.requireNonNull(event, "event");
        requireText(event.id(), "id");
        LedgerEntry known = ledger.getIfPresent(event.id());
        if (known != null) {
            return resumeOrAcknowledge(known);
        }
        requireText(event.traceId(), "traceId");
        requireText(event.userId(), "userId");
        RetrievalTrace trace = traceRepository.find(event.traceId())
                .orElseThrow(() -> new InputValidationException("Feedback " + event.id()
                        + " references unknown retrieval trace '" + event.traceId() + "'"));
        validateJudgments(event, trace);

        LayerRewards rewards = rewardDecomposer.decompose(event, trace.latest());
        FeedbackEvent stamped = event.timestamp() != null ? event
                : new FeedbackEvent(event.id(), event.traceId(), event.userId(), clock.instant(), event.retrieval(),
                        event.reasoning(), event.synthesis());
        LedgerEntry entry = new LedgerEntry(stamped, trace, rewards, judgedLevels(event));
        LedgerEntry raced = ledger.asMap().putIfAbsent(event.id(), entry);
        if (raced != null) {
            return resumeOrAcknowledge(raced);
        }
        try {
            authorityCalculator.register(event.userId());
        } catch (RuntimeException ex) {
            ledger.invalidate(event.id());
            throw ex;
        }
        run(entry);
        LOGGER.info("Accepted feedback {} from user {} (rewards {})", event.id(), event.userId(), rewards);
        return FeedbackAck.accepted(event.id(), rewards, entry.judged);
    }

    /**
     * Record the consensus outcome of an accepted feedback event. The authority
     * update runs asynchronously; an event can be validated once.
     */
    public CompletableFuture<UserAuthority> validate(String feedbackId, Map<FeedbackLevel, Boolean> confirmed) {
        LedgerEntry entry = ledger.getIfPresent(feedbackId);
        if (entry == null) {
            throw new NotFoundException("Unknown feedback '" + feedbackId + "'");
        }
        if (confirmed == null || confirmed.isEmpty() || confirmed.values().stream().anyMatch(Objects::isNull)) {
            throw new InputValidationException("A validation outcome needs at least one level verdict");
        }
        if (!entry.validated.compareAndSet(false, true)) {
            throw new InputValidationException("Feedback '" + feedbackId + "' was already validated");
        }
        return authorityCalculator.updateFromFeedback(new ValidationOutcome(feedbackId, entry.event.userId(),
                entry.trace.domain(), confirmed));
    }

    /**
     * A re-sent event whose update failed resumes where the failed attempt
     * stopped; any other re-sent event is a duplicate.
     */
    private FeedbackAck resumeOrAcknowledge(LedgerEntry entry) {
        String feedbackId = entry.event.id();
        if (!entry.state.compareAndSet(UpdateState.FAILED, UpdateState.RUNNING)) {
            LOGGER.info("Feedback {} was already processed", feedbackId);
            return FeedbackAck.duplicate(feedbackId);
        }
        LOGGER.info("Resuming the failed update of feedback {} ({} parameters already committed)", feedbackId,
                entry.progress.committedParameters().size());
        run(entry);
        return FeedbackAck.resumed(feedbackId, entry.rewards, entry.judged);
    }

    private void run(LedgerEntry entry) {
        if (!asyncUpdates) {
            apply(entry);
            return;
        }
        try {
            updateExecutor.execute(() -> applyQueued(entry, 1));
        } catch (RuntimeException ex) {
            entry.state.set(UpdateState.FAILED);
            throw ex;
        }
    }

    private void apply(LedgerEntry entry) {
        try {
            updater.update(entry.event, entry.trace, entry.rewards, entry.judged, entry.progress);
            entry.state.set(UpdateState.APPLIED);
        } catch (RuntimeException ex) {
            entry.state.set(UpdateState.FAILED);
            LOGGER.warn("Update of feedback {} failed after committing {} parameters: {}", entry.event.id(),
                    entry.progress.committedParameters().size(), ex.getMessage());
            throw ex;
        }
    }

    private void applyQueued(LedgerEntry entry, int attempt) {
        try {
            apply(entry);
        } catch (ConcurrencyConflictException ex) {
            if (attempt < QUEUED_ATTEMPTS && entry.state.compareAndSet(UpdateState.FAILED, UpdateState.RUNNING)) {
                LOGGER.warn("Re-queueing the update of feedback {} (attempt {} of {})", entry.event.id(), attempt + 1,
                        QUEUED_ATTEMPTS);
                try {
                    updateExecutor.execute(() -> applyQueued(entry, attempt + 1));
                } catch (RuntimeException rejected) {
                    entry.state.set(UpdateState.FAILED);
                    LOGGER.error("Could not re-queue the update of feedback {}; re-send the event to resume it",
                            entry.event.id(), rejected);
                }
            } else {
                LOGGER.error("Queued update of feedback {} gave up after {} attempts; re-send the event to resume it",
                        entry.event.id(), attempt, ex);
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Queued update of feedback {} failed; re-send the event to resume it", entry.event.id(), ex);
        }
    }

    private void validateJudgments(FeedbackEvent event, RetrievalTrace trace) {
        RetrievalJudgment retrieval = event.retrieval();
        if (retrieval != null) {
            requireScore(retrieval.sourcesRelevant(), "retrieval.sourcesRelevant");
            requireScore(retrieval.sourcesComplete(), "retrieval.sourcesComplete");
            requireScore(retrieval.rankingQuality(), "retrieval.rankingQuality");
        }
        ReasoningJudgment reasoning = event.reasoning();
        if (reasoning != null) {
            reasoning.strategyCorrect().forEach((strategyId, score) -> {
                requireStrategy(strategyId);
                requireScore(score, "reasoning.strategyCorrect." + strategyId);
            });
            requireScore(reasoning.reasoningCoherent(), "reasoning.reasoningCoherent");
            if (reasoning.preferredStrategy() != null) {
                requireStrategy(reasoning.preferredStrategy());
            }
        }
        SynthesisJudgment synthesis = event.synthesis();
        if (synthesis != null) {
            requireScore(synthesis.finalAnswerCorrect(), "synthesis.finalAnswerCorrect");
            requireScore(synthesis.rankingCorrect(), "synthesis.rankingCorrect");
            String preferred = synthesis.preferredChunkId();
            if (preferred != null && trace.iterations().stream().noneMatch(it -> it.presented(preferred))) {
                throw new InputValidationException("Preferred chunk '" + preferred + "' was not presented in trace '"
                        + trace.traceId() + "'");
            }
        }
    }

    private static Set<FeedbackLevel> judgedLevels(FeedbackEvent event) {
        Set<FeedbackLevel> levels = EnumSet.noneOf(FeedbackLevel.class);
        if (event.retrieval() != null) {
            levels.add(FeedbackLevel.RETRIEVAL);
        }
        if (event.reasoning() != null) {
            levels.add(FeedbackLevel.REASONING);
        }
        if (event.synthesis() != null) {
            levels.add(FeedbackLevel.SYNTHESIS);
        }
        return levels;
    }

    private void requireStrategy(String strategyId) {
        if (schema.find(strategyId).isEmpty()) {
            throw new InputValidationException("Unknown strategy '" + strategyId + "'");
        }
    }

    private static void requireScore(Double score, String field) {
        if (score != null && !(score >= 0.0d && score <= 1.0d)) {
            throw new InputValidationException(field + " must be within [0,1] but was " + score);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InputValidationException("Feedback " + field + " must not be blank");
        }
    }

    private enum UpdateState {
        RUNNING, APPLIED, FAILED
    }

    private static final class LedgerEntry {

        private final FeedbackEvent event;
        private final RetrievalTrace trace;
        private final LayerRewards rewards;
        private final Set<FeedbackLevel> judged;
        private final UpdateProgress progress = new UpdateProgress();
        private final AtomicReference<UpdateState> state = new AtomicReference<>(UpdateState.RUNNING);
        private final AtomicBoolean validated = new AtomicBoolean();

        private LedgerEntry(FeedbackEvent event, RetrievalTrace trace, LayerRewards rewards,
                Set<FeedbackLevel> judged) {
            this.event = event;
            this.trace = trace;
            this.rewards = rewards;
            this.judged = judged;
        }
    }
}
