package ch.so.arp.rag.hybrid;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import javax.sql.DataSource;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.hybrid.authority.AuthorityCalculator;
import ch.so.arp.rag.hybrid.authority.AuthorityRepository;
import ch.so.arp.rag.hybrid.authority.AuthorityWeights;
import ch.so.arp.rag.hybrid.authority.InMemoryAuthorityRepository;
import ch.so.arp.rag.hybrid.authority.JdbcAuthorityRepository;
import ch.so.arp.rag.hybrid.bridge.BridgeIndex;
import ch.so.arp.rag.hybrid.bridge.InMemoryBridgeIndex;
import ch.so.arp.rag.hybrid.bridge.JdbcBridgeIndex;
import ch.so.arp.rag.hybrid.catalog.ContentCatalog;
import ch.so.arp.rag.hybrid.catalog.InMemoryContentCatalog;
import ch.so.arp.rag.hybrid.feedback.FeedbackService;
import ch.so.arp.rag.hybrid.feedback.RewardDecomposer;
import ch.so.arp.rag.hybrid.gating.GatingNetwork;
import ch.so.arp.rag.hybrid.learning.DecayScheduler;
import ch.so.arp.rag.hybrid.learning.LearningSettings;
import ch.so.arp.rag.hybrid.learning.PolicyGradientUpdater;
import ch.so.arp.rag.hybrid.learning.RewardBaseline;
import ch.so.arp.rag.hybrid.learning.TemporalDecayManager;
import ch.so.arp.rag.hybrid.parameter.InMemoryParameterStore;
import ch.so.arp.rag.hybrid.parameter.JdbcParameterStore;
import ch.so.arp.rag.hybrid.parameter.ParameterStore;
import ch.so.arp.rag.hybrid.parameter.ParameterWriter;
import ch.so.arp.rag.hybrid.parameter.Strategy;
import ch.so.arp.rag.hybrid.parameter.WeightSchema;
import ch.so.arp.rag.hybrid.retrieval.GraphTraversalScorer;
import ch.so.arp.rag.hybrid.retrieval.HybridRetrievalService;
import ch.so.arp.rag.hybrid.retrieval.HybridScoreCombiner;
import ch.so.arp.rag.hybrid.retrieval.InMemoryVectorIndex;
import ch.so.arp.rag.hybrid.retrieval.LinearRerankModel;
import ch.so.arp.rag.hybrid.retrieval.RerankModel;
import ch.so.arp.rag.hybrid.retrieval.TraceRepository;
import ch.so.arp.rag.hybrid.retrieval.VectorSimilaritySearcher;

/**
 * Central configuration wiring the retrieval and learning components together.
 * {@code hybrid.persistence.jdbc} decides whether the stores live in memory or
 * in the database.
 */
@Configuration
@EnableConfigurationProperties(HybridRetrievalProperties.class)
public class HybridRetrievalConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WeightSchema weightSchema(HybridRetrievalProperties properties) {
        List<Strategy> strategies = properties.getStrategies().stream()
                .map(strategy -> new Strategy(strategy.getId(), strategy.getRelationPriors(),
                        strategy.getDefaultRelationWeight(), strategy.getAllowedRelations(), strategy.getAlphaPrior(),
                        strategy.getGatingPrior()))
                .toList();
        return new WeightSchema(strategies, properties.getRetrieval().getAlphaLowerBound(),
                properties.getRetrieval().getAlphaUpperBound(), properties.getGating().getEmbeddingDimensions());
    }

    @Bean
    public ConflictRetrier conflictRetrier(HybridRetrievalProperties properties) {
        return new ConflictRetrier("parameter-cas", properties.getLearning().getConflictRetryAttempts(),
                properties.getLearning().getConflictRetryBackoff());
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentCatalog contentCatalog(HybridRetrievalProperties properties) {
        return new InMemoryContentCatalog(properties.getGating().getEmbeddingDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "hybrid.persistence.jdbc", havingValue = "false", matchIfMissing = true)
    public ParameterStore inMemoryParameterStore(WeightSchema weightSchema, Clock clock) {
        InMemoryParameterStore store = new InMemoryParameterStore(clock);
        weightSchema.bootstrap(store, clock);
        return store;
    }

    @Bean
    @ConditionalOnProperty(name = "hybrid.persistence.jdbc", havingValue = "true")
    public ParameterStore jdbcParameterStore(JdbcClient jdbcClient, DataSource dataSource,
            ObjectProvider<PlatformTransactionManager> transactionManager, ObjectProvider<ObjectMapper> objectMapper,
            WeightSchema weightSchema, Clock clock) {
        TransactionTemplate transactions = new TransactionTemplate(
                transactionManager.getIfAvailable(() -> new DataSourceTransactionManager(dataSource)));
        JdbcParameterStore store = new JdbcParameterStore(jdbcClient, transactions,
                objectMapper.getIfAvailable(ObjectMapper::new), clock);
        store.ensureSchema();
        weightSchema.bootstrap(store, clock);
        return store;
    }

    @Bean
    @ConditionalOnProperty(name = "hybrid.persistence.jdbc", havingValue = "false", matchIfMissing = true)
    public BridgeIndex inMemoryBridgeIndex(ContentCatalog contentCatalog, Clock clock) {
        return new InMemoryBridgeIndex(contentCatalog, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "hybrid.persistence.jdbc", havingValue = "true")
    public BridgeIndex jdbcBridgeIndex(JdbcClient jdbcClient, ContentCatalog contentCatalog, Clock clock,
            ConflictRetrier conflictRetrier) {
        JdbcBridgeIndex index = new JdbcBridgeIndex(jdbcClient, contentCatalog, clock, conflictRetrier);
        index.ensureSchema();
        return index;
    }

    @Bean
    @ConditionalOnProperty(name = "hybrid.persistence.jdbc", havingValue = "false", matchIfMissing = true)
    public AuthorityRepository inMemoryAuthorityRepository() {
        return new InMemoryAuthorityRepository();
    }

    @Bean
    @ConditionalOnProperty(name = "hybrid.persistence.jdbc", havingValue = "true")
    public AuthorityRepository jdbcAuthorityRepository(JdbcClient jdbcClient,
            ObjectProvider<ObjectMapper> objectMapper, ConflictRetrier conflictRetrier) {
        JdbcAuthorityRepository repository = new JdbcAuthorityRepository(jdbcClient,
                objectMapper.getIfAvailable(ObjectMapper::new), conflictRetrier);
        repository.ensureSchema();
        return repository;
    }

    @Bean
    public ParameterWriter parameterWriter(ParameterStore parameterStore, ConflictRetrier conflictRetrier,
            Clock clock) {
        return new ParameterWriter(parameterStore, conflictRetrier, clock);
    }

    @Bean
    public GatingNetwork gatingNetwork(WeightSchema weightSchema, HybridRetrievalProperties properties) {
        return new GatingNetwork(weightSchema, properties.getGating().getTemperature());
    }

    @Bean
    @ConditionalOnMissingBean
    public VectorSimilaritySearcher vectorSimilaritySearcher(ContentCatalog contentCatalog) {
        return new InMemoryVectorIndex(contentCatalog);
    }

    @Bean
    public GraphTraversalScorer graphTraversalScorer(ContentCatalog contentCatalog, WeightSchema weightSchema,
            HybridRetrievalProperties properties) {
        return new GraphTraversalScorer(contentCatalog, weightSchema, properties.getRetrieval().getHopLimit(),
                properties.getRetrieval().isBidirectionalTraversal());
    }

    @Bean
    public HybridScoreCombiner hybridScoreCombiner(BridgeIndex bridgeIndex, HybridRetrievalProperties properties) {
        return new HybridScoreCombiner(bridgeIndex, properties.getRetrieval().getNeutralGraphScore());
    }

    @Bean
    @ConditionalOnMissingBean
    public RerankModel rerankModel(HybridRetrievalProperties properties) {
        return new LinearRerankModel(properties.getLearning().getRerankTemperature());
    }

    @Bean
    public TraceRepository traceRepository(HybridRetrievalProperties properties) {
        return new TraceRepository(properties.getTrace().getRetention(), properties.getTrace().getMaxSize());
    }

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "retrievalExecutor")
    public ExecutorService retrievalExecutor(HybridRetrievalProperties properties) {
        return Executors.newFixedThreadPool(properties.getRetrieval().getThreads());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "learningExecutor")
    public ExecutorService learningExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public HybridRetrievalService hybridRetrievalService(WeightSchema weightSchema, ParameterStore parameterStore,
            GatingNetwork gatingNetwork, VectorSimilaritySearcher vectorSimilaritySearcher,
            GraphTraversalScorer graphTraversalScorer, HybridScoreCombiner hybridScoreCombiner,
            RerankModel rerankModel, TraceRepository traceRepository,
            @Qualifier("retrievalExecutor") Executor retrievalExecutor, HybridRetrievalProperties properties,
            Clock clock) {
        return new HybridRetrievalService(weightSchema, parameterStore, gatingNetwork, vectorSimilaritySearcher,
                graphTraversalScorer, hybridScoreCombiner, rerankModel, traceRepository, retrievalExecutor,
                properties.getRetrieval().getStrategyTimeout(), properties.getRetrieval().getOverRetrieveFactor(),
                clock);
    }

    @Bean
    public AuthorityCalculator authorityCalculator(AuthorityRepository authorityRepository,
            @Qualifier("learningExecutor") Executor learningExecutor, HybridRetrievalProperties properties,
            Clock clock) {
        HybridRetrievalProperties.Authority authority = properties.getAuthority();
        AuthorityWeights weights = new AuthorityWeights(authority.getBaselineWeight(),
                authority.getTrackRecordWeight(), authority.getRecentPerformanceWeight());
        return new AuthorityCalculator(authorityRepository, weights, authority.getRecentWindow(),
                authority.getNeutralPrior(), learningExecutor, clock);
    }

    @Bean
    public PolicyGradientUpdater policyGradientUpdater(WeightSchema weightSchema, ParameterStore parameterStore,
            ParameterWriter parameterWriter, BridgeIndex bridgeIndex, GatingNetwork gatingNetwork,
            RerankModel rerankModel, AuthorityCalculator authorityCalculator, HybridRetrievalProperties properties) {
        HybridRetrievalProperties.Learning learning = properties.getLearning();
        return new PolicyGradientUpdater(weightSchema, parameterStore, parameterWriter, bridgeIndex, gatingNetwork,
                rerankModel, authorityCalculator, new RewardBaseline(learning.getBaselineWindow()),
                new LearningSettings(learning.getLearningRate(), learning.getGradientClip(),
                        learning.getIterationCreditDecay()));
    }

    @Bean
    public FeedbackService feedbackService(TraceRepository traceRepository, WeightSchema weightSchema,
            PolicyGradientUpdater policyGradientUpdater, AuthorityCalculator authorityCalculator,
            @Qualifier("learningExecutor") Executor learningExecutor, HybridRetrievalProperties properties,
            Clock clock) {
        HybridRetrievalProperties.Learning learning = properties.getLearning();
        return new FeedbackService(traceRepository, weightSchema, new RewardDecomposer(weightSchema),
                policyGradientUpdater, authorityCalculator, learningExecutor, learning.isAsyncUpdates(),
                learning.getProcessedFeedbackRetention(), learning.getProcessedFeedbackMaxSize(), clock);
    }

    @Bean
    public TemporalDecayManager temporalDecayManager(ParameterStore parameterStore, ParameterWriter parameterWriter,
            HybridRetrievalProperties properties) {
        return new TemporalDecayManager(parameterStore, parameterWriter, properties.getDecay().getRate(),
                properties.getDecay().getReinforcementGrace());
    }

    @Bean
    @ConditionalOnProperty(name = "hybrid.decay.enabled", havingValue = "true", matchIfMissing = true)
    public ThreadPoolTaskScheduler decayTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("hybrid-decay-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    @ConditionalOnProperty(name = "hybrid.decay.enabled", havingValue = "true", matchIfMissing = true)
    public DecayScheduler decayScheduler(TemporalDecayManager temporalDecayManager,
            ThreadPoolTaskScheduler decayTaskScheduler, HybridRetrievalProperties properties, Clock clock) {
        return new DecayScheduler(temporalDecayManager, decayTaskScheduler, properties.getDecay().getInterval(),
                clock);
    }
}
