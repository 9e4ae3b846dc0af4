package io.dispatch4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.dispatch4j.JobHandler;
import io.dispatch4j.JobProducer;
import io.dispatch4j.core.JobHandlerRegistry;
import io.dispatch4j.internal.CadenceTrigger;
import io.dispatch4j.internal.DefaultJobProducer;
import io.dispatch4j.internal.JobRunner;
import io.dispatch4j.internal.JobRunnerOptions;
import io.dispatch4j.internal.QueueReconciler;
import io.dispatch4j.internal.mongo.MongoAttemptLogStore;
import io.dispatch4j.internal.mongo.MongoContentStore;
import io.dispatch4j.internal.mongo.MongoExecutionQueue;
import io.dispatch4j.internal.mongo.MongoJobStore;
import io.dispatch4j.internal.mongo.MongoPostingScheduleProvider;
import io.dispatch4j.payload.PayloadValidator;
import io.dispatch4j.publishing.AutoScheduler;
import io.dispatch4j.publishing.BackoffPolicy;
import io.dispatch4j.publishing.ContentPublishingJobHandler;
import io.dispatch4j.publishing.PlatformClientFactory;
import io.dispatch4j.publishing.PlatformClientRegistry;
import io.dispatch4j.publishing.PublishingScheduler;
import io.dispatch4j.publishing.PublishingStatsService;
import io.dispatch4j.publishing.RetryBackoffManager;
import io.dispatch4j.publishing.VariationPublisher;
import io.dispatch4j.ratelimit.InMemoryRateLimiter;
import io.dispatch4j.ratelimit.RateLimiter;
import io.dispatch4j.spi.AccountLookup;
import io.dispatch4j.spi.AttemptLogStore;
import io.dispatch4j.spi.ContentStore;
import io.dispatch4j.spi.ExecutionQueue;
import io.dispatch4j.spi.JobStore;
import io.dispatch4j.spi.PostingScheduleProvider;
import io.dispatch4j.spi.TenantResolver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Spring Boot auto-configuration entrypoint for dispatch components.
 *
 * <p>Publishing beans that need credentials are only created when the application
 * provides an {@link AccountLookup} bean.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration"
})
@ConditionalOnClass({JobProducer.class, MongoTemplate.class})
@EnableConfigurationProperties(DispatchProperties.class)
@ConditionalOnProperty(prefix = "dispatch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DispatchConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock dispatchClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper dispatchObjectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Bean
    @ConditionalOnMissingBean
    public PayloadValidator payloadValidator(ObjectMapper objectMapper) {
        return new PayloadValidator(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter rateLimiter(DispatchProperties props, Clock clock) {
        return new InMemoryRateLimiter(clock, props.getRateLimitWindow(), props.getPlatformLimits(), props.getMaxQueuedJobs());
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantResolver tenantResolver() {
        return parentId -> Optional.empty();
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, Clock clock) {
        return new MongoJobStore(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionQueue.class)
    protected MongoExecutionQueue mongoExecutionQueue(MongoTemplate mongoTemplate, Clock clock) {
        return new MongoExecutionQueue(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean(ContentStore.class)
    protected MongoContentStore mongoContentStore(MongoTemplate mongoTemplate) {
        return new MongoContentStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(AttemptLogStore.class)
    protected MongoAttemptLogStore mongoAttemptLogStore(MongoTemplate mongoTemplate) {
        return new MongoAttemptLogStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(PostingScheduleProvider.class)
    protected MongoPostingScheduleProvider mongoPostingScheduleProvider(MongoTemplate mongoTemplate) {
        return new MongoPostingScheduleProvider(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected DispatchMongoIndexConfig dispatchMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new DispatchMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobProducer jobProducer(DispatchProperties props,
                                   JobStore jobStore,
                                   ExecutionQueue queue,
                                   PayloadValidator validator,
                                   RateLimiter rateLimiter,
                                   TenantResolver tenantResolver,
                                   Clock clock) {
        return new DefaultJobProducer(jobStore, queue, validator, rateLimiter, tenantResolver, clock,
                props.getMaxActiveJobs(), props.getMaxAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRunner jobRunner(DispatchProperties props,
                               JobStore jobStore,
                               ExecutionQueue queue,
                               JobHandlerRegistry registry,
                               PayloadValidator validator,
                               ObjectMapper objectMapper,
                               Clock clock) {
        JobRunnerOptions options = new JobRunnerOptions(
                props.getWorkerId(),
                props.getProcessEvery(),
                props.getBatchSize(),
                props.getMaxConcurrency(),
                props.getLeaseLifetime()
        );
        return new JobRunner(jobStore, queue, registry, validator, objectMapper, clock, options);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueReconciler queueReconciler(DispatchProperties props, JobStore jobStore, ExecutionQueue queue, Clock clock) {
        DispatchProperties.Reconcile r = props.getReconcile();
        return new QueueReconciler(jobStore, queue, clock, r.getGracePeriod(), r.getMode());
    }

    @Bean
    @ConditionalOnMissingBean(name = "reconcileTrigger")
    @ConditionalOnProperty(prefix = "dispatch.reconcile", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CadenceTrigger reconcileTrigger(DispatchProperties props, QueueReconciler reconciler, Clock clock) {
        return new CadenceTrigger("reconcile", props.getReconcile().getCadence(), zone(props), clock,
                reconciler::reconcile);
    }

    @Bean
    @ConditionalOnMissingBean
    public AutoScheduler autoScheduler(DispatchProperties props, ContentStore contentStore, PostingScheduleProvider schedules) {
        return new AutoScheduler(contentStore, schedules, props.getAutoSchedule().getHorizon(), zone(props));
    }

    @Bean
    @ConditionalOnMissingBean
    public PublishingStatsService publishingStatsService(AttemptLogStore attemptLog, Clock clock) {
        return new PublishingStatsService(attemptLog, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchLifecycle dispatchLifecycle(JobRunner runner, ObjectProvider<CadenceTrigger> triggers) {
        return new DispatchLifecycle(runner, triggers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnProperty(prefix = "dispatch", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton dispatchIndexesInitializer(DispatchMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    private static ZoneId zone(DispatchProperties props) {
        return ZoneId.of(props.getAutoSchedule().getZone());
    }

    /**
     * Scheduled publishing. Needs the application's {@link AccountLookup}; platform
     * clients are collected from every {@link PlatformClientFactory} bean.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(AccountLookup.class)
    static class PublishingConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public PlatformClientRegistry platformClientRegistry(ObjectProvider<List<PlatformClientFactory>> factoriesProvider) {
            return new PlatformClientRegistry(factoriesProvider.getIfAvailable(List::of));
        }

        @Bean
        @ConditionalOnMissingBean
        public VariationPublisher variationPublisher(ContentStore contentStore,
                                                     AttemptLogStore attemptLog,
                                                     RateLimiter rateLimiter,
                                                     AccountLookup accountLookup,
                                                     PlatformClientRegistry clients,
                                                     Clock clock) {
            return new VariationPublisher(contentStore, attemptLog, rateLimiter, accountLookup, clients,
                    BackoffPolicy.defaults(), clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public RetryBackoffManager retryBackoffManager(ContentStore contentStore,
                                                       AttemptLogStore attemptLog,
                                                       VariationPublisher publisher,
                                                       Clock clock) {
            return new RetryBackoffManager(contentStore, attemptLog, publisher, clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public PublishingScheduler publishingScheduler(DispatchProperties props,
                                                       ContentStore contentStore,
                                                       AttemptLogStore attemptLog,
                                                       VariationPublisher publisher,
                                                       RetryBackoffManager retries,
                                                       Clock clock) {
            return new PublishingScheduler(contentStore, attemptLog, publisher, retries, clock,
                    props.getPublishing().getConcurrency());
        }

        @Bean
        @ConditionalOnMissingBean
        public ContentPublishingJobHandler contentPublishingJobHandler(ContentStore contentStore,
                                                                       AccountLookup accountLookup,
                                                                       VariationPublisher publisher,
                                                                       Clock clock) {
            return new ContentPublishingJobHandler(contentStore, accountLookup, publisher, clock);
        }

        @Bean
        @ConditionalOnMissingBean(name = "publishingTrigger")
        @ConditionalOnProperty(prefix = "dispatch.publishing", name = "enabled", havingValue = "true", matchIfMissing = true)
        public CadenceTrigger publishingTrigger(DispatchProperties props, PublishingScheduler scheduler, Clock clock) {
            return new CadenceTrigger("publishing", props.getPublishing().getCadence(), zone(props), clock,
                    scheduler::runOnce);
        }
    }
}
