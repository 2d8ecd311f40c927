package io.jobs4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.JobManager;
import io.jobs4j.core.ScheduleSnapshotStore;
import io.jobs4j.internal.mongo.MongoScheduleStore;
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

/**
 * Spring Boot auto-configuration entrypoint for the job manager.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(JobManager.class)
@EnableConfigurationProperties(JobManagerProperties.class)
@ConditionalOnProperty(prefix = "jobs4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobManagerConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobManager jobManager(JobManagerProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper om = objectMapper.getIfAvailable();
        return om != null ? new JobManager(props, om) : new JobManager(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobManagerLifecycle jobManagerLifecycle(JobManager jobManager, JobManagerProperties props,
                                                   ObjectProvider<ScheduleSnapshotStore> snapshotStore) {
        return new JobManagerLifecycle(jobManager, props, snapshotStore.getIfAvailable());
    }

    /**
     * Mongo-backed schedule persistence, active when Spring Data MongoDB and a {@link MongoTemplate}
     * are present.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({MongoTemplate.class, MongoScheduleStore.class})
    @ConditionalOnBean(MongoTemplate.class)
    static class MongoStoreConfig {

        @Bean
        @ConditionalOnMissingBean(ScheduleSnapshotStore.class)
        MongoScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            return new MongoScheduleStore(mongoTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        JobsMongoIndexConfig jobsMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new JobsMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "jobs4j", name = "ensure-indexes-on-startup", havingValue = "true")
        SmartInitializingSingleton jobsIndexesInitializer(JobsMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }
}
