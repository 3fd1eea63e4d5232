package io.github.hunghhdev.cohortttl.spring;

import io.github.hunghhdev.cohortttl.core.CleanupEngine;
import io.github.hunghhdev.cohortttl.core.CleanupEventListener;
import io.github.hunghhdev.cohortttl.core.DocumentStore;
import io.github.hunghhdev.cohortttl.core.ExpiryCallback;
import io.github.hunghhdev.cohortttl.core.PgDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Map;

/**
 * Auto-configuration for the cohort TTL engine.
 * Creates a PostgreSQL document store from the application's DataSource unless a {@link DocumentStore} bean
 * exists, then an engine governed by the {@code cohortttl.resources} rules. The engine starts with the
 * context and releases its coordinator lease when the context closes.
 */
@Configuration
@ConditionalOnClass(CleanupEngine.class)
@ConditionalOnProperty(prefix = "cohortttl", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CohortTtlProperties.class)
@AutoConfigureAfter(DataSourceAutoConfiguration.class)
public class CohortTtlAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(CohortTtlAutoConfiguration.class);

    /**
     * Document store over the application's DataSource.
     */
    @Configuration
    @ConditionalOnClass(DataSource.class)
    @ConditionalOnBean(DataSource.class)
    static class JdbcDocumentStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(DocumentStore.class)
        public PgDocumentStore cohortTtlDocumentStore(DataSource dataSource, CohortTtlProperties properties) {
            logger.info("Auto-configuring PgDocumentStore with table: {}, auto-create: {}",
                       properties.getTableName(), properties.isAutoCreateTable());
            return PgDocumentStore.builder()
                    .dataSource(dataSource)
                    .tableName(properties.getTableName())
                    .autoCreateTable(properties.isAutoCreateTable())
                    .build();
        }
    }

    /**
     * Create the engine. Every {@link ExpiryCallback} bean is registered under its bean name.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    @ConditionalOnBean(DocumentStore.class)
    public CleanupEngine cohortTtlEngine(DocumentStore store, CohortTtlProperties properties,
                                         ListableBeanFactory beanFactory,
                                         ObjectProvider<CleanupEventListener> listeners) {
        Map<String, ExpiryCallback> callbacks = beanFactory.getBeansOfType(ExpiryCallback.class);

        CleanupEngine.Builder builder = CleanupEngine.builder()
                .store(store)
                .options(properties.toOptions())
                .rules(properties.toRules())
                .callbacks(callbacks)
                .registerShutdownHook(false);
        listeners.orderedStream().forEach(builder::listener);

        CleanupEngine engine = builder.build();
        logger.info("Auto-configuring cohort TTL engine for resources {} with {} callbacks, coordinator: {}",
                   engine.getRules().keySet(), callbacks.size(), properties.getCoordinator().isEnabled());
        return engine;
    }
}
