package com.tandem.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Spring {@link Configuration} that selects the task, project and ledger stores.
 * <p>
 * When {@code spring.datasource.url} is set, PostgreSQL-backed JDBC stores are created
 * and their tables ensured on startup. Otherwise in-memory stores are used as a
 * fallback -- suitable for development and testing but not durable across restarts.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @ConfigurationProperties("spring.datasource")
    @ConditionalOnProperty("spring.datasource.url")
    public DataSourceProperties dataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @ConditionalOnProperty("spring.datasource.url")
    public DataSource dataSource(DataSourceProperties properties) throws SQLException {
        log.info("Configuring JDBC stores (PostgreSQL) at {}", properties.getUrl());
        DataSource dataSource = properties.initializeDataSourceBuilder().build();
        JdbcSchema.createTables(dataSource);
        return dataSource;
    }

    @Bean
    @ConditionalOnProperty("spring.datasource.url")
    public ProjectStore jdbcProjectStore(DataSource dataSource) {
        return new JdbcProjectStore(dataSource);
    }

    @Bean
    @ConditionalOnProperty("spring.datasource.url")
    public InteractionLedger jdbcInteractionLedger(DataSource dataSource, ObjectMapper objectMapper) {
        return new JdbcInteractionLedger(dataSource, objectMapper);
    }

    @Bean
    @ConditionalOnProperty("spring.datasource.url")
    public TaskStore jdbcTaskStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        return new JdbcTaskStore(dataSource, objectMapper, clock);
    }

    /**
     * In-memory fallback stores, used when no DataSource is configured.
     * State is lost on application restart.
     */
    @Configuration
    @ConditionalOnExpression("'${spring.datasource.url:}'.isEmpty()")
    static class InMemoryStores {

        @Bean
        public InMemoryProjectStore inMemoryProjectStore() {
            log.info("No DataSource configured; using in-memory stores (state will not persist across restarts)");
            return new InMemoryProjectStore();
        }

        @Bean
        public InMemoryInteractionLedger inMemoryInteractionLedger() {
            return new InMemoryInteractionLedger();
        }

        @Bean
        public InMemoryTaskStore inMemoryTaskStore(InMemoryInteractionLedger ledger,
                                                   InMemoryProjectStore projects,
                                                   Clock clock) {
            return new InMemoryTaskStore(ledger, projects, clock);
        }
    }
}
