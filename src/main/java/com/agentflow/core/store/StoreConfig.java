package com.agentflow.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link OrchestrationStore} bean.
 * <p>
 * With {@code agentflow.store.type=jdbc} a {@link JdbcOrchestrationStore} is
 * created over its own connection pool and its tables are ensured on startup.
 * Otherwise an {@link InMemoryOrchestrationStore} is used: suitable for
 * development and tests but not durable across restarts.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "agentflow.store", name = "type", havingValue = "jdbc")
    public DataSource orchestrationDataSource(StoreProperties properties) {
        var jdbc = properties.getJdbc();
        log.info("Connecting orchestration store to {}", jdbc.getUrl());
        return DataSourceBuilder.create()
                .url(jdbc.getUrl())
                .username(jdbc.getUsername())
                .password(jdbc.getPassword())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "agentflow.store", name = "type", havingValue = "jdbc")
    public OrchestrationStore jdbcOrchestrationStore(DataSource orchestrationDataSource,
                                                     ObjectMapper objectMapper,
                                                     StoreProperties properties) throws Exception {
        log.info("Configuring JDBC orchestration store");
        var store = new JdbcOrchestrationStore(orchestrationDataSource, objectMapper,
                properties.getJdbc().getTablePrefix());
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnProperty(prefix = "agentflow.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public OrchestrationStore memoryOrchestrationStore() {
        log.info("Using in-memory orchestration store (state will not persist across restarts)");
        return new InMemoryOrchestrationStore();
    }
}
