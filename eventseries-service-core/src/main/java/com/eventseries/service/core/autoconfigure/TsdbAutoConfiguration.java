package com.eventseries.service.core.autoconfigure;

import com.eventseries.service.core.config.TsdbProperties;
import com.eventseries.service.core.query.QueryBuilder;
import com.eventseries.service.core.registry.ModelRegistry;
import com.eventseries.service.core.rollup.RollupPlanner;
import com.eventseries.service.core.spi.TsdbQueryExecutor;
import com.eventseries.service.core.tsdb.TsdbQueryService;
import java.time.Clock;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(afterName = "com.eventseries.service.storage.autoconfigure.JdbcExecutorAutoConfiguration")
@EnableConfigurationProperties(TsdbProperties.class)
public class TsdbAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock tsdbClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelRegistry modelRegistry() {
        return ModelRegistry.createDefault();
    }

    @Bean
    @ConditionalOnMissingBean
    public RollupPlanner rollupPlanner(TsdbProperties properties, Clock clock) {
        return new RollupPlanner(properties.rollupSpecs(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryBuilder queryBuilder(ModelRegistry registry, RollupPlanner planner, TsdbProperties properties) {
        return new QueryBuilder(registry, planner, properties.getMaxRows());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TsdbQueryExecutor.class)
    public TsdbQueryService tsdbQueryService(
            ModelRegistry registry, QueryBuilder queryBuilder, TsdbQueryExecutor executor) {
        return new TsdbQueryService(registry, queryBuilder, executor);
    }
}
