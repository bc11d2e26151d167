package com.eventseries.service.storage.autoconfigure;

import com.eventseries.service.core.spi.TsdbQueryExecutor;
import com.eventseries.service.storage.config.StorageProperties;
import com.eventseries.service.storage.impl.ClickHouseSqlRenderer;
import com.eventseries.service.storage.impl.JdbcTsdbQueryExecutor;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, JdbcTemplateAutoConfiguration.class})
@ConditionalOnClass(NamedParameterJdbcTemplate.class)
@ConditionalOnProperty(
        prefix = "eventseries.tsdb.storage",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
@EnableConfigurationProperties(StorageProperties.class)
public class JdbcExecutorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DataSource.class)
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClickHouseSqlRenderer clickHouseSqlRenderer(StorageProperties properties) {
        return new ClickHouseSqlRenderer(properties);
    }

    @Bean
    @ConditionalOnMissingBean(TsdbQueryExecutor.class)
    @ConditionalOnBean(NamedParameterJdbcTemplate.class)
    public TsdbQueryExecutor jdbcTsdbQueryExecutor(NamedParameterJdbcTemplate jdbc, ClickHouseSqlRenderer renderer) {
        return new JdbcTsdbQueryExecutor(jdbc, renderer);
    }
}
