package com.eventseries.service.storage.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.eventseries.service.core.autoconfigure.TsdbAutoConfiguration;
import com.eventseries.service.core.spi.TsdbQueryExecutor;
import com.eventseries.service.core.tsdb.TsdbQueryService;
import com.eventseries.service.storage.config.StorageProperties;
import com.eventseries.service.storage.impl.JdbcTsdbQueryExecutor;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class JdbcExecutorAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(
                    AutoConfigurations.of(JdbcExecutorAutoConfiguration.class, TsdbAutoConfiguration.class));

    @Test
    void wiresJdbcExecutorWhenDataSourcePresent() {
        runner.withUserConfiguration(DataSourceConfig.class).run(context -> {
            assertThat(context).hasSingleBean(TsdbQueryExecutor.class);
            assertThat(context.getBean(TsdbQueryExecutor.class)).isInstanceOf(JdbcTsdbQueryExecutor.class);
            assertThat(context).hasSingleBean(TsdbQueryService.class);
        });
    }

    @Test
    void tableOverridesAreBound() {
        runner.withUserConfiguration(DataSourceConfig.class)
                .withPropertyValues("eventseries.tsdb.storage.tables.outcomes=outcomes_daily_local")
                .run(context -> {
                    StorageProperties properties = context.getBean(StorageProperties.class);
                    assertThat(properties.tableFor(com.eventseries.service.core.model.Dataset.OUTCOMES))
                            .isEqualTo("outcomes_daily_local");
                    assertThat(properties.tableFor(com.eventseries.service.core.model.Dataset.EVENTS))
                            .isEqualTo("errors_local");
                });
    }

    @Test
    void disabledStorageLeavesNoExecutor() {
        runner.withUserConfiguration(DataSourceConfig.class)
                .withPropertyValues("eventseries.tsdb.storage.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(TsdbQueryExecutor.class);
                    assertThat(context).doesNotHaveBean(TsdbQueryService.class);
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class DataSourceConfig {

        @Bean
        DataSource dataSource() {
            return mock(DataSource.class);
        }
    }
}
