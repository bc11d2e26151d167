package com.eventseries.service.storage.config;

import com.eventseries.service.core.model.Dataset;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "eventseries.tsdb.storage")
public class StorageProperties {
    private boolean enabled = true;
    private String timestampColumn = "timestamp";
    private String environmentIdColumn = "environment_id";
    private Map<Dataset, String> tables = defaultTables();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public void setTimestampColumn(String timestampColumn) {
        this.timestampColumn = timestampColumn;
    }

    public String getEnvironmentIdColumn() {
        return environmentIdColumn;
    }

    public void setEnvironmentIdColumn(String environmentIdColumn) {
        this.environmentIdColumn = environmentIdColumn;
    }

    public Map<Dataset, String> getTables() {
        return tables;
    }

    public void setTables(Map<Dataset, String> tables) {
        Map<Dataset, String> merged = defaultTables();
        merged.putAll(tables);
        this.tables = merged;
    }

    public String tableFor(Dataset dataset) {
        String table = tables.get(dataset);
        if (table == null || table.isBlank()) {
            throw new IllegalStateException("No table configured for dataset " + dataset);
        }
        return table;
    }

    private static Map<Dataset, String> defaultTables() {
        Map<Dataset, String> defaults = new EnumMap<>(Dataset.class);
        defaults.put(Dataset.EVENTS, "errors_local");
        defaults.put(Dataset.TRANSACTIONS, "transactions_local");
        defaults.put(Dataset.ISSUE_PLATFORM, "search_issues_local");
        defaults.put(Dataset.OUTCOMES, "outcomes_hourly_local");
        defaults.put(Dataset.OUTCOMES_RAW, "outcomes_raw_local");
        return defaults;
    }
}
