package com.eventseries.service.core.config;

import com.eventseries.service.core.rollup.RollupSpec;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "eventseries.tsdb")
public class TsdbProperties {
    private int maxRows = 10000;
    private List<Rollup> rollups = new ArrayList<>(List.of(
            new Rollup(10, 360),
            new Rollup(3600, 24 * 7),
            new Rollup(3600 * 24, 90)));

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public List<Rollup> getRollups() {
        return rollups;
    }

    public void setRollups(List<Rollup> rollups) {
        this.rollups = rollups;
    }

    public List<RollupSpec> rollupSpecs() {
        return rollups.stream().map(r -> new RollupSpec(r.getSeconds(), r.getSamples())).toList();
    }

    public static class Rollup {
        private int seconds;
        private int samples;

        public Rollup() {}

        public Rollup(int seconds, int samples) {
            this.seconds = seconds;
            this.samples = samples;
        }

        public int getSeconds() {
            return seconds;
        }

        public void setSeconds(int seconds) {
            this.seconds = seconds;
        }

        public int getSamples() {
            return samples;
        }

        public void setSamples(int samples) {
            this.samples = samples;
        }
    }
}
