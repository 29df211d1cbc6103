package com.questrail.busanomaly.config;

import com.questrail.busanomaly.field.FieldVariability;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * AnomalyGenerationConfig
 * -----------------------------------------------------------------------------
 * Parameters of one anomaly-generation session.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>samplingPeriod</b>: Nominal period between two messages of the
 *       target identifier.</li>
 *   <li><b>sequenceDuration</b>: Time covered by one sequence; together with
 *       the sampling period it fixes the words per sequence.</li>
 *   <li><b>anomalyDuration</b>: Time covered by a field anomaly; the run
 *       length in words is {@code anomalyDuration / samplingPeriod}.</li>
 *   <li><b>dropLength</b>: Words removed by the drop anomaly.</li>
 *   <li><b>targetCategory</b>: Variability category of the field that field
 *       anomalies target.</li>
 *   <li><b>verbose</b>: Report onset and field geometry of field anomalies.</li>
 *   <li><b>seed</b>: Seed of the session's random source; {@code null} for an
 *       unseeded source.</li>
 * </ul>
 */
public record AnomalyGenerationConfig(
        Duration samplingPeriod,
        Duration sequenceDuration,
        Duration anomalyDuration,
        int dropLength,
        FieldVariability targetCategory,
        boolean verbose,
        Long seed
) {
    public AnomalyGenerationConfig {
        Objects.requireNonNull(samplingPeriod, "samplingPeriod");
        Objects.requireNonNull(sequenceDuration, "sequenceDuration");
        Objects.requireNonNull(anomalyDuration, "anomalyDuration");
        Objects.requireNonNull(targetCategory, "targetCategory");

        if (samplingPeriod.isZero() || samplingPeriod.isNegative()) {
            throw new IllegalArgumentException("samplingPeriod must be positive");
        }
        if (sequenceDuration.compareTo(samplingPeriod) < 0) {
            throw new IllegalArgumentException("sequenceDuration must cover at least one samplingPeriod");
        }
        if (anomalyDuration.isNegative()) {
            throw new IllegalArgumentException("anomalyDuration must be non-negative");
        }
        if (dropLength < 0) {
            throw new IllegalArgumentException("dropLength must be non-negative");
        }
    }

    /**
     * Returns the field-anomaly run length in words.
     */
    public int anomalyWordCount() {
        return (int) (anomalyDuration.toNanos() / samplingPeriod.toNanos());
    }

    /**
     * Returns a new random source for this configuration.
     */
    public Random newRandom() {
        return seed == null ? new Random() : new Random(seed);
    }

    /**
     * Creates a configuration with the defaults used for 10 ms bus traffic.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>samplingPeriod: 10ms</li>
     *   <li>sequenceDuration: 3s</li>
     *   <li>anomalyDuration: 1s</li>
     *   <li>dropLength: 10</li>
     *   <li>targetCategory: HIGH_VAR</li>
     *   <li>verbose: false</li>
     *   <li>seed: none</li>
     * </ul>
     */
    public static AnomalyGenerationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration samplingPeriod = Duration.ofMillis(10);
        private Duration sequenceDuration = Duration.ofSeconds(3);
        private Duration anomalyDuration = Duration.ofSeconds(1);
        private int dropLength = 10;
        private FieldVariability targetCategory = FieldVariability.HIGH_VAR;
        private boolean verbose;
        private Long seed;

        public Builder withSamplingPeriod(Duration samplingPeriod) {
            this.samplingPeriod = samplingPeriod;
            return this;
        }

        public Builder withSequenceDuration(Duration sequenceDuration) {
            this.sequenceDuration = sequenceDuration;
            return this;
        }

        public Builder withAnomalyDuration(Duration anomalyDuration) {
            this.anomalyDuration = anomalyDuration;
            return this;
        }

        public Builder withDropLength(int dropLength) {
            this.dropLength = dropLength;
            return this;
        }

        public Builder withTargetCategory(FieldVariability targetCategory) {
            this.targetCategory = targetCategory;
            return this;
        }

        public Builder withVerbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public AnomalyGenerationConfig build() {
            return new AnomalyGenerationConfig(samplingPeriod, sequenceDuration, anomalyDuration,
                    dropLength, targetCategory, verbose, seed);
        }
    }
}
