package com.cellsentinel.flink;

import java.io.Serializable;

/**
 * Typed, immutable configuration object for the Cell Sentinel batch job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configurable from the shell or a container definition
 * without touching files.
 * </p>
 *
 * <h3>Environment</h3>
 * <ul>
 * <li>{@code TRAFFIC_INPUT_PATH}: hourly traffic, JSON lines (default
 * {@code data/traffic.jsonl})</li>
 * <li>{@code GEOMETRY_INPUT_PATH}: antenna geometry, JSON lines (default
 * {@code data/geometry.jsonl})</li>
 * <li>{@code OUTPUT_DIR}: directory receiving the report files (default
 * {@code output})</li>
 * <li>{@code FLINK_PARALLELISM}: parallelism of the classification
 * (default 1)</li>
 * <li>{@code DETECTION_CONFIG_PATH}: optional detection YAML; the bundled
 * {@code detection.yml} is used when empty</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final String trafficInputPath;
    private final String geometryInputPath;
    private final String outputDir;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private final String detectionConfigPath;

    private JobConfig(Builder b) {
        this.trafficInputPath = b.trafficInputPath;
        this.geometryInputPath = b.geometryInputPath;
        this.outputDir = b.outputDir;
        this.parallelism = b.parallelism;
        this.detectionConfigPath = b.detectionConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .trafficInputPath(env("TRAFFIC_INPUT_PATH", "data/traffic.jsonl"))
                    .geometryInputPath(env("GEOMETRY_INPUT_PATH", "data/geometry.jsonl"))
                    .outputDir(env("OUTPUT_DIR", "output"))
                    .parallelism(Integer.parseInt(env("FLINK_PARALLELISM", "1")))
                    .detectionConfigPath(env("DETECTION_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return {@code true} if an explicit detection config file was given
     */
    public boolean hasDetectionConfigPath() {
        return !detectionConfigPath.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getTrafficInputPath() {
        return trafficInputPath;
    }

    public String getGeometryInputPath() {
        return geometryInputPath;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public int getParallelism() {
        return parallelism;
    }

    public String getDetectionConfigPath() {
        return detectionConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, non-blank input and output paths).
     * </p>
     */
    public static class Builder {
        private String trafficInputPath = "data/traffic.jsonl";
        private String geometryInputPath = "data/geometry.jsonl";
        private String outputDir = "output";
        private int parallelism = 1;
        private String detectionConfigPath = "";

        public Builder trafficInputPath(String v) {
            this.trafficInputPath = v;
            return this;
        }

        public Builder geometryInputPath(String v) {
            this.geometryInputPath = v;
            return this;
        }

        public Builder outputDir(String v) {
            this.outputDir = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder detectionConfigPath(String v) {
            this.detectionConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(trafficInputPath, "trafficInputPath");
            requireNonBlank(geometryInputPath, "geometryInputPath");
            requireNonBlank(outputDir, "outputDir");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (detectionConfigPath == null) {
                detectionConfigPath = "";
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "trafficInputPath='" + trafficInputPath + '\'' +
                ", geometryInputPath='" + geometryInputPath + '\'' +
                ", outputDir='" + outputDir + '\'' +
                ", parallelism=" + parallelism +
                ", detectionConfigPath='" + detectionConfigPath + '\'' +
                '}';
    }
}
