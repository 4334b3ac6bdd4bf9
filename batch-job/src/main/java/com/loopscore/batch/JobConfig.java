package com.loopscore.batch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration of the LoOP batch job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a shell, a container {@code -e} flag or a
 * scheduler without command-line parsing.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><th>Variable</th><th>Default</th><th>Meaning</th></tr>
 * <tr><td>{@code LOOP_INPUT_PATH}</td><td>(required)</td><td>JSON-lines input file</td></tr>
 * <tr><td>{@code LOOP_OUTPUT_PATH}</td><td>stdout</td><td>JSON-lines output file</td></tr>
 * <tr><td>{@code LOOP_FEATURE_FIELDS}</td><td>all numeric</td><td>comma-separated feature fields</td></tr>
 * <tr><td>{@code LOOP_CLUSTER_FIELD}</td><td>none</td><td>field holding the cluster label</td></tr>
 * <tr><td>{@code LOOP_ID_FIELD}</td><td>none</td><td>field copied to the output as {@code id}</td></tr>
 * <tr><td>{@code LOOP_CONFIG_PATH}</td><td>classpath / defaults</td><td>detector YAML</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    private final String inputPath;
    private final String outputPath;
    private final List<String> featureFields;
    private final String clusterField;
    private final String idField;
    private final String loopConfigPath;

    private JobConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.featureFields = List.copyOf(b.featureFields);
        this.clusterField = b.clusterField;
        this.idField = b.idField;
        this.loopConfigPath = b.loopConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if {@code LOOP_INPUT_PATH} is not set
     */
    public static JobConfig fromEnvironment() {
        return new Builder()
                .inputPath(env("LOOP_INPUT_PATH", ""))
                .outputPath(env("LOOP_OUTPUT_PATH", ""))
                .featureFields(parseList(env("LOOP_FEATURE_FIELDS", "")))
                .clusterField(env("LOOP_CLUSTER_FIELD", ""))
                .idField(env("LOOP_ID_FIELD", ""))
                .loopConfigPath(env("LOOP_CONFIG_PATH", ""))
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    /**
     * @return output file path, blank for standard output
     */
    public String getOutputPath() {
        return outputPath;
    }

    /**
     * @return configured feature fields; empty means "infer from input"
     */
    public List<String> getFeatureFields() {
        return featureFields;
    }

    public String getClusterField() {
        return clusterField;
    }

    public boolean hasClusterField() {
        return !clusterField.isBlank();
    }

    public String getIdField() {
        return idField;
    }

    /**
     * @return detector YAML path, blank to use {@code LoopConfigLoader.load()}
     */
    public String getLoopConfigPath() {
        return loopConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} requires a non-blank input path and rejects blank or
     * duplicate feature names. {@code null} optional values are treated as
     * blank.
     * </p>
     */
    public static class Builder {
        private String inputPath = "";
        private String outputPath = "";
        private List<String> featureFields = new ArrayList<>();
        private String clusterField = "";
        private String idField = "";
        private String loopConfigPath = "";

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder featureFields(List<String> v) {
            this.featureFields = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder clusterField(String v) {
            this.clusterField = v;
            return this;
        }

        public Builder idField(String v) {
            this.idField = v;
            return this;
        }

        public Builder loopConfigPath(String v) {
            this.loopConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            if (inputPath == null || inputPath.isBlank()) {
                throw new IllegalArgumentException("inputPath must not be null or blank");
            }
            outputPath = Objects.requireNonNullElse(outputPath, "").trim();
            clusterField = Objects.requireNonNullElse(clusterField, "").trim();
            idField = Objects.requireNonNullElse(idField, "").trim();
            loopConfigPath = Objects.requireNonNullElse(loopConfigPath, "").trim();

            for (String field : featureFields) {
                if (field == null || field.isBlank()) {
                    throw new IllegalArgumentException("featureFields must not contain blank names");
                }
            }
            if (featureFields.stream().distinct().count() != featureFields.size()) {
                throw new IllegalArgumentException("featureFields must be unique, got: " + featureFields);
            }
            if (hasText(clusterField) && featureFields.contains(clusterField)) {
                throw new IllegalArgumentException(
                        "clusterField '" + clusterField + "' must not also be a feature field");
            }

            return new JobConfig(this);
        }

        private static boolean hasText(String value) {
            return value != null && !value.isBlank();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    static List<String> parseList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", featureFields=" + featureFields +
                ", clusterField='" + clusterField + '\'' +
                ", idField='" + idField + '\'' +
                ", loopConfigPath='" + loopConfigPath + '\'' +
                '}';
    }
}
