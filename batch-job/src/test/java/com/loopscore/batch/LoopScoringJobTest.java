package com.loopscore.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests for {@link LoopScoringJob}.
 */
class LoopScoringJobTest {

    private static final double[][] ROWS = {
            {0.0, 0.0}, {0.0, 1.0}, {1.0, 0.0}, {1.0, 1.0}, {3.0, 3.0},
            {10.0, 10.0}, {10.5, 10.0}, {10.0, 11.0}, {11.0, 11.5}, {14.0, 9.0}};

    @TempDir
    Path dir;

    private Path input;
    private Path output;
    private Path loopConfig;

    @BeforeEach
    void setUp() throws IOException {
        StringBuilder lines = new StringBuilder();
        for (int i = 0; i < ROWS.length; i++) {
            lines.append("{\"id\":\"obs-").append(i)
                    .append("\",\"x\":").append(ROWS[i][0])
                    .append(",\"y\":").append(ROWS[i][1])
                    .append(",\"group\":\"").append(i < 5 ? "low" : "high")
                    .append("\"}\n");
        }
        input = Files.writeString(dir.resolve("input.jsonl"), lines.toString());
        output = dir.resolve("scores.jsonl");
        loopConfig = Files.writeString(dir.resolve("loop.yml"), "extent: 0.997\nneighbors: 2\n");
    }

    @Test
    @DisplayName("Should score clustered input and write one line per observation")
    void shouldScoreClusteredInput() throws IOException {
        JobConfig config = new JobConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .clusterField("group")
                .idField("id")
                .loopConfigPath(loopConfig.toString())
                .build();

        List<ScoreRecord> records = LoopScoringJob.run(config);

        assertThat(records).hasSize(ROWS.length);
        assertThat(records.get(4).getProbability()).isCloseTo(0.9551456782018998, within(1e-9));
        assertThat(records.get(9).getProbability()).isCloseTo(0.946973242578056, within(1e-9));
        assertThat(records.get(0).getProbability()).isEqualTo(0.0);

        List<JsonNode> written = readOutput();
        assertThat(written).hasSize(ROWS.length);
        assertThat(written.get(4).get("row").asInt()).isEqualTo(4);
        assertThat(written.get(4).get("id").asText()).isEqualTo("obs-4");
        assertThat(written.get(4).get("cluster").asText()).isEqualTo("low");
        assertThat(written.get(9).get("cluster").asText()).isEqualTo("high");
        assertThat(written.get(4).get("probability").asDouble()).isCloseTo(0.9551456782018998, within(1e-9));
    }

    @Test
    @DisplayName("Without a cluster field all observations should form one cluster")
    void shouldScoreAsSingleCluster() throws IOException {
        JobConfig config = new JobConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .featureFields(List.of("x", "y"))
                .loopConfigPath(loopConfig.toString())
                .build();

        List<ScoreRecord> records = LoopScoringJob.run(config);

        assertThat(records.get(4).getProbability()).isCloseTo(0.9191957992916892, within(1e-9));
        assertThat(records.get(9).getProbability()).isCloseTo(0.9693759263615517, within(1e-9));

        JsonNode first = readOutput().get(0);
        assertThat(first.has("id")).isFalse();
        assertThat(first.has("cluster")).isFalse();
    }

    @Test
    @DisplayName("A row with a missing feature should be written with a null probability")
    void shouldWriteNullForMissingFeature() throws IOException {
        List<String> lines = new ArrayList<>(Files.readAllLines(input));
        lines.set(2, "{\"id\":\"obs-2\",\"y\":0.0,\"group\":\"low\"}");
        Files.write(input, lines);

        JobConfig config = new JobConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .featureFields(List.of("x", "y"))
                .clusterField("group")
                .loopConfigPath(loopConfig.toString())
                .build();

        List<ScoreRecord> records = LoopScoringJob.run(config);

        assertThat(records.get(2).getProbability()).isNull();
        assertThat(records.get(4).getProbability()).isCloseTo(0.9151546762197165, within(1e-6));
        assertThat(readOutput().get(2).get("probability").isNull()).isTrue();
    }

    private List<JsonNode> readOutput() throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        List<JsonNode> nodes = new ArrayList<>();
        for (String line : Files.readAllLines(output)) {
            nodes.add(mapper.readTree(line));
        }
        return nodes;
    }
}
