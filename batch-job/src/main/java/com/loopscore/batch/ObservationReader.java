package com.loopscore.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reads JSON-lines input into {@link Observation}s.
 *
 * <p>
 * Blank lines are ignored. A line that is not a JSON object (malformed text,
 * an array, a scalar or {@code null}) is logged and skipped, so one bad record
 * does not abort the whole batch.
 * </p>
 *
 * @since 1.0.0
 */
public class ObservationReader {

    private static final Logger LOG = LoggerFactory.getLogger(ObservationReader.class);

    private final ObjectMapper mapper;

    public ObservationReader() {
        this.mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Read every observation of a file.
     *
     * @param path JSON-lines file; must not be {@code null}
     * @return unmodifiable list of observations in file order
     * @throws IllegalArgumentException if the file does not exist
     * @throws IOException              if reading fails
     */
    public List<Observation> read(Path path) throws IOException {
        Objects.requireNonNull(path, "Input path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Observation> observations = read(reader);
            LOG.info("Read {} observation(s) from {}", observations.size(), path);
            return observations;
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Input file not found: " + path, e);
        }
    }

    /**
     * Read every observation from a character stream. The reader is not closed.
     *
     * @param reader JSON-lines source; must not be {@code null}
     * @return unmodifiable list of observations in input order
     * @throws IOException if reading fails
     */
    public List<Observation> read(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "Reader must not be null");
        BufferedReader lines = reader instanceof BufferedReader b ? b : new BufferedReader(reader);

        List<Observation> observations = new ArrayList<>();
        int lineNumber = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            Observation observation;
            try {
                observation = mapper.readValue(line, Observation.class);
            } catch (JsonProcessingException e) {
                LOG.warn("Failed to parse line {}, skipping: {}", lineNumber, e.getOriginalMessage());
                continue;
            }
            if (observation == null) {
                LOG.warn("Line {} is not a JSON object, skipping", lineNumber);
                continue;
            }
            observations.add(observation);
        }
        return Collections.unmodifiableList(observations);
    }
}
