package com.loopscore.batch;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;

/**
 * Writes {@link ScoreRecord}s as JSON lines.
 *
 * @since 1.0.0
 */
public class ScoreWriter {

    private static final byte NEWLINE = '\n';

    private final ObjectMapper mapper;

    public ScoreWriter() {
        this.mapper = new ObjectMapper();
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    /**
     * Write one line per record and flush. The stream is not closed.
     *
     * @param records records in output order; must not be {@code null}
     * @param out     target stream; must not be {@code null}
     * @throws IOException if writing fails
     */
    public void write(List<ScoreRecord> records, OutputStream out) throws IOException {
        Objects.requireNonNull(records, "Records must not be null");
        Objects.requireNonNull(out, "Output stream must not be null");
        for (ScoreRecord record : records) {
            out.write(mapper.writeValueAsBytes(record));
            out.write(NEWLINE);
        }
        out.flush();
    }
}
