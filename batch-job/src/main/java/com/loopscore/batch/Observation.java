package com.loopscore.batch;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One input record of the batch job.
 *
 * <p>
 * Records arrive as free-form JSON objects, one per line. This class keeps
 * them as an ordered {@link Map} so that feature, cluster and id fields can be
 * chosen by configuration instead of a fixed schema.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Observation {

    /** Every key/value pair of the JSON object, in document order. */
    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** Receives every property of the input line, in document order. */
    @JsonAnySetter
    public void setField(String key, Object value) {
        fields.put(key, value);
    }

    /**
     * Used when inferring feature columns from the first record of a batch.
     *
     * @return read-only view of the record's properties
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Numeric value of a property. JSON numbers are widened to {@code double};
     * quoted numbers such as {@code "3.5"} are parsed.
     *
     * @param fieldName property name
     * @return the value, empty when absent, {@code null} or not a number
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Feature cell for the dataset row built from this record. Anything that
     * is not numeric becomes a missing value, which the detector scores as NaN
     * for this row only.
     */
    public double getFeature(String fieldName) {
        return getNumericField(fieldName).orElse(Double.NaN);
    }

    /**
     * Property rendered as text, as used for cluster labels and record ids.
     * The number {@code 3} and the string {@code "3"} give the same label.
     */
    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Observation other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Observation" + fields;
    }
}
