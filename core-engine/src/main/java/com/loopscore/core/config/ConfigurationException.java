package com.loopscore.core.config;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raised when the detector configuration or the inputs it is applied to are
 * invalid: {@code extent} outside (0, 1], {@code neighbors} not positive, or
 * {@code neighbors} not smaller than the smallest cluster.
 *
 * <p>
 * Always thrown before any distance is computed. The exception carries every
 * violation found, so a caller fixing its configuration sees all problems at
 * once.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    /**
     * @param violations human-readable descriptions of each problem, naming the
     *                   offending parameter and value; must not be empty
     */
    public ConfigurationException(List<String> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * @param violation a single problem description
     */
    public ConfigurationException(String violation) {
        this(Collections.singletonList(violation));
    }

    /**
     * @return unmodifiable list of violations, in detection order
     */
    public List<String> getViolations() {
        return violations;
    }

    private static String describe(List<String> violations) {
        Objects.requireNonNull(violations, "violations must not be null");
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("At least one violation is required");
        }
        if (violations.size() == 1) {
            return "Invalid LoOP configuration: " + violations.get(0);
        }
        return "Invalid LoOP configuration:\n  - " + String.join("\n  - ", violations);
    }
}
