package com.signalmachine.config;

import com.signalmachine.generator.DiagramOptions;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Limits and defaults for diagram requests. Each value is read from its {@code app.*} property first, then from
 * the matching environment variable.
 */
@Component
public class AppProperties {

    static final int DEFAULT_MAX_CELLS = 500;
    static final int DEFAULT_MAX_STEPS = 500;

    private final int maxCells;
    private final int maxSteps;
    private final String startSignal;

    public AppProperties(Environment environment) {
        this.maxCells = resolvePositive(environment, "app.max-cells", "APP_MAX_CELLS", DEFAULT_MAX_CELLS);
        this.maxSteps = resolvePositive(environment, "app.max-steps", "APP_MAX_STEPS", DEFAULT_MAX_STEPS);
        String signal = resolveOptional(environment, "app.start-signal", "APP_START_SIGNAL");
        this.startSignal = signal != null ? signal : DiagramOptions.DEFAULT_START_SIGNAL;
    }

    public int getMaxCells() {
        return maxCells;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    /**
     * Signal seeded on cell 0 when a request does not name one.
     */
    public String getStartSignal() {
        return startSignal;
    }

    private String resolveOptional(Environment environment, String propertyKey, String envKey) {
        String value = environment.getProperty(propertyKey);
        if (StringUtils.hasText(value)) {
            return value.trim();
        }
        value = environment.getProperty(envKey);
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private int resolvePositive(Environment environment, String propertyKey, String envKey, int defaultValue) {
        String value = resolveOptional(environment, propertyKey, envKey);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException();
            }
            return parsed;
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException(envKey + " must be a positive integer: " + value, ex);
        }
    }
}
