package com.signalmachine.generator;

import java.util.Objects;

public final class DiagramOptions {

    public static final int DEFAULT_CELLS = 100;
    public static final int DEFAULT_STEPS = 100;
    public static final String DEFAULT_START_SIGNAL = "Init";

    private final String rules;
    private final int cells;
    private final int steps;
    private final String startSignal;

    private DiagramOptions(Builder builder) {
        this.rules = builder.rules;
        this.cells = builder.cells;
        this.steps = builder.steps;
        this.startSignal = builder.startSignal;
    }

    public String rules() {
        return rules;
    }

    public int cells() {
        return cells;
    }

    public int steps() {
        return steps;
    }

    /**
     * Signal placed on cell 0 of the initial configuration, or {@code null} to start from an empty strip.
     */
    public String startSignal() {
        return startSignal;
    }

    public String summary() {
        return "cells=" + cells + " steps=" + steps + " start=" + (startSignal == null ? "-" : startSignal);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String rules;
        private int cells = DEFAULT_CELLS;
        private int steps = DEFAULT_STEPS;
        private String startSignal = DEFAULT_START_SIGNAL;

        private Builder() {
        }

        public Builder rules(String rules) {
            this.rules = Objects.requireNonNull(rules, "rules");
            return this;
        }

        public Builder cells(int cells) {
            if (cells <= 0) {
                throw new IllegalArgumentException("Number of cells must be positive");
            }
            this.cells = cells;
            return this;
        }

        public Builder steps(int steps) {
            if (steps < 0) {
                throw new IllegalArgumentException("Number of steps must not be negative");
            }
            this.steps = steps;
            return this;
        }

        public Builder startSignal(String startSignal) {
            if (startSignal != null && startSignal.isBlank()) {
                throw new IllegalArgumentException("Start signal must not be blank");
            }
            this.startSignal = startSignal == null ? null : startSignal.trim();
            return this;
        }

        public DiagramOptions build() {
            if (rules == null) {
                throw new IllegalStateException("Rules must be provided");
            }
            return new DiagramOptions(this);
        }
    }
}
