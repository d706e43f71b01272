package com.signalmachine.automaton;

import java.util.Objects;

/**
 * Places {@code signal} on cell {@code c + neighbor} at time {@code t + futureStep} when the owning rule fires on
 * cell {@code c} at time {@code t}.
 */
public record RuleOutput(int neighbor, Signal signal, int futureStep) {

    public static final int DEFAULT_FUTURE_STEP = 1;

    public RuleOutput {
        Objects.requireNonNull(signal, "signal");
        if (futureStep < 0) {
            throw new IllegalArgumentException("Output cannot target a past time step: " + futureStep);
        }
        if (futureStep == 0 && neighbor != 0) {
            throw new IllegalArgumentException("Only the firing cell can receive a signal in the same time step");
        }
    }

    public String render(SignalTable table) {
        String target = neighbor + "." + table.nameOf(signal);
        return futureStep == DEFAULT_FUTURE_STEP ? target : futureStep + "/" + target;
    }
}
