package com.signalmachine.automaton;

/**
 * Interned signal handle. Handles are only created by {@link SignalTable#intern(String)}, so two handles
 * from the same table are equal exactly when their names are.
 */
public record Signal(int id) implements Comparable<Signal> {

    public Signal {
        if (id < 0) {
            throw new IllegalArgumentException("Signal id must not be negative");
        }
    }

    @Override
    public int compareTo(Signal other) {
        return Integer.compare(id, other.id);
    }
}
