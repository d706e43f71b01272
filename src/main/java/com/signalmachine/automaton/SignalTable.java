package com.signalmachine.automaton;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bidirectional name to handle map. Grows monotonically; not thread-safe.
 */
public final class SignalTable {

    private final Map<String, Signal> byName = new HashMap<>();
    private final List<String> names = new ArrayList<>();

    public Signal intern(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Signal name must not be empty");
        }
        Signal existing = byName.get(name);
        if (existing != null) {
            return existing;
        }
        Signal signal = new Signal(names.size());
        names.add(name);
        byName.put(name, signal);
        return signal;
    }

    public Optional<Signal> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public String nameOf(Signal signal) {
        Objects.requireNonNull(signal, "signal");
        if (signal.id() >= names.size()) {
            throw new IllegalArgumentException("Signal " + signal.id() + " was not interned by this table");
        }
        return names.get(signal.id());
    }

    public int size() {
        return names.size();
    }
}
