package com.signalmachine.generator;

import com.signalmachine.automaton.Automaton;
import com.signalmachine.automaton.Configuration;
import com.signalmachine.automaton.Signal;
import com.signalmachine.automaton.SignalTable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record DiagramResult(
        Automaton automaton,
        List<Configuration> diagram,
        int cells,
        int steps,
        String startSignal,
        Duration elapsed
) {
    public DiagramResult {
        diagram = List.copyOf(diagram);
    }

    public List<String> signalNames() {
        SignalTable table = automaton.signals();
        List<String> names = new ArrayList<>();
        for (Signal signal : automaton.getSignals()) {
            names.add(table.nameOf(signal));
        }
        return names;
    }

    /**
     * Signal names per time step and cell, in interning order.
     */
    public List<List<List<String>>> rows() {
        SignalTable table = automaton.signals();
        List<List<List<String>>> rows = new ArrayList<>(diagram.size());
        for (Configuration configuration : diagram) {
            List<List<String>> row = new ArrayList<>(configuration.size());
            for (int c = 0; c < configuration.size(); c++) {
                List<String> names = new ArrayList<>();
                for (Signal signal : configuration.signals(c)) {
                    names.add(table.nameOf(signal));
                }
                row.add(names);
            }
            rows.add(row);
        }
        return rows;
    }
}
