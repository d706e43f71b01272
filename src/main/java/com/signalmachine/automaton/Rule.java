package com.signalmachine.automaton;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

public record Rule(Clause condition, List<RuleOutput> outputs) {

    public Rule {
        Objects.requireNonNull(condition, "condition");
        outputs = List.copyOf(outputs);
    }

    public Set<Signal> conditionSignals() {
        return condition.collectSignals();
    }

    public Set<Signal> outputSignals() {
        Set<Signal> signals = new TreeSet<>();
        for (RuleOutput output : outputs) {
            signals.add(output.signal());
        }
        return signals;
    }

    public String render(SignalTable table) {
        return condition.render(table) + ": " + outputs.stream()
                .map(output -> output.render(table))
                .collect(Collectors.joining(" "));
    }
}
