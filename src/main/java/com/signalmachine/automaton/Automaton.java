package com.signalmachine.automaton;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signal-based one-dimensional cellular automaton.
 *
 * <p>Rules are applied to every cell in their declaration order. The neighborhood window
 * {@code [minNeighbor, maxNeighbor]} covers every position read by a condition and every neighbor written by
 * an output; {@code maxFutureDepth} is the furthest time step any output reaches.
 */
public final class Automaton {

    private static final Logger log = LoggerFactory.getLogger(Automaton.class);

    private final List<Rule> rules;
    private final SignalTable signals;
    private final int minNeighbor;
    private final int maxNeighbor;
    private final int maxFutureDepth;

    public Automaton(List<Rule> rules, SignalTable signals) {
        this.rules = List.copyOf(rules);
        this.signals = Objects.requireNonNull(signals, "signals");
        int min = 0;
        int max = 0;
        int depth = RuleOutput.DEFAULT_FUTURE_STEP;
        for (Rule rule : this.rules) {
            List<Integer> positions = new ArrayList<>();
            rule.condition().forEachLiteral(literal -> positions.add(literal.position()));
            for (int position : positions) {
                min = Math.min(min, position);
                max = Math.max(max, position);
            }
            for (RuleOutput output : rule.outputs()) {
                min = Math.min(min, output.neighbor());
                max = Math.max(max, output.neighbor());
                depth = Math.max(depth, output.futureStep());
            }
        }
        this.minNeighbor = min;
        this.maxNeighbor = max;
        this.maxFutureDepth = depth;
    }

    /**
     * Parses rule text with a fresh signal table.
     *
     * @throws RuleSyntaxException when the text is malformed
     */
    public static Automaton parse(String rulesText) {
        return parse(rulesText, new SignalTable());
    }

    public static Automaton parse(String rulesText, SignalTable signals) {
        List<Rule> rules = new RuleParser(signals).parse(rulesText);
        Automaton automaton = new Automaton(rules, signals);
        log.debug("Parsed {} rules (neighbors [{}, {}], future depth {})",
                rules.size(), automaton.minNeighbor, automaton.maxNeighbor, automaton.maxFutureDepth);
        return automaton;
    }

    public List<Rule> rules() {
        return rules;
    }

    public SignalTable signals() {
        return signals;
    }

    public int minNeighbor() {
        return minNeighbor;
    }

    public int maxNeighbor() {
        return maxNeighbor;
    }

    public int maxFutureDepth() {
        return maxFutureDepth;
    }

    /**
     * Computes the space-time diagram starting from {@code initial}.
     *
     * <p>Cells are visited left to right and rules in declaration order. A same-step output ({@code 0/0.X})
     * lands in the configuration being read, so it is visible to the rules evaluated after it on that cell and
     * to the cells visited later whose window reaches back to it. Outputs falling outside the strip or after the
     * last step are dropped.
     *
     * @return {@code nbSteps + 1} configurations, the first being {@code initial} itself
     */
    public List<Configuration> makeDiagram(Configuration initial, int nbSteps) {
        Objects.requireNonNull(initial, "initial");
        if (nbSteps < 0) {
            throw new IllegalArgumentException("Number of steps must not be negative");
        }
        int nbCells = initial.size();
        List<Configuration> diagram = new ArrayList<>(nbSteps + 1);
        diagram.add(initial);
        for (int i = 0; i < nbSteps; i++) {
            diagram.add(new Configuration(nbCells));
        }
        for (int t = 0; t < nbSteps; t++) {
            Configuration config = diagram.get(t);
            for (int c = 0; c < nbCells; c++) {
                Neighborhood neighborhood = config.neighborhood(c, minNeighbor, maxNeighbor);
                for (Rule rule : rules) {
                    if (!rule.condition().eval(neighborhood)) {
                        continue;
                    }
                    for (RuleOutput output : rule.outputs()) {
                        int targetCell = c + output.neighbor();
                        int targetTime = t + output.futureStep();
                        if (targetTime < diagram.size() && targetCell >= 0 && targetCell < nbCells) {
                            diagram.get(targetTime).add(targetCell, output.signal());
                        }
                    }
                }
            }
        }
        return diagram;
    }

    public Set<Signal> getSignals() {
        Set<Signal> result = new TreeSet<>();
        for (Rule rule : rules) {
            result.addAll(rule.conditionSignals());
            result.addAll(rule.outputSignals());
        }
        return result;
    }

    /**
     * Canonical rule text, one rule per line. Parsing it again yields an equivalent automaton.
     */
    public String render() {
        return rules.stream()
                .map(rule -> rule.render(signals))
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return render();
    }
}
