package com.signalmachine.generator;

import com.signalmachine.automaton.Automaton;
import com.signalmachine.automaton.Configuration;
import com.signalmachine.automaton.RuleSyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DiagramService {

    private static final Logger log = LoggerFactory.getLogger(DiagramService.class);

    /**
     * @throws RuleSyntaxException when the rules of {@code options} are malformed
     */
    public DiagramResult generate(DiagramOptions options) {
        Objects.requireNonNull(options, "options");
        long start = System.nanoTime();
        Automaton automaton = Automaton.parse(options.rules());
        Configuration initial = buildInitialConfiguration(automaton, options);
        List<Configuration> diagram = automaton.makeDiagram(initial, options.steps());
        Duration spent = Duration.ofNanos(System.nanoTime() - start);

        DiagramResult result = new DiagramResult(
                automaton,
                diagram,
                options.cells(),
                options.steps(),
                options.startSignal(),
                spent);
        String timeLabel = String.format(Locale.US, "%.1f ms", spent.toNanos() / 1_000_000.0);
        log.info("Diagram {}: {} rules, {} signals (spent={})",
                options.summary(),
                automaton.rules().size(),
                automaton.getSignals().size(),
                timeLabel);
        return result;
    }

    /**
     * Parses rule text into its canonical form.
     */
    public String render(String rules) {
        Objects.requireNonNull(rules, "rules");
        return Automaton.parse(rules).render();
    }

    private Configuration buildInitialConfiguration(Automaton automaton, DiagramOptions options) {
        Configuration initial = new Configuration(options.cells());
        if (options.startSignal() != null) {
            initial.add(0, automaton.signals().intern(options.startSignal()));
        }
        return initial;
    }
}
