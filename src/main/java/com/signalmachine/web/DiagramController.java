package com.signalmachine.web;

import com.signalmachine.automaton.Automaton;
import com.signalmachine.automaton.RuleSyntaxException;
import com.signalmachine.config.AppProperties;
import com.signalmachine.generator.DiagramOptions;
import com.signalmachine.generator.DiagramResult;
import com.signalmachine.generator.DiagramService;
import com.signalmachine.generator.RuleLibrary;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping
public class DiagramController {

    private static final Logger log = LoggerFactory.getLogger(DiagramController.class);

    private final DiagramService diagramService;
    private final RuleLibrary ruleLibrary;
    private final AppProperties properties;

    public DiagramController(DiagramService diagramService, RuleLibrary ruleLibrary, AppProperties properties) {
        this.diagramService = diagramService;
        this.ruleLibrary = ruleLibrary;
        this.properties = properties;
    }

    @PostMapping(path = "/diagram", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public DiagramResponse diagram(@RequestBody DiagramRequest request) {
        String rules = resolveRules(request);
        DiagramOptions options;
        try {
            options = buildOptions(request, rules);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }

        DiagramResult result;
        try {
            result = diagramService.generate(options);
        } catch (RuleSyntaxException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid rules: " + ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Diagram failed: " + ex.getMessage(), ex);
        }

        Automaton automaton = result.automaton();
        return new DiagramResponse(
                result.cells(),
                result.steps(),
                result.startSignal(),
                automaton.minNeighbor(),
                automaton.maxNeighbor(),
                automaton.maxFutureDepth(),
                result.signalNames(),
                automaton.render(),
                result.rows());
    }

    @PostMapping(path = "/automaton/render", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public String render(@RequestBody String rules) {
        try {
            return diagramService.render(rules);
        } catch (RuleSyntaxException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid rules: " + ex.getMessage(), ex);
        }
    }

    @GetMapping(path = "/rule-sets", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<String> ruleSets() {
        return ruleLibrary.names();
    }

    @GetMapping(path = "/rule-sets/{name}", produces = MediaType.TEXT_PLAIN_VALUE)
    public String ruleSet(@PathVariable("name") String name) {
        return ruleLibrary.find(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown rule set: " + name));
    }

    private String resolveRules(DiagramRequest request) {
        boolean hasRules = StringUtils.hasText(request.rules());
        boolean hasRuleSet = StringUtils.hasText(request.ruleSet());
        if (hasRules == hasRuleSet) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Exactly one of rules or ruleSet must be given");
        }
        if (hasRules) {
            return request.rules();
        }
        String name = request.ruleSet().trim();
        log.debug("Using built-in rule set {}", name);
        return ruleLibrary.find(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown rule set: " + name));
    }

    private DiagramOptions buildOptions(DiagramRequest request, String rules) {
        int cells = request.cells() != null ? request.cells() : DiagramOptions.DEFAULT_CELLS;
        int steps = request.steps() != null ? request.steps() : DiagramOptions.DEFAULT_STEPS;
        if (cells > properties.getMaxCells()) {
            throw new IllegalArgumentException("Cells must not exceed " + properties.getMaxCells());
        }
        if (steps > properties.getMaxSteps()) {
            throw new IllegalArgumentException("Steps must not exceed " + properties.getMaxSteps());
        }
        String startSignal = StringUtils.hasText(request.startSignal())
                ? request.startSignal().trim()
                : properties.getStartSignal();
        return DiagramOptions.builder()
                .rules(rules)
                .cells(cells)
                .steps(steps)
                .startSignal(startSignal)
                .build();
    }
}
