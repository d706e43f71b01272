package com.signalmachine.generator;

import static org.junit.jupiter.api.Assertions.*;

import com.signalmachine.automaton.RuleSyntaxException;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiagramServiceTest {

    private final DiagramService service = new DiagramService();

    @Test
    void generateSeedsStartSignalOnFirstCell() {
        DiagramOptions options = DiagramOptions.builder()
                .rules("Init: 1.Init")
                .cells(4)
                .steps(3)
                .build();

        DiagramResult result = service.generate(options);
        assertEquals(4, result.diagram().size());
        assertEquals(4, result.cells());
        assertEquals(3, result.steps());
        assertEquals("Init", result.startSignal());
        assertEquals(List.of("Init"), result.signalNames());

        List<List<List<String>>> rows = result.rows();
        assertEquals(List.of(List.of("Init"), List.of(), List.of(), List.of()), rows.get(0));
        assertEquals(List.of("Init"), rows.get(3).get(3));
        assertTrue(rows.get(3).get(0).isEmpty());
        assertNotNull(result.elapsed());
    }

    @Test
    void generateWithoutStartSignalStaysEmpty() {
        DiagramOptions options = DiagramOptions.builder()
                .rules("Init: 1.Init")
                .cells(3)
                .steps(2)
                .startSignal(null)
                .build();

        DiagramResult result = service.generate(options);
        assertNull(result.startSignal());
        for (List<List<String>> row : result.rows()) {
            for (List<String> cell : row) {
                assertTrue(cell.isEmpty());
            }
        }
    }

    @Test
    void sameStepRulesFireOnUnseededCells() {
        DiagramOptions options = DiagramOptions.builder()
                .rules("-Init: 0/0.Quiet")
                .cells(2)
                .steps(1)
                .build();

        List<List<List<String>>> rows = service.generate(options).rows();
        assertEquals(List.of(List.of("Init"), List.of("Quiet")), rows.get(0));
        assertEquals(List.of(List.of(), List.of()), rows.get(1));
    }

    @Test
    void generateRejectsMalformedRules() {
        DiagramOptions options = DiagramOptions.builder().rules("(Init: 1.Init").build();
        assertThrows(RuleSyntaxException.class, () -> service.generate(options));
    }

    @Test
    void renderNormalizesRules() {
        String rendered = service.render("""
                Right:   # moving right
                  -Half: 1.Right
                  Half: Wall
                """);
        assertEquals("(Right -Half): 1.Right\n(Right Half): 0.Wall", rendered);
    }

    @Test
    void optionsValidateInput() {
        assertThrows(IllegalArgumentException.class, () -> DiagramOptions.builder().cells(0));
        assertThrows(IllegalArgumentException.class, () -> DiagramOptions.builder().steps(-1));
        assertThrows(IllegalArgumentException.class, () -> DiagramOptions.builder().startSignal("  "));
        assertThrows(IllegalStateException.class, () -> DiagramOptions.builder().build());

        DiagramOptions options = DiagramOptions.builder().rules("").steps(0).build();
        assertEquals(DiagramOptions.DEFAULT_CELLS, options.cells());
        assertEquals(0, options.steps());
        assertEquals("cells=100 steps=0 start=Init", options.summary());
    }
}
