package com.signalmachine.generator;

import static org.junit.jupiter.api.Assertions.*;

import com.signalmachine.automaton.Automaton;
import org.junit.jupiter.api.Test;

class RuleLibraryTest {

    @Test
    void loadsBuiltInRuleSets() {
        RuleLibrary library = new RuleLibrary();
        assertTrue(library.names().contains("fischer"));

        String fischer = library.find(" fischer ").orElseThrow();
        assertTrue(fischer.startsWith("# Fischer"));
        assertEquals(16, Automaton.parse(fischer).rules().size());
    }

    @Test
    void unknownRuleSetIsAbsent() {
        RuleLibrary library = new RuleLibrary();
        assertTrue(library.find("conway").isEmpty());
    }

    @Test
    void emptyLocationYieldsNoRuleSets() {
        RuleLibrary library = new RuleLibrary("classpath*:no-such-directory/*.rules");
        assertTrue(library.names().isEmpty());
    }
}
