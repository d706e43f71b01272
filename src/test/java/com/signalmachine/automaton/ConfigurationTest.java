package com.signalmachine.automaton;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import org.junit.jupiter.api.Test;

class ConfigurationTest {

    private final SignalTable table = new SignalTable();
    private final Signal a = table.intern("A");
    private final Signal b = table.intern("B");

    @Test
    void rejectsEmptyStrip() {
        assertThrows(IllegalArgumentException.class, () -> new Configuration(0));
    }

    @Test
    void neighborhoodTreatsOutsideCellsAsEmpty() {
        Configuration config = new Configuration(3);
        config.add(0, a);
        config.add(2, b);

        Neighborhood neighborhood = config.neighborhood(0, -1, 1);
        assertEquals(-1, neighborhood.minOffset());
        assertEquals(1, neighborhood.maxOffset());
        assertTrue(neighborhood.at(-1).isEmpty());
        assertEquals(Set.of(a), neighborhood.at(0));
        assertTrue(neighborhood.at(1).isEmpty());

        Neighborhood last = config.neighborhood(2, -2, 1);
        assertTrue(last.has(-2, a));
        assertTrue(last.has(0, b));
        assertTrue(last.at(1).isEmpty());
    }

    @Test
    void neighborhoodRejectsOffsetsOutsideWindow() {
        Configuration config = new Configuration(5);
        Neighborhood neighborhood = config.neighborhood(2, 0, 0);
        assertThrows(IndexOutOfBoundsException.class, () -> neighborhood.at(1));
        assertThrows(IndexOutOfBoundsException.class, () -> neighborhood.has(-1, a));
        assertThrows(IllegalArgumentException.class, () -> config.neighborhood(2, 1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> config.neighborhood(5, 0, 0));
    }

    @Test
    void neighborhoodSeesLaterWrites() {
        Configuration config = new Configuration(3);
        Neighborhood neighborhood = config.neighborhood(1, -1, 1);
        assertFalse(neighborhood.has(-1, a));
        config.add(0, a);
        assertTrue(neighborhood.has(-1, a));
    }

    @Test
    void addIsSetUnion() {
        Configuration config = new Configuration(2);
        assertTrue(config.add(1, a));
        assertFalse(config.add(1, a));
        assertEquals(1, config.signals(1).size());
        assertThrows(UnsupportedOperationException.class, () -> config.signals(1).add(b));
        assertThrows(IndexOutOfBoundsException.class, () -> config.add(2, a));
    }

    @Test
    void equalityFollowsCellContents() {
        Configuration config = new Configuration(4);
        config.add(3, b);
        Configuration other = new Configuration(4);
        other.add(3, b);
        assertEquals(config, other);
        assertEquals(config.hashCode(), other.hashCode());
        other.add(0, a);
        assertNotEquals(config, other);
        assertTrue(new Configuration(4).isEmpty());
        assertFalse(config.isEmpty());
    }

    @Test
    void rejectsOversizedNeighborhoods() {
        Configuration config = new Configuration(2);
        assertThrows(IllegalArgumentException.class, () -> config.neighborhood(0, Integer.MIN_VALUE, Integer.MAX_VALUE));
        assertThrows(IllegalArgumentException.class, () -> config.neighborhood(0, 0, Integer.MAX_VALUE));
        assertThrows(IllegalArgumentException.class,
                () -> config.neighborhood(0, 0, Configuration.MAX_NEIGHBORHOOD_WIDTH));
        Neighborhood widest = config.neighborhood(0, -RuleParser.MAX_OFFSET, RuleParser.MAX_OFFSET);
        assertEquals(RuleParser.MAX_OFFSET, widest.maxOffset());
        assertTrue(widest.at(RuleParser.MAX_OFFSET).isEmpty());
    }
}
