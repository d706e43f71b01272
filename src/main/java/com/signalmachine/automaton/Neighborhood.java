package com.signalmachine.automaton;

import java.util.List;
import java.util.Set;

/**
 * Signal sets of the cells around a focal cell at one time step, indexed by relative offset.
 */
public final class Neighborhood {

    private final int minOffset;
    private final List<Set<Signal>> cells;

    Neighborhood(int minOffset, List<Set<Signal>> cells) {
        this.minOffset = minOffset;
        this.cells = List.copyOf(cells);
    }

    public int minOffset() {
        return minOffset;
    }

    public int maxOffset() {
        return minOffset + cells.size() - 1;
    }

    /**
     * @throws IndexOutOfBoundsException when the offset lies outside the window
     */
    public Set<Signal> at(int offset) {
        if (offset < minOffset || offset > maxOffset()) {
            throw new IndexOutOfBoundsException(
                    "Offset " + offset + " outside neighborhood [" + minOffset + ", " + maxOffset() + "]");
        }
        return cells.get(offset - minOffset);
    }

    public boolean has(int offset, Signal signal) {
        return at(offset).contains(signal);
    }
}
