package com.signalmachine.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * One time step of the strip: a fixed number of cells, each holding a set of active signals.
 * Cells are mutated in place while a diagram is generated.
 */
public final class Configuration {

    /**
     * Widest neighborhood window a rule set accepted by {@link RuleParser} can need.
     */
    public static final int MAX_NEIGHBORHOOD_WIDTH = 2 * RuleParser.MAX_OFFSET + 1;

    private final List<Set<Signal>> cells;

    public Configuration(int nbCells) {
        if (nbCells <= 0) {
            throw new IllegalArgumentException("Configuration must have a positive number of cells");
        }
        this.cells = new ArrayList<>(nbCells);
        for (int i = 0; i < nbCells; i++) {
            cells.add(new TreeSet<>());
        }
    }

    public int size() {
        return cells.size();
    }

    /**
     * Adds a signal to a cell. Returns {@code false} when the signal was already present.
     */
    public boolean add(int cell, Signal signal) {
        return cells.get(index(cell)).add(signal);
    }

    public boolean contains(int cell, Signal signal) {
        return cells.get(index(cell)).contains(signal);
    }

    /**
     * Read-only live view of a cell's signals.
     */
    public Set<Signal> signals(int cell) {
        return Collections.unmodifiableSet(cells.get(index(cell)));
    }

    public boolean isEmpty() {
        for (Set<Signal> cell : cells) {
            if (!cell.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Window of cells {@code [cell + minOffset, cell + maxOffset]}. Offsets falling outside the strip map to an
     * empty set. The window holds live views, so signals added to those cells afterwards are visible through it.
     */
    public Neighborhood neighborhood(int cell, int minOffset, int maxOffset) {
        if (minOffset > maxOffset) {
            throw new IllegalArgumentException("Neighborhood offsets are reversed: " + minOffset + " > " + maxOffset);
        }
        long width = (long) maxOffset - minOffset + 1;
        if (width > MAX_NEIGHBORHOOD_WIDTH) {
            throw new IllegalArgumentException("Neighborhood width " + width + " exceeds " + MAX_NEIGHBORHOOD_WIDTH);
        }
        index(cell);
        List<Set<Signal>> window = new ArrayList<>((int) width);
        for (int offset = minOffset; offset <= maxOffset; offset++) {
            int target = cell + offset;
            if (target < 0 || target >= cells.size()) {
                window.add(Collections.emptySet());
            } else {
                window.add(Collections.unmodifiableSet(cells.get(target)));
            }
        }
        return new Neighborhood(minOffset, window);
    }

    private int index(int cell) {
        if (cell < 0 || cell >= cells.size()) {
            throw new IndexOutOfBoundsException("Cell out of range: " + cell);
        }
        return cell;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Configuration other)) {
            return false;
        }
        return cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
