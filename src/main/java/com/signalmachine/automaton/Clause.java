package com.signalmachine.automaton;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Boolean condition over the signals of a {@link Neighborhood}. The variant set is closed; {@link #eval},
 * {@link #render} and {@link #collectSignals} each match on it in one place.
 */
public sealed interface Clause permits Clause.True, Clause.Literal, Clause.Negation, Clause.Conjunction,
        Clause.Disjunction {

    /**
     * Shared instance of the empty clause.
     */
    True TRUE = new True();

    /**
     * Empty disjunction.
     */
    Clause FALSE = new Negation(TRUE);

    static Clause literal(Signal signal) {
        return new Literal(signal, 0, 0);
    }

    /**
     * Negates a clause; negating a negation yields its subclause.
     */
    static Clause not(Clause clause) {
        Objects.requireNonNull(clause, "clause");
        if (clause instanceof Negation negation) {
            return negation.subclause();
        }
        return new Negation(clause);
    }

    static Clause and(Clause... clauses) {
        return new Conjunction(List.of(clauses));
    }

    default boolean eval(Neighborhood neighborhood) {
        if (this instanceof True) {
            return true;
        }
        if (this instanceof Literal literal) {
            return neighborhood.has(literal.position(), literal.signal());
        }
        if (this instanceof Negation negation) {
            return !negation.subclause().eval(neighborhood);
        }
        if (this instanceof Conjunction conjunction) {
            for (Clause subclause : conjunction.subclauses()) {
                if (!subclause.eval(neighborhood)) {
                    return false;
                }
            }
            return true;
        }
        if (this instanceof Disjunction disjunction) {
            for (Clause subclause : disjunction.subclauses()) {
                if (subclause.eval(neighborhood)) {
                    return true;
                }
            }
            return false;
        }
        throw new IllegalStateException("Unknown clause " + getClass().getName());
    }

    default String render(SignalTable table) {
        if (this instanceof True) {
            return "";
        }
        if (this instanceof Literal literal) {
            return literal.render(table, false);
        }
        if (this instanceof Negation negation) {
            Clause subclause = negation.subclause();
            if (subclause instanceof True) {
                return "[]";
            }
            if (subclause instanceof Literal literal) {
                return literal.render(table, true);
            }
            return "-" + subclause.render(table);
        }
        if (this instanceof Conjunction conjunction) {
            return conjunction.subclauses().stream()
                    .map(subclause -> subclause.render(table))
                    .collect(Collectors.joining(" ", "(", ")"));
        }
        if (this instanceof Disjunction disjunction) {
            return disjunction.subclauses().stream()
                    .map(subclause -> subclause.render(table))
                    .collect(Collectors.joining(" ", "[", "]"));
        }
        throw new IllegalStateException("Unknown clause " + getClass().getName());
    }

    default Set<Signal> collectSignals() {
        Set<Signal> signals = new TreeSet<>();
        forEachLiteral(literal -> signals.add(literal.signal()));
        return signals;
    }

    /**
     * Visits every literal of the tree, depth first.
     */
    default void forEachLiteral(Consumer<Literal> action) {
        if (this instanceof Literal literal) {
            action.accept(literal);
        } else if (this instanceof Negation negation) {
            negation.subclause().forEachLiteral(action);
        } else if (this instanceof Conjunction conjunction) {
            conjunction.subclauses().forEach(subclause -> subclause.forEachLiteral(action));
        } else if (this instanceof Disjunction disjunction) {
            disjunction.subclauses().forEach(subclause -> subclause.forEachLiteral(action));
        }
    }

    record True() implements Clause {
    }

    /**
     * Presence of {@code signal} at {@code position} relative to the focal cell. The time offset is kept for
     * rendering; evaluation always reads the current time slice.
     */
    record Literal(Signal signal, int position, int timeStep) implements Clause {

        public Literal {
            Objects.requireNonNull(signal, "signal");
        }

        String render(SignalTable table, boolean negated) {
            StringBuilder builder = new StringBuilder();
            if (timeStep != 0) {
                builder.append(timeStep).append('/').append(position).append('.');
            } else if (position != 0) {
                builder.append(position).append('.');
            }
            if (negated) {
                builder.append('-');
            }
            return builder.append(table.nameOf(signal)).toString();
        }
    }

    record Negation(Clause subclause) implements Clause {

        public Negation {
            Objects.requireNonNull(subclause, "subclause");
        }
    }

    /**
     * All subclauses hold. Nested conjunctions are flattened into this one.
     */
    record Conjunction(List<Clause> subclauses) implements Clause {

        public Conjunction {
            List<Clause> flat = new ArrayList<>(subclauses.size());
            for (Clause subclause : subclauses) {
                if (subclause instanceof Conjunction nested) {
                    flat.addAll(nested.subclauses());
                } else {
                    flat.add(Objects.requireNonNull(subclause, "subclause"));
                }
            }
            subclauses = List.copyOf(flat);
        }
    }

    /**
     * At least one subclause holds. Nested disjunctions are flattened into this one.
     */
    record Disjunction(List<Clause> subclauses) implements Clause {

        public Disjunction {
            List<Clause> flat = new ArrayList<>(subclauses.size());
            for (Clause subclause : subclauses) {
                if (subclause instanceof Disjunction nested) {
                    flat.addAll(nested.subclauses());
                } else {
                    flat.add(Objects.requireNonNull(subclause, "subclause"));
                }
            }
            subclauses = List.copyOf(flat);
        }
    }
}
