package Powerset.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Wire form of a transition: {@code (from, symbol, to)}.
 * A null symbol is an epsilon transition. {@code singleTarget} controls whether {@code to}
 * is written as a plain int (DFA style) or as a list (NFA style).
 */
public record TransitionDef(int from, String symbol, List<Integer> to, boolean singleTarget) {

    public TransitionDef {
        // null targets are kept for the validator to report
        to = to == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(to));
        if (singleTarget && to.size() != 1) {
            throw new IllegalArgumentException("single-target transition needs exactly one target: " + to);
        }
    }

    public static TransitionDef of(int from, String symbol, int to) {
        return new TransitionDef(from, symbol, List.of(to), true);
    }

    public static TransitionDef of(int from, String symbol, List<Integer> to) {
        return new TransitionDef(from, symbol, to, false);
    }

    public boolean isEpsilon() {
        return symbol == null;
    }

    @Override
    public String toString() {
        return "(" + from + ", " + (symbol == null ? "ε" : symbol) + ", " + (singleTarget ? to.get(0) : to) + ")";
    }
}
