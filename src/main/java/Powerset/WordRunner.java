package Powerset;

import java.util.BitSet;
import java.util.List;

import Powerset.Model.Automaton;

/**
 * Runs a word through an automaton. Works for NFAs (including epsilon transitions) and DFAs alike,
 * by tracking the closed set of current states.
 */
public final class WordRunner {

    private WordRunner() {
    }

    /**
     * @param word symbols; a symbol outside the alphabet rejects the word
     * @return whether the automaton accepts {@code word}
     */
    public static boolean accepts(Automaton automaton, List<String> word) {
        final EpsilonClosure closure = new EpsilonClosure(automaton);
        final BitSet start = new BitSet(automaton.size());
        start.set(automaton.getStartIndex());
        BitSet current = closure.closure(start);
        for (String symbol : word) {
            final int a = automaton.getSymbolIndex(symbol);
            if (a < 0) {
                return false;
            }
            current = closure.closure(closure.move(current, a));
            if (current.isEmpty()) {
                return false;
            }
        }
        for (int i = current.nextSetBit(0); i >= 0; i = current.nextSetBit(i + 1)) {
            if (automaton.isAcceptingIndex(i)) {
                return true;
            }
        }
        return false;
    }
}
