package Powerset;

import java.util.BitSet;
import java.util.Collection;
import java.util.SortedSet;

import Powerset.Model.Automaton;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntPriorityQueue;

/**
 * Epsilon-closure over a fixed automaton: the smallest superset of a state set that is closed
 * under epsilon transitions.
 * <p>
 * Uses an explicit worklist, so cyclic epsilon graphs and long epsilon chains are fine.
 * Stateless apart from the automaton; safe to share between threads.
 */
public final class EpsilonClosure {
    private final Automaton automaton;

    public EpsilonClosure(Automaton automaton) {
        this.automaton = automaton;
    }

    /**
     * @param states state indices; not modified
     * @return a new set holding the closure of {@code states}
     */
    public BitSet closure(BitSet states) {
        final BitSet closure = (BitSet) states.clone();
        final IntPriorityQueue worklist = new IntArrayFIFOQueue();
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            worklist.enqueue(i);
        }
        while (!worklist.isEmpty()) {
            int p = worklist.dequeueInt();
            for (int q : automaton.epsilonIndices(p)) {
                if (!closure.get(q)) { // visited guard
                    closure.set(q);
                    worklist.enqueue(q);
                }
            }
        }
        return closure;
    }

    /**
     * Id-level variant of {@link #closure(BitSet)}.
     * @param states state ids, all declared in the automaton
     * @return closure as sorted state ids
     */
    public SortedSet<Integer> closure(Collection<Integer> states) {
        return BitSetUtils.toStateIds(closure(BitSetUtils.toIndices(states, automaton)), automaton);
    }

    /**
     * States reachable from {@code states} by exactly one {@code symbol} transition, without closure.
     * @param symbolIndex index of the symbol in the alphabet
     */
    public BitSet move(BitSet states, int symbolIndex) {
        final BitSet result = new BitSet(automaton.size());
        for (int p = states.nextSetBit(0); p >= 0; p = states.nextSetBit(p + 1)) {
            for (int q : automaton.successorIndices(p, symbolIndex)) {
                result.set(q);
            }
        }
        return result;
    }
}
