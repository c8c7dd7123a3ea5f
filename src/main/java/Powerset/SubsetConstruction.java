package Powerset;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import Powerset.Model.Automaton;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset (powerset) construction: NFA with epsilon transitions to an equivalent DFA.
 * <p>
 * DFA states are numbered 0, 1, 2, ... in discovery order, with subsets explored breadth-first
 * and symbols in alphabet order. The numbering therefore depends only on the input automaton.
 * The result is partial: an empty successor subset produces no transition.
 */
public class SubsetConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);
    private static final long STATES_EXPLORED_PERIOD = 10000L;
    private static final int MISSING_ELEMENT = -1;

    public static Automaton convert(Automaton nfa) {
        return convert(nfa, false);
    }

    public static Automaton convert(Automaton nfa, boolean minimize) {
        final Automaton dfa = doConvert(nfa);
        if (minimize) {
            return MooreMinimizer.minimize(dfa);
        }
        return dfa;
    }

    private static Automaton doConvert(Automaton nfa) {
        final EpsilonClosure closure = new EpsilonClosure(nfa);
        final List<String> alphabet = nfa.getAlphabet();

        // canonical subset -> DFA state; BitSet equality is by content, and keys are never mutated
        final Object2IntMap<BitSet> outStateMap = new Object2IntOpenHashMap<>();
        outStateMap.defaultReturnValue(MISSING_ELEMENT);
        final List<BitSet> subsets = new ArrayList<>();
        final List<int[]> transitions = new ArrayList<>(); // {from, symbol index, to}
        final Deque<SubsetRecord> queue = new ArrayDeque<>();

        final BitSet startSet = new BitSet(nfa.size());
        startSet.set(nfa.getStartIndex());
        final BitSet init = closure.closure(startSet);
        outStateMap.put(init, 0);
        subsets.add(init);
        queue.add(new SubsetRecord(init, 0));

        long statesExplored = 0;
        while (!queue.isEmpty()) {
            final SubsetRecord curr = queue.poll();

            for (int a = 0; a < alphabet.size(); a++) {
                final BitSet moved = closure.move(curr.subset(), a);
                if (moved.isEmpty()) {
                    continue; // partial for this pair
                }
                final BitSet succ = closure.closure(moved);
                int outSucc = outStateMap.getInt(succ);
                if (outSucc == MISSING_ELEMENT) {
                    outSucc = subsets.size();
                    outStateMap.put(succ, outSucc);
                    subsets.add(succ);
                    queue.add(new SubsetRecord(succ, outSucc));
                }
                transitions.add(new int[] {curr.dfaState(), a, outSucc});
            }

            statesExplored++;
            if (LOG.isDebugEnabled() && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                LOG.debug("Explored {} subsets - {} left in queue - {} discovered",
                    statesExplored, queue.size(), subsets.size());
            }
        }

        final Automaton.Builder out = Automaton.builder(alphabet);
        for (int id = 0; id < subsets.size(); id++) {
            final BitSet subset = subsets.get(id);
            out.addState(id, containsAccepting(nfa, subset));
            out.setOrigin(id, BitSetUtils.toStateIds(subset, nfa));
        }
        out.setStart(0);
        for (int[] t : transitions) {
            out.addTransition(t[0], alphabet.get(t[1]), t[2]);
        }

        LOG.debug("Subset construction: {} NFA states -> {} DFA states", nfa.size(), subsets.size());
        return out.build();
    }

    private static boolean containsAccepting(Automaton nfa, BitSet subset) {
        for (int i = subset.nextSetBit(0); i >= 0; i = subset.nextSetBit(i + 1)) {
            if (nfa.isAcceptingIndex(i)) {
                return true;
            }
        }
        return false;
    }

    private record SubsetRecord(BitSet subset, int dfaState) {

        @Override
        public String toString() {
            return dfaState + ": " + subset;
        }
    }
}
