package Powerset;

import java.util.BitSet;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

import Powerset.Model.Automaton;

public class BitSetUtils {
    /**
     * Determine is sub is a subset of sup.
     */
    public static boolean isSubset(BitSet sub, BitSet sup) {
        for(int i=sub.nextSetBit(0);i>=0;i=sub.nextSetBit(i+1)) {
            if(!sup.get(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Translate a set of state indices of the automaton back to its state ids.
     */
    public static SortedSet<Integer> toStateIds(BitSet indices, Automaton automaton) {
        SortedSet<Integer> ids = new TreeSet<>();
        for(int i=indices.nextSetBit(0);i>=0;i=indices.nextSetBit(i+1)) {
            ids.add(automaton.stateAt(i));
        }
        return Collections.unmodifiableSortedSet(ids);
    }

    /**
     * Inverse of {@link #toStateIds}; unknown ids are rejected.
     */
    public static BitSet toIndices(Iterable<Integer> stateIds, Automaton automaton) {
        BitSet indices = new BitSet(automaton.size());
        for (int id : stateIds) {
            int idx = automaton.indexOf(id);
            if (idx < 0) {
                throw new IllegalArgumentException("Unknown state: " + id);
            }
            indices.set(idx);
        }
        return indices;
    }
}
