package Powerset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

import Powerset.Model.Automaton;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntPriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFA minimization by Moore-style partition refinement.
 * <p>
 * States unreachable from the start state are discarded first. The partition starts as
 * {accepting, non-accepting} and blocks are split per symbol until a full pass changes nothing.
 * A missing transition counts as its own pseudo-block, so partial DFAs stay partial: a state
 * without a transition is never merged with one that has it.
 * <p>
 * Each output state is labelled with the smallest original state id of its block, and
 * carries the block members as its origin set.
 */
public class MooreMinimizer {
    private static final Logger LOG = LoggerFactory.getLogger(MooreMinimizer.class);
    private static final int MISSING_BLOCK = -1;

    public static Automaton minimize(Automaton dfa) {
        if (!dfa.isDeterministic()) {
            throw new IllegalArgumentException("Minimization needs a deterministic automaton");
        }
        final BitSet reachable = reachableStates(dfa);
        final Partition partition = initialPartition(dfa, reachable);
        final int rounds = refine(dfa, partition);
        LOG.debug("Partition stable after {} rounds: {} reachable states -> {} blocks",
            rounds, reachable.cardinality(), partition.blocks.size());
        return buildMinimal(dfa, partition);
    }

    /**
     * Breadth-first reachability from the start state over declared transitions.
     * @return reachable state indices
     */
    static BitSet reachableStates(Automaton dfa) {
        final BitSet reachable = new BitSet(dfa.size());
        final IntPriorityQueue queue = new IntArrayFIFOQueue();
        reachable.set(dfa.getStartIndex());
        queue.enqueue(dfa.getStartIndex());
        final int symbols = dfa.getAlphabet().size();
        while (!queue.isEmpty()) {
            int p = queue.dequeueInt();
            for (int a = 0; a < symbols; a++) {
                for (int q : dfa.successorIndices(p, a)) {
                    if (!reachable.get(q)) {
                        reachable.set(q);
                        queue.enqueue(q);
                    }
                }
            }
        }
        return reachable;
    }

    /**
     * States from which some accepting state is reachable. The others are dead: they accept nothing.
     * @return live state indices
     */
    public static BitSet liveStates(Automaton dfa) {
        final int symbols = dfa.getAlphabet().size();
        final BitSet live = new BitSet(dfa.size());
        for (int i = 0; i < dfa.size(); i++) {
            live.set(i, dfa.isAcceptingIndex(i));
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int p = live.nextClearBit(0); p < dfa.size(); p = live.nextClearBit(p + 1)) {
                for (int a = 0; a < symbols && !live.get(p); a++) {
                    for (int q : dfa.successorIndices(p, a)) {
                        if (live.get(q)) {
                            live.set(p);
                            changed = true;
                            break;
                        }
                    }
                }
            }
        }
        return live;
    }

    private static Partition initialPartition(Automaton dfa, BitSet reachable) {
        final IntList acc = new IntArrayList();
        final IntList rej = new IntArrayList();
        for (int i = reachable.nextSetBit(0); i >= 0; i = reachable.nextSetBit(i + 1)) {
            (dfa.isAcceptingIndex(i) ? acc : rej).add(i);
        }
        final Partition partition = new Partition(dfa.size());
        // an empty block is skipped; a single block is already stable
        if (!acc.isEmpty()) {
            partition.addBlock(acc);
        }
        if (!rej.isEmpty()) {
            partition.addBlock(rej);
        }
        return partition;
    }

    /**
     * Split blocks until a full pass over all blocks and symbols produces no split.
     * @return number of passes
     */
    private static int refine(Automaton dfa, Partition partition) {
        final int symbols = dfa.getAlphabet().size();
        int rounds = 0;
        boolean split = true;
        while (split) {
            split = false;
            rounds++;
            // blocks appended during the pass are visited in the same pass
            for (int b = 0; b < partition.blocks.size(); b++) {
                for (int a = 0; a < symbols; a++) {
                    if (partition.blocks.get(b).size() < 2) {
                        break;
                    }
                    final int symbol = a;
                    split |= partition.split(b, state -> {
                        int[] succ = dfa.successorIndices(state, symbol);
                        return succ.length == 0 ? MISSING_BLOCK : partition.blockOf[succ[0]];
                    });
                }
            }
        }
        return rounds;
    }

    private static Automaton buildMinimal(Automaton dfa, Partition partition) {
        final int blockCount = partition.blocks.size();
        final int[] label = new int[blockCount];
        final int[] representative = new int[blockCount];
        for (int b = 0; b < blockCount; b++) {
            int rep = -1;
            for (int s : partition.blocks.get(b)) {
                if (rep < 0 || dfa.stateAt(s) < dfa.stateAt(rep)) {
                    rep = s;
                }
            }
            representative[b] = rep;
            label[b] = dfa.stateAt(rep);
        }

        // emit blocks in ascending label order
        final Integer[] order = new Integer[blockCount];
        for (int b = 0; b < blockCount; b++) {
            order[b] = b;
        }
        Arrays.sort(order, (x, y) -> Integer.compare(label[x], label[y]));

        final List<String> alphabet = dfa.getAlphabet();
        final Automaton.Builder out = Automaton.builder(alphabet);
        for (int b : order) {
            out.addState(label[b], dfa.isAcceptingIndex(representative[b]));
            final TreeSet<Integer> members = new TreeSet<>();
            for (int s : partition.blocks.get(b)) {
                members.add(dfa.stateAt(s));
            }
            out.setOrigin(label[b], members);
        }
        out.setStart(label[partition.blockOf[dfa.getStartIndex()]]);
        for (int b : order) {
            for (int a = 0; a < alphabet.size(); a++) {
                for (int t : dfa.successorIndices(representative[b], a)) {
                    out.addTransition(label[b], alphabet.get(a), label[partition.blockOf[t]]);
                }
            }
        }
        return out.build();
    }

    @FunctionalInterface
    private interface SplitKey {
        int keyOf(int state);
    }

    private static final class Partition {
        private final List<IntList> blocks = new ArrayList<>();
        private final int[] blockOf;

        private Partition(int states) {
            this.blockOf = new int[states];
            Arrays.fill(blockOf, MISSING_BLOCK);
        }

        private void addBlock(IntList members) {
            int id = blocks.size();
            blocks.add(members);
            for (int s : members) {
                blockOf[s] = id;
            }
        }

        /**
         * Split block b into groups of equal key. The first group keeps id b, the rest are appended.
         * @return whether the block was split
         */
        private boolean split(int b, SplitKey key) {
            final Int2ObjectMap<IntList> groups = new Int2ObjectLinkedOpenHashMap<>();
            for (int s : blocks.get(b)) {
                final int k = key.keyOf(s);
                IntList group = groups.get(k);
                if (group == null) {
                    group = new IntArrayList();
                    groups.put(k, group);
                }
                group.add(s);
            }
            if (groups.size() < 2) {
                return false;
            }
            final Iterator<IntList> it = groups.values().iterator();
            blocks.set(b, it.next());
            while (it.hasNext()) {
                addBlock(it.next());
            }
            return true;
        }
    }
}
