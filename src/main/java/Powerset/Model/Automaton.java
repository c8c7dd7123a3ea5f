package Powerset.Model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

/**
 * Immutable finite automaton over string symbols, with optional epsilon transitions.
 * <p>
 * States are identified by non-negative ints. Internally every state also has a dense index
 * (its position in {@link #getStates()}), which the engines use as bit positions in subsets.
 * Symbols likewise have an index: their position in {@link #getAlphabet()}.
 * <p>
 * Generated automata (output of subset construction or minimization) additionally carry an
 * origin set per state. Origins are for traceability only.
 */
public final class Automaton {
    private static final int[] NO_TARGETS = new int[0];
    private static final int MISSING_ELEMENT = -1;

    private final int[] stateIds;
    private final Int2IntMap indexById;
    private final List<String> alphabet;
    private final Map<String, Integer> symbolIndex;
    private final int startIndex;
    private final BitSet accepting;
    // [state index][symbol index] -> sorted target indices
    private final int[][][] delta;
    // [state index] -> sorted target indices
    private final int[][] epsilon;
    private final List<SortedSet<Integer>> origins;
    private final boolean deterministic;

    private Automaton(Builder builder) {
        int n = builder.states.size();
        this.stateIds = new int[n];
        this.indexById = new Int2IntOpenHashMap(n);
        this.indexById.defaultReturnValue(MISSING_ELEMENT);
        int idx = 0;
        for (int id : builder.states.keySet()) {
            stateIds[idx] = id;
            indexById.put(id, idx);
            idx++;
        }
        this.alphabet = List.copyOf(builder.alphabet);
        this.symbolIndex = new HashMap<>();
        for (int i = 0; i < alphabet.size(); i++) {
            symbolIndex.put(alphabet.get(i), i);
        }
        this.startIndex = indexById.get((int) builder.start);
        this.accepting = new BitSet(n);
        this.delta = new int[n][alphabet.size()][];
        this.epsilon = new int[n][];

        boolean det = true;
        List<SortedSet<Integer>> originList = builder.origins.isEmpty() ? null : new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            StateEntry entry = builder.states.get(stateIds[i]);
            accepting.set(i, entry.accepting);
            epsilon[i] = toIndices(entry.epsilon);
            det &= epsilon[i].length == 0;
            for (int a = 0; a < alphabet.size(); a++) {
                delta[i][a] = toIndices(entry.moves.get(alphabet.get(a)));
                det &= delta[i][a].length <= 1;
            }
            if (originList != null) {
                SortedSet<Integer> origin = builder.origins.get(stateIds[i]);
                originList.add(origin == null
                    ? Collections.emptySortedSet()
                    : Collections.unmodifiableSortedSet(new TreeSet<>(origin)));
            }
        }
        this.origins = originList;
        this.deterministic = det;
    }

    private int[] toIndices(Set<Integer> targetIds) {
        if (targetIds == null || targetIds.isEmpty()) {
            return NO_TARGETS;
        }
        int[] result = new int[targetIds.size()];
        int k = 0;
        for (int t : targetIds) {
            result[k++] = indexById.get(t);
        }
        Arrays.sort(result);
        return result;
    }

    public static Builder builder(List<String> alphabet) {
        return new Builder(alphabet);
    }

    /**
     * @return number of states
     */
    public int size() {
        return stateIds.length;
    }

    /**
     * @return state ids, in declaration order
     */
    public List<Integer> getStates() {
        List<Integer> result = new ArrayList<>(stateIds.length);
        for (int id : stateIds) {
            result.add(id);
        }
        return Collections.unmodifiableList(result);
    }

    public List<String> getAlphabet() {
        return alphabet;
    }

    public int getStart() {
        return stateIds[startIndex];
    }

    public boolean containsState(int state) {
        return indexById.containsKey(state);
    }

    public boolean isAccepting(int state) {
        return accepting.get(requireIndex(state));
    }

    /**
     * @return accepting state ids, in declaration order
     */
    public List<Integer> getAcceptStates() {
        List<Integer> result = new ArrayList<>();
        for (int i = accepting.nextSetBit(0); i >= 0; i = accepting.nextSetBit(i + 1)) {
            result.add(stateIds[i]);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Targets of (state, symbol).
     * @param state source state id
     * @param symbol symbol, or null for epsilon
     * @return target state ids in ascending order; empty if there is no such transition
     */
    public SortedSet<Integer> getSuccessors(int state, String symbol) {
        int idx = requireIndex(state);
        int[] targets;
        if (symbol == null) {
            targets = epsilon[idx];
        } else {
            int a = getSymbolIndex(symbol);
            targets = a < 0 ? NO_TARGETS : delta[idx][a];
        }
        return idsOf(targets);
    }

    /**
     * Deterministic successor.
     * @return the single target of (state, symbol), or null when undefined
     * @throws IllegalStateException if this automaton is not deterministic
     */
    public Integer getSuccessor(int state, String symbol) {
        if (!deterministic) {
            throw new IllegalStateException("getSuccessor called on a nondeterministic automaton");
        }
        int a = getSymbolIndex(symbol);
        if (a < 0) {
            return null;
        }
        int[] targets = delta[requireIndex(state)][a];
        return targets.length == 0 ? null : stateIds[targets[0]];
    }

    /**
     * Every non-empty transition, ordered by source state, then epsilon, then alphabet order.
     */
    public List<Transition> getTransitions() {
        List<Transition> result = new ArrayList<>();
        for (int i = 0; i < stateIds.length; i++) {
            if (epsilon[i].length > 0) {
                result.add(new Transition(stateIds[i], null, idsOf(epsilon[i])));
            }
            for (int a = 0; a < alphabet.size(); a++) {
                if (delta[i][a].length > 0) {
                    result.add(new Transition(stateIds[i], alphabet.get(a), idsOf(delta[i][a])));
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    private SortedSet<Integer> idsOf(int[] indices) {
        SortedSet<Integer> result = new TreeSet<>();
        for (int t : indices) {
            result.add(stateIds[t]);
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * No epsilon transitions and at most one target per (state, symbol).
     */
    public boolean isDeterministic() {
        return deterministic;
    }

    public boolean hasEpsilonTransitions() {
        for (int[] e : epsilon) {
            if (e.length > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if this automaton was produced by an engine and carries origin sets
     */
    public boolean isGenerated() {
        return origins != null;
    }

    /**
     * Source state ids this state was built from. Empty for automata that were not generated.
     */
    public SortedSet<Integer> getOrigin(int state) {
        int idx = requireIndex(state);
        return origins == null ? Collections.emptySortedSet() : origins.get(idx);
    }

    // Index-level access for the engines.

    /**
     * @return dense index of a state, or -1 if unknown
     */
    public int indexOf(int state) {
        return indexById.get(state);
    }

    public int stateAt(int index) {
        return stateIds[index];
    }

    public int getStartIndex() {
        return startIndex;
    }

    public boolean isAcceptingIndex(int index) {
        return accepting.get(index);
    }

    /**
     * @return index of the symbol in the alphabet, or -1 if not declared
     */
    public int getSymbolIndex(String symbol) {
        Integer a = symbolIndex.get(symbol);
        return a == null ? -1 : a;
    }

    /**
     * Shared array: callers must not modify it.
     */
    public int[] successorIndices(int index, int symbolIndex) {
        return delta[index][symbolIndex];
    }

    /**
     * Shared array: callers must not modify it.
     */
    public int[] epsilonIndices(int index) {
        return epsilon[index];
    }

    private int requireIndex(int state) {
        int idx = indexById.get(state);
        if (idx == MISSING_ELEMENT) {
            throw new IllegalArgumentException("Unknown state: " + state);
        }
        return idx;
    }

    @Override
    public String toString() {
        return "Automaton{states=" + getStates() + ", alphabet=" + alphabet + ", start=" + getStart()
            + ", accept=" + getAcceptStates() + ", transitions=" + getTransitions() + "}";
    }

    /**
     * A merged transition: all targets of one (state, symbol) pair.
     * @param symbol null for epsilon
     */
    public record Transition(int from, String symbol, SortedSet<Integer> to) {
        public boolean isEpsilon() {
            return symbol == null;
        }
    }

    private static final class StateEntry {
        private final boolean accepting;
        private Set<Integer> epsilon;
        private final Map<String, Set<Integer>> moves = new HashMap<>();

        private StateEntry(boolean accepting) {
            this.accepting = accepting;
        }
    }

    /**
     * Mutable staging area for an {@link Automaton}. Not thread-safe; build once.
     * Repeated transitions for the same (state, symbol) are merged by union.
     */
    public static final class Builder {
        private final List<String> alphabet;
        private final Map<Integer, StateEntry> states = new LinkedHashMap<>();
        private final Map<Integer, SortedSet<Integer>> origins = new HashMap<>();
        private Integer start;

        private Builder(List<String> alphabet) {
            // immutable lists throw on contains(null)
            if (alphabet.stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("Epsilon cannot be part of the alphabet");
            }
            if (new HashSet<>(alphabet).size() != alphabet.size()) {
                throw new IllegalArgumentException("Duplicate symbols in alphabet: " + alphabet);
            }
            this.alphabet = List.copyOf(alphabet);
        }

        public Builder addState(int id, boolean accepting) {
            if (id < 0) {
                throw new IllegalArgumentException("State ids must be non-negative: " + id);
            }
            if (states.putIfAbsent(id, new StateEntry(accepting)) != null) {
                throw new IllegalArgumentException("Duplicate state: " + id);
            }
            return this;
        }

        public Builder setStart(int id) {
            this.start = id;
            return this;
        }

        public Builder setOrigin(int id, Collection<Integer> origin) {
            origins.put(id, new TreeSet<>(origin));
            return this;
        }

        /**
         * @param symbol null for epsilon
         */
        public Builder addTransition(int from, String symbol, int to) {
            StateEntry entry = states.get(from);
            if (entry == null || !states.containsKey(to)) {
                throw new IllegalArgumentException("Transition references unknown state: " + from + " -> " + to);
            }
            Set<Integer> targets;
            if (symbol == null) {
                if (entry.epsilon == null) {
                    entry.epsilon = new HashSet<>();
                }
                targets = entry.epsilon;
            } else {
                if (!alphabet.contains(symbol)) {
                    throw new IllegalArgumentException("Symbol not in alphabet: " + symbol);
                }
                targets = entry.moves.computeIfAbsent(symbol, k -> new HashSet<>());
            }
            targets.add(to);
            return this;
        }

        public boolean containsState(int id) {
            return states.containsKey(id);
        }

        public Automaton build() {
            if (states.isEmpty()) {
                throw new IllegalStateException("Automaton needs at least one state");
            }
            if (start == null || !states.containsKey(start)) {
                throw new IllegalStateException("Start state " + start + " is not a declared state");
            }
            return new Automaton(this);
        }
    }
}
