package Powerset.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Serialized shape of an automaton as it crosses the request boundary.
 * Nothing here is validated; see {@link AutomatonValidator}.
 *
 * @param states declared state ids
 * @param alphabet declared symbols, epsilon excluded
 * @param transitions raw transitions, possibly redundant or referencing unknown states/symbols
 * @param start start state, null when absent from the input
 * @param accept accepting states
 * @param origins for generated automata only: source state ids each state was built from
 */
public record AutomatonDef(List<Integer> states,
                           List<String> alphabet,
                           List<TransitionDef> transitions,
                           Integer start,
                           List<Integer> accept,
                           @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<Integer, List<Integer>> origins) {

    @JsonCreator
    public AutomatonDef {
        states = states == null ? List.of() : copyOf(states);
        alphabet = alphabet == null ? List.of() : copyOf(alphabet);
        transitions = transitions == null ? List.of() : copyOf(transitions);
        accept = accept == null ? List.of() : copyOf(accept);
        origins = origins == null ? Map.of() : origins;
    }

    public AutomatonDef(List<Integer> states, List<String> alphabet, List<TransitionDef> transitions,
                        Integer start, List<Integer> accept) {
        this(states, alphabet, transitions, start, accept, null);
    }

    /**
     * Encode a validated or generated automaton.
     * @param automaton automaton to encode
     * @param singleTargets write each transition target as a plain int; only valid for deterministic automata
     * @return the wire form, transitions ordered by source state, then epsilon, then alphabet order
     */
    public static AutomatonDef of(Automaton automaton, boolean singleTargets) {
        if (singleTargets && !automaton.isDeterministic()) {
            throw new IllegalArgumentException("Only deterministic automata can be encoded with single targets");
        }
        List<TransitionDef> transitions = new ArrayList<>();
        for (Automaton.Transition t : automaton.getTransitions()) {
            transitions.add(singleTargets
                ? TransitionDef.of(t.from(), t.symbol(), t.to().first())
                : TransitionDef.of(t.from(), t.symbol(), new ArrayList<>(t.to())));
        }
        Map<Integer, List<Integer>> origins = null;
        if (automaton.isGenerated()) {
            origins = new LinkedHashMap<>();
            for (int state : automaton.getStates()) {
                SortedSet<Integer> origin = automaton.getOrigin(state);
                origins.put(state, List.copyOf(origin));
            }
        }
        return new AutomatonDef(automaton.getStates(), automaton.getAlphabet(), transitions,
            automaton.getStart(), automaton.getAcceptStates(), origins);
    }

    // tolerates null elements, unlike List.copyOf; validation reports them
    private static <T> List<T> copyOf(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
