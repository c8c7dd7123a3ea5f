package Powerset;

import java.util.List;

import Powerset.Model.Automaton;
import Powerset.Model.AutomatonDef;
import Powerset.Model.DroppedTransition;

/**
 * Outcome of a pipeline request: the NFA as it was accepted (after dropping invalid parts)
 * and the computed DFA, which is the minimal DFA for minimize requests.
 */
public record TransformationResult(Automaton nfa, Automaton dfa, List<DroppedTransition> dropped) {

    public TransformationResult {
        dropped = List.copyOf(dropped);
    }

    /**
     * @return wire form of the echoed NFA, with list-valued targets
     */
    public AutomatonDef nfaDef() {
        return AutomatonDef.of(nfa, false);
    }

    /**
     * @return wire form of the DFA, with single-int targets
     */
    public AutomatonDef dfaDef() {
        return AutomatonDef.of(dfa, true);
    }
}
