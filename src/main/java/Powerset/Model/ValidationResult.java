package Powerset.Model;

import java.util.List;

/**
 * A validated automaton together with everything that was dropped on the way.
 */
public record ValidationResult(Automaton automaton, List<DroppedTransition> dropped) {

    public ValidationResult {
        dropped = List.copyOf(dropped);
    }
}
