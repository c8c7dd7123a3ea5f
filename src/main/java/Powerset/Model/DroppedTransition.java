package Powerset.Model;

/**
 * A piece of user input that was left out of the validated automaton.
 * Recorded and logged, never raised.
 *
 * @param transition the offending transition, or null when the dropped item is not a transition
 * @param reason human-readable cause
 */
public record DroppedTransition(TransitionDef transition, String reason) {

    @Override
    public String toString() {
        return transition == null ? reason : transition + ": " + reason;
    }
}
