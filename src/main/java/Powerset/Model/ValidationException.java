package Powerset.Model;

/**
 * Hard, input-level failure: the definition cannot be turned into an automaton at all.
 * Dropped transitions never end up here, see {@link DroppedTransition}.
 */
public class ValidationException extends Exception {

    public ValidationException(String message) {
        super(message);
    }
}
