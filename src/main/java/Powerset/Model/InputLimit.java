package Powerset.Model;

import java.util.HashSet;

/**
 * Caller-imposed bound on the size of accepted definitions.
 * Subset construction is exponential in the worst case, so work is bounded up front
 * by the number of declared states rather than by interrupting the engine.
 */
public final class InputLimit {

    private final int stateThreshold;

    public InputLimit() {
        this(Integer.MAX_VALUE);
    }

    public InputLimit(int stateThreshold) {
        if (stateThreshold < 1) {
            throw new IllegalArgumentException("State threshold must be positive: " + stateThreshold);
        }
        this.stateThreshold = stateThreshold;
    }

    public static InputLimit unbounded() {
        return new InputLimit();
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public boolean isAboveThreshold(int states) {
        return states > stateThreshold;
    }

    /**
     * @throws ValidationException if the definition declares more distinct states than allowed
     */
    public void check(AutomatonDef def) throws ValidationException {
        int declared = new HashSet<>(def.states()).size();
        if (isAboveThreshold(declared)) {
            throw new ValidationException(
                "Automaton declares " + declared + " states, above the limit of " + stateThreshold);
        }
    }

    @Override
    public String toString() {
        return stateThreshold == Integer.MAX_VALUE ? "unbounded" : String.valueOf(stateThreshold);
    }
}
