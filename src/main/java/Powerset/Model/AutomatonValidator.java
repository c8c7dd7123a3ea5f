package Powerset.Model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw {@link AutomatonDef} into an {@link Automaton}.
 * <p>
 * Only an empty state set, a missing start state or malformed state ids abort validation.
 * Everything else that does not fit (unknown states or symbols in transitions, unknown accept
 * states, epsilon or duplicates in the alphabet) is dropped with a warning. Repeated transitions
 * for one (state, symbol) pair are merged by union of their targets.
 */
public final class AutomatonValidator {
    private static final Logger LOG = LoggerFactory.getLogger(AutomatonValidator.class);

    private AutomatonValidator() {
    }

    public static ValidationResult validate(AutomatonDef def) throws ValidationException {
        final List<DroppedTransition> dropped = new ArrayList<>();

        // states
        if (def.states().isEmpty()) {
            throw new ValidationException("Automaton must declare at least one state");
        }
        final Set<Integer> states = new LinkedHashSet<>();
        for (Integer state : def.states()) {
            if (state == null || state < 0) {
                throw new ValidationException("State ids must be non-negative integers, got: " + state);
            }
            if (!states.add(state)) {
                drop(dropped, null, "duplicate state " + state + " collapsed");
            }
        }

        // start
        if (def.start() == null) {
            throw new ValidationException("Automaton has no start state");
        }
        if (!states.contains(def.start())) {
            throw new ValidationException("Start state " + def.start() + " is not one of the declared states " + states);
        }

        // alphabet
        final Set<String> alphabet = new LinkedHashSet<>();
        for (String symbol : def.alphabet()) {
            if (symbol == null || symbol.isEmpty()) {
                drop(dropped, null, "epsilon is not an alphabet symbol, ignored");
            } else if (!alphabet.add(symbol)) {
                drop(dropped, null, "duplicate symbol '" + symbol + "' collapsed");
            }
        }

        // accept
        final Set<Integer> accept = new LinkedHashSet<>();
        for (Integer state : def.accept()) {
            if (state == null || !states.contains(state)) {
                drop(dropped, null, "accept state " + state + " is not a declared state, ignored");
            } else {
                accept.add(state);
            }
        }

        final Automaton.Builder builder = Automaton.builder(new ArrayList<>(alphabet));
        for (int state : states) {
            builder.addState(state, accept.contains(state));
        }
        builder.setStart(def.start());

        // transitions
        for (TransitionDef t : def.transitions()) {
            if (t == null) {
                drop(dropped, null, "null transition ignored");
                continue;
            }
            if (!states.contains(t.from())) {
                drop(dropped, t, "unknown source state " + t.from());
                continue;
            }
            if (!t.isEpsilon() && !alphabet.contains(t.symbol())) {
                drop(dropped, t, "symbol '" + t.symbol() + "' is not in the alphabet");
                continue;
            }
            final List<Integer> unknownTargets = new ArrayList<>();
            int kept = 0;
            for (Integer target : t.to()) {
                if (target == null || !states.contains(target)) {
                    unknownTargets.add(target);
                } else {
                    builder.addTransition(t.from(), t.symbol(), target);
                    kept++;
                }
            }
            if (kept == 0) {
                drop(dropped, t, unknownTargets.isEmpty()
                    ? "no target states"
                    : "no known target states, unknown: " + unknownTargets);
            } else if (!unknownTargets.isEmpty()) {
                drop(dropped, t, "unknown target states " + unknownTargets + " removed");
            }
        }

        return new ValidationResult(builder.build(), dropped);
    }

    private static void drop(List<DroppedTransition> dropped, TransitionDef transition, String reason) {
        DroppedTransition d = new DroppedTransition(transition, reason);
        LOG.warn("Dropped: {}", d);
        dropped.add(d);
    }
}
