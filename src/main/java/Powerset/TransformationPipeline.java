package Powerset;

import Powerset.Model.Automaton;
import Powerset.Model.AutomatonDef;
import Powerset.Model.AutomatonValidator;
import Powerset.Model.InputLimit;
import Powerset.Model.ValidationException;
import Powerset.Model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the two supported requests. Both validate the definition first and echo the
 * validated NFA back with the result.
 * <p>
 * Holds no mutable state; a single instance can serve concurrent requests.
 */
public class TransformationPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(TransformationPipeline.class);

    private final InputLimit limit;

    public TransformationPipeline() {
        this(InputLimit.unbounded());
    }

    public TransformationPipeline(InputLimit limit) {
        this.limit = limit;
    }

    /**
     * NFA to DFA.
     * @throws ValidationException if the definition is unusable or above the input limit
     */
    public TransformationResult convert(AutomatonDef def) throws ValidationException {
        final ValidationResult validated = validate(def);
        final Automaton dfa = SubsetConstruction.convert(validated.automaton());
        LOG.debug("convert: {} NFA states -> {} DFA states", validated.automaton().size(), dfa.size());
        return new TransformationResult(validated.automaton(), dfa, validated.dropped());
    }

    /**
     * NFA to minimal DFA, i.e. {@code minimize(convert(nfa))}.
     * @throws ValidationException if the definition is unusable or above the input limit
     */
    public TransformationResult minimize(AutomatonDef def) throws ValidationException {
        final ValidationResult validated = validate(def);
        final Automaton dfa = SubsetConstruction.convert(validated.automaton());
        final Automaton minimal = MooreMinimizer.minimize(dfa);
        LOG.debug("minimize: {} NFA states -> {} DFA states -> {} minimal states",
            validated.automaton().size(), dfa.size(), minimal.size());
        return new TransformationResult(validated.automaton(), minimal, validated.dropped());
    }

    /**
     * Dispatch by request name, as used by the command line.
     * @param request "convert" or "minimize", case-insensitive
     */
    public TransformationResult handle(String request, AutomatonDef def) throws ValidationException {
        return switch (request.toLowerCase()) {
            case "convert" -> convert(def);
            case "minimize" -> minimize(def);
            default -> throw new IllegalArgumentException("Unexpected request: " + request);
        };
    }

    public InputLimit getLimit() {
        return limit;
    }

    private ValidationResult validate(AutomatonDef def) throws ValidationException {
        limit.check(def);
        return AutomatonValidator.validate(def);
    }
}
