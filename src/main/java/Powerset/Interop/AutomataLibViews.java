package Powerset.Interop;

import java.util.BitSet;

import Powerset.EpsilonClosure;
import Powerset.Model.Automaton;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

/**
 * Copies of {@link Automaton} values as AutomataLib automata, and AutomataLib's own
 * determinizer/minimizer as an independent reference.
 * <p>
 * AutomataLib state {@code i} is always the state with index {@code i} in the source automaton.
 */
public final class AutomataLibViews {

    private AutomataLibViews() {
    }

    public static Alphabet<String> alphabetOf(Automaton automaton) {
        return Alphabets.fromCollection(automaton.getAlphabet());
    }

    /**
     * Epsilon-free copy: initial states are the closure of the start state and every
     * {@code a}-transition leads to the closure of its targets. Accepts the same language.
     */
    public static CompactNFA<String> toCompactNFA(Automaton nfa) {
        final Alphabet<String> alphabet = alphabetOf(nfa);
        final EpsilonClosure closure = new EpsilonClosure(nfa);
        final CompactNFA<String> out = new CompactNFA<>(alphabet, nfa.size());
        for (int i = 0; i < nfa.size(); i++) {
            out.addState(nfa.isAcceptingIndex(i));
        }

        final BitSet start = new BitSet(nfa.size());
        start.set(nfa.getStartIndex());
        final BitSet inits = closure.closure(start);
        for (int i = inits.nextSetBit(0); i >= 0; i = inits.nextSetBit(i + 1)) {
            out.setInitial(i, true);
        }

        for (int p = 0; p < nfa.size(); p++) {
            final BitSet single = new BitSet(nfa.size());
            single.set(p);
            for (int a = 0; a < alphabet.size(); a++) {
                final BitSet succ = closure.closure(closure.move(single, a));
                for (int q = succ.nextSetBit(0); q >= 0; q = succ.nextSetBit(q + 1)) {
                    out.addTransition(p, alphabet.getSymbol(a), q);
                }
            }
        }
        return out;
    }

    /**
     * @param complete add a rejecting sink for undefined transitions, so that the result is a total DFA
     */
    public static CompactDFA<String> toCompactDFA(Automaton dfa, boolean complete) {
        if (!dfa.isDeterministic()) {
            throw new IllegalArgumentException("Not a deterministic automaton");
        }
        final Alphabet<String> alphabet = alphabetOf(dfa);
        final CompactDFA<String> out = new CompactDFA<>(alphabet, dfa.size() + 1);
        for (int i = 0; i < dfa.size(); i++) {
            out.addState(dfa.isAcceptingIndex(i));
        }
        out.setInitialState(dfa.getStartIndex());

        int sink = -1;
        for (int p = 0; p < dfa.size(); p++) {
            for (int a = 0; a < alphabet.size(); a++) {
                final int[] succ = dfa.successorIndices(p, a);
                if (succ.length == 1) {
                    out.setTransition(p, alphabet.getSymbol(a), (Integer) succ[0]);
                } else if (complete) {
                    if (sink < 0) {
                        sink = addSink(out, alphabet);
                    }
                    out.setTransition(p, alphabet.getSymbol(a), (Integer) sink);
                }
            }
        }
        return out;
    }

    private static int addSink(CompactDFA<String> out, Alphabet<String> alphabet) {
        final int sink = out.addState(false);
        for (String symbol : alphabet) {
            out.setTransition(sink, symbol, (Integer) sink);
        }
        return sink;
    }

    /**
     * AutomataLib's total DFA for the NFA, as produced by its own subset construction.
     */
    public static CompactDFA<String> referenceDFA(Automaton nfa) {
        final CompactNFA<String> compact = toCompactNFA(nfa);
        return NFAs.determinize(compact, compact.getInputAlphabet(), false, false);
    }

    /**
     * Size of AutomataLib's minimal total DFA for the NFA. A minimal partial DFA has either the
     * same size or one state less (no explicit sink).
     */
    public static int referenceMinimalSize(Automaton nfa) {
        final CompactDFA<String> reference = referenceDFA(nfa);
        return HopcroftMinimizer.minimizeDFA(reference, reference.getInputAlphabet()).size();
    }

    /**
     * @return whether {@code dfa} accepts the same language as {@code nfa}, checked with AutomataLib
     */
    public static boolean isEquivalent(Automaton nfa, Automaton dfa) {
        final CompactDFA<String> reference = referenceDFA(nfa);
        final CompactDFA<String> ours = toCompactDFA(dfa, true);
        return Automata.testEquivalence(reference, ours, reference.getInputAlphabet());
    }
}
