package Powerset.Interop;

import Powerset.Model.Automaton;
import Powerset.Model.AutomatonDef;
import Powerset.Model.AutomatonValidator;
import Powerset.Model.TransitionDef;
import Powerset.Model.ValidationException;
import Powerset.SubsetConstruction;
import Powerset.WordRunner;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class AutomataLibViewsTest {

  private static Automaton validate(AutomatonDef def) throws ValidationException {
    return AutomatonValidator.validate(def).automaton();
  }

  // (a|b)*ab, with an epsilon detour through state 3
  private static Automaton endsWithAB() throws ValidationException {
    return Automaton.builder(List.of("a", "b"))
        .addState(0, false)
        .addState(1, false)
        .addState(2, true)
        .addState(3, false)
        .setStart(0)
        .addTransition(0, "a", 0)
        .addTransition(0, "b", 0)
        .addTransition(0, null, 3)
        .addTransition(3, "a", 1)
        .addTransition(1, "b", 2)
        .build();
  }

  @Test
  void testCompactNFAAcceptsSameWords() throws ValidationException {
    Automaton nfa = endsWithAB();
    CompactNFA<String> compact = AutomataLibViews.toCompactNFA(nfa);
    Assertions.assertEquals(nfa.size(), compact.size());
    Assertions.assertEquals(2, compact.getInitialStates().size());
    for (List<String> word : List.<List<String>>of(List.of(), List.of("a", "b"), List.of("b", "a", "b"),
        List.of("a", "b", "a"), List.of("b"))) {
      Assertions.assertEquals(WordRunner.accepts(nfa, word), compact.accepts(word), word.toString());
    }
  }

  @Test
  void testCompactDFAPartialAndComplete() throws ValidationException {
    Automaton dfa = validate(new AutomatonDef(List.of(0, 1), List.of("a", "b"),
        List.of(TransitionDef.of(0, "a", 1)), 0, List.of(1)));
    CompactDFA<String> partial = AutomataLibViews.toCompactDFA(dfa, false);
    Assertions.assertEquals(2, partial.size());
    Assertions.assertNull(partial.getSuccessor(0, "b"));

    CompactDFA<String> complete = AutomataLibViews.toCompactDFA(dfa, true);
    Assertions.assertEquals(3, complete.size());
    Assertions.assertEquals(2, complete.getSuccessor(0, "b"));
    Assertions.assertEquals(2, complete.getSuccessor(2, "a"));
    Assertions.assertTrue(complete.accepts(List.of("a")));
    Assertions.assertFalse(complete.accepts(List.of("a", "a")));

    Assertions.assertThrows(IllegalArgumentException.class, () -> AutomataLibViews.toCompactDFA(endsWithAB(), true));
  }

  @Test
  void testEquivalence() throws ValidationException {
    Automaton nfa = endsWithAB();
    Automaton dfa = SubsetConstruction.convert(nfa);
    Assertions.assertTrue(AutomataLibViews.isEquivalent(nfa, dfa));
    Assertions.assertEquals(3, AutomataLibViews.referenceMinimalSize(nfa));

    // accepts "ab" only
    Automaton other = Automaton.builder(List.of("a", "b"))
        .addState(0, false).addState(1, false).addState(2, true)
        .setStart(0)
        .addTransition(0, "a", 1)
        .addTransition(1, "b", 2)
        .build();
    Assertions.assertFalse(AutomataLibViews.isEquivalent(nfa, other));
    Assertions.assertTrue(AutomataLibViews.isEquivalent(other, other));
  }

  @Test
  void testReferenceDFAIsTotal() throws ValidationException {
    CompactDFA<String> reference = AutomataLibViews.referenceDFA(endsWithAB());
    for (Integer s : reference.getStates()) {
      for (String a : reference.getInputAlphabet()) {
        Assertions.assertNotNull(reference.getSuccessor(s, a));
      }
    }
  }
}
