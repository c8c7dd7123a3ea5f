package Powerset;

import Powerset.Interop.AutomataLibViews;
import Powerset.Model.Automaton;
import Powerset.Model.AutomatonDef;
import Powerset.Model.AutomatonValidator;
import Powerset.Model.TransitionDef;
import Powerset.Model.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class MooreMinimizerTest {

  private static Automaton.Builder abBuilder() {
    return Automaton.builder(List.of("a", "b"));
  }

  @Test
  void testMergesEquivalentStates() {
    // 0 and 2 are equivalent: both are "last symbol was not a"
    Automaton dfa = abBuilder()
        .addState(0, false).addState(1, true).addState(2, false)
        .setStart(0)
        .addTransition(0, "a", 1).addTransition(0, "b", 2)
        .addTransition(1, "a", 1).addTransition(1, "b", 2)
        .addTransition(2, "a", 1).addTransition(2, "b", 2)
        .build();
    Automaton min = MooreMinimizer.minimize(dfa);

    Assertions.assertEquals(2, min.size());
    Assertions.assertEquals(List.of(0, 1), min.getStates()); // labelled by smallest member
    Assertions.assertEquals(0, min.getStart());
    Assertions.assertEquals(Set.of(0, 2), min.getOrigin(0));
    Assertions.assertEquals(Set.of(1), min.getOrigin(1));
    Assertions.assertEquals(List.of(1), min.getAcceptStates());
    Assertions.assertEquals(1, min.getSuccessor(0, "a"));
    Assertions.assertEquals(0, min.getSuccessor(0, "b"));
    Assertions.assertEquals(1, min.getSuccessor(1, "a"));
    Assertions.assertEquals(0, min.getSuccessor(1, "b"));
  }

  @Test
  void testUnreachableStatesRemoved() {
    Automaton dfa = abBuilder()
        .addState(0, false).addState(1, true).addState(2, true)
        .setStart(0)
        .addTransition(0, "a", 1).addTransition(1, "b", 0)
        .addTransition(2, "a", 0) // 2 is never reached
        .build();
    Automaton min = MooreMinimizer.minimize(dfa);

    Assertions.assertEquals(2, min.size());
    Assertions.assertFalse(min.containsState(2));
    for (int s : min.getStates()) {
      Assertions.assertFalse(min.getOrigin(s).contains(2));
    }
  }

  @Test
  void testMissingTransitionIsItsOwnBlock() {
    // no accepting states at all, yet the states differ in which transitions they define
    Automaton dfa = abBuilder()
        .addState(0, false).addState(1, false).addState(2, false)
        .setStart(0)
        .addTransition(0, "a", 1).addTransition(0, "b", 2)
        .addTransition(1, "a", 1)
        .build();
    Automaton min = MooreMinimizer.minimize(dfa);
    Assertions.assertEquals(3, min.size());

    // two states that both lack every transition do merge
    Automaton twoEnds = abBuilder()
        .addState(0, false).addState(1, true).addState(2, true)
        .setStart(0)
        .addTransition(0, "a", 1).addTransition(0, "b", 2)
        .build();
    Automaton min2 = MooreMinimizer.minimize(twoEnds);
    Assertions.assertEquals(2, min2.size());
    Assertions.assertEquals(Set.of(1, 2), min2.getOrigin(1));
  }

  @Test
  void testSingleState() {
    Automaton rejecting = abBuilder().addState(5, false).setStart(5).addTransition(5, "a", 5).build();
    Automaton min = MooreMinimizer.minimize(rejecting);
    Assertions.assertEquals(1, min.size());
    Assertions.assertEquals(5, min.getStart());
    Assertions.assertFalse(min.isAccepting(5));
    Assertions.assertEquals(5, min.getSuccessor(5, "a"));
    Assertions.assertNull(min.getSuccessor(5, "b"));

    Automaton accepting = Automaton.builder(List.of()).addState(0, true).setStart(0).build();
    Automaton min2 = MooreMinimizer.minimize(accepting);
    Assertions.assertEquals(1, min2.size());
    Assertions.assertTrue(min2.isAccepting(0));
  }

  @Test
  void testRejectsNondeterministicInput() {
    Automaton nfa = abBuilder().addState(0, false).addState(1, true).setStart(0)
        .addTransition(0, "a", 0).addTransition(0, "a", 1).build();
    Assertions.assertThrows(IllegalArgumentException.class, () -> MooreMinimizer.minimize(nfa));
  }

  @Test
  void testEndsWithABIsAlreadyMinimal() throws ValidationException {
    Automaton nfa = AutomatonValidator.validate(SubsetConstructionTest.endsWithAB()).automaton();
    Automaton dfa = SubsetConstruction.convert(nfa);
    Automaton min = MooreMinimizer.minimize(dfa);
    Assertions.assertEquals(3, min.size());
    for (List<String> w : List.of(List.<String>of(), List.of("a", "b"), List.of("a", "a", "b"), List.of("b", "a"))) {
      Assertions.assertEquals(WordRunner.accepts(dfa, w), WordRunner.accepts(min, w), "word " + w);
    }
  }

  @Test
  void testLiveStates() {
    Automaton dfa = abBuilder()
        .addState(0, false).addState(1, true).addState(2, false)
        .setStart(0)
        .addTransition(0, "a", 1).addTransition(0, "b", 2).addTransition(2, "a", 2)
        .build();
    Assertions.assertEquals(Set.of(0, 1), BitSetUtils.toStateIds(MooreMinimizer.liveStates(dfa), dfa));
  }

  @Test
  void testIdempotenceAndLanguage() throws ValidationException {
    List<List<String>> words = RandomNFA.allWords(RandomNFA.AB, 6);
    for (int seed = 0; seed < 100; seed++) {
      Automaton nfa = AutomatonValidator.validate(RandomNFA.getRandomAutomaton(seed, 8)).automaton();
      Automaton dfa = SubsetConstruction.convert(nfa);
      Automaton min = MooreMinimizer.minimize(dfa);
      Automaton minMin = MooreMinimizer.minimize(min);

      Assertions.assertTrue(min.size() <= dfa.size());
      Assertions.assertEquals(min.size(), minMin.size(), "seed " + seed);
      Assertions.assertEquals(min.getStates(), minMin.getStates());
      Assertions.assertEquals(min.getTransitions(), minMin.getTransitions());
      Assertions.assertEquals(min.getAcceptStates(), minMin.getAcceptStates());
      for (List<String> w : words) {
        Assertions.assertEquals(WordRunner.accepts(dfa, w), WordRunner.accepts(min, w), "seed " + seed + ", word " + w);
      }
      Assertions.assertTrue(AutomataLibViews.isEquivalent(nfa, min), "seed " + seed);
    }
  }

  @Test
  void testMinimalAgainstAutomataLib() throws ValidationException {
    int checked = 0;
    for (int seed = 0; seed < 200; seed++) {
      AutomatonDef def = RandomNFA.coaccessible(RandomNFA.getRandomAutomaton(seed, 10));
      if (def == null) {
        continue;
      }
      Automaton nfa = AutomatonValidator.validate(def).automaton();
      Automaton min = MooreMinimizer.minimize(SubsetConstruction.convert(nfa));
      Assertions.assertEquals(min.size(), MooreMinimizer.liveStates(min).cardinality(), "seed " + seed);

      // AutomataLib's minimal DFA is total; ours only lacks its sink
      int reference = AutomataLibViews.referenceMinimalSize(nfa);
      Assertions.assertTrue(min.size() == reference || min.size() == reference - 1,
          "seed " + seed + ": " + min.size() + " vs " + reference);
      checked++;
    }
    Assertions.assertTrue(checked > 0);
  }

  @Test
  void testEquivalentNFAsGiveSameMinimalSize() throws ValidationException {
    // ends with "ab", built with an epsilon detour through extra states
    AutomatonDef padded = new AutomatonDef(List.of(0, 3, 4, 5), List.of("a", "b"),
        List.of(TransitionDef.of(0, "a", List.of(0)),
                TransitionDef.of(0, "b", List.of(0)),
                TransitionDef.of(0, null, List.of(3)),
                TransitionDef.of(3, "a", List.of(4)),
                TransitionDef.of(4, "b", List.of(5))),
        0, List.of(5));
    Automaton original = AutomatonValidator.validate(SubsetConstructionTest.endsWithAB()).automaton();
    Automaton other = AutomatonValidator.validate(padded).automaton();

    Automaton min1 = MooreMinimizer.minimize(SubsetConstruction.convert(original));
    Automaton min2 = MooreMinimizer.minimize(SubsetConstruction.convert(other));
    Assertions.assertEquals(min1.size(), min2.size());
    Assertions.assertEquals(AutomatonDef.of(min1, true).transitions(), AutomatonDef.of(min2, true).transitions());
  }
}
