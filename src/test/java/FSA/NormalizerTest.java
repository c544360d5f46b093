package FSA;

import FSA.Model.FiniteAutomaton;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

public class NormalizerTest {
  @Test
  void testCompleteAddsSink() {
    FiniteAutomaton fa = ClassificationTest.scenarioAutomaton();
    FiniteAutomaton result = Normalizer.complete(fa);
    Assertions.assertSame(fa, result); // in place

    Assertions.assertTrue(Classification.isComplete(fa));
    Assertions.assertEquals(Set.of("q0", "q1", "p"), fa.getStates());
    Assertions.assertEquals(Set.of("p"), fa.getTransitions("q1", "a"));
    Assertions.assertEquals(Set.of("p"), fa.getTransitions("q1", "b"));
    Assertions.assertEquals(Set.of("p"), fa.getTransitions("p", "a"));
    Assertions.assertEquals(Set.of("p"), fa.getTransitions("p", "b"));
    // existing transitions are untouched
    Assertions.assertEquals(Set.of("q1"), fa.getTransitions("q0", "a"));
    Assertions.assertEquals(Set.of("q0"), fa.getTransitions("q0", "b"));
    Assertions.assertFalse(fa.isAccepting("p"));
    Assertions.assertEquals("deterministic complete standard", Classification.classify(fa));
  }

  @Test
  void testCompleteIsIdempotent() {
    FiniteAutomaton fa = Normalizer.complete(ClassificationTest.scenarioAutomaton());
    FiniteAutomaton once = fa.copy();
    Normalizer.complete(fa);
    Assertions.assertEquals(once, fa);
  }

  @Test
  void testCompleteAvoidsLabelCollision() {
    FiniteAutomaton fa = ClassificationTest.scenarioAutomaton();
    fa.addState("p");
    Normalizer.complete(fa);
    Assertions.assertTrue(fa.getStates().contains("p1"));
    Assertions.assertEquals(Set.of("p1"), fa.getTransitions("p", "a"));
    Assertions.assertEquals(Set.of("p1"), fa.getTransitions("p1", "b"));
  }

  @Test
  void testCompleteSinkAvoidsUndeclaredDestination() {
    FiniteAutomaton fa = ClassificationTest.scenarioAutomaton();
    fa.addTransition("q1", "a", "p"); // p only appears as a destination
    Normalizer.complete(fa);
    Assertions.assertEquals(Set.of("p1"), fa.getTransitions("q1", "b"));
    Assertions.assertEquals(Set.of("p"), fa.getTransitions("q1", "a"));
    Assertions.assertFalse(fa.hasTransitions("p"));
  }

  @Test
  void testCompleteIgnoresEpsilon() {
    FiniteAutomaton fa = ClassificationTest.scenarioAutomaton();
    fa.addSymbol(FiniteAutomaton.EPSILON);
    Normalizer.complete(fa);
    Assertions.assertTrue(Classification.isComplete(fa));
    Assertions.assertFalse(fa.hasTransition("p", FiniteAutomaton.EPSILON));
    Assertions.assertFalse(fa.hasTransition("q1", FiniteAutomaton.EPSILON));
  }

  @Test
  void testCompleteWithoutInputSymbolsIsNoOp() {
    FiniteAutomaton fa = new FiniteAutomaton();
    fa.addState("q0");
    fa.addStartState("q0");
    FiniteAutomaton before = fa.copy();
    Normalizer.complete(fa);
    Assertions.assertEquals(before, fa);
  }

  @Test
  void testStandardizeMergesStarts() {
    FiniteAutomaton fa = ClassificationTest.scenarioAutomaton();
    fa.addStartState("q1");
    fa.addTransition("q1", "a", "q0");
    Assertions.assertFalse(Classification.isStandard(fa));

    FiniteAutomaton result = Normalizer.standardize(fa);
    Assertions.assertSame(fa, result);
    Assertions.assertEquals(Set.of("init"), fa.getStartStates());
    Assertions.assertTrue(fa.getStates().contains("init"));
    Assertions.assertEquals(Map.of("a", Set.of("q0", "q1"), "b", Set.of("q0")), fa.getTransitions("init"));

    // originals stay in place
    Assertions.assertEquals(Set.of("q1"), fa.getTransitions("q0", "a"));
    Assertions.assertEquals(Set.of("q0"), fa.getTransitions("q1", "a"));
    Assertions.assertTrue(Classification.isStandard(fa));
  }

  @Test
  void testStandardizeKeepsEmptyWordAcceptance() {
    FiniteAutomaton fa = ClassificationTest.scenarioAutomaton();
    fa.addStartState("q1"); // q1 accepts, so the empty word is in the language
    Normalizer.standardize(fa);
    Assertions.assertTrue(fa.isAccepting("init"));

    FiniteAutomaton rejecting = ClassificationTest.scenarioAutomaton();
    rejecting.addState("q2");
    rejecting.addStartState("q2");
    Normalizer.standardize(rejecting);
    Assertions.assertFalse(rejecting.isAccepting("init"));
  }

  @Test
  void testStandardizeIsIdentityWhenStandard() {
    FiniteAutomaton fa = ClassificationTest.scenarioAutomaton();
    FiniteAutomaton before = fa.copy();
    Assertions.assertSame(fa, Normalizer.standardize(fa));
    Assertions.assertEquals(before, fa);
  }

  @Test
  void testStandardizeIsIdempotent() {
    FiniteAutomaton fa = ClassificationTest.scenarioAutomaton();
    fa.addStartState("q1");
    Normalizer.standardize(fa);
    Set<String> starts = Set.copyOf(fa.getStartStates());
    Normalizer.standardize(fa);
    Assertions.assertEquals(starts, fa.getStartStates());
  }

  @Test
  void testStandardizeWithoutStartStates() {
    FiniteAutomaton fa = new FiniteAutomaton();
    Normalizer.standardize(fa);
    Assertions.assertEquals(Set.of("init"), fa.getStartStates());
    Assertions.assertFalse(fa.hasTransitions("init"));
    Assertions.assertFalse(fa.isAccepting("init"));
    Assertions.assertTrue(Classification.isStandard(fa));
  }

  @Test
  void testStandardizeCopiesEpsilonTransitions() {
    FiniteAutomaton fa = ClassificationTest.scenarioAutomaton();
    fa.addState("q2");
    fa.addStartState("q2");
    fa.addTransition("q2", FiniteAutomaton.EPSILON, "q1");
    Normalizer.standardize(fa);
    Assertions.assertEquals(Set.of("q1"), fa.getTransitions("init", FiniteAutomaton.EPSILON));
  }

  @Test
  void testStandardizePreservesLanguage() {
    for (int seed = 0; seed < 50; seed++) {
      FiniteAutomaton fa = TabakovVardiRandomNFA.getRandomAutomaton(seed, 5);
      FiniteAutomaton standard = Normalizer.standardize(fa.copy());
      Assertions.assertTrue(CompactConversion.testEquivalence(fa, standard), "seed " + seed);
    }
  }
}
