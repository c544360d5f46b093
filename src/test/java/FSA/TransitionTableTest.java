package FSA;

import FSA.Model.FiniteAutomaton;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TransitionTableTest {
  private static String lines(String... lines) {
    return String.join(System.lineSeparator(), lines) + System.lineSeparator();
  }

  @Test
  void testRender() {
    String expected = lines(
        "+--------+----+----+",
        "| State  | a  | b  |",
        "+--------+----+----+",
        "| --> q0 | q1 | q0 |",
        "| <-- q1 | -  | -  |",
        "+--------+----+----+");
    Assertions.assertEquals(expected, TransitionTable.render(ClassificationTest.scenarioAutomaton()));
  }

  @Test
  void testRowLabels() {
    FiniteAutomaton fa = new FiniteAutomaton();
    fa.addStartState("s");
    fa.addAcceptState("s");
    fa.addAcceptState("f");
    fa.addStartState("i");
    Assertions.assertEquals("<--> s", TransitionTable.rowLabel(fa, "s"));
    Assertions.assertEquals("<-- f", TransitionTable.rowLabel(fa, "f"));
    Assertions.assertEquals("--> i", TransitionTable.rowLabel(fa, "i"));
    Assertions.assertEquals("x", TransitionTable.rowLabel(fa, "x"));
  }

  @Test
  void testNondeterministicCellsAndEpsilonColumn() {
    FiniteAutomaton fa = PowersetDeterminizerTest.epsilonAutomaton();
    fa.addTransition("q1", "a", "q0");
    String expected = lines(
        "+--------+-------+----+",
        "| State  | a     | ε  |",
        "+--------+-------+----+",
        "| --> q0 | -     | q1 |",
        "| q1     | q0 q2 | -  |",
        "| <-- q2 | -     | -  |",
        "+--------+-------+----+");
    Assertions.assertEquals(expected, TransitionTable.render(fa));
  }

  @Test
  void testEmptyAutomaton() {
    String expected = lines(
        "+-------+",
        "| State |",
        "+-------+",
        "+-------+");
    Assertions.assertEquals(expected, TransitionTable.render(new FiniteAutomaton()));
  }
}
