package FSA;

import FSA.Model.FiniteAutomaton;
import net.automatalib.exception.FormatException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class FSACommandLine {
  static final List<String> DEFAULT_OPERATIONS = List.of("standardize", "complete");

  public static void main(String[] args) {
    String epsilonToken = TextFormat.DEFAULT_EPSILON_TOKEN;
    boolean verify = false;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        PowersetDeterminizer.DEBUG = true;
      } else if ("--verify".equalsIgnoreCase(arg)) {
        verify = true;
      } else if ("--epsilon".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
          System.err.println("Missing value for --epsilon");
          printUsageAndExit(); // exits
        }
        epsilonToken = args[++i]; // consume the value
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.isEmpty()) {
      printUsageAndExit();
    }

    String filePath = positional.get(0);
    List<String> operations = positional.size() > 1 ? positional.subList(1, positional.size()) : DEFAULT_OPERATIONS;
    for (String op : operations) {
      if (!isOperation(op)) {
        System.err.println("Unknown operation: " + op);
        printUsageAndExit();
      }
    }

    final FiniteAutomaton fa;
    try {
      fa = new TextFormat(epsilonToken).read(Paths.get(filePath));
    } catch (IOException | FormatException ex) {
      throw new RuntimeException(ex);
    }
    runPipeline(fa, operations, verify, System.out);
  }

  private static void printUsageAndExit() {
    System.out.println(
        "FSA [--debug] [--verify] [--epsilon <token>] <automaton file> [operation ...]");
    System.out.println("[--debug] : Print subset discovery during determinization");
    System.out.println("[--verify] : Check each determinization against AutomataLib's subset construction");
    System.out.println("[--epsilon <token>] : Token read as the empty transition (default: "
        + TextFormat.DEFAULT_EPSILON_TOKEN + ")");
    System.out.println();
    System.out.println("<operation> : applied in order, any of:");
    System.out.println("  standardize: single start state.");
    System.out.println("  complete: total transition function through a sink state.");
    System.out.println("  determinize: subset construction, epsilon transitions removed.");
    System.out.println("  Default: " + String.join(" ", DEFAULT_OPERATIONS));
    System.out.println();
    System.out.println("<automaton file> : sections States:, Alphabet:, Start:, Accept:, Transitions:");
    System.exit(0);
  }

  static boolean isOperation(String op) {
    return switch (op.toLowerCase()) {
      case "standardize", "complete", "determinize" -> true;
      default -> false;
    };
  }

  /**
   * Print the automaton, then apply each operation and print the result.
   * @param fa - loaded automaton; standardize and complete mutate it
   * @param operations - operation names, case-insensitive
   * @param verify - whether to check determinization results for language equivalence
   * @param out - destination of the tables and classifications
   * @return - the final automaton
   */
  static FiniteAutomaton runPipeline(FiniteAutomaton fa, List<String> operations, boolean verify, PrintStream out) {
    print(fa, out);
    for (String op : operations) {
      out.println();
      out.println("Invoking operation:" + op);
      fa = applyOperation(op, fa, verify, out);
      print(fa, out);
    }
    return fa;
  }

  static FiniteAutomaton applyOperation(String op, FiniteAutomaton fa, boolean verify, PrintStream out) {
    return switch (op.toLowerCase()) {
      case "standardize" -> Normalizer.standardize(fa);
      case "complete" -> Normalizer.complete(fa);
      case "determinize" -> determinize(fa, verify, out);
      default -> throw new IllegalStateException("Unexpected operation choice: " + op);
    };
  }

  private static FiniteAutomaton determinize(FiniteAutomaton fa, boolean verify, PrintStream out) {
    long before = System.currentTimeMillis();
    FiniteAutomaton dfa = PowersetDeterminizer.determinize(fa);
    long after = System.currentTimeMillis();
    out.println("Determinized size: " + dfa.size());
    out.println("determinize duration: " + ((after - before) / 1000f) + "s");
    if (verify) {
      boolean equivalent = CompactConversion.testEquivalence(fa, dfa);
      out.println("Equivalent to AutomataLib subset construction: " + equivalent);
      if (!equivalent) {
        throw new IllegalStateException("Determinized automaton accepts a different language");
      }
    }
    return dfa;
  }

  private static void print(FiniteAutomaton fa, PrintStream out) {
    out.print(TransitionTable.render(fa));
    out.println(Classification.classify(fa));
  }
}
