package FSA;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import FSA.Model.FiniteAutomaton;
import net.automatalib.exception.FormatException;

/**
 * Line-oriented automaton description:
 * <pre>
 * States: q0 q1
 * Alphabet: a b
 * Start: q0
 * Accept: q1
 * Transitions:
 * q0 a q1
 * q0 eps q1
 *
 * </pre>
 * Sections may come in any order. Transition triples run until a blank line or the end of input.
 * Lines outside of sections are ignored.
 */
public class TextFormat {
    public static final String DEFAULT_EPSILON_TOKEN = "eps";

    static final String STATES = "States:";
    static final String ALPHABET = "Alphabet:";
    static final String START = "Start:";
    static final String ACCEPT = "Accept:";
    static final String TRANSITIONS = "Transitions:";

    private final String epsilonToken;

    public TextFormat() {
        this(DEFAULT_EPSILON_TOKEN);
    }

    /**
     * @param epsilonToken token read as {@link FiniteAutomaton#EPSILON}, in addition to the symbol itself
     */
    public TextFormat(String epsilonToken) {
        this.epsilonToken = epsilonToken;
    }

    /**
     * Read an automaton from a file. A missing file is reported on standard error and yields an
     * empty automaton.
     * @throws FormatException on a transition line that is not a triple
     */
    public FiniteAutomaton read(Path filePath) throws IOException, FormatException {
        try (Reader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (NoSuchFileException ex) {
            System.err.println("Error: File '" + filePath + "' not found.");
            return new FiniteAutomaton();
        }
    }

    public FiniteAutomaton parse(Reader reader) throws IOException, FormatException {
        final FiniteAutomaton fa = new FiniteAutomaton();
        final BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        int lineNo = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNo++;
            line = line.strip();
            if (line.startsWith(STATES)) {
                for (String state : tokens(line, STATES)) {
                    fa.addState(state);
                }
            } else if (line.startsWith(ALPHABET)) {
                for (String symbol : tokens(line, ALPHABET)) {
                    fa.addSymbol(symbol(symbol));
                }
            } else if (line.startsWith(START)) {
                for (String state : tokens(line, START)) {
                    fa.addStartState(state);
                }
            } else if (line.startsWith(ACCEPT)) {
                for (String state : tokens(line, ACCEPT)) {
                    fa.addAcceptState(state);
                }
            } else if (line.startsWith(TRANSITIONS)) {
                while ((line = in.readLine()) != null) {
                    lineNo++;
                    line = line.strip();
                    if (line.isEmpty()) {
                        break;
                    }
                    String[] triple = line.split("\\s+");
                    if (triple.length != 3) {
                        throw new FormatException("Line " + lineNo + ": expected '<from> <symbol> <to>' but got '" + line + "'");
                    }
                    fa.addTransition(triple[0], symbol(triple[1]), triple[2]);
                }
            }
        }
        return fa;
    }

    private String symbol(String token) {
        return token.equals(epsilonToken) ? FiniteAutomaton.EPSILON : token;
    }

    private static String[] tokens(String line, String marker) {
        String rest = line.substring(marker.length()).strip();
        return rest.isEmpty() ? new String[0] : rest.split("\\s+");
    }
}
