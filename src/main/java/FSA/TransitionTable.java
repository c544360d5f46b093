package FSA;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import FSA.Model.FiniteAutomaton;

/**
 * Printable grid of states (rows) against symbols (columns), both in lexicographic order.
 * Start states are prefixed {@code -->}, accepting states {@code <--}, states that are both {@code <-->}.
 * An epsilon column is appended when epsilon transitions exist but epsilon is not declared.
 */
public class TransitionTable {
    static final String STATE_HEADER = "State";
    static final String UNDEFINED = "-";

    public static String render(FiniteAutomaton fa) {
        final List<String> symbols = new ArrayList<>(fa.getAlphabet());
        if (!symbols.contains(FiniteAutomaton.EPSILON) && usesEpsilon(fa)) {
            symbols.add(FiniteAutomaton.EPSILON);
        }
        final List<String[]> rows = new ArrayList<>();

        String[] header = new String[symbols.size() + 1];
        header[0] = STATE_HEADER;
        for (int i = 0; i < symbols.size(); i++) {
            header[i + 1] = symbols.get(i);
        }
        rows.add(header);

        for (String state : fa.getStates()) {
            String[] row = new String[symbols.size() + 1];
            row[0] = rowLabel(fa, state);
            for (int i = 0; i < symbols.size(); i++) {
                Set<String> dests = fa.getTransitions(state, symbols.get(i));
                row[i + 1] = dests.isEmpty() ? UNDEFINED : String.join(" ", dests);
            }
            rows.add(row);
        }

        int[] widths = new int[header.length];
        for (String[] row : rows) {
            for (int c = 0; c < row.length; c++) {
                widths[c] = Math.max(widths[c], row[c].codePointCount(0, row[c].length()));
            }
        }

        final String rule = rule(widths);
        StringBuilder sb = new StringBuilder();
        sb.append(rule);
        appendRow(sb, header, widths);
        sb.append(rule);
        for (String[] row : rows.subList(1, rows.size())) {
            appendRow(sb, row, widths);
        }
        sb.append(rule);
        return sb.toString();
    }

    private static boolean usesEpsilon(FiniteAutomaton fa) {
        for (String state : fa.getSourceStates()) {
            if (fa.hasTransition(state, FiniteAutomaton.EPSILON)) {
                return true;
            }
        }
        return false;
    }

    static String rowLabel(FiniteAutomaton fa, String state) {
        boolean start = fa.isStart(state);
        boolean accept = fa.isAccepting(state);
        if (start && accept) {
            return "<--> " + state;
        } else if (accept) {
            return "<-- " + state;
        } else if (start) {
            return "--> " + state;
        }
        return state;
    }

    private static String rule(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int w : widths) {
            char[] dashes = new char[w + 2];
            Arrays.fill(dashes, '-');
            sb.append(dashes).append('+');
        }
        return sb.append(System.lineSeparator()).toString();
    }

    private static void appendRow(StringBuilder sb, String[] row, int[] widths) {
        sb.append('|');
        for (int c = 0; c < row.length; c++) {
            int pad = widths[c] - row[c].codePointCount(0, row[c].length());
            sb.append(' ').append(row[c]).append(" ".repeat(pad)).append(" |");
        }
        sb.append(System.lineSeparator());
    }
}
