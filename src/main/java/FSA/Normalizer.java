package FSA;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.Model.FiniteAutomaton;

/**
 * In-place normal forms: a single start state, and a total transition function.
 * Both return the automaton they were given.
 */
public class Normalizer {
    static final String START_LABEL = "init";
    static final String SINK_LABEL = "p";

    /**
     * Replace several (or zero) start states with one fresh start state carrying the union of their
     * outgoing transitions. The original start states and their transitions stay in place.
     * The new start state is accepting if any original start state was, so the empty word is kept.
     */
    public static FiniteAutomaton standardize(FiniteAutomaton fa) {
        if (Classification.isStandard(fa)) {
            return fa;
        }
        final String start = fa.freshState(START_LABEL);
        fa.addState(start);

        boolean accepting = false;
        for (String s : fa.getStartStates()) {
            accepting |= fa.isAccepting(s);
            for (Map.Entry<String, Set<String>> cell : fa.getTransitions(s).entrySet()) {
                for (String dest : cell.getValue()) {
                    fa.addTransition(start, cell.getKey(), dest);
                }
            }
        }
        if (accepting) {
            fa.addAcceptState(start);
        }
        fa.setStartStates(List.of(start));
        return fa;
    }

    /**
     * Route every missing (state, input symbol) pair to a fresh non-accepting sink that loops on
     * every input symbol. No-op when already complete or when there are no input symbols.
     */
    public static FiniteAutomaton complete(FiniteAutomaton fa) {
        if (Classification.isComplete(fa)) {
            return fa;
        }
        final Set<String> inputs = fa.getInputSymbols();
        if (inputs.isEmpty()) {
            return fa;
        }
        final String sink = fa.freshState(SINK_LABEL);
        fa.addState(sink);

        // the sink is included here, which gives it its self-loops
        for (String state : new ArrayList<>(fa.getStates())) {
            for (String symbol : inputs) {
                if (!fa.hasTransition(state, symbol)) {
                    fa.addTransition(state, symbol, sink);
                }
            }
        }
        return fa;
    }
}
