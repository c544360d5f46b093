package FSA;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import FSA.Model.FiniteAutomaton;
import FSA.Model.Property;

public class Classification {
    public static final String NOT_RECOGNIZED = "not recognized";

    /**
     * At most one destination per (state, symbol) and no epsilon transitions.
     * A state without transitions does not break determinism.
     */
    public static boolean isDeterministic(FiniteAutomaton fa) {
        for (String state : fa.getSourceStates()) {
            for (Map.Entry<String, Set<String>> cell : fa.getTransitions(state).entrySet()) {
                if (FiniteAutomaton.EPSILON.equals(cell.getKey()) || cell.getValue().size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Every state has a transition on every input symbol (epsilon excluded).
     * A state with no transitions at all is incomplete even over an empty alphabet.
     */
    public static boolean isComplete(FiniteAutomaton fa) {
        Set<String> inputs = fa.getInputSymbols();
        for (String state : fa.getStates()) {
            if (!fa.hasTransitions(state)) {
                return false;
            }
            for (String symbol : inputs) {
                if (!fa.hasTransition(state, symbol)) {
                    return false;
                }
            }
        }
        return true;
    }

    public static boolean isStandard(FiniteAutomaton fa) {
        return fa.getStartStates().size() == 1;
    }

    public static EnumSet<Property> properties(FiniteAutomaton fa) {
        EnumSet<Property> result = EnumSet.noneOf(Property.class);
        if (isDeterministic(fa)) {
            result.add(Property.DETERMINISTIC);
        }
        if (isComplete(fa)) {
            result.add(Property.COMPLETE);
        }
        if (isStandard(fa)) {
            result.add(Property.STANDARD);
        }
        return result;
    }

    /**
     * Space-separated labels of the properties that hold, in fixed order, or "not recognized".
     */
    public static String classify(FiniteAutomaton fa) {
        EnumSet<Property> props = properties(fa);
        if (props.isEmpty()) {
            return NOT_RECOGNIZED;
        }
        return props.stream().map(Property::getLabel).collect(Collectors.joining(" "));
    }
}
