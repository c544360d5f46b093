package FSA;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import FSA.Model.FiniteAutomaton;

public class EpsilonClosure {
    /**
     * States reachable from {@code state} through zero or more epsilon transitions, {@code state} included.
     */
    public static SortedSet<String> of(FiniteAutomaton fa, String state) {
        SortedSet<String> closure = new TreeSet<>();
        closure.add(state);
        Deque<String> stack = new ArrayDeque<>();
        stack.push(state);

        while (!stack.isEmpty()) {
            String curr = stack.pop();
            for (String next : fa.getTransitions(curr, FiniteAutomaton.EPSILON)) {
                if (closure.add(next)) {
                    stack.push(next);
                }
            }
        }
        return closure;
    }

    /**
     * Union of the closures of {@code states}.
     */
    public static SortedSet<String> of(FiniteAutomaton fa, Collection<String> states) {
        SortedSet<String> closure = new TreeSet<>();
        for (String s : states) {
            if (!closure.contains(s)) {
                closure.addAll(of(fa, s));
            }
        }
        return closure;
    }

    /**
     * Closure of every declared state, in state order.
     */
    public static Map<String, SortedSet<String>> all(FiniteAutomaton fa) {
        Map<String, SortedSet<String>> result = new LinkedHashMap<>();
        for (String s : fa.getStates()) {
            result.put(s, of(fa, s));
        }
        return result;
    }
}
