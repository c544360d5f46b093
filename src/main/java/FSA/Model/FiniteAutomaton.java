package FSA.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finite automaton over string labels, possibly nondeterministic and with epsilon transitions.
 * States, symbols and destination sets are kept sorted so that every traversal (and every name
 * synthesized from one) is reproducible.
 * Each instance owns its collections; views handed out are unmodifiable.
 */
public class FiniteAutomaton {
    public static final String EPSILON = "ε";

    private final SortedSet<String> states = new TreeSet<>();
    private final SortedSet<String> alphabet = new TreeSet<>();
    private final SortedSet<String> startStates = new TreeSet<>();
    private final SortedSet<String> acceptStates = new TreeSet<>();
    // state -> symbol -> destinations; a present entry is never empty
    private final SortedMap<String, SortedMap<String, SortedSet<String>>> transitions = new TreeMap<>();

    public FiniteAutomaton() {
    }

    /**
     * Deep copy; nothing is shared with {@code other}.
     */
    public FiniteAutomaton(FiniteAutomaton other) {
        this.states.addAll(other.states);
        this.alphabet.addAll(other.alphabet);
        this.startStates.addAll(other.startStates);
        this.acceptStates.addAll(other.acceptStates);
        for (Map.Entry<String, SortedMap<String, SortedSet<String>>> row : other.transitions.entrySet()) {
            SortedMap<String, SortedSet<String>> rowCopy = new TreeMap<>();
            for (Map.Entry<String, SortedSet<String>> cell : row.getValue().entrySet()) {
                rowCopy.put(cell.getKey(), new TreeSet<>(cell.getValue()));
            }
            this.transitions.put(row.getKey(), rowCopy);
        }
    }

    public FiniteAutomaton copy() {
        return new FiniteAutomaton(this);
    }

    public void addState(String state) {
        states.add(Objects.requireNonNull(state));
    }

    public void addSymbol(String symbol) {
        alphabet.add(Objects.requireNonNull(symbol));
    }

    public void addStartState(String state) {
        startStates.add(Objects.requireNonNull(state));
    }

    public void addAcceptState(String state) {
        acceptStates.add(Objects.requireNonNull(state));
    }

    public void addTransition(String from, String symbol, String to) {
        Objects.requireNonNull(from);
        Objects.requireNonNull(symbol);
        Objects.requireNonNull(to);
        transitions.computeIfAbsent(from, k -> new TreeMap<>())
            .computeIfAbsent(symbol, k -> new TreeSet<>())
            .add(to);
    }

    /**
     * Replace the start-state set.
     */
    public void setStartStates(Collection<String> newStartStates) {
        startStates.clear();
        for (String s : newStartStates) {
            addStartState(s);
        }
    }

    public Set<String> getStates() {
        return Collections.unmodifiableSortedSet(states);
    }

    /**
     * Declared alphabet, epsilon included if it was declared.
     */
    public Set<String> getAlphabet() {
        return Collections.unmodifiableSortedSet(alphabet);
    }

    /**
     * Declared alphabet without epsilon. Completeness and subset construction range over these.
     */
    public SortedSet<String> getInputSymbols() {
        SortedSet<String> inputs = new TreeSet<>(alphabet);
        inputs.remove(EPSILON);
        return inputs;
    }

    public Set<String> getStartStates() {
        return Collections.unmodifiableSortedSet(startStates);
    }

    public Set<String> getAcceptStates() {
        return Collections.unmodifiableSortedSet(acceptStates);
    }

    public boolean isStart(String state) {
        return startStates.contains(state);
    }

    public boolean isAccepting(String state) {
        return acceptStates.contains(state);
    }

    /**
     * Whether any transition (epsilon included) leaves {@code state}.
     */
    public boolean hasTransitions(String state) {
        return transitions.containsKey(state);
    }

    public boolean hasTransition(String state, String symbol) {
        SortedMap<String, SortedSet<String>> row = transitions.get(state);
        return row != null && row.containsKey(symbol);
    }

    /**
     * Outgoing transitions of {@code state} by symbol; empty if there are none.
     * Neither the map nor its destination sets can be modified.
     */
    public Map<String, Set<String>> getTransitions(String state) {
        SortedMap<String, SortedSet<String>> row = transitions.get(state);
        if (row == null) {
            return Collections.emptyMap();
        }
        SortedMap<String, Set<String>> view = new TreeMap<>();
        for (Map.Entry<String, SortedSet<String>> cell : row.entrySet()) {
            view.put(cell.getKey(), Collections.unmodifiableSortedSet(cell.getValue()));
        }
        return Collections.unmodifiableSortedMap(view);
    }

    /**
     * Destinations of {@code state} on {@code symbol}; empty if undefined.
     */
    public Set<String> getTransitions(String state, String symbol) {
        SortedMap<String, SortedSet<String>> row = transitions.get(state);
        if (row == null) {
            return Collections.emptySet();
        }
        SortedSet<String> dests = row.get(symbol);
        return dests == null ? Collections.emptySet() : Collections.unmodifiableSortedSet(dests);
    }

    /**
     * States with at least one outgoing transition.
     */
    public Set<String> getSourceStates() {
        return Collections.unmodifiableSet(transitions.keySet());
    }

    /**
     * A label not used anywhere, transition destinations included: {@code base}, else
     * {@code base1}, {@code base2}, ...
     */
    public String freshState(String base) {
        if (!isUsed(base)) {
            return base;
        }
        int suffix = 1;
        while (isUsed(base + suffix)) {
            suffix++;
        }
        return base + suffix;
    }

    private boolean isUsed(String label) {
        if (states.contains(label) || startStates.contains(label)
            || acceptStates.contains(label) || transitions.containsKey(label)) {
            return true;
        }
        for (SortedMap<String, SortedSet<String>> row : transitions.values()) {
            for (SortedSet<String> dests : row.values()) {
                if (dests.contains(label)) {
                    return true;
                }
            }
        }
        return false;
    }

    public int size() {
        return states.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FiniteAutomaton)) {
            return false;
        }
        FiniteAutomaton other = (FiniteAutomaton) o;
        return states.equals(other.states)
            && alphabet.equals(other.alphabet)
            && startStates.equals(other.startStates)
            && acceptStates.equals(other.acceptStates)
            && transitions.equals(other.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, startStates, acceptStates, transitions);
    }

    @Override
    public String toString() {
        return "FiniteAutomaton{states=" + states
            + ", alphabet=" + alphabet
            + ", start=" + startStates
            + ", accept=" + acceptStates
            + ", transitions=" + transitions + "}";
    }
}
