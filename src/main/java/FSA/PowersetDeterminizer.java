package FSA;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import FSA.Model.DeterminizeRecord;
import FSA.Model.FiniteAutomaton;
import FSA.Registry.AddressRegistry;
import FSA.Registry.Registry;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Subset construction over automata with epsilon transitions and any number of start states.
 * Subsets are BitSets over a sorted enumeration of the original labels. Subsets are discovered
 * breadth-first, symbols in sorted order, and named {@code S0, S1, ...} in discovery order;
 * {@code S0} is always the start state.
 */
public class PowersetDeterminizer {
    public static boolean DEBUG = false;
    public static final String STATE_PREFIX = "S";

    private final FiniteAutomaton nfa;
    private final List<String> labels;
    private final Object2IntMap<String> labelIndex;
    private final BitSet[] closures;

    private PowersetDeterminizer(FiniteAutomaton nfa) {
        this.nfa = nfa;

        this.labels = labelUniverse(nfa);
        this.labelIndex = new Object2IntOpenHashMap<>(labels.size());
        this.labelIndex.defaultReturnValue(Registry.MISSING_ELEMENT);
        for (int i = 0; i < labels.size(); i++) {
            labelIndex.put(labels.get(i), i);
        }

        this.closures = new BitSet[labels.size()];
        for (int i = 0; i < labels.size(); i++) {
            closures[i] = toBitSet(EpsilonClosure.of(nfa, labels.get(i)));
        }
    }

    /**
     * Deterministic equivalent of {@code nfa}. The input is left untouched; an automaton that is
     * already deterministic comes back as a copy.
     */
    public static FiniteAutomaton determinize(FiniteAutomaton nfa) {
        return determinize(nfa, new AddressRegistry());
    }

    /**
     * As {@link #determinize(FiniteAutomaton)}, recording each subset under the address that names it
     * (see {@link #labelUniverse}). Pass an empty registry; addresses are used as state names.
     * The registry is left untouched when the input is already deterministic.
     */
    public static FiniteAutomaton determinize(FiniteAutomaton nfa, Registry registry) {
        if (Classification.isDeterministic(nfa)) {
            return nfa.copy();
        }
        return new PowersetDeterminizer(nfa).doDeterminize(registry);
    }

    /**
     * Sorted enumeration of every label {@code nfa} mentions. Bit {@code i} of a registered subset
     * stands for element {@code i} of this list.
     */
    public static List<String> labelUniverse(FiniteAutomaton nfa) {
        // undeclared labels still get an index, so loosely-built input cannot break the construction
        SortedSet<String> universe = new TreeSet<>(nfa.getStates());
        universe.addAll(nfa.getStartStates());
        for (String s : nfa.getSourceStates()) {
            universe.add(s);
            for (Collection<String> dests : nfa.getTransitions(s).values()) {
                universe.addAll(dests);
            }
        }
        return new ArrayList<>(universe);
    }

    public static String stateName(int address) {
        return STATE_PREFIX + address;
    }

    private FiniteAutomaton doDeterminize(Registry registry) {
        final Collection<String> inputs = nfa.getInputSymbols();
        final FiniteAutomaton out = new FiniteAutomaton();
        for (String symbol : inputs) {
            out.addSymbol(symbol);
        }

        Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        // union of the closures of all start states
        BitSet init = new BitSet();
        for (String s : nfa.getStartStates()) {
            init.or(closures[labelIndex.getInt(s)]);
        }
        int initOut = registry.put(init);
        out.addState(stateName(initOut));
        out.addStartState(stateName(initOut));
        queue.offer(new DeterminizeRecord(init, initOut));

        while (!queue.isEmpty()) {
            DeterminizeRecord curr = queue.poll();
            BitSet inState = curr.subset();
            String outState = stateName(curr.address());

            if (isAccepting(inState)) {
                out.addAcceptState(outState);
            }
            if (DEBUG) {
                System.out.println("DEBUG: " + outState + " = " + curr.describe(labels));
            }

            for (String sym : inputs) {
                BitSet succ = getSuccessor(inState, sym);
                if (succ.isEmpty()) {
                    continue;
                }
                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // add new state to DFA and to queue
                    outSucc = registry.put(succ);
                    out.addState(stateName(outSucc));
                    queue.offer(new DeterminizeRecord(succ, outSucc));
                }
                out.addTransition(outState, sym, stateName(outSucc));
            }
        }

        if (DEBUG) {
            System.out.println("DEBUG: " + nfa.size() + " states determinized into " + out.size());
        }
        return out;
    }

    /**
     * Epsilon closure of the direct {@code sym}-successors of every member of {@code subset}.
     */
    private BitSet getSuccessor(BitSet subset, String sym) {
        BitSet result = new BitSet();
        for (int i = subset.nextSetBit(0); i >= 0; i = subset.nextSetBit(i + 1)) {
            for (String dest : nfa.getTransitions(labels.get(i), sym)) {
                int d = labelIndex.getInt(dest);
                if (!result.get(d)) {
                    result.or(closures[d]);
                }
            }
        }
        return result;
    }

    private boolean isAccepting(BitSet subset) {
        for (int i = subset.nextSetBit(0); i >= 0; i = subset.nextSetBit(i + 1)) {
            if (nfa.isAccepting(labels.get(i))) {
                return true;
            }
        }
        return false;
    }

    private BitSet toBitSet(Collection<String> states) {
        BitSet result = new BitSet(labels.size());
        for (String s : states) {
            result.set(labelIndex.getInt(s));
        }
        return result;
    }
}
