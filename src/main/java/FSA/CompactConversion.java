package FSA;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import FSA.Model.FiniteAutomaton;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Conversions into AutomataLib's compact automata, used to cross-check results against
 * AutomataLib's own subset construction.
 */
public class CompactConversion {

    public static CompactNFA<String> toCompactNFA(FiniteAutomaton fa) {
        return toCompactNFA(fa, Alphabets.fromCollection(fa.getInputSymbols()));
    }

    /**
     * Epsilon-free NFA with the same language. Initial states are the closure of the start states,
     * each transition target is expanded by its closure, and a state accepts if its closure does.
     * @param alphabet input symbols to carry over; transitions on other symbols are dropped
     */
    public static CompactNFA<String> toCompactNFA(FiniteAutomaton fa, Alphabet<String> alphabet) {
        final Map<String, SortedSet<String>> closures = EpsilonClosure.all(fa);
        final CompactNFA<String> nfa = new CompactNFA<>(alphabet, fa.size());
        final Object2IntMap<String> ids = new Object2IntOpenHashMap<>(fa.size());

        for (String s : fa.getStates()) {
            boolean accepting = false;
            for (String c : closures.get(s)) {
                accepting |= fa.isAccepting(c);
            }
            ids.put(s, (int) nfa.addState(accepting));
        }
        for (String s : EpsilonClosure.of(fa, fa.getStartStates())) {
            if (ids.containsKey(s)) {
                nfa.setInitial(ids.getInt(s), true);
            }
        }
        for (String s : fa.getStates()) {
            for (String a : alphabet) {
                Set<String> targets = new TreeSet<>();
                for (String p : closures.get(s)) {
                    targets.addAll(EpsilonClosure.of(fa, fa.getTransitions(p, a)));
                }
                for (String t : targets) {
                    if (ids.containsKey(t)) {
                        nfa.addTransition(ids.getInt(s), a, ids.getInt(t));
                    }
                }
            }
        }
        return nfa;
    }

    /**
     * Direct conversion of a deterministic automaton with at most one start state.
     * The result is partial wherever {@code fa} is.
     */
    public static CompactDFA<String> toCompactDFA(FiniteAutomaton fa) {
        if (!Classification.isDeterministic(fa)) {
            throw new IllegalArgumentException("Automaton is not deterministic");
        }
        if (fa.getStartStates().size() > 1) {
            throw new IllegalArgumentException("Automaton has " + fa.getStartStates().size() + " start states");
        }
        final Alphabet<String> alphabet = Alphabets.fromCollection(fa.getInputSymbols());
        final CompactDFA<String> dfa = new CompactDFA<>(alphabet, fa.size());
        final Object2IntMap<String> ids = new Object2IntOpenHashMap<>(fa.size());

        for (String s : fa.getStates()) {
            int id = fa.isStart(s) ? dfa.addInitialState(fa.isAccepting(s)) : dfa.addState(fa.isAccepting(s));
            ids.put(s, id);
        }
        for (String s : fa.getStates()) {
            for (String a : alphabet) {
                for (String t : fa.getTransitions(s, a)) {
                    dfa.setTransition(ids.getInt(s), alphabet.getSymbolIndex(a), ids.getInt(t));
                }
            }
        }
        return dfa;
    }

    /**
     * Language equivalence over the union of both input alphabets, decided by AutomataLib on the
     * total DFAs of its own subset construction.
     */
    public static boolean testEquivalence(FiniteAutomaton a, FiniteAutomaton b) {
        final Collection<String> symbols = new TreeSet<>(a.getInputSymbols());
        symbols.addAll(b.getInputSymbols());
        final Alphabet<String> alphabet = Alphabets.fromCollection(symbols);

        final CompactDFA<String> dfaA = NFAs.determinize(toCompactNFA(a, alphabet), alphabet, false, false);
        final CompactDFA<String> dfaB = NFAs.determinize(toCompactNFA(b, alphabet), alphabet, false, false);
        return Automata.testEquivalence(dfaA, dfaB, alphabet);
    }
}
