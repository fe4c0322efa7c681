/* @LICENSE@
 */
package org.rxdfa.regex;

import static org.rxdfa.regex.Misc.LS;
import static org.rxdfa.regex.Misc.labelOf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A deterministic finite automaton as produced by
 * {@link RegexDfa#convert(String)}. States are numbered from 0 in the order the
 * construction discovered them; state 0 is the start state. Each state has a
 * transition map from symbol to next state, with symbols in ascending order,
 * and the set of positions of the regular expression it was built from.
 * <p>
 * Instances are immutable and thread safe.
 */
public final class Automaton {

    /**
     * Returned by {@link #next(int, char)} when a state has no transition on a
     * symbol.
     */
    public static final int DEAD = -1;

    private final List<SortedMap<Character, Integer>> states;
    private final List<SortedSet<Integer>> positions;
    private final SortedSet<Integer> accepting;

    Automaton(List<SortedMap<Character, Integer>> states,
              List<SortedSet<Integer>> positions,
              SortedSet<Integer> accepting) {
        assert states.size() == positions.size();
        List<SortedMap<Character, Integer>> s =
            new ArrayList<SortedMap<Character, Integer>>(states.size());
        for (SortedMap<Character, Integer> map : states) {
            s.add(Collections.unmodifiableSortedMap(
                new TreeMap<Character, Integer>(map)));
        }
        List<SortedSet<Integer>> p =
            new ArrayList<SortedSet<Integer>>(positions.size());
        for (SortedSet<Integer> set : positions) {
            p.add(Collections.unmodifiableSortedSet(new TreeSet<Integer>(set)));
        }
        this.states = Collections.unmodifiableList(s);
        this.positions = Collections.unmodifiableList(p);
        this.accepting = Collections.unmodifiableSortedSet(
            new TreeSet<Integer>(accepting));
    }

    /**
     * @return the number of states
     */
    public int size() {
        return states.size();
    }

    /**
     * @return the transition map of every state, indexed by state.
     */
    public List<SortedMap<Character, Integer>> states() {
        return states;
    }

    public SortedMap<Character, Integer> transitions(int state) {
        return states.get(state);
    }

    /**
     * @return the state reached from <code>state</code> on
     *         <code>symbol</code>, or {@link #DEAD}.
     */
    public int next(int state, char symbol) {
        Integer ns = states.get(state).get(symbol);
        return ns == null ? DEAD : ns;
    }

    public SortedSet<Integer> accepting() {
        return accepting;
    }

    public boolean isAccepting(int state) {
        return accepting.contains(state);
    }

    /**
     * @return the positions of the regular expression which make up
     *         <code>state</code>.
     */
    public SortedSet<Integer> positions(int state) {
        return positions.get(state);
    }

    /**
     * @return every symbol which labels at least one transition.
     */
    public SortedSet<Character> alphabet() {
        SortedSet<Character> ret = new TreeSet<Character>();
        for (SortedMap<Character, Integer> map : states) {
            ret.addAll(map.keySet());
        }
        return Collections.unmodifiableSortedSet(ret);
    }

    /**
     * Runs the automaton over <code>input</code> from the start state.
     *
     * @return true iff the whole input leads to an accepting state.
     */
    public boolean accepts(CharSequence input) {
        int state = 0;
        for (int i = 0; i < input.length(); ++i) {
            state = next(state, input.charAt(i));
            if (state == DEAD) return false;
        }
        return isAccepting(state);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Automaton)) return false;
        Automaton that = (Automaton) o;
        return states.equals(that.states)
            && positions.equals(that.positions)
            && accepting.equals(that.accepting);
    }

    @Override
    public int hashCode() {
        return (states.hashCode() * 31 + positions.hashCode()) * 31
            + accepting.hashCode();
    }

    private static final String INDENT = "    ";

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int nArcs = 0;
        for (SortedMap<Character, Integer> map : states) nArcs += map.size();
        sb
            .append("total states: ").append(size())
            .append(" total arcs ").append(nArcs)
            .append(LS);
        for (int s = 0; s < size(); ++s) {
            sb.append("state ").append(s).append(": ")
                .append(labelOf(positions.get(s)));
            if (isAccepting(s)) sb.append(" (accept)");
            sb.append(LS);
            for (Map.Entry<Character, Integer> e : states.get(s).entrySet()) {
                sb.append(INDENT).append(e.getKey())
                    .append(" -> ").append(e.getValue()).append(LS);
            }
        }
        return sb.toString();
    }
}
