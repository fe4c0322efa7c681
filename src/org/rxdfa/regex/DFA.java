/* @LICENSE@
 */


package org.rxdfa.regex;


import static org.rxdfa.regex.Misc.LS;
import static org.rxdfa.regex.Misc.labelOf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdfa.regex.Misc.BreadthFirstVisitor;
import org.rxdfa.regex.Misc.Edge;
import org.rxdfa.regex.Misc.Vertex;
import org.rxdfa.regex.RegexDfa.ConversionException;



/**
 * DFA built directly from position sets. Each state stands for the set of
 * positions which may match the next input symbol; two states are the same
 * state iff their position sets are equal.
 */
final class DFA {

    private static final Logger logger = Logger.getLogger("org.rxdfa.regex");
    private static final Level level = Level.FINEST;

    /**
     * An entry in the transition table: a symbol mapped to a next state.
     */
    static final class Arc implements Edge<State> {

        final char symbol;
        final State ns;

        private Arc(char symbol, State ns) {
            this.symbol = symbol;
            this.ns = ns;
        }

        public State vertex() {
            return ns;
        }

        @Override
        public String toString() {
            return "{symbol:" + symbol + ", ns:" + ns.toLabel() + '}';
        }
    }


    static final class State implements Vertex<Arc> {

        private static final Arc[] NO_ARCS = new Arc[0];

        final int index;
        final SortedSet<Integer> positions;
        final boolean accept;
        private Arc[] arcs = NO_ARCS;

        private State(int index, SortedSet<Integer> positions, boolean accept) {
            this.index = index;
            this.positions = positions;
            this.accept = accept;
        }
        private void arcs(Arc[] arcs) {
            this.arcs = arcs;
        }
        public Iterable<Arc> edges() {
            return Collections.unmodifiableList(Arrays.asList(arcs));
        }

        String toLabel() {
            return labelOf(positions);
        }

        private static final String INDENT = "    ";

        @Override
        public String toString() {

            StringBuilder sb = new StringBuilder();

            sb.append("state ").append(index).append(": ");
            sb.append(toLabel()).append(' ');
            if (accept)         sb.append("(accept) ");
            sb.append(LS);

            for (Arc arc : arcs) {
                sb.append(INDENT).append(arc).append(LS);
            }

            return sb.toString();
        }
    }

    final State init;
    private final List<State> states;

    /**
     * Construct the DFA for an annotated tree.
     *
     * @param positions
     *            position and followpos tables of the tree
     * @param start
     *            firstpos of the root
     * @param maxStates
     *            the most states the DFA may have
     * @throws ConversionException
     *             if more than <code>maxStates</code> states are needed.
     */
    DFA(final Positions positions, SortedSet<Integer> start, final int maxStates) {

        final class StateFactory {

            private final Map<SortedSet<Integer>, State> map =
                new LinkedHashMap<SortedSet<Integer>, State>();

            private State stateFrom(SortedSet<Integer> set) {
                State state = map.get(set);
                if (state == null) {
                    if (map.size() >= maxStates) {
                        throw new ConversionException(
                            new ConversionError.TooManyStates(maxStates));
                    }
                    SortedSet<Integer> key =
                        Collections.unmodifiableSortedSet(new TreeSet<Integer>(set));
                    state = new State(
                        map.size(), key, key.contains(positions.endMarker()));
                    map.put(key, state);
                }
                return state;
            }
        }
        final StateFactory factory = new StateFactory();

        init = factory.stateFrom(start);

        /*
         * Worklist construction as breadth first search: states are numbered
         * when first met, and visited in that same order.
         */
        new BreadthFirstVisitor<State, Arc>() {

            final SortedMap<Character, SortedSet<Integer>> sigma =
                new TreeMap<Character, SortedSet<Integer>>();

            /*
             * Create all the arcs for the state already discovered.
             */
            @Override
            protected void visit(State state) {

                sigma.clear();
                for (int p : state.positions) {
                    if (positions.isEndMarker(p)) continue;
                    char symbol = positions.symbolAt(p);
                    SortedSet<Integer> next = sigma.get(symbol);
                    if (next == null) {
                        next = new TreeSet<Integer>();
                        sigma.put(symbol, next);
                    }
                    next.addAll(positions.followpos(p));
                }

                Arc[] arcs = new Arc[sigma.size()];
                int i = 0;
                for (Map.Entry<Character, SortedSet<Integer>> e : sigma.entrySet()) {
                    arcs[i++] = new Arc(e.getKey(), factory.stateFrom(e.getValue()));
                }
                state.arcs(arcs);
            }
        }.start(init);

        states = Collections.unmodifiableList(
            new ArrayList<State>(factory.map.values()));

        assert init.index == 0;

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + toString());
        }
    }

    List<State> states() {
        return states;
    }

    int size() {
        return states.size();
    }

    /**
     * @return the immutable, index based form of this DFA.
     */
    Automaton toAutomaton() {
        List<SortedMap<Character, Integer>> transitions =
            new ArrayList<SortedMap<Character, Integer>>(states.size());
        List<SortedSet<Integer>> positionSets =
            new ArrayList<SortedSet<Integer>>(states.size());
        SortedSet<Integer> accepting = new TreeSet<Integer>();

        for (State state : states) {
            SortedMap<Character, Integer> map = new TreeMap<Character, Integer>();
            for (Arc arc : state.arcs) {
                map.put(arc.symbol, arc.ns.index);
            }
            transitions.add(map);
            positionSets.add(state.positions);
            if (state.accept) accepting.add(state.index);
        }
        return new Automaton(transitions, positionSets, accepting);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int nArcs = 0;
        for (State state : states) nArcs += state.arcs.length;
        sb
            .append("total states: ").append(size())
            .append(" total arcs ").append(nArcs)
            .append(LS);
        for (State state : states) {
            sb.append(state);
        }
        return sb.toString();
    }
}
