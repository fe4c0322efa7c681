/*
 * @LICENSE@
 */

package org.rxdfa.regex;

import java.util.IdentityHashMap;
import java.util.LinkedList;
import java.util.Map;
import java.util.Queue;
import java.util.Set;


/**
 * Small helpers shared by the construction classes: string idioms and a
 * generic breadth first digraph visitor.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * {1,2,3} - the label used for position sets in listings and logs
     */
    static String labelOf(Set<Integer> positions) {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        for (int p : positions) {
            if (sb.length() > 1) sb.append(',');
            sb.append(p);
        }
        return sb.append('}').toString();
    }

    static <K, V extends Set<Integer>> String stringFrom(String title, Map<K, V> map) {
        StringBuilder sb = new StringBuilder();
        sb.append("map: ").append(title).append(LS);
        for (Map.Entry<K, V> e : map.entrySet()) {
            sb.append("    ").append(e.getKey()).append(" --> ")
                .append(labelOf(e.getValue())).append(LS);
        }
        return sb.toString();
    }

    /*
     * Generic digraph visitor
     */
    interface Vertex<E extends Edge<?>> {
        Iterable<E> edges();
    }
    interface Edge<V extends Vertex<?>> {
        V vertex();
    }

    /**
     * Visits each vertex reachable from the start vertex exactly once, in
     * breadth first order. {@link #visit(Vertex)} is called before the edges
     * of a vertex are read, so a subclass may discover the edges (and the
     * vertices they lead to) lazily from inside <code>visit</code>.
     */
    static abstract class BreadthFirstVisitor<V extends Vertex<E>, E extends Edge<V>> {

        private final Map<V, Void> discovered = new IdentityHashMap<V, Void>();
        private final Queue<V> queue = new LinkedList<V>();

        final BreadthFirstVisitor<V, E> start(V init) {
            discovered.clear(); queue.clear();
            discover(init);
            while (!queue.isEmpty()) {
                V vertex = queue.remove();
                visit(vertex);
                for (E edge : vertex.edges()) {
                    if (!discovered.containsKey(edge.vertex())) {
                        discover(edge.vertex());
                    }
                }
            }
            return this;
        }

        private void discover(V vertex) {
            discovered.put(vertex, null);
            queue.add(vertex);
        }

        protected abstract void visit(V vertex);
    }
}
