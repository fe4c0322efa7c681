/*
 * @LICENSE@
 */

package org.rxdfa.regex;

import static org.rxdfa.regex.Misc.LS;
import static org.rxdfa.regex.Misc.labelOf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdfa.regex.AST.Alt;
import org.rxdfa.regex.AST.Cat;
import org.rxdfa.regex.AST.Node;
import org.rxdfa.regex.AST.Star;
import org.rxdfa.regex.AST.Terminal;
import org.rxdfa.regex.AST.Visitor.TraversalOrder;

/**
 * Computes the node attributes of the direct construction: the position of
 * each terminal, and nullable, firstpos and lastpos of every node. The rules
 * follow Chapter 3 of the Dragon book:
 *
 * <pre>
 *   node        nullable          firstpos                      lastpos
 *   terminal p  false             {p}                           {p}
 *   c1 c2       n(c1) &amp;&amp; n(c2)  fp(c1) + (n(c1) ? fp(c2) : {})  lp(c2) + (n(c2) ? lp(c1) : {})
 *   c1 | c2     n(c1) || n(c2)    fp(c1) + fp(c2)               lp(c1) + lp(c2)
 *   c*          true              fp(c)                         lp(c)
 * </pre>
 */
final class Annotator {

    private static final Logger logger = Logger.getLogger("org.rxdfa.regex");
    private static final Level level = Level.FINER;

    static final class NodeAttributes {

        private boolean nullable = false;
        private int position = 0;
        private final SortedSet<Integer> fp = new TreeSet<Integer>();
        private final SortedSet<Integer> lp = new TreeSet<Integer>();

        boolean nullable() {
            return nullable;
        }

        /**
         * @return the position of a terminal, 0 for non terminals.
         */
        int position() {
            return position;
        }

        SortedSet<Integer> firstpos() {
            return Collections.unmodifiableSortedSet(fp);
        }

        SortedSet<Integer> lastpos() {
            return Collections.unmodifiableSortedSet(lp);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("nullable=" + nullable).append(LS);
            sb.append('\t').append("fp: ").append(labelOf(fp)).append(LS);
            sb.append('\t').append("lp: ").append(labelOf(lp)).append(LS);
            return sb.toString();
        }
    }

    private Annotator() {}

    /**
     * Annotates every node of the tree rooted at <code>root</code>. Positions
     * are taken from <code>positions</code>, which must be fresh; the
     * terminal <code>endMarker</code> has its position recorded as the end
     * marker.
     *
     * @return the attributes of every node, in bottom up visiting order.
     * @throws IllegalStateException if a node is reachable twice from the
     *             root.
     */
    static Map<Node, NodeAttributes> annotate(
            final Node root,
            final Terminal endMarker,
            final Positions positions) {

        if (positions.size() != 0) {
            throw new IllegalArgumentException("positions already assigned");
        }

        final Map<Node, NodeAttributes> nodeAttr =
                new LinkedHashMap<Node, NodeAttributes>();

        new AST.Visitor(TraversalOrder.BOTTOM_UP) {

            @Override
            protected void visit(Node node) {
                NodeAttributes na = nodeAttr.put(node, new NodeAttributes());
                if (na != null) {
                    throw new IllegalStateException("reconvergence: node "
                            + node);
                }
                super.visit(node);
            }

            @Override
            protected void visit(Terminal node) {

                NodeAttributes na = nodeAttr.get(node);
                na.position = positions.assign(node.symbol);
                if (node == endMarker) {
                    positions.markEnd(na.position);
                }
                na.nullable = false;
                na.fp.add(na.position);
                na.lp.add(na.position);
            }

            @Override
            protected void visit(Cat node) {

                NodeAttributes na = nodeAttr.get(node);
                NodeAttributes na1 = nodeAttr.get(node.first);
                NodeAttributes na2 = nodeAttr.get(node.second);

                na.nullable = na1.nullable && na2.nullable;

                na.fp.addAll(na1.fp);
                if (na1.nullable) {
                    na.fp.addAll(na2.fp);
                }

                na.lp.addAll(na2.lp);
                if (na2.nullable) {
                    na.lp.addAll(na1.lp);
                }
            }

            @Override
            protected void visit(Alt node) {

                NodeAttributes na = nodeAttr.get(node);
                NodeAttributes na1 = nodeAttr.get(node.first);
                NodeAttributes na2 = nodeAttr.get(node.second);

                na.nullable = na1.nullable || na2.nullable;

                na.fp.addAll(na1.fp);
                na.fp.addAll(na2.fp);

                na.lp.addAll(na1.lp);
                na.lp.addAll(na2.lp);
            }

            @Override
            protected void visit(Star node) {

                NodeAttributes na = nodeAttr.get(node);
                NodeAttributes naChild = nodeAttr.get(node.child);

                na.nullable = true;
                na.fp.addAll(naChild.fp);
                na.lp.addAll(naChild.lp);
            }

        }.walk(root);

        if (positions.endMarker() == 0) {
            throw new IllegalStateException("end marker not in tree");
        }
        assert positions.endMarker() == positions.size()
            : "end marker is not the last position: " + positions;

        if (logger.isLoggable(level)) {
            logger.log(level, "npos: " + positions.size());
            logger.log(level, "root: " + nodeAttr.get(root));
        }
        return nodeAttr;
    }
}
