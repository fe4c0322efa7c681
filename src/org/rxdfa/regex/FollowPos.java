/* @LICENSE@
 */
package org.rxdfa.regex;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdfa.regex.AST.Cat;
import org.rxdfa.regex.AST.Node;
import org.rxdfa.regex.AST.Star;
import org.rxdfa.regex.AST.Visitor.TraversalOrder;
import org.rxdfa.regex.Annotator.NodeAttributes;

/**
 * Derives the followpos relation from an annotated tree. Only two kinds of
 * node make one position follow another:
 * <ul>
 * <li><code>c1 c2</code>: every position in lastpos(c1) is followed by every
 * position in firstpos(c2).</li>
 * <li><code>c*</code>: every position in lastpos(c*) is followed by every
 * position in firstpos(c*).</li>
 * </ul>
 */
final class FollowPos {

    private static final Logger logger = Logger.getLogger("org.rxdfa.regex");
    private static final Level level = Level.FINER;

    private FollowPos() {}

    static void compute(Node root,
            final Map<Node, NodeAttributes> nodeAttr,
            final Positions positions) {

        new AST.Visitor(TraversalOrder.TOP_DOWN) {

            @Override
            protected void visit(Cat node) {
                NodeAttributes first = nodeAttr.get(node.first);
                NodeAttributes second = nodeAttr.get(node.second);
                for (int p : first.lastpos()) {
                    positions.addFollow(p, second.firstpos());
                }
            }

            @Override
            protected void visit(Star node) {
                NodeAttributes na = nodeAttr.get(node);
                for (int p : na.lastpos()) {
                    positions.addFollow(p, na.firstpos());
                }
            }

        }.walk(root);

        if (logger.isLoggable(level)) {
            logger.log(level, positions.toString());
        }
    }
}
