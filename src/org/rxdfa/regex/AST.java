/* @LICENSE@
 */
package org.rxdfa.regex;

import static org.rxdfa.regex.Misc.LS;

import java.util.Stack;

import org.rxdfa.regex.AST.Visitor.TraversalOrder;

/**
 * Uninstantiable class which serves as a source container for the static
 * classes and static methods used the construction of Abstract Syntax Trees.
 * <p>
 * Every traversal goes through {@link Visitor#walk(Node)}, which keeps its
 * own stack of pending nodes; the depth of a tree is therefore bounded by the
 * heap, not by the call stack.
 */
final class AST {

    /** The symbol of the terminal appended to every parsed expression. */
    static final char END_MARKER = '#';

    static abstract class Node {

        final Node copy() {
            return new CopyVisitor().copy(this);
        }

        final String toTreeString() {
            final StringBuilder sb = new StringBuilder();
            new TreePrinter(sb).print(this);
            return sb.toString();
        }

        /**
         * The equals relation is always the identity relation for all Node
         * subclasses.
         */
        @Override
        public final boolean equals(Object o) {
            return super.equals(o);
        }
        @Override
        public final int hashCode() {
            return super.hashCode();
        }
    }

    static final class Terminal extends Node {

        final char symbol;

        private Terminal(char symbol) {
            this.symbol = symbol;
        }

        @Override
        public String toString() {
            return String.valueOf(symbol);
        }
    }

    static abstract class NonTerminal extends Node {

        abstract Node[] children();
    }

    static abstract class Unary extends NonTerminal {

        final Node child;
        private Unary(Node child) {
            assert child != null;
            this.child = child;
        }

        @Override
        final Node[] children() {
            return new Node[] {child};
        }
    }

    static final class Star extends Unary {

        private Star(Node child) {
            super(child);
        }
    }

    static abstract class Binary extends NonTerminal {

        final Node first, second;

        private Binary(Node first, Node second) {
            assert first != null && second != null;
            this.first = first;
            this.second = second;
        }

        @Override
        final Node[] children() {
            return new Node[] {first, second};
        }
    }

    static final class Cat extends Binary {

        private Cat(Node first, Node second) {
            super(first, second);
        }
    }

    static final class Alt extends Binary {

        private Alt(Node first, Node second) {
            super(first, second);
        }
    }

    static abstract class Visitor {

        enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP;
        }

        /*
         * one pending node on the walk stack; expanded once its children
         * have been pushed (BOTTOM_UP only)
         */
        private static final class Frame {
            final Node node;
            final int depth;
            boolean expanded;

            Frame(Node node, int depth) {
                this.node = node;
                this.depth = depth;
            }
        }

        private final TraversalOrder order;
        private int depth = 0;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        /**
         * Visits every node of the tree rooted at <code>root</code>, parents
         * before children (TOP_DOWN) or children before parents (BOTTOM_UP).
         * Children are always visited first to last.
         */
        protected final void walk(Node root) {
            final Stack<Frame> stack = new Stack<Frame>();
            stack.push(new Frame(root, 0));
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (order == TraversalOrder.TOP_DOWN) {
                    stack.pop();
                    depth = frame.depth;
                    visit(frame.node);
                    pushChildren(stack, frame);
                } else if (frame.expanded || frame.node instanceof Terminal) {
                    stack.pop();
                    depth = frame.depth;
                    visit(frame.node);
                } else {
                    frame.expanded = true;
                    pushChildren(stack, frame);
                }
            }
        }

        private static void pushChildren(Stack<Frame> stack, Frame frame) {
            if (frame.node instanceof NonTerminal) {
                Node[] children = ((NonTerminal) frame.node).children();
                for (int i = children.length - 1; i >= 0; --i) {
                    stack.push(new Frame(children[i], frame.depth + 1));
                }
            }
        }

        /**
         * @return the distance from the root of the node being visited.
         */
        protected final int depth() {
            return depth;
        }

        /*
         * multi-dispatch:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         */

        protected void visit(Node node) {
            if (node instanceof NonTerminal) {
                visit((NonTerminal) node);
            } else if (node instanceof Terminal) {
                visit((Terminal) node);
            } else {
                error(node);
            }
        }

        protected void visit(NonTerminal node) {
            if (node instanceof Binary) {
                visit((Binary) node);
            } else if (node instanceof Unary){
                visit((Unary) node);
            } else {
                error(node);
            }
        }

        protected void visit(Binary node) {
            if (node instanceof Cat) {
                visit((Cat) node);
            } else if (node instanceof Alt) {
                visit((Alt) node);
            } else {
                error(node);
            }
        }

        protected void visit(Unary node) {
            if (node instanceof Star) {
                visit((Star) node);
            } else error(node);
        }

        protected void visit(Cat node) {}
        protected void visit(Alt node) {}
        protected void visit(Star node) {}

        protected void visit(Terminal node) {}

        private static void error(Node node) {
            throw new IllegalStateException("unknown node type " + node);
        }
    }

    /**
     * Indented dump of a tree, one node per line, for logs and test failure
     * messages.
     */
    static final class TreePrinter extends Visitor {

        private static final String INDENT = "    ";

        private final StringBuilder sb;

        TreePrinter(StringBuilder sb) {
            super(TraversalOrder.TOP_DOWN);
            this.sb = sb;
        }

        void print(Node root) {
            walk(root);
        }

        private void line(String label) {
            for (int i = 0; i < depth(); ++i) {
                sb.append(INDENT);
            }
            sb.append(label).append(LS);
        }

        @Override
        protected void visit(Cat node) {
            line("&");
        }

        @Override
        protected void visit(Alt node) {
            line("|");
        }

        @Override
        protected void visit(Star node) {
            line("*");
        }

        @Override
        protected void visit(Terminal node) {
            line(node.toString());
        }
    }


    /*
     * static factories of convenience for parser and testing
     */

    static Terminal terminal(char c) {
        return new Terminal(c);
    }

    static Terminal endMarker() {
        return new Terminal(END_MARKER);
    }

    static Node literal(String s) {
        Node root = null;
        for (char c : s.toCharArray()) {
            root = root == null ? terminal(c) : new Cat(root, terminal(c));
        }
        return root;
    }

    static Node cat(Node... nodes) {
        Node root = null;
        for (Node node : nodes) {
            if (root == null) {
                root = node;
            } else {
                root = new Cat(root, node);
            }
        }
        return root;
    }

    static Node alt(Node... nodes) {
        Node root = null;
        for (Node node : nodes) {
            if (root == null) {
                root = node;
            } else {
                root = new Alt(root, node);
            }
        }
        return root;
    }

    static Star star(Node child) {
        return new Star(child);
    }

    /**
     * <code>x+</code> as <code>x x*</code>. The starred operand is a deep copy,
     * so each occurrence of <code>x</code> owns its own terminals (and later
     * its own positions).
     */
    static Cat plus(Node child) {
        return new Cat(child, new Star(child.copy()));
    }

    /**
     * @return the number of terminals in the tree rooted at <code>root</code>
     */
    static int terminals(Node root) {
        final int[] n = {0};
        new Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visit(Terminal node) {
                ++n[0];
            }
        }.walk(root);
        return n[0];
    }

    static final class CopyVisitor extends Visitor {

        private final Stack<Node> kids = new Stack<Node>();

        CopyVisitor() {
            super(TraversalOrder.BOTTOM_UP);
        }

        private void push(Node node) {
            kids.push(node);
        }

        Node copy(Node node) {
            assert node != null;
            walk(node);
            assert kids.size() == 1;
            return kids.pop();
        }

        @Override
        protected void visit(Terminal node) {
            push(new Terminal(node.symbol));
        }
        @Override
        protected void visit(Cat node) {
            Node second = kids.pop();
            Node first = kids.pop();
            push(new Cat(first, second));
        }
        @Override
        protected void visit(Alt node) {
            Node second = kids.pop();
            Node first = kids.pop();
            push(new Alt(first, second));
        }
        @Override
        protected void visit(Star node) {
            push(new Star(kids.pop()));
        }
    }

    private AST() {}    // uninstantiable
}
