/* @LICENSE@
 */

package org.rxdfa.regex;

import static org.rxdfa.regex.AST.*;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdfa.regex.AST.Node;
import org.rxdfa.regex.AST.Star;
import org.rxdfa.regex.AST.Terminal;
import org.rxdfa.regex.AST.Visitor;
import org.rxdfa.regex.AST.Visitor.TraversalOrder;
import org.rxdfa.regex.RegexDfa.ConversionException;

/**
 * Parser for the expression syntax:
 *
 * <pre>
 * expression := term ('|' term)*
 * term       := factor+
 * factor     := base ('*' | '+')*
 * base       := '(' expression ')' | symbol
 * symbol     := letter | number | '#'
 * </pre>
 *
 * Open groups are kept on an explicit stack, so nesting depth is bounded by
 * the heap. A run of postfix operators is reduced to one: it is
 * <code>*</code> if any of them is, else <code>+</code>. Since every
 * <code>+</code> copies its operand, the parser counts the terminals it
 * creates and fails once the augmented expression would exceed
 * <code>maxPositions</code> positions.
 * <p>
 * The parsed expression is augmented as <code>(expression)#</code> with a
 * distinct end marker terminal. A parser instance parses exactly one
 * expression.
 */
final class RegexParser {

    private static final Logger logger = Logger.getLogger("org.rxdfa.regex");
    private static final Level level = Level.FINEST;

    static final class Result {
        Result(Node root, Terminal endMarker) {
            this.root = root;
            this.endMarker = endMarker;
        }
        final Node root;
        final Terminal endMarker;
    }

    /*
     * an open group: the alternatives closed so far, and the term being built
     */
    private static final class Group {
        Node alternatives;
        Node term;

        void append(Node factor) {
            term = term == null ? factor : cat(term, factor);
        }

        void endTerm() {
            assert term != null;
            alternatives = alternatives == null ? term : alt(alternatives, term);
            term = null;
        }

        Node close() {
            endTerm();
            return alternatives;
        }
    }

    private static final int EOX = -1;  // end of expression

    private final String regex;
    private final int maxPositions;

    /*
     * state for advance()
     */
    private int index;      // index of token in regex
    private int token;      // the lookahead char, or EOX
    private int npos;       // terminals created so far

    RegexParser(String regex) {
        this(regex, RegexDfa.DEFAULT_MAX_POSITIONS);
    }

    RegexParser(String regex, int maxPositions) {
        if (regex == null) throw new NullPointerException("regex");
        this.regex = regex;
        this.maxPositions = maxPositions;
        this.index = 0;
        this.token = regex.isEmpty() ? EOX : regex.charAt(0);
        this.npos = 0;
    }

    /**
     * @return true iff <code>c</code> is a letter, a number (decimal, letter
     *         or other) or the end marker symbol. Symbols are single UTF-16
     *         chars; supplementary code points are never symbols.
     */
    static boolean isSymbol(int c) {
        if (c == EOX || Character.isSurrogate((char) c)) return false;
        if (c == END_MARKER || Character.isLetter(c)) return true;
        switch (Character.getType(c)) {
        case Character.DECIMAL_DIGIT_NUMBER:
        case Character.LETTER_NUMBER:
        case Character.OTHER_NUMBER:
            return true;
        default:
            return false;
        }
    }

    /**
     * @throws ConversionException if the expression is malformed or too
     *             large.
     */
    Result parse() {
        logger.log(level, "regex: " + regex);

        final Node expression = expression();
        assert token == EOX : "unexpected char at end of expression: " + (char) token;

        final Terminal end = endMarker();
        final Node root = cat(expression, end);

        assert new Visitor(TraversalOrder.TOP_DOWN) {

            boolean noReconvergence() {
                walk(root);
                return !reconvergence;
            }

            boolean reconvergence = false;
            private final Map<Node, Object> id =     // in case Node.equals()
                new IdentityHashMap<Node, Object>(); // is ever defined

            @Override
            protected void visit(Node node) {
                if (id.put(node, new Object()) != null) reconvergence = true;
                super.visit(node);
            }

        }.noReconvergence();

        if (logger.isLoggable(level)) {
            logger.log(level, "augmentedRootTree: " + Misc.LS + root.toTreeString());
        }
        return new Result(root, end);
    }

    private void advance() {
        ++index;
        token = index < regex.length() ? regex.charAt(index) : EOX;
    }

    /*
     * Alternates between reading a base and reading what may follow one:
     * postfix operators, '|', ')' or the end.
     */
    private Node expression() {
        final Stack<Group> open = new Stack<Group>();
        Group group = new Group();

        while (true) {
            Node node = base(open);
            if (node == null) {         // '(' pushed a new group
                open.push(group);
                group = new Group();
                continue;
            }
            while (true) {
                group.append(postfix(node));
                if (token == '|') {
                    advance();
                    group.endTerm();
                    break;
                }
                if (token == ')') {
                    if (open.isEmpty()) {
                        throw mismatchedParentheses();  // unbalanced ')' at top level
                    }
                    advance();
                    node = group.close();
                    group = open.pop();
                    continue;
                }
                if (token == EOX) {
                    if (!open.isEmpty()) {
                        throw mismatchedParentheses();
                    }
                    return group.close();
                }
                break;                  // next factor of the term
            }
        }
    }

    /**
     * @return a terminal, or <code>null</code> after consuming a '('.
     */
    private Node base(Stack<Group> open) {
        if (token == '(') {
            advance();
            return null;
        }
        if (isSymbol(token)) {
            count(1, index);
            char c = (char) token;
            advance();
            return terminal(c);
        }
        if (token == EOX && !open.isEmpty()) {
            // ran out of input inside a group: the ')' is what's missing
            throw mismatchedParentheses();
        }
        throw new ConversionException(new ConversionError.UnexpectedCharacter(
            token == EOX ? null : Integer.valueOf(regex.codePointAt(index)), index));
    }

    private Node postfix(Node node) {
        int op = EOX;
        int opIndex = index;
        while (token == '*' || token == '+') {
            if (token == '*' || op == EOX) {
                op = token;
                opIndex = index;
            }
            advance();
        }
        if (op == '*') {
            return node instanceof Star ? node : star(node);
        }
        if (op == '+') {
            if (node instanceof Star) {
                return node;            // x*+ is x*
            }
            count(terminals(node), opIndex);
            return plus(node);
        }
        return node;
    }

    /*
     * the end marker takes the last position
     */
    private void count(int n, int at) {
        if (npos + n >= maxPositions) {
            throw new ConversionException(
                new ConversionError.TooManyPositions(maxPositions, at));
        }
        npos += n;
    }

    private ConversionException mismatchedParentheses() {
        return new ConversionException(
            new ConversionError.MismatchedParentheses(index));
    }
}
