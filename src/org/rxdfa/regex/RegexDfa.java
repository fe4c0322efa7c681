/*
 * @LICENSE@
 */

package org.rxdfa.regex;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdfa.regex.AST.Node;
import org.rxdfa.regex.Annotator.NodeAttributes;

/**
 * Converts regular expressions to deterministic finite automata by the direct
 * (McNaughton-Yamada, Berry-Sethi) construction: the positions of the
 * expression, and the followpos relation among them, define the DFA states
 * without an intermediate NFA.
 * <p>
 * <strong>Syntax:</strong> symbols are letters, numbers (decimal digits,
 * letter numbers such as <code>&#x216B;</code> and other numbers such as
 * <code>&#xB2;</code>) and <code>#</code>. A symbol is one UTF-16 char:
 * supplementary code points, letters or not, are rejected as unexpected
 * characters. Operators are concatenation (juxtaposition), alternation
 * <code>|</code>, and the postfix <code>*</code> (zero or more) and
 * <code>+</code> (one or more), with parentheses for grouping. Postfix
 * operators may be stacked, as in <code>a*+</code>; a run of them means
 * <code>*</code> if it holds one, else <code>+</code>. Nothing else is
 * accepted: no character classes, no <code>?</code>, no anchors or escapes.
 * <p>
 * <strong>Thread safety:</strong> every conversion works on its own tables;
 * the methods of this class may be called concurrently.
 * <p>
 * <strong>Configuration:</strong> the number of DFA states a conversion may
 * create is limited to {@link #DEFAULT_MAX_STATES}, or to the value of the
 * system property {@value #MAX_STATES_PROPERTY} when set, or to the limit
 * passed to {@link #convert(String, int)}. The number of positions of an
 * expression, counting the copies <code>+</code> makes of its operand, is
 * limited to {@link #DEFAULT_MAX_POSITIONS}, or to the value of the system
 * property {@value #MAX_POSITIONS_PROPERTY} when set.
 */
public final class RegexDfa {

    private static final Logger logger = Logger.getLogger("org.rxdfa.regex");
    private static final Level level = Level.FINE;

    /**
     * Default limit on the number of states of one automaton.
     */
    public static final int DEFAULT_MAX_STATES = 10 * 1000;

    /**
     * System property overriding {@link #DEFAULT_MAX_STATES}.
     */
    public static final String MAX_STATES_PROPERTY = "org.rxdfa.regex.maxStates";

    /**
     * Default limit on the number of positions of one expression.
     */
    public static final int DEFAULT_MAX_POSITIONS = 100 * 1000;

    /**
     * System property overriding {@link #DEFAULT_MAX_POSITIONS}.
     */
    public static final String MAX_POSITIONS_PROPERTY = "org.rxdfa.regex.maxPositions";

    /**
     * A runtime exception thrown by {@link RegexDfa#compile(String)} and
     * {@link ConversionResult#orThrow()} when a regular expression can not be
     * converted.
     */
    public static final class ConversionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final transient ConversionError error;

        public ConversionException(ConversionError error) {
            super(error.toString());
            this.error = error;
        }

        public ConversionError error() {
            return error;
        }
    }

    private RegexDfa() {}   // uninstantiable

    /**
     * @return the state limit used by {@link #convert(String)}
     */
    public static int maxStates() {
        return Integer.getInteger(MAX_STATES_PROPERTY, DEFAULT_MAX_STATES);
    }

    /**
     * @return the position limit used by every conversion; never less than 2,
     *         the positions of a one symbol expression.
     */
    public static int maxPositions() {
        return Math.max(2, Integer.getInteger(MAX_POSITIONS_PROPERTY, DEFAULT_MAX_POSITIONS));
    }

    /**
     * Converts a regular expression with the configured state limit.
     *
     * @param regex
     *            the regular expression
     * @return the automaton, or the reason there is none. Never
     *         <code>null</code>.
     */
    public static ConversionResult convert(String regex) {
        return convert(regex, maxStates());
    }

    /**
     * Converts a regular expression.
     *
     * @param regex
     *            the regular expression
     * @param maxStates
     *            the most states the automaton may have
     * @return the automaton, or the reason there is none. Never
     *         <code>null</code>.
     * @throws IllegalArgumentException
     *             if <code>maxStates</code> is not positive.
     */
    public static ConversionResult convert(String regex, int maxStates) {
        if (regex == null) throw new NullPointerException("regex");
        if (maxStates < 1) {
            throw new IllegalArgumentException("maxStates: " + maxStates);
        }
        try {
            return ConversionResult.success(construct(regex, maxStates).toAutomaton());
        } catch (ConversionException e) {
            logger.log(level, "conversion failed: " + regex, e);
            return ConversionResult.failure(e.error());
        }
    }

    /**
     * Converts a regular expression with the configured state limit.
     *
     * @throws ConversionException
     *             if the regular expression can not be converted.
     */
    public static Automaton compile(String regex) {
        return convert(regex).orThrow();
    }

    /*
     * parse, annotate, followpos, DFA - all tables local to this call.
     */
    static DFA construct(String regex, int maxStates) {
        return construct(regex, maxStates, maxPositions());
    }

    static DFA construct(String regex, int maxStates, int maxPositions) {
        RegexParser.Result parsed = new RegexParser(regex, maxPositions).parse();
        Positions positions = new Positions();
        Map<Node, NodeAttributes> nodeAttr =
            Annotator.annotate(parsed.root, parsed.endMarker, positions);
        FollowPos.compute(parsed.root, nodeAttr, positions);
        return new DFA(positions, nodeAttr.get(parsed.root).firstpos(), maxStates);
    }
}
