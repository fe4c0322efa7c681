/* @LICENSE@
 */
package org.rxdfa.regex;

/**
 * Describes why a regular expression could not be converted. Instances are
 * immutable values; the message of each kind is meant to be shown to the end
 * user as is.
 */
public abstract class ConversionError {

    /**
     * The kinds of conversion failure.
     */
    public enum Kind {
        /**
         * An opening parenthesis without its closing one, or a closing
         * parenthesis without an opening one.
         */
        MISMATCHED_PARENTHESES,
        /**
         * A character outside the accepted alphabet, or the end of the
         * expression where a symbol or '(' was required.
         */
        UNEXPECTED_CHARACTER,
        /**
         * The automaton needs more states than the configured limit.
         */
        TOO_MANY_STATES,
        /**
         * The expression, with every <code>+</code> expanded, has more
         * positions than the configured limit.
         */
        TOO_MANY_POSITIONS
    }

    private final int index;

    private ConversionError(int index) {
        this.index = index;
    }

    public abstract Kind kind();

    public abstract String getMessage();

    /**
     * @return the index in the regular expression where the error was found,
     *         or -1 if the error is not tied to a place in the expression.
     */
    public final int index() {
        return index;
    }

    @Override
    public final boolean equals(Object o) {
        if (!(o instanceof ConversionError)) return false;
        ConversionError that = (ConversionError) o;
        return kind() == that.kind()
            && index == that.index
            && getMessage().equals(that.getMessage());
    }

    @Override
    public final int hashCode() {
        return (kind().hashCode() * 31 + index) * 31 + getMessage().hashCode();
    }

    @Override
    public String toString() {
        return index < 0 ? getMessage() : getMessage() + " near index " + index;
    }

    public static final class MismatchedParentheses extends ConversionError {

        MismatchedParentheses(int index) {
            super(index);
        }

        @Override
        public Kind kind() {
            return Kind.MISMATCHED_PARENTHESES;
        }

        @Override
        public String getMessage() {
            return "Mismatched parentheses";
        }
    }

    public static final class UnexpectedCharacter extends ConversionError {

        private final Integer codePoint;

        UnexpectedCharacter(Integer codePoint, int index) {
            super(index);
            this.codePoint = codePoint;
        }

        /**
         * @return the offending code point, or <code>null</code> when the
         *         expression ended where more input was required.
         */
        public Integer codePoint() {
            return codePoint;
        }

        @Override
        public Kind kind() {
            return Kind.UNEXPECTED_CHARACTER;
        }

        @Override
        public String getMessage() {
            return codePoint == null
                ? "Unexpected character: none"
                : "Unexpected character: '"
                    + new String(Character.toChars(codePoint)) + "'";
        }
    }

    public static final class TooManyStates extends ConversionError {

        private final int limit;

        TooManyStates(int limit) {
            super(-1);
            this.limit = limit;
        }

        public int limit() {
            return limit;
        }

        @Override
        public Kind kind() {
            return Kind.TOO_MANY_STATES;
        }

        @Override
        public String getMessage() {
            return "DFA state count exceeded: " + limit;
        }
    }

    public static final class TooManyPositions extends ConversionError {

        private final int limit;

        TooManyPositions(int limit, int index) {
            super(index);
            this.limit = limit;
        }

        public int limit() {
            return limit;
        }

        @Override
        public Kind kind() {
            return Kind.TOO_MANY_POSITIONS;
        }

        @Override
        public String getMessage() {
            return "Expression position count exceeded: " + limit;
        }
    }
}
