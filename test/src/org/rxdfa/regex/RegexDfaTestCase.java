/* @LICENSE@
 */

package org.rxdfa.regex;

import org.rxdfa.regex.ConversionError.Kind;
import org.rxdfa.regex.RegexDfa.ConversionException;

public class RegexDfaTestCase extends AbstractRxTestCase {

    public RegexDfaTestCase(String name) {
        super(name);
    }

    protected void tearDown() throws Exception {
        System.clearProperty(RegexDfa.MAX_STATES_PROPERTY);
        System.clearProperty(RegexDfa.MAX_POSITIONS_PROPERTY);
        super.tearDown();
    }

    public void testSuccess() {
        ConversionResult result = RegexDfa.convert("(a|b)*abb");
        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals(4, result.automaton().size());
        assertSame(result.automaton(), result.orThrow());
        assertEquals("success: 4 states", result.toString());
        try {
            result.error();
            fail("should throw");
        } catch (IllegalStateException e) {}
    }

    public void testFailure() {
        ConversionResult result = RegexDfa.convert("(ab");
        assertTrue(result.isFailure());
        assertEquals(new ConversionError.MismatchedParentheses(3), result.error());
        assertEquals("failure: Mismatched parentheses near index 3", result.toString());
        try {
            result.automaton();
            fail("should throw");
        } catch (IllegalStateException e) {}
        try {
            result.orThrow();
            fail("should throw");
        } catch (ConversionException e) {
            assertEquals(result.error(), e.error());
            assertEquals("Mismatched parentheses near index 3", e.getMessage());
        }
    }

    public void testErrors() {
        assertError("((", Kind.MISMATCHED_PARENTHESES, 2);
        assertError("a)", Kind.MISMATCHED_PARENTHESES, 1);
        assertError("a$", Kind.UNEXPECTED_CHARACTER, 1);
        assertError("", Kind.UNEXPECTED_CHARACTER, 0);
        assertError("a|", Kind.UNEXPECTED_CHARACTER, 2);
        assertError("()", Kind.UNEXPECTED_CHARACTER, 1);
        assertError("*", Kind.UNEXPECTED_CHARACTER, 0);
        assertError("[ab]", Kind.UNEXPECTED_CHARACTER, 0);
    }

    public void testCompile() {
        assertEquals(RegexDfa.convert("ab").automaton(), RegexDfa.compile("ab"));
        try {
            RegexDfa.compile("a$");
            fail("should throw");
        } catch (ConversionException e) {
            assertEquals(Kind.UNEXPECTED_CHARACTER, e.error().kind());
            assertEquals("Unexpected character: '$' near index 1", e.getMessage());
        }
    }

    public void testArguments() {
        try {
            RegexDfa.convert(null);
            fail("should throw");
        } catch (NullPointerException e) {}
        try {
            RegexDfa.convert("a", 0);
            fail("should throw");
        } catch (IllegalArgumentException e) {
            assertEquals("maxStates: 0", e.getMessage());
        }
    }

    public void testMaxStatesProperty() {
        assertEquals(RegexDfa.DEFAULT_MAX_STATES, RegexDfa.maxStates());
        System.setProperty(RegexDfa.MAX_STATES_PROPERTY, "1");
        assertEquals(1, RegexDfa.maxStates());
        assertTrue(RegexDfa.convert("a*").isSuccess());
        ConversionResult result = RegexDfa.convert("a");
        assertEquals(new ConversionError.TooManyStates(1), result.error());
        assertEquals("failure: DFA state count exceeded: 1", result.toString());

        // an explicit limit wins over the property
        assertTrue(RegexDfa.convert("a", 2).isSuccess());
    }

    public void testMaxPositionsProperty() {
        assertEquals(RegexDfa.DEFAULT_MAX_POSITIONS, RegexDfa.maxPositions());
        System.setProperty(RegexDfa.MAX_POSITIONS_PROPERTY, "3");
        assertEquals(3, RegexDfa.maxPositions());
        assertTrue(RegexDfa.convert("ab").isSuccess());
        assertTrue(RegexDfa.convert("a+").isSuccess());

        ConversionResult result = RegexDfa.convert("abc");
        assertEquals(new ConversionError.TooManyPositions(3, 2), result.error());
        assertEquals("failure: Expression position count exceeded: 3 near index 2",
            result.toString());
        assertEquals(Kind.TOO_MANY_POSITIONS, RegexDfa.convert("ab+").error().kind());

        System.setProperty(RegexDfa.MAX_POSITIONS_PROPERTY, "0");
        assertEquals(2, RegexDfa.maxPositions());
        assertTrue(RegexDfa.convert("a").isSuccess());
    }

    public void testErrorValues() {
        ConversionError e = new ConversionError.UnexpectedCharacter(Integer.valueOf('x'), 3);
        assertEquals(e, new ConversionError.UnexpectedCharacter(Integer.valueOf('x'), 3));
        assertEquals(e.hashCode(), new ConversionError.UnexpectedCharacter(Integer.valueOf('x'), 3).hashCode());
        assertFalse(e.equals(new ConversionError.UnexpectedCharacter(Integer.valueOf('x'), 4)));
        assertFalse(e.equals(new ConversionError.UnexpectedCharacter(Integer.valueOf('y'), 3)));
        assertFalse(new ConversionError.MismatchedParentheses(3).equals(e));
        assertEquals("Unexpected character: 'x' near index 3", e.toString());
    }
}
