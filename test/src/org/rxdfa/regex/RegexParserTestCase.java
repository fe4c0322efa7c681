/* @LICENSE@
 */

package org.rxdfa.regex;

import static org.rxdfa.regex.Misc.LS;

import org.rxdfa.regex.AST.Cat;
import org.rxdfa.regex.AST.Node;
import org.rxdfa.regex.AST.Star;
import org.rxdfa.regex.ConversionError.Kind;
import org.rxdfa.regex.RegexDfa.ConversionException;

public class RegexParserTestCase extends AbstractRxTestCase {

    public RegexParserTestCase(String name) {
        super(name);
    }

    private static String tree(String... lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append(LS);
        }
        return sb.toString();
    }

    private static String treeOf(String regex) {
        return new RegexParser(regex).parse().root.toTreeString();
    }

    private static ConversionError unexpected(char c, int index) {
        return new ConversionError.UnexpectedCharacter(Integer.valueOf(c), index);
    }

    private static ConversionError errorOf(String regex) {
        try {
            new RegexParser(regex).parse();
            fail("should throw: " + regex);
            return null;
        } catch (ConversionException e) {
            return e.error();
        }
    }

    public void testPrecedence() {
        assertEquals(tree(
            "&",
            "    |",
            "        &",
            "            a",
            "            b",
            "        *",
            "            c",
            "    #"),
            treeOf("ab|c*"));
    }

    public void testLeftAssociative() {
        assertEquals(tree(
            "&",
            "    |",
            "        |",
            "            a",
            "            b",
            "        c",
            "    #"),
            treeOf("a|b|c"));
        assertEquals(tree(
            "&",
            "    &",
            "        &",
            "            x",
            "            y",
            "        z",
            "    #"),
            treeOf("xyz"));
    }

    public void testGroups() {
        assertEquals(tree(
            "&",
            "    &",
            "        *",
            "            |",
            "                a",
            "                b",
            "        a",
            "    #"),
            treeOf("(a|b)*a"));
        assertEquals(treeOf("a"), treeOf("((a))"));
    }

    public void testPlusIsDeepCopy() {
        RegexParser.Result result = new RegexParser("(ab)+").parse();
        assertEquals(tree(
            "&",
            "    &",
            "        &",
            "            a",
            "            b",
            "        *",
            "            &",
            "                a",
            "                b",
            "    #"),
            result.root.toTreeString());

        Cat plus = (Cat) ((Cat) result.root).first;
        Node once = plus.first;
        Node starred = ((Star) plus.second).child;
        assertNotSame(once, starred);
        assertNotSame(((Cat) once).first, ((Cat) starred).first);
        assertNotSame(((Cat) once).second, ((Cat) starred).second);
    }

    public void testStackedPostfix() {
        String starred = tree(
            "&",
            "    *",
            "        a",
            "    #");
        assertEquals(starred, treeOf("a**"));
        assertEquals(starred, treeOf("a*+"));
        assertEquals(starred, treeOf("a+*"));
        assertEquals(starred, treeOf("a+*+"));
        assertEquals(starred, treeOf("(a*)*"));
        assertEquals(starred, treeOf("(a*)+"));
        assertEquals(treeOf("a+"), treeOf("a++"));
    }

    public void testLongPostfixRun() {
        StringBuilder sb = new StringBuilder("a");
        for (int i = 0; i < 40; ++i) {
            sb.append('+');
        }
        Analysis analysis = new Analysis(sb.toString());
        assertEquals(3, analysis.positions.size());
        assertEquals(dfa("a+"), dfa(sb.toString()));
    }

    public void testTooManyPositions() {
        try {
            new RegexParser("((a+)+)+", 8).parse();
            fail("should throw");
        } catch (ConversionException e) {
            assertEquals(new ConversionError.TooManyPositions(8, 7), e.error());
            assertEquals("Expression position count exceeded: 8 near index 7",
                e.getMessage());
        }
        // the end marker included
        assertEquals(9, AST.terminals(new RegexParser("((a+)+)+", 9).parse().root));

        try {
            new RegexParser("abc", 3).parse();
            fail("should throw");
        } catch (ConversionException e) {
            assertEquals(new ConversionError.TooManyPositions(3, 2), e.error());
        }
        assertEquals(4, AST.terminals(new RegexParser("abc", 4).parse().root));
    }

    public void testNestedPlusBounded() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 40; ++i) {
            sb.append('(');
        }
        sb.append('a');
        for (int i = 0; i < 40; ++i) {
            sb.append("+)");
        }
        ConversionResult result = RegexDfa.convert(sb.toString());
        assertTrue(result.isFailure());
        assertEquals(Kind.TOO_MANY_POSITIONS, result.error().kind());
        assertEquals(RegexDfa.DEFAULT_MAX_POSITIONS,
            ((ConversionError.TooManyPositions) result.error()).limit());
    }

    /*
     * groups are kept on a heap stack: deep nesting parses
     */
    public void testDeepGroups() {
        int depth = 20 * 1000;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; ++i) {
            sb.append('(');
        }
        sb.append('a');
        for (int i = 0; i < depth; ++i) {
            sb.append(')');
        }
        assertEquals(treeOf("a"), treeOf(sb.toString()));
        assertEquals(dfa("a"), dfa(sb.toString()));

        sb.setLength(0);
        StringBuilder input = new StringBuilder();
        for (int i = 0; i < depth; ++i) {
            sb.append("(a");
            input.append('a');
        }
        for (int i = 0; i < depth; ++i) {
            sb.append(')');
        }
        Automaton chain = RegexDfa.convert(sb.toString(), depth + 1).automaton();
        assertEquals(depth + 1, chain.size());
        assertTrue(chain.accepts(input));
        assertFalse(chain.accepts(input.substring(1)));

        sb.setLength(0);
        for (int i = 0; i < depth; ++i) {
            sb.append('(');
        }
        sb.append('a');
        assertEquals(new ConversionError.MismatchedParentheses(depth + 1), errorOf(sb.toString()));
    }

    public void testEndMarker() {
        RegexParser.Result result = new RegexParser("a#").parse();
        Cat root = (Cat) result.root;
        assertSame(result.endMarker, root.second);
        assertEquals(AST.END_MARKER, result.endMarker.symbol);
        // user written '#' is a terminal of its own
        assertEquals('#', ((AST.Terminal) ((Cat) root.first).second).symbol);
        assertNotSame(result.endMarker, ((Cat) root.first).second);
    }

    public void testSymbols() {
        assertTrue(RegexParser.isSymbol('a'));
        assertTrue(RegexParser.isSymbol('Z'));
        assertTrue(RegexParser.isSymbol('7'));
        assertTrue(RegexParser.isSymbol('#'));
        assertTrue(RegexParser.isSymbol('\u00e9'));    // e acute
        assertTrue(RegexParser.isSymbol('\u00b2'));    // superscript two
        assertTrue(RegexParser.isSymbol('\u216b'));    // roman numeral twelve
        assertFalse(RegexParser.isSymbol('\ud835'));   // high surrogate
        assertFalse(RegexParser.isSymbol(' '));
        assertFalse(RegexParser.isSymbol('.'));
        assertFalse(RegexParser.isSymbol('?'));
        assertFalse(RegexParser.isSymbol(-1));
    }

    public void testMismatchedParentheses() {
        assertEquals(new ConversionError.MismatchedParentheses(2), errorOf("(("));
        assertEquals(new ConversionError.MismatchedParentheses(1), errorOf("("));
        assertEquals(new ConversionError.MismatchedParentheses(2), errorOf("(a"));
        assertEquals(new ConversionError.MismatchedParentheses(3), errorOf("(a|"));
        assertEquals(new ConversionError.MismatchedParentheses(1), errorOf("a)"));
        assertEquals(new ConversionError.MismatchedParentheses(4), errorOf("(a)*)b"));
        assertEquals("Mismatched parentheses", errorOf("((").getMessage());
    }

    public void testUnexpectedCharacter() {
        ConversionError e = errorOf("a$");
        assertEquals(Kind.UNEXPECTED_CHARACTER, e.kind());
        assertEquals(1, e.index());
        assertEquals(Integer.valueOf('$'),
            ((ConversionError.UnexpectedCharacter) e).codePoint());
        assertEquals("Unexpected character: '$'", e.getMessage());

        assertEquals(unexpected(')', 1), errorOf("()"));
        assertEquals(unexpected('|', 2), errorOf("a||b"));
        assertEquals(unexpected('*', 0), errorOf("*a"));
        assertEquals(unexpected('+', 2), errorOf("a|+"));
        assertEquals(unexpected(' ', 1), errorOf("a b"));
        assertEquals(unexpected('?', 1), errorOf("a?"));
    }

    public void testSupplementaryCharacter() {
        int bold = 0x1D400;     // mathematical bold capital A
        String regex = "a" + new String(Character.toChars(bold)) + "b";
        ConversionError e = errorOf(regex);
        assertEquals(new ConversionError.UnexpectedCharacter(bold, 1), e);
        assertEquals("Unexpected character: '" + new String(Character.toChars(bold)) + "'",
            e.getMessage());
    }

    public void testUnexpectedEnd() {
        ConversionError e = errorOf("");
        assertEquals(new ConversionError.UnexpectedCharacter(null, 0), e);
        assertNull(((ConversionError.UnexpectedCharacter) e).codePoint());
        assertEquals("Unexpected character: none", e.getMessage());
        assertEquals(new ConversionError.UnexpectedCharacter(null, 2), errorOf("a|"));
    }

    public void testNull() {
        try {
            new RegexParser(null);
            fail("should throw");
        } catch (NullPointerException e) {
            assertEquals("regex", e.getMessage());
        }
    }

    /*
     * the walks keep their own stack: a long expression must not overflow
     * the call stack.
     */
    public void testDeepTree() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 50 * 1000; ++i) {
            sb.append((char) ('a' + i % 26));
        }
        Analysis analysis = new Analysis(sb.toString());
        assertEquals(50 * 1000 + 1, analysis.positions.size());
        assertEquals(pos(1), analysis.root().firstpos());
        assertEquals(pos(2), analysis.positions.followpos(1));
    }
}
