/* @LICENSE@
 */
package org.rxdfa.regex;

import java.io.Flushable;
import java.io.IOException;
import java.util.Map;

/**
 * Renders an automaton as Graphviz DOT source. Accepting states are drawn as
 * double circles, the others as circles; states come in index order, each
 * followed by its transitions in symbol order, so equal automata render to
 * equal text.
 *
 * <pre>
 * // DFA
 * digraph {
 *     0 [shape=circle]
 *     0 -&gt; 1 [label="a"]
 *     1 [shape=doublecircle]
 * }
 * </pre>
 */
public final class DotRenderer implements Renderer {

    private static final String NL = "\n";    // on every platform
    private static final String INDENT = "\t";

    private final String comment;

    public DotRenderer() {
        this("DFA");
    }

    /**
     * @param comment
     *            written as a comment line ahead of the graph, or
     *            <code>null</code> for none.
     */
    public DotRenderer(String comment) {
        this.comment = comment;
    }

    public void render(Automaton automaton, Appendable a) throws IOException {
        if (comment != null) {
            a.append("// ").append(comment).append(NL);
        }
        a.append("digraph {").append(NL);
        for (int s = 0; s < automaton.size(); ++s) {
            a.append(INDENT).append(Integer.toString(s))
                .append(" [shape=")
                .append(automaton.isAccepting(s) ? "doublecircle" : "circle")
                .append(']').append(NL);
            for (Map.Entry<Character, Integer> e : automaton.transitions(s).entrySet()) {
                a.append(INDENT).append(Integer.toString(s))
                    .append(" -> ").append(e.getValue().toString())
                    .append(" [label=").append(quote(e.getKey())).append(']')
                    .append(NL);
            }
        }
        a.append('}').append(NL);
        if (a instanceof Flushable) {
            ((Flushable) a).flush();
        }
    }

    /**
     * @return the DOT source of <code>automaton</code> as a string.
     */
    public String toDot(Automaton automaton) {
        StringBuilder sb = new StringBuilder();
        try {
            render(automaton, sb);
        } catch (IOException e) {
            throw new AssertionError(e);    // StringBuilder does not throw
        }
        return sb.toString();
    }

    private static String quote(char c) {
        return "\"" + c + "\"";
    }
}
