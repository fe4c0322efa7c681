/*
 * @LICENSE@
 */

/**
 * <h3><b>rxdfa</b> - regular expressions to deterministic finite automata by
 * the direct construction.</h3>
 * <p>
 * <h4>Usage.</h4>
 * <pre>
 * ConversionResult result = RegexDfa.convert("(a|b)*abb");
 * if (result.isSuccess()) {
 *     Automaton dfa = result.automaton();
 *     new DotRenderer().render(dfa, writer);
 * } else {
 *     show(result.error().getMessage());
 * }
 * </pre>
 * <p>
 * <h4>How it works.</h4>
 * <p>
 * The expression is parsed into an abstract syntax tree, and augmented with a
 * terminal end marker <code>#</code>: <code>(r)#</code>. Every terminal of
 * the augmented tree is a <em>position</em>, numbered from 1 in left to right
 * order. For every node the construction computes whether it matches the
 * empty string (<em>nullable</em>), which positions can match the first
 * symbol of its strings (<em>firstpos</em>) and which the last
 * (<em>lastpos</em>). From those follows, for every position, the set of
 * positions which can match the symbol after it (<em>followpos</em>).
 * <p>
 * A DFA state is a set of positions. The start state is firstpos of the root;
 * on a symbol <code>a</code>, a state moves to the union of followpos over
 * its positions labeled <code>a</code>. A state is accepting when it holds
 * the position of the end marker. No NFA is built along the way.
 * <p>
 * <h4>Not supported.</h4>
 * Character classes, <code>?</code>, bounded quantifiers, anchors, escapes
 * and back references are not part of the syntax. Symbols are single UTF-16
 * chars, so supplementary code points are rejected. Automata are not minimized.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>For the construction itself, see section 3.9 ("Optimization of
 * DFA-Based Pattern Matchers") of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a></li>
 * <li>G. Berry and R. Sethi, "From regular expressions to deterministic
 * automata", Theoretical Computer Science 48 (1986).</li>
 * </ul>
 */
package org.rxdfa.regex;
