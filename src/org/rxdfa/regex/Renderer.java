/* @LICENSE@
 */
package org.rxdfa.regex;

import java.io.IOException;

/**
 * Draws an {@link Automaton}: one node per state, marked when the state is
 * accepting, and one labeled, directed edge per transition. What the drawing
 * is made of, and where it ends up, is up to the implementation.
 */
public interface Renderer {

    void render(Automaton automaton, Appendable out) throws IOException;
}
