/* @LICENSE@
 */
package org.rxdfa.regex;

import static org.rxdfa.regex.Misc.stringFrom;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The position table and followpos table of one conversion. An instance is
 * created for every call and handed from the annotator to the followpos
 * builder and the DFA constructor; it is never shared between conversions.
 * <p>
 * Positions are 1-based and dense: the n-th terminal met in left to right
 * order gets position n.
 */
final class Positions {

    private static final SortedSet<Integer> NONE =
        Collections.unmodifiableSortedSet(new TreeSet<Integer>());

    private final StringBuilder symbols = new StringBuilder();
    private final SortedMap<Integer, SortedSet<Integer>> followpos =
        new TreeMap<Integer, SortedSet<Integer>>();
    private int endMarker = 0;

    /**
     * Assigns the next position to a terminal.
     *
     * @return the new position
     */
    int assign(char symbol) {
        symbols.append(symbol);
        return symbols.length();
    }

    void markEnd(int position) {
        check(position);
        if (endMarker != 0) {
            throw new IllegalStateException("end marker already at " + endMarker);
        }
        endMarker = position;
    }

    /**
     * @return the number of positions assigned so far
     */
    int size() {
        return symbols.length();
    }

    char symbolAt(int position) {
        check(position);
        return symbols.charAt(position - 1);
    }

    /**
     * @return the position of the end marker, 0 before it is assigned.
     */
    int endMarker() {
        return endMarker;
    }

    boolean isEndMarker(int position) {
        return position == endMarker;
    }

    void addFollow(int position, SortedSet<Integer> follow) {
        check(position);
        if (isEndMarker(position)) {
            throw new IllegalStateException("end marker can not be followed");
        }
        SortedSet<Integer> set = followpos.get(position);
        if (set == null) {
            set = new TreeSet<Integer>();
            followpos.put(position, set);
        }
        set.addAll(follow);
    }

    /**
     * @return the positions which can follow <code>position</code>; empty when
     *         nothing can.
     */
    SortedSet<Integer> followpos(int position) {
        check(position);
        SortedSet<Integer> set = followpos.get(position);
        return set == null ? NONE : Collections.unmodifiableSortedSet(set);
    }

    private void check(int position) {
        if (position < 1 || position > symbols.length()) {
            throw new IllegalArgumentException("no such position: " + position);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("positions: ");
        for (int p = 1; p <= size(); ++p) {
            sb.append(p).append('=').append(symbolAt(p)).append(' ');
        }
        sb.append("end=").append(endMarker).append(Misc.LS);
        sb.append(stringFrom("followpos", followpos));
        return sb.toString();
    }
}
