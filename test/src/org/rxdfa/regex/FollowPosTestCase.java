/* @LICENSE@
 */

package org.rxdfa.regex;

public class FollowPosTestCase extends AbstractRxTestCase {

    public FollowPosTestCase(String name) {
        super(name);
    }

    /*
     * Dragon book, fig. 3.60
     */
    public void testTextbook() {
        Positions positions = new Analysis("(a|b)*abb").positions;
        assertEquals(pos(1, 2, 3), positions.followpos(1));
        assertEquals(pos(1, 2, 3), positions.followpos(2));
        assertEquals(pos(4), positions.followpos(3));
        assertEquals(pos(5), positions.followpos(4));
        assertEquals(pos(6), positions.followpos(5));
        assertEquals(pos(), positions.followpos(6));
    }

    public void testPlus() {
        Positions positions = new Analysis("a+").positions;
        assertEquals(pos(2, 3), positions.followpos(1));
        assertEquals(pos(2, 3), positions.followpos(2));
        assertTrue(positions.followpos(3).isEmpty());
    }

    public void testNestedStar() {
        Positions positions = new Analysis("(ab*)*c").positions;
        // a1 b2 c3 #4
        assertEquals(pos(1, 2, 3), positions.followpos(1));
        assertEquals(pos(1, 2, 3), positions.followpos(2));
        assertEquals(pos(4), positions.followpos(3));
    }

    public void testAlternation() {
        Positions positions = new Analysis("a|bc").positions;
        assertEquals(pos(4), positions.followpos(1));
        assertEquals(pos(3), positions.followpos(2));
        assertEquals(pos(4), positions.followpos(3));
    }

    public void testEndMarkerNotFollowed() {
        Positions positions = new Analysis("(a|b)*").positions;
        int end = positions.endMarker();
        for (int p = 1; p <= positions.size(); ++p) {
            if (p != end) {
                assertTrue(positions.followpos(p).contains(end));
            }
        }
        assertTrue(positions.followpos(end).isEmpty());
    }

    public void testPositionsTable() {
        Positions positions = new Positions();
        assertEquals(1, positions.assign('a'));
        assertEquals(2, positions.assign('#'));
        assertEquals(0, positions.endMarker());
        positions.markEnd(2);
        assertEquals(2, positions.endMarker());

        try {
            positions.markEnd(2);
            fail("should throw");
        } catch (IllegalStateException e) {}

        try {
            positions.addFollow(2, pos(1));
            fail("should throw");
        } catch (IllegalStateException e) {}

        try {
            positions.symbolAt(3);
            fail("should throw");
        } catch (IllegalArgumentException e) {
            assertEquals("no such position: 3", e.getMessage());
        }

        try {
            positions.followpos(0);
            fail("should throw");
        } catch (IllegalArgumentException e) {}

        positions.addFollow(1, pos(2));
        positions.addFollow(1, pos(1));
        assertEquals(pos(1, 2), positions.followpos(1));
        try {
            positions.followpos(1).clear();
            fail("should throw");
        } catch (UnsupportedOperationException e) {}
    }
}
