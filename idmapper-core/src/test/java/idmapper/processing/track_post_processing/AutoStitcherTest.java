package idmapper.processing.track_post_processing;

import idmapper.data_structure.AuditEntry;
import idmapper.data_structure.IdentityGraph;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static idmapper.test_utils.TestUtils.*;
import static org.junit.Assert.*;

public class AutoStitcherTest {
    static AutoStitcher defaultStitcher() {
        return new AutoStitcher(15, 2.0, 30, 150);
    }

    @Test
    public void testStitchesCloseFragments() {
        IdentityGraph graph = graph(track(1, 0, 9, 100, 100), track(2, 20, 29, 150, 100));
        assertEquals(1, defaultStitcher().run(graph));
        assertEquals(Collections.singletonList(1), graph.getTrackIds());
        assertEquals(20, graph.getTrack(1).length());
        assertTrue(graph.isLineageConsistent());
    }

    @Test
    public void testDistanceThresholdIsExclusive() {
        IdentityGraph far = graph(track(1, 0, 9, 100, 100), track(2, 20, 29, 251, 100));
        assertEquals("151px apart", 0, defaultStitcher().run(far));
        IdentityGraph limit = graph(track(1, 0, 9, 100, 100), track(2, 20, 29, 250, 100));
        assertEquals("exactly 150px apart", 0, defaultStitcher().run(limit));
        assertEquals(Arrays.asList(1, 2), limit.getTrackIds());
    }

    @Test
    public void testTimeGapThreshold() {
        assertEquals(60, defaultStitcher().getMaxFrameGap(), 1e-9);
        IdentityGraph within = graph(track(1, 0, 9, 0, 0), track(2, 69, 70, 0, 0));
        assertEquals("gap of 60 frames", 1, defaultStitcher().run(within));
        IdentityGraph beyond = graph(track(1, 0, 9, 0, 0), track(2, 70, 71, 0, 0));
        assertEquals("gap of 61 frames", 0, defaultStitcher().run(beyond));
    }

    @Test
    public void testOverlappingFragmentsAreNotStitched() {
        IdentityGraph graph = graph(track(1, 0, 9, 0, 0), track(2, 9, 15, 0, 0));
        assertEquals(0, defaultStitcher().run(graph));
    }

    @Test
    public void testClosestCandidateWins() {
        IdentityGraph graph = graph(track(1, 0, 9, 0, 0), track(2, 12, 20, 100, 0), track(3, 13, 20, 30, 0));
        assertEquals(1, defaultStitcher().run(graph));
        assertEquals(Arrays.asList(1, 2), graph.getTrackIds());
        assertEquals(Integer.valueOf(1), graph.resolve(3));
    }

    @Test
    public void testTieKeepsEarliestCandidate() {
        IdentityGraph graph = graph(track(1, 0, 9, 0, 0), track(2, 12, 20, 50, 0), track(3, 12, 20, -50, 0));
        assertEquals(1, defaultStitcher().run(graph));
        assertEquals(Arrays.asList(1, 3), graph.getTrackIds());
    }

    @Test
    public void testLookaheadLimitsCandidates() {
        IdentityGraph narrow = graph(track(1, 0, 9, 0, 0), track(2, 12, 20, 1000, 0), track(3, 30, 40, 10, 0));
        assertEquals(0, new AutoStitcher(1, 2.0, 30, 150).run(narrow));
        IdentityGraph wide = graph(track(1, 0, 9, 0, 0), track(2, 12, 20, 1000, 0), track(3, 30, 40, 10, 0));
        assertEquals(1, new AutoStitcher(2, 2.0, 30, 150).run(wide));
        assertEquals(Arrays.asList(1, 2), wide.getTrackIds());
    }

    @Test
    public void testChainIsFullyStitchedAndRerunIsNoOp() {
        IdentityGraph graph = graph(
                track(1, 0, 9, 0, 0),
                track(2, 12, 21, 20, 0),
                track(3, 24, 33, 40, 0),
                track(4, 36, 45, 60, 0),
                track(5, 48, 57, 80, 0));
        assertEquals(4, defaultStitcher().run(graph));
        assertEquals(Collections.singletonList(1), graph.getTrackIds());
        long mod = graph.getModificationCount();
        int audit = graph.getAuditEntries().size();
        assertEquals(0, defaultStitcher().run(graph));
        assertEquals(mod, graph.getModificationCount());
        assertEquals(audit, graph.getAuditEntries().size());
    }

    @Test
    public void testAuditEntries() {
        IdentityGraph graph = graph(track(1, 0, 9, 0, 0), track(2, 12, 21, 20, 0), track(3, 24, 33, 40, 0));
        int merged = defaultStitcher().run(graph);
        List<AuditEntry> entries = graph.getAuditEntries();
        assertEquals(merged + 1, entries.size());
        assertEquals(merged, entries.stream().filter(e -> e.getAction().equals("Merge")).count());
        assertEquals("AutoStitch", entries.get(entries.size()-1).getAction());
        assertEquals(merged, ((Number)entries.get(entries.size()-1).getDetails().get("merged")).intValue());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidLookahead() {
        new AutoStitcher(0, 2.0, 30, 150);
    }
}
