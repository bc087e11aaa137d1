package idmapper.processing.track_post_processing;

import idmapper.data_structure.IdentityGraph;
import idmapper.data_structure.Role;
import idmapper.data_structure.Track;
import org.junit.Test;

import java.util.Collections;

import static idmapper.test_utils.TestUtils.*;
import static org.junit.Assert.*;

public class TrackSplitterTest {

    @Test
    public void testSplitKeepHead() {
        IdentityGraph graph = graph(track(3, 10, 20, 0, 0).setRole(Role.of("Target")), track(7, 30, 31, 0, 0));
        SplitResult res = TrackSplitter.split(graph, 3, 15, true);
        assertTrue(res.toString(), res.isSuccess());
        assertEquals(8, res.getNewId());
        assertEquals(6, res.getNewSegmentLength());
        assertFrames("head kept", range(10, 14), graph.getTrack(3));
        Track created = graph.getTrack(8);
        assertFrames("tail moved", range(15, 20), created);
        assertEquals(Role.of("Target"), graph.getTrack(3).getRole());
        assertEquals(Role.IGNORE, created.getRole());
        assertTrue(created.getMergedFrom().isEmpty());
        assertEquals(Integer.valueOf(8), graph.getLineage().get(8));
        assertTrue(graph.isLineageConsistent());
        assertEquals("Split", graph.getAuditEntries().get(graph.getAuditEntries().size()-1).getAction());
    }

    @Test
    public void testSplitKeepTail() {
        IdentityGraph graph = graph(track(3, 10, 20, 0, 0));
        SplitResult res = TrackSplitter.split(graph, 3, 15, false);
        assertTrue(res.isSuccess());
        assertEquals(5, res.getNewSegmentLength());
        assertFrames("tail kept", range(15, 20), graph.getTrack(3));
        assertFrames("head moved", range(10, 14), graph.getTrack(res.getNewId()));
    }

    @Test
    public void testSplitInsideGap() {
        IdentityGraph graph = graph(track(1, new int[]{1, 2, 5, 6}, 0, 0));
        SplitResult res = TrackSplitter.split(graph, 1, 4, true);
        assertTrue(res.isSuccess());
        assertFrames("head", new int[]{1, 2}, graph.getTrack(1));
        assertFrames("tail", new int[]{5, 6}, graph.getTrack(res.getNewId()));
    }

    @Test
    public void testInvalidSplitLeavesStoreUnchanged() {
        IdentityGraph graph = graph(track(3, 10, 20, 0, 0));
        long mod = graph.getModificationCount();
        assertEquals(SplitResult.Status.UNKNOWN_TRACK_ID, TrackSplitter.split(graph, 4, 15, true).getStatus());
        assertEquals(SplitResult.Status.SPLIT_AT_START, TrackSplitter.split(graph, 3, 10, true).getStatus());
        assertEquals(SplitResult.Status.SPLIT_AT_START, TrackSplitter.split(graph, 3, 2, true).getStatus());
        SplitResult out = TrackSplitter.split(graph, 3, 21, true);
        assertEquals(SplitResult.Status.OUT_OF_BOUNDS, out.getStatus());
        assertEquals(-1, out.getNewId());
        assertEquals(mod, graph.getModificationCount());
        assertEquals(Collections.singletonList(3), graph.getTrackIds());
        assertTrue(graph.getAuditEntries().isEmpty());
    }

    @Test
    public void testSplitThenMergeRestoresTrack() {
        Track original = track(3, 10, 20, 0, 0);
        IdentityGraph graph = graph(original.duplicate());
        SplitResult res = TrackSplitter.split(graph, 3, 15, true);
        assertTrue(TrackMerger.merge(graph, 3, res.getNewId()));
        assertEquals(original, graph.getTrack(3));
        assertEquals(Integer.valueOf(3), graph.resolve(res.getNewId()));
    }

    @Test
    public void testNewIdsAreNeverReused() {
        IdentityGraph graph = graph(track(1, 0, 9, 0, 0), track(2, 20, 29, 0, 0));
        TrackMerger.merge(graph, 1, 2);
        SplitResult first = TrackSplitter.split(graph, 1, 5, true);
        assertEquals("merged id 2 is still in the lineage", 3, first.getNewId());
        TrackMerger.merge(graph, 1, 3);
        SplitResult second = TrackSplitter.split(graph, 1, 5, true);
        assertEquals(4, second.getNewId());
    }
}
