package idmapper.processing.track_post_processing;

import idmapper.data_structure.Cast;
import idmapper.data_structure.IdentityGraph;
import idmapper.data_structure.Role;
import idmapper.data_structure.Track;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.TreeSet;

import static idmapper.test_utils.TestUtils.*;
import static org.junit.Assert.*;

public class TrackMergerTest {
    public static final Logger logger = LoggerFactory.getLogger(TrackMergerTest.class);

    @Test
    public void testMergeConcatenatesFramesAndRepointsLineage() {
        IdentityGraph graph = graph(track(5, new int[]{10, 11, 12}, 0, 0), track(7, new int[]{20, 21}, 50, 0));
        assertTrue(TrackMerger.merge(graph, 5, 7));
        Track m = graph.getTrack(5);
        assertFrames("merged frames", new int[]{10, 11, 12, 20, 21}, m);
        assertEquals(new TreeSet<>(Arrays.asList(5, 7)), m.getMergedFrom());
        assertFalse("slave removed", graph.containsTrack(7));
        assertEquals(Integer.valueOf(5), graph.getLineage().get(7));
        assertEquals(Integer.valueOf(5), graph.resolve(7));
        assertTrue(graph.isLineageConsistent());
        assertEquals("Merge", graph.getAuditEntries().get(graph.getAuditEntries().size()-1).getAction());
    }

    @Test
    public void testMergeKeepsFrameOrder() {
        IdentityGraph graph = graph(track(1, new int[]{1, 3, 5}, 0, 0), track(2, new int[]{2, 4}, 0, 0));
        TrackMerger.merge(graph, 1, 2);
        assertFrames("interleaved frames", range(1, 5), graph.getTrack(1));
        assertEquals(5, graph.getTrack(1).getBoxes().size());
    }

    @Test
    public void testOverlappingFramesAreKept() {
        IdentityGraph graph = graph(track(1, 0, 3, 0, 0), track(2, 2, 5, 10, 0));
        TrackMerger.merge(graph, 1, 2);
        assertFrames("both detections kept", new int[]{0, 1, 2, 2, 3, 3, 4, 5}, graph.getTrack(1));
    }

    @Test
    public void testSelfMergeAndUnknownIdAreNoOp() {
        IdentityGraph graph = graph(track(5, 0, 3, 0, 0), track(7, 5, 6, 0, 0));
        long mod = graph.getModificationCount();
        int auditSize = graph.getAuditEntries().size();
        assertFalse(TrackMerger.merge(graph, 5, 5));
        assertFalse(TrackMerger.merge(graph, 5, 99));
        assertFalse(TrackMerger.merge(graph, 99, 5));
        assertEquals(mod, graph.getModificationCount());
        assertEquals(auditSize, graph.getAuditEntries().size());
        assertEquals(Arrays.asList(5, 7), graph.getTrackIds());
    }

    @Test
    public void testChainedMergesResolveToLastMaster() {
        IdentityGraph graph = graph(track(1, 0, 2, 0, 0), track(2, 4, 6, 0, 0), track(3, 8, 9, 0, 0));
        TrackMerger.merge(graph, 1, 2);
        TrackMerger.merge(graph, 3, 1);
        assertEquals(Collections.singletonList(3), graph.getTrackIds());
        assertEquals(Integer.valueOf(3), graph.resolve(1));
        assertEquals(Integer.valueOf(3), graph.resolve(2));
        assertEquals(new TreeSet<>(Arrays.asList(1, 2, 3)), graph.getTrack(3).getMergedFrom());
        assertTrue(graph.isLineageConsistent());
    }

    @Test
    public void testMergeOrderDoesNotChangeDetections() {
        IdentityGraph g1 = graph(track(1, 0, 2, 0, 0), track(2, 5, 6, 10, 0), track(3, 9, 12, 20, 0));
        IdentityGraph g2 = graph(track(1, 0, 2, 0, 0), track(2, 5, 6, 10, 0), track(3, 9, 12, 20, 0));
        TrackMerger.merge(g1, 1, 2);
        TrackMerger.merge(g1, 1, 3);
        TrackMerger.merge(g2, 1, 3);
        TrackMerger.merge(g2, 1, 2);
        assertEquals(g1.getTrack(1).getDetections(), g2.getTrack(1).getDetections());
        assertEquals(g1.getTrack(1).getMergedFrom(), g2.getTrack(1).getMergedFrom());
        assertEquals(g1.getLineage(), g2.getLineage());
    }

    @Test
    public void testManualMergeInheritsCastRole() {
        Cast cast = Cast.defaultCast();
        Track target = track(8, 10, 12, 0, 0).setRole(Role.of("Target"));
        IdentityGraph graph = graph(track(4, 0, 3, 0, 0), target, track(9, 20, 21, 0, 0));
        int master = TrackMerger.manualMerge(graph, Arrays.asList(9, 8, 4), cast);
        assertEquals("smallest id is the master", 4, master);
        assertEquals(Collections.singletonList(4), graph.getTrackIds());
        assertEquals(Role.of("Target"), graph.getTrack(4).getRole());
        assertEquals("ManualMerge", graph.getAuditEntries().get(graph.getAuditEntries().size()-1).getAction());
    }

    @Test
    public void testManualMergeKeepsMasterCastRole() {
        Cast cast = Cast.defaultCast();
        IdentityGraph graph = graph(track(4, 0, 3, 0, 0).setRole(Role.of("Confederate_1")), track(8, 10, 12, 0, 0).setRole(Role.of("Target")));
        TrackMerger.manualMerge(graph, Arrays.asList(4, 8), cast);
        assertEquals(Role.of("Confederate_1"), graph.getTrack(4).getRole());
    }

    @Test
    public void testManualMergeNeedsTwoExistingTracks() {
        IdentityGraph graph = graph(track(4, 0, 3, 0, 0));
        long mod = graph.getModificationCount();
        assertEquals(-1, TrackMerger.manualMerge(graph, Arrays.asList(4, 12), Cast.defaultCast()));
        assertEquals(mod, graph.getModificationCount());
    }

    @Test
    public void testMergeAllByRole() {
        Role target = Role.of("Target");
        Role conf = Role.of("Confederate_1");
        IdentityGraph graph = graph(
                track(1, 0, 2, 0, 0).setRole(target),
                track(2, 0, 2, 50, 0).setRole(conf),
                track(3, 5, 6, 0, 0).setRole(target),
                track(4, 5, 6, 50, 0).setRole(conf),
                track(5, 8, 9, 0, 0).setRole(target),
                track(6, 8, 9, 90, 0));
        MergeByRoleResult res = TrackMerger.mergeAllByRole(graph, Cast.defaultCast());
        assertEquals(3, res.getMergeCount());
        assertEquals(Arrays.asList(target, conf), res.getRoles());
        assertEquals(Arrays.asList(1, 2, 6), graph.getTrackIds());
        assertFrames("target", new int[]{0, 1, 2, 5, 6, 8, 9}, graph.getTrack(1));
        assertEquals(Integer.valueOf(1), graph.resolve(5));
        assertEquals(Integer.valueOf(2), graph.resolve(4));
        assertTrue(graph.isLineageConsistent());
        assertEquals("MergeByRole", graph.getAuditEntries().get(graph.getAuditEntries().size()-1).getAction());
    }
}
