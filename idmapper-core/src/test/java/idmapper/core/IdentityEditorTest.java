package idmapper.core;

import idmapper.data_structure.AuditEntry;
import idmapper.data_structure.Cast;
import idmapper.data_structure.Role;
import idmapper.data_structure.io.LoadResult;
import idmapper.data_structure.io.MalformedStreamException;
import idmapper.data_structure.io.SessionAutosave;
import idmapper.processing.track_post_processing.MergeByRoleResult;
import idmapper.processing.track_post_processing.SplitResult;
import idmapper.utils.FileIO;
import idmapper.utils.JSONUtils;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static idmapper.test_utils.TestUtils.*;
import static org.junit.Assert.*;

public class IdentityEditorTest {
    public static final Logger logger = LoggerFactory.getLogger(IdentityEditorTest.class);
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();
    IdentityEditor editor;
    Path stream;

    @Before
    public void setUp() throws IOException {
        editor = newEditor(new EngineParameters());
        // tracks 1, 2, 3: 10 frames each separated by 5 empty frames, 20px apart
        stream = writeStream(testFolder.getRoot().toPath().resolve("run.json.gz"), sequentialStream(3, 10, 5));
    }

    @After
    public void tearDown() {
        if (editor != null) editor.close();
    }

    IdentityEditor newEditor(EngineParameters params) throws IOException {
        return new IdentityEditor(params, Cast.defaultCast(), testFolder.newFolder(), ProgressCallback.NONE);
    }

    static String lastAction(IdentityEditor editor) {
        List<AuditEntry> entries = editor.getGraph().getAuditEntries();
        return entries.get(entries.size()-1).getAction();
    }

    @Test
    public void testLoadMergeUndoRedo() throws IOException {
        LoadResult res = editor.load(stream);
        assertEquals(3, res.getTracks().size());
        assertEquals("Load", lastAction(editor));
        assertFalse(editor.canUndo());
        assertTrue(editor.merge(1, 2));
        assertTrue(editor.canUndo());
        assertEquals(Arrays.asList(1, 3), editor.getGraph().getTrackIds());

        assertTrue(editor.undo());
        assertEquals(Arrays.asList(1, 2, 3), editor.getGraph().getTrackIds());
        assertEquals(Integer.valueOf(2), editor.getGraph().resolve(2));
        assertEquals("Undo", lastAction(editor));
        assertFalse(editor.undo());

        assertTrue(editor.redo());
        assertEquals(Arrays.asList(1, 3), editor.getGraph().getTrackIds());
        assertEquals("Redo", lastAction(editor));
        assertTrue(editor.getGraph().isLineageConsistent());
    }

    @Test
    public void testRefusedOperationsAreNotRecorded() throws IOException {
        editor.load(stream);
        assertFalse(editor.merge(1, 1));
        assertFalse(editor.merge(1, 42));
        assertEquals(SplitResult.Status.UNKNOWN_TRACK_ID, editor.split(42, 3, true).getStatus());
        assertEquals(SplitResult.Status.SPLIT_AT_START, editor.split(1, 0, true).getStatus());
        assertEquals("role outside the cast", 0, editor.assignRole(Collections.singletonList(1), "Stranger"));
        assertEquals(-1, editor.manualMerge(Collections.singletonList(1)));
        assertFalse(editor.canUndo());
    }

    @Test
    public void testMalformedLoadKeepsSession() throws IOException {
        editor.load(stream);
        editor.merge(1, 2);
        Path bad = writeStream(testFolder.getRoot().toPath().resolve("bad.json.gz"), Arrays.asList(record(0, det(7, 0, 0)), "{\"f_idx\": 1, \"det\": [{\"track_id\": 7}]}"));
        try {
            editor.load(bad);
            fail("malformed stream should be rejected");
        } catch (MalformedStreamException e) {
            assertEquals(2, e.getLine());
        }
        assertEquals(Arrays.asList(1, 3), editor.getGraph().getTrackIds());
        assertEquals(stream, editor.getStream());
        assertTrue(editor.canUndo());
    }

    @Test
    public void testAutoStitchAndExport() throws IOException, ParseException {
        editor.load(stream);
        assertEquals(2, editor.autoStitch());
        assertEquals(Collections.singletonList(1), editor.getGraph().getTrackIds());
        assertEquals(1, editor.assignRole(Collections.singletonList(1), "Target"));
        Path out = editor.exportIdentityMap(null);
        assertEquals(testFolder.getRoot().toPath().resolve("run_identity.json"), out);
        JSONObject json = JSONUtils.parseJSONObject(FileIO.readString(out));
        assertEquals(3, json.size());
        for (String id : Arrays.asList("1", "2", "3")) assertEquals("Target", json.get(id));
        Path audit = editor.exportAuditLog(null);
        assertTrue(Files.exists(audit));
        assertTrue(editor.undo());
        assertEquals(Role.IGNORE, editor.getGraph().getTrack(1).getRole());
    }

    @Test
    public void testAbsorbNoise() throws IOException {
        editor.load(stream);
        editor.assignRole(Collections.singletonList(2), "Target");
        assertEquals(2, editor.absorbNoise());
        assertEquals(Collections.singletonList(2), editor.getGraph().getTrackIds());
        assertEquals(Role.of("Target"), editor.getGraph().getTrack(2).getRole());
    }

    @Test
    public void testCastMembers() throws IOException {
        editor.load(stream);
        assertTrue(editor.addCastMember("Witness"));
        assertFalse(editor.addCastMember("Ignore"));
        assertEquals(2, editor.assignRole(Arrays.asList(1, 3), "Witness"));
        assertEquals(2, editor.removeCastMember("Witness"));
        assertFalse(editor.getCast().contains(Role.of("Witness")));
        assertEquals(Role.IGNORE, editor.getGraph().getTrack(1).getRole());
        assertTrue(editor.undo());
        assertEquals(Role.of("Witness"), editor.getGraph().getTrack(3).getRole());
    }

    @Test
    public void testMergeAllByRoleAndManualMerge() throws IOException {
        editor.load(stream);
        editor.assignRole(Arrays.asList(1, 3), "Target");
        assertEquals(1, editor.mergeAllByRole().getMergeCount());
        assertEquals(Arrays.asList(1, 2), editor.getGraph().getTrackIds());
        assertEquals(1, editor.manualMerge(Arrays.asList(2, 1)));
        assertEquals(Role.of("Target"), editor.getGraph().getTrack(1).getRole());
        assertEquals(Arrays.asList(1, 2, 3), Arrays.asList(editor.getGraph().getTrack(1).getMergedFrom().toArray(new Integer[0])));
    }

    @Test
    public void testSplitAllocatesFreshIdentifier() throws IOException {
        editor.load(stream);
        SplitResult res = editor.split(2, 20, true);
        assertTrue(res.isSuccess());
        assertEquals(4, res.getNewId());
        assertEquals(5, res.getNewSegmentLength());
        assertEquals(Collections.singletonList(4), new ArrayList<>(editor.getDetectionsAt(20).keySet()));
    }

    @Test
    public void testHistoryIsBounded() throws IOException {
        editor.close();
        editor = newEditor(new EngineParameters().setMaxHistory(2).setRamBuffer(1));
        editor.load(stream);
        editor.split(1, 5, true);
        editor.split(2, 20, true);
        editor.split(3, 35, true);
        assertTrue(editor.undo());
        assertTrue(editor.undo());
        assertFalse(editor.undo());
        assertEquals(4, editor.getGraph().trackCount());
    }

    @Test
    public void testAutosaveAndRestore() throws IOException {
        editor.load(stream);
        editor.merge(1, 3);
        SessionAutosave autosave = SessionAutosave.forStream(stream);
        assertTrue(autosave.exists());
        try (IdentityEditor other = newEditor(new EngineParameters())) {
            other.setAutosave(autosave);
            assertTrue(other.restoreAutosave());
            assertEquals(Arrays.asList(1, 2), other.getGraph().getTrackIds());
            assertEquals(Integer.valueOf(1), other.getGraph().resolve(3));
            assertFalse(other.canUndo());
            assertEquals("RestoreSession", lastAction(other));
        }
    }

    @Test
    public void testRestoreKeepsUntrackedDetectionsFlag() throws IOException {
        Path untracked = writeStream(testFolder.getRoot().toPath().resolve("untracked.json.gz"), Arrays.asList(
                record(0, det(1, 10, 10), det(null, 80, 80)),
                record(1, det(1, 12, 10), det(null, 200, 200))));
        editor.load(untracked);
        assertTrue(editor.getGraph().hasUntrackedDetections());
        editor.assignRole(Collections.singletonList(1), "Target");
        try (IdentityEditor other = newEditor(new EngineParameters())) {
            other.setAutosave(SessionAutosave.forStream(untracked));
            assertTrue(other.restoreAutosave());
            assertTrue(other.getGraph().hasUntrackedDetections());
            assertEquals("short fragments stay listed", 3, other.getTrackSummaries(true).size());
        }
    }

    @Test
    public void testTrackSummariesHideShortTracks() throws IOException {
        editor.load(stream);
        assertEquals("10-frame tracks are shorter than 1s at 30 fps", 0, editor.getTrackSummaries(true).size());
        assertEquals(3, editor.getTrackSummaries(false).size());
        editor.assignRole(Collections.singletonList(2), "Target");
        assertEquals(1, editor.getTrackSummaries(true).size());
        assertEquals(10, editor.getTrackSummaries(true).get(0).getLength());
    }

    @Test
    public void testBackgroundExecution() throws IOException, InterruptedException, ExecutionException {
        AtomicReference<DefaultWorker.Outcome<LoadResult>> loaded = new AtomicReference<>();
        LoadResult res = editor.loadInBackground(stream, loaded::set).get();
        assertEquals(3, res.getTracks().size());
        assertTrue(loaded.get().isSuccess());
        AtomicReference<DefaultWorker.Outcome<Integer>> stitched = new AtomicReference<>();
        assertEquals(Integer.valueOf(2), editor.autoStitchInBackground(stitched::set).get());
        assertEquals(Integer.valueOf(2), stitched.get().getResult());
        assertTrue(editor.canUndo());
    }

    @Test
    public void testBackgroundCastOperations() throws IOException, InterruptedException, ExecutionException {
        editor.load(stream);
        editor.assignRole(Arrays.asList(1, 2), "Target");
        AtomicReference<DefaultWorker.Outcome<MergeByRoleResult>> merged = new AtomicReference<>();
        assertEquals(1, editor.mergeAllByRoleInBackground(merged::set).get().getMergeCount());
        assertTrue(merged.get().isSuccess());
        assertEquals(Arrays.asList(1, 3), editor.getGraph().getTrackIds());
        AtomicReference<DefaultWorker.Outcome<Integer>> absorbed = new AtomicReference<>();
        assertEquals(Integer.valueOf(1), editor.absorbNoiseInBackground(absorbed::set).get());
        assertEquals(Integer.valueOf(1), absorbed.get().getResult());
        assertEquals(Collections.singletonList(1), editor.getGraph().getTrackIds());
    }
}
