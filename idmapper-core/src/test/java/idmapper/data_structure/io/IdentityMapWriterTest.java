package idmapper.data_structure.io;

import idmapper.data_structure.Cast;
import idmapper.data_structure.IdentityGraph;
import idmapper.data_structure.Role;
import idmapper.processing.track_post_processing.TrackMerger;
import idmapper.utils.FileIO;
import idmapper.utils.JSONUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static idmapper.test_utils.TestUtils.graph;
import static idmapper.test_utils.TestUtils.track;
import static org.junit.Assert.*;

public class IdentityMapWriterTest {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void testIdentityMapContainsOnlyCastRoles() throws IOException, ParseException {
        IdentityGraph graph = graph(
                track(1, 0, 9, 0, 0).setRole(Role.of("Target")),
                track(2, 20, 29, 0, 0),
                track(3, 40, 49, 0, 0),
                track(4, 0, 9, 50, 0).setRole(Role.of("Stranger")),
                track(6, 0, 9, 90, 0).setRole(Role.of("Confederate_2")));
        TrackMerger.merge(graph, 1, 2);
        Path out = testFolder.getRoot().toPath().resolve("map.json");
        assertEquals(3, IdentityMapWriter.writeIdentityMap(out, graph, Cast.defaultCast()));
        JSONObject json = JSONUtils.parseJSONObject(FileIO.readString(out));
        assertEquals(3, json.size());
        assertEquals("Target", json.get("1"));
        assertEquals("Target", json.get("2"));
        assertEquals("Confederate_2", json.get("6"));
        assertFalse("Ignore omitted", json.containsKey("3"));
        assertFalse("non cast role omitted", json.containsKey("4"));
    }

    @Test
    public void testAuditLogExport() throws IOException, ParseException {
        IdentityGraph graph = graph(track(1, 0, 9, 0, 0), track(2, 20, 29, 0, 0));
        TrackMerger.merge(graph, 1, 2);
        Path out = testFolder.getRoot().toPath().resolve("audit.json");
        assertEquals(1, IdentityMapWriter.writeAuditLog(out, graph));
        JSONArray json = (JSONArray)JSONUtils.parse(FileIO.readString(out));
        JSONObject entry = (JSONObject)json.get(0);
        assertEquals("Merge", entry.get("action"));
        assertNotNull(entry.get("timestamp"));
        assertEquals(2L, ((JSONObject)entry.get("details")).get("slave"));
    }

    @Test
    public void testDefaultPaths() {
        Path stream = Paths.get("data", "session_03.json.gz");
        assertEquals(Paths.get("data", "session_03_identity.json"), IdentityMapWriter.defaultIdentityPath(stream));
        assertEquals(Paths.get("data", "session_03_audit.json"), IdentityMapWriter.defaultAuditPath(stream));
        assertEquals(Paths.get("data", "other_identity.json"), IdentityMapWriter.defaultIdentityPath(Paths.get("data", "other.ndjson")));
    }
}
