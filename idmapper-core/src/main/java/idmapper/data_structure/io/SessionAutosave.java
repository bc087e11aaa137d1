/* 
 * Copyright (C) 2025 IDMAPPER developers
 *
 * This File is part of IDMAPPER
 *
 * IDMAPPER is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * IDMAPPER is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with IDMAPPER.  If not, see <http://www.gnu.org/licenses/>.
 */
package idmapper.data_structure.io;

import idmapper.data_structure.AuditLog;
import idmapper.data_structure.GraphState;
import idmapper.data_structure.IdentityGraph;
import idmapper.utils.FileIO;
import idmapper.utils.JSONUtils;
import idmapper.utils.Utils;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Crash-safe session file {@code {tracks, id_lineage, audit_log, untracked_detections, updated_at}}, written to a temporary file then renamed.
 */
public class SessionAutosave {
    public final static Logger logger = LoggerFactory.getLogger(SessionAutosave.class);
    public final static String AUTOSAVE_SUFFIX = "_autosave.json";
    public final static String UNTRACKED_KEY = "untracked_detections";
    final Path file;

    public SessionAutosave(Path file) {
        this.file = file;
    }

    /**
     * @param stream detection stream {@code <name>.json.gz}
     * @return autosave of the stream: {@code <name>_autosave.json} in the same directory
     */
    public static SessionAutosave forStream(Path stream) {
        return new SessionAutosave(stream.resolveSibling(IdentityMapWriter.baseName(stream) + AUTOSAVE_SUFFIX));
    }

    public Path getFile() {
        return file;
    }

    public boolean exists() {
        return Files.isRegularFile(file);
    }

    public void save(IdentityGraph graph) throws IOException {
        GraphState state;
        AuditLog audit;
        boolean untracked;
        graph.lock();
        try {
            state = graph.snapshot();
            audit = graph.copyAuditLog();
            untracked = graph.hasUntrackedDetections();
        } finally {
            graph.unlock();
        }
        save(state, audit, untracked);
    }

    public void save(GraphState state, AuditLog audit, boolean untrackedDetections) throws IOException {
        JSONObject json = state.toJSONEntry();
        json.put("audit_log", audit.toJSONEntry());
        json.put(UNTRACKED_KEY, untrackedDetections);
        json.put("updated_at", Utils.getTimestamp());
        FileIO.writeAtomically(file, json.toJSONString());
        logger.debug("session autosaved to {}: {} tracks", file, state.getTracks().size());
    }

    /**
     * Reads the session file. Lineage entries missing from the file are synthesized: each live track maps to itself, and each identifier of its provenance maps to it.
     * When the untracked detections flag is missing it is set if any lineage identifier is synthetic.
     * @return saved session
     * @throws MalformedStreamException if the file cannot be parsed
     * @throws IOException on read error
     */
    public Session read() throws IOException {
        JSONObject json;
        try {
            json = JSONUtils.parseJSONObject(FileIO.readString(file));
        } catch (ParseException e) {
            throw new MalformedStreamException("invalid session file "+file+": "+e, 0, e);
        }
        GraphState state;
        try {
            state = GraphState.fromJSONEntry(json);
        } catch (RuntimeException e) {
            throw new MalformedStreamException("invalid session file "+file+": "+e.getMessage(), 0, e);
        }
        int added = state.getLineage().fillMissing(state.getTracks().values());
        if (added > 0) logger.info("session {}: {} missing lineage entries synthesized", file, added);
        AuditLog audit = AuditLog.fromJSONEntry((List)json.get("audit_log"));
        Object untracked = json.get(UNTRACKED_KEY);
        boolean untrackedDetections = untracked instanceof Boolean ? (Boolean)untracked : hasSyntheticIds(state);
        return new Session(state, audit, untrackedDetections, (String)json.get("updated_at"));
    }

    static boolean hasSyntheticIds(GraphState state) {
        return state.getLineage().keySet().stream().anyMatch(id -> id >= TrackStoreBuilder.SYNTHETIC_ID_OFFSET);
    }

    /**
     * Restores the saved session into {@code graph}
     * @param graph graph replaced by the saved session
     * @return restored session
     * @throws IOException if the file cannot be read; {@code graph} is then left untouched
     */
    public Session restore(IdentityGraph graph) throws IOException {
        Session s = read();
        graph.restoreSession(s.state, s.auditLog, s.untrackedDetections);
        logger.info("session restored from {}: {} tracks", file, s.state.getTracks().size());
        return s;
    }

    public boolean delete() throws IOException {
        return Files.deleteIfExists(file);
    }

    public static class Session {
        final GraphState state;
        final AuditLog auditLog;
        final boolean untrackedDetections;
        final String updatedAt;

        Session(GraphState state, AuditLog auditLog, boolean untrackedDetections, String updatedAt) {
            this.state = state;
            this.auditLog = auditLog;
            this.untrackedDetections = untrackedDetections;
            this.updatedAt = updatedAt;
        }

        public GraphState getState() {
            return state;
        }

        public AuditLog getAuditLog() {
            return auditLog;
        }

        public boolean hasUntrackedDetections() {
            return untrackedDetections;
        }

        public String getUpdatedAt() {
            return updatedAt;
        }
    }
}
