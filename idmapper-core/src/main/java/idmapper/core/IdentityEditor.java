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
package idmapper.core;

import idmapper.data_structure.Cast;
import idmapper.data_structure.Detection;
import idmapper.data_structure.GraphState;
import idmapper.data_structure.IdentityGraph;
import idmapper.data_structure.Role;
import idmapper.data_structure.TrackSummary;
import idmapper.data_structure.dao.DiskBackedHistoryManager;
import idmapper.data_structure.dao.GraphStateSerializer;
import idmapper.data_structure.io.DetectionLoader;
import idmapper.data_structure.io.IdentityMapWriter;
import idmapper.data_structure.io.LoadResult;
import idmapper.data_structure.io.SessionAutosave;
import idmapper.processing.track_post_processing.AutoStitcher;
import idmapper.processing.track_post_processing.MergeByRoleResult;
import idmapper.processing.track_post_processing.NoiseAbsorber;
import idmapper.processing.track_post_processing.SplitResult;
import idmapper.processing.track_post_processing.TrackMerger;
import idmapper.processing.track_post_processing.TrackSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Editing session over one detection stream: owns the identity graph, the cast, the undo / redo history, the autosave and the background worker.
 * <p>
 * Every mutating operation that changes the graph records the new state in the history and autosaves the session.
 * Undo and redo restore a recorded state and append an "Undo" / "Redo" entry to the audit log.
 */
public class IdentityEditor implements AutoCloseable {
    public final static Logger logger = LoggerFactory.getLogger(IdentityEditor.class);
    final IdentityGraph graph = new IdentityGraph();
    final Cast cast;
    final EngineParameters params;
    final DiskBackedHistoryManager<GraphState> history;
    final DefaultWorker worker;
    final ProgressCallback pcb;
    SessionAutosave autosave;
    boolean autosaveNextToStream = true;
    Path stream;

    /**
     * @param params engine parameters
     * @param cast known roles
     * @param historyDirectory scratch directory of the history; a temporary directory is used if null
     * @param pcb progress feedback, may be null
     * @throws IOException if the history scratch directory cannot be created
     */
    public IdentityEditor(EngineParameters params, Cast cast, File historyDirectory, ProgressCallback pcb) throws IOException {
        this.params = params;
        this.cast = cast;
        this.pcb = pcb == null ? ProgressCallback.get(logger) : pcb;
        this.history = new DiskBackedHistoryManager<>(params.getMaxHistory(), params.getRamBuffer(), historyDirectory, new GraphStateSerializer());
        this.worker = new DefaultWorker(this.pcb);
    }

    /**
     * @return editor configured from the user settings file
     * @throws IOException if the history scratch directory cannot be created
     */
    public static IdentityEditor fromProperties() throws IOException {
        return new IdentityEditor(EngineParameters.fromProperties(), EngineParameters.castFromProperties(), null, null);
    }

    public IdentityGraph getGraph() {
        return graph;
    }

    public Cast getCast() {
        return cast;
    }

    public EngineParameters getParameters() {
        return params;
    }

    public DefaultWorker getWorker() {
        return worker;
    }

    public Path getStream() {
        return stream;
    }

    public SessionAutosave getAutosave() {
        return autosave;
    }

    /**
     * By default the session is autosaved next to the loaded stream ({@link SessionAutosave#forStream(Path)})
     * @param autosave destination of automatic saves after each change; null disables autosave
     */
    public synchronized IdentityEditor setAutosave(SessionAutosave autosave) {
        this.autosave = autosave;
        this.autosaveNextToStream = false;
        return this;
    }

    // loading

    /**
     * Loads a detection stream. The live graph is replaced only once the whole stream has been parsed.
     * @param file gzip NDJSON detection stream
     * @return parsed stream
     * @throws IOException if the stream is malformed or unreadable; the live graph is then untouched
     */
    public LoadResult load(Path file) throws IOException {
        return load(file, () -> false);
    }

    public LoadResult load(Path file, BooleanSupplier cancelled) throws IOException {
        LoadResult result = new DetectionLoader(cancelled, pcb).load(file);
        synchronized (this) {
            graph.replaceWith(result);
            history.reset(graph.snapshot());
            stream = file;
            if (autosaveNextToStream) autosave = SessionAutosave.forStream(file);
            saveSession();
        }
        return result;
    }

    public Future<LoadResult> loadInBackground(Path file, Consumer<DefaultWorker.Outcome<LoadResult>> onDone) {
        return worker.execute(cancelled -> load(file, cancelled), onDone);
    }

    /**
     * Replaces the live graph by the autosaved session
     * @return false if there is no autosave to restore
     * @throws IOException if the autosave cannot be read; the live graph is then untouched
     */
    public synchronized boolean restoreAutosave() throws IOException {
        if (autosave == null || !autosave.exists()) return false;
        autosave.restore(graph);
        history.reset(graph.snapshot());
        return true;
    }

    // editing

    public boolean merge(int master, int slave) {
        return commit(() -> TrackMerger.merge(graph, master, slave));
    }

    /**
     * @return id of the master track, or -1 if fewer than two selected tracks exist
     */
    public int manualMerge(Collection<Integer> ids) {
        return commit(() -> TrackMerger.manualMerge(graph, ids, cast));
    }

    public MergeByRoleResult mergeAllByRole() {
        return commit(() -> TrackMerger.mergeAllByRole(graph, cast));
    }

    public Future<MergeByRoleResult> mergeAllByRoleInBackground(Consumer<DefaultWorker.Outcome<MergeByRoleResult>> onDone) {
        return worker.execute(cancelled -> mergeAllByRole(), onDone);
    }

    public SplitResult split(int trackId, int atFrame, boolean keepHead) {
        SplitResult res = commit(() -> TrackSplitter.split(graph, trackId, atFrame, keepHead));
        if (!res.isSuccess()) logger.warn("split refused: {}", res.getMessage());
        return res;
    }

    /**
     * @return number of merges performed
     */
    public int autoStitch() {
        AutoStitcher stitcher = new AutoStitcher(params.getLookahead(), params.getStitchTimeGapSeconds(), params.getFps(), params.getStitchMaxDistance());
        int count = commit(() -> stitcher.run(graph));
        pcb.log("Auto-stitch: "+count+" fragments merged");
        return count;
    }

    public Future<Integer> autoStitchInBackground(Consumer<DefaultWorker.Outcome<Integer>> onDone) {
        return worker.execute(cancelled -> autoStitch(), onDone);
    }

    /**
     * @return number of fragments absorbed into cast tracks
     */
    public int absorbNoise() {
        NoiseAbsorber absorber = NoiseAbsorber.withTimeGapSeconds(params.getNoiseMaxDistance(), params.getStitchTimeGapSeconds(), params.getFps());
        int count = commit(() -> absorber.run(graph, cast));
        pcb.log("Noise absorption: "+count+" fragments absorbed");
        return count;
    }

    public Future<Integer> absorbNoiseInBackground(Consumer<DefaultWorker.Outcome<Integer>> onDone) {
        return worker.execute(cancelled -> absorbNoise(), onDone);
    }

    /**
     * @param ids selected tracks
     * @param roleName a cast member, or {@value Role#IGNORE_NAME}
     * @return number of tracks whose role changed
     */
    public int assignRole(Collection<Integer> ids, String roleName) {
        Role role = Role.parse(roleName);
        if (!role.isIgnore() && !cast.contains(role)) {
            logger.warn("role {} is not a cast member", role);
            return 0;
        }
        return commit(() -> graph.assignRole(ids, role));
    }

    public boolean addCastMember(String name) {
        Role role = Role.of(name);
        if (role.isIgnore()) {
            logger.warn("\"{}\" is reserved and cannot be a cast member", Role.IGNORE_NAME);
            return false;
        }
        return cast.add(role);
    }

    /**
     * Removes a role from the cast; every track carrying it is reset to {@value Role#IGNORE_NAME}
     * @return number of tracks reset
     */
    public int removeCastMember(String name) {
        Role role = Role.of(name);
        if (!cast.remove(role)) {
            logger.warn("role {} is not a cast member", role);
            return 0;
        }
        return commit(() -> graph.resetRole(role));
    }

    // history

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    /**
     * @return false if there is nothing to undo or if the previous state could not be restored
     */
    public synchronized boolean undo() {
        return restore(history.undo(), "Undo");
    }

    public synchronized boolean redo() {
        return restore(history.redo(), "Redo");
    }

    private boolean restore(GraphState state, String action) {
        if (state == null) return false;
        graph.restore(state, action);
        saveSession();
        return true;
    }

    public DiskBackedHistoryManager<GraphState> getHistory() {
        return history;
    }

    // queries

    /**
     * @param hideShort hide tracks shorter than one second that carry no cast role; ignored when the stream contains untracked detections
     */
    public List<TrackSummary> getTrackSummaries(boolean hideShort) {
        return graph.getTrackSummaries(params.getFps(), cast, hideShort && !graph.hasUntrackedDetections());
    }

    public SortedMap<Integer, Detection> getDetectionsAt(int frame) {
        return graph.getDetectionsAt(frame);
    }

    public SortedMap<Integer, Role> getIdentityMap() {
        return graph.getIdentityMap(cast);
    }

    // export

    /**
     * @param output destination; if null {@code <stream>_identity.json} next to the loaded stream
     * @return destination path
     */
    public Path exportIdentityMap(Path output) throws IOException {
        if (output == null) output = IdentityMapWriter.defaultIdentityPath(requireStream());
        IdentityMapWriter.writeIdentityMap(output, graph, cast);
        return output;
    }

    public Path exportAuditLog(Path output) throws IOException {
        if (output == null) output = IdentityMapWriter.defaultAuditPath(requireStream());
        IdentityMapWriter.writeAuditLog(output, graph);
        return output;
    }

    private Path requireStream() {
        if (stream == null) throw new IllegalStateException("no stream loaded: an output path is required");
        return stream;
    }

    /**
     * Runs {@code operation} and records the resulting state if the graph was modified
     */
    private synchronized <T> T commit(Supplier<T> operation) {
        GraphState state = null;
        T res;
        graph.lock();
        try {
            long mod = graph.getModificationCount();
            res = operation.get();
            if (graph.getModificationCount() != mod) state = graph.snapshot();
        } finally {
            graph.unlock();
        }
        if (state != null) {
            history.push(state);
            saveSession();
        }
        return res;
    }

    private void saveSession() {
        if (autosave == null) return;
        try {
            autosave.save(graph);
        } catch (IOException e) {
            logger.error("Error while autosaving session to "+autosave.getFile(), e);
        }
    }

    @Override
    public void close() {
        worker.close();
        history.close();
    }
}
