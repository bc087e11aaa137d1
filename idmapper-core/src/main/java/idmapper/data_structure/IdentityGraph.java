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
package idmapper.data_structure;

import idmapper.data_structure.io.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static idmapper.data_structure.AuditLog.details;

/**
 * Owned state of an identity-mapping session: the track store, the lineage map and the audit log.
 * <p>
 * The whole graph is a single consistency domain guarded by one reentrant lock: every accessor locks it, and operations that touch several tracks
 * (merge, split, bulk engines) hold it for their whole duration through {@link #lock()} / {@link #unlock()} or {@link #locked(Supplier)}.
 * Copies that must be stable ({@link #snapshot()}) are taken while holding the lock; callers perform any I/O on the copy after releasing it.
 */
public class IdentityGraph {
    public final static Logger logger = LoggerFactory.getLogger(IdentityGraph.class);
    private final ReentrantLock lock = new ReentrantLock();
    private final SortedMap<Integer, Track> tracks = new TreeMap<>();
    private final LineageMap lineage = new LineageMap();
    private final AuditLog auditLog = new AuditLog();
    private boolean untrackedDetections;
    private long modificationCount;

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public <T> T locked(Supplier<T> operation) {
        lock.lock();
        try {
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    public Track getTrack(int id) {
        return locked(() -> tracks.get(id));
    }

    public boolean containsTrack(int id) {
        return locked(() -> tracks.containsKey(id));
    }

    public List<Integer> getTrackIds() {
        return locked(() -> new ArrayList<>(tracks.keySet()));
    }

    public List<Track> getTracks() {
        return locked(() -> new ArrayList<>(tracks.values()));
    }

    public int trackCount() {
        return locked(tracks::size);
    }

    /**
     * Inserts a new track in the store and records it in the lineage. Caller must hold the lock when part of a larger operation.
     * @param track track whose id was allocated by {@link #nextId()}
     */
    public void addTrack(Track track) {
        lock.lock();
        try {
            if (tracks.containsKey(track.getId())) throw new IllegalArgumentException("Track "+track.getId()+" already exists");
            tracks.put(track.getId(), track);
            lineage.register(track.getId());
            ++modificationCount;
        } finally {
            lock.unlock();
        }
    }

    public Track removeTrack(int id) {
        lock.lock();
        try {
            Track t = tracks.remove(id);
            if (t != null) ++modificationCount;
            return t;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return an identifier greater than every identifier ever issued in this session
     */
    public int nextId() {
        return locked(() -> Math.max(lineage.maxId(), tracks.isEmpty() ? -1 : tracks.lastKey()) + 1);
    }

    /**
     * Live lineage map. Must only be used while holding the lock.
     * @return lineage map
     */
    public LineageMap getLineage() {
        return lineage;
    }

    public Integer resolve(int originalId) {
        return locked(() -> lineage.resolve(originalId));
    }

    public AuditEntry audit(String action, Map<String, ?> details) {
        return locked(() -> auditLog.append(action, details));
    }

    public List<AuditEntry> getAuditEntries() {
        return locked(auditLog::getEntries);
    }

    public AuditLog copyAuditLog() {
        return locked(auditLog::duplicate);
    }

    public boolean hasUntrackedDetections() {
        return locked(() -> untrackedDetections);
    }

    /**
     * Counter incremented by every mutation, used to detect whether an operation changed the graph
     * @return modification count
     */
    public long getModificationCount() {
        return locked(() -> modificationCount);
    }

    /**
     * @return a detached deep copy of the tracks and lineage
     */
    public GraphState snapshot() {
        return locked(() -> new GraphState(tracks.values(), lineage));
    }

    /**
     * Replaces tracks and lineage by a copy of {@code state} (undo / redo)
     * @param state state to restore
     * @param action name of the audit entry recording the restoration
     */
    public void restore(GraphState state, String action) {
        lock.lock();
        try {
            setState(state.getTracks().values(), state.getLineage());
            auditLog.append(action, details("tracks", tracks.size()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Swaps in the result of a fully parsed detection stream. Clears the audit log and records one "Load" entry.
     * @param result parsed stream
     */
    public void replaceWith(LoadResult result) {
        lock.lock();
        try {
            setState(result.getTracks(), result.getLineage());
            untrackedDetections = result.hasUntrackedDetections();
            auditLog.clear();
            auditLog.append("Load", details("source", result.getSource(), "tracks", tracks.size(), "detections", result.getDetectionCount(), "untracked", result.hasUntrackedDetections()));
        } finally {
            lock.unlock();
        }
        logger.info("loaded {} tracks ({} detections) from {}", result.getTracks().size(), result.getDetectionCount(), result.getSource());
    }

    /**
     * Swaps in an autosaved session, including its audit log
     * @param state tracks and lineage
     * @param audit audit log of the saved session
     * @param untrackedDetections whether the stream of the saved session contained untracked detections
     */
    public void restoreSession(GraphState state, AuditLog audit, boolean untrackedDetections) {
        lock.lock();
        try {
            setState(state.getTracks().values(), state.getLineage());
            this.untrackedDetections = untrackedDetections;
            auditLog.clear();
            for (AuditEntry e : audit.getEntries()) auditLog.append(e);
            auditLog.append("RestoreSession", details("tracks", tracks.size()));
        } finally {
            lock.unlock();
        }
    }

    private void setState(Collection<Track> newTracks, LineageMap newLineage) {
        tracks.clear();
        for (Track t : newTracks) tracks.put(t.getId(), t.duplicate());
        lineage.clear();
        for (Map.Entry<Integer, Integer> e : newLineage.getEntries().entrySet()) lineage.put(e.getKey(), e.getValue());
        ++modificationCount;
    }

    /**
     * Sets the role of every live track among {@code ids}
     * @param ids track ids
     * @param role role
     * @return number of tracks whose role changed
     */
    public int assignRole(Collection<Integer> ids, Role role) {
        lock.lock();
        try {
            List<Integer> changed = new ArrayList<>();
            for (Integer id : new TreeSet<>(ids)) {
                Track t = tracks.get(id);
                if (t == null) {
                    logger.debug("assign role: track {} not found", id);
                    continue;
                }
                if (!t.getRole().equals(role)) {
                    t.setRole(role);
                    changed.add(id);
                }
            }
            if (!changed.isEmpty()) {
                ++modificationCount;
                auditLog.append("AssignRole", details("ids", changed, "role", role.getName()));
            }
            return changed.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resets to {@link Role#IGNORE} every track carrying {@code role}
     * @param role role removed from the cast
     * @return number of tracks modified
     */
    public int resetRole(Role role) {
        lock.lock();
        try {
            List<Integer> ids = tracks.values().stream().filter(t -> t.getRole().equals(role)).map(Track::getId).collect(Collectors.toList());
            if (ids.isEmpty()) return 0;
            for (Integer id : ids) tracks.get(id).setRole(Role.IGNORE);
            ++modificationCount;
            auditLog.append("ResetRole", details("role", role.getName(), "ids", ids));
            return ids.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param frame frame index
     * @return detection of each live track present at {@code frame}, by track id
     */
    public SortedMap<Integer, Detection> getDetectionsAt(int frame) {
        return locked(() -> {
            SortedMap<Integer, Detection> res = new TreeMap<>();
            for (Track t : tracks.values()) {
                if (t.isEmpty() || t.getFirstFrame() > frame || t.getLastFrame() < frame) continue;
                Detection d = t.getDetection(frame);
                if (d != null) res.put(t.getId(), d);
            }
            return res;
        });
    }

    /**
     * @param fps frame rate used to compute durations
     * @param cast known roles
     * @param hideShort when true, tracks shorter than one second that carry no cast role are omitted
     * @return summaries sorted by id
     */
    public List<TrackSummary> getTrackSummaries(double fps, Cast cast, boolean hideShort) {
        return locked(() -> tracks.values().stream()
                .map(t -> new TrackSummary(t, fps, cast))
                .filter(s -> !hideShort || s.isCastMember() || s.getDurationSeconds() >= 1.0)
                .collect(Collectors.toList()));
    }

    /**
     * Flattens the graph into the identity map consumed downstream: every original identifier whose current track carries a cast role
     * @param cast known roles
     * @return original id → role
     */
    public SortedMap<Integer, Role> getIdentityMap(Cast cast) {
        return locked(() -> {
            SortedMap<Integer, Role> res = new TreeMap<>();
            for (Integer oid : lineage.keySet()) {
                Integer master = lineage.resolve(oid);
                Track t = master == null ? null : tracks.get(master);
                if (t == null || t.getRole().isIgnore() || !cast.contains(t.getRole())) continue;
                res.put(oid, t.getRole());
            }
            return res;
        });
    }

    /**
     * @return true if every lineage entry resolves to a live track
     */
    public boolean isLineageConsistent() {
        return locked(() -> lineage.allResolveTo(tracks::containsKey));
    }
}
