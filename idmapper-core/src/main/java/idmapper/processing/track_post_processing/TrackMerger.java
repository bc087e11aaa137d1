package idmapper.processing.track_post_processing;

import idmapper.data_structure.Cast;
import idmapper.data_structure.IdentityGraph;
import idmapper.data_structure.Role;
import idmapper.data_structure.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

import static idmapper.data_structure.AuditLog.details;

/**
 * Folds tracks into each other. Overlapping frames are not reconciled: both detections are kept, sorted by frame.
 */
public class TrackMerger {
    public final static Logger logger = LoggerFactory.getLogger(TrackMerger.class);

    /**
     * Appends the detections and provenance of {@code slave} to {@code master}, re-points the lineage of {@code slave} and removes it from the store.
     * No-op if either track is absent or if both ids are equal.
     * @return true if a merge was performed
     */
    public static boolean merge(IdentityGraph graph, int master, int slave) {
        return merge(graph, master, slave, "manual");
    }

    static boolean merge(IdentityGraph graph, int master, int slave, String reason) {
        if (master == slave) return false;
        graph.lock();
        try {
            Track m = graph.getTrack(master);
            Track s = graph.getTrack(slave);
            if (m == null || s == null) {
                logger.debug("merge {} <- {} ignored: {} absent", master, slave, m == null ? master : slave);
                return false;
            }
            m.append(s);
            int repointed = graph.getLineage().repoint(slave, master);
            graph.removeTrack(slave);
            graph.audit("Merge", details("master", master, "slave", slave, "reason", reason, "length", m.length(), "lineage", repointed));
            logger.debug("merged {} <- {} ({}): {}", master, slave, reason, m);
            return true;
        } finally {
            graph.unlock();
        }
    }

    /**
     * Merges all selected tracks into the one with the smallest id.
     * If the master carries no cast role but a merged track does, the master inherits the first such role; otherwise it keeps its own.
     * @param ids selected track ids
     * @param cast known roles
     * @return id of the master track, or -1 if fewer than two selected tracks exist
     */
    public static int manualMerge(IdentityGraph graph, Collection<Integer> ids, Cast cast) {
        graph.lock();
        try {
            List<Integer> live = new TreeSet<>(ids).stream().filter(graph::containsTrack).collect(Collectors.toList());
            if (live.size() < 2) {
                logger.warn("manual merge needs at least 2 existing tracks, got: {}", ids);
                return -1;
            }
            int master = live.get(0);
            Role role = graph.getTrack(master).getRole();
            for (int slave : live.subList(1, live.size())) {
                Role slaveRole = graph.getTrack(slave).getRole();
                if (!cast.contains(role) && cast.contains(slaveRole)) role = slaveRole;
                merge(graph, master, slave, "manual");
            }
            graph.getTrack(master).setRole(role);
            graph.audit("ManualMerge", details("master", master, "ids", live, "role", role.getName()));
            return master;
        } finally {
            graph.unlock();
        }
    }

    /**
     * For each cast role, merges all tracks carrying it into the earliest allocated one (smallest id)
     * @param cast known roles
     * @return merge count and roles for which at least one merge occurred
     */
    public static MergeByRoleResult mergeAllByRole(IdentityGraph graph, Cast cast) {
        graph.lock();
        try {
            int count = 0;
            List<Role> roles = new ArrayList<>();
            for (Role role : cast) {
                List<Integer> ids = graph.getTracks().stream().filter(t -> t.getRole().equals(role)).map(Track::getId).sorted().collect(Collectors.toList());
                if (ids.size() < 2) continue;
                int master = ids.get(0);
                for (int slave : ids.subList(1, ids.size())) {
                    if (merge(graph, master, slave, "role:"+role.getName())) ++count;
                }
                roles.add(role);
            }
            if (count > 0) graph.audit("MergeByRole", details("merged", count, "roles", roles.stream().map(Role::getName).collect(Collectors.toList())));
            logger.info("merge by role: {} fragments merged for {}", count, roles);
            return new MergeByRoleResult(count, roles);
        } finally {
            graph.unlock();
        }
    }
}
