package idmapper.processing.track_post_processing;

import idmapper.data_structure.Detection;
import idmapper.data_structure.IdentityGraph;
import idmapper.data_structure.Role;
import idmapper.data_structure.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

import static idmapper.data_structure.AuditLog.details;

public class TrackSplitter {
    public final static Logger logger = LoggerFactory.getLogger(TrackSplitter.class);

    /**
     * Cuts a track in two at {@code atFrame}: the head segment holds frames strictly before {@code atFrame}, the tail segment the remaining frames.
     * One segment stays under {@code trackId}, the other receives a newly allocated identifier with role {@link Role#IGNORE} and empty provenance.
     * @param trackId track to cut
     * @param atFrame first frame of the tail segment
     * @param keepHead if true the head stays under {@code trackId} and the tail moves to the new identifier, otherwise the reverse
     * @return outcome; on failure the store is unchanged
     */
    public static SplitResult split(IdentityGraph graph, int trackId, int atFrame, boolean keepHead) {
        graph.lock();
        try {
            Track track = graph.getTrack(trackId);
            if (track == null) return SplitResult.failure(SplitResult.Status.UNKNOWN_TRACK_ID, "Track "+trackId+" not found");
            int idx = track.indexOfFirstFrameFrom(atFrame);
            if (idx < 0) return SplitResult.failure(SplitResult.Status.OUT_OF_BOUNDS, "Frame "+atFrame+" is after the end of track "+track);
            if (idx == 0) return SplitResult.failure(SplitResult.Status.SPLIT_AT_START, "Cannot split track "+track+" at its start (frame "+atFrame+")");
            int newId = graph.nextId();
            List<Detection> moved = keepHead ? track.removeFrom(idx) : track.removeUntil(idx);
            Track created = new Track(newId, moved, Role.IGNORE, Collections.emptySet());
            graph.addTrack(created);
            graph.audit("Split", details("original", trackId, "new_id", newId, "frame", atFrame, "keep_head", keepHead));
            logger.debug("split {} at frame {}: kept {} new {}", trackId, atFrame, track, created);
            return new SplitResult(SplitResult.Status.OK, newId, moved.size(), "Track "+trackId+" split at frame "+atFrame+": new track "+newId+" ("+moved.size()+" detections)");
        } finally {
            graph.unlock();
        }
    }
}
