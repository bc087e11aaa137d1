package idmapper.processing.track_post_processing;

import idmapper.data_structure.IdentityGraph;
import idmapper.data_structure.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

import static idmapper.data_structure.AuditLog.details;

/**
 * Unsupervised stitching of temporally and spatially adjacent fragments.
 * <p>
 * Tracks are ordered by first frame; each track A is compared to the next {@code lookahead} tracks B. B is eligible if it starts strictly after A ends,
 * within the maximal gap, and the distance between the center of the last box of A and the center of the first box of B is below the maximal distance.
 * The closest eligible B is merged into A (first one in order on ties), then the scan resumes at A. Passes are repeated until one performs no merge.
 * <p>
 * This is a greedy, order-dependent heuristic: it may merge unrelated fragments, and results should be reviewed (and undone if needed).
 */
public class AutoStitcher {
    public final static Logger logger = LoggerFactory.getLogger(AutoStitcher.class);
    final int lookahead;
    final double maxTimeGapSeconds;
    final double fps;
    final double maxDistance;

    /**
     * @param lookahead number of following tracks considered as merge candidates
     * @param maxTimeGapSeconds maximal gap between two fragments, in seconds
     * @param fps frame rate used to convert the gap to frames
     * @param maxDistance maximal distance between boundary box centers, in pixels (exclusive)
     */
    public AutoStitcher(int lookahead, double maxTimeGapSeconds, double fps, double maxDistance) {
        if (lookahead < 1) throw new IllegalArgumentException("lookahead should be >= 1, was: "+lookahead);
        if (maxTimeGapSeconds < 0) throw new IllegalArgumentException("max time gap should be >= 0, was: "+maxTimeGapSeconds);
        if (fps <= 0) throw new IllegalArgumentException("fps should be > 0, was: "+fps);
        if (maxDistance < 0) throw new IllegalArgumentException("max distance should be >= 0, was: "+maxDistance);
        this.lookahead = lookahead;
        this.maxTimeGapSeconds = maxTimeGapSeconds;
        this.fps = fps;
        this.maxDistance = maxDistance;
    }

    public double getMaxFrameGap() {
        return maxTimeGapSeconds * fps;
    }

    /**
     * @return number of merges performed
     */
    public int run(IdentityGraph graph) {
        double maxGap = getMaxFrameGap();
        int merged = 0;
        graph.lock();
        try {
            boolean changed = true;
            while (changed) {
                changed = false;
                List<Track> order = orderByFirstFrame(graph);
                int i = 0;
                while (i < order.size() - 1) {
                    Track a = order.get(i);
                    Track best = null;
                    double minDist = Double.POSITIVE_INFINITY;
                    int limit = Math.min(i + lookahead, order.size() - 1);
                    for (int j = i + 1; j <= limit; ++j) {
                        Track b = order.get(j);
                        int gap = b.getFirstFrame() - a.getLastFrame();
                        if (gap <= 0 || gap > maxGap) continue;
                        double d = a.tail().getBox().centerDistance(b.head().getBox());
                        if (d < maxDistance && d < minDist) {
                            minDist = d;
                            best = b;
                        }
                    }
                    if (best != null && TrackMerger.merge(graph, a.getId(), best.getId(), "auto-stitch")) {
                        ++merged;
                        changed = true;
                        order = orderByFirstFrame(graph); // a keeps its first frame, thus its position
                    } else ++i;
                }
            }
            if (merged > 0) graph.audit("AutoStitch", details("merged", merged, "lookahead", lookahead, "max_time_gap", maxTimeGapSeconds, "max_distance", maxDistance));
        } finally {
            graph.unlock();
        }
        logger.info("auto-stitch: {} fragments merged (lookahead: {}, time gap: {}s, distance: {}px)", merged, lookahead, maxTimeGapSeconds, maxDistance);
        return merged;
    }

    static List<Track> orderByFirstFrame(IdentityGraph graph) {
        return graph.getTracks().stream().filter(t -> !t.isEmpty()).sorted(Track.FIRST_FRAME_ORDER).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "AutoStitcher{lookahead="+lookahead+", maxTimeGap="+maxTimeGapSeconds+"s, maxDistance="+maxDistance+"px}";
    }
}
