package idmapper.processing.track_post_processing;

import idmapper.data_structure.Cast;
import idmapper.data_structure.IdentityGraph;
import idmapper.data_structure.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static idmapper.data_structure.AuditLog.details;

/**
 * Supervised absorption of short fragments into role-bearing tracks.
 * <p>
 * Main tracks carry a cast role; every other track is a candidate. A candidate whose frame span overlaps the span of a main track is never absorbed into it.
 * Otherwise it is absorbed if it starts shortly after the main track ends, or ends shortly before it starts, and the corresponding boundary boxes are close.
 * Candidates are only ever merged into main tracks, never with each other. Passes are repeated until one absorbs nothing.
 */
public class NoiseAbsorber {
    public final static Logger logger = LoggerFactory.getLogger(NoiseAbsorber.class);
    final double maxDistance;
    final double maxTimeGap;

    /**
     * @param maxDistance maximal distance between boundary box centers, in pixels (exclusive)
     * @param maxTimeGap maximal gap, in frames (exclusive)
     */
    public NoiseAbsorber(double maxDistance, double maxTimeGap) {
        if (maxDistance < 0) throw new IllegalArgumentException("max distance should be >= 0, was: "+maxDistance);
        if (maxTimeGap < 0) throw new IllegalArgumentException("max time gap should be >= 0, was: "+maxTimeGap);
        this.maxDistance = maxDistance;
        this.maxTimeGap = maxTimeGap;
    }

    public static NoiseAbsorber withTimeGapSeconds(double maxDistance, double maxTimeGapSeconds, double fps) {
        return new NoiseAbsorber(maxDistance, maxTimeGapSeconds * fps);
    }

    /**
     * @param cast roles of main tracks
     * @return number of absorbed fragments
     */
    public int run(IdentityGraph graph, Cast cast) {
        int absorbed = 0;
        graph.lock();
        try {
            List<Integer> mainIds = graph.getTracks().stream().filter(t -> cast.contains(t.getRole())).map(Track::getId).sorted().collect(Collectors.toList());
            List<Integer> candidates = graph.getTracks().stream().filter(t -> !cast.contains(t.getRole())).map(Track::getId).sorted().collect(Collectors.toList());
            boolean changed = true;
            while (changed) {
                changed = false;
                for (int mainId : mainIds) {
                    Track main = graph.getTrack(mainId);
                    if (main == null || main.isEmpty()) continue;
                    Iterator<Integer> it = candidates.iterator();
                    while (it.hasNext()) {
                        int candId = it.next();
                        Track cand = graph.getTrack(candId);
                        if (cand == null || cand.isEmpty()) {
                            it.remove();
                            continue;
                        }
                        if (main.spanOverlaps(cand)) continue;
                        if (isAdjacent(main, cand) && TrackMerger.merge(graph, mainId, candId, "noise")) {
                            it.remove();
                            ++absorbed;
                            changed = true;
                        }
                    }
                }
            }
            if (absorbed > 0) graph.audit("AbsorbNoise", details("absorbed", absorbed, "max_distance", maxDistance, "max_time_gap_frames", maxTimeGap));
        } finally {
            graph.unlock();
        }
        logger.info("noise absorption: {} fragments absorbed (distance < {}px, gap < {} frames)", absorbed, maxDistance, maxTimeGap);
        return absorbed;
    }

    boolean isAdjacent(Track main, Track cand) {
        double distAfter = Double.POSITIVE_INFINITY;
        int gapAfter = cand.getFirstFrame() - main.getLastFrame();
        if (gapAfter > 0 && gapAfter < maxTimeGap) distAfter = main.tail().getBox().centerDistance(cand.head().getBox());
        double distBefore = Double.POSITIVE_INFINITY;
        int gapBefore = main.getFirstFrame() - cand.getLastFrame();
        if (gapBefore > 0 && gapBefore < maxTimeGap) distBefore = cand.tail().getBox().centerDistance(main.head().getBox());
        return distAfter < maxDistance || distBefore < maxDistance;
    }

    @Override
    public String toString() {
        return "NoiseAbsorber{maxDistance="+maxDistance+"px, maxTimeGap="+maxTimeGap+" frames}";
    }
}
