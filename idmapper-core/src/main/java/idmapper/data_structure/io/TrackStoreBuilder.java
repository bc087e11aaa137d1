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

import com.google.common.collect.Sets;
import idmapper.data_structure.Detection;
import idmapper.data_structure.LineageMap;
import idmapper.data_structure.Track;
import idmapper.utils.geom.Box;

import java.util.*;

/**
 * Private scratch store filled by the {@link DetectionLoader}. Nothing is visible to the live graph until {@link #build(String, int)} succeeds.
 */
public class TrackStoreBuilder {
    /**
     * Synthetic identifiers of untracked detections are {@code SYNTHETIC_ID_OFFSET + frame * MAX_DETECTIONS_PER_FRAME + positionInFrame}
     */
    public final static int SYNTHETIC_ID_OFFSET = 9_000_000;
    public final static int MAX_DETECTIONS_PER_FRAME = 1000;
    final Map<Integer, Track> tracks = new HashMap<>();
    final Set<Integer> sourceIds = new HashSet<>();
    final Set<Integer> syntheticIds = new HashSet<>();
    int detectionCount;

    public static int syntheticId(int frame, int positionInFrame) {
        if (positionInFrame < 0 || positionInFrame >= MAX_DETECTIONS_PER_FRAME) throw new IllegalArgumentException("position in frame should be in [0, "+MAX_DETECTIONS_PER_FRAME+"), was: "+positionInFrame);
        if (frame < 0) throw new IllegalArgumentException("frame should be positive, was: "+frame);
        long id = SYNTHETIC_ID_OFFSET + (long)frame * MAX_DETECTIONS_PER_FRAME + positionInFrame;
        if (id > Integer.MAX_VALUE) throw new IllegalArgumentException("frame index too large for synthetic identifier: "+frame);
        return (int)id;
    }

    /**
     * @param frame frame index
     * @param positionInFrame index of the detection within its frame record
     * @param sourceId tracker identifier, or null if the detection is untracked
     * @param box bounding box
     * @return identifier of the track the detection was added to
     */
    public int add(int frame, int positionInFrame, Integer sourceId, Box box) {
        int id;
        if (sourceId == null) {
            id = syntheticId(frame, positionInFrame);
            syntheticIds.add(id);
        } else {
            id = sourceId;
            sourceIds.add(id);
        }
        tracks.computeIfAbsent(id, Track::new).addDetection(new Detection(frame, box));
        ++detectionCount;
        return id;
    }

    public boolean hasUntrackedDetections() {
        return !syntheticIds.isEmpty();
    }

    public int getDetectionCount() {
        return detectionCount;
    }

    public int trackCount() {
        return tracks.size();
    }

    public LoadResult build(String source, int lineCount) throws MalformedStreamException {
        Set<Integer> collisions = Sets.intersection(sourceIds, syntheticIds);
        if (!collisions.isEmpty()) throw new MalformedStreamException("tracker identifiers collide with synthetic identifiers of untracked detections: "+new TreeSet<>(collisions), 0);
        LineageMap lineage = new LineageMap();
        List<Track> res = new ArrayList<>(tracks.values());
        res.sort(Comparator.comparingInt(Track::getId));
        for (Track t : res) lineage.register(t.getId());
        return new LoadResult(res, lineage, hasUntrackedDetections(), detectionCount, lineCount, source);
    }
}
