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

import idmapper.data_structure.LineageMap;
import idmapper.data_structure.Track;

import java.util.Collection;
import java.util.Collections;

/**
 * Fully parsed detection stream, ready to be swapped into an {@link idmapper.data_structure.IdentityGraph}
 */
public class LoadResult {
    final Collection<Track> tracks;
    final LineageMap lineage;
    final boolean untrackedDetections;
    final int detectionCount;
    final int lineCount;
    final String source;

    LoadResult(Collection<Track> tracks, LineageMap lineage, boolean untrackedDetections, int detectionCount, int lineCount, String source) {
        this.tracks = Collections.unmodifiableCollection(tracks);
        this.lineage = lineage;
        this.untrackedDetections = untrackedDetections;
        this.detectionCount = detectionCount;
        this.lineCount = lineCount;
        this.source = source;
    }

    public Collection<Track> getTracks() {
        return tracks;
    }

    public LineageMap getLineage() {
        return lineage;
    }

    /**
     * @return true if at least one detection came without a tracker identifier; callers should then relax the default "hide short tracks" filter
     */
    public boolean hasUntrackedDetections() {
        return untrackedDetections;
    }

    public int getDetectionCount() {
        return detectionCount;
    }

    public int getLineCount() {
        return lineCount;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "LoadResult{source="+source+", tracks="+tracks.size()+", detections="+detectionCount+", untracked="+untrackedDetections+"}";
    }
}
