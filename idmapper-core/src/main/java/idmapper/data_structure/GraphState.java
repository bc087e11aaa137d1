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

import idmapper.utils.JSONSerializable;
import org.json.simple.JSONObject;

import java.util.*;

/**
 * Detached copy of the identity graph (tracks and lineage) at one point in time. This is the content of an undo/redo snapshot.
 */
public class GraphState implements JSONSerializable {
    final SortedMap<Integer, Track> tracks;
    final LineageMap lineage;

    public GraphState(Collection<Track> tracks, LineageMap lineage) {
        this.tracks = new TreeMap<>();
        for (Track t : tracks) this.tracks.put(t.getId(), t.duplicate());
        this.lineage = lineage.duplicate();
    }

    public SortedMap<Integer, Track> getTracks() {
        return Collections.unmodifiableSortedMap(tracks);
    }

    public LineageMap getLineage() {
        return lineage;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        JSONObject t = new JSONObject();
        tracks.forEach((id, track) -> t.put(String.valueOf(id), track.toJSONEntry()));
        res.put("tracks", t);
        res.put("id_lineage", lineage.toJSONEntry());
        return res;
    }

    public static GraphState fromJSONEntry(Map json) {
        Map t = (Map)json.get("tracks");
        if (t == null) throw new IllegalArgumentException("missing \"tracks\" entry");
        List<Track> tracks = new ArrayList<>(t.size());
        for (Object e : t.entrySet()) {
            Map.Entry entry = (Map.Entry)e;
            tracks.add(Track.fromJSONEntry(Integer.parseInt(String.valueOf(entry.getKey())), (Map)entry.getValue()));
        }
        Map l = (Map)json.get("id_lineage");
        LineageMap lineage = l == null ? new LineageMap() : LineageMap.fromJSONEntry(l);
        return new GraphState(tracks, lineage);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphState)) return false;
        GraphState that = (GraphState) o;
        return tracks.equals(that.tracks) && lineage.equals(that.lineage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tracks, lineage);
    }

    @Override
    public String toString() {
        return "GraphState{tracks="+tracks.size()+", lineage="+lineage.size()+"}";
    }
}
