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
import java.util.function.IntPredicate;

/**
 * Maps every identifier ever allocated to the identifier of the live track that currently represents it.
 * Merges re-point all entries of the absorbed track in a single pass, so that any entry resolves in one hop.
 */
public class LineageMap implements JSONSerializable {
    private final TreeMap<Integer, Integer> lineage = new TreeMap<>();

    public LineageMap() {}

    public LineageMap(Map<Integer, Integer> entries) {
        lineage.putAll(entries);
    }

    /**
     * Records {@code id} as its own master if it is not already known
     * @param id identifier
     */
    public void register(int id) {
        lineage.putIfAbsent(id, id);
    }

    public void put(int originalId, int masterId) {
        lineage.put(originalId, masterId);
    }

    public Integer get(int originalId) {
        return lineage.get(originalId);
    }

    public boolean containsKey(int originalId) {
        return lineage.containsKey(originalId);
    }

    /**
     * Re-points every entry currently pointing to {@code slave} to {@code master}
     * @param slave identifier absorbed
     * @param master identifier that absorbs
     * @return number of entries modified
     */
    public int repoint(int slave, int master) {
        int count = 0;
        for (Map.Entry<Integer, Integer> e : lineage.entrySet()) {
            if (e.getValue() == slave) {
                e.setValue(master);
                ++count;
            }
        }
        return count;
    }

    /**
     * Follows the chain starting at {@code originalId} until reaching an identifier that maps to itself or is unknown
     * @param originalId identifier
     * @return resolved identifier, or null if {@code originalId} is unknown
     */
    public Integer resolve(int originalId) {
        Integer current = lineage.get(originalId);
        if (current == null) return null;
        Set<Integer> visited = new HashSet<>();
        visited.add(originalId);
        while (visited.add(current)) {
            Integer next = lineage.get(current);
            if (next == null || next.equals(current)) return current;
            current = next;
        }
        return current; // cycle
    }

    /**
     * @param isLive predicate on identifiers of live tracks
     * @return true if every entry resolves to a live identifier
     */
    public boolean allResolveTo(IntPredicate isLive) {
        for (Integer k : lineage.keySet()) {
            Integer r = resolve(k);
            if (r == null || !isLive.test(r)) return false;
        }
        return true;
    }

    /**
     * Adds identity entries for every track, and entries pointing to the track for each identifier of its provenance, when missing
     * @param tracks live tracks
     * @return number of entries added
     */
    public int fillMissing(Collection<Track> tracks) {
        int count = 0;
        for (Track t : tracks) {
            if (lineage.putIfAbsent(t.getId(), t.getId()) == null) ++count;
            for (int h : t.getMergedFrom()) {
                if (lineage.putIfAbsent(h, t.getId()) == null) ++count;
            }
        }
        return count;
    }

    /**
     * @return greatest identifier ever recorded, or -1 if empty
     */
    public int maxId() {
        return lineage.isEmpty() ? -1 : lineage.lastKey();
    }

    public SortedMap<Integer, Integer> getEntries() {
        return Collections.unmodifiableSortedMap(lineage);
    }

    public Set<Integer> keySet() {
        return Collections.unmodifiableSet(lineage.keySet());
    }

    public int size() {
        return lineage.size();
    }

    public void clear() {
        lineage.clear();
    }

    public LineageMap duplicate() {
        return new LineageMap(lineage);
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        lineage.forEach((k, v) -> res.put(String.valueOf(k), v));
        return res;
    }

    public static LineageMap fromJSONEntry(Map json) {
        LineageMap res = new LineageMap();
        for (Object e : json.entrySet()) {
            Map.Entry entry = (Map.Entry)e;
            res.put(Integer.parseInt(String.valueOf(entry.getKey())), ((Number)entry.getValue()).intValue());
        }
        return res;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineageMap)) return false;
        return lineage.equals(((LineageMap) o).lineage);
    }

    @Override
    public int hashCode() {
        return lineage.hashCode();
    }

    @Override
    public String toString() {
        return lineage.toString();
    }
}
