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
import idmapper.utils.JSONUtils;
import idmapper.utils.geom.Box;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Chronological sequence of detections of one consolidated identity.
 * Detections are always kept sorted by frame (stable on ties), so that frames and boxes form two parallel frame-sorted sequences.
 * {@code mergedFrom} holds every original identifier folded into this track.
 */
public class Track implements JSONSerializable {
    public final static Logger logger = LoggerFactory.getLogger(Track.class);
    public final static Comparator<Track> FIRST_FRAME_ORDER = Comparator.comparingInt(Track::getFirstFrame).thenComparingInt(Track::getId);
    final int id;
    final List<Detection> detections;
    final SortedSet<Integer> mergedFrom;
    Role role = Role.IGNORE;

    /**
     * Creates an empty track that was issued by the tracker, thus provenance is the track itself
     * @param id identifier
     */
    public Track(int id) {
        this(id, Collections.emptyList(), Role.IGNORE, Collections.singleton(id));
    }

    public Track(int id, Collection<Detection> detections, Role role, Collection<Integer> mergedFrom) {
        this.id = id;
        this.detections = new ArrayList<>(detections);
        this.detections.sort(Detection.FRAME_COMPARATOR);
        this.role = role == null ? Role.IGNORE : role;
        this.mergedFrom = new TreeSet<>(mergedFrom);
    }

    public int getId() {
        return id;
    }

    public Role getRole() {
        return role;
    }

    public Track setRole(Role role) {
        this.role = role == null ? Role.IGNORE : role;
        return this;
    }

    public SortedSet<Integer> getMergedFrom() {
        return Collections.unmodifiableSortedSet(mergedFrom);
    }

    public List<Detection> getDetections() {
        return Collections.unmodifiableList(detections);
    }

    public int[] getFrames() {
        return detections.stream().mapToInt(Detection::getFrame).toArray();
    }

    public List<Box> getBoxes() {
        return detections.stream().map(Detection::getBox).collect(Collectors.toList());
    }

    public Detection getDetection(int frame) {
        return detections.stream().filter(d -> d.frame == frame).findFirst().orElse(null);
    }

    public boolean isEmpty() {
        return detections.isEmpty();
    }

    public int length() {
        return detections.size();
    }

    public Detection head() {
        return detections.get(0);
    }

    public Detection tail() {
        return detections.get(detections.size()-1);
    }

    public int getFirstFrame() {
        return head().frame;
    }

    public int getLastFrame() {
        return tail().frame;
    }

    /**
     * @param other track
     * @return whether the frame spans [first, last] of both tracks intersect
     */
    public boolean spanOverlaps(Track other) {
        return getFirstFrame() <= other.getLastFrame() && other.getFirstFrame() <= getLastFrame();
    }

    /**
     * @param frame frame index
     * @return index of the first detection whose frame is greater or equal to {@code frame}, or -1 if there is none
     */
    public int indexOfFirstFrameFrom(int frame) {
        for (int i = 0; i<detections.size(); ++i) {
            if (detections.get(i).frame >= frame) return i;
        }
        return -1;
    }

    public Track addDetection(Detection detection) {
        detections.add(detection);
        if (detections.size()>1 && detections.get(detections.size()-2).frame > detection.frame) sortByFrame();
        return this;
    }

    /**
     * Appends all detections and provenance of {@code other} to this track, then restores the frame order
     * @param other track folded into this one
     */
    public void append(Track other) {
        detections.addAll(other.detections);
        mergedFrom.addAll(other.mergedFrom);
        sortByFrame();
    }

    /**
     * Removes and returns the detections from index {@code fromIndex} (included) to the end of the track
     * @param fromIndex first index removed
     * @return removed detections
     */
    public List<Detection> removeFrom(int fromIndex) {
        List<Detection> sub = detections.subList(fromIndex, detections.size());
        List<Detection> res = new ArrayList<>(sub);
        sub.clear();
        return res;
    }

    /**
     * Removes and returns the detections from the start of the track to index {@code toIndex} (excluded)
     * @param toIndex first index kept
     * @return removed detections
     */
    public List<Detection> removeUntil(int toIndex) {
        List<Detection> sub = detections.subList(0, toIndex);
        List<Detection> res = new ArrayList<>(sub);
        sub.clear();
        return res;
    }

    void sortByFrame() {
        detections.sort(Detection.FRAME_COMPARATOR); // List.sort is stable
    }

    public Track duplicate() {
        return new Track(id, detections, role, mergedFrom);
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("frames", JSONUtils.toJSONArray(getFrames()));
        JSONArray boxes = new JSONArray();
        for (Detection d : detections) boxes.add(d.box.toJSONEntry());
        res.put("boxes", boxes);
        res.put("role", role.getName());
        res.put("merged_from", JSONUtils.toJSONArray(mergedFrom));
        return res;
    }

    public static Track fromJSONEntry(int id, Map json) {
        List frames = (List)json.get("frames");
        List boxes = (List)json.get("boxes");
        if (frames == null || boxes == null) throw new IllegalArgumentException("Track "+id+": missing frames or boxes");
        if (frames.size() != boxes.size()) throw new IllegalArgumentException("Track "+id+": frames and boxes differ in length: "+frames.size()+" vs "+boxes.size());
        List<Detection> dets = new ArrayList<>(frames.size());
        for (int i = 0; i<frames.size(); ++i) dets.add(new Detection(((Number)frames.get(i)).intValue(), Box.fromJSONEntry(boxes.get(i))));
        List merged = (List)json.get("merged_from");
        Collection<Integer> mergedFrom = merged == null ? Collections.singleton(id) : JSONUtils.fromIntList(merged);
        return new Track(id, dets, Role.parse((String)json.get("role")), mergedFrom);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Track track = (Track) o;
        return id == track.id && detections.equals(track.detections) && role.equals(track.role) && mergedFrom.equals(track.mergedFrom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, detections, role, mergedFrom);
    }

    @Override
    public String toString() {
        if (detections.isEmpty()) return id+"[]";
        return id+"["+getFirstFrame()+"->"+getLastFrame()+"]";
    }
}
