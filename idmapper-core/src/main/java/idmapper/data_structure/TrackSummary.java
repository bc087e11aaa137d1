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

import java.util.Collections;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Row of the operator's track list
 */
public class TrackSummary {
    final int id;
    final SortedSet<Integer> mergedFrom;
    final int length;
    final double durationSeconds;
    final Role role;
    final boolean castMember;

    public TrackSummary(Track track, double fps, Cast cast) {
        this.id = track.getId();
        this.mergedFrom = Collections.unmodifiableSortedSet(new TreeSet<>(track.getMergedFrom()));
        this.length = track.length();
        this.durationSeconds = track.length() / fps;
        this.role = track.getRole();
        this.castMember = cast.contains(role);
    }

    public int getId() {
        return id;
    }

    public SortedSet<Integer> getMergedFrom() {
        return mergedFrom;
    }

    public int getLength() {
        return length;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    public Role getRole() {
        return role;
    }

    public boolean isCastMember() {
        return castMember;
    }

    @Override
    public String toString() {
        String merged = mergedFrom.size() > 1 ? mergedFrom.toString() : String.valueOf(id);
        return String.format(Locale.US, "%d %s %.2fs %s", id, merged, durationSeconds, role);
    }
}
