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

import idmapper.utils.geom.Box;

import java.util.Comparator;
import java.util.Objects;

/**
 * One bounding box of the tracker output, at a given frame. Immutable.
 */
public class Detection {
    public final static Comparator<Detection> FRAME_COMPARATOR = Comparator.comparingInt(Detection::getFrame);
    final int frame;
    final Box box;

    public Detection(int frame, Box box) {
        this.frame = frame;
        this.box = Objects.requireNonNull(box, "box");
    }

    public int getFrame() {
        return frame;
    }

    public Box getBox() {
        return box;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Detection)) return false;
        Detection d = (Detection) o;
        return frame == d.frame && box.equals(d.box);
    }

    @Override
    public int hashCode() {
        return 31 * frame + box.hashCode();
    }

    @Override
    public String toString() {
        return "F"+frame+box;
    }
}
