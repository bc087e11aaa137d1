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
package idmapper.utils.geom;

import idmapper.utils.JSONSerializable;
import idmapper.utils.JSONUtils;
import org.json.simple.JSONArray;

import java.util.List;
import java.util.Locale;

/**
 * Axis-aligned bounding box with real-valued corners (x1, y1) - (x2, y2). Immutable.
 */
public class Box implements JSONSerializable {
    public final double x1, y1, x2, y2;
    public Box(double x1, double y1, double x2, double y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }
    public Point center() {
        return new Point((x1 + x2) / 2, (y1 + y2) / 2);
    }
    public double centerDistance(Box other) {
        return center().dist(other.center());
    }
    public double[] toArray() {
        return new double[]{x1, y1, x2, y2};
    }
    @Override
    public JSONArray toJSONEntry() {
        return JSONUtils.toJSONArray(toArray());
    }
    public static Box fromJSONEntry(Object jsonEntry) {
        double[] c = JSONUtils.fromDoubleArray((List)jsonEntry);
        if (c.length!=4) throw new IllegalArgumentException("Box should have 4 coordinates, found: "+c.length);
        return new Box(c[0], c[1], c[2], c[3]);
    }
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box)) return false;
        Box b = (Box) o;
        return Double.compare(b.x1, x1) == 0 && Double.compare(b.y1, y1) == 0 && Double.compare(b.x2, x2) == 0 && Double.compare(b.y2, y2) == 0;
    }
    @Override
    public int hashCode() {
        int h = Double.hashCode(x1);
        h = 31 * h + Double.hashCode(y1);
        h = 31 * h + Double.hashCode(x2);
        return 31 * h + Double.hashCode(y2);
    }
    @Override
    public String toString() {
        return String.format(Locale.US, "[%.1f;%.1f -> %.1f;%.1f]", x1, y1, x2, y2);
    }
}
