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
package idmapper.utils;

import java.util.*;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion helpers between json-simple entries and java values.
 * json-simple parses every integer as {@link Long} and every decimal as {@link Double}, values are therefore read as {@link Number}.
 */
public class JSONUtils {
    public final static Logger logger = LoggerFactory.getLogger(JSONUtils.class);

    public static Object parse(String json) throws ParseException {
        return new JSONParser().parse(json);
    }

    public static JSONObject parseJSONObject(String json) throws ParseException {
        Object o = parse(json);
        if (o instanceof JSONObject) return (JSONObject)o;
        throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, o);
    }

    public static JSONObject toJSONObject(Map<String, ?> map) {
        JSONObject res=  new JSONObject();
        for (Map.Entry<String, ?> e : map.entrySet()) res.put(e.getKey(), toJSONEntry(e.getValue()));
        return res;
    }

    public static Object toJSONEntry(Object o) {
        if (o==null) return null;
        else if (o instanceof JSONObject || o instanceof JSONArray) return o;
        else if (o instanceof JSONSerializable) return ((JSONSerializable)o).toJSONEntry();
        else if (o instanceof double[]) return toJSONArray((double[])o);
        else if (o instanceof int[]) return toJSONArray((int[])o);
        else if (o instanceof Number) return o;
        else if (o instanceof Boolean) return o;
        else if (o instanceof String) return o;
        else if (o instanceof Collection) {
            JSONArray l = new JSONArray();
            ((Collection<?>)o).forEach((oo) -> l.add(toJSONEntry(oo)));
            return l;
        }
        else if (o instanceof Map) {
            JSONObject res = new JSONObject();
            ((Map<?, ?>)o).forEach((k, v) -> res.put(String.valueOf(k), toJSONEntry(v)));
            return res;
        }
        else return o.toString();
    }

    public static JSONArray toJSONArray(double[] array) {
        JSONArray res = new JSONArray();
        for (double d : array) res.add(d);
        return res;
    }

    public static JSONArray toJSONArray(int[] array) {
        JSONArray res = new JSONArray();
        for (int i : array) res.add(i);
        return res;
    }

    public static JSONArray toJSONArray(Collection<? extends Number> collection) {
        JSONArray res = new JSONArray();
        res.addAll(collection);
        return res;
    }

    public static double[] fromDoubleArray(List array) {
        double[] res = new double[array.size()];
        for (int i = 0; i<res.length; ++i) {
            if (array.get(i)==null) {
                logger.debug("fromDoubleArrayError: {}", array);
                res[i] = Double.NaN;
            } else res[i]=((Number)array.get(i)).doubleValue();
        }
        return res;
    }

    public static List<Integer> fromIntList(List array) {
        List<Integer> res = new ArrayList<>(array.size());
        for (Object o : array) res.add(((Number)o).intValue());
        return res;
    }

    /**
     * @param object json object
     * @param key key
     * @return the numerical value associated to {@code key}, or null if absent or not a number
     */
    public static Number getNumber(Map object, String key) {
        Object v = object.get(key);
        if (v instanceof Number) return (Number)v;
        return null;
    }
}
