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
import org.json.simple.JSONArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of every mutating operation. Entries are only discarded all at once, when a new session is loaded or restored.
 * Not thread safe by itself: access is serialized by the lock of the owning {@link IdentityGraph}.
 */
public class AuditLog implements JSONSerializable {
    public final static Logger logger = LoggerFactory.getLogger(AuditLog.class);
    private final List<AuditEntry> entries = new ArrayList<>();

    public AuditEntry append(String action, Map<String, ?> details) {
        return append(new AuditEntry(action, details));
    }

    public AuditEntry append(AuditEntry entry) {
        entries.add(entry);
        logger.debug("audit: {}", entry);
        return entry;
    }

    public List<AuditEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public int size() {
        return entries.size();
    }

    void clear() {
        entries.clear();
    }

    public AuditLog duplicate() {
        AuditLog res = new AuditLog();
        res.entries.addAll(entries);
        return res;
    }

    @Override
    public JSONArray toJSONEntry() {
        JSONArray res = new JSONArray();
        for (AuditEntry e : entries) res.add(e.toJSONEntry());
        return res;
    }

    public static AuditLog fromJSONEntry(List json) {
        AuditLog res = new AuditLog();
        if (json != null) for (Object o : json) res.entries.add(AuditEntry.fromJSONEntry((Map)o));
        return res;
    }

    /**
     * Convenience builder for audit details: {@code details("master", 3, "slave", 5)}
     * @param keyValues alternating keys and values
     * @return ordered map
     */
    public static Map<String, Object> details(Object... keyValues) {
        if (keyValues.length % 2 != 0) throw new IllegalArgumentException("details need key/value pairs");
        Map<String, Object> res = new LinkedHashMap<>();
        for (int i = 0; i<keyValues.length; i+=2) res.put(String.valueOf(keyValues[i]), keyValues[i+1]);
        return res;
    }
}
