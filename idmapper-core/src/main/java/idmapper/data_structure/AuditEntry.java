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
import idmapper.utils.Utils;
import org.json.simple.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One record of the audit log. Immutable.
 */
public class AuditEntry implements JSONSerializable {
    final String timestamp;
    final String action;
    final Map<String, Object> details;

    public AuditEntry(String action, Map<String, ?> details) {
        this(Utils.getTimestamp(), action, details);
    }

    public AuditEntry(String timestamp, String action, Map<String, ?> details) {
        this.timestamp = timestamp;
        this.action = action;
        this.details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getAction() {
        return action;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("timestamp", timestamp);
        res.put("action", action);
        res.put("details", JSONUtils.toJSONObject(details));
        return res;
    }

    public static AuditEntry fromJSONEntry(Map json) {
        Map details = (Map)json.get("details");
        return new AuditEntry((String)json.get("timestamp"), (String)json.get("action"), details);
    }

    @Override
    public String toString() {
        return timestamp+" "+action+" "+details;
    }
}
