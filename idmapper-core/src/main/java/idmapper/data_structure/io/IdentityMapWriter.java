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

import idmapper.data_structure.AuditEntry;
import idmapper.data_structure.Cast;
import idmapper.data_structure.IdentityGraph;
import idmapper.data_structure.Role;
import idmapper.utils.FileIO;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes the outputs consumed downstream: the identity map {@code {"<original id>": "<role>"}} and the audit log.
 */
public class IdentityMapWriter {
    public final static Logger logger = LoggerFactory.getLogger(IdentityMapWriter.class);
    public final static String STREAM_SUFFIX = ".json.gz";
    public final static String IDENTITY_SUFFIX = "_identity.json";
    public final static String AUDIT_SUFFIX = "_audit.json";

    public static JSONObject toJSON(Map<Integer, Role> identityMap) {
        JSONObject res = new JSONObject();
        identityMap.forEach((id, role) -> {
            if (!role.isIgnore()) res.put(String.valueOf(id), role.getName());
        });
        return res;
    }

    public static JSONArray toJSON(List<AuditEntry> entries) {
        JSONArray res = new JSONArray();
        for (AuditEntry e : entries) res.add(e.toJSONEntry());
        return res;
    }

    /**
     * @param output destination
     * @param graph graph
     * @param cast known roles
     * @return number of original identifiers written
     * @throws IOException
     */
    public static int writeIdentityMap(Path output, IdentityGraph graph, Cast cast) throws IOException {
        JSONObject json = toJSON(graph.getIdentityMap(cast)); // copy taken under the graph lock, written after
        FileIO.writeAtomically(output, json.toJSONString());
        logger.info("identity map: {} original ids written to {}", json.size(), output);
        return json.size();
    }

    public static int writeAuditLog(Path output, IdentityGraph graph) throws IOException {
        JSONArray json = toJSON(graph.getAuditEntries());
        FileIO.writeAtomically(output, json.toJSONString());
        logger.debug("audit log: {} entries written to {}", json.size(), output);
        return json.size();
    }

    /**
     * @param stream detection stream {@code <name>.json.gz}
     * @return {@code <name>_identity.json} in the same directory
     */
    public static Path defaultIdentityPath(Path stream) {
        return stream.resolveSibling(baseName(stream) + IDENTITY_SUFFIX);
    }

    public static Path defaultAuditPath(Path stream) {
        return stream.resolveSibling(baseName(stream) + AUDIT_SUFFIX);
    }

    static String baseName(Path stream) {
        String name = stream.getFileName().toString();
        if (name.endsWith(STREAM_SUFFIX)) return name.substring(0, name.length() - STREAM_SUFFIX.length());
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
