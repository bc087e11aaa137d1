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

import idmapper.core.ProgressCallback;
import idmapper.utils.FileIO;
import idmapper.utils.JSONUtils;
import idmapper.utils.geom.Box;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.zip.ZipException;

/**
 * Parses a gzip-compressed, newline-delimited JSON detection stream into a {@link LoadResult}.
 * <p>
 * Each line: {@code {"f_idx": int, "det": [{"track_id": int|null, "conf": float, "box": {"x1":f,"y1":f,"x2":f,"y2":f}, "keypoints": [...]}]}}.
 * A {@code track_id} that is absent, null or -1 denotes an untracked detection, which receives a synthetic identifier (see {@link TrackStoreBuilder#syntheticId(int, int)}).
 * <p>
 * The stream is parsed into a private {@link TrackStoreBuilder}; any error or cancellation discards it, so that the live graph is only replaced when the whole stream was read.
 */
public class DetectionLoader {
    public final static Logger logger = LoggerFactory.getLogger(DetectionLoader.class);
    public final static String FRAME_KEY = "f_idx";
    public final static String DETECTIONS_KEY = "det";
    public final static String TRACK_ID_KEY = "track_id";
    public final static String BOX_KEY = "box";
    public final static int UNTRACKED_ID = -1;
    static final int PROGRESS_INTERVAL = 1000;
    final BooleanSupplier cancelled;
    final ProgressCallback pcb;

    public DetectionLoader() {
        this(() -> false, null);
    }

    /**
     * @param cancelled checked between records; when it returns true loading stops with a {@link CancelledByOperatorException}
     * @param pcb progress feedback, may be null
     */
    public DetectionLoader(BooleanSupplier cancelled, ProgressCallback pcb) {
        this.cancelled = cancelled == null ? () -> false : cancelled;
        this.pcb = pcb;
    }

    public LoadResult load(Path file) throws IOException {
        if (pcb != null) pcb.log("Loading detections: "+file.getFileName());
        try (BufferedReader reader = FileIO.openGzipReader(file)) {
            return load(reader, file.getFileName().toString());
        } catch (ZipException e) {
            throw new MalformedStreamException("not a gzip stream: "+file, 0, e);
        }
    }

    /**
     * @param reader decompressed line reader
     * @param source name of the stream, recorded in the audit log
     * @return parsed stream
     * @throws MalformedStreamException if a record cannot be parsed, or the stream is truncated
     * @throws CancelledByOperatorException if cancellation was requested
     * @throws IOException other read errors
     */
    public LoadResult load(BufferedReader reader, String source) throws IOException {
        TrackStoreBuilder builder = new TrackStoreBuilder();
        JSONParser parser = new JSONParser();
        int lineNumber = 0;
        String line;
        try {
            while ((line = reader.readLine()) != null) {
                ++lineNumber;
                if (cancelled.getAsBoolean()) {
                    logger.info("loading of {} cancelled at line {}", source, lineNumber);
                    throw new CancelledByOperatorException("Detection loading cancelled by operator at line "+lineNumber);
                }
                if (line.trim().isEmpty()) continue;
                parseRecord(parser, line, lineNumber, builder);
                if (pcb != null && lineNumber % PROGRESS_INTERVAL == 0) pcb.log("Loading line "+lineNumber+"...");
            }
        } catch (EOFException | ZipException e) {
            throw new MalformedStreamException("truncated or corrupted stream after "+lineNumber+" lines", lineNumber+1, e);
        }
        LoadResult res = builder.build(source, lineNumber);
        if (pcb != null) pcb.log("Detections loaded: "+res.getTracks().size()+" tracks");
        logger.debug("parsed {}: {} lines, {} detections, {} tracks, untracked: {}", source, lineNumber, res.getDetectionCount(), res.getTracks().size(), res.hasUntrackedDetections());
        return res;
    }

    static void parseRecord(JSONParser parser, String line, int lineNumber, TrackStoreBuilder builder) throws MalformedStreamException {
        JSONObject record;
        try {
            Object o = parser.parse(line);
            if (!(o instanceof JSONObject)) throw new MalformedStreamException("record is not a JSON object", lineNumber);
            record = (JSONObject)o;
        } catch (ParseException e) {
            throw new MalformedStreamException("invalid JSON: "+e, lineNumber, e);
        }
        Number frame = JSONUtils.getNumber(record, FRAME_KEY);
        if (frame == null) throw new MalformedStreamException("missing or non-numeric \""+FRAME_KEY+"\"", lineNumber);
        if (frame.longValue() < 0) throw new MalformedStreamException("negative frame index: "+frame, lineNumber);
        if (frame.longValue() > Integer.MAX_VALUE) throw new MalformedStreamException("frame index out of range: "+frame, lineNumber);
        Object dets = record.get(DETECTIONS_KEY);
        if (!(dets instanceof List)) throw new MalformedStreamException("missing or invalid \""+DETECTIONS_KEY+"\" array", lineNumber);
        List detList = (List)dets;
        if (detList.size() > TrackStoreBuilder.MAX_DETECTIONS_PER_FRAME) throw new MalformedStreamException("too many detections in frame "+frame+": "+detList.size(), lineNumber);
        for (int i = 0; i<detList.size(); ++i) {
            Object d = detList.get(i);
            if (!(d instanceof Map)) throw new MalformedStreamException("detection "+i+" is not a JSON object", lineNumber);
            Map det = (Map)d;
            Integer trackId = parseTrackId(det, lineNumber);
            Box box = parseBox(det.get(BOX_KEY), i, lineNumber);
            try {
                builder.add(frame.intValue(), i, trackId, box);
            } catch (IllegalArgumentException e) {
                throw new MalformedStreamException(e.getMessage(), lineNumber, e);
            }
        }
    }

    static Integer parseTrackId(Map det, int lineNumber) throws MalformedStreamException {
        Object tid = det.get(TRACK_ID_KEY);
        if (tid == null) return null;
        if (!(tid instanceof Number)) throw new MalformedStreamException("non-numeric \""+TRACK_ID_KEY+"\": "+tid, lineNumber);
        long lid = ((Number)tid).longValue();
        if (lid > Integer.MAX_VALUE || lid < Integer.MIN_VALUE) throw new MalformedStreamException("\""+TRACK_ID_KEY+"\" out of range: "+tid, lineNumber);
        int id = (int)lid;
        if (id == UNTRACKED_ID) return null;
        if (id < 0) throw new MalformedStreamException("negative \""+TRACK_ID_KEY+"\": "+id, lineNumber);
        return id;
    }

    static Box parseBox(Object box, int detIdx, int lineNumber) throws MalformedStreamException {
        if (!(box instanceof Map)) throw new MalformedStreamException("detection "+detIdx+": missing \""+BOX_KEY+"\" object", lineNumber);
        Map b = (Map)box;
        double[] c = new double[4];
        String[] keys = new String[]{"x1", "y1", "x2", "y2"};
        for (int k = 0; k<4; ++k) {
            Number n = JSONUtils.getNumber(b, keys[k]);
            if (n == null) throw new MalformedStreamException("detection "+detIdx+": missing or non-numeric box coordinate \""+keys[k]+"\"", lineNumber);
            c[k] = n.doubleValue();
        }
        return new Box(c[0], c[1], c[2], c[3]);
    }
}
