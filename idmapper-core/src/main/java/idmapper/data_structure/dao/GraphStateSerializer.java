package idmapper.data_structure.dao;

import idmapper.data_structure.GraphState;
import idmapper.utils.CompressionUtils;
import idmapper.utils.JSONUtils;
import org.json.simple.parser.ParseException;

import java.io.IOException;

/**
 * Deflate-compressed JSON of a {@link GraphState}
 */
public class GraphStateSerializer implements SnapshotSerializer<GraphState> {
    @Override
    public byte[] serialize(GraphState state) throws IOException {
        return CompressionUtils.compress(state.toJSONEntry().toJSONString());
    }

    @Override
    public GraphState deserialize(byte[] bytes) throws IOException {
        String json = CompressionUtils.decompressToString(bytes);
        try {
            return GraphState.fromJSONEntry(JSONUtils.parseJSONObject(json));
        } catch (ParseException | RuntimeException e) {
            throw new IOException("invalid graph snapshot: "+e, e);
        }
    }
}
