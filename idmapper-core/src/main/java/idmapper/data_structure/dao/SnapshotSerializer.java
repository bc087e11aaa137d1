package idmapper.data_structure.dao;

import java.io.IOException;

/**
 * Converts a state to a self-contained byte payload and back
 * @param <T> state type
 */
public interface SnapshotSerializer<T> {
    byte[] serialize(T state) throws IOException;
    T deserialize(byte[] bytes) throws IOException;
}
