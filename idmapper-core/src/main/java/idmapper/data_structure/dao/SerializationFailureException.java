package idmapper.data_structure.dao;

import java.io.IOException;

/**
 * A history snapshot could not be written to, or read back from, memory or disk
 */
public class SerializationFailureException extends IOException {
    public SerializationFailureException(String message) {
        super(message);
    }
    public SerializationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
