package idmapper.data_structure.dao;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.UUID;

/**
 * Serialized state held by the history. Either {@link Resident} (payload in memory) or {@link Spilled} (payload in a scratch file, memory released).
 * Instances are immutable: residency changes are performed by {@link Resident#spill(File)} and {@link Spilled#load()}, which return a new snapshot.
 */
public abstract class Snapshot {
    static final Logger logger = LoggerFactory.getLogger(Snapshot.class);
    public static final String EXTENSION = ".snapshot";
    final long timestamp;

    Snapshot(long timestamp) {
        this.timestamp = timestamp;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public abstract boolean isResident();

    public abstract byte[] getBytes() throws SerializationFailureException;

    /**
     * @return bytes held in memory by this snapshot
     */
    public abstract long heapMemory();

    /**
     * Releases the backing resources (deletes the scratch file of a spilled snapshot)
     */
    public abstract void discard();

    public static final class Resident extends Snapshot {
        final byte[] bytes;

        public Resident(byte[] bytes) {
            this(bytes, System.currentTimeMillis());
        }

        Resident(byte[] bytes, long timestamp) {
            super(timestamp);
            this.bytes = bytes;
        }

        @Override
        public boolean isResident() {
            return true;
        }

        @Override
        public byte[] getBytes() {
            return bytes;
        }

        @Override
        public long heapMemory() {
            return bytes.length;
        }

        @Override
        public void discard() {}

        /**
         * Writes the payload once to a new file of {@code directory}
         * @param directory scratch directory
         * @return spilled snapshot referencing the file
         * @throws SerializationFailureException if the file cannot be written; no file is left behind
         */
        public Spilled spill(File directory) throws SerializationFailureException {
            File f = new File(directory, UUID.randomUUID() + EXTENSION);
            try {
                Files.write(f.toPath(), bytes);
            } catch (IOException e) {
                f.delete();
                throw new SerializationFailureException("could not spill snapshot to "+f, e);
            }
            f.deleteOnExit();
            return new Spilled(f, timestamp);
        }

        @Override
        public String toString() {
            return "Resident{"+bytes.length+" bytes}";
        }
    }

    public static final class Spilled extends Snapshot {
        final File file;

        Spilled(File file, long timestamp) {
            super(timestamp);
            this.file = file;
        }

        public File getFile() {
            return file;
        }

        @Override
        public boolean isResident() {
            return false;
        }

        @Override
        public byte[] getBytes() throws SerializationFailureException {
            try {
                return Files.readAllBytes(file.toPath());
            } catch (IOException e) {
                throw new SerializationFailureException("could not read spilled snapshot "+file, e);
            }
        }

        @Override
        public long heapMemory() {
            return 0;
        }

        @Override
        public void discard() {
            if (file.exists() && !file.delete()) logger.warn("could not delete spilled snapshot: {}", file);
        }

        /**
         * Reads the payload back in memory and deletes the file
         * @return resident snapshot
         * @throws SerializationFailureException if the file cannot be read
         */
        public Resident load() throws SerializationFailureException {
            Resident res = new Resident(getBytes(), timestamp);
            discard();
            return res;
        }

        @Override
        public String toString() {
            return "Spilled{"+file.getName()+"}";
        }
    }
}
