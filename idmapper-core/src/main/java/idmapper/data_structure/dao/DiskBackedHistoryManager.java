package idmapper.data_structure.dao;

import idmapper.utils.FileIO;
import idmapper.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.LinkedList;
import java.util.ListIterator;

/**
 * Undo / redo history over whole-state snapshots, with bounded memory residency.
 * <p>
 * The current state is always held in memory. In each stack (index 0 = most recent), the {@code ramBuffer - 1} most recent snapshots stay resident;
 * older ones are spilled to a private scratch directory and their payload is released. The undo stack holds at most {@code maxHistory} entries,
 * the oldest one being evicted (and its file deleted) beyond that.
 * <p>
 * A snapshot that cannot be spilled stays resident; a snapshot that cannot be read back is dropped: the corresponding step is lost but the caller's state is untouched.
 * @param <T> state type
 */
public class DiskBackedHistoryManager<T> implements AutoCloseable {
    static final Logger logger = LoggerFactory.getLogger(DiskBackedHistoryManager.class);
    final int maxHistory;
    final int ramBuffer;
    final File directory;
    final boolean ownsDirectory;
    final SnapshotSerializer<T> serializer;
    final LinkedList<Snapshot> undoStack = new LinkedList<>();
    final LinkedList<Snapshot> redoStack = new LinkedList<>();
    Snapshot.Resident current;

    /**
     * @param maxHistory maximal number of undo entries (>=1)
     * @param ramBuffer number of most recent entries held in memory, including the current state (>=1)
     * @param directory scratch directory for spilled snapshots; if null a temporary directory is created and deleted on {@link #close()}
     * @param serializer state serializer
     * @throws IOException if the scratch directory cannot be created
     */
    public DiskBackedHistoryManager(int maxHistory, int ramBuffer, File directory, SnapshotSerializer<T> serializer) throws IOException {
        if (maxHistory < 1) throw new IllegalArgumentException("max history should be >= 1, was: "+maxHistory);
        if (ramBuffer < 1) throw new IllegalArgumentException("ram buffer should be >= 1, was: "+ramBuffer);
        this.maxHistory = maxHistory;
        this.ramBuffer = ramBuffer;
        this.serializer = serializer;
        if (directory == null) {
            this.directory = FileIO.createScratchDirectory("idmapper-history");
            this.ownsDirectory = true;
        } else {
            if (!directory.isDirectory() && !directory.mkdirs()) throw new IOException("Could not create history directory: "+directory);
            this.directory = directory;
            this.ownsDirectory = false;
        }
    }

    public synchronized boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public synchronized boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public synchronized int undoSize() {
        return undoStack.size();
    }

    public synchronized int redoSize() {
        return redoStack.size();
    }

    public synchronized int spilledCount() {
        return (int)(undoStack.stream().filter(s -> !s.isResident()).count() + redoStack.stream().filter(s -> !s.isResident()).count());
    }

    /**
     * @return total number of bytes held in memory, current state included
     */
    public synchronized long residentBytes() {
        long total = current == null ? 0 : current.heapMemory();
        for (Snapshot s : undoStack) total += s.heapMemory();
        for (Snapshot s : redoStack) total += s.heapMemory();
        return total;
    }

    public File getDirectory() {
        return directory;
    }

    /**
     * Discards both stacks and records {@code state} as the current state
     * @param state current state, may be null
     * @return false if {@code state} could not be serialized, in which case there is no current state
     */
    public synchronized boolean reset(T state) {
        clear();
        if (state == null) return true;
        try {
            current = new Snapshot.Resident(serializer.serialize(state));
            return true;
        } catch (IOException | RuntimeException e) {
            logger.error("Error serializing state: history disabled until next change", e);
            return false;
        }
    }

    /**
     * Records a new state. The previous current state goes on top of the undo stack and the redo stack is discarded.
     * @param state new current state
     * @return false if {@code state} could not be serialized, in which case the history is unchanged
     */
    public synchronized boolean push(T state) {
        Snapshot.Resident next;
        try {
            next = new Snapshot.Resident(serializer.serialize(state));
        } catch (IOException | RuntimeException e) {
            logger.error("Error serializing state: change not recorded in history", e);
            return false;
        }
        if (current != null) undoStack.push(current);
        current = next;
        discardAll(redoStack);
        enforceResidency(undoStack);
        evict();
        if (logger.isDebugEnabled()) logger.debug("history push: undo={} redo={} spilled={} resident={}B{}", undoStack.size(), redoStack.size(), spilledCount(), residentBytes(), Utils.getMemoryUsage());
        return true;
    }

    /**
     * @return the state preceding the current one, or null if there is none or if it could not be restored
     */
    public synchronized T undo() {
        return move(undoStack, redoStack, "undo");
    }

    /**
     * @return the state following the current one, or null if there is none or if it could not be restored
     */
    public synchronized T redo() {
        return move(redoStack, undoStack, "redo");
    }

    private T move(LinkedList<Snapshot> source, LinkedList<Snapshot> target, String name) {
        if (source.isEmpty()) {
            logger.debug("Cannot {}! Stack is empty.", name);
            return null;
        }
        Snapshot popped = source.pop();
        Snapshot.Resident next;
        T state;
        try {
            next = popped instanceof Snapshot.Spilled ? ((Snapshot.Spilled)popped).load() : (Snapshot.Resident)popped;
            state = serializer.deserialize(next.getBytes());
        } catch (IOException | RuntimeException e) {
            logger.error("Error restoring snapshot for "+name+": this step is lost", e);
            popped.discard();
            return null;
        }
        if (current != null) target.push(current);
        current = next;
        enforceResidency(target);
        evict();
        return state;
    }

    /**
     * Spills every resident entry beyond the {@code ramBuffer - 1} most recent ones
     */
    private void enforceResidency(LinkedList<Snapshot> stack) {
        int idx = 0;
        ListIterator<Snapshot> it = stack.listIterator();
        while (it.hasNext()) {
            Snapshot s = it.next();
            if (idx >= ramBuffer - 1 && s instanceof Snapshot.Resident) {
                try {
                    it.set(((Snapshot.Resident)s).spill(directory));
                } catch (SerializationFailureException e) {
                    logger.error("Error spilling snapshot: kept in memory", e);
                }
            }
            ++idx;
        }
    }

    private void evict() {
        while (undoStack.size() > maxHistory) {
            Snapshot s = undoStack.removeLast();
            s.discard();
            logger.debug("history: evicted oldest snapshot {}", s);
        }
    }

    private static void discardAll(LinkedList<Snapshot> stack) {
        for (Snapshot s : stack) s.discard();
        stack.clear();
    }

    /**
     * Discards both stacks and the current state
     */
    public synchronized void clear() {
        discardAll(undoStack);
        discardAll(redoStack);
        current = null;
    }

    @Override
    public synchronized void close() {
        clear();
        if (ownsDirectory) Utils.deleteDirectory(directory);
    }
}
