package pl.marcinmilkowski.starter_word.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Lock-guarded {@link BotState} backed by a single JSON snapshot file.
 *
 * Readers run under the shared lock via {@link #withRead} and only see a
 * {@link StateView}; writers run under the
 * exclusive lock via {@link #withWrite}, which persists the whole state before
 * releasing the lock. Snapshots are written to {@code <path>.tmp}, forced to disk
 * and then moved over the target, so the target file is never partially written.
 *
 * A failed write is logged and does not undo the in-memory change; the store
 * stays {@link #isDirty() dirty} until a later save succeeds.
 */
public class StateStore {

    private static final Logger logger = LoggerFactory.getLogger(StateStore.class);

    private final Path path;
    private final Path tmpPath;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private BotState state = new BotState();
    private volatile boolean dirty;

    public StateStore(Path path) {
        this.path = Objects.requireNonNull(path, "path");
        this.tmpPath = path.resolveSibling(path.getFileName().toString() + ".tmp");
    }

    /**
     * Replace the in-memory state with the snapshot on disk.
     * A missing file leaves the current (empty) state untouched.
     *
     * @throws StateLoadException if the file exists but cannot be read or parsed
     */
    public void load() throws StateLoadException {
        if (!Files.exists(path)) {
            logger.info("No state snapshot at {}, starting empty", path);
            return;
        }
        BotState loaded;
        try {
            loaded = StateSnapshotCodec.decode(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StateLoadException("Failed to read state " + path + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new StateLoadException("Invalid state snapshot " + path + ": " + e.getMessage(), e);
        }

        lock.writeLock().lock();
        try {
            state = loaded;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("State loaded from {}: {}", path, loaded);
    }

    /**
     * Write the current state to disk atomically.
     *
     * @throws StatePersistException if any step of the write fails
     */
    public void save() throws StatePersistException {
        // Exclusive (and reentrant from withWrite) so concurrent saves never share the temp file.
        lock.writeLock().lock();
        try {
            writeSnapshot(StateSnapshotCodec.encode(state));
            dirty = false;
        } catch (IOException e) {
            dirty = true;
            throw new StatePersistException("Failed to persist state to " + path + ": " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void writeSnapshot(String json) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (FileChannel channel = FileChannel.open(tmpPath,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(json.getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(tmpPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warn("Atomic move not supported for {}, falling back to plain replace", path);
            Files.move(tmpPath, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Run a function under the shared lock against a read-only view of the state.
     * Values derived from the view should be copied before they leave the function.
     */
    public <R> R withRead(Function<? super StateView, R> fn) {
        lock.readLock().lock();
        try {
            return fn.apply(state.readOnlyView());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Run a mutating function under the exclusive lock and persist the result
     * before returning. Persist failures are logged, not thrown.
     */
    public <R> R withWrite(Function<BotState, R> fn) {
        lock.writeLock().lock();
        try {
            R result = fn.apply(state);
            try {
                save();
            } catch (StatePersistException e) {
                logger.error("State change kept in memory only: {}", e.getMessage(), e);
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * {@link #withWrite(Function)} for mutations without a result.
     */
    public void update(Consumer<BotState> fn) {
        withWrite(s -> {
            fn.accept(s);
            return null;
        });
    }

    /**
     * True when the last save attempt failed and memory is ahead of disk.
     */
    public boolean isDirty() {
        return dirty;
    }

    public Path getPath() {
        return path;
    }
}
