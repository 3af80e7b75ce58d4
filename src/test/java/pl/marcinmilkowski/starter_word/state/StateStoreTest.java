package pl.marcinmilkowski.starter_word.state;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Missing snapshot leaves the state empty")
    void loadMissingFile() throws Exception {
        StateStore store = new StateStore(tempDir.resolve("state.json"));
        store.load();

        assertEquals(new BotState(), store.withRead(StateView::copy));
        assertFalse(Files.exists(tempDir.resolve("state.json")));
    }

    @Test
    @DisplayName("Saved state loads back equal")
    void roundTrip() throws Exception {
        Path path = tempDir.resolve("state.json");
        StateStore store = new StateStore(path);
        store.update(s -> {
            s.markUsed(LocalDate.of(2026, 10, 17), "crwth", null);
            s.markUsed(LocalDate.of(2026, 10, 18), "fjord", "1234");
            s.enqueue(new QueuedSuggestion("5678", "jazzy"));
            s.enqueue(new QueuedSuggestion("9012", "kayak"));
        });

        StateStore reloaded = new StateStore(path);
        reloaded.load();

        BotState expected = store.withRead(StateView::copy);
        BotState actual = reloaded.withRead(StateView::copy);
        assertEquals(expected, actual);
        assertEquals(List.of("crwth", "fjord"), new ArrayList<>(actual.used()));
        assertEquals("1234", actual.history().get(1).suggesterId());
        assertNull(actual.history().get(0).suggesterId());
        assertEquals("jazzy", actual.queue().get(0).word());
    }

    @Test
    @DisplayName("withWrite persists before returning and leaves no temp file")
    void withWriteIsDurable() throws Exception {
        Path path = tempDir.resolve("nested/dir/state.json");
        StateStore store = new StateStore(path);

        boolean queued = store.withWrite(s -> {
            s.enqueue(new QueuedSuggestion("1", "crane"));
            return true;
        });

        assertTrue(queued);
        assertTrue(Files.exists(path));
        assertFalse(Files.exists(path.resolveSibling("state.json.tmp")));
        assertTrue(Files.readString(path).contains("crane"));
        assertFalse(store.isDirty());
    }

    @Test
    @DisplayName("withRead does not touch the disk")
    void withReadDoesNotPersist() {
        Path path = tempDir.resolve("state.json");
        StateStore store = new StateStore(path);

        int size = store.withRead(s -> s.used().size());

        assertEquals(0, size);
        assertFalse(Files.exists(path));
    }

    @Test
    @DisplayName("Malformed snapshot fails with StateLoadException")
    void malformedSnapshot() throws Exception {
        Path path = tempDir.resolve("state.json");
        Files.writeString(path, "{ not json");

        StateStore store = new StateStore(path);
        assertThrows(StateLoadException.class, store::load);
    }

    @Test
    @DisplayName("Snapshot with a bad date fails with StateLoadException")
    void badDate() throws Exception {
        Path path = tempDir.resolve("state.json");
        Files.writeString(path, "{\"used\":[\"crane\"],\"history\":[{\"date\":\"yesterday\",\"word\":\"crane\"}],\"queue\":[]}");

        StateStore store = new StateStore(path);
        assertThrows(StateLoadException.class, store::load);
    }

    @Test
    @DisplayName("Failed persist keeps the change in memory and marks the store dirty")
    void persistFailureIsSwallowed() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "a regular file, not a directory");
        StateStore store = new StateStore(blocker.resolve("state.json"));

        store.update(s -> s.markUsed(LocalDate.of(2026, 10, 19), "crane", null));

        assertTrue(store.<Boolean>withRead(s -> s.isUsed("crane")));
        assertTrue(store.isDirty());
        assertThrows(StatePersistException.class, store::save);
    }

    @Test
    @DisplayName("Concurrent writers are serialized")
    void concurrentWriters() throws Exception {
        Path path = tempDir.resolve("state.json");
        StateStore store = new StateStore(path);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String id = Integer.toString(i);
                futures.add(pool.submit(() -> store.update(s -> s.enqueue(new QueuedSuggestion(id, "w" + id)))));
                futures.add(pool.submit(() -> store.withRead(StateView::queueSize)));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdown();
        }

        assertEquals(40, store.withRead(StateView::queueSize));
        StateStore reloaded = new StateStore(path);
        reloaded.load();
        assertEquals(40, reloaded.withRead(StateView::queueSize));
    }

    @Test
    @DisplayName("Truncated snapshot fails with StateLoadException")
    void truncatedSnapshot() throws Exception {
        Path path = tempDir.resolve("state.json");
        for (String content : new String[]{"{ \"used\": ", "{\"history\":[{\"date\":\"2026-10-19\",\"word\":\"cr"}) {
            Files.writeString(path, content);
            StateStore store = new StateStore(path);
            assertThrows(StateLoadException.class, store::load, content);
        }
    }

    @Test
    @DisplayName("Readers get a view without mutators")
    void readersCannotMutate() {
        StateStore store = new StateStore(tempDir.resolve("state.json"));
        store.update(s -> s.enqueue(new QueuedSuggestion("1", "crane")));

        StateView view = store.withRead(s -> s);

        assertFalse(view instanceof BotState);
        assertThrows(UnsupportedOperationException.class, () -> view.used().add("slate"));
        assertThrows(UnsupportedOperationException.class,
            () -> view.history().add(new UsedEntry(LocalDate.of(2026, 10, 19), "slate", null)));
        assertThrows(UnsupportedOperationException.class, () -> view.queue().clear());
        assertEquals(1, store.withRead(StateView::queueSize));
    }

    @Test
    @DisplayName("Copies taken under the read lock are detached from the store")
    void readCopiesAreDetached() {
        StateStore store = new StateStore(tempDir.resolve("state.json"));

        BotState copy = store.withRead(StateView::copy);
        copy.enqueue(new QueuedSuggestion("1", "crane"));

        assertEquals(0, store.withRead(StateView::queueSize));
    }

    @Test
    @DisplayName("Readers running alongside a writer only see whole mutations")
    void readersSeeConsistentState() throws Exception {
        StateStore store = new StateStore(tempDir.resolve("state.json"));
        int rounds = 50;
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<Boolean>> readers = new ArrayList<>();
            Future<?> writer = pool.submit(() -> {
                for (int i = 0; i < rounds; i++) {
                    LocalDate date = LocalDate.of(2026, 1, 1).plusDays(i);
                    String word = "w" + String.format("%04d", i);
                    store.update(s -> s.markUsed(date, word, null));
                }
            });
            for (int r = 0; r < 5; r++) {
                readers.add(pool.submit(() -> {
                    boolean consistent = true;
                    for (int i = 0; i < 200; i++) {
                        consistent &= store.withRead(s -> s.used().size() == s.history().size());
                    }
                    return consistent;
                }));
            }
            writer.get();
            for (Future<Boolean> reader : readers) {
                assertTrue(reader.get());
            }
        } finally {
            pool.shutdown();
        }
        assertEquals(rounds, store.<Integer>withRead(s -> s.history().size()));
    }
}
