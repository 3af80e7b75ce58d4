package pl.marcinmilkowski.starter_word.state;

import java.time.LocalDate;
import java.util.*;

/**
 * Mutable selection state: used words, selection history and the suggestion queue.
 *
 * Not thread-safe on its own; access goes through {@link StateStore}.
 * Every word in the history is also in the used set.
 */
public class BotState implements StateView {

    private final Set<String> used = new LinkedHashSet<>();
    private final List<UsedEntry> history = new ArrayList<>();
    private final Deque<QueuedSuggestion> queue = new ArrayDeque<>();
    private final StateView readOnly = new ReadOnlyView();

    /**
     * Record a selection for a date and mark the word used.
     *
     * @param suggesterId submitter of the word, null for sampler picks
     */
    public void markUsed(LocalDate date, String word, String suggesterId) {
        used.add(word);
        history.add(new UsedEntry(date, word, suggesterId));
    }

    @Override
    public boolean isUsed(String word) {
        return used.contains(word);
    }

    /**
     * Latest history entry for the given date, if any.
     */
    @Override
    public Optional<UsedEntry> findEntry(LocalDate date) {
        for (int i = history.size() - 1; i >= 0; i--) {
            UsedEntry e = history.get(i);
            if (e.date().equals(date)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    public void enqueue(QueuedSuggestion suggestion) {
        queue.addLast(suggestion);
    }

    /**
     * Remove and return the oldest queued suggestion, null if the queue is empty.
     */
    public QueuedSuggestion pollSuggestion() {
        return queue.pollFirst();
    }

    @Override
    public boolean isQueued(String word) {
        for (QueuedSuggestion q : queue) {
            if (q.word().equalsIgnoreCase(word)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int queueSize() {
        return queue.size();
    }

    /**
     * Read-only view of the used set.
     */
    @Override
    public Set<String> used() {
        return Collections.unmodifiableSet(used);
    }

    /**
     * Read-only view of the history, in insertion order.
     */
    @Override
    public List<UsedEntry> history() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Snapshot of the queue, oldest first.
     */
    @Override
    public List<QueuedSuggestion> queue() {
        return List.copyOf(queue);
    }

    @Override
    public BotState copy() {
        BotState copy = new BotState();
        copy.used.addAll(used);
        copy.history.addAll(history);
        copy.queue.addAll(queue);
        return copy;
    }

    /**
     * View of this state without the mutators.
     */
    StateView readOnlyView() {
        return readOnly;
    }

    // Used while decoding a snapshot; bypasses markUsed so manual edits load as written.
    void addUsed(String word) {
        used.add(word);
    }

    void addHistory(UsedEntry entry) {
        history.add(entry);
    }

    private final class ReadOnlyView implements StateView {

        @Override
        public boolean isUsed(String word) {
            return BotState.this.isUsed(word);
        }

        @Override
        public Optional<UsedEntry> findEntry(LocalDate date) {
            return BotState.this.findEntry(date);
        }

        @Override
        public boolean isQueued(String word) {
            return BotState.this.isQueued(word);
        }

        @Override
        public int queueSize() {
            return BotState.this.queueSize();
        }

        @Override
        public Set<String> used() {
            return BotState.this.used();
        }

        @Override
        public List<UsedEntry> history() {
            return BotState.this.history();
        }

        @Override
        public List<QueuedSuggestion> queue() {
            return BotState.this.queue();
        }

        @Override
        public BotState copy() {
            return BotState.this.copy();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BotState)) return false;
        BotState other = (BotState) o;
        return used.equals(other.used)
            && history.equals(other.history)
            && List.copyOf(queue).equals(List.copyOf(other.queue));
    }

    @Override
    public int hashCode() {
        return Objects.hash(used, history, List.copyOf(queue));
    }

    @Override
    public String toString() {
        return String.format("BotState[used=%d, history=%d, queue=%d]", used.size(), history.size(), queue.size());
    }
}
