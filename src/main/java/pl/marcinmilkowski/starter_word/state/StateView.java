package pl.marcinmilkowski.starter_word.state;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to the selection state, handed out by {@link StateStore#withRead}.
 */
public interface StateView {

    boolean isUsed(String word);

    /**
     * Latest history entry for the given date, if any.
     */
    Optional<UsedEntry> findEntry(LocalDate date);

    /**
     * Case-insensitive check against the words waiting in the queue.
     */
    boolean isQueued(String word);

    int queueSize();

    Set<String> used();

    List<UsedEntry> history();

    /**
     * Queued suggestions, oldest first.
     */
    List<QueuedSuggestion> queue();

    /**
     * Detached mutable copy; changes to it never reach the store.
     */
    BotState copy();
}
