package pl.marcinmilkowski.starter_word.state;

import java.util.Objects;

/**
 * A submitted word waiting in the suggestion queue.
 */
public record QueuedSuggestion(String submitterId, String word) {

    public QueuedSuggestion {
        Objects.requireNonNull(submitterId, "submitterId");
        Objects.requireNonNull(word, "word");
    }
}
