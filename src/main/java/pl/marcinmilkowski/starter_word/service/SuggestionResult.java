package pl.marcinmilkowski.starter_word.service;

import java.util.Objects;

/**
 * Outcome of a suggestion: accepted with the normalized word, or rejected with a reason.
 */
public record SuggestionResult(String word, RejectionReason reason) {

    public static SuggestionResult accepted(String word) {
        return new SuggestionResult(Objects.requireNonNull(word, "word"), null);
    }

    public static SuggestionResult rejected(String word, RejectionReason reason) {
        return new SuggestionResult(word, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isAccepted() {
        return reason == null;
    }

    public String message() {
        return isAccepted() ? "Queued `" + word + "`." : reason.message();
    }
}
