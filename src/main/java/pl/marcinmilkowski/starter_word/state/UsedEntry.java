package pl.marcinmilkowski.starter_word.state;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * One past selection: the word chosen for a calendar date.
 */
public record UsedEntry(
    LocalDate date,
    String word,
    String suggesterId   // null when the word came from the weighted sampler
) {

    public UsedEntry {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(word, "word");
    }

    public Optional<String> suggester() {
        return Optional.ofNullable(suggesterId);
    }
}
