package pl.marcinmilkowski.starter_word.announce;

import java.time.LocalDate;
import java.util.Objects;

/**
 * The word selected for a date, ready to be announced.
 */
public record Announcement(
    LocalDate date,
    String word,
    String suggesterId   // null for sampler picks
) {

    public Announcement {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(word, "word");
    }
}
