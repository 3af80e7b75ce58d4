package pl.marcinmilkowski.starter_word.scheduler;

import pl.marcinmilkowski.starter_word.announce.Announcement;

import java.time.LocalDate;

/**
 * The outcome of one selection cycle.
 */
public record SelectionResult(LocalDate date, String word, String suggesterId, SelectionSource source) {

    public Announcement toAnnouncement() {
        return new Announcement(date, word, suggesterId);
    }
}
