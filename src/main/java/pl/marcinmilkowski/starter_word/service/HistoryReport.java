package pl.marcinmilkowski.starter_word.service;

import pl.marcinmilkowski.starter_word.state.UsedEntry;

import java.util.List;

/**
 * Result of a history query.
 *
 * {@code entries} holds every qualifying entry, newest first; {@code text} is the
 * rendered message, truncated to the transport budget.
 */
public record HistoryReport(int days, List<UsedEntry> entries, String text) {

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
