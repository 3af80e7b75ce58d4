package pl.marcinmilkowski.starter_word.service;

import pl.marcinmilkowski.starter_word.state.StateStore;
import pl.marcinmilkowski.starter_word.state.UsedEntry;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Lists recent selections for display.
 */
public class HistoryService {

    public static final int DEFAULT_DAYS = 14;
    public static final int MIN_DAYS = 1;
    public static final int MAX_DAYS = 3650;

    /** Character budget of one rendered message. */
    public static final int MESSAGE_BUDGET = 1900;

    private static final Comparator<UsedEntry> NEWEST_FIRST =
        Comparator.comparing(UsedEntry::date).reversed().thenComparing(UsedEntry::word);

    private final StateStore store;
    private final Clock clock;

    /**
     * @param clock clock in the configured timezone; "today" is taken from it
     */
    public HistoryService(StateStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Entries dated on or after {@code today - daysBack}, newest first, ties by word.
     *
     * @param daysBack days to look back; null means {@value #DEFAULT_DAYS}, clamped to [1, 3650]
     */
    public HistoryReport queryHistory(Integer daysBack) {
        int days = clampDays(daysBack);
        LocalDate cutoff = LocalDate.now(clock).minusDays(days);

        List<UsedEntry> rows = store.withRead(s -> s.history().stream()
            .filter(e -> !e.date().isBefore(cutoff))
            .collect(Collectors.toList()));
        rows.sort(NEWEST_FIRST);

        if (rows.isEmpty()) {
            return new HistoryReport(days, List.of(), "No entries in the last " + days + " days.");
        }

        StringBuilder out = new StringBuilder(1024);
        out.append("Previous starting words for the last ").append(days).append(" days\n");
        for (UsedEntry e : rows) {
            String line = e.date() + " - `" + e.word() + "`\n";
            if (out.length() + line.length() > MESSAGE_BUDGET) {
                break;
            }
            out.append(line);
        }
        return new HistoryReport(days, List.copyOf(rows), out.toString());
    }

    static int clampDays(Integer daysBack) {
        int days = daysBack != null ? daysBack : DEFAULT_DAYS;
        return Math.max(MIN_DAYS, Math.min(MAX_DAYS, days));
    }
}
