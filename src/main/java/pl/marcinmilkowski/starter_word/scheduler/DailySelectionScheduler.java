package pl.marcinmilkowski.starter_word.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.starter_word.announce.AnnouncementException;
import pl.marcinmilkowski.starter_word.announce.Announcer;
import pl.marcinmilkowski.starter_word.lexicon.Lexicon;
import pl.marcinmilkowski.starter_word.sampler.WeightedSampler;
import pl.marcinmilkowski.starter_word.state.QueuedSuggestion;
import pl.marcinmilkowski.starter_word.state.StateStore;
import pl.marcinmilkowski.starter_word.state.UsedEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Selects and announces tomorrow's word once per day.
 *
 * One cycle targets tomorrow's date in the clock's zone:
 * 1. Reuse: if history already has an entry for the date, announce it again.
 * 2. Queue: pop suggestions until one is in the lexicon and unused; drop the rest.
 * 3. Fallback: weighted draw over unused lexicon words.
 * 4. Announce.
 *
 * The cycle runs once on {@link #start()}, then every day at 23:55 local time.
 * Cycle failures are logged and the loop carries on; {@link #stop()} ends it.
 */
public class DailySelectionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DailySelectionScheduler.class);

    public static final LocalTime TRIGGER_TIME = LocalTime.of(23, 55);

    private final Lexicon lexicon;
    private final StateStore store;
    private final WeightedSampler sampler;
    private final Announcer announcer;
    private final Clock clock;
    private final double alpha;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private Thread worker;

    /**
     * @param clock clock in the configured timezone
     */
    public DailySelectionScheduler(Lexicon lexicon, StateStore store, WeightedSampler sampler,
                                   Announcer announcer, Clock clock) {
        this(lexicon, store, sampler, announcer, clock, WeightedSampler.DEFAULT_ALPHA);
    }

    public DailySelectionScheduler(Lexicon lexicon, StateStore store, WeightedSampler sampler,
                                   Announcer announcer, Clock clock, double alpha) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        this.store = Objects.requireNonNull(store, "store");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.announcer = Objects.requireNonNull(announcer, "announcer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.alpha = alpha;
    }

    /**
     * Run one cycle for tomorrow's date.
     *
     * @return the selected (or reused) word
     * @throws NoCandidateException if nothing is left to select
     * @throws AnnouncementException if selection succeeded but delivery failed;
     *         the word stays recorded for the date
     */
    public SelectionResult runCycle() throws NoCandidateException, AnnouncementException {
        LocalDate target = LocalDate.now(clock).plusDays(1);
        SelectionResult result = select(target);
        logger.info("Selected '{}' for {} ({})", result.word(), result.date(), result.source());
        announcer.announce(result.toAnnouncement());
        return result;
    }

    SelectionResult select(LocalDate target) throws NoCandidateException {
        Optional<UsedEntry> existing = store.withRead(s -> s.findEntry(target));
        if (existing.isPresent()) {
            UsedEntry e = existing.get();
            return new SelectionResult(target, e.word(), e.suggesterId(), SelectionSource.REUSED);
        }

        Optional<QueuedSuggestion> fromQueue = drainQueue(target);
        if (fromQueue.isPresent()) {
            QueuedSuggestion q = fromQueue.get();
            return new SelectionResult(target, q.word(), q.submitterId(), SelectionSource.QUEUE);
        }

        Set<String> used = store.withRead(s -> new LinkedHashSet<>(s.used()));
        Optional<String> picked = sampler.pickWeighted(lexicon, used, alpha);
        if (picked.isEmpty()) {
            throw new NoCandidateException("No unused lexicon words left (" + used.size() + " used of "
                + lexicon.size() + ")");
        }
        String word = picked.get();
        store.update(s -> s.markUsed(target, word, null));
        return new SelectionResult(target, word, null, SelectionSource.SAMPLER);
    }

    // Single write: pops up to and including the first acceptable entry, then marks it used.
    private Optional<QueuedSuggestion> drainQueue(LocalDate target) {
        if (store.withRead(s -> s.queueSize() == 0)) {
            return Optional.empty();
        }
        return store.withWrite(s -> {
            QueuedSuggestion next;
            while ((next = s.pollSuggestion()) != null) {
                String word = Lexicon.normalize(next.word());
                if (lexicon.contains(word) && !s.isUsed(word)) {
                    s.markUsed(target, word, next.submitterId());
                    return Optional.of(new QueuedSuggestion(next.submitterId(), word));
                }
                logger.info("Dropped queued suggestion '{}' from {}: {}", next.word(), next.submitterId(),
                    lexicon.contains(word) ? "already used" : "not in lexicon");
            }
            return Optional.<QueuedSuggestion>empty();
        });
    }

    /**
     * Next 23:55 local time strictly after {@code now}: today's if still ahead, otherwise tomorrow's.
     */
    public static ZonedDateTime nextTrigger(ZonedDateTime now) {
        ZonedDateTime today = ZonedDateTime.of(now.toLocalDate(), TRIGGER_TIME, now.getZone());
        if (now.isBefore(today)) {
            return today;
        }
        return ZonedDateTime.of(now.toLocalDate().plusDays(1), TRIGGER_TIME, now.getZone());
    }

    /**
     * Start the background loop. The first cycle runs immediately.
     */
    public synchronized void start() {
        if (worker != null) {
            throw new IllegalStateException("Scheduler already started");
        }
        worker = new Thread(this::loop, "daily-selection");
        worker.setDaemon(true);
        worker.start();
        logger.info("Daily selection scheduler started ({} local)", TRIGGER_TIME);
    }

    /**
     * Signal the loop to finish and wait briefly for it.
     */
    public void stop() {
        stopSignal.countDown();
        Thread t;
        synchronized (this) {
            t = worker;
        }
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Daily selection scheduler stopped");
    }

    public boolean isStopped() {
        return stopSignal.getCount() == 0;
    }

    private void loop() {
        while (!isStopped()) {
            runCycleSafely();

            ZonedDateTime now = ZonedDateTime.now(clock);
            ZonedDateTime next = nextTrigger(now);
            Duration wait = Duration.between(now, next);
            logger.info("Next selection at {} (in {})", next, wait);
            try {
                if (stopSignal.await(Math.max(wait.toMillis(), 0), TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Scheduler interrupted, exiting loop");
                return;
            }
        }
    }

    void runCycleSafely() {
        try {
            runCycle();
        } catch (NoCandidateException e) {
            logger.error("Selection cycle failed: {}", e.getMessage());
        } catch (AnnouncementException e) {
            logger.error("Announcement failed, will retry on next cycle: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            logger.error("Unexpected error in selection cycle", e);
        }
    }
}
