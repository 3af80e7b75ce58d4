package pl.marcinmilkowski.starter_word.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.starter_word.lexicon.Lexicon;
import pl.marcinmilkowski.starter_word.state.QueuedSuggestion;
import pl.marcinmilkowski.starter_word.state.StateStore;
import pl.marcinmilkowski.starter_word.state.StateView;

import java.util.Objects;

/**
 * Validates submitted words and appends accepted ones to the suggestion queue.
 *
 * Checks run in order: format, lexicon membership, used set, queue duplicates.
 * The used/queued checks are repeated under the write lock so two concurrent
 * submissions of the same word cannot both be queued.
 */
public class SuggestionService {

    private static final Logger logger = LoggerFactory.getLogger(SuggestionService.class);

    private final Lexicon lexicon;
    private final StateStore store;

    public SuggestionService(Lexicon lexicon, StateStore store) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Validate and queue a suggestion.
     *
     * @param submitterId opaque id of the submitter, kept for attribution
     * @param rawWord the word as typed; trimmed and lowercased before checks
     */
    public SuggestionResult submitSuggestion(String submitterId, String rawWord) {
        Objects.requireNonNull(submitterId, "submitterId");
        String word = Lexicon.normalize(rawWord);

        if (!Lexicon.isWellFormed(word)) {
            return reject(submitterId, word, RejectionReason.INVALID_FORMAT);
        }
        if (!lexicon.contains(word)) {
            return reject(submitterId, word, RejectionReason.NOT_IN_LEXICON);
        }
        RejectionReason early = store.withRead(s -> stateCheck(s, word));
        if (early != null) {
            return reject(submitterId, word, early);
        }

        RejectionReason late = store.withWrite(s -> {
            RejectionReason reason = stateCheck(s, word);
            if (reason == null) {
                s.enqueue(new QueuedSuggestion(submitterId, word));
            }
            return reason;
        });
        if (late != null) {
            return reject(submitterId, word, late);
        }

        logger.info("Queued suggestion '{}' from {}", word, submitterId);
        return SuggestionResult.accepted(word);
    }

    private static RejectionReason stateCheck(StateView state, String word) {
        if (state.isUsed(word)) return RejectionReason.ALREADY_USED;
        if (state.isQueued(word)) return RejectionReason.ALREADY_QUEUED;
        return null;
    }

    private SuggestionResult reject(String submitterId, String word, RejectionReason reason) {
        logger.debug("Rejected suggestion '{}' from {}: {}", word, submitterId, reason);
        return SuggestionResult.rejected(word, reason);
    }
}
