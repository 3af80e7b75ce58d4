package pl.marcinmilkowski.starter_word.scheduler;

/**
 * Where a cycle's word came from.
 */
public enum SelectionSource {
    /** An earlier cycle already selected a word for the date. */
    REUSED,
    /** First valid entry of the suggestion queue. */
    QUEUE,
    /** Weighted random draw over unused lexicon words. */
    SAMPLER
}
