package pl.marcinmilkowski.starter_word.service;

/**
 * Why a suggestion was not queued, in the order the checks run.
 */
public enum RejectionReason {
    INVALID_FORMAT("Rejected: provide a 5-letter a-z word."),
    NOT_IN_LEXICON("Rejected: not in dictionary."),
    ALREADY_USED("Rejected: already used previously."),
    ALREADY_QUEUED("Already queued.");

    private final String message;

    RejectionReason(String message) {
        this.message = message;
    }

    /**
     * Human-readable text for the submitter.
     */
    public String message() {
        return message;
    }
}
