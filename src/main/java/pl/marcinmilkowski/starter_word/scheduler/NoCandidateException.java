package pl.marcinmilkowski.starter_word.scheduler;

/**
 * Thrown when every lexicon word has been used and the queue offered nothing.
 */
public class NoCandidateException extends Exception {

    public NoCandidateException(String message) {
        super(message);
    }
}
