package pl.marcinmilkowski.starter_word.lexicon;

import java.io.IOException;

/**
 * Thrown when the lexicon source cannot be read.
 */
public class LexiconLoadException extends IOException {

    public LexiconLoadException(String message) {
        super(message);
    }

    public LexiconLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
