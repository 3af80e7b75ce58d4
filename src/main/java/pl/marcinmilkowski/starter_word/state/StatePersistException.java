package pl.marcinmilkowski.starter_word.state;

import java.io.IOException;

/**
 * Thrown when the state snapshot cannot be written to disk.
 */
public class StatePersistException extends IOException {

    public StatePersistException(String message, Throwable cause) {
        super(message, cause);
    }
}
