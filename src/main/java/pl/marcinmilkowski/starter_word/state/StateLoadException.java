package pl.marcinmilkowski.starter_word.state;

import java.io.IOException;

/**
 * Thrown when an existing state snapshot cannot be read or parsed.
 */
public class StateLoadException extends IOException {

    public StateLoadException(String message) {
        super(message);
    }

    public StateLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
