package pl.marcinmilkowski.starter_word.announce;

import java.io.IOException;

/**
 * Thrown when an announcement could not be delivered.
 */
public class AnnouncementException extends IOException {

    public AnnouncementException(String message) {
        super(message);
    }

    public AnnouncementException(String message, Throwable cause) {
        super(message, cause);
    }
}
