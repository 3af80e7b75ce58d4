package pl.marcinmilkowski.starter_word.announce;

/**
 * Outbound notification channel for daily selections.
 *
 * Implementations must tolerate being called again for the same date: a cycle
 * that failed after selecting re-announces the stored word on the next run.
 */
public interface Announcer {

    /**
     * Deliver an announcement.
     *
     * @throws AnnouncementException if the channel did not accept it
     */
    void announce(Announcement announcement) throws AnnouncementException;
}
