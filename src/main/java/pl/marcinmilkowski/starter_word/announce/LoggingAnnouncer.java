package pl.marcinmilkowski.starter_word.announce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes announcements to the log. Used when no webhook is configured.
 */
public class LoggingAnnouncer implements Announcer {

    private static final Logger logger = LoggerFactory.getLogger(LoggingAnnouncer.class);

    private final AnnouncementFormatter formatter;

    public LoggingAnnouncer(AnnouncementFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public void announce(Announcement announcement) {
        logger.info("Announcement for {}:\n{}", announcement.date(), formatter.format(announcement));
    }
}
