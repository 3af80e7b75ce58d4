package pl.marcinmilkowski.starter_word.announce;

/**
 * Renders announcements as chat text with role and user mentions.
 *
 * Output shape:
 * <pre>
 * &lt;@&amp;ROLE&gt;
 * Tomorrow's Wordle starter (2026-10-19) is: ||`crwth`||
 * Suggested by &lt;@1234&gt;
 * </pre>
 * The role line is present only when a role id is configured, the last line only
 * for suggested words. The word is wrapped in spoiler markers.
 */
public class AnnouncementFormatter {

    private final String roleId;

    /**
     * @param roleId role to mention, null or blank for none
     */
    public AnnouncementFormatter(String roleId) {
        this.roleId = roleId == null || roleId.isBlank() ? null : roleId.trim();
    }

    public String format(Announcement a) {
        StringBuilder sb = new StringBuilder();
        if (roleId != null) {
            sb.append("<@&").append(roleId).append(">\n");
        }
        sb.append("Tomorrow's Wordle starter (").append(a.date()).append(") is: ||`")
            .append(a.word()).append("`||");
        if (a.suggesterId() != null) {
            sb.append("\nSuggested by ").append(mention(a.suggesterId()));
        }
        return sb.toString();
    }

    public static String mention(String userId) {
        return "<@" + userId + ">";
    }
}
