package pl.marcinmilkowski.starter_word.announce;

import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Posts announcements to a chat webhook as {@code {"content": "..."}}.
 */
public class WebhookAnnouncer implements Announcer {

    private static final Logger logger = LoggerFactory.getLogger(WebhookAnnouncer.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final URI endpoint;
    private final AnnouncementFormatter formatter;

    public WebhookAnnouncer(URI endpoint, AnnouncementFormatter formatter) {
        this(HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(), endpoint, formatter);
    }

    public WebhookAnnouncer(HttpClient httpClient, URI endpoint, AnnouncementFormatter formatter) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        if (!endpoint.isAbsolute()) throw new IllegalArgumentException("Webhook URI must be absolute: " + endpoint);
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    @Override
    public void announce(Announcement announcement) throws AnnouncementException {
        JSONObject payload = new JSONObject();
        payload.put("content", formatter.format(announcement));

        HttpRequest request = HttpRequest.newBuilder(endpoint)
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", "application/json; charset=UTF-8")
            .POST(HttpRequest.BodyPublishers.ofString(payload.toJSONString(), StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new AnnouncementException("Webhook request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnnouncementException("Interrupted while posting announcement", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new AnnouncementException("Webhook returned HTTP " + status + ": " + response.body());
        }
        logger.info("Announced '{}' for {} (HTTP {})", announcement.word(), announcement.date(), status);
    }
}
