package pl.marcinmilkowski.starter_word.announce;

import com.alibaba.fastjson2.JSON;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WebhookAnnouncerTest {

    private static final Announcement ANNOUNCEMENT = new Announcement(LocalDate.of(2026, 10, 19), "crwth", "1234");

    private HttpServer server;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastContentType = new AtomicReference<>();
    private final AtomicInteger status = new AtomicInteger(204);

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/hook", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            exchange.sendResponseHeaders(status.get(), -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private URI hookUri() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/hook");
    }

    @Test
    @DisplayName("Posts the formatted text as JSON content")
    void postsContent() throws Exception {
        AnnouncementFormatter formatter = new AnnouncementFormatter("555");
        new WebhookAnnouncer(hookUri(), formatter).announce(ANNOUNCEMENT);

        assertEquals(formatter.format(ANNOUNCEMENT), JSON.parseObject(lastBody.get()).getString("content"));
        assertTrue(lastContentType.get().startsWith("application/json"));
    }

    @Test
    @DisplayName("Non-2xx response is an AnnouncementException")
    void rejectsErrorStatus() {
        status.set(500);
        WebhookAnnouncer announcer = new WebhookAnnouncer(hookUri(), new AnnouncementFormatter(null));

        AnnouncementException e = assertThrows(AnnouncementException.class, () -> announcer.announce(ANNOUNCEMENT));
        assertTrue(e.getMessage().contains("500"));
    }

    @Test
    @DisplayName("Unreachable endpoint is an AnnouncementException")
    void unreachable() {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            freePort = socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        URI uri = URI.create("http://127.0.0.1:" + freePort + "/hook");
        WebhookAnnouncer announcer = new WebhookAnnouncer(uri, new AnnouncementFormatter(null));

        assertThrows(AnnouncementException.class, () -> announcer.announce(ANNOUNCEMENT));
    }

    @Test
    @DisplayName("Relative webhook URI is rejected")
    void relativeUri() {
        assertThrows(IllegalArgumentException.class,
            () -> new WebhookAnnouncer(URI.create("/hook"), new AnnouncementFormatter(null)));
    }
}
