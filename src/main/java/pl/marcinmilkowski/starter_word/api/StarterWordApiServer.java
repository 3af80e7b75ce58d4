package pl.marcinmilkowski.starter_word.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.starter_word.lexicon.Lexicon;
import pl.marcinmilkowski.starter_word.lexicon.LexiconEntry;
import pl.marcinmilkowski.starter_word.service.HistoryReport;
import pl.marcinmilkowski.starter_word.service.HistoryService;
import pl.marcinmilkowski.starter_word.service.SuggestionResult;
import pl.marcinmilkowski.starter_word.service.SuggestionService;
import pl.marcinmilkowski.starter_word.state.StateStore;
import pl.marcinmilkowski.starter_word.state.UsedEntry;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * REST API server for suggestions and history.
 *
 * Endpoints:
 * - GET  /health - Health check with lexicon and state counters
 * - POST /api/suggest - Queue a word: {"submitter_id": "...", "word": "..."}
 * - GET  /api/history?days=14 - Recent selections, newest first
 * - GET  /api/lexicon/top?n=20 - Highest-scoring lexicon words
 */
public class StarterWordApiServer {

    private static final Logger logger = LoggerFactory.getLogger(StarterWordApiServer.class);

    private static final int MAX_TOP = 500;

    private final Lexicon lexicon;
    private final StateStore store;
    private final SuggestionService suggestions;
    private final HistoryService history;
    private final int port;
    private HttpServer server;
    private ExecutorService executor;

    public StarterWordApiServer(Lexicon lexicon, StateStore store, SuggestionService suggestions,
                                HistoryService history, int port) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        this.store = Objects.requireNonNull(store, "store");
        this.suggestions = Objects.requireNonNull(suggestions, "suggestions");
        this.history = Objects.requireNonNull(history, "history");
        this.port = port;
    }

    /**
     * Start the API server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", wrapHandler(this::handleHealth));
        server.createContext("/api/suggest", wrapHandler(this::handleSuggest));
        server.createContext("/api/history", wrapHandler(this::handleHistory));
        server.createContext("/api/lexicon/top", wrapHandler(this::handleTop));

        executor = Executors.newFixedThreadPool(4);
        server.setExecutor(executor);
        server.start();
        logger.info("API server started on http://localhost:{}", getPort());
        logger.info("Endpoints:");
        logger.info("  GET  /health            - Health check");
        logger.info("  POST /api/suggest       - Queue a suggested word");
        logger.info("  GET  /api/history       - Recent selections (?days=N)");
        logger.info("  GET  /api/lexicon/top   - Highest-scoring words (?n=N)");
    }

    /**
     * Stop the API server.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            logger.info("API server stopped");
        }
        if (executor != null) {
            executor.shutdown();
        }
    }

    /**
     * Port actually bound, useful when started with port 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Wrap a handler to catch all exceptions and return JSON error.
     */
    private HttpHandler wrapHandler(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (Exception e) {
                logger.error("Unhandled exception for {}: {}", exchange.getRequestURI(), e.getMessage(), e);
                try {
                    if (exchange.getResponseCode() == -1) {
                        sendError(exchange, 500, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                    } else {
                        logger.warn("Cannot send error response: headers already sent");
                    }
                } catch (IOException sendFailure) {
                    logger.debug("Failed to send error response: {}", sendFailure.getMessage());
                }
            } finally {
                exchange.close();
            }
        };
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }

        Map<String, Object> response = new HashMap<>();
        response.put("status", "ok");
        response.put("service", "starter-word");
        response.put("lexicon_size", lexicon.size());
        response.put("used_count", store.withRead(s -> s.used().size()));
        response.put("queue_length", store.withRead(s -> s.queueSize()));
        response.put("state_dirty", store.isDirty());
        sendJson(exchange, 200, response);
    }

    /**
     * POST /api/suggest
     * {
     *   "submitter_id": "1234",
     *   "word": "fjord"
     * }
     */
    private void handleSuggest(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }

        JSONObject request;
        try {
            request = JSON.parseObject(readRequestBody(exchange));
        } catch (JSONException e) {
            sendError(exchange, 400, "Invalid JSON body");
            return;
        }
        String submitter = request != null ? request.getString("submitter_id") : null;
        String word = request != null ? request.getString("word") : null;
        if (submitter == null || submitter.isBlank() || word == null) {
            sendError(exchange, 400, "Missing required fields: submitter_id, word");
            return;
        }

        SuggestionResult result = suggestions.submitSuggestion(submitter.trim(), word);

        Map<String, Object> response = new HashMap<>();
        response.put("status", result.isAccepted() ? "accepted" : "rejected");
        response.put("word", result.word());
        response.put("message", result.message());
        if (!result.isAccepted()) {
            response.put("reason", result.reason().name());
        }
        sendJson(exchange, 200, response);
    }

    private void handleHistory(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }

        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        Integer days = null;
        if (params.containsKey("days")) {
            try {
                days = Integer.parseInt(params.get("days").trim());
            } catch (NumberFormatException e) {
                sendError(exchange, 400, "Invalid numeric parameter: days");
                return;
            }
        }

        HistoryReport report = history.queryHistory(days);
        List<Map<String, Object>> entries = new ArrayList<>();
        for (UsedEntry e : report.entries()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", e.date().toString());
            row.put("word", e.word());
            row.put("suggester_id", e.suggesterId());
            entries.add(row);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("status", report.isEmpty() ? "empty" : "ok");
        response.put("days", report.days());
        response.put("entries", entries);
        response.put("text", report.text());
        sendJson(exchange, 200, response);
    }

    private void handleTop(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }

        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        int n;
        try {
            n = Integer.parseInt(params.getOrDefault("n", "20").trim());
        } catch (NumberFormatException e) {
            sendError(exchange, 400, "Invalid numeric parameter: n");
            return;
        }
        n = Math.max(1, Math.min(MAX_TOP, n));

        List<Map<String, Object>> words = new ArrayList<>();
        for (LexiconEntry entry : lexicon.top(n)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("word", entry.word());
            row.put("score", Math.round(entry.score() * 1000.0) / 1000.0);
            words.add(row);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("status", "ok");
        response.put("count", words.size());
        response.put("words", words);
        sendJson(exchange, 200, response);
    }

    private Map<String, String> parseQueryParams(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }

        for (String pair : query.split("&")) {
            String[] keyValue = pair.split("=", 2);
            if (keyValue.length == 2) {
                try {
                    params.put(
                        URLDecoder.decode(keyValue[0], StandardCharsets.UTF_8),
                        URLDecoder.decode(keyValue[1], StandardCharsets.UTF_8)
                    );
                } catch (IllegalArgumentException e) {
                    logger.debug("Skipping malformed query parameter: {}", pair);
                }
            }
        }
        return params;
    }

    private String readRequestBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private void sendJson(HttpExchange exchange, int status, Map<String, Object> data) throws IOException {
        String json = JSON.toJSONString(data, com.alibaba.fastjson2.JSONWriter.Feature.WriteMapNullValue);
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        exchange.sendResponseHeaders(status, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        Map<String, Object> error = new HashMap<>();
        error.put("status", "error");
        error.put("message", message);
        error.put("code", status);

        sendJson(exchange, status, error);
    }

    /**
     * Builder for the API server.
     */
    public static class Builder {
        private Lexicon lexicon;
        private StateStore store;
        private SuggestionService suggestions;
        private HistoryService history;
        private int port = 8080;

        public Builder withLexicon(Lexicon lexicon) {
            this.lexicon = lexicon;
            return this;
        }

        public Builder withStore(StateStore store) {
            this.store = store;
            return this;
        }

        public Builder withSuggestionService(SuggestionService suggestions) {
            this.suggestions = suggestions;
            return this;
        }

        public Builder withHistoryService(HistoryService history) {
            this.history = history;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public StarterWordApiServer build() {
            return new StarterWordApiServer(lexicon, store, suggestions, history, port);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
