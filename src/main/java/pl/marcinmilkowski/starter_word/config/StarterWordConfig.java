package pl.marcinmilkowski.starter_word.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

/**
 * Process configuration, loaded from JSON with environment overrides.
 *
 * Expected JSON structure:
 * {
 *   "timezone": "Europe/Warsaw",
 *   "lexicon_path": "valid-words.txt",
 *   "state_path": "data/state.json",
 *   "api": { "port": 8080 },
 *   "announce": {
 *     "webhook_url": "https://discord.com/api/webhooks/...",
 *     "role_id": "123456789"
 *   }
 * }
 *
 * Environment variables win over file values: TIMEZONE, DICT_PATH, STATE_PATH,
 * API_PORT, ANNOUNCE_WEBHOOK_URL, WORDLE_ROLE_ID.
 */
public final class StarterWordConfig {

    private static final Logger logger = LoggerFactory.getLogger(StarterWordConfig.class);

    public static final int DEFAULT_PORT = 8080;

    private final ZoneId timezone;
    private final Path lexiconPath;
    private final Path statePath;
    private final int apiPort;
    private final URI webhookUrl;
    private final String roleId;

    private StarterWordConfig(ZoneId timezone, Path lexiconPath, Path statePath, int apiPort,
                              URI webhookUrl, String roleId) {
        this.timezone = timezone;
        this.lexiconPath = lexiconPath;
        this.statePath = statePath;
        this.apiPort = apiPort;
        this.webhookUrl = webhookUrl;
        this.roleId = roleId;
    }

    /**
     * Load configuration from a JSON file, then apply environment overrides.
     *
     * @throws ConfigException if the file is missing or invalid, or a required value is absent
     */
    public static StarterWordConfig load(Path configPath, Map<String, String> env) throws ConfigException {
        if (!Files.exists(configPath)) {
            throw new ConfigException("Config file not found: " + configPath);
        }
        JSONObject root;
        try {
            root = JSON.parseObject(Files.readString(configPath));
        } catch (IOException e) {
            throw new ConfigException("Failed to read config " + configPath + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // fastjson2 reports some truncated documents as index errors, not JSONException
            throw new ConfigException("Malformed config " + configPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new ConfigException("Empty config file: " + configPath);
        }
        StarterWordConfig config = build(root, env);
        logger.info("Loaded config from {}: {}", configPath, config);
        return config;
    }

    /**
     * Build configuration from environment variables only.
     */
    public static StarterWordConfig fromEnvironment(Map<String, String> env) throws ConfigException {
        return build(new JSONObject(), env);
    }

    private static StarterWordConfig build(JSONObject root, Map<String, String> env) throws ConfigException {
        JSONObject api = root.getJSONObject("api");
        JSONObject announce = root.getJSONObject("announce");

        String zoneId = pick(env, "TIMEZONE", root.getString("timezone"));
        String lexicon = pick(env, "DICT_PATH", root.getString("lexicon_path"));
        String state = pick(env, "STATE_PATH", root.getString("state_path"));
        String port = pick(env, "API_PORT", api != null ? api.getString("port") : null);
        String webhook = pick(env, "ANNOUNCE_WEBHOOK_URL", announce != null ? announce.getString("webhook_url") : null);
        String role = pick(env, "WORDLE_ROLE_ID", announce != null ? announce.getString("role_id") : null);

        ZoneId timezone;
        try {
            timezone = ZoneId.of(require(zoneId, "timezone"));
        } catch (DateTimeException e) {
            throw new ConfigException("Invalid timezone: " + zoneId, e);
        }

        int apiPort = DEFAULT_PORT;
        if (port != null) {
            try {
                apiPort = Integer.parseInt(port.trim());
            } catch (NumberFormatException e) {
                throw new ConfigException("Invalid API port: " + port, e);
            }
            if (apiPort < 0 || apiPort > 65535) {
                throw new ConfigException("API port out of range: " + apiPort);
            }
        }

        URI webhookUrl = null;
        if (webhook != null) {
            try {
                webhookUrl = URI.create(webhook.trim());
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Invalid webhook URL: " + webhook, e);
            }
            if (!webhookUrl.isAbsolute()) {
                throw new ConfigException("Webhook URL must be absolute: " + webhook);
            }
        }

        return new StarterWordConfig(
            timezone,
            Path.of(require(lexicon, "lexicon_path")),
            Path.of(require(state, "state_path")),
            apiPort,
            webhookUrl,
            role
        );
    }

    private static String pick(Map<String, String> env, String key, String fileValue) {
        String v = env.get(key);
        if (v != null && !v.isBlank()) return v;
        return fileValue == null || fileValue.isBlank() ? null : fileValue;
    }

    private static String require(String value, String field) throws ConfigException {
        if (value == null) {
            throw new ConfigException("Missing required config value: " + field);
        }
        return value.trim();
    }

    public ZoneId getTimezone() {
        return timezone;
    }

    public Path getLexiconPath() {
        return lexiconPath;
    }

    public Path getStatePath() {
        return statePath;
    }

    public int getApiPort() {
        return apiPort;
    }

    /**
     * Webhook for announcements, null to log them instead.
     */
    public URI getWebhookUrl() {
        return webhookUrl;
    }

    /**
     * Role mentioned in announcements, may be null.
     */
    public String getRoleId() {
        return roleId;
    }

    @Override
    public String toString() {
        return String.format("timezone=%s, lexicon=%s, state=%s, port=%d, webhook=%s, role=%s",
            timezone, lexiconPath, statePath, apiPort, webhookUrl != null ? "set" : "none", roleId);
    }
}
