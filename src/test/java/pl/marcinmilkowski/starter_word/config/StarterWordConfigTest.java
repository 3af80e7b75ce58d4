package pl.marcinmilkowski.starter_word.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StarterWordConfigTest {

    @TempDir
    Path tempDir;

    private Path writeConfig(String json) throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    @DisplayName("Loads every section from the JSON file")
    void loadsFile() throws Exception {
        Path file = writeConfig("""
            {
              "timezone": "Europe/Warsaw",
              "lexicon_path": "words.txt",
              "state_path": "data/state.json",
              "api": { "port": 9090 },
              "announce": { "webhook_url": "https://example.org/hook", "role_id": "555" }
            }
            """);

        StarterWordConfig config = StarterWordConfig.load(file, Map.of());

        assertEquals(ZoneId.of("Europe/Warsaw"), config.getTimezone());
        assertEquals(Path.of("words.txt"), config.getLexiconPath());
        assertEquals(Path.of("data/state.json"), config.getStatePath());
        assertEquals(9090, config.getApiPort());
        assertEquals(URI.create("https://example.org/hook"), config.getWebhookUrl());
        assertEquals("555", config.getRoleId());
    }

    @Test
    @DisplayName("Environment values override the file")
    void environmentWins() throws Exception {
        Path file = writeConfig("""
            { "timezone": "Europe/Warsaw", "lexicon_path": "words.txt", "state_path": "state.json" }
            """);

        StarterWordConfig config = StarterWordConfig.load(file, Map.of(
            "TIMEZONE", "America/New_York",
            "STATE_PATH", "/var/lib/bot/state.json",
            "API_PORT", "0"));

        assertEquals(ZoneId.of("America/New_York"), config.getTimezone());
        assertEquals(Path.of("words.txt"), config.getLexiconPath());
        assertEquals(Path.of("/var/lib/bot/state.json"), config.getStatePath());
        assertEquals(0, config.getApiPort());
        assertNull(config.getWebhookUrl());
        assertNull(config.getRoleId());
    }

    @Test
    @DisplayName("Environment alone is enough when it names the required values")
    void environmentOnly() throws Exception {
        StarterWordConfig config = StarterWordConfig.fromEnvironment(Map.of(
            "TIMEZONE", "UTC",
            "DICT_PATH", "valid-words.txt",
            "STATE_PATH", "state.json",
            "WORDLE_ROLE_ID", "777"));

        assertEquals(StarterWordConfig.DEFAULT_PORT, config.getApiPort());
        assertEquals("777", config.getRoleId());
    }

    @Test
    @DisplayName("Missing required values fail")
    void missingRequired() {
        ConfigException e = assertThrows(ConfigException.class,
            () -> StarterWordConfig.fromEnvironment(Map.of("TIMEZONE", "UTC", "DICT_PATH", "w.txt")));
        assertTrue(e.getMessage().contains("state_path"));

        assertThrows(ConfigException.class,
            () -> StarterWordConfig.fromEnvironment(Map.of("DICT_PATH", "w.txt", "STATE_PATH", "s.json")));
    }

    @Test
    @DisplayName("Invalid values fail")
    void invalidValues() {
        Map<String, String> base = Map.of("DICT_PATH", "w.txt", "STATE_PATH", "s.json");

        assertThrows(ConfigException.class, () -> StarterWordConfig.fromEnvironment(
            with(base, "TIMEZONE", "Mars/Olympus")));
        assertThrows(ConfigException.class, () -> StarterWordConfig.fromEnvironment(
            with(with(base, "TIMEZONE", "UTC"), "API_PORT", "eighty")));
        assertThrows(ConfigException.class, () -> StarterWordConfig.fromEnvironment(
            with(with(base, "TIMEZONE", "UTC"), "API_PORT", "70000")));
        assertThrows(ConfigException.class, () -> StarterWordConfig.fromEnvironment(
            with(with(base, "TIMEZONE", "UTC"), "ANNOUNCE_WEBHOOK_URL", "not a url")));
        assertThrows(ConfigException.class, () -> StarterWordConfig.fromEnvironment(
            with(with(base, "TIMEZONE", "UTC"), "ANNOUNCE_WEBHOOK_URL", "/relative/hook")));
    }

    @Test
    @DisplayName("Missing or malformed config files fail")
    void badFiles() throws Exception {
        assertThrows(ConfigException.class,
            () -> StarterWordConfig.load(tempDir.resolve("absent.json"), Map.of()));
        Path broken = writeConfig("{ \"timezone\": ");
        assertThrows(ConfigException.class, () -> StarterWordConfig.load(broken, Map.of()));
        Path cutOff = writeConfig("{\"timezone\":\"UTC\",\"lexicon_path\":\"wor");
        assertThrows(ConfigException.class, () -> StarterWordConfig.load(cutOff, Map.of()));
    }

    private static Map<String, String> with(Map<String, String> base, String key, String value) {
        Map<String, String> copy = new java.util.HashMap<>(base);
        copy.put(key, value);
        return copy;
    }
}
