package pl.marcinmilkowski.starter_word;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.starter_word.announce.AnnouncementFormatter;
import pl.marcinmilkowski.starter_word.announce.Announcer;
import pl.marcinmilkowski.starter_word.announce.LoggingAnnouncer;
import pl.marcinmilkowski.starter_word.announce.WebhookAnnouncer;
import pl.marcinmilkowski.starter_word.api.StarterWordApiServer;
import pl.marcinmilkowski.starter_word.config.ConfigException;
import pl.marcinmilkowski.starter_word.config.StarterWordConfig;
import pl.marcinmilkowski.starter_word.lexicon.Lexicon;
import pl.marcinmilkowski.starter_word.lexicon.LexiconEntry;
import pl.marcinmilkowski.starter_word.sampler.WeightedSampler;
import pl.marcinmilkowski.starter_word.scheduler.DailySelectionScheduler;
import pl.marcinmilkowski.starter_word.service.HistoryService;
import pl.marcinmilkowski.starter_word.service.SuggestionService;
import pl.marcinmilkowski.starter_word.state.StateStore;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Main entry point for the Starter Word application.
 * Wires the lexicon, state store, scheduler and API server together.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        String command = args[0].toLowerCase();
        try {
            switch (command) {
                case "run":
                    handleRunCommand(args);
                    break;
                case "rank":
                    handleRankCommand(args);
                    break;
                case "pick":
                    handlePickCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (ConfigException | IOException e) {
            logger.error("Startup failed: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
            System.exit(1);
        }
    }

    private static void handleRunCommand(String[] args) throws ConfigException, IOException {
        String configFile = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                case "-c":
                    configFile = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        StarterWordConfig config = configFile != null
            ? StarterWordConfig.load(Paths.get(configFile), System.getenv())
            : StarterWordConfig.fromEnvironment(System.getenv());

        logger.info("Starting Starter Word ({})", config);
        Clock clock = Clock.system(config.getTimezone());

        StateStore store = new StateStore(config.getStatePath());
        store.load();

        Lexicon lexicon = Lexicon.load(config.getLexiconPath());
        if (lexicon.isEmpty()) {
            throw new ConfigException("Lexicon has no five-letter words: " + config.getLexiconPath());
        }

        AnnouncementFormatter formatter = new AnnouncementFormatter(config.getRoleId());
        Announcer announcer = config.getWebhookUrl() != null
            ? new WebhookAnnouncer(config.getWebhookUrl(), formatter)
            : new LoggingAnnouncer(formatter);

        StarterWordApiServer server = StarterWordApiServer.builder()
            .withLexicon(lexicon)
            .withStore(store)
            .withSuggestionService(new SuggestionService(lexicon, store))
            .withHistoryService(new HistoryService(store, clock))
            .withPort(config.getApiPort())
            .build();
        server.start();

        DailySelectionScheduler scheduler =
            new DailySelectionScheduler(lexicon, store, new WeightedSampler(), announcer, clock);
        scheduler.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down...");
            scheduler.stop();
            server.stop();
        }));

        // Keep running until interrupted
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void handleRankCommand(String[] args) throws IOException {
        String lexiconFile = null;
        int limit = 50;
        boolean bottom = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--lexicon":
                case "-l":
                    lexiconFile = args[++i];
                    break;
                case "--limit":
                case "-n":
                    limit = Integer.parseInt(args[++i]);
                    break;
                case "--bottom":
                    bottom = true;
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (lexiconFile == null) {
            System.err.println("Error: --lexicon is required");
            System.err.println("Usage: java -jar starter-word.jar rank --lexicon <file> [--limit <n>] [--bottom]");
            return;
        }

        Lexicon lexicon = Lexicon.load(Paths.get(lexiconFile));
        List<LexiconEntry> ranked = bottom ? lexicon.bottom(limit) : lexicon.top(limit);

        System.out.println((bottom ? "Easiest " : "Hardest ") + ranked.size() + " of " + lexicon.size() + " words:");
        for (int i = 0; i < ranked.size(); i++) {
            LexiconEntry e = ranked.get(i);
            System.out.printf("%3d. %8.3f  %s%n", i + 1, e.score(), e.word());
        }
    }

    private static void handlePickCommand(String[] args) throws IOException {
        String lexiconFile = null;
        String stateFile = null;
        double alpha = WeightedSampler.DEFAULT_ALPHA;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--lexicon":
                case "-l":
                    lexiconFile = args[++i];
                    break;
                case "--state":
                case "-s":
                    stateFile = args[++i];
                    break;
                case "--alpha":
                    alpha = Double.parseDouble(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (lexiconFile == null) {
            System.err.println("Error: --lexicon is required");
            System.err.println("Usage: java -jar starter-word.jar pick --lexicon <file> [--state <file>] [--alpha <a>]");
            return;
        }

        Lexicon lexicon = Lexicon.load(Paths.get(lexiconFile));
        Set<String> used = Set.of();
        if (stateFile != null) {
            StateStore store = new StateStore(Paths.get(stateFile));
            store.load();
            used = store.withRead(s -> Set.copyOf(s.used()));
        }

        Optional<String> picked = new WeightedSampler().pickWeighted(lexicon, used, alpha);
        if (picked.isEmpty()) {
            System.out.println("No unused words left.");
            return;
        }
        String word = picked.get();
        System.out.printf("%s (score %.3f)%n", word, lexicon.score(word).orElse(Double.NaN));
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar starter-word.jar <command> [options]");
        System.out.println();
        System.out.println("Available commands:");
        System.out.println("  run    - Start the daily scheduler and the API server");
        System.out.println("  rank   - Print lexicon words ranked by difficulty score");
        System.out.println("  pick   - Draw one weighted word without recording it");
        System.out.println("  help   - Show this help message");
        System.out.println();
        System.out.println("Run command:");
        System.out.println("  java -jar starter-word.jar run [--config <file>]");
        System.out.println("    Without --config, TIMEZONE, DICT_PATH and STATE_PATH must be set.");
        System.out.println();
        System.out.println("Rank command:");
        System.out.println("  java -jar starter-word.jar rank --lexicon <file> [--limit <n>] [--bottom]");
        System.out.println();
        System.out.println("Pick command:");
        System.out.println("  java -jar starter-word.jar pick --lexicon <file> [--state <file>] [--alpha <a>]");
    }
}
