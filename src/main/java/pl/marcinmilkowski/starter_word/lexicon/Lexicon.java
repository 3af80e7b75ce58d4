package pl.marcinmilkowski.starter_word.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable set of candidate words with precomputed difficulty scores.
 *
 * Built once at startup from a plain-text word list (one token per line, any case
 * or surrounding whitespace). Only tokens of exactly five ASCII letters survive.
 * Corpus statistics are computed over the filtered set before any word is scored,
 * so every score sees the same statistics.
 *
 * Safe to share between threads without synchronization.
 */
public final class Lexicon {

    private static final Logger logger = LoggerFactory.getLogger(Lexicon.class);

    public static final int WORD_LENGTH = 5;

    private static final Pattern WORD_PATTERN = Pattern.compile("[a-z]{5}");

    private final Map<String, Double> scores;
    private final CorpusStats stats;

    // Package-private so test fixtures can supply scores directly.
    Lexicon(Map<String, Double> scores, CorpusStats stats) {
        this.scores = Collections.unmodifiableMap(scores);
        this.stats = stats;
    }

    /**
     * Load and score a word list from disk.
     *
     * @param path Path to the word list
     * @throws LexiconLoadException if the file is missing or unreadable
     */
    public static Lexicon load(Path path) throws LexiconLoadException {
        if (!Files.isRegularFile(path)) {
            throw new LexiconLoadException("Lexicon file not found: " + path);
        }
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LexiconLoadException("Failed to read lexicon " + path + ": " + e.getMessage(), e);
        }
        Lexicon lexicon = parse(content);
        logger.info("Loaded lexicon: {} words from {}", lexicon.size(), path);
        return lexicon;
    }

    /**
     * Build a lexicon from source text with the default weights.
     */
    public static Lexicon parse(String sourceText) {
        return parse(sourceText, ScoreWeights.DEFAULTS);
    }

    /**
     * Build a lexicon from source text.
     *
     * @param sourceText one candidate per line
     * @param weights feature weights used for scoring
     */
    public static Lexicon parse(String sourceText, ScoreWeights weights) {
        Set<String> words = sourceText.lines()
            .map(Lexicon::normalize)
            .filter(Lexicon::isWellFormed)
            .collect(Collectors.toCollection(LinkedHashSet::new));

        CorpusStats stats = CorpusStats.compute(words);
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String w : words) {
            scores.put(w, DifficultyScorer.score(w, stats, weights));
        }
        return new Lexicon(scores, stats);
    }

    /**
     * Trim and lowercase a raw token. Returns the empty string for null.
     */
    public static String normalize(String token) {
        return token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Check that a token is exactly five lowercase ASCII letters.
     */
    public static boolean isWellFormed(String token) {
        return token != null && WORD_PATTERN.matcher(token).matches();
    }

    public boolean contains(String word) {
        return word != null && scores.containsKey(word);
    }

    /**
     * Score of a word, empty if it is not in the lexicon.
     */
    public OptionalDouble score(String word) {
        Double s = word != null ? scores.get(word) : null;
        return s != null ? OptionalDouble.of(s) : OptionalDouble.empty();
    }

    /**
     * All words with their scores, in source order.
     */
    public Map<String, Double> scores() {
        return scores;
    }

    public CorpusStats stats() {
        return stats;
    }

    public int size() {
        return scores.size();
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    /**
     * Highest-scoring words first, ties by word ascending.
     */
    public List<LexiconEntry> top(int limit) {
        return entries().stream()
            .sorted()
            .limit(Math.max(limit, 0))
            .collect(Collectors.toList());
    }

    /**
     * Lowest-scoring words first, ties by word ascending.
     */
    public List<LexiconEntry> bottom(int limit) {
        return entries().stream()
            .sorted(Comparator.comparingDouble(LexiconEntry::score).thenComparing(LexiconEntry::word))
            .limit(Math.max(limit, 0))
            .collect(Collectors.toList());
    }

    private List<LexiconEntry> entries() {
        List<LexiconEntry> entries = new ArrayList<>(scores.size());
        scores.forEach((w, s) -> entries.add(new LexiconEntry(w, s)));
        return entries;
    }
}
