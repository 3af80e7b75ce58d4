package pl.marcinmilkowski.starter_word.lexicon;

import java.util.HashSet;
import java.util.Set;

/**
 * Deterministic difficulty score for a five-letter word.
 *
 * The score is a linear combination of corpus rarity (letters and bigrams,
 * measured as {@code ln(1/freq)}) and word-shape features such as missing vowels,
 * repeated letters and consonant clusters. Same word, stats and weights always
 * give the same value.
 */
public final class DifficultyScorer {

    /** Floor for relative frequencies so the logarithm stays finite. */
    static final double EPSILON = 1e-6;

    private static final String RARE_LETTERS = "jqxzkvwy";

    private DifficultyScorer() {
    }

    /**
     * Score a word against the corpus statistics.
     *
     * @param word five lowercase ASCII letters
     * @param stats corpus statistics of the lexicon
     * @param weights feature weights
     * @return a finite score, higher means harder
     * @throws IllegalArgumentException if the word is not five letters a-z
     */
    public static double score(String word, CorpusStats stats, ScoreWeights weights) {
        if (!Lexicon.isWellFormed(word)) {
            throw new IllegalArgumentException("Not a five-letter lowercase word: " + word);
        }
        char[] b = word.toCharArray();

        boolean hasVowel = false;
        boolean hasVowelOrY = false;
        int vowels = 0;
        for (char c : b) {
            if (isTrueVowel(c)) {
                hasVowel = true;
                hasVowelOrY = true;
                vowels++;
            } else if (c == 'y') {
                hasVowelOrY = true;
            }
        }
        double vowelRatio = vowels / (double) Lexicon.WORD_LENGTH;

        int[] counts = new int[26];
        for (char c : b) {
            counts[c - 'a']++;
        }
        int unique = 0;
        int duplicates = 0;
        for (int k : counts) {
            if (k > 0) {
                unique++;
                duplicates += k - 1;
            }
        }

        int adjacentDoubles = 0;
        for (int i = 0; i < b.length - 1; i++) {
            if (b[i] == b[i + 1]) adjacentDoubles++;
        }

        int longestCluster = 0;
        int run = 0;
        for (char c : b) {
            if (isTrueVowel(c) || c == 'y') {
                run = 0;
            } else {
                run++;
                longestCluster = Math.max(longestCluster, run);
            }
        }

        boolean ababa = b[0] == b[2] && b[2] == b[4] && b[0] != b[1] && b[1] == b[3];

        Set<String> seenBigrams = new HashSet<>();
        int repeatedBigrams = 0;
        for (int i = 0; i < b.length - 1; i++) {
            if (!seenBigrams.add(word.substring(i, i + 2))) repeatedBigrams++;
        }

        boolean qWithoutU = word.indexOf('q') >= 0 && word.indexOf('u') < 0;

        double rareLetterScore = 0.0;
        for (char c : b) {
            double f = frequency(stats.letterCount(c), stats.totalLetters());
            rareLetterScore += Math.log(1.0 / f);
            if (RARE_LETTERS.indexOf(c) >= 0) {
                rareLetterScore += weights.rareBoost();
            }
        }
        double rareBigramScore = 0.0;
        for (int i = 0; i < b.length - 1; i++) {
            double f = frequency(stats.bigramCount(b[i], b[i + 1]), stats.totalBigrams());
            rareBigramScore += Math.log(1.0 / f);
        }

        double score = 0.0;
        if (!hasVowelOrY) {
            score += weights.noVowelsOrY();
        } else if (!hasVowel) {
            score += weights.noVowels();
        }
        if (vowelRatio < 0.2) {
            score += weights.lowVowelRatio();
        }
        score += weights.rareLetter() * rareLetterScore;
        score += weights.rareBigram() * rareBigramScore;
        score += weights.adjacentDouble() * adjacentDoubles;
        score += weights.consonantCluster() * longestCluster;
        score += weights.duplicateExtra() * duplicates;
        score += weights.lowUnique() * Math.max(Lexicon.WORD_LENGTH - unique, 0);
        score += weights.ababa() * (ababa ? 1 : 0);
        score += weights.repeatedBigram() * repeatedBigrams;
        score += weights.qWithoutU() * (qWithoutU ? 1 : 0);
        return score;
    }

    private static boolean isTrueVowel(char c) {
        return c == 'a' || c == 'e' || c == 'i' || c == 'o' || c == 'u';
    }

    // Unseen letters and bigrams count once; result is clamped to [EPSILON, 1].
    private static double frequency(int count, double total) {
        if (total <= 0) return EPSILON;
        double f = Math.max(count, 1) / total;
        return Math.min(Math.max(f, EPSILON), 1.0);
    }
}
