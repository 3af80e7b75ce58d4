package pl.marcinmilkowski.starter_word.lexicon;

import java.util.Collection;

/**
 * Letter and adjacent-bigram frequency counts over the whole lexicon.
 *
 * Every word contributes 5 letters and 4 bigrams, so the totals are simply
 * {@code words * 5} and {@code words * 4}. Instances are immutable once computed.
 */
public final class CorpusStats {

    private static final int ALPHABET = 26;

    private final int[] letterCounts;
    private final int[] bigramCounts;
    private final int wordCount;

    private CorpusStats(int[] letterCounts, int[] bigramCounts, int wordCount) {
        this.letterCounts = letterCounts;
        this.bigramCounts = bigramCounts;
        this.wordCount = wordCount;
    }

    /**
     * Count letters and bigrams over a collection of already-normalized words.
     *
     * @param words five-letter lowercase words
     */
    public static CorpusStats compute(Collection<String> words) {
        int[] letters = new int[ALPHABET];
        int[] bigrams = new int[ALPHABET * ALPHABET];
        for (String w : words) {
            for (int i = 0; i < Lexicon.WORD_LENGTH; i++) {
                letters[w.charAt(i) - 'a']++;
            }
            for (int i = 0; i < Lexicon.WORD_LENGTH - 1; i++) {
                bigrams[bigramIndex(w.charAt(i), w.charAt(i + 1))]++;
            }
        }
        return new CorpusStats(letters, bigrams, words.size());
    }

    /**
     * Occurrences of a letter across the corpus, 0 if unseen or not a-z.
     */
    public int letterCount(char c) {
        if (c < 'a' || c > 'z') return 0;
        return letterCounts[c - 'a'];
    }

    /**
     * Occurrences of the adjacent pair {@code (first, second)} across the corpus.
     */
    public int bigramCount(char first, char second) {
        if (first < 'a' || first > 'z' || second < 'a' || second > 'z') return 0;
        return bigramCounts[bigramIndex(first, second)];
    }

    public int wordCount() {
        return wordCount;
    }

    public double totalLetters() {
        return wordCount * (double) Lexicon.WORD_LENGTH;
    }

    public double totalBigrams() {
        return wordCount * (double) (Lexicon.WORD_LENGTH - 1);
    }

    private static int bigramIndex(char first, char second) {
        return (first - 'a') * ALPHABET + (second - 'a');
    }
}
