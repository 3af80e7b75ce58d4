package pl.marcinmilkowski.starter_word.lexicon;

/**
 * A single lexicon word with its precomputed difficulty score.
 *
 * Sorted by score descending (harder words first), ties broken by word ascending.
 */
public record LexiconEntry(
    String word,     // Exactly five lowercase ASCII letters
    double score     // Difficulty score, higher = rarer/harder
) implements Comparable<LexiconEntry> {

    @Override
    public int compareTo(LexiconEntry other) {
        int byScore = Double.compare(other.score, this.score);
        return byScore != 0 ? byScore : this.word.compareTo(other.word);
    }

    /**
     * Format for display.
     */
    @Override
    public String toString() {
        return String.format("%s score=%.3f", word, score);
    }
}
