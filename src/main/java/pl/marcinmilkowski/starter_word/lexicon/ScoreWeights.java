package pl.marcinmilkowski.starter_word.lexicon;

/**
 * Fixed weights of the difficulty score features.
 */
public record ScoreWeights(
    // corpus
    double rareLetter,       // ln(1/freq) per letter
    double rareBoost,        // extra for jqxzkvwy per letter, inside the rare-letter sum
    double rareBigram,       // ln(1/freq) per adjacent bigram

    // word-local features
    double noVowelsOrY,      // no aeiouy at all
    double noVowels,         // y present but no aeiou
    double lowVowelRatio,    // aeiou fraction below 0.2
    double adjacentDouble,   // per adjacent doubled letter
    double consonantCluster, // longest consonant run, y counts as vowel
    double duplicateExtra,   // per extra occurrence of a repeated letter
    double lowUnique,        // per missing unique letter (5 - unique)
    double ababa,            // ABABA shape
    double repeatedBigram,   // per bigram seen twice inside the word
    double qWithoutU
) {

    public static final ScoreWeights DEFAULTS = new ScoreWeights(
        0.35, 0.25, 0.20,
        9.0, 5.0, 2.0,
        1.0, 1.0, 1.6, 0.7, 3.0, 1.2, 2.0
    );
}
