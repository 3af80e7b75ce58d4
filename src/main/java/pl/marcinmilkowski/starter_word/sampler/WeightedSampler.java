package pl.marcinmilkowski.starter_word.sampler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.starter_word.lexicon.Lexicon;

import java.security.SecureRandom;
import java.util.*;
import java.util.random.RandomGenerator;

/**
 * Draws a single lexicon word with probability proportional to a transformed score.
 *
 * Candidate weight: {@code (max(score, 0) + 1e-6) ^ alpha}. Larger {@code alpha}
 * sharpens the preference for high-scoring (rare, unusual) words. Non-finite or
 * non-positive weights are discarded.
 *
 * The random source is injected; the default is a {@link SecureRandom}.
 */
public class WeightedSampler {

    private static final Logger logger = LoggerFactory.getLogger(WeightedSampler.class);

    public static final double DEFAULT_ALPHA = 2.0;

    private static final double EPSILON = 1e-6;

    private final RandomGenerator random;

    public WeightedSampler() {
        this(new SecureRandom());
    }

    public WeightedSampler(RandomGenerator random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Draw one word that is not in {@code exclude}.
     *
     * @param lexicon scored words
     * @param exclude words that must not be returned, may be empty
     * @param alpha exponent applied to the shifted score
     * @return the drawn word, or empty if no candidate has a positive finite weight
     */
    public Optional<String> pickWeighted(Lexicon lexicon, Set<String> exclude, double alpha) {
        Map<String, Double> scores = lexicon.scores();
        List<String> keys = new ArrayList<>(scores.size());
        double[] weights = new double[scores.size()];
        double max = 0.0;

        for (Map.Entry<String, Double> e : scores.entrySet()) {
            if (exclude.contains(e.getKey())) {
                continue;
            }
            double weight = Math.pow(Math.max(e.getValue(), 0.0) + EPSILON, alpha);
            if (!Double.isFinite(weight) || weight <= 0.0) {
                continue;
            }
            weights[keys.size()] = weight;
            keys.add(e.getKey());
            max = Math.max(max, weight);
        }

        if (keys.isEmpty()) {
            logger.debug("No weighted candidates left ({} excluded of {})", exclude.size(), scores.size());
            return Optional.empty();
        }

        // Scaled by the largest weight, the running sum stays within [1, n]
        double[] cumulative = new double[keys.size()];
        double total = 0.0;
        for (int i = 0; i < keys.size(); i++) {
            total += weights[i] / max;
            cumulative[i] = total;
        }

        double target = random.nextDouble() * total;
        int idx = Arrays.binarySearch(cumulative, 0, keys.size(), target);
        // binarySearch gives -(insertion point) - 1 on a miss; an exact hit belongs to the next bucket
        idx = idx < 0 ? -idx - 1 : idx + 1;
        return Optional.of(keys.get(Math.min(idx, keys.size() - 1)));
    }

    public Optional<String> pickWeighted(Lexicon lexicon, Set<String> exclude) {
        return pickWeighted(lexicon, exclude, DEFAULT_ALPHA);
    }
}
