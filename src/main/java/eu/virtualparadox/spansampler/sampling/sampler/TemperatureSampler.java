package eu.virtualparadox.spansampler.sampling.sampler;

import eu.virtualparadox.spansampler.sampling.candidate.Candidate;
import eu.virtualparadox.spansampler.sampling.weight.WeightedCandidates;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Draws candidates with probability proportional to {@code weight^(1/temperature)}.
 *
 * <h2>Temperature</h2>
 * <ul>
 *   <li>{@code temperature -> 0+}: the distribution concentrates on the heaviest candidates.</li>
 *   <li>{@code temperature == 0}: deterministic arg-max; only the candidates of maximal weight can be
 *       drawn, uniformly among ties. Temperatures so small that {@code 1/temperature} overflows
 *       behave the same way.</li>
 *   <li>{@code temperature -> +inf}: uniform over all candidates of positive weight.</li>
 * </ul>
 * Weights are divided by the maximal weight before exponentiation. After normalization this gives
 * the same distribution and it cannot overflow for small temperatures.
 *
 * <h2>Replacement</h2>
 * With replacement exactly {@code numSamples} independent draws are made. Without replacement at most
 * {@code min(numSamples, candidates)} distinct candidates are returned; zero-probability candidates are
 * never drawn, so fewer come back once the positive mass is used up.
 *
 * <p>The sampler keeps no state between calls; all randomness comes from the supplied {@link Random}.</p>
 */
@Component
public class TemperatureSampler {

    /**
     * Samples from {@code weighted}.
     *
     * @param weighted        candidates and their weights
     * @param temperature     non-negative sampling temperature
     * @param numSamples      number of samples requested ({@code > 0})
     * @param withReplacement whether a candidate may be drawn more than once
     * @param random          source of randomness
     * @return drawn candidates, in draw order
     * @throws IllegalArgumentException if {@code temperature} is negative or NaN, or {@code numSamples <= 0}
     * @throws IllegalStateException    if every candidate has zero weight
     */
    public List<Candidate> sample(final WeightedCandidates weighted,
                                  final double temperature,
                                  final int numSamples,
                                  final boolean withReplacement,
                                  final Random random) {
        Objects.requireNonNull(weighted, "weighted must not be null");
        Objects.requireNonNull(random, "random must not be null");
        if (temperature < 0 || Double.isNaN(temperature)) {
            throw new IllegalArgumentException("Temperature must be non-negative, got " + temperature);
        }
        if (numSamples <= 0) {
            throw new IllegalArgumentException("numSamples must be positive, got " + numSamples);
        }

        if (weighted.isEmpty()) {
            return new ArrayList<>();
        }

        final double[] adjusted = adjustedWeights(weighted.weights(), temperature);
        final List<Candidate> candidates = weighted.candidates();
        final List<Candidate> selected = new ArrayList<>();

        if (withReplacement) {
            final double total = sum(adjusted);
            for (int k = 0; k < numSamples; k++) {
                selected.add(candidates.get(draw(adjusted, total, random)));
            }
            return selected;
        }

        final int draws = Math.min(numSamples, candidates.size());
        for (int k = 0; k < draws; k++) {
            final double total = sum(adjusted);
            if (total <= 0) {
                break;
            }
            final int index = draw(adjusted, total, random);
            selected.add(candidates.get(index));
            adjusted[index] = 0;
        }
        return selected;
    }

    /**
     * Applies the temperature to {@code weights}. The result is unnormalized; its maximum is 1.
     *
     * @param weights     non-negative weights
     * @param temperature non-negative temperature
     * @return adjusted weights
     * @throws IllegalStateException if all weights are zero
     */
    double[] adjustedWeights(final double[] weights, final double temperature) {
        double max = 0;
        for (double weight : weights) {
            max = Math.max(max, weight);
        }
        if (max <= 0) {
            throw new IllegalStateException("Cannot sample: all " + weights.length + " candidates have zero weight");
        }

        // Subnormal temperatures overflow the exponent; treat them like zero
        final double exponent = 1 / temperature;
        final boolean argMax = Double.isInfinite(exponent);

        final double[] adjusted = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] <= 0) {
                adjusted[i] = 0;
            } else if (argMax) {
                adjusted[i] = weights[i] == max ? 1 : 0;
            } else {
                adjusted[i] = Math.pow(weights[i] / max, exponent);
            }
        }
        return adjusted;
    }

    /**
     * Picks an index with probability {@code adjusted[i] / total} by walking the cumulative sum.
     */
    private static int draw(final double[] adjusted, final double total, final Random random) {
        final double target = random.nextDouble() * total;
        double cumulative = 0;
        int lastPositive = -1;

        for (int i = 0; i < adjusted.length; i++) {
            if (adjusted[i] <= 0) {
                continue;
            }
            cumulative += adjusted[i];
            lastPositive = i;
            if (target < cumulative) {
                return i;
            }
        }

        // Rounding can leave target just above the final cumulative sum
        return lastPositive;
    }

    private static double sum(final double[] values) {
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total;
    }
}
