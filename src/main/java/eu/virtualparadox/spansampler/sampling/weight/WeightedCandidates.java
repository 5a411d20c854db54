package eu.virtualparadox.spansampler.sampling.weight;

import eu.virtualparadox.spansampler.sampling.candidate.Candidate;

import java.util.Arrays;
import java.util.List;

/**
 * Candidates paired with their overlap-corrected weights; {@code weight(i)} belongs to
 * {@code candidates().get(i)}.
 */
public final class WeightedCandidates {

    private final List<Candidate> candidates;
    private final double[] weights;

    public WeightedCandidates(final List<Candidate> candidates, final double[] weights) {
        this.candidates = List.copyOf(candidates);
        this.weights = weights.clone();

        if (this.candidates.size() != this.weights.length) {
            throw new IllegalStateException(
                    "Weights are not aligned with candidates: " + this.candidates.size()
                            + " candidates but " + this.weights.length + " weights"
            );
        }
        for (double weight : this.weights) {
            if (weight < 0 || Double.isNaN(weight)) {
                throw new IllegalStateException("Weights must be non-negative, got " + weight);
            }
        }
    }

    public static WeightedCandidates empty() {
        return new WeightedCandidates(List.of(), new double[0]);
    }

    public List<Candidate> candidates() {
        return candidates;
    }

    public double[] weights() {
        return weights.clone();
    }

    public double weight(final int index) {
        return weights[index];
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public double totalWeight() {
        return Arrays.stream(weights).sum();
    }
}
