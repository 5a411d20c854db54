package eu.virtualparadox.spansampler.sampling.sampler;

import eu.virtualparadox.spansampler.sampling.candidate.Candidate;
import eu.virtualparadox.spansampler.sampling.weight.WeightedCandidates;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static eu.virtualparadox.spansampler.tree.FixtureNode.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TemperatureSamplerTest {

    private static final int DRAWS = 20_000;

    private final TemperatureSampler sampler = new TemperatureSampler();

    @Test
    @DisplayName("Lower temperatures favour the heaviest candidate")
    void lowerTemperatureConcentratesMass() {
        final WeightedCandidates weighted = weighted(1, 2, 10);
        final double[] temperatures = {4, 1, 0.5, 0.25};

        double previous = 0;
        for (double temperature : temperatures) {
            final double frequency = frequencies(weighted, temperature, new Random(42))[2];
            assertThat(frequency).isGreaterThan(previous);
            previous = frequency;
        }
        assertThat(previous).isGreaterThan(0.99);
    }

    @Test
    @DisplayName("At temperature 1 draws follow the weights")
    void unitTemperatureIsProportional() {
        final double[] frequencies = frequencies(weighted(1, 2, 10), 1, new Random(7));

        assertEquals(1.0 / 13, frequencies[0], 0.02);
        assertEquals(2.0 / 13, frequencies[1], 0.02);
        assertEquals(10.0 / 13, frequencies[2], 0.02);
    }

    @Test
    @DisplayName("Infinite temperature is uniform over positive weights")
    void infiniteTemperatureIsUniform() {
        final double[] frequencies = frequencies(weighted(1, 2, 10, 0), Double.POSITIVE_INFINITY, new Random(3));

        assertEquals(1.0 / 3, frequencies[0], 0.02);
        assertEquals(1.0 / 3, frequencies[1], 0.02);
        assertEquals(1.0 / 3, frequencies[2], 0.02);
        assertEquals(0.0, frequencies[3]);
    }

    @Test
    @DisplayName("Temperature 0 only draws maximal weights, uniformly among ties")
    void zeroTemperatureIsArgMax() {
        final WeightedCandidates weighted = weighted(5, 1, 5);

        final List<Candidate> drawn = sampler.sample(weighted, 0, 200, true, new Random(11));

        assertEquals(200, drawn.size());
        assertThat(drawn).doesNotContain(weighted.candidates().get(1));
        assertThat(drawn).contains(weighted.candidates().get(0), weighted.candidates().get(2));
    }

    @Test
    @DisplayName("Temperatures too small to invert behave like temperature 0")
    void subnormalTemperatureIsArgMax() {
        final WeightedCandidates weighted = weighted(5, 1, 5);

        final double[] adjusted = sampler.adjustedWeights(weighted.weights(), Double.MIN_VALUE);
        final List<Candidate> drawn = sampler.sample(weighted, Double.MIN_VALUE, 200, true, new Random(11));

        assertArrayEquals(new double[]{1, 0, 1}, adjusted);
        assertThat(drawn).doesNotContain(weighted.candidates().get(1));
        assertThat(drawn).contains(weighted.candidates().get(0), weighted.candidates().get(2));
    }

    @Test
    @DisplayName("With replacement returns exactly the requested number of draws")
    void withReplacement() {
        final List<Candidate> drawn = sampler.sample(weighted(1, 2, 3), 1, 10, true, new Random(1));

        assertEquals(10, drawn.size());
    }

    @Test
    @DisplayName("Without replacement returns distinct candidates, at most one per candidate")
    void withoutReplacement() {
        final WeightedCandidates weighted = weighted(1, 2, 3);

        final List<Candidate> drawn = sampler.sample(weighted, 1, 10, false, new Random(1));

        assertEquals(3, drawn.size());
        assertEquals(3, new HashSet<>(drawn).size());
        assertThat(drawn).containsExactlyInAnyOrderElementsOf(weighted.candidates());
    }

    @Test
    @DisplayName("Zero-weight candidates are never drawn")
    void zeroWeightsAreSkipped() {
        final WeightedCandidates weighted = weighted(0, 3, 0, 1);

        final List<Candidate> drawn = sampler.sample(weighted, 0.5, 4, false, new Random(5));

        assertThat(drawn).containsExactlyInAnyOrder(weighted.candidates().get(1), weighted.candidates().get(3));
    }

    @Test
    @DisplayName("The same seed gives the same draws")
    void reproducible() {
        final WeightedCandidates weighted = weighted(3, 1, 4, 1, 5, 9, 2, 6);

        final List<Candidate> first = sampler.sample(weighted, 0.8, 5, false, new Random(2024));
        final List<Candidate> second = sampler.sample(weighted, 0.8, 5, false, new Random(2024));

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Small temperatures do not overflow")
    void smallTemperature() {
        final double[] adjusted = sampler.adjustedWeights(new double[]{1_000_000, 500_000, 0}, 0.01);

        assertEquals(1.0, adjusted[0]);
        assertThat(adjusted[1]).isGreaterThan(0).isLessThan(1e-20);
        assertEquals(0.0, adjusted[2]);
    }

    @Test
    @DisplayName("Empty input yields no draws")
    void emptyInput() {
        assertTrue(sampler.sample(WeightedCandidates.empty(), 1, 3, false, new Random()).isEmpty());
    }

    @Test
    @DisplayName("Invalid arguments are rejected")
    void invalidArguments() {
        final WeightedCandidates weighted = weighted(1, 2);

        assertThrows(IllegalArgumentException.class, () -> sampler.sample(weighted, -0.1, 1, false, new Random()));
        assertThrows(IllegalArgumentException.class, () -> sampler.sample(weighted, Double.NaN, 1, false, new Random()));
        assertThrows(IllegalArgumentException.class, () -> sampler.sample(weighted, 1, 0, false, new Random()));
        assertThrows(IllegalStateException.class, () -> sampler.sample(weighted(0, 0), 1, 1, false, new Random()));
    }

    private double[] frequencies(final WeightedCandidates weighted, final double temperature, final Random random) {
        final List<Candidate> drawn = sampler.sample(weighted, temperature, DRAWS, true, random);
        final double[] frequencies = new double[weighted.size()];
        for (Candidate candidate : drawn) {
            frequencies[weighted.candidates().indexOf(candidate)] += 1.0 / DRAWS;
        }
        return frequencies;
    }

    private static WeightedCandidates weighted(final double... weights) {
        final List<Candidate> candidates = new ArrayList<>(weights.length);
        for (int i = 0; i < weights.length; i++) {
            candidates.add(node("c" + i, i, i + 1));
        }
        return new WeightedCandidates(candidates, weights);
    }
}
