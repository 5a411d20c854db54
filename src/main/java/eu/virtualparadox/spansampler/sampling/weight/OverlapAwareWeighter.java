package eu.virtualparadox.spansampler.sampling.weight;

import eu.virtualparadox.spansampler.sampling.candidate.Candidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns each candidate a weight proportional to its non-whitespace characters, corrected
 * for overlap with other candidates.
 *
 * <h2>Overview</h2>
 * Candidates overlap: in {@code (a + b) + c} the span {@code a + b} is a candidate on its own
 * and also part of the outer expression. Weighting each candidate by its own length would count
 * the shared characters twice and favour deeply nested expressions. Instead:
 * <ol>
 *   <li>All candidate boundaries split the source into elementary intervals, each tagged with the
 *       set of candidates covering it. Neighbouring intervals with the same covering set are merged.</li>
 *   <li>Each interval contributes {@code nonWhitespaceChars / coveringCount} to every covering
 *       candidate.</li>
 * </ol>
 * The weights therefore add up to the number of non-whitespace characters in the union of all
 * candidate spans, so every such character is equally likely to be picked.
 *
 * <p>Characters are Unicode code points of the UTF-8 decoded bytes. Whitespace is the Unicode
 * {@code \s} class.</p>
 *
 * <p>Candidates are tracked by their index in the input list, never by equality, so two
 * candidates sharing a byte range are weighted independently.</p>
 */
@Component
@Slf4j
public class OverlapAwareWeighter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Computes overlap-aware weights.
     *
     * @param candidates candidates to weigh, in any order
     * @param source     bytes of the source file the candidates point into
     * @return the candidates, in input order, with aligned weights
     * @throws IllegalArgumentException if a candidate range is inverted or lies outside {@code source}
     */
    public WeightedCandidates weigh(final List<Candidate> candidates, final byte[] source) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        Objects.requireNonNull(source, "source must not be null");

        if (candidates.isEmpty()) {
            return WeightedCandidates.empty();
        }
        validateRanges(candidates, source.length);

        final List<ElementaryInterval> intervals = partition(candidates);
        final double[] weights = new double[candidates.size()];

        for (final ElementaryInterval interval : intervals) {
            final String text = new String(source, interval.start(), interval.end() - interval.start(),
                    StandardCharsets.UTF_8);
            final double contribution = (double) countNonWhitespace(text) / interval.covering().cardinality();

            final BitSet covering = interval.covering();
            for (int i = covering.nextSetBit(0); i >= 0; i = covering.nextSetBit(i + 1)) {
                weights[i] += contribution;
            }
        }

        final WeightedCandidates result = new WeightedCandidates(candidates, weights);
        log.debug("Weighted {} candidates over {} elementary intervals, total weight {}",
                candidates.size(), intervals.size(), result.totalWeight());
        return result;
    }

    /**
     * Splits the candidate spans into disjoint elementary intervals with their covering sets.
     * Adjacent intervals with identical covering sets are merged. Uncovered gaps are omitted.
     *
     * @param candidates candidates with validated ranges
     * @return intervals sorted by start
     */
    List<ElementaryInterval> partition(final List<Candidate> candidates) {
        final TreeSet<Integer> boundaries = new TreeSet<>();
        final Map<Integer, List<Integer>> startingAt = new HashMap<>();
        final Map<Integer, List<Integer>> endingAt = new HashMap<>();

        for (int i = 0; i < candidates.size(); i++) {
            final Candidate candidate = candidates.get(i);
            boundaries.add(candidate.startByte());
            boundaries.add(candidate.endByte());
            startingAt.computeIfAbsent(candidate.startByte(), k -> new ArrayList<>()).add(i);
            endingAt.computeIfAbsent(candidate.endByte(), k -> new ArrayList<>()).add(i);
        }

        final List<ElementaryInterval> intervals = new ArrayList<>();
        final BitSet active = new BitSet(candidates.size());
        Integer position = boundaries.first();

        while (position != null) {
            // Add before removing so empty candidates never stay active
            for (int index : startingAt.getOrDefault(position, List.of())) {
                active.set(index);
            }
            for (int index : endingAt.getOrDefault(position, List.of())) {
                active.clear(index);
            }

            final Integer next = boundaries.higher(position);
            if (next != null && !active.isEmpty()) {
                appendOrMerge(intervals, new ElementaryInterval(position, next, (BitSet) active.clone()));
            }
            position = next;
        }

        return intervals;
    }

    private static void appendOrMerge(final List<ElementaryInterval> intervals, final ElementaryInterval interval) {
        if (!intervals.isEmpty()) {
            final ElementaryInterval previous = intervals.get(intervals.size() - 1);
            if (previous.end() == interval.start() && previous.covering().equals(interval.covering())) {
                intervals.set(intervals.size() - 1,
                        new ElementaryInterval(previous.start(), interval.end(), previous.covering()));
                return;
            }
        }
        intervals.add(interval);
    }

    private static void validateRanges(final List<Candidate> candidates, final int sourceLength) {
        for (final Candidate candidate : candidates) {
            Objects.requireNonNull(candidate, "candidates must not contain null elements");
            if (candidate.startByte() < 0 || candidate.startByte() > candidate.endByte()) {
                throw new IllegalArgumentException("Invalid candidate range [" + candidate.startByte()
                        + ", " + candidate.endByte() + ") for " + candidate.type());
            }
            if (candidate.endByte() > sourceLength) {
                throw new IllegalArgumentException("Candidate " + candidate.type() + " ends at byte "
                        + candidate.endByte() + " past the source length " + sourceLength);
            }
        }
    }

    /**
     * Counts the code points of {@code text} that are not whitespace.
     */
    static int countNonWhitespace(final String text) {
        int whitespace = 0;
        final Matcher matcher = WHITESPACE.matcher(text);
        while (matcher.find()) {
            whitespace += text.codePointCount(matcher.start(), matcher.end());
        }
        return text.codePointCount(0, text.length()) - whitespace;
    }
}
