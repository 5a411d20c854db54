package eu.virtualparadox.spansampler.sampling.weight;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Reduces a set of half-open {@link ByteSpan}s to the bytes they cover.
 *
 * <p>The result is the shortest sorted list of disjoint spans covering exactly the same bytes.
 * Since the spans are half-open, {@code [0, 4)} and {@code [4, 6)} leave no uncovered byte between
 * them and come out as {@code [0, 6)}, while {@code [0, 4)} and {@code [5, 6)} stay apart.</p>
 *
 * <p>Empty spans cover nothing on their own; they only disappear into a run that already
 * reaches their offset.</p>
 *
 * Example:
 * <pre>
 *   [0, 4), [2, 6), [6, 9), [12, 15)  ->  [0, 9), [12, 15)
 * </pre>
 */
@Component
public class ByteSpanMerger {

    /**
     * @param spans spans to merge; may be {@code null} or empty
     * @return covered byte runs in ascending order (never {@code null})
     * @throws IllegalArgumentException if a span starts after it ends
     * @throws NullPointerException     if the list contains {@code null}
     */
    public List<ByteSpan> merge(final List<ByteSpan> spans) {
        final List<ByteSpan> merged = new ArrayList<>();
        if (spans == null || spans.isEmpty()) {
            return merged;
        }

        final List<ByteSpan> byStart = new ArrayList<>(spans);
        for (ByteSpan span : byStart) {
            Objects.requireNonNull(span, "span must not be null");
            if (span.start() > span.end()) {
                throw new IllegalArgumentException("Span " + span.asString() + " starts after it ends");
            }
        }
        byStart.sort(Comparator.comparingInt(ByteSpan::start));

        int runStart = byStart.get(0).start();
        int runEnd = byStart.get(0).end();
        for (ByteSpan span : byStart.subList(1, byStart.size())) {
            if (span.start() > runEnd) {
                // a gap of at least one byte closes the run
                merged.add(new ByteSpan(runStart, runEnd));
                runStart = span.start();
            }
            runEnd = Math.max(runEnd, span.end());
        }
        merged.add(new ByteSpan(runStart, runEnd));
        return merged;
    }
}
