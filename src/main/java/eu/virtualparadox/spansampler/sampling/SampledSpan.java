package eu.virtualparadox.spansampler.sampling;

import eu.virtualparadox.spansampler.sampling.candidate.Candidate;
import eu.virtualparadox.spansampler.tree.Point;

import java.nio.charset.StandardCharsets;

/**
 * A sampled hole: the byte and (row, column) range of a selected {@link Candidate}.
 * <p>The candidate is kept for reference so callers can read metadata from the tree it came from.</p>
 *
 * @param startPos   inclusive start byte offset
 * @param endPos     exclusive end byte offset
 * @param startPoint start position
 * @param endPoint   exclusive end position
 * @param candidate  the selected node or node group
 */
public record SampledSpan(int startPos, int endPos, Point startPoint, Point endPoint, Candidate candidate) {

    public SampledSpan {
        if (startPos < 0 || startPos >= endPos) {
            throw new IllegalArgumentException(
                    "Sampled span must be non-empty, got [" + startPos + ", " + endPos + ")"
            );
        }
    }

    public static SampledSpan of(final Candidate candidate) {
        return new SampledSpan(candidate.startByte(), candidate.endByte(),
                candidate.startPoint(), candidate.endPoint(), candidate);
    }

    /**
     * Decodes the sampled bytes.
     *
     * @param source the source bytes the span points into
     * @return the UTF-8 text of the span
     */
    public String text(final byte[] source) {
        return new String(source, startPos, endPos - startPos, StandardCharsets.UTF_8);
    }
}
