package eu.virtualparadox.spansampler.sampling.weight;

/**
 * Half-open byte range {@code [start, end)} into a source buffer.
 *
 * @param start inclusive start offset
 * @param end   exclusive end offset
 */
public record ByteSpan(int start, int end) {

    public int length() {
        return end - start;
    }

    public String asString() {
        return "[" + start + ", " + end + ")";
    }
}
