package eu.virtualparadox.spansampler.sampling;

/**
 * Per-call sampling parameters. Validated on construction.
 *
 * @param minBytesLength        exclusive lower bound on the byte length of a sample
 * @param maxBytesLength        inclusive upper bound on the byte length of a sample
 * @param numSamples            how many spans to sample
 * @param sampleWithReplacement whether the same candidate may be sampled twice
 * @param temperature           non-negative temperature; lower values favour longer spans
 */
public record SamplingParameters(int minBytesLength,
                                 int maxBytesLength,
                                 int numSamples,
                                 boolean sampleWithReplacement,
                                 double temperature) {

    public SamplingParameters {
        if (temperature < 0 || Double.isNaN(temperature)) {
            throw new IllegalArgumentException("Temperature must be non-negative, got " + temperature);
        }
        if (numSamples <= 0) {
            throw new IllegalArgumentException("numSamples must be positive, got " + numSamples);
        }
        if (minBytesLength < 0) {
            throw new IllegalArgumentException("minBytesLength must be non-negative, got " + minBytesLength);
        }
        if (maxBytesLength <= minBytesLength) {
            throw new IllegalArgumentException("maxBytesLength (" + maxBytesLength
                    + ") must be greater than minBytesLength (" + minBytesLength + ")");
        }
    }

    public SamplingParameters withNumSamples(final int samples) {
        return new SamplingParameters(minBytesLength, maxBytesLength, samples, sampleWithReplacement, temperature);
    }

    public SamplingParameters withTemperature(final double value) {
        return new SamplingParameters(minBytesLength, maxBytesLength, numSamples, sampleWithReplacement, value);
    }
}
