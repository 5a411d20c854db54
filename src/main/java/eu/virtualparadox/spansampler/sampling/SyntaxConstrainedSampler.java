package eu.virtualparadox.spansampler.sampling;

import eu.virtualparadox.spansampler.application.config.SamplerConfig;
import eu.virtualparadox.spansampler.policy.SamplingPolicy;
import eu.virtualparadox.spansampler.sampling.candidate.Candidate;
import eu.virtualparadox.spansampler.sampling.collector.EligibleNodeCollector;
import eu.virtualparadox.spansampler.sampling.sampler.TemperatureSampler;
import eu.virtualparadox.spansampler.sampling.weight.ByteSpan;
import eu.virtualparadox.spansampler.sampling.weight.ByteSpanMerger;
import eu.virtualparadox.spansampler.sampling.weight.OverlapAwareWeighter;
import eu.virtualparadox.spansampler.sampling.weight.WeightedCandidates;
import eu.virtualparadox.spansampler.tree.SyntaxTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Syntax-constrained span sampling.
 * <p>
 * Spans (syntax nodes or runs of sibling nodes) are sampled such that every non-whitespace
 * character covered by some candidate has the same chance of ending up in a sample. Lowering the
 * temperature biases the choice towards longer spans.
 * </p>
 * <ol>
 *   <li>{@link EligibleNodeCollector} gathers the candidates allowed by the {@link SamplingPolicy}.</li>
 *   <li>{@link OverlapAwareWeighter} weighs them by non-whitespace length, sharing overlapping characters.</li>
 *   <li>{@link TemperatureSampler} draws the requested number of candidates.</li>
 * </ol>
 *
 * <p>Each call works on local state only, so the service is safe to use from several threads on
 * independent trees. Reproducibility is controlled through the supplied {@link Random}.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyntaxConstrainedSampler {

    private static final int LOGGED_SPAN_CHARS = 80;

    private final EligibleNodeCollector collector;
    private final OverlapAwareWeighter weighter;
    private final TemperatureSampler temperatureSampler;
    private final ByteSpanMerger byteSpanMerger;
    private final SamplerConfig samplerConfig;

    /**
     * Samples with the configured default parameters.
     *
     * @param tree   parsed source
     * @param policy sampling rules
     * @param random source of randomness
     * @return sampled spans; empty if the tree has no eligible candidates. See
     *         {@link #sample(SyntaxTree, SamplingPolicy, SamplingParameters, Random)} for when fewer
     *         spans than requested come back.
     */
    public List<SampledSpan> sample(final SyntaxTree tree, final SamplingPolicy policy, final Random random) {
        return sample(tree, policy, samplerConfig.toParameters(), random);
    }

    /**
     * Samples spans from {@code tree}.
     *
     * @param tree       parsed source
     * @param policy     sampling rules
     * @param parameters length bounds, sample count, replacement policy and temperature
     * @param random     source of randomness
     * @return sampled spans in draw order; empty if the tree has no eligible candidates. Without
     *         replacement this can hold fewer than {@code min(numSamples, candidates)} spans:
     *         whitespace-only candidates have zero weight and are never drawn, so drawing stops
     *         once every candidate with non-whitespace text has been taken.
     * @throws IllegalStateException if all eligible candidates consist of whitespace only
     */
    public List<SampledSpan> sample(final SyntaxTree tree,
                                    final SamplingPolicy policy,
                                    final SamplingParameters parameters,
                                    final Random random) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        Objects.requireNonNull(random, "random must not be null");

        final List<Candidate> candidates = collector.collect(
                tree, policy, parameters.minBytesLength(), parameters.maxBytesLength());
        log.info("Found {} eligible candidates", candidates.size());
        if (candidates.isEmpty()) {
            return new ArrayList<>();
        }

        final byte[] source = tree.source();
        final WeightedCandidates weighted = weighter.weigh(candidates, source);
        final List<Candidate> selected = temperatureSampler.sample(
                weighted,
                parameters.temperature(),
                parameters.numSamples(),
                parameters.sampleWithReplacement(),
                random
        );

        final List<SampledSpan> spans = new ArrayList<>(selected.size());
        for (final Candidate candidate : selected) {
            final SampledSpan span = SampledSpan.of(candidate);
            if (span.endPos() > source.length) {
                throw new IllegalStateException("Sampled span " + span.startPos() + ".." + span.endPos()
                        + " exceeds the source length " + source.length);
            }
            if (log.isDebugEnabled()) {
                log.debug("Sampled {} {}-{}: {}", candidate.type(), span.startPoint().asString(),
                        span.endPoint().asString(), StringUtils.abbreviate(span.text(source), LOGGED_SPAN_CHARS));
            }
            spans.add(span);
        }
        return spans;
    }

    /**
     * Computes which bytes of {@code tree} could be part of a sample.
     *
     * @param tree           parsed source
     * @param policy         sampling rules
     * @param minBytesLength exclusive lower bound on candidate length
     * @param maxBytesLength inclusive upper bound on candidate length
     * @return merged, sorted byte spans covered by at least one candidate
     */
    public List<ByteSpan> eligibleCoverage(final SyntaxTree tree,
                                           final SamplingPolicy policy,
                                           final int minBytesLength,
                                           final int maxBytesLength) {
        final List<Candidate> candidates = collector.collect(tree, policy, minBytesLength, maxBytesLength);

        final List<ByteSpan> spans = new ArrayList<>(candidates.size());
        for (final Candidate candidate : candidates) {
            spans.add(new ByteSpan(candidate.startByte(), candidate.endByte()));
        }
        return byteSpanMerger.merge(spans);
    }
}
