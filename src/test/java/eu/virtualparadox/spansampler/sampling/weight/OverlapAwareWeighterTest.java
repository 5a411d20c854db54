package eu.virtualparadox.spansampler.sampling.weight;

import eu.virtualparadox.spansampler.policy.SamplingPolicy;
import eu.virtualparadox.spansampler.sampling.candidate.Candidate;
import eu.virtualparadox.spansampler.sampling.candidate.NodeGroup;
import eu.virtualparadox.spansampler.sampling.collector.EligibleNodeCollector;
import eu.virtualparadox.spansampler.tree.FixtureNode;
import eu.virtualparadox.spansampler.tree.FixtureTrees;
import eu.virtualparadox.spansampler.tree.SyntaxNode;
import eu.virtualparadox.spansampler.tree.SyntaxTree;
import eu.virtualparadox.spansampler.tree.javaparser.JavaParserTreeFactory;
import eu.virtualparadox.spansampler.tree.javaparser.JavaSources;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static eu.virtualparadox.spansampler.tree.FixtureNode.node;
import static eu.virtualparadox.spansampler.tree.TreeSearch.findFirst;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class OverlapAwareWeighterTest {

    private static final double EPSILON = 1e-9;

    private final OverlapAwareWeighter weighter = new OverlapAwareWeighter();
    private final EligibleNodeCollector collector = new EligibleNodeCollector();

    @Test
    @DisplayName("Shared characters are split equally between overlapping candidates")
    void overlapIsShared() {
        final SyntaxTree tree = FixtureTrees.nestedSum();
        final SyntaxNode outer = tree.root();
        final SyntaxNode inner = findFirst(tree, "binary_inner");

        final WeightedCandidates weighted = weighter.weigh(List.of(outer, inner), tree.source());

        // "(" + half of "a+b" + ")+c"
        assertEquals(5.5, weighted.weight(0), EPSILON);
        assertEquals(1.5, weighted.weight(1), EPSILON);
        assertEquals(7.0, weighted.totalWeight(), EPSILON);
    }

    @Test
    @DisplayName("Candidates with the same range are weighted independently")
    void identityNotEquality() {
        final SyntaxTree tree = FixtureTrees.nestedSum();
        final SyntaxNode inner = findFirst(tree, "binary_inner");
        final NodeGroup sameRange = new NodeGroup(inner.children());

        final WeightedCandidates weighted = weighter.weigh(List.of(inner, sameRange), tree.source());

        assertEquals(2, weighted.size());
        assertSame(inner, weighted.candidates().get(0));
        assertSame(sameRange, weighted.candidates().get(1));
        assertEquals(1.5, weighted.weight(0), EPSILON);
        assertEquals(1.5, weighted.weight(1), EPSILON);
    }

    @Test
    @DisplayName("Whitespace does not count towards the weight")
    void whitespaceIsFree() {
        final String source = "a  \t\n  b   ";
        final SyntaxTree tree = FixtureTrees.tree(source, node("pair", 0, source.length(),
                node("identifier", 0, 1),
                node("blank", 1, 7),
                node("identifier", 7, 8)));

        final List<SyntaxNode> candidates = tree.root().children();
        final WeightedCandidates weighted = weighter.weigh(List.<Candidate>copyOf(candidates), tree.source());

        assertEquals(1.0, weighted.weight(0), EPSILON);
        assertEquals(0.0, weighted.weight(1), EPSILON);
        assertEquals(1.0, weighted.weight(2), EPSILON);
    }

    @Test
    @DisplayName("Weights count characters, not bytes")
    void multiByteCharacters() {
        final String source = "x = é€";
        final int length = source.getBytes(StandardCharsets.UTF_8).length;
        final SyntaxTree tree = FixtureTrees.tree(source, node("assignment", 0, length));

        final WeightedCandidates weighted = weighter.weigh(List.of(tree.root()), tree.source());

        assertEquals(9, length);
        assertEquals(4.0, weighted.weight(0), EPSILON);
    }

    @Test
    @DisplayName("Empty candidates get zero weight and do not split their neighbours")
    void emptyCandidate() {
        final String source = "abcde";
        final FixtureNode empty = node("empty", 2, 2);
        final FixtureNode whole = node("word", 0, 5, empty);
        final SyntaxTree tree = FixtureTrees.tree(source, whole);

        final List<Candidate> candidates = List.of(whole, empty);
        final List<ElementaryInterval> intervals = weighter.partition(candidates);
        final WeightedCandidates weighted = weighter.weigh(candidates, tree.source());

        assertEquals(1, intervals.size());
        assertEquals(0, intervals.get(0).start());
        assertEquals(5, intervals.get(0).end());
        assertEquals(5.0, weighted.weight(0), EPSILON);
        assertEquals(0.0, weighted.weight(1), EPSILON);
    }

    @Test
    @DisplayName("Partition yields disjoint intervals with their covering candidates and skips gaps")
    void partition() {
        final List<Candidate> candidates = List.of(
                node("a", 0, 4),
                node("b", 2, 6),
                node("c", 8, 10));

        final List<ElementaryInterval> intervals = weighter.partition(candidates);

        assertEquals(4, intervals.size());
        assertInterval(intervals.get(0), 0, 2, 0);
        assertInterval(intervals.get(1), 2, 4, 0, 1);
        assertInterval(intervals.get(2), 4, 6, 1);
        assertInterval(intervals.get(3), 8, 10, 2);
    }

    @Test
    @DisplayName("Total weight equals the non-whitespace characters of the covered region")
    void weightConservation() {
        final JavaParserTreeFactory factory = new JavaParserTreeFactory();
        final SyntaxTree tree = factory.parse(JavaSources.TWO_METHODS);
        final ByteSpanMerger merger = new ByteSpanMerger();

        final SamplingPolicy[] policies = {
                SamplingPolicy.everything(),
                SamplingPolicy.of(n -> n.type().equals("MethodDeclaration"), c -> false),
                SamplingPolicy.of(n -> n.type().equals("BlockStmt"), c -> c.type().equals("UnaryExpr"))
        };
        for (SamplingPolicy policy : policies) {
            final List<Candidate> candidates = collector.collect(tree, policy, 1, 1000);
            final WeightedCandidates weighted = weighter.weigh(candidates, tree.source());

            final List<ByteSpan> covered = merger.merge(candidates.stream()
                    .map(c -> new ByteSpan(c.startByte(), c.endByte()))
                    .toList());
            int expected = 0;
            for (ByteSpan span : covered) {
                expected += JavaSources.TWO_METHODS.substring(span.start(), span.end())
                        .replaceAll("\\s", "")
                        .length();
            }

            assertThat(candidates).isNotEmpty();
            assertEquals(expected, weighted.totalWeight(), 1e-6);
        }
    }

    @Test
    @DisplayName("Whole-file weight equals the file's non-whitespace character count")
    void wholeFileWeight() {
        final SyntaxTree tree = new JavaParserTreeFactory().parse(JavaSources.TWO_METHODS);

        final List<Candidate> candidates = collector.collect(tree, SamplingPolicy.everything(), 1, 1000);
        final WeightedCandidates weighted = weighter.weigh(candidates, tree.source());

        assertEquals(JavaSources.TWO_METHODS.replaceAll("\\s", "").length(), weighted.totalWeight(), 1e-6);
    }

    @Test
    @DisplayName("Ranges past the end of the source are rejected")
    void outOfRange() {
        final byte[] source = "abc".getBytes(StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class,
                () -> weighter.weigh(List.of(node("long", 0, 4)), source));
        assertThrows(IllegalArgumentException.class,
                () -> weighter.weigh(List.of(node("inverted", 2, 1)), source));
    }

    @Test
    @DisplayName("No candidates yields an empty result")
    void noCandidates() {
        assertTrue(weighter.weigh(List.of(), new byte[0]).isEmpty());
    }

    @Test
    @DisplayName("Non-whitespace counting uses the Unicode whitespace class")
    void countNonWhitespace() {
        assertEquals(0, OverlapAwareWeighter.countNonWhitespace(" \t\r\n"));
        assertEquals(3, OverlapAwareWeighter.countNonWhitespace("a b c"));
        assertEquals(2, OverlapAwareWeighter.countNonWhitespace("😀 x"));
    }

    private static void assertInterval(final ElementaryInterval interval, final int start, final int end,
                                       final int... covering) {
        assertEquals(start, interval.start());
        assertEquals(end, interval.end());
        assertEquals(covering.length, interval.covering().cardinality());
        for (int index : covering) {
            assertTrue(interval.covering().get(index), "candidate " + index + " should cover " + start);
        }
    }
}
