package eu.virtualparadox.spansampler.policy;

import eu.virtualparadox.spansampler.sampling.candidate.Candidate;
import eu.virtualparadox.spansampler.tree.SyntaxNode;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Language-specific rules that decide where spans may be sampled.
 * <ul>
 *   <li>{@link #isEligibleSubtree(SyntaxNode)} marks subtrees inside which sampling is allowed.
 *       Descendants inherit the mark.</li>
 *   <li>{@link #exclude(Candidate)} removes individual candidates, e.g. lone comments or braces.</li>
 *   <li>{@link #visitChildren(SyntaxNode)} chooses which children the traversal descends into.</li>
 * </ul>
 */
public interface SamplingPolicy {

    boolean isEligibleSubtree(SyntaxNode node);

    boolean exclude(Candidate candidate);

    default List<SyntaxNode> visitChildren(final SyntaxNode node) {
        return node.children();
    }

    /**
     * Builds a policy from plain functions.
     *
     * @param eligibleSubtree predicate marking eligible subtrees
     * @param exclude         predicate removing candidates
     * @param visitChildren   child selection used during traversal
     * @return policy delegating to the given functions
     */
    static SamplingPolicy of(final Predicate<SyntaxNode> eligibleSubtree,
                             final Predicate<Candidate> exclude,
                             final Function<SyntaxNode, List<SyntaxNode>> visitChildren) {
        Objects.requireNonNull(eligibleSubtree, "eligibleSubtree must not be null");
        Objects.requireNonNull(exclude, "exclude must not be null");
        Objects.requireNonNull(visitChildren, "visitChildren must not be null");

        return new SamplingPolicy() {
            @Override
            public boolean isEligibleSubtree(final SyntaxNode node) {
                return eligibleSubtree.test(node);
            }

            @Override
            public boolean exclude(final Candidate candidate) {
                return exclude.test(candidate);
            }

            @Override
            public List<SyntaxNode> visitChildren(final SyntaxNode node) {
                return visitChildren.apply(node);
            }
        };
    }

    static SamplingPolicy of(final Predicate<SyntaxNode> eligibleSubtree,
                             final Predicate<Candidate> exclude) {
        return of(eligibleSubtree, exclude, SyntaxNode::children);
    }

    /**
     * @return a policy under which every node of the tree is eligible and nothing is excluded
     */
    static SamplingPolicy everything() {
        return of(node -> true, candidate -> false);
    }
}
