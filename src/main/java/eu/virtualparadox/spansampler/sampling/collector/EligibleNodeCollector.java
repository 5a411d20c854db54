package eu.virtualparadox.spansampler.sampling.collector;

import eu.virtualparadox.spansampler.policy.SamplingPolicy;
import eu.virtualparadox.spansampler.sampling.candidate.Candidate;
import eu.virtualparadox.spansampler.sampling.candidate.NodeGroup;
import eu.virtualparadox.spansampler.tree.SyntaxNode;
import eu.virtualparadox.spansampler.tree.SyntaxTree;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Walks a {@link SyntaxTree} once and collects every {@link Candidate} that may be sampled.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>A node is inside an <em>eligible subtree</em> if it, or any of its ancestors, satisfies
 *       {@link SamplingPolicy#isEligibleSubtree(SyntaxNode)}.</li>
 *   <li>A node becomes a candidate when it is inside an eligible subtree, is not excluded and
 *       its byte length lies in {@code (minBytesLength, maxBytesLength]}.</li>
 *   <li>Nodes of length {@code <= minBytesLength} are pruned together with their subtree,
 *       since no descendant can be longer.</li>
 *   <li>For every node inside an eligible subtree, runs of at least two consecutive visited
 *       children form {@link NodeGroup}s. A group is skipped when its first member is excluded
 *       or the group itself is excluded. Groups never take in the last visited child. Growing a
 *       group stops as soon as it exceeds {@code maxBytesLength}.</li>
 * </ul>
 *
 * <p>The traversal uses an explicit stack of {@code (node, inherited eligibility)} frames so deep
 * trees cannot overflow the call stack. The collector is stateless and thread-safe.</p>
 */
@Component
public class EligibleNodeCollector {

    /**
     * Collects all candidates of {@code tree} under {@code policy}.
     *
     * @param tree           parsed source
     * @param policy         eligibility, exclusion and traversal rules
     * @param minBytesLength exclusive lower bound on candidate length
     * @param maxBytesLength inclusive upper bound on candidate length
     * @return candidates in discovery order; empty if nothing qualifies
     */
    public List<Candidate> collect(final SyntaxTree tree,
                                   final SamplingPolicy policy,
                                   final int minBytesLength,
                                   final int maxBytesLength) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        final List<Candidate> candidates = new ArrayList<>();
        final Deque<Frame> toVisit = new ArrayDeque<>();
        toVisit.push(new Frame(tree.root(), policy.isEligibleSubtree(tree.root())));

        while (!toVisit.isEmpty()) {
            final Frame frame = toVisit.pop();
            final SyntaxNode node = frame.node();

            final int length = node.byteLength();
            if (length <= minBytesLength) {
                // Neither this node nor its children can be long enough
                continue;
            }

            if (length <= maxBytesLength && frame.eligibleSubtree() && !policy.exclude(node)) {
                candidates.add(node);
            }

            final List<SyntaxNode> children = policy.visitChildren(node);
            for (final SyntaxNode child : children) {
                toVisit.push(new Frame(child, frame.eligibleSubtree() || policy.isEligibleSubtree(child)));
            }

            if (frame.eligibleSubtree()) {
                collectGroups(children, policy, minBytesLength, maxBytesLength, candidates);
            }
        }

        return candidates;
    }

    /**
     * Adds every group {@code children[i:j]} with {@code i + 2 <= j < children.size()} that fits
     * the length bounds.
     */
    private void collectGroups(final List<SyntaxNode> children,
                               final SamplingPolicy policy,
                               final int minBytesLength,
                               final int maxBytesLength,
                               final List<Candidate> candidates) {
        for (int i = 0; i < children.size(); i++) {
            if (policy.exclude(children.get(i))) {
                continue;
            }

            for (int j = i + 2; j < children.size(); j++) {
                final NodeGroup group = new NodeGroup(children.subList(i, j));
                final int groupLength = group.endByte() - group.startByte();

                if (groupLength > maxBytesLength) {
                    // Groups only grow with j
                    break;
                }
                if (groupLength > minBytesLength && !policy.exclude(group)) {
                    candidates.add(group);
                }
            }
        }
    }

    private record Frame(SyntaxNode node, boolean eligibleSubtree) {
    }
}
