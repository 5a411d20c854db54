package eu.virtualparadox.spansampler.sampling.candidate;

import eu.virtualparadox.spansampler.tree.Point;
import eu.virtualparadox.spansampler.tree.SyntaxNode;

/**
 * Something that can be sampled: either a single {@link SyntaxNode} or a {@link NodeGroup}
 * of consecutive sibling nodes.
 * <p>
 * Candidates are compared by reference identity throughout the sampling pipeline.
 * A node and a group may cover exactly the same bytes and still count as two
 * distinct candidates.
 * </p>
 */
public interface Candidate {

    /**
     * @return an identifier for the candidate; not guaranteed to be globally unique
     */
    long id();

    /**
     * @return the syntactic type tag
     */
    String type();

    /**
     * @return inclusive start byte offset
     */
    int startByte();

    /**
     * @return exclusive end byte offset
     */
    int endByte();

    Point startPoint();

    Point endPoint();
}
