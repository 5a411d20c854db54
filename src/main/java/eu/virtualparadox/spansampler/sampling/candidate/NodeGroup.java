package eu.virtualparadox.spansampler.sampling.candidate;

import eu.virtualparadox.spansampler.tree.Point;
import eu.virtualparadox.spansampler.tree.SyntaxNode;

import java.util.List;

/**
 * A run of consecutive sibling nodes sampled as a single unit, e.g. a sequence of statements.
 * <p>
 * The nodes are assumed to be sorted and contiguous siblings. The group's range runs
 * from the first node's start to the last node's end.
 * </p>
 */
public final class NodeGroup implements Candidate {

    public static final String TYPE = "_group";

    private final List<SyntaxNode> nodes;

    public NodeGroup(final List<SyntaxNode> nodes) {
        if (nodes == null || nodes.size() < 2) {
            throw new IllegalArgumentException("A node group needs at least 2 nodes");
        }
        this.nodes = List.copyOf(nodes);
    }

    public List<SyntaxNode> nodes() {
        return nodes;
    }

    public SyntaxNode first() {
        return nodes.get(0);
    }

    public SyntaxNode last() {
        return nodes.get(nodes.size() - 1);
    }

    /**
     * Span of the underlying node ids. Only meant for de-duplication.
     */
    @Override
    public long id() {
        return last().id() - first().id();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public int startByte() {
        return first().startByte();
    }

    @Override
    public int endByte() {
        return last().endByte();
    }

    @Override
    public Point startPoint() {
        return first().startPoint();
    }

    @Override
    public Point endPoint() {
        return last().endPoint();
    }

    @Override
    public String toString() {
        return "NodeGroup[" + nodes.size() + " nodes, " + startByte() + ".." + endByte() + "]";
    }
}
