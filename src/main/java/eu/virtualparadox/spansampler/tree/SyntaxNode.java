package eu.virtualparadox.spansampler.tree;

import eu.virtualparadox.spansampler.sampling.candidate.Candidate;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a node of an already parsed syntax tree.
 * <p>
 * Byte offsets are half-open ({@code [startByte, endByte)}) and refer to the source
 * bytes of the owning {@link SyntaxTree}. Children are ordered by position and lie
 * inside the parent's range.
 * </p>
 * <p>
 * Implementations must keep object identity stable for the lifetime of the tree:
 * two calls to {@link #children()} return the same node instances.
 * </p>
 */
public interface SyntaxNode extends Candidate {

    /**
     * @return the ordered child nodes, never {@code null}
     */
    List<SyntaxNode> children();

    /**
     * @return the parent node, empty for the root
     */
    Optional<SyntaxNode> parent();

    /**
     * Number of bytes covered by this node.
     *
     * @return {@code endByte() - startByte()}
     */
    default int byteLength() {
        return endByte() - startByte();
    }
}
