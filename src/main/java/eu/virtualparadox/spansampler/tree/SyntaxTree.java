package eu.virtualparadox.spansampler.tree;

import java.util.Objects;

/**
 * A parsed source file: the root {@link SyntaxNode} plus the bytes it was parsed from.
 */
public final class SyntaxTree {

    private final SyntaxNode root;
    private final byte[] source;

    public SyntaxTree(final SyntaxNode root, final byte[] source) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null").clone();

        if (root.endByte() > source.length) {
            throw new IllegalArgumentException(
                    "Root node ends at byte " + root.endByte()
                            + " but the source has only " + source.length + " bytes"
            );
        }
    }

    public SyntaxNode root() {
        return root;
    }

    /**
     * @return a copy of the source bytes
     */
    public byte[] source() {
        return source.clone();
    }

    public int length() {
        return source.length;
    }
}
