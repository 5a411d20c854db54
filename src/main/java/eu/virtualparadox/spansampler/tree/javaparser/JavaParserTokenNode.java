package eu.virtualparadox.spansampler.tree.javaparser;

import eu.virtualparadox.spansampler.tree.Point;
import eu.virtualparadox.spansampler.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Leaf for a punctuation token that JavaParser keeps out of its AST, such as the braces of a block.
 * The type is the token text itself, e.g. {@code "}"}.
 */
public final class JavaParserTokenNode implements SyntaxNode {

    private final long id;
    private final String text;
    private final JavaParserSyntaxNode parent;
    private final int startByte;
    private final int endByte;
    private final Point startPoint;
    private final Point endPoint;

    JavaParserTokenNode(final long id,
                        final String text,
                        final JavaParserSyntaxNode parent,
                        final int startByte,
                        final int endByte,
                        final Point startPoint,
                        final Point endPoint) {
        this.id = id;
        this.text = text;
        this.parent = parent;
        this.startByte = startByte;
        this.endByte = endByte;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public String type() {
        return text;
    }

    @Override
    public int startByte() {
        return startByte;
    }

    @Override
    public int endByte() {
        return endByte;
    }

    @Override
    public Point startPoint() {
        return startPoint;
    }

    @Override
    public Point endPoint() {
        return endPoint;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.of(parent);
    }

    @Override
    public String toString() {
        return "'" + text + "'[" + startByte + ".." + endByte + "]";
    }
}
