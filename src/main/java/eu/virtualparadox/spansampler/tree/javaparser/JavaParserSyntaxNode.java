package eu.virtualparadox.spansampler.tree.javaparser;

import com.github.javaparser.ast.Node;
import eu.virtualparadox.spansampler.tree.Point;
import eu.virtualparadox.spansampler.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * {@link SyntaxNode} view of a JavaParser {@link Node}. Instances are created once per tree by
 * {@link JavaParserTreeFactory}, so identity is stable.
 */
public final class JavaParserSyntaxNode implements SyntaxNode {

    private final long id;
    private final Node node;
    private final JavaParserSyntaxNode parent;
    private final int startByte;
    private final int endByte;
    private final Point startPoint;
    private final Point endPoint;
    private List<SyntaxNode> children = List.of();

    JavaParserSyntaxNode(final long id,
                         final Node node,
                         final JavaParserSyntaxNode parent,
                         final int startByte,
                         final int endByte,
                         final Point startPoint,
                         final Point endPoint) {
        this.id = id;
        this.node = node;
        this.parent = parent;
        this.startByte = startByte;
        this.endByte = endByte;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
    }

    void setChildren(final List<SyntaxNode> children) {
        this.children = List.copyOf(children);
    }

    /**
     * @return the wrapped JavaParser node
     */
    public Node node() {
        return node;
    }

    /**
     * Finds the child wrapping {@code target}.
     *
     * @param target a direct child of {@link #node()}
     * @return the wrapper, or empty if {@code target} was left out of the tree (e.g. a comment)
     */
    public Optional<SyntaxNode> childWrapping(final Node target) {
        for (final SyntaxNode child : children) {
            if (child instanceof JavaParserSyntaxNode wrapper && wrapper.node == target) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    @Override
    public long id() {
        return id;
    }

    /**
     * @return the JavaParser class name, e.g. {@code MethodDeclaration}
     */
    @Override
    public String type() {
        return node.getClass().getSimpleName();
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
        return children;
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public String toString() {
        return type() + "[" + startByte + ".." + endByte + "]";
    }
}
