package eu.virtualparadox.spansampler.policy;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import eu.virtualparadox.spansampler.sampling.candidate.Candidate;
import eu.virtualparadox.spansampler.tree.SyntaxNode;
import eu.virtualparadox.spansampler.tree.javaparser.JavaParserSyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Samples whole statements (and runs of statements) inside Java method bodies, for trees built by
 * {@link eu.virtualparadox.spansampler.tree.javaparser.JavaParserTreeFactory}.
 *
 * <ul>
 *   <li><strong>Eligible:</strong> the body block of a {@link MethodDeclaration}, optionally only if it
 *       touches one of a set of 1-based line numbers.</li>
 *   <li><strong>Excluded:</strong> braces, bare blocks, catch clauses and {@code else if} branches.</li>
 *   <li><strong>Traversal:</strong> simple statements are not descended into; compound statements
 *       only expose their bodies.</li>
 * </ul>
 */
public final class JavaMethodBodyPolicy implements SamplingPolicy {

    private static final Set<String> EXCLUDED_TYPES = Set.of(
            "{",
            "}",
            "BlockStmt",
            "CatchClause"
    );

    private final Set<Integer> eligibleLines;

    public JavaMethodBodyPolicy() {
        this(Set.of());
    }

    /**
     * @param eligibleLines 1-based line numbers a method body must touch to be sampled;
     *                      empty to accept every method body
     */
    public JavaMethodBodyPolicy(final Set<Integer> eligibleLines) {
        this.eligibleLines = Set.copyOf(eligibleLines);
    }

    @Override
    public boolean isEligibleSubtree(final SyntaxNode node) {
        final boolean methodBody = javaNode(node)
                .filter(BlockStmt.class::isInstance)
                .flatMap(Node::getParentNode)
                .filter(MethodDeclaration.class::isInstance)
                .isPresent();
        if (!methodBody) {
            return false;
        }
        if (eligibleLines.isEmpty()) {
            return true;
        }

        for (int line = node.startPoint().row() + 1; line <= node.endPoint().row() + 1; line++) {
            if (eligibleLines.contains(line)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean exclude(final Candidate candidate) {
        if (EXCLUDED_TYPES.contains(candidate.type())) {
            return true;
        }
        if (!(candidate instanceof SyntaxNode node)) {
            return false;
        }

        // Nested if-else chains
        return javaNode(node)
                .filter(IfStmt.class::isInstance)
                .flatMap(Node::getParentNode)
                .filter(IfStmt.class::isInstance)
                .isPresent();
    }

    @Override
    public List<SyntaxNode> visitChildren(final SyntaxNode node) {
        if (!(node instanceof JavaParserSyntaxNode wrapper)) {
            return node.children();
        }

        final Node javaNode = wrapper.node();
        if (javaNode instanceof ExpressionStmt || javaNode instanceof ReturnStmt || javaNode instanceof ThrowStmt) {
            return List.of();
        }
        if (javaNode instanceof IfStmt ifStmt) {
            final List<Node> branches = new ArrayList<>();
            branches.add(ifStmt.getThenStmt());
            ifStmt.getElseStmt().ifPresent(branches::add);
            return wrapped(wrapper, branches);
        }
        if (javaNode instanceof ForStmt forStmt) {
            return wrapped(wrapper, List.of(forStmt.getBody()));
        }
        if (javaNode instanceof ForEachStmt forEachStmt) {
            return wrapped(wrapper, List.of(forEachStmt.getBody()));
        }
        if (javaNode instanceof WhileStmt whileStmt) {
            return wrapped(wrapper, List.of(whileStmt.getBody()));
        }
        if (javaNode instanceof DoStmt doStmt) {
            return wrapped(wrapper, List.of(doStmt.getBody()));
        }
        if (javaNode instanceof TryStmt tryStmt) {
            // Resources are not statements
            final List<Node> parts = new ArrayList<>();
            parts.add(tryStmt.getTryBlock());
            parts.addAll(tryStmt.getCatchClauses());
            tryStmt.getFinallyBlock().ifPresent(parts::add);
            return wrapped(wrapper, parts);
        }
        if (javaNode instanceof CatchClause catchClause) {
            return wrapped(wrapper, List.of(catchClause.getBody()));
        }
        return node.children();
    }

    private static List<SyntaxNode> wrapped(final JavaParserSyntaxNode parent, final List<? extends Node> targets) {
        final List<SyntaxNode> result = new ArrayList<>(targets.size());
        for (final Node target : targets) {
            parent.childWrapping(target).ifPresent(result::add);
        }
        return result;
    }

    private static Optional<Node> javaNode(final SyntaxNode node) {
        if (node instanceof JavaParserSyntaxNode wrapper) {
            return Optional.of(wrapper.node());
        }
        return Optional.empty();
    }
}
