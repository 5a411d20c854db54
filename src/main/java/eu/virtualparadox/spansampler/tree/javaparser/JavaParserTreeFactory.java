package eu.virtualparadox.spansampler.tree.javaparser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.JavaToken;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.stmt.BlockStmt;
import eu.virtualparadox.spansampler.tree.Point;
import eu.virtualparadox.spansampler.tree.SyntaxNode;
import eu.virtualparadox.spansampler.tree.SyntaxTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Parses Java source with JavaParser and exposes the result as a {@link SyntaxTree}.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li>The root node wraps the {@link CompilationUnit} and spans the whole file.</li>
 *   <li>Every other node keeps its JavaParser range, converted to half-open UTF-8 byte offsets.</li>
 *   <li>Comments, nodes without a range and nodes reaching outside their parent are left out.</li>
 *   <li>Blocks get {@link JavaParserTokenNode} leaves for their opening and closing braces, so the
 *       last statement of a block is never its last child.</li>
 *   <li>Children are ordered by start offset.</li>
 *   <li>Ids are handed out parents first; siblings get consecutive ids.</li>
 * </ul>
 */
@Component
@Slf4j
public class JavaParserTreeFactory {

    private final ParserConfiguration configuration;

    public JavaParserTreeFactory() {
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setTabSize(1)
                .setStoreTokens(true);
    }

    /**
     * Reads and parses a Java file.
     *
     * @param file path of a UTF-8 encoded Java source file
     * @return the parsed tree
     * @throws IOException           if the file cannot be read
     * @throws ParseProblemException if the source does not parse
     */
    public SyntaxTree parse(final Path file) throws IOException {
        log.debug("Parsing {}", file);
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Parses Java source code.
     *
     * @param source Java source
     * @return the parsed tree
     * @throws ParseProblemException if the source does not parse
     */
    public SyntaxTree parse(final String source) {
        final ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new ParseProblemException(result.getProblems());
        }

        final SourceOffsets offsets = new SourceOffsets(source);
        final SyntaxNode root = buildTree(result.getResult().get(), offsets);
        return new SyntaxTree(root, source.getBytes(StandardCharsets.UTF_8));
    }

    private SyntaxNode buildTree(final CompilationUnit unit, final SourceOffsets offsets) {
        long nextId = 0;
        final JavaParserSyntaxNode root = new JavaParserSyntaxNode(nextId++, unit, null,
                0, offsets.byteLength(), offsets.point(0), offsets.point(offsets.byteLength()));

        final Deque<JavaParserSyntaxNode> toBuild = new ArrayDeque<>();
        toBuild.push(root);

        while (!toBuild.isEmpty()) {
            final JavaParserSyntaxNode parent = toBuild.pop();

            final List<Placed> placed = new ArrayList<>();
            for (final Node child : parent.node().getChildNodes()) {
                if (child instanceof Comment || child.getRange().isEmpty()) {
                    continue;
                }
                place(child.getRange().get(), child, null, parent, offsets).ifPresent(placed::add);
            }
            if (parent.node() instanceof BlockStmt block) {
                block.getTokenRange().ifPresent(tokens -> {
                    placeToken(tokens.getBegin(), "{", parent, offsets).ifPresent(placed::add);
                    placeToken(tokens.getEnd(), "}", parent, offsets).ifPresent(placed::add);
                });
            }
            placed.sort(Comparator.comparingInt(Placed::startByte).thenComparingInt(Placed::endByte));

            final List<SyntaxNode> children = new ArrayList<>(placed.size());
            for (final Placed child : placed) {
                final Point startPoint = offsets.point(child.startByte());
                final Point endPoint = offsets.point(child.endByte());
                if (child.node() == null) {
                    children.add(new JavaParserTokenNode(nextId++, child.token(), parent,
                            child.startByte(), child.endByte(), startPoint, endPoint));
                    continue;
                }

                final JavaParserSyntaxNode wrapper = new JavaParserSyntaxNode(nextId++, child.node(), parent,
                        child.startByte(), child.endByte(), startPoint, endPoint);
                children.add(wrapper);
                toBuild.push(wrapper);
            }
            parent.setChildren(children);
        }

        return root;
    }

    private static Optional<Placed> placeToken(final JavaToken token,
                                               final String expected,
                                               final JavaParserSyntaxNode parent,
                                               final SourceOffsets offsets) {
        if (!expected.equals(token.getText()) || token.getRange().isEmpty()) {
            return Optional.empty();
        }
        return place(token.getRange().get(), null, expected, parent, offsets);
    }

    /**
     * Converts a JavaParser range to byte offsets, dropping it if it falls outside {@code parent}.
     */
    private static Optional<Placed> place(final Range range,
                                          final Node node,
                                          final String token,
                                          final JavaParserSyntaxNode parent,
                                          final SourceOffsets offsets) {
        final int startByte = offsets.byteOffset(offsets.charOffset(range.begin));
        // JavaParser ranges end on the last character, inclusive
        final int endByte = offsets.byteOffset(offsets.charOffset(range.end) + 1);
        if (startByte < parent.startByte() || endByte > parent.endByte() || startByte >= endByte) {
            return Optional.empty();
        }
        return Optional.of(new Placed(node, token, startByte, endByte));
    }

    /**
     * A child about to be wrapped: either an AST node or, with {@code node == null}, a token.
     */
    private record Placed(Node node, String token, int startByte, int endByte) {
    }
}
