package io.github.nxtool.nxstyle.analyzer;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * One parsed source file: the immutable tree-sitter tree together with the exact bytes it was parsed from. Text slices
 * use tree-sitter byte offsets, so they are taken from the UTF-8 bytes and not from the decoded string.
 */
public final class SyntaxTree {
    private static final Logger logger = LogManager.getLogger(SyntaxTree.class);

    private final Path file;
    private final TSLanguage language;
    private final TSTree tree;
    private final byte[] sourceBytes;

    private SyntaxTree(Path file, TSLanguage language, TSTree tree, byte[] sourceBytes) {
        this.file = file;
        this.language = language;
        this.tree = tree;
        this.sourceBytes = sourceBytes;
    }

    /**
     * Parses {@code contents} with the given grammar.
     *
     * @throws StyleCheckException if the grammar cannot be loaded into the parser
     */
    public static SyntaxTree parse(Path file, byte[] contents, TSLanguage language) throws StyleCheckException {
        var parser = new TSParser();
        if (!parser.setLanguage(language)) {
            throw new StyleCheckException(
                    "Failed to set language " + language.getClass().getSimpleName() + " on TSParser",
                    file,
                    "parsing");
        }

        // Re-encode so that byte offsets reported by tree-sitter line up with our slices even for invalid UTF-8 input
        String src = new String(contents, StandardCharsets.UTF_8);
        byte[] bytes = src.getBytes(StandardCharsets.UTF_8);

        long start = System.nanoTime();
        TSTree tree = parser.parseString(null, src);
        logger.debug(
                "Parsed {} ({} bytes) in {} us",
                file,
                bytes.length,
                (System.nanoTime() - start) / 1_000);

        var root = tree.getRootNode();
        if (root.isNull()) {
            throw new StyleCheckException("Parsing produced no root node", file, "parsing");
        }
        ASTTraversalUtils.logSyntaxErrors(root, file);
        return new SyntaxTree(file, language, tree, bytes);
    }

    public Path file() {
        return file;
    }

    public TSLanguage language() {
        return language;
    }

    public TSNode root() {
        return tree.getRootNode();
    }

    /** Source text of a node. */
    public String text(TSNode node) {
        return slice(node.getStartByte(), node.getEndByte());
    }

    /** Source text between two byte offsets, clamped to the file. */
    public String slice(int startByte, int endByte) {
        int start = Math.max(0, Math.min(startByte, sourceBytes.length));
        int end = Math.max(start, Math.min(endByte, sourceBytes.length));
        return new String(sourceBytes, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Source text between two byte offsets with the given sub-ranges replaced. Each replacement keeps the first and
     * last byte of its range (the delimiters) and drops everything in between, so {@code "a, b"} becomes {@code ""}
     * and {@code (x, y)} becomes {@code ()}. Ranges must not overlap.
     */
    public String sliceCollapsing(int startByte, int endByte, List<TSNode> collapsed) {
        var sorted = collapsed.stream()
                .filter(n -> n.getStartByte() >= startByte && n.getEndByte() <= endByte)
                .sorted(Comparator.comparingInt(TSNode::getStartByte))
                .toList();

        var sb = new StringBuilder();
        int cursor = startByte;
        for (var node : sorted) {
            int nodeStart = node.getStartByte();
            int nodeEnd = node.getEndByte();
            if (nodeStart < cursor) {
                continue;
            }
            sb.append(slice(cursor, nodeStart));
            if (nodeEnd - nodeStart >= 2) {
                sb.append(slice(nodeStart, nodeStart + 1));
                sb.append(slice(nodeEnd - 1, nodeEnd));
            } else {
                sb.append(slice(nodeStart, nodeEnd));
            }
            cursor = nodeEnd;
        }
        sb.append(slice(cursor, endByte));
        return sb.toString();
    }

    /** Prints the tree in pre-order, one node per line, indented by depth. */
    public void dump(PrintWriter out) {
        ASTTraversalUtils.walkTree(root(), (node, depth) -> {
            var label = node.isNamed() ? node.getType() : '"' + node.getType() + '"';
            out.printf(
                    "%s%s [%d:%d - %d:%d]%n",
                    "  ".repeat(depth),
                    label,
                    ASTTraversalUtils.startRow(node) + 1,
                    ASTTraversalUtils.startColumn(node),
                    ASTTraversalUtils.endRow(node) + 1,
                    ASTTraversalUtils.endColumn(node));
            return true;
        });
        out.flush();
    }
}
