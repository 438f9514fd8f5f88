package io.github.nxtool.nxstyle.analyzer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSQuery;
import org.treesitter.TSQueryCapture;
import org.treesitter.TSQueryCursor;
import org.treesitter.TSQueryException;
import org.treesitter.TSQueryMatch;

/**
 * Read-only mapping from capture name to the nodes the query matched under that name. Nodes in a group are ordered by
 * position and never repeated. A name the query did not match simply maps to an empty list.
 */
public final class CaptureSet {
    private static final Logger logger = LogManager.getLogger(CaptureSet.class);

    private final Map<String, List<TSNode>> groups;

    private CaptureSet(Map<String, List<TSNode>> groups) {
        this.groups = groups;
    }

    /**
     * Compiles the query held in a classpath resource.
     *
     * @throws UncheckedIOException if the resource cannot be read
     * @throws TSQueryException if the pattern text does not compile against the grammar
     */
    public static TSQuery compileQuery(TSLanguage language, String resource) {
        String rawQueryString = loadResource(resource);
        return new TSQuery(language, rawQueryString);
    }

    /** Runs the query over {@code root} and groups the captured nodes by capture name. */
    public static CaptureSet collect(TSQuery query, TSNode root) {
        var grouped = new LinkedHashMap<String, List<TSNode>>();
        var seen = new HashSet<NodeKey>();

        var cursor = new TSQueryCursor();
        cursor.exec(query, root);

        TSQueryMatch match = new TSQueryMatch(); // Reusable match object
        while (cursor.nextMatch(match)) {
            for (TSQueryCapture capture : match.getCaptures()) {
                String captureName = query.getCaptureNameForId(capture.getIndex());
                TSNode node = capture.getNode();
                if (!ASTTraversalUtils.isPresent(node)) {
                    continue;
                }
                if (seen.add(new NodeKey(captureName, node.getStartByte(), node.getEndByte(), node.getType()))) {
                    grouped.computeIfAbsent(captureName, k -> new ArrayList<>()).add(node);
                }
            }
        }

        var frozen = new LinkedHashMap<String, List<TSNode>>();
        grouped.forEach((name, nodes) -> {
            nodes.sort(Comparator.comparingInt(TSNode::getStartByte).thenComparingInt(TSNode::getEndByte));
            frozen.put(name, List.copyOf(nodes));
            logger.trace("Capture '{}': {} node(s)", name, nodes.size());
        });
        return new CaptureSet(frozen);
    }

    /** The nodes captured under {@code name}, in source order; empty when the query produced none. */
    public List<TSNode> get(String name) {
        return groups.getOrDefault(name, List.of());
    }

    public boolean has(String name) {
        return !get(name).isEmpty();
    }

    public Set<String> names() {
        return groups.keySet();
    }

    private static String loadResource(String path) {
        try (InputStream in = CaptureSet.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) throw new IOException("Resource not found: " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private record NodeKey(String captureName, int startByte, int endByte, String type) {}
}
