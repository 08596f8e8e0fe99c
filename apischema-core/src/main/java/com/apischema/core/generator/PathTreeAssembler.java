package com.apischema.core.generator;

import com.apischema.core.model.DocumentNode;
import com.apischema.core.model.Link;
import com.apischema.core.util.PathTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Arranges compiled links into a tree keyed by path segment.
 *
 * <p>The shared leading static prefix of the paths is stripped first (see
 * {@link PathTemplates#strippablePrefix(List)}), the version placeholder never becomes a
 * key, and each link is stored at its leaf under the lower-case HTTP method. When two
 * links land on the same leaf and method, the first one wins and the second is logged
 * and skipped.
 */
public class PathTreeAssembler {

    private static final Logger log = LoggerFactory.getLogger(PathTreeAssembler.class);

    /**
     * Builds the tree, stripping the prefix shared by the links themselves.
     *
     * @param links compiled links in route order
     * @return root node, empty when there are no links
     */
    public DocumentNode assemble(List<PlacedLink> links) {
        return assemble(links, PathTemplates.strippablePrefix(links.stream().map(PlacedLink::path).toList()));
    }

    /**
     * Builds the tree under a prefix computed by the caller.
     *
     * <p>The prefix must be shared by every link path. The generator computes it over all
     * candidate routes so a route keeps its place whichever of them the caller may see.
     *
     * @param links compiled links in route order
     * @param prefix leading key segments to strip
     * @return root node, empty when there are no links
     */
    public DocumentNode assemble(List<PlacedLink> links, List<String> prefix) {
        if (links.isEmpty()) {
            return DocumentNode.empty();
        }

        log.debug("Stripping common prefix {} from {} links", prefix, links.size());

        NodeBuilder root = new NodeBuilder();
        for (PlacedLink placed : links) {
            try {
                insert(root, keysFor(placed.path(), prefix), placed);
            } catch (LinkCompilationException e) {
                log.warn("Skipping link: {}", e.getMessage());
            }
        }
        return root.build();
    }

    private static List<String> keysFor(String path, List<String> prefix) {
        List<String> segments = PathTemplates.keySegments(path);
        return segments.subList(prefix.size(), segments.size());
    }

    private static void insert(NodeBuilder root, List<String> keys, PlacedLink placed) {
        NodeBuilder node = root;
        for (String key : keys) {
            node = node.children.computeIfAbsent(key, k -> new NodeBuilder());
        }
        String method = placed.method().toLowerCase(Locale.ROOT);
        if (node.links.containsKey(method)) {
            throw new LinkCompilationException(
                "Duplicate link " + placed.method() + " " + placed.path());
        }
        node.links.put(method, placed.link());
    }

    /**
     * Mutable node used while inserting.
     */
    private static final class NodeBuilder {
        private final Map<String, NodeBuilder> children = new LinkedHashMap<>();
        private final Map<String, Link> links = new LinkedHashMap<>();

        private DocumentNode build() {
            Map<String, DocumentNode> builtChildren = new LinkedHashMap<>();
            children.forEach((key, child) -> builtChildren.put(key, child.build()));
            return new DocumentNode(builtChildren, links);
        }
    }
}
