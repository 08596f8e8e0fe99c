package com.apischema.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node of the document tree, keyed by path segment.
 *
 * @param children child nodes by path segment
 * @param links links at this node by lower-case HTTP method
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record DocumentNode(
    Map<String, DocumentNode> children,
    Map<String, Link> links
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentNode {
        children = children == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(children));
        links = links == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(links));
    }

    /**
     * Creates a node without children or links.
     *
     * @return empty node
     */
    public static DocumentNode empty() {
        return new DocumentNode(Map.of(), Map.of());
    }

    /**
     * Returns whether nothing is documented below this node.
     *
     * @return true when the node has no children and no links
     */
    @JsonIgnore
    public boolean isEmpty() {
        return children.isEmpty() && links.isEmpty();
    }

    /**
     * Returns the child for a segment.
     *
     * @param segment path segment
     * @return child node or null
     */
    public DocumentNode child(String segment) {
        return children.get(segment);
    }

    /**
     * Counts links in this subtree.
     *
     * @return number of links
     */
    public int linkCount() {
        int count = links.size();
        for (DocumentNode child : children.values()) {
            count += child.linkCount();
        }
        return count;
    }
}
