package com.apischema.core.generator;

import com.apischema.core.model.Link;

import java.util.Objects;

/**
 * A compiled link together with the route template it was compiled from.
 *
 * @param path path template, used for tree placement
 * @param method HTTP method
 * @param link compiled link
 */
public record PlacedLink(String path, String method, Link link) {

    public PlacedLink {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(link, "link must not be null");
    }
}
