package com.apischema.core.route;

import java.util.Locale;
import java.util.Objects;

/**
 * A registered route: path template, HTTP method and handler.
 *
 * @param path path template such as {@code /api/{version}/users/{id}/}
 * @param method upper-case HTTP method
 * @param handler handler metadata
 */
public record Route(String path, String method, RouteHandler handler) {

    /**
     * Compact constructor with validation.
     */
    public Route {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        method = method.toUpperCase(Locale.ROOT);
    }

    /**
     * Returns a copy with a different path.
     *
     * @param newPath new path template
     * @return route with the same method and handler
     */
    public Route withPath(String newPath) {
        return new Route(newPath, method, handler);
    }
}
