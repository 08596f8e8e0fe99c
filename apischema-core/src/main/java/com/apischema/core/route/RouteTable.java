package com.apischema.core.route;

import java.util.List;

/**
 * Supplies the routes to document.
 */
@FunctionalInterface
public interface RouteTable {

    /**
     * Returns all registered routes in registration order.
     *
     * @return routes
     */
    List<Route> routes();

    /**
     * Returns a table over a fixed list.
     *
     * @param routes routes in order
     * @return route table
     */
    static RouteTable of(List<Route> routes) {
        List<Route> copy = List.copyOf(routes);
        return () -> copy;
    }
}
