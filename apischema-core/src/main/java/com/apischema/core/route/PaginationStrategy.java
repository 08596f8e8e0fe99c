package com.apischema.core.route;

import com.apischema.core.model.FieldDescriptor;
import com.apischema.core.model.FieldLocation;
import com.apischema.core.model.SchemaFragment;
import com.apischema.core.model.SchemaType;

import java.util.List;
import java.util.Objects;

/**
 * Pagination configured on a route.
 *
 * <p>A strategy with a {@code defaultStrategy} is a proxy: it forwards to that strategy,
 * which is what gets classified.
 *
 * @param name strategy name
 * @param style pagination style of this strategy (ignored for proxies)
 * @param defaultStrategy strategy a proxy forwards to, null for concrete strategies
 */
public record PaginationStrategy(
    String name,
    PaginationStyle style,
    PaginationStrategy defaultStrategy
) {
    /**
     * Compact constructor with validation.
     */
    public PaginationStrategy {
        Objects.requireNonNull(name, "name must not be null");
        if (style == null) {
            style = PaginationStyle.CUSTOM;
        }
    }

    public static PaginationStrategy of(String name, PaginationStyle style) {
        return new PaginationStrategy(name, style, null);
    }

    /**
     * Creates a proxy forwarding to {@code target}.
     *
     * @param name proxy name
     * @param target concrete strategy
     * @return proxy strategy
     */
    public static PaginationStrategy proxy(String name, PaginationStrategy target) {
        return new PaginationStrategy(name, PaginationStyle.CUSTOM, Objects.requireNonNull(target, "target must not be null"));
    }

    /**
     * Follows the proxy indirection once.
     *
     * @return the default strategy for proxies, this strategy otherwise
     */
    public PaginationStrategy resolve() {
        return defaultStrategy != null ? defaultStrategy : this;
    }

    /**
     * Returns the query parameters clients use to page through results.
     *
     * @return query fields for the resolved style
     */
    public List<FieldDescriptor> queryFields() {
        return switch (resolve().style()) {
            case PAGE_NUMBER -> List.of(
                queryField("page", "Page", "A page number within the paginated result set."));
            case LIMIT_OFFSET -> List.of(
                queryField("limit", "Limit", "Number of results to return per page."),
                queryField("offset", "Offset", "The initial index from which to return the results."));
            case CURSOR -> List.of(
                new FieldDescriptor("cursor", FieldLocation.QUERY, false,
                    SchemaFragment.of(SchemaType.STRING, "Cursor", "The pagination cursor value."), null));
            case CUSTOM -> List.of();
        };
    }

    private static FieldDescriptor queryField(String name, String title, String description) {
        return new FieldDescriptor(name, FieldLocation.QUERY, false,
            SchemaFragment.of(SchemaType.INTEGER, title, description), null);
    }
}
