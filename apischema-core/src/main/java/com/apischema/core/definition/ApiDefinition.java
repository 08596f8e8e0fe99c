package com.apischema.core.definition;

import com.apischema.core.descriptor.ShapeDeclaration;
import com.apischema.core.introspect.ModelMetadataProvider;
import com.apischema.core.route.Route;
import com.apischema.core.route.RouteTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A loaded and linked API definition.
 *
 * @param routes routes in file order
 * @param shapes descriptors and families by name
 * @param models model metadata for path parameters
 */
public record ApiDefinition(
    List<Route> routes,
    Map<String, ShapeDeclaration> shapes,
    ModelMetadataProvider models
) {
    public ApiDefinition {
        routes = routes == null ? List.of() : List.copyOf(routes);
        shapes = shapes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(shapes));
        models = models == null ? ModelMetadataProvider.none() : models;
    }

    public RouteTable routeTable() {
        return RouteTable.of(routes);
    }

    /**
     * Looks up a descriptor or family by name.
     *
     * @param name declared name
     * @return shape, or empty if not declared
     */
    public Optional<ShapeDeclaration> shape(String name) {
        return Optional.ofNullable(shapes.get(name));
    }
}
