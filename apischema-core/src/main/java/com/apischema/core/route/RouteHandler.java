package com.apischema.core.route;

import com.apischema.core.descriptor.ShapeDeclaration;
import com.apischema.core.model.FieldDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Metadata of the handler bound to a route.
 *
 * @param name handler name, used in logs
 * @param action named action (list, retrieve, create, ...), null for plain method handlers
 * @param description handler documentation
 * @param request declared request shape, may be null
 * @param response declared response shape, may be null
 * @param serializer generic shape of the handler, used when no request/response shape is declared
 * @param pagination pagination strategy, may be null
 * @param filterFields query fields contributed by filters
 * @param model name of the model the handler exposes, may be null
 * @param lookupField path variable used to look up single objects, may be null
 * @param lookupValuePattern regular expression for the lookup variable, may be null
 * @param parserMediaTypes accepted request media types, first is preferred
 * @param excludeFromSchema whether to leave the handler out of documents
 * @param requiredPermissions permissions a caller needs to see the route
 */
public record RouteHandler(
    String name,
    String action,
    String description,
    ShapeDeclaration request,
    ShapeDeclaration response,
    ShapeDeclaration serializer,
    PaginationStrategy pagination,
    List<FieldDescriptor> filterFields,
    String model,
    String lookupField,
    String lookupValuePattern,
    List<String> parserMediaTypes,
    boolean excludeFromSchema,
    Set<String> requiredPermissions
) {
    /**
     * Compact constructor with validation.
     */
    public RouteHandler {
        Objects.requireNonNull(name, "name must not be null");
        if (description == null) {
            description = "";
        }
        filterFields = filterFields == null ? List.of() : List.copyOf(filterFields);
        parserMediaTypes = parserMediaTypes == null ? List.of() : List.copyOf(parserMediaTypes);
        requiredPermissions = requiredPermissions == null ? Set.of() : Set.copyOf(requiredPermissions);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Returns the action name for a method: the declared action, or the lower-case
     * method for plain handlers.
     *
     * @param method HTTP method
     * @return action name
     */
    public String actionFor(String method) {
        return action != null ? action : method.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether the handler declares named actions.
     *
     * @return true if {@link #action()} is set
     */
    public boolean hasAction() {
        return action != null;
    }

    /**
     * Builder for {@link RouteHandler}.
     */
    public static final class Builder {
        private final String name;
        private String action;
        private String description;
        private ShapeDeclaration request;
        private ShapeDeclaration response;
        private ShapeDeclaration serializer;
        private PaginationStrategy pagination;
        private final List<FieldDescriptor> filterFields = new ArrayList<>();
        private String model;
        private String lookupField;
        private String lookupValuePattern;
        private final List<String> parserMediaTypes = new ArrayList<>();
        private boolean excludeFromSchema;
        private final Set<String> requiredPermissions = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder request(ShapeDeclaration request) {
            this.request = request;
            return this;
        }

        public Builder response(ShapeDeclaration response) {
            this.response = response;
            return this;
        }

        public Builder serializer(ShapeDeclaration serializer) {
            this.serializer = serializer;
            return this;
        }

        public Builder pagination(PaginationStrategy pagination) {
            this.pagination = pagination;
            return this;
        }

        public Builder filterField(FieldDescriptor field) {
            filterFields.add(field);
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder lookup(String field, String valuePattern) {
            this.lookupField = field;
            this.lookupValuePattern = valuePattern;
            return this;
        }

        public Builder parserMediaType(String mediaType) {
            parserMediaTypes.add(mediaType);
            return this;
        }

        public Builder excludeFromSchema(boolean exclude) {
            this.excludeFromSchema = exclude;
            return this;
        }

        public Builder requiredPermission(String permission) {
            requiredPermissions.add(permission);
            return this;
        }

        public RouteHandler build() {
            return new RouteHandler(name, action, description, request, response, serializer, pagination,
                filterFields, model, lookupField, lookupValuePattern, parserMediaTypes, excludeFromSchema,
                requiredPermissions);
        }
    }
}
