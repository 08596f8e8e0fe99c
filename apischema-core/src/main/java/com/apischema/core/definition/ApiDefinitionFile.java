package com.apischema.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Raw content of an API definition file, as read by Jackson.
 *
 * <p>Names are cross-references and are checked by {@link DefinitionLoader}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * descriptors:
 *   - name: Profile
 *     fields:
 *       - { name: bio, kind: primitive, type: string, helpText: "Short biography" }
 *   - name: User
 *     documentation: "A registered user."
 *     errors: { 404: "User not found" }
 *     fields:
 *       - { name: id, kind: primitive, type: integer, readOnly: true }
 *       - { name: profile, kind: nested, descriptor: Profile }
 *
 * families:
 *   - name: UserResponse
 *     versions:
 *       - { when: ">1.3, <=1.6", descriptor: UserLegacy }
 *       - { when: ">1.6", descriptor: User }
 *
 * models:
 *   - name: user
 *     fields:
 *       - { name: id, primaryKey: true, autoIncrement: true, verboseName: "ID" }
 *
 * paginations:
 *   - { name: pages, style: page_number }
 *
 * handlers:
 *   - name: UserViewSet
 *     serializer: User
 *     response: UserResponse
 *     pagination: pages
 *     model: user
 *
 * routes:
 *   - { path: "/api/{version}/users/", method: GET, handler: UserViewSet, action: list }
 *   - { path: "/api/{version}/users/{pk}/", method: GET, handler: UserViewSet, action: retrieve }
 * }</pre>
 *
 * @param descriptors plain descriptors
 * @param families version-selected descriptor families
 * @param models model metadata used for path parameters
 * @param paginations named pagination strategies
 * @param handlers named handlers
 * @param routes routes binding paths and methods to handlers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiDefinitionFile(
    @JsonProperty("descriptors") List<DescriptorDefinition> descriptors,
    @JsonProperty("families") List<FamilyDefinition> families,
    @JsonProperty("models") List<ModelDefinition> models,
    @JsonProperty("paginations") List<PaginationDefinition> paginations,
    @JsonProperty("handlers") List<HandlerDefinition> handlers,
    @JsonProperty("routes") List<RouteDefinition> routes
) {
    public ApiDefinitionFile {
        descriptors = descriptors == null ? List.of() : descriptors;
        families = families == null ? List.of() : families;
        models = models == null ? List.of() : models;
        paginations = paginations == null ? List.of() : paginations;
        handlers = handlers == null ? List.of() : handlers;
        routes = routes == null ? List.of() : routes;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DescriptorDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("documentation") String documentation,
        @JsonProperty("many") boolean many,
        @JsonProperty("errors") Map<Integer, String> errors,
        @JsonProperty("fields") List<FieldDefinition> fields
    ) {
        public DescriptorDefinition {
            errors = errors == null ? Map.of() : errors;
            fields = fields == null ? List.of() : fields;
        }
    }

    /**
     * One field. {@code kind} is one of primitive, list, nested, hidden, dict, json;
     * {@code type} applies to primitives and {@code child} to lists.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FieldDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("kind") String kind,
        @JsonProperty("type") String type,
        @JsonProperty("label") String label,
        @JsonProperty("helpText") String helpText,
        @JsonProperty("required") boolean required,
        @JsonProperty("readOnly") boolean readOnly,
        @JsonProperty("descriptor") String descriptor,
        @JsonProperty("child") FieldDefinition child,
        @JsonProperty("choices") List<String> choices
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FamilyDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("documentation") String documentation,
        @JsonProperty("versions") List<VersionEntryDefinition> versions
    ) {
        public FamilyDefinition {
            versions = versions == null ? List.of() : versions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VersionEntryDefinition(
        @JsonProperty("when") String when,
        @JsonProperty("descriptor") String descriptor
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("verboseName") String verboseName,
        @JsonProperty("fields") List<ModelFieldDefinition> fields
    ) {
        public ModelDefinition {
            fields = fields == null ? List.of() : fields;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelFieldDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("verboseName") String verboseName,
        @JsonProperty("helpText") String helpText,
        @JsonProperty("primaryKey") boolean primaryKey,
        @JsonProperty("autoIncrement") boolean autoIncrement
    ) {
    }

    /**
     * A pagination strategy: either a {@code style} or a {@code defaultStrategy} it proxies.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaginationDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("style") String style,
        @JsonProperty("defaultStrategy") String defaultStrategy
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HandlerDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("request") String request,
        @JsonProperty("response") String response,
        @JsonProperty("serializer") String serializer,
        @JsonProperty("pagination") String pagination,
        @JsonProperty("filters") List<FilterDefinition> filters,
        @JsonProperty("model") String model,
        @JsonProperty("lookupField") String lookupField,
        @JsonProperty("lookupValuePattern") String lookupValuePattern,
        @JsonProperty("parserMediaTypes") List<String> parserMediaTypes,
        @JsonProperty("excludeFromSchema") boolean excludeFromSchema,
        @JsonProperty("requiredPermissions") List<String> requiredPermissions
    ) {
        public HandlerDefinition {
            filters = filters == null ? List.of() : filters;
            parserMediaTypes = parserMediaTypes == null ? List.of() : parserMediaTypes;
            requiredPermissions = requiredPermissions == null ? List.of() : requiredPermissions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FilterDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("required") boolean required,
        @JsonProperty("description") String description
    ) {
    }

    /**
     * A route. {@code action} names the action of action-based handlers and is left
     * out for plain method handlers.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RouteDefinition(
        @JsonProperty("path") String path,
        @JsonProperty("method") String method,
        @JsonProperty("handler") String handler,
        @JsonProperty("action") String action
    ) {
    }
}
