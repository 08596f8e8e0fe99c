package com.apischema.core.definition;

import com.apischema.core.definition.ApiDefinitionFile.DescriptorDefinition;
import com.apischema.core.definition.ApiDefinitionFile.FamilyDefinition;
import com.apischema.core.definition.ApiDefinitionFile.FieldDefinition;
import com.apischema.core.definition.ApiDefinitionFile.FilterDefinition;
import com.apischema.core.definition.ApiDefinitionFile.HandlerDefinition;
import com.apischema.core.definition.ApiDefinitionFile.ModelDefinition;
import com.apischema.core.definition.ApiDefinitionFile.ModelFieldDefinition;
import com.apischema.core.definition.ApiDefinitionFile.PaginationDefinition;
import com.apischema.core.definition.ApiDefinitionFile.RouteDefinition;
import com.apischema.core.definition.ApiDefinitionFile.VersionEntryDefinition;
import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.DeclaredField;
import com.apischema.core.descriptor.FieldKind;
import com.apischema.core.descriptor.PrimitiveType;
import com.apischema.core.descriptor.ShapeDeclaration;
import com.apischema.core.introspect.DefaultFieldSchemaIntrospector;
import com.apischema.core.introspect.ModelFieldMetadata;
import com.apischema.core.introspect.ModelMetadataProvider;
import com.apischema.core.model.FieldDescriptor;
import com.apischema.core.model.FieldLocation;
import com.apischema.core.route.PaginationStrategy;
import com.apischema.core.route.PaginationStyle;
import com.apischema.core.route.Route;
import com.apischema.core.route.RouteHandler;
import com.apischema.core.version.VersionMap;
import com.apischema.core.version.VersionParseException;
import com.apischema.core.version.VersionedShape;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Loads an API definition file (YAML, or JSON as a subset of it) and links its
 * cross-references into descriptors, version families, model metadata and routes.
 *
 * <p>Unlike configuration, a definition is mandatory: an unreadable file, an unknown
 * reference or an unknown field kind raises {@link DefinitionException}. Descriptors that
 * nest each other in a cycle raise {@link CyclicDescriptorException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ApiDefinition definition = DefinitionLoader.load(Paths.get("api.yaml"));
 * RouteTable routes = definition.routeTable();
 * }</pre>
 */
public final class DefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(DefinitionLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DefinitionLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads a definition file.
     *
     * @param definitionPath path to the definition
     * @return linked definition
     * @throws DefinitionException if the file cannot be read or is inconsistent
     * @throws CyclicDescriptorException if descriptors nest each other in a cycle
     */
    public static ApiDefinition load(Path definitionPath) {
        if (!Files.isRegularFile(definitionPath) || !Files.isReadable(definitionPath)) {
            throw new DefinitionException("Definition file not found or not readable: " + definitionPath);
        }
        try {
            log.debug("Loading definition from: {}", definitionPath);
            ApiDefinitionFile file = YAML_MAPPER.readValue(definitionPath.toFile(), ApiDefinitionFile.class);
            ApiDefinition definition = link(file == null ? emptyFile() : file);
            log.info("Loaded definition from: {} ({} routes, {} shapes)",
                definitionPath, definition.routes().size(), definition.shapes().size());
            return definition;
        } catch (IOException e) {
            throw new DefinitionException("Failed to parse definition file: " + definitionPath, e);
        }
    }

    /**
     * Reads a definition from text.
     *
     * @param content YAML or JSON content
     * @return linked definition
     */
    public static ApiDefinition read(String content) {
        try {
            ApiDefinitionFile file = YAML_MAPPER.readValue(content, ApiDefinitionFile.class);
            return link(file == null ? emptyFile() : file);
        } catch (IOException e) {
            throw new DefinitionException("Failed to parse definition: " + e.getMessage(), e);
        }
    }

    /**
     * Links a parsed definition.
     *
     * @param file parsed file
     * @return linked definition
     */
    public static ApiDefinition link(ApiDefinitionFile file) {
        return new Linker(file).link();
    }

    private static ApiDefinitionFile emptyFile() {
        return new ApiDefinitionFile(null, null, null, null, null, null);
    }

    /**
     * State of one linking pass.
     */
    private static final class Linker {
        private final ApiDefinitionFile file;
        private final Map<String, DescriptorDefinition> descriptorDefinitions = new LinkedHashMap<>();
        private final Map<String, DataShapeDescriptor> descriptors = new HashMap<>();
        private final LinkedHashSet<String> resolving = new LinkedHashSet<>();
        private final Map<String, ShapeDeclaration> shapes = new LinkedHashMap<>();
        private final Map<String, PaginationStrategy> paginations = new LinkedHashMap<>();
        private final Map<String, HandlerDefinition> handlers = new LinkedHashMap<>();
        private final DefaultFieldSchemaIntrospector introspector = new DefaultFieldSchemaIntrospector();

        private Linker(ApiDefinitionFile file) {
            this.file = file;
        }

        private ApiDefinition link() {
            for (DescriptorDefinition definition : file.descriptors()) {
                requireName(definition.name(), "descriptor");
                if (descriptorDefinitions.put(definition.name(), definition) != null) {
                    throw new DefinitionException("Duplicate descriptor: " + definition.name());
                }
            }
            for (DescriptorDefinition definition : file.descriptors()) {
                shapes.put(definition.name(), descriptor(definition.name()));
            }
            for (FamilyDefinition family : file.families()) {
                requireName(family.name(), "family");
                if (shapes.containsKey(family.name())) {
                    throw new DefinitionException("Duplicate shape name: " + family.name());
                }
                shapes.put(family.name(), family(family));
            }
            linkPaginations();
            for (HandlerDefinition handler : file.handlers()) {
                requireName(handler.name(), "handler");
                handlers.put(handler.name(), handler);
            }

            List<Route> routes = new ArrayList<>();
            for (RouteDefinition route : file.routes()) {
                routes.add(route(route));
            }
            return new ApiDefinition(routes, shapes, models());
        }

        private DataShapeDescriptor descriptor(String name) {
            DataShapeDescriptor built = descriptors.get(name);
            if (built != null) {
                return built;
            }
            DescriptorDefinition definition = descriptorDefinitions.get(name);
            if (definition == null) {
                throw new DefinitionException("Unknown descriptor: " + name);
            }
            if (!resolving.add(name)) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String step : resolving) {
                    inCycle = inCycle || step.equals(name);
                    if (inCycle) {
                        cycle.add(step);
                    }
                }
                cycle.add(name);
                throw new CyclicDescriptorException(cycle);
            }

            DataShapeDescriptor.Builder builder = DataShapeDescriptor.builder(name)
                .documentation(definition.documentation())
                .many(definition.many());
            for (FieldDefinition field : definition.fields()) {
                builder.field(field(name, field));
            }
            definition.errors().forEach(builder::errorStatus);

            resolving.remove(name);
            DataShapeDescriptor descriptor = builder.build();
            descriptors.put(name, descriptor);
            return descriptor;
        }

        private DeclaredField field(String owner, FieldDefinition definition) {
            String name = definition.name() == null ? "item" : definition.name();
            FieldKind kind = enumValue(FieldKind.class, definition.kind() == null ? "primitive" : definition.kind(),
                "field kind of " + owner + "." + name);

            DeclaredField field = switch (kind) {
                case PRIMITIVE -> {
                    PrimitiveType type = definition.type() == null
                        ? PrimitiveType.STRING
                        : enumValue(PrimitiveType.class, definition.type(), "type of " + owner + "." + name);
                    yield type == PrimitiveType.CHOICE
                        ? DeclaredField.choice(name, definition.choices())
                        : DeclaredField.primitive(name, type);
                }
                case LIST -> DeclaredField.listOf(name,
                    definition.child() == null ? null : field(owner, definition.child()));
                case NESTED -> {
                    if (definition.descriptor() == null) {
                        throw new DefinitionException("Nested field " + owner + "." + name + " names no descriptor");
                    }
                    yield DeclaredField.nested(name, descriptor(definition.descriptor()));
                }
                case HIDDEN -> DeclaredField.hidden(name);
                case DICT -> DeclaredField.dict(name);
                case JSON -> DeclaredField.json(name);
            };

            if (definition.required()) {
                field = field.asRequired();
            }
            if (definition.readOnly()) {
                field = field.asReadOnly();
            }
            return field.withLabel(definition.label()).withHelpText(definition.helpText());
        }

        private VersionedShape family(FamilyDefinition family) {
            if (family.versions().isEmpty()) {
                throw new DefinitionException("Family " + family.name() + " declares no versions");
            }
            VersionMap.Builder versions = VersionMap.builder();
            for (VersionEntryDefinition entry : family.versions()) {
                try {
                    versions.when(entry.when(), descriptor(entry.descriptor()));
                } catch (VersionParseException e) {
                    throw new DefinitionException(
                        "Invalid version constraint '" + entry.when() + "' in family " + family.name(), e);
                }
            }
            return new VersionedShape(family.name(), family.documentation(), versions.build());
        }

        private void linkPaginations() {
            Map<String, PaginationDefinition> definitions = new LinkedHashMap<>();
            for (PaginationDefinition definition : file.paginations()) {
                requireName(definition.name(), "pagination");
                definitions.put(definition.name(), definition);
                if (definition.defaultStrategy() == null) {
                    PaginationStyle style = definition.style() == null
                        ? PaginationStyle.CUSTOM
                        : enumValue(PaginationStyle.class, definition.style(), "style of pagination " + definition.name());
                    paginations.put(definition.name(), PaginationStrategy.of(definition.name(), style));
                }
            }
            for (PaginationDefinition definition : definitions.values()) {
                if (definition.defaultStrategy() == null) {
                    continue;
                }
                PaginationStrategy target = paginations.get(definition.defaultStrategy());
                if (target == null || target.defaultStrategy() != null) {
                    throw new DefinitionException("Pagination " + definition.name()
                        + " must forward to a declared concrete strategy, not " + definition.defaultStrategy());
                }
                paginations.put(definition.name(), PaginationStrategy.proxy(definition.name(), target));
            }
        }

        private Route route(RouteDefinition definition) {
            if (definition.path() == null || definition.method() == null) {
                throw new DefinitionException("Route needs a path and a method: " + definition);
            }
            HandlerDefinition handler = handlers.get(definition.handler());
            if (handler == null) {
                throw new DefinitionException("Unknown handler '" + definition.handler() + "' on route "
                    + definition.method() + " " + definition.path());
            }

            RouteHandler.Builder builder = RouteHandler.builder(handler.name())
                .action(definition.action())
                .description(handler.description())
                .request(shape(handler.request()))
                .response(shape(handler.response()))
                .serializer(shape(handler.serializer()))
                .pagination(pagination(handler.pagination()))
                .model(handler.model())
                .lookup(handler.lookupField(), handler.lookupValuePattern())
                .excludeFromSchema(handler.excludeFromSchema());
            handler.parserMediaTypes().forEach(builder::parserMediaType);
            handler.requiredPermissions().forEach(builder::requiredPermission);
            for (FilterDefinition filter : handler.filters()) {
                builder.filterField(filterField(handler.name(), filter));
            }
            return new Route(definition.path(), definition.method(), builder.build());
        }

        private FieldDescriptor filterField(String handler, FilterDefinition filter) {
            requireName(filter.name(), "filter of handler " + handler);
            PrimitiveType type = filter.type() == null
                ? PrimitiveType.STRING
                : enumValue(PrimitiveType.class, filter.type(), "type of filter " + filter.name());
            return new FieldDescriptor(
                filter.name(),
                FieldLocation.QUERY,
                filter.required(),
                introspector.toSchema(DeclaredField.primitive(filter.name(), type)),
                filter.description()
            );
        }

        private ShapeDeclaration shape(String name) {
            if (name == null) {
                return null;
            }
            ShapeDeclaration shape = shapes.get(name);
            if (shape == null) {
                throw new DefinitionException("Unknown descriptor or family: " + name);
            }
            return shape;
        }

        private PaginationStrategy pagination(String name) {
            if (name == null) {
                return null;
            }
            PaginationStrategy strategy = paginations.get(name);
            if (strategy == null) {
                throw new DefinitionException("Unknown pagination: " + name);
            }
            return strategy;
        }

        private ModelMetadataProvider models() {
            Map<String, Map<String, ModelFieldMetadata>> models = new HashMap<>();
            for (ModelDefinition model : file.models()) {
                requireName(model.name(), "model");
                String modelVerboseName = model.verboseName() == null ? model.name() : model.verboseName();
                Map<String, ModelFieldMetadata> fields = new HashMap<>();
                for (ModelFieldDefinition field : model.fields()) {
                    requireName(field.name(), "field of model " + model.name());
                    fields.put(field.name(), new ModelFieldMetadata(
                        modelVerboseName, field.verboseName(), field.helpText(), field.primaryKey(), field.autoIncrement()));
                }
                models.put(model.name(), Map.copyOf(fields));
            }
            Map<String, Map<String, ModelFieldMetadata>> frozen = Map.copyOf(models);
            return (model, field) -> Optional.ofNullable(frozen.getOrDefault(model, Map.of()).get(field));
        }

        private static void requireName(String name, String what) {
            if (name == null || name.isBlank()) {
                throw new DefinitionException("A " + what + " has no name");
            }
        }

        private static <E extends Enum<E>> E enumValue(Class<E> type, String value, String what) {
            try {
                return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new DefinitionException("Unknown " + what + ": " + value, e);
            }
        }
    }
}
