package com.apischema.core.generator;

import com.apischema.core.config.SchemaConfig.GenerationSettings;
import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.ShapeDeclaration;
import com.apischema.core.introspect.DefaultFieldSchemaIntrospector;
import com.apischema.core.introspect.DefaultParameterExtractor;
import com.apischema.core.introspect.ModelFieldMetadata;
import com.apischema.core.introspect.ModelMetadataProvider;
import com.apischema.core.model.FieldDescriptor;
import com.apischema.core.model.FieldLocation;
import com.apischema.core.model.Link;
import com.apischema.core.model.SchemaFragment;
import com.apischema.core.model.SchemaType;
import com.apischema.core.route.Route;
import com.apischema.core.route.RouteHandler;
import com.apischema.core.util.Docs;
import com.apischema.core.util.PathTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles one route into a {@link Link}.
 *
 * <p>Fields are gathered in this order: path variables, request body or query fields,
 * pagination fields, filter fields. The response descriptor is the declared response
 * (resolved by version when it is a versioned family) or, for {@code list} and
 * {@code retrieve} actions, the handler's generic serializer, wrapped in a pagination
 * envelope for {@code list}.
 *
 * <p>Version errors ({@link com.apischema.core.version.VersionParseException},
 * {@link com.apischema.core.version.NoMatchingVersionException}) propagate to the caller.
 * Problems confined to the route raise {@link LinkCompilationException}.
 */
public class LinkCompiler {

    private static final Logger log = LoggerFactory.getLogger(LinkCompiler.class);

    static final String REQUEST_DESCRIPTION_HEADING = "\n\n**Request Description:**\n";
    static final String RESPONSE_DESCRIPTION_HEADING = "\n\n**Response Description:**\n";

    private static final String LIST_ACTION = "list";
    private static final String RETRIEVE_ACTION = "retrieve";
    private static final Set<String> FILTERABLE_ACTIONS = Set.of("list", "retrieve", "update", "partial_update", "destroy");
    private static final Set<String> FILTERABLE_METHODS = Set.of("GET", "PUT", "PATCH", "DELETE");

    private final FieldDeriver fieldDeriver;
    private final ResponseSchemaComposer responseComposer;
    private final PaginationShapeSynthesizer paginationSynthesizer;
    private final ModelMetadataProvider modelMetadata;
    private final GenerationSettings settings;

    /**
     * Creates a compiler with the default introspector and parameter extractor.
     *
     * @param settings generation settings
     * @param modelMetadata model metadata for path variables
     */
    public LinkCompiler(GenerationSettings settings, ModelMetadataProvider modelMetadata) {
        this(new FieldDeriver(new DefaultFieldSchemaIntrospector()), settings, modelMetadata);
    }

    private LinkCompiler(FieldDeriver fieldDeriver, GenerationSettings settings, ModelMetadataProvider modelMetadata) {
        this(fieldDeriver,
            new ResponseSchemaComposer(fieldDeriver, new DefaultParameterExtractor()),
            new PaginationShapeSynthesizer(),
            settings,
            modelMetadata);
    }

    public LinkCompiler(FieldDeriver fieldDeriver,
                        ResponseSchemaComposer responseComposer,
                        PaginationShapeSynthesizer paginationSynthesizer,
                        GenerationSettings settings,
                        ModelMetadataProvider modelMetadata) {
        this.fieldDeriver = Objects.requireNonNull(fieldDeriver, "fieldDeriver must not be null");
        this.responseComposer = Objects.requireNonNull(responseComposer, "responseComposer must not be null");
        this.paginationSynthesizer = Objects.requireNonNull(paginationSynthesizer, "paginationSynthesizer must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.modelMetadata = Objects.requireNonNull(modelMetadata, "modelMetadata must not be null");
    }

    /**
     * Compiles a route.
     *
     * @param route route to document
     * @param runtimeVersion API version being documented
     * @return compiled link
     * @throws LinkCompilationException if the route cannot be documented
     */
    public Link compile(Route route, String runtimeVersion) {
        String path = route.path();
        String method = route.method();
        RouteHandler handler = route.handler();
        String action = handler.actionFor(method);

        if (!PathTemplates.isWellFormed(path)) {
            throw new LinkCompilationException("Malformed path template: " + path);
        }

        List<FieldDescriptor> fields = new ArrayList<>(pathFields(path, handler));
        fields.addAll(requestFields(method, handler, runtimeVersion));
        if (isListView(path, method, handler) && handler.pagination() != null) {
            fields.addAll(handler.pagination().queryFields());
        }
        if (allowsFilters(method, handler)) {
            fields.addAll(handler.filterFields());
        }

        String encoding = fields.stream().anyMatch(field -> field.location().isBody())
            ? encodingFor(handler)
            : null;

        String handlerDoc = Docs.normalize(handler.description());
        StringBuilder description = new StringBuilder(handlerDoc);

        ShapeDeclaration requestDeclaration = handler.request();
        if (requestDeclaration != null && requestDeclaration.isVersioned()) {
            String requestDoc = Docs.normalize(requestDeclaration.documentation());
            if (!requestDoc.isEmpty()) {
                description.append(REQUEST_DESCRIPTION_HEADING).append(requestDoc);
            }
        }

        DataShapeDescriptor response = null;
        ShapeDeclaration responseDeclaration = handler.response();
        if (responseDeclaration != null) {
            response = responseDeclaration.resolve(runtimeVersion);
            if (responseDeclaration.isVersioned()) {
                String responseDoc = Docs.normalize(response.documentation());
                if (responseDoc.isEmpty()) {
                    responseDoc = Docs.normalize(responseDeclaration.documentation());
                }
                if (!responseDoc.isEmpty()) {
                    description.append(RESPONSE_DESCRIPTION_HEADING).append(responseDoc);
                }
            }
        } else if ((LIST_ACTION.equals(action) || RETRIEVE_ACTION.equals(action)) && handler.serializer() != null) {
            response = handler.serializer().resolve(runtimeVersion);
            if (LIST_ACTION.equals(action)) {
                response = paginationSynthesizer.wrap(response, handler.pagination());
            }
        }

        ComposedResponse composed = response == null
            ? ComposedResponse.empty()
            : responseComposer.compose(response, handlerDoc.isEmpty() ? null : handlerDoc);

        log.debug("Compiled {} {} ({}) with {} fields", method, path, handler.name(), fields.size());

        return new Link(
            path.replace(PathTemplates.VERSION_PLACEHOLDER, runtimeVersion),
            method.toLowerCase(Locale.ROOT),
            encoding,
            description.toString(),
            fields,
            composed.responseSchema(),
            composed.errorStatusCodes()
        );
    }

    /**
     * Returns one required {@code path} field per template variable except the version.
     */
    List<FieldDescriptor> pathFields(String path, RouteHandler handler) {
        List<FieldDescriptor> fields = new ArrayList<>();

        for (String variable : PathTemplates.variables(path)) {
            if (PathTemplates.VERSION_VARIABLE.equals(variable)) {
                continue;
            }

            String title = null;
            String description = null;
            SchemaType type = SchemaType.STRING;
            String pattern = null;

            Optional<ModelFieldMetadata> metadata = handler.model() == null
                ? Optional.empty()
                : modelMetadata.lookup(handler.model(), variable);

            if (metadata.isPresent()) {
                ModelFieldMetadata field = metadata.get();
                title = field.verboseName();
                if (field.helpText() != null && !field.helpText().isBlank()) {
                    description = field.helpText();
                } else if (field.primaryKey()) {
                    description = primaryKeyDescription(field);
                }
            }

            if (handler.lookupValuePattern() != null && variable.equals(handler.lookupField())) {
                pattern = validatedPattern(handler);
            } else if (metadata.map(ModelFieldMetadata::autoIncrement).orElse(false)) {
                type = SchemaType.INTEGER;
            }

            fields.add(new FieldDescriptor(
                variable,
                FieldLocation.PATH,
                true,
                SchemaFragment.of(type, title, description).withPattern(pattern),
                null
            ));
        }
        return fields;
    }

    private List<FieldDescriptor> requestFields(String method, RouteHandler handler, String runtimeVersion) {
        ShapeDeclaration declaration = handler.request() != null ? handler.request() : handler.serializer();
        if (declaration == null) {
            return List.of();
        }
        return fieldDeriver.requestFields(declaration.resolve(runtimeVersion), method);
    }

    private String encodingFor(RouteHandler handler) {
        return handler.parserMediaTypes().isEmpty()
            ? settings.defaultEncoding()
            : handler.parserMediaTypes().get(0);
    }

    private static String primaryKeyDescription(ModelFieldMetadata field) {
        String valueType = field.autoIncrement() ? "unique integer value" : "unique value";
        String model = field.modelVerboseName() == null ? "object" : field.modelVerboseName();
        return "A " + valueType + " identifying this " + model + ".";
    }

    private static String validatedPattern(RouteHandler handler) {
        try {
            Pattern.compile(handler.lookupValuePattern());
        } catch (PatternSyntaxException e) {
            throw new LinkCompilationException(
                "Invalid lookup value pattern on " + handler.name() + ": " + handler.lookupValuePattern(), e);
        }
        return handler.lookupValuePattern();
    }

    /**
     * A list view returns a collection: the {@code list} action, or for plain handlers a
     * GET whose path does not end in a variable.
     */
    static boolean isListView(String path, String method, RouteHandler handler) {
        if (handler.hasAction()) {
            return LIST_ACTION.equals(handler.action());
        }
        if (!"GET".equals(method)) {
            return false;
        }
        List<String> segments = PathTemplates.keySegments(path);
        return segments.isEmpty() || !PathTemplates.isVariable(segments.get(segments.size() - 1));
    }

    static boolean allowsFilters(String method, RouteHandler handler) {
        if (handler.hasAction()) {
            return FILTERABLE_ACTIONS.contains(handler.action());
        }
        return FILTERABLE_METHODS.contains(method);
    }
}
