package com.apischema.core.generator;

import com.apischema.core.config.SchemaConfig;
import com.apischema.core.model.ApiDocument;
import com.apischema.core.model.DocumentNode;
import com.apischema.core.model.Link;
import com.apischema.core.route.PermissionChecker;
import com.apischema.core.route.RequestContext;
import com.apischema.core.route.Route;
import com.apischema.core.route.RouteTable;
import com.apischema.core.util.PathTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Generates an {@link ApiDocument} for a request.
 *
 * <p>Routes excluded from the schema are dropped, {@code {pk}} variables are renamed to
 * {@code {id}} when configured, and for non-public requests routes the
 * {@link PermissionChecker} rejects are dropped. Each remaining route is compiled with the
 * {@link LinkCompiler} for the requested version (or the configured one) and the links
 * are assembled into a tree. The stripped path prefix is computed over every candidate
 * route before the permission check, so the tree layout does not depend on the caller. Routes that fail to compile are logged and skipped; version
 * errors propagate.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ApiDocumentGenerator generator = new ApiDocumentGenerator(config, routeTable,
 *     new DeclaredPermissionChecker(), new LinkCompiler(config.generation(), ModelMetadataProvider.none()));
 * Optional<ApiDocument> document = generator.generate(RequestContext.publicView("1.7"));
 * }</pre>
 */
public class ApiDocumentGenerator {

    private static final Logger log = LoggerFactory.getLogger(ApiDocumentGenerator.class);

    static final String PK_PLACEHOLDER = "{pk}";
    static final String ID_PLACEHOLDER = "{id}";

    private final SchemaConfig config;
    private final RouteTable routeTable;
    private final PermissionChecker permissionChecker;
    private final LinkCompiler linkCompiler;
    private final PathTreeAssembler assembler = new PathTreeAssembler();

    public ApiDocumentGenerator(SchemaConfig config,
                                RouteTable routeTable,
                                PermissionChecker permissionChecker,
                                LinkCompiler linkCompiler) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.routeTable = Objects.requireNonNull(routeTable, "routeTable must not be null");
        this.permissionChecker = Objects.requireNonNull(permissionChecker, "permissionChecker must not be null");
        this.linkCompiler = Objects.requireNonNull(linkCompiler, "linkCompiler must not be null");
    }

    /**
     * Generates the document.
     *
     * @param request requesting caller
     * @return document, or empty when the caller can see no route
     * @throws com.apischema.core.version.VersionParseException if a version is malformed
     * @throws com.apischema.core.version.NoMatchingVersionException if a versioned shape has no entry for the version
     */
    public Optional<ApiDocument> generate(RequestContext request) {
        List<Route> candidates = candidateRoutes();
        if (candidates.isEmpty()) {
            log.info("No routes to document");
            return Optional.empty();
        }

        String version = request.version() != null && !request.version().isBlank()
            ? request.version()
            : config.document().version();

        List<String> prefix = PathTemplates.strippablePrefix(candidates.stream().map(Route::path).toList());

        List<PlacedLink> links = new ArrayList<>();
        for (Route route : candidates) {
            if (!request.publicView() && !permissionChecker.isVisible(route, request)) {
                log.debug("Route {} {} hidden from caller", route.method(), route.path());
                continue;
            }
            try {
                Link link = linkCompiler.compile(route, version);
                links.add(new PlacedLink(route.path(), route.method(), link));
            } catch (LinkCompilationException e) {
                log.warn("Skipping route {} {}: {}", route.method(), route.path(), e.getMessage());
            }
        }

        DocumentNode content = assembler.assemble(links, prefix);
        if (content.isEmpty()) {
            log.info("Nothing to document for version {}", version);
            return Optional.empty();
        }

        String url = config.document().url() != null ? config.document().url() : request.baseUrl();
        log.info("Generated document for version {} with {} links", version, content.linkCount());
        return Optional.of(new ApiDocument(
            version,
            config.document().title(),
            config.document().description(),
            url,
            content
        ));
    }

    private List<Route> candidateRoutes() {
        boolean coercePk = config.generation().coercePathPk();
        List<Route> routes = new ArrayList<>();
        for (Route route : routeTable.routes()) {
            if (route.handler().excludeFromSchema()) {
                continue;
            }
            routes.add(coercePk ? coercePk(route) : route);
        }
        return routes;
    }

    private static Route coercePk(Route route) {
        if (!route.path().contains(PK_PLACEHOLDER)) {
            return route;
        }
        return route.withPath(route.path().replace(PK_PLACEHOLDER, ID_PLACEHOLDER));
    }
}
