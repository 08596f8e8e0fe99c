package com.apischema.cli;

import com.apischema.core.config.ConfigLoader;
import com.apischema.core.config.SchemaConfig;
import com.apischema.core.definition.ApiDefinition;
import com.apischema.core.definition.DefinitionLoader;
import com.apischema.core.generator.ApiDocumentGenerator;
import com.apischema.core.generator.LinkCompiler;
import com.apischema.core.model.ApiDocument;
import com.apischema.core.renderer.ApiDocumentWriter;
import com.apischema.core.renderer.DocumentFormat;
import com.apischema.core.route.DeclaredPermissionChecker;
import com.apischema.core.route.RequestContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to generate the API document of a definition file.
 *
 * <p>Exit codes: {@code 0} document written, {@code 2} nothing to document,
 * {@code 1} definition or version error.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print the document for the configured version as JSON
 * apischema generate api.yaml
 *
 * # Document version 1.5 for a caller holding one permission, as YAML, into a file
 * apischema generate api.yaml --api-version 1.5 --private --grant users.view -f yaml -o schema.yaml
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate the API document for a version",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final int EXIT_EMPTY = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "API definition file (YAML or JSON)")
    private Path definitionPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: apischema.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-a", "--api-version"}, description = "API version to document (default: configured version)")
    private String apiVersion;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "JSON"
    )
    private DocumentFormat format;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path outputFile;

    @Option(names = {"--private"}, description = "Only document routes the granted permissions allow")
    private boolean privateView;

    @Option(names = {"--grant"}, description = "Permission held by the caller, repeatable")
    private List<String> grants = new ArrayList<>();

    @Option(names = {"--base-url"}, description = "Document URL when none is configured")
    private String baseUrl;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            SchemaConfig config = ConfigLoader.load(configPath);
            ApiDefinition definition = DefinitionLoader.load(definitionPath);

            ApiDocumentGenerator generator = new ApiDocumentGenerator(
                config,
                definition.routeTable(),
                new DeclaredPermissionChecker(),
                new LinkCompiler(config.generation(), definition.models())
            );
            RequestContext request = new RequestContext(apiVersion, !privateView, baseUrl, new LinkedHashSet<>(grants));

            Optional<ApiDocument> document = generator.generate(request);
            if (document.isEmpty()) {
                err.println("No routes to document for this caller and version");
                return EXIT_EMPTY;
            }

            ApiDocumentWriter writer = new ApiDocumentWriter();
            if (outputFile != null) {
                writer.write(document.get(), format, outputFile);
                out.println("Wrote " + format.extension() + " document to: " + outputFile);
            } else {
                out.println(writer.render(document.get(), format));
            }
            out.flush();
            return 0;

        } catch (RuntimeException e) {
            log.error("Generate failed", e);
            err.println("Generate failed: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
