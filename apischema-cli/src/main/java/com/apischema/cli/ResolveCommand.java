package com.apischema.cli;

import com.apischema.core.definition.ApiDefinition;
import com.apischema.core.definition.DefinitionLoader;
import com.apischema.core.descriptor.DataShapeDescriptor;
import com.apischema.core.descriptor.ShapeDeclaration;
import com.apischema.core.version.NoMatchingVersionException;
import com.apischema.core.version.VersionParseException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command printing the descriptor a shape selects for a version.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * apischema resolve api.yaml UserResponse 1.5
 * # UserLegacy
 * }</pre>
 */
@Command(
    name = "resolve",
    description = "Show which descriptor a shape selects for a version",
    mixinStandardHelpOptions = true
)
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "API definition file (YAML or JSON)")
    private Path definitionPath;

    @Parameters(index = "1", description = "Descriptor or family name")
    private String shapeName;

    @Parameters(index = "2", description = "API version")
    private String version;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ApiDefinition definition = DefinitionLoader.load(definitionPath);
            Optional<ShapeDeclaration> shape = definition.shape(shapeName);
            if (shape.isEmpty()) {
                err.println("Unknown shape: " + shapeName);
                err.flush();
                return 1;
            }

            DataShapeDescriptor descriptor = shape.get().resolve(version);
            log.debug("{} resolves to {} for version {}", shapeName, descriptor.name(), version);
            out.println(descriptor.name());
            out.flush();
            return 0;

        } catch (NoMatchingVersionException | VersionParseException e) {
            err.println(e.getMessage());
            err.flush();
            return 1;
        } catch (RuntimeException e) {
            log.error("Resolve failed", e);
            err.println("Resolve failed: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
