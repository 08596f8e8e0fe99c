package com.apischema.core.version;

import com.apischema.core.descriptor.DataShapeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the descriptor of a {@link VersionMap} that applies to a runtime version.
 */
public final class VersionResolver {

    private static final Logger log = LoggerFactory.getLogger(VersionResolver.class);

    private VersionResolver() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns the descriptor of the first entry whose every clause holds for
     * {@code runtimeVersion}.
     *
     * @param versionMap candidate entries in priority order
     * @param runtimeVersion version requested at runtime
     * @return matching descriptor
     * @throws VersionParseException if the runtime version is malformed
     * @throws NoMatchingVersionException if no entry matches
     */
    public static DataShapeDescriptor resolve(VersionMap versionMap, String runtimeVersion) {
        SemanticVersion version = SemanticVersion.parse(runtimeVersion);

        for (VersionMap.Entry entry : versionMap.entries()) {
            if (entry.constraint().matches(version)) {
                log.debug("Version {} matched '{}' -> {}", runtimeVersion, entry.constraint(), entry.descriptor().name());
                return entry.descriptor();
            }
        }

        log.debug("Version {} matched none of {} entries", runtimeVersion, versionMap.entries().size());
        throw new NoMatchingVersionException(runtimeVersion);
    }
}
