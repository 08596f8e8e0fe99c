package com.apischema.core.route;

import java.util.Set;

/**
 * The request asking for a document.
 *
 * @param version requested API version, may be null
 * @param publicView whether to document every route regardless of permissions
 * @param baseUrl absolute URL of the request, used when no document URL is configured
 * @param grantedPermissions permissions of the caller
 */
public record RequestContext(
    String version,
    boolean publicView,
    String baseUrl,
    Set<String> grantedPermissions
) {
    /**
     * Compact constructor with validation.
     */
    public RequestContext {
        grantedPermissions = grantedPermissions == null ? Set.of() : Set.copyOf(grantedPermissions);
    }

    /**
     * Creates a public request for a version.
     *
     * @param version requested version, may be null
     * @return public request context
     */
    public static RequestContext publicView(String version) {
        return new RequestContext(version, true, null, Set.of());
    }
}
