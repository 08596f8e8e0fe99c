package com.apischema.core.route;

/**
 * Shows a route when the caller holds every permission its handler requires.
 */
public class DeclaredPermissionChecker implements PermissionChecker {

    @Override
    public boolean isVisible(Route route, RequestContext request) {
        return request.grantedPermissions().containsAll(route.handler().requiredPermissions());
    }
}
