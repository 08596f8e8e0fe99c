package com.apischema.core.route;

/**
 * Decides whether a caller may see a route in the generated document.
 */
@FunctionalInterface
public interface PermissionChecker {

    /**
     * Checks visibility.
     *
     * @param route candidate route
     * @param request requesting caller
     * @return true if the route is documented for this caller
     */
    boolean isVisible(Route route, RequestContext request);

    /**
     * Returns a checker that shows everything.
     *
     * @return permissive checker
     */
    static PermissionChecker allowAll() {
        return (route, request) -> true;
    }
}
