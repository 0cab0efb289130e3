package com.hotride.auth.client;

/**
 * Decides whether a navigation may proceed given whether a session exists. Pure, so callers can
 * re-evaluate it whenever {@link SessionManager} reports a change.
 */
public final class RouteGuard {

    private RouteGuard() {
    }

    public static RouteDecision evaluate(boolean sessionPresent, Route route) {
        if (!sessionPresent && route.access() == Route.Access.PROTECTED) {
            return RouteDecision.redirectTo(Route.LOGIN);
        }
        if (sessionPresent && route == Route.LOGIN) {
            return RouteDecision.redirectTo(Route.HOME);
        }
        return RouteDecision.allow();
    }

    /**
     * Evaluate against the manager's current session.
     *
     * @throws IllegalStateException if the session has not been restored yet
     */
    public static RouteDecision evaluate(SessionManager sessionManager, Route route) {
        return evaluate(sessionManager.isAuthenticated(), route);
    }
}
