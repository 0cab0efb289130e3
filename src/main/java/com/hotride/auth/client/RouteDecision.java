package com.hotride.auth.client;

public sealed interface RouteDecision permits RouteDecision.Allow, RouteDecision.RedirectTo {

    record Allow() implements RouteDecision {
    }

    record RedirectTo(Route target) implements RouteDecision {
    }

    static RouteDecision allow() {
        return new Allow();
    }

    static RouteDecision redirectTo(Route target) {
        return new RedirectTo(target);
    }
}
