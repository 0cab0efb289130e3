package com.hotride.auth.client;

/**
 * @param token opaque bearer token; the client never inspects it
 */
public record Session(String token, UserSnapshot user) {

    @Override
    public String toString() {
        return "Session[token=[REDACTED], user=" + (user == null ? null : user.id()) + "]";
    }
}
