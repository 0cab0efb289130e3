package com.hotride.auth.client;

import java.util.Optional;

@FunctionalInterface
public interface SessionListener {

    void onSessionChanged(Optional<Session> session);
}
