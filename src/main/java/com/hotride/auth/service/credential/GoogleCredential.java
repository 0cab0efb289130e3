package com.hotride.auth.service.credential;

public record GoogleCredential(String idToken) implements Credential {
}
