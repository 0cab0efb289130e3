package com.hotride.auth.service.credential;

/**
 * @param identifier an email address or phone number, told apart by shape
 */
public record PasswordCredential(String identifier, String password) implements Credential {

    @Override
    public String toString() {
        return "PasswordCredential[identifier=" + identifier + ", password=[REDACTED]]";
    }
}
