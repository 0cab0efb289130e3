package com.hotride.auth.service.credential;

public record AppleUserData(String email, String fullName) {
}
