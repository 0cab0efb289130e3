package com.hotride.auth.service;

/**
 * First-time profile completion. {@code phone} is optional, but when present it must already be the
 * account's verified phone.
 */
public record ProfileSetup(String fullName, String profilePictureRef, String phone) {
}
