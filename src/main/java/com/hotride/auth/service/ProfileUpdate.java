package com.hotride.auth.service;

/**
 * Partial edit of a profile; {@code null} fields are left unchanged.
 */
public record ProfileUpdate(String fullName, String profilePictureRef, String phone) {
}
