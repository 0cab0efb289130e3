package com.hotride.auth.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for resetting a password with a verified reset token.
 * Used by POST /auth/password/reset.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResetPasswordRequest {

    @NotBlank(message = "Reset token is required")
    private String resetToken;

    @NotBlank(message = "New password is required")
    private String newPassword;

    @Override
    public String toString() {
        return "ResetPasswordRequest{resetToken='[REDACTED]', newPassword='[REDACTED]'}";
    }
}
