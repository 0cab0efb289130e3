package com.hotride.auth.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for PATCH /users/me. Absent fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfileUpdateRequest {

    @Size(max = 100, message = "Full name must be at most 100 characters")
    private String fullName;

    private String profilePictureRef;

    private String phone;
}
