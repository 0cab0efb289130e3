package com.hotride.auth.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerifyPhoneRequest {

    @NotBlank(message = "Phone number is required")
    private String phone;

    @NotBlank(message = "Code is required")
    private String code;
}
