package com.hotride.auth.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppleAuthRequest {

    @NotBlank(message = "Apple identity token is required")
    private String identityToken;

    private String nonce;

    /** Sent by the device only on the first Apple consent. */
    private UserData userData;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserData {
        private String email;
        private String fullName;
    }
}
