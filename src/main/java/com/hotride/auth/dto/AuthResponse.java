package com.hotride.auth.dto;

import com.hotride.auth.service.AuthResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse {

    private String accessToken;
    private String tokenType;
    private long expiresIn;
    private UserResponse user;

    public static AuthResponse from(AuthResult result) {
        return new AuthResponse(result.accessToken(), "Bearer", result.expiresIn(),
                UserResponse.from(result.account()));
    }
}
