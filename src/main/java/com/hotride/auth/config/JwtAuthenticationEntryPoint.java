package com.hotride.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {

        String authHeader = request.getHeader("Authorization");
        boolean hasJwtToken = authHeader != null && authHeader.startsWith("Bearer ");

        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json;charset=UTF-8");

        Map<String, Object> errorResponse = new LinkedHashMap<>();
        if (hasJwtToken) {
            // A token was sent but the filter rejected it
            errorResponse.put("error", "SESSION_EXPIRED");
            errorResponse.put("code", "TOKEN_EXPIRED");
            errorResponse.put("message", "Session expired. Please log in again.");
        } else {
            errorResponse.put("error", "AUTHENTICATION_REQUIRED");
            errorResponse.put("code", "AUTHENTICATION_REQUIRED");
            errorResponse.put("message", "Authentication required");
        }
        errorResponse.put("retryable", false);

        response.getWriter().write(objectMapper.writeValueAsString(errorResponse));
    }
}
