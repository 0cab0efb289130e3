package com.hotride.auth.controller;

import com.hotride.auth.dto.AppleAuthRequest;
import com.hotride.auth.dto.AuthResponse;
import com.hotride.auth.dto.EmailRequest;
import com.hotride.auth.dto.GoogleAuthRequest;
import com.hotride.auth.dto.LoginRequest;
import com.hotride.auth.dto.RegisterRequest;
import com.hotride.auth.dto.ResetPasswordRequest;
import com.hotride.auth.dto.VerifyEmailRequest;
import com.hotride.auth.service.AccountLifecycleService;
import com.hotride.auth.service.PasswordResetService;
import com.hotride.auth.service.credential.AppleUserData;
import com.hotride.auth.service.verification.IssuedCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Registration, verification and sign-in")
public class AuthController {

    private final AccountLifecycleService accountLifecycleService;
    private final PasswordResetService passwordResetService;

    @PostMapping("/register")
    @Operation(summary = "Register with email and password", description = "Creates an unverified account and emails a verification code")
    public ResponseEntity<Map<String, String>> register(@Valid @RequestBody RegisterRequest request) {
        accountLifecycleService.register(request.getFullName(), request.getEmail(), request.getPassword());

        Map<String, String> response = new HashMap<>();
        response.put("message", "Account created. Please check your email for a verification code.");
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @PostMapping("/verify-email")
    @Operation(summary = "Verify email", description = "Redeems the emailed code and starts a session")
    public ResponseEntity<AuthResponse> verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
        return ResponseEntity.ok(AuthResponse.from(
                accountLifecycleService.verifyEmail(request.getEmail(), request.getCode())));
    }

    @PostMapping("/resend-email-code")
    @Operation(summary = "Resend email verification code")
    public ResponseEntity<Map<String, String>> resendEmailCode(@Valid @RequestBody EmailRequest request) {
        IssuedCode issued = accountLifecycleService.resendEmailCode(request.getEmail());
        return ResponseEntity.ok(codeSent("Verification code sent.", issued));
    }

    @PostMapping("/login")
    @Operation(summary = "Log in with email or phone and password")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(AuthResponse.from(
                accountLifecycleService.login(request.getIdentifier(), request.getPassword())));
    }

    @PostMapping("/google")
    @Operation(summary = "Sign in with Google", description = "Verifies a Google ID token; creates the account on first sign-in")
    public ResponseEntity<AuthResponse> google(@Valid @RequestBody GoogleAuthRequest request) {
        return ResponseEntity.ok(AuthResponse.from(accountLifecycleService.loginWithGoogle(request.getIdToken())));
    }

    @PostMapping("/apple")
    @Operation(summary = "Sign in with Apple", description = "Verifies an Apple identity token and nonce; creates the account on first sign-in")
    public ResponseEntity<AuthResponse> apple(@Valid @RequestBody AppleAuthRequest request) {
        AppleUserData userData = request.getUserData() == null ? null
                : new AppleUserData(request.getUserData().getEmail(), request.getUserData().getFullName());
        return ResponseEntity.ok(AuthResponse.from(
                accountLifecycleService.loginWithApple(request.getIdentityToken(), request.getNonce(), userData)));
    }

    @PostMapping("/password/forgot")
    @Operation(summary = "Request a password reset code", description = "Always succeeds to avoid revealing which emails have accounts")
    public ResponseEntity<Map<String, String>> forgotPassword(@Valid @RequestBody EmailRequest request) {
        passwordResetService.requestPasswordReset(request.getEmail());
        return ResponseEntity.ok(Map.of("message", "If an account exists for this email, a reset code has been sent."));
    }

    @PostMapping("/password/verify-code")
    @Operation(summary = "Exchange a reset code for a reset token")
    public ResponseEntity<Map<String, String>> verifyResetCode(@Valid @RequestBody VerifyEmailRequest request) {
        String resetToken = passwordResetService.verifyResetCode(request.getEmail(), request.getCode());
        return ResponseEntity.ok(Map.of("resetToken", resetToken));
    }

    @PostMapping("/password/reset")
    @Operation(summary = "Set a new password with a reset token")
    public ResponseEntity<Map<String, String>> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        passwordResetService.resetPassword(request.getResetToken(), request.getNewPassword());
        return ResponseEntity.ok(Map.of("message", "Password updated. Please log in with your new password."));
    }

    static Map<String, String> codeSent(String message, IssuedCode issued) {
        Map<String, String> response = new HashMap<>();
        response.put("message", message);
        response.put("expiresAt", issued.expiresAt().toString());
        return response;
    }
}
