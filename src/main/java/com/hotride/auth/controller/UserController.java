package com.hotride.auth.controller;

import com.hotride.auth.dto.PhoneCodeRequest;
import com.hotride.auth.dto.ProfileSetupRequest;
import com.hotride.auth.dto.ProfileUpdateRequest;
import com.hotride.auth.dto.UserResponse;
import com.hotride.auth.dto.VerifyPhoneRequest;
import com.hotride.auth.service.AccountLifecycleService;
import com.hotride.auth.service.ProfileSetup;
import com.hotride.auth.service.ProfileUpdate;
import com.hotride.auth.service.verification.IssuedCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/users/me")
@RequiredArgsConstructor
@Tag(name = "Profile", description = "Phone verification and profile of the signed-in rider")
@SecurityRequirement(name = "Bearer Authentication")
public class UserController extends BaseController {

    private final AccountLifecycleService accountLifecycleService;

    @GetMapping
    @Operation(summary = "Get the signed-in rider")
    public ResponseEntity<UserResponse> getCurrentUser(HttpServletRequest httpRequest) {
        UUID accountId = extractAccountId(httpRequest);
        return ResponseEntity.ok(UserResponse.from(accountLifecycleService.currentAccount(accountId)));
    }

    @PatchMapping
    @Operation(summary = "Edit profile", description = "Changing the phone clears its verification")
    public ResponseEntity<UserResponse> updateProfile(@Valid @RequestBody ProfileUpdateRequest request,
                                                      HttpServletRequest httpRequest) {
        UUID accountId = extractAccountId(httpRequest);
        ProfileUpdate update = new ProfileUpdate(request.getFullName(), request.getProfilePictureRef(), request.getPhone());
        return ResponseEntity.ok(UserResponse.from(accountLifecycleService.updateProfile(accountId, update)));
    }

    @PostMapping("/phone/send-code")
    @Operation(summary = "Send a phone verification code")
    public ResponseEntity<Map<String, String>> sendPhoneCode(@Valid @RequestBody PhoneCodeRequest request,
                                                             HttpServletRequest httpRequest) {
        UUID accountId = extractAccountId(httpRequest);
        IssuedCode issued = accountLifecycleService.sendPhoneCode(accountId, request.getPhone());
        return ResponseEntity.ok(AuthController.codeSent("Verification code sent.", issued));
    }

    @PostMapping("/phone/verify")
    @Operation(summary = "Verify phone", description = "Marks the phone verified; does not start a new session")
    public ResponseEntity<UserResponse> verifyPhone(@Valid @RequestBody VerifyPhoneRequest request,
                                                    HttpServletRequest httpRequest) {
        UUID accountId = extractAccountId(httpRequest);
        return ResponseEntity.ok(UserResponse.from(
                accountLifecycleService.verifyPhone(accountId, request.getPhone(), request.getCode())));
    }

    @PostMapping("/profile")
    @Operation(summary = "Complete profile setup")
    public ResponseEntity<UserResponse> completeProfile(@Valid @RequestBody ProfileSetupRequest request,
                                                        HttpServletRequest httpRequest) {
        UUID accountId = extractAccountId(httpRequest);
        ProfileSetup setup = new ProfileSetup(request.getFullName(), request.getProfilePictureRef(), request.getPhone());
        return ResponseEntity.ok(UserResponse.from(accountLifecycleService.completeProfile(accountId, setup)));
    }
}
