package com.hotride.auth.dto;

import com.hotride.auth.model.Account;
import com.hotride.auth.model.AccountState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of an account. Never carries the password hash or provider subject.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private String id;
    private String email;
    private String phone;
    private String fullName;
    private String profilePictureRef;
    private String authProvider;
    private boolean emailVerified;
    private boolean phoneVerified;
    private boolean profileComplete;

    public static UserResponse from(Account account) {
        return new UserResponse(
                account.getId().toString(),
                account.getEmail(),
                account.getPhone(),
                account.getFullName(),
                account.getProfilePictureRef(),
                account.getAuthProvider().wireName(),
                Boolean.TRUE.equals(account.getEmailVerified()),
                Boolean.TRUE.equals(account.getPhoneVerified()),
                account.currentState() == AccountState.PROFILE_COMPLETE);
    }
}
