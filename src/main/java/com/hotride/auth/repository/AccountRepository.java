package com.hotride.auth.repository;

import com.hotride.auth.exception.DuplicateIdentifierException;
import com.hotride.auth.model.Account;
import com.hotride.auth.model.AuthProvider;

import java.util.Optional;
import java.util.UUID;

public interface AccountRepository {

    /**
     * Persist a new account together with the claim on its email. Fails if another account
     * already holds that email.
     *
     * @throws DuplicateIdentifierException when the email claim already exists
     */
    Account create(Account account);

    Account save(Account account);

    /**
     * Save an account whose verified phone changed. The claim on its verified phone, if it has one, is
     * taken and the claim on {@code releasedPhone}, if given, is dropped in the same write.
     *
     * @throws DuplicateIdentifierException when another account holds the phone claim
     */
    Account saveWithPhoneClaim(Account account, String releasedPhone);

    Optional<Account> findById(UUID id);

    Optional<Account> findByEmail(String email);

    /**
     * The account that has verified this phone, if any. Unverified phone entries never match.
     */
    Optional<Account> findByVerifiedPhone(String phone);

    Optional<Account> findByProviderSubject(AuthProvider provider, String subject);
}
