package com.hotride.auth.service.credential;

import com.hotride.auth.model.Account;

/**
 * The account a credential resolved to, and whether this sign-in created it.
 */
public record AccountIdentity(Account account, boolean created) {
}
