package com.codeheadsystems.totp.cli.lookup;

/**
 * Resolves the base32 shared secret stored for an account.
 */
@FunctionalInterface
public interface SecretLookup {

  /**
   * Lookup secret.
   *
   * @param accountId the account id
   * @return the base32 secret text
   * @throws SecretNotFoundException if nothing is stored for the account
   */
  String lookupSecret(String accountId);
}
