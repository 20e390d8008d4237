package com.codeheadsystems.totp.cli.lookup;

/**
 * Thrown when no secret is stored for the requested account.
 */
public class SecretNotFoundException extends RuntimeException {

  private final String accountId;

  /**
   * Instantiates a new Secret not found exception.
   *
   * @param accountId the account id
   */
  public SecretNotFoundException(final String accountId) {
    super("No secret found for account: " + accountId);
    this.accountId = accountId;
  }

  /**
   * Account id.
   *
   * @return the string
   */
  public String accountId() {
    return accountId;
  }
}
