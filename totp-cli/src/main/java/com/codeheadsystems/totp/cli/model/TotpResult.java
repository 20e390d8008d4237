package com.codeheadsystems.totp.cli.model;

/**
 * A generated code and how long it stays current.
 *
 * @param accountId        the account the code was generated for
 * @param code             the zero-padded code
 * @param secondsRemaining seconds until the next time step
 */
public record TotpResult(String accountId, String code, int secondsRemaining) {
}
