package com.codeheadsystems.totp.cli.manager;

import com.codeheadsystems.totp.cli.lookup.SecretLookup;
import com.codeheadsystems.totp.cli.model.TotpResult;
import com.codeheadsystems.totp.rfc6238.TotpConfig;
import com.codeheadsystems.totp.rfc6238.TotpGenerator;
import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the current code for a named account.
 */
@Singleton
public class TotpManager {

  private static final Logger log = LoggerFactory.getLogger(TotpManager.class);

  private final SecretLookup secretLookup;
  private final TotpGenerator generator;
  private final TotpConfig config;
  private final Clock clock;

  /**
   * Production constructor, default profile and the system clock.
   *
   * @param secretLookup the secret lookup
   * @param generator    the generator
   */
  @Inject
  public TotpManager(final SecretLookup secretLookup, final TotpGenerator generator) {
    this(secretLookup, generator, TotpConfig.DEFAULT, Clock.systemUTC());
  }

  /**
   * Instantiates a new Totp manager.
   *
   * @param secretLookup the secret lookup
   * @param generator    the generator
   * @param config       the step and digit count
   * @param clock        the clock, read once per code
   */
  public TotpManager(final SecretLookup secretLookup, final TotpGenerator generator,
                     final TotpConfig config, final Clock clock) {
    log.info("TotpManager({}, {})", secretLookup, config);
    this.secretLookup = secretLookup;
    this.generator = generator;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Generates the code for the account at the current time. Lookup failures propagate unchanged.
   *
   * @param accountId the account id
   * @return the totp result
   */
  public TotpResult totpFor(final String accountId) {
    log.trace("totpFor(accountId={})", accountId);
    final String secret = secretLookup.lookupSecret(accountId);
    final long now = clock.instant().getEpochSecond();
    final String code = generator.generate(secret, now, config);
    return new TotpResult(accountId, code, TotpGenerator.secondsRemaining(now, config.stepSeconds()));
  }
}
