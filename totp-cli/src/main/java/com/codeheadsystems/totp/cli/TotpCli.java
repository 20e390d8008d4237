package com.codeheadsystems.totp.cli;

import com.codeheadsystems.totp.cli.config.TotpCliConfig;
import com.codeheadsystems.totp.cli.lookup.PropertiesSecretLookup;
import com.codeheadsystems.totp.cli.lookup.SecretLookup;
import com.codeheadsystems.totp.cli.lookup.SecretLookupException;
import com.codeheadsystems.totp.cli.lookup.SecretNotFoundException;
import com.codeheadsystems.totp.cli.manager.TotpManager;
import com.codeheadsystems.totp.cli.model.TotpResult;
import com.codeheadsystems.totp.rfc6238.InvalidSecretException;
import com.codeheadsystems.totp.rfc6238.TotpDigestException;
import com.codeheadsystems.totp.rfc6238.TotpGenerator;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Command-line TOTP generator.
 *
 * <pre>
 * Usage:
 *   java -jar totp-cli.jar &lt;account&gt; [--secrets &lt;file&gt;] [--time &lt;epochSeconds&gt;] [--digits &lt;n&gt;] [--step &lt;seconds&gt;]
 *   java -jar totp-cli.jar --secret &lt;base32&gt; [--time &lt;epochSeconds&gt;] [--digits &lt;n&gt;] [--step &lt;seconds&gt;]
 *
 * Examples:
 *   java -jar totp-cli.jar github
 *   java -jar totp-cli.jar --secret JBSWY3DPEHPK3PXP --time 59
 * </pre>
 *
 * <p>Secrets are read from {@code ~/.totp/secrets.properties} unless {@code --secrets} or the
 * {@code TOTP_SECRETS_FILE} environment variable names another file. The code goes to stdout,
 * its remaining validity to stderr.
 */
public class TotpCli {

  /**
   * Exit status for usage errors.
   */
  public static final int EXIT_USAGE = 1;
  /**
   * Exit status for lookup, secret or HMAC failures.
   */
  public static final int EXIT_FAILURE = 2;

  private static final String INLINE_ACCOUNT = "(inline)";

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Runs the command.
   *
   * @param args the args
   * @param out  receives the code
   * @param err  receives diagnostics
   * @return the exit status
   */
  public static int run(String[] args, PrintStream out, PrintStream err) {
    final TotpCliConfig config;
    try {
      config = TotpCliConfig.fromArgs(args);
    } catch (IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      usage(err);
      return EXIT_USAGE;
    }
    return run(config, out, err);
  }

  /**
   * Runs the command with already-parsed options.
   *
   * @param config the config
   * @param out    receives the code
   * @param err    receives diagnostics
   * @return the exit status
   */
  public static int run(TotpCliConfig config, PrintStream out, PrintStream err) {
    return run(config, new TotpGenerator(), out, err);
  }

  static int run(TotpCliConfig config, TotpGenerator generator, PrintStream out, PrintStream err) {
    final SecretLookup lookup = config.secret() != null
        ? accountId -> config.secret()
        : new PropertiesSecretLookup(config.secretsFile());
    final String account = config.account() != null ? config.account() : INLINE_ACCOUNT;
    final Clock clock = config.time() != null
        ? Clock.fixed(Instant.ofEpochSecond(config.time()), ZoneOffset.UTC)
        : Clock.systemUTC();
    final TotpManager manager = new TotpManager(lookup, generator, config.totpConfig(), clock);

    try {
      TotpResult result = manager.totpFor(account);
      out.println(result.code());
      err.println("valid for " + result.secondsRemaining() + "s");
      return 0;
    } catch (SecretNotFoundException | SecretLookupException | InvalidSecretException | TotpDigestException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private static void usage(PrintStream err) {
    err.println("Usage: TotpCli <account> [--secrets <file>] [--time <epochSeconds>] [--digits <n>] [--step <seconds>]");
    err.println("       TotpCli --secret <base32> [--time <epochSeconds>] [--digits <n>] [--step <seconds>]");
    err.println();
    err.println("  --secrets <file>  Secrets properties file (default: ~/" + TotpCliConfig.DEFAULT_SECRETS_FILE
        + ", or $" + TotpCliConfig.SECRETS_FILE_ENV + ")");
    err.println("  --time <seconds>  Unix time to generate for (default: now)");
    err.println("  --digits <n>      Code length (default: 6)");
    err.println("  --step <seconds>  Time step (default: 30)");
  }
}
