package com.codeheadsystems.totp.cli.lookup;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads secrets from a properties file of {@code account=BASE32SECRET} lines.
 * The file is read on every lookup.
 */
public class PropertiesSecretLookup implements SecretLookup {

  private static final Logger log = LoggerFactory.getLogger(PropertiesSecretLookup.class);

  private final Path secretsFile;

  /**
   * Instantiates a new Properties secret lookup.
   *
   * @param secretsFile the secrets file
   */
  public PropertiesSecretLookup(final Path secretsFile) {
    log.info("PropertiesSecretLookup({})", secretsFile);
    this.secretsFile = Objects.requireNonNull(secretsFile, "secretsFile");
  }

  @Override
  public String lookupSecret(final String accountId) {
    log.trace("lookupSecret(accountId={})", accountId);
    final Properties properties = new Properties();
    try (Reader reader = Files.newBufferedReader(secretsFile, StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (IOException e) {
      log.warn("Unable to read secrets file {}: {}", secretsFile, e.toString());
      throw new SecretLookupException("Unable to read secrets file: " + secretsFile, e);
    }
    final String secret = properties.getProperty(accountId);
    if (secret == null || secret.isBlank()) {
      throw new SecretNotFoundException(accountId);
    }
    return secret.trim();
  }

  /**
   * Secrets file.
   *
   * @return the path
   */
  public Path secretsFile() {
    return secretsFile;
  }
}
