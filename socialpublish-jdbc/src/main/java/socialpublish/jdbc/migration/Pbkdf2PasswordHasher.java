package socialpublish.jdbc.migration;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PBKDF2-HMAC-SHA256 hasher producing {@code pbkdf2-sha256$<iterations>$<salt>$<hash>}.
 */
public final class Pbkdf2PasswordHasher implements PasswordHasher {
  private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
  private static final int KEY_LENGTH_BITS = 256;
  private static final int SALT_BYTES = 16;

  private final int iterations;
  private final SecureRandom random = new SecureRandom();

  public Pbkdf2PasswordHasher() {
    this(210_000);
  }

  public Pbkdf2PasswordHasher(int iterations) {
    if (iterations <= 0) {
      throw new IllegalArgumentException("iterations must be > 0");
    }
    this.iterations = iterations;
  }

  @Override
  public String hash(String rawPassword) {
    byte[] salt = new byte[SALT_BYTES];
    random.nextBytes(salt);
    PBEKeySpec spec = new PBEKeySpec(rawPassword.toCharArray(), salt, iterations, KEY_LENGTH_BITS);
    try {
      byte[] hash = SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
      Base64.Encoder b64 = Base64.getEncoder().withoutPadding();
      return "pbkdf2-sha256$" + iterations + "$" + b64.encodeToString(salt) + "$" + b64.encodeToString(hash);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(ALGORITHM + " not available", e);
    } finally {
      spec.clearPassword();
    }
  }
}
