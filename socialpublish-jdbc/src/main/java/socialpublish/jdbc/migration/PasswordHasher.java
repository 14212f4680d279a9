package socialpublish.jdbc.migration;

/**
 * Hashes the password of the default account seeded on first start.
 *
 * <p>The algorithm belongs to the authentication layer; {@link Pbkdf2PasswordHasher}
 * is used when none is configured.
 */
@FunctionalInterface
public interface PasswordHasher {
  String hash(String rawPassword);
}
