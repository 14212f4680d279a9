package socialpublish.jdbc.dialect;

import socialpublish.jdbc.spi.Dialect;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registry of database dialects, keyed by name and by JDBC URL prefix.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/socialpublish.jdbc.spi.Dialect}.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect("jdbc:sqlite:socialpublish.db");
 * Dialect h2 = Dialects.get("h2");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS = ServiceLoader.load(Dialect.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private static final Map<String, Dialect> BY_NAME = DIALECTS.stream()
      .collect(Collectors.toUnmodifiableMap(d -> d.name().toLowerCase(Locale.ROOT),
          Function.identity()));

  private Dialects() {
  }

  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Finds the dialect whose URL prefix matches {@code jdbcUrl}.
   */
  public static Optional<Dialect> forJdbcUrl(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    return DIALECTS.stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
        .findFirst();
  }

  /**
   * Auto-detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no dialect handles it
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return forJdbcUrl(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: "
            + DIALECTS.stream().flatMap(d -> d.jdbcUrlPrefixes().stream()).toList()));
  }
}
