package socialpublish.jdbc;

import socialpublish.jdbc.migration.PasswordHasher;
import socialpublish.jdbc.migration.Pbkdf2PasswordHasher;

import java.time.Clock;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for {@link Database#open(DatabaseConfig)}.
 *
 * <p>The pool defaults suit a single-writer embedded engine: a few connections, kept
 * short-lived, rather than many competing writers.
 */
public final class DatabaseConfig {
  public static final String PREFIX = "socialpublish.db.";

  private String jdbcUrl = "jdbc:sqlite:socialpublish.db";
  private String username;
  private String password;
  private int maximumPoolSize = 3;
  private int minimumIdle = 1;
  private long connectionTimeoutMs = 30_000L;
  private int queryTimeoutSeconds;
  private int statementWorkers;
  private PasswordHasher passwordHasher;
  private Clock clock = Clock.systemUTC();

  /**
   * Reads {@code socialpublish.db.*} keys; absent keys keep their defaults.
   *
   * <p>Recognized keys: {@code jdbcUrl}, {@code username}, {@code password},
   * {@code maximumPoolSize}, {@code minimumIdle}, {@code connectionTimeoutMs},
   * {@code queryTimeoutSeconds}, {@code statementWorkers}.
   */
  public static DatabaseConfig fromProperties(Properties properties) {
    DatabaseConfig config = new DatabaseConfig();
    String value = properties.getProperty(PREFIX + "jdbcUrl");
    if (value != null) {
      config.setJdbcUrl(value.trim());
    }
    config.setUsername(properties.getProperty(PREFIX + "username"));
    config.setPassword(properties.getProperty(PREFIX + "password"));
    value = properties.getProperty(PREFIX + "maximumPoolSize");
    if (value != null) {
      config.setMaximumPoolSize(Integer.parseInt(value.trim()));
    }
    value = properties.getProperty(PREFIX + "minimumIdle");
    if (value != null) {
      config.setMinimumIdle(Integer.parseInt(value.trim()));
    }
    value = properties.getProperty(PREFIX + "connectionTimeoutMs");
    if (value != null) {
      config.setConnectionTimeoutMs(Long.parseLong(value.trim()));
    }
    value = properties.getProperty(PREFIX + "queryTimeoutSeconds");
    if (value != null) {
      config.setQueryTimeoutSeconds(Integer.parseInt(value.trim()));
    }
    value = properties.getProperty(PREFIX + "statementWorkers");
    if (value != null) {
      config.setStatementWorkers(Integer.parseInt(value.trim()));
    }
    return config;
  }

  public String getJdbcUrl() {
    return jdbcUrl;
  }

  public DatabaseConfig setJdbcUrl(String jdbcUrl) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    return this;
  }

  public String getUsername() {
    return username;
  }

  public DatabaseConfig setUsername(String username) {
    this.username = username;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public DatabaseConfig setPassword(String password) {
    this.password = password;
    return this;
  }

  public int getMaximumPoolSize() {
    return maximumPoolSize;
  }

  public DatabaseConfig setMaximumPoolSize(int maximumPoolSize) {
    if (maximumPoolSize < 1) {
      throw new IllegalArgumentException("maximumPoolSize must be >= 1");
    }
    this.maximumPoolSize = maximumPoolSize;
    return this;
  }

  public int getMinimumIdle() {
    return minimumIdle;
  }

  public DatabaseConfig setMinimumIdle(int minimumIdle) {
    if (minimumIdle < 0) {
      throw new IllegalArgumentException("minimumIdle must be >= 0");
    }
    this.minimumIdle = minimumIdle;
    return this;
  }

  public long getConnectionTimeoutMs() {
    return connectionTimeoutMs;
  }

  public DatabaseConfig setConnectionTimeoutMs(long connectionTimeoutMs) {
    if (connectionTimeoutMs < 250) {
      throw new IllegalArgumentException("connectionTimeoutMs must be >= 250");
    }
    this.connectionTimeoutMs = connectionTimeoutMs;
    return this;
  }

  public int getQueryTimeoutSeconds() {
    return queryTimeoutSeconds;
  }

  /** 0 disables the driver-side timeout. */
  public DatabaseConfig setQueryTimeoutSeconds(int queryTimeoutSeconds) {
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    }
    this.queryTimeoutSeconds = queryTimeoutSeconds;
    return this;
  }

  /**
   * Statement worker threads; defaults to the maximum pool size.
   */
  public int getStatementWorkers() {
    return statementWorkers > 0 ? statementWorkers : maximumPoolSize;
  }

  public DatabaseConfig setStatementWorkers(int statementWorkers) {
    if (statementWorkers < 0) {
      throw new IllegalArgumentException("statementWorkers must be >= 0");
    }
    this.statementWorkers = statementWorkers;
    return this;
  }

  public PasswordHasher getPasswordHasher() {
    return passwordHasher != null ? passwordHasher : new Pbkdf2PasswordHasher();
  }

  public DatabaseConfig setPasswordHasher(PasswordHasher passwordHasher) {
    this.passwordHasher = passwordHasher;
    return this;
  }

  public Clock getClock() {
    return clock;
  }

  public DatabaseConfig setClock(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    return this;
  }
}
