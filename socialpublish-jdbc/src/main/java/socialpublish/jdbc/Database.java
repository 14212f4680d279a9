package socialpublish.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import socialpublish.jdbc.dialect.Dialects;
import socialpublish.jdbc.migration.MigrationRunner;
import socialpublish.jdbc.spi.Dialect;
import socialpublish.jdbc.store.JdbcDocumentStore;
import socialpublish.jdbc.tx.JdbcTransactionManager;
import socialpublish.jdbc.tx.StatementExecutor;
import socialpublish.jdbc.tx.ThreadLocalTxContext;
import socialpublish.post.PostFeed;
import socialpublish.post.PostRepository;
import socialpublish.spi.DocumentStore;
import socialpublish.spi.SiteWideDocumentReader;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Opens the connection pool, migrates the schema, and wires the store on top.
 *
 * <pre>{@code
 * try (Database db = Database.open(DatabaseConfig.fromProperties(props))) {
 *     Post post = db.postRepository().create(ownerId, PostPayload.ofContent("hi"), List.of("feed"));
 * }
 * }</pre>
 *
 * <p>If migrations fail the pool is closed and {@link socialpublish.jdbc.migration.MigrationException}
 * is thrown; a partially migrated database is never handed out.
 */
public final class Database implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Database.class.getName());

  private final HikariDataSource dataSource;
  private final Dialect dialect;
  private final StatementExecutor executor;
  private final JdbcTransactionManager txManager;
  private final JdbcTemplate jdbc;
  private final JdbcDocumentStore documentStore;
  private final PostRepository postRepository;
  private final PostFeed postFeed;

  private Database(HikariDataSource dataSource, Dialect dialect, DatabaseConfig config) {
    this.dataSource = dataSource;
    this.dialect = dialect;
    this.executor = new StatementExecutor(config.getStatementWorkers(), config.getQueryTimeoutSeconds());
    this.txManager = new JdbcTransactionManager(
        dataSource::getConnection, new ThreadLocalTxContext(), dialect);
    this.jdbc = new JdbcTemplate(executor);
    this.documentStore = new JdbcDocumentStore(txManager, jdbc, dialect, config.getClock());
    this.postRepository = new PostRepository(documentStore);
    this.postFeed = new PostFeed(documentStore.siteWideReader(), postRepository);
  }

  /**
   * Opens the database described by {@code config} and applies pending migrations.
   *
   * @throws socialpublish.jdbc.migration.MigrationException if the schema cannot be migrated
   * @throws IllegalArgumentException if no dialect handles the JDBC URL
   */
  public static Database open(DatabaseConfig config) {
    Objects.requireNonNull(config, "config");
    Dialect dialect = Dialects.detect(config.getJdbcUrl());

    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.getJdbcUrl());
    hikari.setUsername(config.getUsername());
    hikari.setPassword(config.getPassword());
    hikari.setMaximumPoolSize(config.getMaximumPoolSize());
    hikari.setMinimumIdle(Math.min(config.getMinimumIdle(), config.getMaximumPoolSize()));
    hikari.setConnectionTimeout(config.getConnectionTimeoutMs());
    hikari.setPoolName("socialpublish-" + dialect.name());
    dialect.connectionInitSql().ifPresent(hikari::setConnectionInitSql);

    HikariDataSource dataSource = new HikariDataSource(hikari);
    Database db = new Database(dataSource, dialect, config);
    try {
      int applied = new MigrationRunner(db.txManager, db.jdbc, dialect,
          config.getPasswordHasher(), config.getClock()).run();
      logger.info("Opened " + dialect.name() + " database (" + applied + " migrations applied)");
      return db;
    } catch (RuntimeException e) {
      db.close();
      throw e;
    }
  }

  public Dialect dialect() {
    return dialect;
  }

  public JdbcTransactionManager txManager() {
    return txManager;
  }

  public JdbcTemplate jdbc() {
    return jdbc;
  }

  public DocumentStore documentStore() {
    return documentStore;
  }

  /**
   * All-owners reader; hand it only to whole-feed read paths.
   */
  public SiteWideDocumentReader siteWideReader() {
    return documentStore.siteWideReader();
  }

  public PostRepository postRepository() {
    return postRepository;
  }

  public PostFeed postFeed() {
    return postFeed;
  }

  HikariDataSource dataSource() {
    return dataSource;
  }

  @Override
  public void close() {
    executor.close();
    if (!dataSource.isClosed()) {
      dataSource.close();
    }
  }
}
