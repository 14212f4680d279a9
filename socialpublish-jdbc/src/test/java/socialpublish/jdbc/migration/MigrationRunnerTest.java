package socialpublish.jdbc.migration;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import socialpublish.SqlUpdateException;
import socialpublish.jdbc.JdbcTemplate;
import socialpublish.jdbc.dialect.SqliteDialect;
import socialpublish.jdbc.spi.Dialect;
import socialpublish.jdbc.store.JdbcDocumentStore;
import socialpublish.jdbc.tx.JdbcTransactionManager;
import socialpublish.jdbc.tx.StatementExecutor;
import socialpublish.jdbc.tx.ThreadLocalTxContext;
import socialpublish.model.Document;
import socialpublish.model.OrderBy;
import socialpublish.model.Tag;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MigrationRunnerTest {
  private static final PasswordHasher STUB_HASHER = raw -> "hashed:" + raw;
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

  @TempDir
  Path tempDir;

  private final Dialect dialect = new SqliteDialect();
  private HikariDataSource dataSource;
  private StatementExecutor executor;
  private JdbcTemplate jdbc;
  private JdbcTransactionManager txManager;

  @BeforeEach
  void setUp() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:sqlite:" + tempDir.resolve("migrations.db"));
    config.setMaximumPoolSize(2);
    config.setPoolName("migration-test-pool");
    config.setConnectionInitSql(dialect.connectionInitSql().orElseThrow());
    dataSource = new HikariDataSource(config);
    executor = new StatementExecutor(2, 0);
    jdbc = new JdbcTemplate(executor);
    txManager = new JdbcTransactionManager(dataSource::getConnection,
        new ThreadLocalTxContext(), dialect);
  }

  @AfterEach
  void tearDown() {
    executor.close();
    dataSource.close();
  }

  private MigrationRunner runner(List<Migration> migrations) {
    return new MigrationRunner(txManager, jdbc, dialect, STUB_HASHER, CLOCK, migrations);
  }

  private long count(String sql, Object... params) {
    return txManager.withTransaction(conn -> jdbc.queryLong(conn, sql, params));
  }

  private boolean tableExists(String table) {
    return txManager.withTransaction(conn -> dialect.tableExists(jdbc, conn, table));
  }

  private boolean columnExists(String table, String column) {
    return txManager.withTransaction(conn -> dialect.columnExists(jdbc, conn, table, column));
  }

  private String adminUuid() {
    return txManager.withTransaction(conn -> jdbc.queryFirst(conn,
        "SELECT uuid FROM users WHERE username = ?", rs -> rs.getString(1), Migrations.DEFAULT_USERNAME)
        .orElseThrow());
  }

  @Test
  void freshDatabaseGetsFullSchema() {
    int applied = runner(Migrations.all()).run();

    // the owner backfill finds nothing to do on an empty database
    assertEquals(Migrations.all().size() - 1, applied);
    for (String table : List.of("documents", "document_tags", "uploads", "users", "user_sessions")) {
      assertTrue(tableExists(table), table);
    }
    assertFalse(tableExists("posts"));
    assertTrue(columnExists("users", "settings"));
    assertTrue(columnExists("documents", "user_uuid"));
    assertTrue(columnExists("uploads", "user_uuid"));
  }

  @Test
  void secondRunAppliesNothing() {
    runner(Migrations.all()).run();

    assertEquals(0, runner(Migrations.all()).run());
    assertEquals(1, count("SELECT COUNT(*) FROM users"));
  }

  @Test
  void seedsDefaultAccountWithHashedPassword() {
    runner(Migrations.all()).run();

    String hash = txManager.withTransaction(conn -> jdbc.queryFirst(conn,
        "SELECT password_hash FROM users WHERE username = ?", rs -> rs.getString(1), "admin")
        .orElseThrow());
    assertEquals("hashed:" + Migrations.DEFAULT_PASSWORD, hash);
    assertEquals(CLOCK.millis(), count("SELECT created_at FROM users WHERE username = ?", "admin"));
  }

  @Test
  void existingAccountSuppressesSeeding() {
    runner(Migrations.all().subList(0, 5)).run();
    txManager.withTransaction(conn -> jdbc.update(conn,
        "INSERT INTO users (uuid, username, password_hash, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
        "00000000-0000-0000-0000-000000000001", "alice", "x", 1L, 1L));

    runner(Migrations.all()).run();

    assertEquals(1, count("SELECT COUNT(*) FROM users"));
    assertEquals(0, count("SELECT COUNT(*) FROM users WHERE username = 'admin'"));
  }

  @Test
  void legacyRowsAreAssignedToDefaultAccount() {
    assertEquals(7, runner(Migrations.all().subList(0, 7)).run());
    assertFalse(columnExists("documents", "user_uuid"));
    txManager.withTransaction(conn -> {
      jdbc.update(conn, "INSERT INTO documents (uuid, search_key, kind, payload, created_at)"
          + " VALUES (?, ?, ?, ?, ?)", "d1", "post:d1", "post", "{}", 1L);
      jdbc.update(conn, "INSERT INTO uploads (uuid, hash, originalname, createdAt) VALUES (?, ?, ?, ?)",
          "u1", "abc", "cat.png", 1L);
      return null;
    });

    assertEquals(2, runner(Migrations.all()).run());

    String admin = adminUuid();
    assertEquals(1, count("SELECT COUNT(*) FROM documents WHERE user_uuid = ?", admin));
    assertEquals(1, count("SELECT COUNT(*) FROM uploads WHERE user_uuid = ?", admin));
  }

  @Test
  void legacyRowsFallBackToEarliestAccount() {
    runner(Migrations.all().subList(0, 7)).run();
    String seeded = adminUuid();
    txManager.withTransaction(conn -> {
      jdbc.update(conn, "UPDATE users SET username = 'root'");
      jdbc.update(conn, "INSERT INTO users (uuid, username, password_hash, created_at, updated_at)"
          + " VALUES (?, ?, ?, ?, ?)", "later-user", "bob", "x", CLOCK.millis() + 1000, CLOCK.millis());
      jdbc.update(conn, "INSERT INTO documents (uuid, search_key, kind, payload, created_at)"
          + " VALUES (?, ?, ?, ?, ?)", "d1", "post:d1", "post", "{}", 1L);
      return null;
    });

    runner(Migrations.all()).run();

    assertEquals(1, count("SELECT COUNT(*) FROM documents WHERE user_uuid = ?", seeded));
  }

  @Test
  void partiallyAddedOwnerColumnIsCompleted() {
    runner(Migrations.all().subList(0, 7)).run();
    txManager.withTransaction(conn -> {
      jdbc.execute(conn, "ALTER TABLE documents ADD COLUMN user_uuid VARCHAR(36)");
      return null;
    });

    runner(Migrations.all()).run();

    assertTrue(columnExists("uploads", "user_uuid"));
  }

  @Test
  void failingMigrationRollsBackWholePass() {
    List<Migration> migrations = new ArrayList<>(Migrations.all());
    migrations.add(Migration.ddl("broken", ctx -> false, "INSERT INTO nowhere VALUES (1)"));

    MigrationException e = assertThrows(MigrationException.class, () -> runner(migrations).run());

    assertTrue(e.getMessage().contains("Migration 9 (broken) failed"), e.getMessage());
    assertInstanceOf(SqlUpdateException.Unknown.class, e.getCause());
    assertFalse(tableExists("documents"));
    assertFalse(tableExists("users"));
  }

  @Test
  void runtimeFailureInStepIsWrapped() {
    List<Migration> migrations = List.of(
        Migration.ddl("scratch table", ctx -> ctx.tableExists("scratch"), "CREATE TABLE scratch (id INTEGER)"),
        Migration.of("explodes", ctx -> false, ctx -> {
          throw new IllegalStateException("boom");
        }));

    MigrationException e = assertThrows(MigrationException.class, () -> runner(migrations).run());

    assertTrue(e.getMessage().contains("Migration 1 (explodes) failed"), e.getMessage());
    assertInstanceOf(IllegalStateException.class, e.getCause());
    assertFalse(tableExists("scratch"));
  }

  @Test
  void checksSeeEarlierMigrationsOfSamePass() throws SQLException {
    List<Boolean> observed = new ArrayList<>();
    List<Migration> migrations = List.of(
        Migration.ddl("scratch table", ctx -> ctx.tableExists("scratch"), "CREATE TABLE scratch (id INTEGER)"),
        Migration.of("observer", ctx -> {
          observed.add(ctx.tableExists("scratch"));
          return true;
        }, ctx -> fail("should not run")));

    assertEquals(1, runner(migrations).run());
    assertEquals(List.of(true), observed);
  }

  @Test
  void upgradesDatabaseWithoutAccounts() {
    txManager.withTransaction(conn -> {
      for (String ddl : ORIGINAL_CONTENT_SCHEMA) {
        jdbc.execute(conn, ddl);
      }
      insertLegacyDocument(conn, "d1", null);
      jdbc.update(conn, "INSERT INTO document_tags (document_uuid, name, kind) VALUES (?, ?, ?)",
          "d1", "mastodon", "target");
      jdbc.update(conn, "INSERT INTO uploads (uuid, hash, originalname, mimetype, size, altText,"
          + " imageWidth, imageHeight, createdAt) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
          "u1", "abc", "cat.png", "image/png", 10L, "a cat", 64, 48, 1L);
      return null;
    });

    assertEquals(6, runner(Migrations.all()).run());

    String admin = adminUuid();
    assertEquals(1, count("SELECT COUNT(*) FROM documents WHERE user_uuid = ?", admin));
    assertEquals(1, count("SELECT COUNT(*) FROM uploads WHERE user_uuid = ?", admin));
    List<Document> docs = new JdbcDocumentStore(txManager, jdbc, dialect)
        .getAllForUser("post", UUID.fromString(admin), OrderBy.CREATED_AT_DESC);
    assertEquals(1, docs.size());
    assertEquals(List.of(Tag.target("mastodon")), docs.get(0).tags());
    assertEquals(0, runner(Migrations.all()).run());
  }

  @Test
  void upgradeKeepsExistingOwnership() {
    String alice = "0190a1b2-0000-7000-8000-000000000001";
    txManager.withTransaction(conn -> {
      for (String ddl : ORIGINAL_CONTENT_SCHEMA) {
        jdbc.execute(conn, ddl);
      }
      for (String ddl : ORIGINAL_ACCOUNT_SCHEMA) {
        jdbc.execute(conn, ddl);
      }
      jdbc.update(conn, "INSERT INTO users (uuid, username, password_hash, created_at, updated_at, settings)"
          + " VALUES (?, ?, ?, ?, ?, ?)", alice, "alice", "x", 1L, 1L, null);
      insertLegacyDocument(conn, "owned", alice);
      insertLegacyDocument(conn, "orphan", null);
      return null;
    });

    assertEquals(1, runner(Migrations.all()).run());

    assertEquals(0, count("SELECT COUNT(*) FROM users WHERE username = 'admin'"));
    assertEquals(2, count("SELECT COUNT(*) FROM documents WHERE user_uuid = ?", alice));
  }

  private void insertLegacyDocument(Connection conn, String uuid, String owner) throws SQLException {
    if (owner == null && !dialect.columnExists(jdbc, conn, "documents", "user_uuid")) {
      jdbc.update(conn, "INSERT INTO documents (uuid, search_key, kind, payload, created_at)"
          + " VALUES (?, ?, ?, ?, ?)", uuid, "post:" + uuid, "post", "{\"content\":\"hi\"}", 1L);
    } else {
      jdbc.update(conn, "INSERT INTO documents (uuid, search_key, kind, payload, created_at, user_uuid)"
          + " VALUES (?, ?, ?, ?, ?, ?)", uuid, "post:" + uuid, "post", "{\"content\":\"hi\"}", 1L, owner);
    }
  }

  // Schema as written by earlier releases, before accounts existed.
  private static final List<String> ORIGINAL_CONTENT_SCHEMA = List.of(
      "CREATE TABLE documents (uuid VARCHAR(36) NOT NULL PRIMARY KEY,"
          + " search_key VARCHAR(255) UNIQUE NOT NULL, kind VARCHAR(255) NOT NULL,"
          + " payload TEXT NOT NULL, created_at INTEGER NOT NULL)",
      "CREATE INDEX documents_created_at ON documents(kind, created_at)",
      "CREATE TABLE document_tags (document_uuid VARCHAR(36) NOT NULL, name VARCHAR(255) NOT NULL,"
          + " kind VARCHAR(255) NOT NULL, PRIMARY KEY (document_uuid, name, kind))",
      "CREATE TABLE uploads (uuid VARCHAR(36) NOT NULL PRIMARY KEY, hash VARCHAR(64) NOT NULL,"
          + " originalname VARCHAR(255) NOT NULL, mimetype VARCHAR(255), size INTEGER, altText TEXT,"
          + " imageWidth INTEGER, imageHeight INTEGER, createdAt INTEGER NOT NULL)",
      "CREATE INDEX uploads_createdAt ON uploads(createdAt)");

  // Account tables and owner columns added by later releases.
  private static final List<String> ORIGINAL_ACCOUNT_SCHEMA = List.of(
      "CREATE TABLE users (uuid VARCHAR(36) NOT NULL PRIMARY KEY, username VARCHAR(255) UNIQUE NOT NULL,"
          + " password_hash VARCHAR(255) NOT NULL, created_at INTEGER NOT NULL, updated_at INTEGER NOT NULL)",
      "CREATE TABLE user_sessions (uuid VARCHAR(36) NOT NULL PRIMARY KEY, user_uuid VARCHAR(36) NOT NULL,"
          + " token_hash VARCHAR(255) UNIQUE NOT NULL, refresh_token_hash VARCHAR(255),"
          + " expires_at INTEGER NOT NULL, created_at INTEGER NOT NULL,"
          + " FOREIGN KEY (user_uuid) REFERENCES users(uuid) ON DELETE CASCADE)",
      "CREATE INDEX user_sessions_expires_at ON user_sessions(expires_at)",
      "ALTER TABLE users ADD COLUMN settings TEXT",
      "ALTER TABLE documents ADD COLUMN user_uuid VARCHAR(36)",
      "ALTER TABLE uploads ADD COLUMN user_uuid VARCHAR(36)",
      "CREATE INDEX documents_user_uuid ON documents(user_uuid, kind, created_at)",
      "CREATE INDEX uploads_user_uuid ON uploads(user_uuid, createdAt)");
}
