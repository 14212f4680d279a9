package socialpublish.jdbc.migration;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * The ordered migration list. Entries are only ever appended.
 *
 * <p>Table and column names match databases written by earlier releases, including
 * the camel-case {@code uploads} columns, so those databases upgrade in place.
 */
public final class Migrations {
  private static final Logger logger = Logger.getLogger(Migrations.class.getName());

  public static final String DEFAULT_USERNAME = "admin";
  static final String DEFAULT_PASSWORD = "changeme";

  private static final List<Migration> ALL = List.of(
      // 0
      Migration.ddl("documents table",
          ctx -> ctx.tableExists("documents"),
          "DROP TABLE IF EXISTS posts",
          "CREATE TABLE IF NOT EXISTS documents ("
              + "uuid VARCHAR(36) NOT NULL PRIMARY KEY, "
              + "search_key VARCHAR(255) NOT NULL UNIQUE, "
              + "kind VARCHAR(255) NOT NULL, "
              + "payload TEXT NOT NULL, "
              + "created_at BIGINT NOT NULL)",
          "CREATE INDEX IF NOT EXISTS documents_created_at ON documents(kind, created_at)"),
      // 1
      Migration.ddl("document_tags table",
          ctx -> ctx.tableExists("document_tags"),
          "CREATE TABLE IF NOT EXISTS document_tags ("
              + "document_uuid VARCHAR(36) NOT NULL REFERENCES documents(uuid), "
              + "name VARCHAR(255) NOT NULL, "
              + "kind VARCHAR(255) NOT NULL, "
              + "PRIMARY KEY (document_uuid, name, kind))"),
      // 2
      Migration.ddl("uploads table",
          ctx -> ctx.tableExists("uploads"),
          "CREATE TABLE IF NOT EXISTS uploads ("
              + "uuid VARCHAR(36) NOT NULL PRIMARY KEY, "
              + "hash VARCHAR(64) NOT NULL, "
              + "originalname VARCHAR(255) NOT NULL, "
              + "mimetype VARCHAR(255), "
              + "size BIGINT, "
              + "altText TEXT, "
              + "imageWidth INTEGER, "
              + "imageHeight INTEGER, "
              + "createdAt BIGINT NOT NULL)",
          "CREATE INDEX IF NOT EXISTS uploads_createdAt ON uploads(createdAt)"),
      // 3
      Migration.ddl("users table",
          ctx -> ctx.tableExists("users"),
          "CREATE TABLE IF NOT EXISTS users ("
              + "uuid VARCHAR(36) NOT NULL PRIMARY KEY, "
              + "username VARCHAR(255) NOT NULL UNIQUE, "
              + "password_hash VARCHAR(255) NOT NULL, "
              + "created_at BIGINT NOT NULL, "
              + "updated_at BIGINT NOT NULL)"),
      // 4
      Migration.ddl("user_sessions table",
          ctx -> ctx.tableExists("user_sessions"),
          "CREATE TABLE IF NOT EXISTS user_sessions ("
              + "uuid VARCHAR(36) NOT NULL PRIMARY KEY, "
              + "user_uuid VARCHAR(36) NOT NULL, "
              + "token_hash VARCHAR(255) NOT NULL UNIQUE, "
              + "refresh_token_hash VARCHAR(255), "
              + "expires_at BIGINT NOT NULL, "
              + "created_at BIGINT NOT NULL, "
              + "FOREIGN KEY (user_uuid) REFERENCES users(uuid) ON DELETE CASCADE)",
          "CREATE INDEX IF NOT EXISTS user_sessions_expires_at ON user_sessions(expires_at)"),
      // 5
      Migration.of("default account",
          ctx -> ctx.count("SELECT COUNT(*) FROM users") > 0,
          Migrations::seedDefaultAccount),
      // 6
      Migration.ddl("users.settings column",
          ctx -> ctx.columnExists("users", "settings"),
          "ALTER TABLE users ADD COLUMN settings TEXT"),
      // 7
      Migration.of("user_uuid columns",
          ctx -> ctx.columnExists("documents", "user_uuid") && ctx.columnExists("uploads", "user_uuid"),
          Migrations::addOwnerColumns),
      // 8
      Migration.of("user_uuid backfill",
          ctx -> ctx.count("SELECT COUNT(*) FROM documents WHERE user_uuid IS NULL") == 0
              && ctx.count("SELECT COUNT(*) FROM uploads WHERE user_uuid IS NULL") == 0,
          Migrations::backfillOwners));

  private Migrations() {
  }

  public static List<Migration> all() {
    return ALL;
  }

  private static void seedDefaultAccount(MigrationContext ctx) throws SQLException {
    String uuid = UUID.randomUUID().toString();
    long now = ctx.clock().millis();
    ctx.update("INSERT INTO users (uuid, username, password_hash, created_at, updated_at)"
            + " VALUES (?, ?, ?, ?, ?)",
        uuid, DEFAULT_USERNAME, ctx.passwordHasher().hash(DEFAULT_PASSWORD), now, now);
    logger.info("Created default account '" + DEFAULT_USERNAME + "' (uuid: " + uuid
        + "); change its password before exposing the service");
  }

  private static void addOwnerColumns(MigrationContext ctx) throws SQLException {
    if (!ctx.columnExists("documents", "user_uuid")) {
      ctx.execute("ALTER TABLE documents ADD COLUMN user_uuid VARCHAR(36)");
    }
    if (!ctx.columnExists("uploads", "user_uuid")) {
      ctx.execute("ALTER TABLE uploads ADD COLUMN user_uuid VARCHAR(36)");
    }
    ctx.execute("CREATE INDEX IF NOT EXISTS documents_user_uuid ON documents(user_uuid, kind, created_at)");
    ctx.execute("CREATE INDEX IF NOT EXISTS uploads_user_uuid ON uploads(user_uuid, createdAt)");
  }

  private static void backfillOwners(MigrationContext ctx) throws SQLException {
    Optional<String> owner = ctx.jdbc().queryFirst(ctx.connection(),
        "SELECT uuid FROM users WHERE username = ?", rs -> rs.getString(1), DEFAULT_USERNAME);
    if (owner.isEmpty()) {
      owner = ctx.jdbc().queryFirst(ctx.connection(),
          "SELECT uuid FROM users ORDER BY created_at", rs -> rs.getString(1));
    }
    String ownerId = owner.orElseThrow(
        () -> new IllegalStateException("No account to assign legacy rows to"));
    int documents = ctx.update("UPDATE documents SET user_uuid = ? WHERE user_uuid IS NULL", ownerId);
    int uploads = ctx.update("UPDATE uploads SET user_uuid = ? WHERE user_uuid IS NULL", ownerId);
    logger.info("Assigned " + documents + " documents and " + uploads + " uploads to " + ownerId);
  }
}
