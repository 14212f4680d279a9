package socialpublish.jdbc.migration;

import socialpublish.QueryCancelledException;
import socialpublish.StoreException;
import socialpublish.jdbc.JdbcTemplate;
import socialpublish.jdbc.spi.Dialect;
import socialpublish.jdbc.tx.JdbcTransactionManager;

import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the migration list in a single transaction.
 *
 * <p>Each migration is skipped when it reports itself applied and run otherwise. If any
 * of them fails, the whole pass rolls back, including migrations applied earlier in
 * the same pass, and {@link MigrationException} is thrown.
 */
public final class MigrationRunner {
  private static final Logger logger = Logger.getLogger(MigrationRunner.class.getName());

  private final JdbcTransactionManager txManager;
  private final JdbcTemplate jdbc;
  private final Dialect dialect;
  private final PasswordHasher passwordHasher;
  private final Clock clock;
  private final List<Migration> migrations;

  public MigrationRunner(JdbcTransactionManager txManager, JdbcTemplate jdbc, Dialect dialect,
      PasswordHasher passwordHasher, Clock clock) {
    this(txManager, jdbc, dialect, passwordHasher, clock, Migrations.all());
  }

  public MigrationRunner(JdbcTransactionManager txManager, JdbcTemplate jdbc, Dialect dialect,
      PasswordHasher passwordHasher, Clock clock, List<Migration> migrations) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.passwordHasher = Objects.requireNonNull(passwordHasher, "passwordHasher");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.migrations = List.copyOf(migrations);
  }

  /**
   * Runs every pending migration.
   *
   * @return how many migrations were applied in this pass
   * @throws MigrationException if any migration fails; nothing from this pass is kept
   */
  public int run() {
    try {
      int applied = txManager.withTransaction(conn -> {
        MigrationContext ctx = new MigrationContext(conn, jdbc, dialect, passwordHasher, clock);
        int count = 0;
        for (int i = 0; i < migrations.size(); i++) {
          Migration migration = migrations.get(i);
          try {
            if (migration.isApplied(ctx)) {
              logger.fine("Migration " + i + " (" + migration.description() + ") already applied");
              continue;
            }
            logger.info("Applying migration " + i + ": " + migration.description());
            migration.apply(ctx);
            count++;
          } catch (SQLException e) {
            throw new MigrationException(failure(i, migration), dialect.classify(e));
          } catch (MigrationException | QueryCancelledException e) {
            throw e;
          } catch (RuntimeException e) {
            throw new MigrationException(failure(i, migration), e);
          }
        }
        return count;
      });
      logger.info("Database migrations complete, " + applied + " applied");
      return applied;
    } catch (MigrationException e) {
      logger.log(Level.SEVERE, e.getMessage(), e);
      throw e;
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Migration transaction failed", e);
      throw new MigrationException("Migration transaction failed", e);
    }
  }

  private static String failure(int index, Migration migration) {
    return "Migration " + index + " (" + migration.description() + ") failed";
  }
}
