package socialpublish.jdbc.migration;

import java.sql.SQLException;
import java.util.List;

/**
 * One forward-only schema or data change.
 *
 * <p>A migration detects its own prior application by inspecting the live schema or
 * data ({@link #isApplied}); there is no version table. {@link #apply} only runs when
 * {@code isApplied} returned {@code false}, and may assume every earlier migration
 * in the list has been applied.
 */
public interface Migration {

  String description();

  boolean isApplied(MigrationContext ctx) throws SQLException;

  void apply(MigrationContext ctx) throws SQLException;

  @FunctionalInterface
  interface Check {
    boolean test(MigrationContext ctx) throws SQLException;
  }

  @FunctionalInterface
  interface Step {
    void run(MigrationContext ctx) throws SQLException;
  }

  /**
   * A migration that runs {@code statements} in order.
   */
  static Migration ddl(String description, Check isApplied, String... statements) {
    List<String> ddl = List.of(statements);
    return of(description, isApplied, ctx -> {
      for (String sql : ddl) {
        ctx.execute(sql);
      }
    });
  }

  static Migration of(String description, Check isApplied, Step apply) {
    return new Migration() {
      @Override
      public String description() {
        return description;
      }

      @Override
      public boolean isApplied(MigrationContext ctx) throws SQLException {
        return isApplied.test(ctx);
      }

      @Override
      public void apply(MigrationContext ctx) throws SQLException {
        apply.run(ctx);
      }
    };
  }
}
