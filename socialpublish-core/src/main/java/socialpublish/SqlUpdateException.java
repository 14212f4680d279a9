package socialpublish;

/**
 * A failed SQL statement, classified by the kind of constraint it violated.
 *
 * <ul>
 *   <li>{@link UniqueViolation}: a unique or primary key constraint</li>
 *   <li>{@link ForeignKeyViolation}: a referential integrity constraint</li>
 *   <li>{@link CheckViolation}: a {@code CHECK} constraint</li>
 *   <li>{@link Unknown}: anything else</li>
 * </ul>
 *
 * <p>Classification is best-effort and engine-specific: embedded engines report
 * violations only through message text, so {@link #table()}, {@link #column()}
 * and {@link #constraint()} may all be {@code null}.
 */
public abstract sealed class SqlUpdateException extends StoreException
    permits SqlUpdateException.UniqueViolation,
    SqlUpdateException.ForeignKeyViolation,
    SqlUpdateException.CheckViolation,
    SqlUpdateException.Unknown {

  private final String table;
  private final String column;
  private final String constraint;

  private SqlUpdateException(String message, String table, String column, String constraint,
      Throwable cause) {
    super(message, cause);
    this.table = table;
    this.column = column;
    this.constraint = constraint;
  }

  public String table() {
    return table;
  }

  public String column() {
    return column;
  }

  public String constraint() {
    return constraint;
  }

  public static final class UniqueViolation extends SqlUpdateException {
    public UniqueViolation(String table, String column, String constraint, Throwable cause) {
      super("Unique constraint violation: " + constraint, table, column, constraint, cause);
    }
  }

  public static final class ForeignKeyViolation extends SqlUpdateException {
    public ForeignKeyViolation(String table, String column, String constraint, Throwable cause) {
      super("Foreign key constraint violation: " + constraint, table, column, constraint, cause);
    }
  }

  public static final class CheckViolation extends SqlUpdateException {
    public CheckViolation(String table, String column, String constraint, Throwable cause) {
      super("Check constraint violation: " + constraint, table, column, constraint, cause);
    }
  }

  public static final class Unknown extends SqlUpdateException {
    public Unknown(String message, Throwable cause) {
      super(message == null ? "Unknown SQL error" : message, null, null, null, cause);
    }
  }
}
