package socialpublish.jdbc.migration;

import socialpublish.StoreException;

/**
 * Raised when the migration pass fails. The whole pass has been rolled back and the
 * database must not be used.
 */
public final class MigrationException extends StoreException {

  public MigrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
