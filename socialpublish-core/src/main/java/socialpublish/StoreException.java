package socialpublish;

import java.util.Optional;

/**
 * Unchecked exception raised when a store operation fails because its transaction failed.
 *
 * <p>Lookups that match nothing are not failures and never raise this exception.
 * Callers that want to react to duplicates can inspect {@link #violation()}.
 *
 * @see SqlUpdateException
 */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns the classified constraint violation in this exception's cause chain, if any.
   *
   * @return the first {@link SqlUpdateException} found, starting with this exception
   */
  public Optional<SqlUpdateException> violation() {
    Throwable current = this;
    while (current != null) {
      if (current instanceof SqlUpdateException sqlUpdate) {
        return Optional.of(sqlUpdate);
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return Optional.empty();
  }
}
