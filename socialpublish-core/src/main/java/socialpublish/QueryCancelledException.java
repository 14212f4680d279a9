package socialpublish;

import java.util.concurrent.CancellationException;

/**
 * Raised when the thread waiting on a statement is interrupted.
 *
 * <p>By the time this is thrown the statement has been cancelled and its worker has
 * finished, and the waiting thread's interrupt flag has been restored. Enclosing
 * transactions roll back as for any other failure.
 */
public final class QueryCancelledException extends CancellationException {

  public QueryCancelledException(String message, Throwable cause) {
    super(message);
    if (cause != null) {
      initCause(cause);
    }
  }
}
