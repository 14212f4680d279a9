package socialpublish.jdbc.tx;

import socialpublish.QueryCancelledException;
import socialpublish.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Runs prepared statements on a dedicated worker pool so that the waiting thread
 * can react to interruption.
 *
 * <p>If the caller is interrupted while a statement runs, the executor:
 * <ol>
 *   <li>issues {@link PreparedStatement#cancel()} on the in-flight statement,</li>
 *   <li>waits, uninterruptibly, for the worker to finish responding to the cancel,</li>
 *   <li>restores the caller's interrupt flag and throws {@link QueryCancelledException}.</li>
 * </ol>
 * A statement the worker has not picked up yet is abandoned instead. Either way the
 * statement is closed only after its worker is done with it, so no live statement
 * outlives the enclosing transaction scope.
 */
public final class StatementExecutor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(StatementExecutor.class.getName());

  private final ExecutorService workers;
  private final int queryTimeoutSeconds;

  /**
   * @param workerThreads       size of the worker pool, normally the connection pool size
   * @param queryTimeoutSeconds per-statement timeout passed to the driver, 0 for none
   */
  public StatementExecutor(int workerThreads, int queryTimeoutSeconds) {
    if (workerThreads <= 0) {
      throw new IllegalArgumentException("workerThreads must be > 0");
    }
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    }
    this.workers = Executors.newFixedThreadPool(workerThreads,
        new DaemonThreadFactory("socialpublish-jdbc-"));
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  /**
   * Work performed against a prepared statement on a worker thread.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface StatementWork<T> {
    T run(PreparedStatement ps) throws SQLException;
  }

  /**
   * Prepares {@code sql} on {@code conn} and runs {@code work} against it on a worker.
   *
   * @throws SQLException           if preparing or running the statement fails
   * @throws QueryCancelledException if the calling thread was interrupted while waiting
   */
  public <T> T execute(Connection conn, String sql, StatementWork<T> work) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      if (queryTimeoutSeconds > 0) {
        ps.setQueryTimeout(queryTimeoutSeconds);
      }
      AtomicBoolean claimed = new AtomicBoolean();
      Future<T> future = workers.submit(() -> {
        if (!claimed.compareAndSet(false, true)) {
          // abandoned by an interrupted caller before it got here
          return null;
        }
        return work.run(ps);
      });
      try {
        return future.get();
      } catch (ExecutionException e) {
        throw unwrap(e);
      } catch (InterruptedException e) {
        QueryCancelledException cancelled = new QueryCancelledException("Statement cancelled: " + sql, e);
        if (claimed.compareAndSet(false, true)) {
          future.cancel(false);
        } else {
          try {
            ps.cancel();
          } catch (SQLException cancelFailure) {
            cancelled.addSuppressed(cancelFailure);
          }
          awaitWorker(future, cancelled);
        }
        logger.fine("Cancelled statement after interrupt: " + sql);
        Thread.currentThread().interrupt();
        throw cancelled;
      }
    }
  }

  private static void awaitWorker(Future<?> future, QueryCancelledException cancelled) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          future.get();
          return;
        } catch (InterruptedException e) {
          interrupted = true;
        } catch (ExecutionException e) {
          cancelled.addSuppressed(e.getCause() != null ? e.getCause() : e);
          return;
        } catch (CancellationException e) {
          return;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private static SQLException unwrap(ExecutionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof SQLException sql) {
      return sql;
    }
    if (cause instanceof RuntimeException runtime) {
      throw runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new SQLException("Statement failed", cause);
  }

  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warning("Statement workers did not terminate within 5s");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
