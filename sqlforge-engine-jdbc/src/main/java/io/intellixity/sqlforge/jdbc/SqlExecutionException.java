package io.intellixity.sqlforge.jdbc;

/** A driver error while executing compiled SQL. Never retried or classified here. */
public final class SqlExecutionException extends RuntimeException {
  public SqlExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
