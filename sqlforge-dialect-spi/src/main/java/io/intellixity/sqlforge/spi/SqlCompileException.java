package io.intellixity.sqlforge.spi;

/**
 * Raised by {@link Dialect#compile} when a node tree cannot be rendered. No SQL is produced when this is thrown.
 */
public class SqlCompileException extends RuntimeException {
  public SqlCompileException(String message) {
    super(message);
  }

  public SqlCompileException(String message, Throwable cause) {
    super(message, cause);
  }
}
