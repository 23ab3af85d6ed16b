package io.intellixity.sqlforge.spi;

/** A node has children of an invalid shape, e.g. an insert with no rows. */
public final class MalformedTreeException extends SqlCompileException {
  public MalformedTreeException(String message) {
    super(message);
  }
}
