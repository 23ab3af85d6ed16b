package io.intellixity.sqlforge.spi;

public enum QueryKind {
  SELECT,
  INSERT,
  UPDATE,
  DELETE,
  /** Root was a raw fragment or a bare expression. */
  RAW
}
