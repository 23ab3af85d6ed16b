package io.intellixity.sqlforge.spi;

/** How a dialect spells the Nth bound parameter (1-based). */
public enum PlaceholderStyle {
  /** {@code $1, $2, ...} (Postgres). */
  DOLLAR_NUMBERED {
    @Override public String token(int index) { return "$" + index; }
  },
  /** {@code ?} for every parameter (MySQL, SQLite, JDBC). */
  QUESTION_MARK {
    @Override public String token(int index) { return "?"; }
  };

  public abstract String token(int index);
}
