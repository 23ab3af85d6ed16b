package io.intellixity.sqlforge.spi;

/** Syntax a dialect may or may not support. */
public enum SqlFeature {
  RETURNING("returning"),
  ON_CONFLICT("on conflict"),
  ON_CONFLICT_CONSTRAINT("on conflict on constraint"),
  ON_DUPLICATE_KEY_UPDATE("on duplicate key update"),
  INSERT_IGNORE("insert ignore"),
  FULL_JOIN("full join"),
  /** Driver reports the generated id of the last inserted row. */
  LAST_INSERT_ID("last insert id");

  private final String sql;

  SqlFeature(String sql) {
    this.sql = sql;
  }

  public String sql() {
    return sql;
  }
}
