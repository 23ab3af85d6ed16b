package io.intellixity.sqlforge.jdbc.sqlite;

import io.intellixity.sqlforge.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.sqlforge.spi.DialectDescriptor;
import io.intellixity.sqlforge.spi.PlaceholderStyle;
import io.intellixity.sqlforge.spi.SqlFeature;

import java.util.EnumSet;

/**
 * SQLite dialect (3.35+ for {@code returning}).
 *
 * Supports {@code on conflict (cols) [where ...]} but not named constraint targets.
 */
public final class SqliteDialect extends AbstractSqlDialect {
  public static final DialectDescriptor DESCRIPTOR = new DialectDescriptor(
      "sqlite",
      "\"",
      PlaceholderStyle.QUESTION_MARK,
      EnumSet.of(SqlFeature.RETURNING, SqlFeature.ON_CONFLICT, SqlFeature.FULL_JOIN, SqlFeature.LAST_INSERT_ID)
  );

  public SqliteDialect() {
    super(DESCRIPTOR);
  }
}
