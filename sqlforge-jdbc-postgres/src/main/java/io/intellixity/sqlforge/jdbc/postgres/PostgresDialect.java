package io.intellixity.sqlforge.jdbc.postgres;

import io.intellixity.sqlforge.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.sqlforge.spi.DialectDescriptor;
import io.intellixity.sqlforge.spi.PlaceholderStyle;
import io.intellixity.sqlforge.spi.SqlFeature;

import java.util.EnumSet;

/**
 * Postgres dialect.
 *
 * Double-quoted identifiers, {@code $1..$n} placeholders, {@code returning} and the full {@code on conflict}
 * grammar including named constraint targets. Rendering itself lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public static final DialectDescriptor DESCRIPTOR = new DialectDescriptor(
      "postgres",
      "\"",
      PlaceholderStyle.DOLLAR_NUMBERED,
      EnumSet.of(SqlFeature.RETURNING, SqlFeature.ON_CONFLICT, SqlFeature.ON_CONFLICT_CONSTRAINT,
          SqlFeature.FULL_JOIN)
  );

  public PostgresDialect() {
    super(DESCRIPTOR);
  }
}
