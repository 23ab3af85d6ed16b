package io.intellixity.sqlforge.jdbc.mysql;

import io.intellixity.sqlforge.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.sqlforge.spi.DialectDescriptor;
import io.intellixity.sqlforge.spi.PlaceholderStyle;
import io.intellixity.sqlforge.spi.SqlFeature;

import java.util.EnumSet;

/**
 * MySQL dialect: backtick identifiers and {@code ?} placeholders.
 *
 * No {@code returning} and no {@code on conflict}; conflict handling is {@code insert ignore} and
 * {@code on duplicate key update}. Generated ids come back through the driver's generated keys.
 */
public final class MySqlDialect extends AbstractSqlDialect {
  public static final DialectDescriptor DESCRIPTOR = new DialectDescriptor(
      "mysql",
      "`",
      PlaceholderStyle.QUESTION_MARK,
      EnumSet.of(SqlFeature.ON_DUPLICATE_KEY_UPDATE, SqlFeature.INSERT_IGNORE, SqlFeature.LAST_INSERT_ID)
  );

  public MySqlDialect() {
    super(DESCRIPTOR);
  }
}
