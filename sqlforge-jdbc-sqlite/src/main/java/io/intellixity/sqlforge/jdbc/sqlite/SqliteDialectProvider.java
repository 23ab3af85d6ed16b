package io.intellixity.sqlforge.jdbc.sqlite;

import io.intellixity.sqlforge.spi.Dialect;
import io.intellixity.sqlforge.spi.DialectProvider;

import java.util.Collection;
import java.util.List;

public final class SqliteDialectProvider implements DialectProvider {
  @Override
  public Collection<Dialect> dialects() {
    return List.of(new SqliteDialect());
  }
}
