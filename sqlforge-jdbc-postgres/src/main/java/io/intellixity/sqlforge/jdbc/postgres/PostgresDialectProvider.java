package io.intellixity.sqlforge.jdbc.postgres;

import io.intellixity.sqlforge.spi.Dialect;
import io.intellixity.sqlforge.spi.DialectProvider;

import java.util.Collection;
import java.util.List;

public final class PostgresDialectProvider implements DialectProvider {
  @Override
  public Collection<Dialect> dialects() {
    return List.of(new PostgresDialect());
  }
}
