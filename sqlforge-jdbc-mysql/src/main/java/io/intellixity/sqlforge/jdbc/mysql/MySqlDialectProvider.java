package io.intellixity.sqlforge.jdbc.mysql;

import io.intellixity.sqlforge.spi.Dialect;
import io.intellixity.sqlforge.spi.DialectProvider;

import java.util.Collection;
import java.util.List;

public final class MySqlDialectProvider implements DialectProvider {
  @Override
  public Collection<Dialect> dialects() {
    return List.of(new MySqlDialect());
  }
}
