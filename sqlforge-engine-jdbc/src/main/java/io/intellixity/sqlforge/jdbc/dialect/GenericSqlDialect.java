package io.intellixity.sqlforge.jdbc.dialect;

import io.intellixity.sqlforge.spi.DialectDescriptor;

/** Dialect defined purely by its descriptor, e.g. one read from JSON. */
public final class GenericSqlDialect extends AbstractSqlDialect {
  public GenericSqlDialect(DialectDescriptor descriptor) {
    super(descriptor);
  }
}
