package io.intellixity.sqlforge.spi;

import java.util.Collection;

/** Discovers {@link Dialect} implementations (listed in META-INF/sqlforge.factories). */
public interface DialectProvider {
  Collection<Dialect> dialects();
}
