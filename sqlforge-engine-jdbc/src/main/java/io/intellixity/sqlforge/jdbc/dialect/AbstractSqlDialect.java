package io.intellixity.sqlforge.jdbc.dialect;

import io.intellixity.sqlforge.node.Node;
import io.intellixity.sqlforge.spi.CompiledQuery;
import io.intellixity.sqlforge.spi.Dialect;
import io.intellixity.sqlforge.spi.DialectDescriptor;
import io.intellixity.sqlforge.spi.SqlFeature;
import io.intellixity.sqlforge.spi.UnsupportedFeatureException;

import java.util.Objects;

/**
 * SQL dialect base driven by a {@link DialectDescriptor}.
 *
 * Provides the full statement grammar (select/insert/update/delete, joins, conflict clauses, returning) and
 * leaves quoting, placeholder spelling and feature checks to overridable hooks. Each {@link #compile(Node)}
 * call renders through a fresh {@link SqlCompiler}, so instances are stateless and thread-safe.
 */
public abstract class AbstractSqlDialect implements Dialect {
  private final DialectDescriptor descriptor;

  protected AbstractSqlDialect(DialectDescriptor descriptor) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
  }

  @Override
  public final DialectDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public final CompiledQuery compile(Node root) {
    Objects.requireNonNull(root, "root");
    return new SqlCompiler(this).compile(root);
  }

  /** Wrap an identifier in the dialect's quote character, doubling embedded quotes. */
  protected String quoteIdentifier(String ident) {
    String q = descriptor.identifierQuote();
    return q + ident.replace(q, q + q) + q;
  }

  /** Placeholder for the 1-based parameter {@code index}. */
  protected String placeholder(int index) {
    return descriptor.placeholderStyle().token(index);
  }

  protected void requireFeature(SqlFeature feature) {
    if (!descriptor.supports(feature)) throw new UnsupportedFeatureException(id(), feature);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + id() + "]";
  }
}
