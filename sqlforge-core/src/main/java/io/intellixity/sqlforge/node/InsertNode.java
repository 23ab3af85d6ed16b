package io.intellixity.sqlforge.node;

import java.util.List;
import java.util.Objects;

/**
 * Insert statement. Exactly one of {@code values} and {@code expression} is expected to be set by the time the
 * tree is compiled; the compiler reports anything else as a malformed tree.
 */
public record InsertNode(
    TableNode into,
    List<ColumnReferenceNode> columns,
    ValuesNode values,
    Node expression,
    boolean ignore,
    OnConflictNode onConflict,
    OnDuplicateKeyUpdateNode onDuplicateKeyUpdate,
    ReturningNode returning
) implements Node {
  public InsertNode {
    Objects.requireNonNull(into, "into");
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  public static InsertNode into(TableNode table) {
    return new InsertNode(table, List.of(), null, null, false, null, null, null);
  }

  public InsertNode withColumns(List<ColumnReferenceNode> columns) {
    return new InsertNode(into, columns, values, expression, ignore, onConflict, onDuplicateKeyUpdate, returning);
  }

  public InsertNode withValues(List<ColumnReferenceNode> columns, ValuesNode values) {
    return new InsertNode(into, columns, values, null, ignore, onConflict, onDuplicateKeyUpdate, returning);
  }

  public InsertNode withExpression(Node expression) {
    return new InsertNode(into, columns, null, expression, ignore, onConflict, onDuplicateKeyUpdate, returning);
  }

  public InsertNode withIgnore() {
    return new InsertNode(into, columns, values, expression, true, onConflict, onDuplicateKeyUpdate, returning);
  }

  public InsertNode withOnConflict(OnConflictNode onConflict) {
    return new InsertNode(into, columns, values, expression, ignore, onConflict, onDuplicateKeyUpdate, returning);
  }

  public InsertNode withOnDuplicateKeyUpdate(OnDuplicateKeyUpdateNode node) {
    return new InsertNode(into, columns, values, expression, ignore, onConflict, node, returning);
  }

  public InsertNode withReturning(ReturningNode returning) {
    return new InsertNode(into, columns, values, expression, ignore, onConflict, onDuplicateKeyUpdate, returning);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
