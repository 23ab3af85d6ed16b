package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.*;

import java.util.*;
import java.util.function.Function;

public final class InsertQueryBuilder implements NodeSource {
  private final InsertNode node;

  InsertQueryBuilder(InsertNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  @Override
  public InsertNode toNode() {
    return node;
  }

  /** Single row. Iteration order of {@code row} is the column order. */
  public InsertQueryBuilder values(Map<String, ?> row) {
    return values(List.of(Objects.requireNonNull(row, "row")));
  }

  /**
   * Multiple rows. Columns are the union of all row keys in first-seen order; a row lacking a column gets
   * {@link GeneratedNode} for it.
   */
  public InsertQueryBuilder values(List<? extends Map<String, ?>> rows) {
    Objects.requireNonNull(rows, "rows");
    LinkedHashSet<String> columnNames = new LinkedHashSet<>();
    for (Map<String, ?> row : rows) columnNames.addAll(row.keySet());

    List<ValueListNode> tuples = new ArrayList<>(rows.size());
    for (Map<String, ?> row : rows) {
      List<Node> values = new ArrayList<>(columnNames.size());
      for (String column : columnNames) {
        values.add(row.containsKey(column) ? NodeParsers.parseValue(row.get(column)) : GeneratedNode.INSTANCE);
      }
      tuples.add(new ValueListNode(values));
    }
    return new InsertQueryBuilder(node.withValues(NodeParsers.parseColumns(columnNames), new ValuesNode(tuples)));
  }

  /** Column list for {@link #expression(NodeSource)}. */
  public InsertQueryBuilder columns(List<String> columns) {
    return new InsertQueryBuilder(node.withColumns(NodeParsers.parseColumns(columns)));
  }

  /** Insert the result of an expression, typically a select. */
  public InsertQueryBuilder expression(NodeSource expression) {
    return new InsertQueryBuilder(node.withExpression(expression.toNode()));
  }

  /** {@code insert ignore} (MySQL). */
  public InsertQueryBuilder ignore() {
    return new InsertQueryBuilder(node.withIgnore());
  }

  /**
   * {@code on conflict} clause, e.g.
   * {@code onConflict(oc -> oc.column("name").doUpdateSet(Map.of("species", "hamster")))}.
   */
  public InsertQueryBuilder onConflict(Function<OnConflictBuilder, ? extends OnConflictSource> build) {
    OnConflictSource oc = build.apply(new OnConflictBuilder(OnConflictNode.create()));
    return new InsertQueryBuilder(node.withOnConflict(Objects.requireNonNull(oc, "onConflict").toNode()));
  }

  /** {@code on duplicate key update} (MySQL). */
  public InsertQueryBuilder onDuplicateKeyUpdate(Map<String, ?> updates) {
    return new InsertQueryBuilder(node.withOnDuplicateKeyUpdate(
        new OnDuplicateKeyUpdateNode(NodeParsers.parseUpdates(updates))));
  }

  public InsertQueryBuilder returning(String... selections) {
    return new InsertQueryBuilder(node.withReturning(
        ReturningNode.append(node.returning(), NodeParsers.parseSelections(selections))));
  }

  public InsertQueryBuilder returningAll() {
    return new InsertQueryBuilder(node.withReturning(
        ReturningNode.append(node.returning(), List.of(SelectAllNode.all()))));
  }
}
