package io.intellixity.sqlforge.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Dialect-neutral "on conflict" description.
 *
 * <p>Target is one of: a column list, a named constraint, or nothing (bare). Outcome is either do-nothing or
 * a list of assignments, each side optionally filtered: {@code indexWhere} applies to the conflict target and
 * {@code updateWhere} to the update.</p>
 */
public record OnConflictNode(
    List<ColumnReferenceNode> columns,
    String constraint,
    WhereNode indexWhere,
    boolean doNothing,
    List<ColumnUpdateNode> updates,
    WhereNode updateWhere
) implements Node {
  public OnConflictNode {
    columns = columns == null ? List.of() : List.copyOf(columns);
    updates = updates == null ? List.of() : List.copyOf(updates);
  }

  public static OnConflictNode create() {
    return new OnConflictNode(List.of(), null, null, false, List.of(), null);
  }

  public OnConflictNode withColumns(List<ColumnReferenceNode> more) {
    List<ColumnReferenceNode> all = new ArrayList<>(columns);
    all.addAll(more);
    return new OnConflictNode(all, constraint, indexWhere, doNothing, updates, updateWhere);
  }

  public OnConflictNode withConstraint(String constraint) {
    return new OnConflictNode(columns, constraint, indexWhere, doNothing, updates, updateWhere);
  }

  public OnConflictNode withIndexWhere(WhereNode indexWhere) {
    return new OnConflictNode(columns, constraint, indexWhere, doNothing, updates, updateWhere);
  }

  public OnConflictNode withDoNothing() {
    return new OnConflictNode(columns, constraint, indexWhere, true, List.of(), null);
  }

  public OnConflictNode withUpdates(List<ColumnUpdateNode> more) {
    List<ColumnUpdateNode> all = new ArrayList<>(updates);
    all.addAll(more);
    return new OnConflictNode(columns, constraint, indexWhere, false, all, updateWhere);
  }

  public OnConflictNode withUpdateWhere(WhereNode updateWhere) {
    return new OnConflictNode(columns, constraint, indexWhere, doNothing, updates, updateWhere);
  }

  public boolean hasTarget() {
    return !columns.isEmpty() || constraint != null;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
