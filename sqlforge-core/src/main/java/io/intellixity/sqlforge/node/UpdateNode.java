package io.intellixity.sqlforge.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record UpdateNode(
    TableNode table,
    List<ColumnUpdateNode> updates,
    WhereNode where,
    ReturningNode returning
) implements Node {
  public UpdateNode {
    Objects.requireNonNull(table, "table");
    updates = updates == null ? List.of() : List.copyOf(updates);
  }

  public static UpdateNode table(TableNode table) {
    return new UpdateNode(table, List.of(), null, null);
  }

  public UpdateNode withUpdates(List<ColumnUpdateNode> more) {
    List<ColumnUpdateNode> all = new ArrayList<>(updates);
    all.addAll(more);
    return new UpdateNode(table, all, where, returning);
  }

  public UpdateNode withWhere(WhereNode where) {
    return new UpdateNode(table, updates, where, returning);
  }

  public UpdateNode withReturning(ReturningNode returning) {
    return new UpdateNode(table, updates, where, returning);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
