package io.intellixity.sqlforge.node;

import java.util.List;

public record OnDuplicateKeyUpdateNode(List<ColumnUpdateNode> updates) implements Node {
  public OnDuplicateKeyUpdateNode {
    updates = updates == null ? List.of() : List.copyOf(updates);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
