package io.intellixity.sqlforge.node;

import java.util.ArrayList;
import java.util.List;

public record ReturningNode(List<Node> selections) implements Node {
  public ReturningNode {
    selections = selections == null ? List.of() : List.copyOf(selections);
  }

  /** Append to an existing (possibly absent) returning clause. */
  public static ReturningNode append(ReturningNode existing, List<? extends Node> more) {
    List<Node> all = new ArrayList<>(existing == null ? List.of() : existing.selections());
    all.addAll(more);
    return new ReturningNode(all);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
