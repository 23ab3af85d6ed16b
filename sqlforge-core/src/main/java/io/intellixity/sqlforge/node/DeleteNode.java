package io.intellixity.sqlforge.node;

import java.util.Objects;

public record DeleteNode(FromNode from, WhereNode where, ReturningNode returning) implements Node {
  public DeleteNode {
    Objects.requireNonNull(from, "from");
  }

  public static DeleteNode from(FromNode from) {
    return new DeleteNode(from, null, null);
  }

  public DeleteNode withWhere(WhereNode where) {
    return new DeleteNode(from, where, returning);
  }

  public DeleteNode withReturning(ReturningNode returning) {
    return new DeleteNode(from, where, returning);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
