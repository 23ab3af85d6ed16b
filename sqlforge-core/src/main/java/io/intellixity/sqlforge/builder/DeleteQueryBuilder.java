package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.*;

import java.util.List;
import java.util.Objects;

public final class DeleteQueryBuilder extends FilterableBuilder<DeleteQueryBuilder> {
  private final DeleteNode node;

  DeleteQueryBuilder(DeleteNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  @Override
  public DeleteNode toNode() {
    return node;
  }

  @Override
  protected WhereNode whereNode() {
    return node.where();
  }

  @Override
  protected DeleteQueryBuilder withWhere(WhereNode where) {
    return new DeleteQueryBuilder(node.withWhere(where));
  }

  public DeleteQueryBuilder returning(String... selections) {
    return new DeleteQueryBuilder(node.withReturning(
        ReturningNode.append(node.returning(), NodeParsers.parseSelections(selections))));
  }

  public DeleteQueryBuilder returningAll() {
    return new DeleteQueryBuilder(node.withReturning(
        ReturningNode.append(node.returning(), List.of(SelectAllNode.all()))));
  }
}
