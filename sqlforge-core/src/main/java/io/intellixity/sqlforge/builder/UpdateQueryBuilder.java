package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class UpdateQueryBuilder extends FilterableBuilder<UpdateQueryBuilder> {
  private final UpdateNode node;

  UpdateQueryBuilder(UpdateNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  @Override
  public UpdateNode toNode() {
    return node;
  }

  @Override
  protected WhereNode whereNode() {
    return node.where();
  }

  @Override
  protected UpdateQueryBuilder withWhere(WhereNode where) {
    return new UpdateQueryBuilder(node.withWhere(where));
  }

  public UpdateQueryBuilder set(Map<String, ?> updates) {
    return new UpdateQueryBuilder(node.withUpdates(NodeParsers.parseUpdates(updates)));
  }

  public UpdateQueryBuilder set(String column, Object value) {
    Map<String, Object> one = new LinkedHashMap<>();
    one.put(column, value);
    return set(one);
  }

  public UpdateQueryBuilder returning(String... selections) {
    return new UpdateQueryBuilder(node.withReturning(
        ReturningNode.append(node.returning(), NodeParsers.parseSelections(selections))));
  }

  public UpdateQueryBuilder returningAll() {
    return new UpdateQueryBuilder(node.withReturning(
        ReturningNode.append(node.returning(), List.of(SelectAllNode.all()))));
  }
}
