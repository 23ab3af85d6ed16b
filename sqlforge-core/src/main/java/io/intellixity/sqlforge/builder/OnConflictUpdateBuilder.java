package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.*;

import java.util.Objects;

/** {@code do update set ...} with an optional predicate on the update, e.g. {@code "excluded.name" != ?}. */
public final class OnConflictUpdateBuilder implements OnConflictSource {
  private final OnConflictNode node;

  OnConflictUpdateBuilder(OnConflictNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  @Override
  public OnConflictNode toNode() {
    return node;
  }

  public OnConflictUpdateBuilder where(Object lhs, String operator, Object rhs) {
    return new OnConflictUpdateBuilder(node.withUpdateWhere(
        WhereNode.combine(node.updateWhere(), Operator.AND, NodeParsers.parseFilter(lhs, operator, rhs))));
  }

  public OnConflictUpdateBuilder whereRef(Object lhs, String operator, Object rhs) {
    return new OnConflictUpdateBuilder(node.withUpdateWhere(
        WhereNode.combine(node.updateWhere(), Operator.AND, NodeParsers.parseReferenceFilter(lhs, operator, rhs))));
  }
}
