package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.*;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Conflict target and index predicate; finish with {@link #doNothing()} or {@link #doUpdateSet(Map)}. */
public final class OnConflictBuilder implements OnConflictSource {
  private final OnConflictNode node;

  OnConflictBuilder(OnConflictNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  @Override
  public OnConflictNode toNode() {
    return node;
  }

  public OnConflictBuilder column(String column) {
    return new OnConflictBuilder(node.withColumns(List.of(NodeParsers.parseColumn(column))));
  }

  public OnConflictBuilder columns(List<String> columns) {
    return new OnConflictBuilder(node.withColumns(NodeParsers.parseColumns(columns)));
  }

  /** Named constraint target ({@code on conflict on constraint "name"}). */
  public OnConflictBuilder constraint(String constraint) {
    if (constraint == null || constraint.isBlank()) throw new IllegalArgumentException("constraint must not be blank");
    return new OnConflictBuilder(node.withConstraint(constraint));
  }

  /** Predicate on the conflict target (partial unique index). */
  public OnConflictBuilder where(Object lhs, String operator, Object rhs) {
    return new OnConflictBuilder(node.withIndexWhere(
        WhereNode.combine(node.indexWhere(), Operator.AND, NodeParsers.parseFilter(lhs, operator, rhs))));
  }

  public OnConflictBuilder whereRef(Object lhs, String operator, Object rhs) {
    return new OnConflictBuilder(node.withIndexWhere(
        WhereNode.combine(node.indexWhere(), Operator.AND, NodeParsers.parseReferenceFilter(lhs, operator, rhs))));
  }

  public OnConflictSource doNothing() {
    OnConflictNode done = node.withDoNothing();
    return () -> done;
  }

  public OnConflictUpdateBuilder doUpdateSet(Map<String, ?> updates) {
    return new OnConflictUpdateBuilder(node.withUpdates(NodeParsers.parseUpdates(updates)));
  }
}
