package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.*;

/**
 * Shared where-clause methods for select/update/delete builders.
 *
 * <p>Each call returns a new builder; {@code where} calls are joined with {@code and}, {@code orWhere} calls with
 * {@code or}. Calls apply in order: {@code where(a).orWhere(b).where(c)} renders {@code (a or b) and c}.</p>
 */
public abstract class FilterableBuilder<B extends FilterableBuilder<B>> implements NodeSource {

  protected abstract WhereNode whereNode();

  protected abstract B withWhere(WhereNode where);

  /** {@code lhs op rhs} where {@code rhs} is bound as a parameter (or used as-is when it is a node/builder). */
  public B where(Object lhs, String operator, Object rhs) {
    return and(NodeParsers.parseFilter(lhs, operator, rhs));
  }

  /** Arbitrary predicate, e.g. a raw fragment. */
  public B where(NodeSource predicate) {
    return and(predicate.toNode());
  }

  /** {@code lhs op rhs} where both sides are references ({@code "pet.owner_id" = "person.id"}). */
  public B whereRef(Object lhs, String operator, Object rhs) {
    return and(NodeParsers.parseReferenceFilter(lhs, operator, rhs));
  }

  public B orWhere(Object lhs, String operator, Object rhs) {
    return or(NodeParsers.parseFilter(lhs, operator, rhs));
  }

  public B orWhere(NodeSource predicate) {
    return or(predicate.toNode());
  }

  public B orWhereRef(Object lhs, String operator, Object rhs) {
    return or(NodeParsers.parseReferenceFilter(lhs, operator, rhs));
  }

  public B whereExists(NodeSource subquery) {
    return and(new UnaryOperationNode(Operator.EXISTS, subquery.toNode()));
  }

  public B whereNotExists(NodeSource subquery) {
    return and(new UnaryOperationNode(Operator.NOT_EXISTS, subquery.toNode()));
  }

  private B and(Node predicate) {
    return withWhere(WhereNode.combine(whereNode(), Operator.AND, predicate));
  }

  private B or(Node predicate) {
    return withWhere(WhereNode.combine(whereNode(), Operator.OR, predicate));
  }
}
