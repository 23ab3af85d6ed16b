package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.*;

import java.util.*;

/**
 * Entry points of the builder layer.
 *
 * <pre>
 * insertInto("person")
 *     .values(row("id", GENERATED, "first_name", "Foo"))
 *     .onConflict(oc -&gt; oc.column("first_name").doNothing());
 * </pre>
 *
 * Every builder is immutable; each call returns a new builder around a new root node.
 */
public final class QueryBuilders {
  /** Value meaning "let the database assign this column". */
  public static final GeneratedNode GENERATED = GeneratedNode.INSTANCE;

  private QueryBuilders() {}

  public static InsertQueryBuilder insertInto(String table) {
    return new InsertQueryBuilder(InsertNode.into(NodeParsers.parseTable(table)));
  }

  public static SelectQueryBuilder selectFrom(String... tables) {
    if (tables.length == 0) throw new IllegalArgumentException("selectFrom requires at least one table");
    List<Node> froms = new ArrayList<>(tables.length);
    for (String t : tables) froms.add(NodeParsers.parseTableExpression(t));
    return new SelectQueryBuilder(SelectNode.from(new FromNode(froms)));
  }

  /** Select from a derived table or other expression. */
  public static SelectQueryBuilder selectFrom(NodeSource from) {
    return new SelectQueryBuilder(SelectNode.from(new FromNode(List.of(from.toNode()))));
  }

  public static UpdateQueryBuilder updateTable(String table) {
    return new UpdateQueryBuilder(UpdateNode.table(NodeParsers.parseTable(table)));
  }

  public static DeleteQueryBuilder deleteFrom(String table) {
    return new DeleteQueryBuilder(DeleteNode.from(new FromNode(List.of(NodeParsers.parseTable(table)))));
  }

  /**
   * Raw SQL. Each {@code ?} slot consumes one entry of {@code parameters}; entries that are nodes or builders
   * are compiled in place, everything else is bound.
   */
  public static RawBuilder raw(String sql, Object... parameters) {
    return raw(sql, Arrays.asList(parameters));
  }

  public static RawBuilder raw(String sql, List<?> parameters) {
    RawNode.Slots slots = RawNode.scan(sql);
    List<String> fragments = slots.fragments();
    List<?> params = parameters == null ? List.of() : parameters;
    if (fragments.size() - 1 != params.size()) {
      throw new IllegalArgumentException("Raw SQL has " + (fragments.size() - 1) + " parameter slot(s) but "
          + params.size() + " value(s) were given: " + sql);
    }
    return new RawBuilder(new RawNode(fragments, NodeParsers.parseValues(params), slots.literalQuestionMark()));
  }

  public static Node ref(String reference) {
    return NodeParsers.parseReference(reference);
  }

  public static Node val(Object value) {
    return new ValueNode(value);
  }

  public static Node cmp(Object lhs, String operator, Object rhs) {
    return NodeParsers.parseFilter(lhs, operator, rhs);
  }

  public static Node and(NodeSource... predicates) {
    return combine(Operator.AND, predicates);
  }

  public static Node or(NodeSource... predicates) {
    return combine(Operator.OR, predicates);
  }

  public static Node not(NodeSource predicate) {
    return new UnaryOperationNode(Operator.NOT, predicate.toNode());
  }

  /** Insertion-ordered row map from alternating column/value arguments. */
  public static Map<String, Object> row(Object... columnsAndValues) {
    if (columnsAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("row() expects column/value pairs");
    }
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < columnsAndValues.length; i += 2) {
      if (!(columnsAndValues[i] instanceof String column)) {
        throw new IllegalArgumentException("Column name expected at position " + i);
      }
      out.put(column, columnsAndValues[i + 1]);
    }
    return out;
  }

  private static Node combine(Operator op, NodeSource... predicates) {
    if (predicates.length == 0) throw new IllegalArgumentException(op.sql() + " requires at least one predicate");
    Node acc = predicates[0].toNode();
    for (int i = 1; i < predicates.length; i++) {
      acc = new BinaryOperationNode(acc, op, predicates[i].toNode());
    }
    return predicates.length == 1 ? acc : new ParensNode(acc);
  }
}
