package io.intellixity.sqlforge.node;

import java.util.Objects;

public record JoinNode(JoinType joinType, Node table, Node on) implements Node {
  public enum JoinType {
    INNER("inner join"),
    LEFT("left join"),
    RIGHT("right join"),
    FULL("full join");

    private final String sql;

    JoinType(String sql) {
      this.sql = sql;
    }

    public String sql() {
      return sql;
    }
  }

  public JoinNode {
    Objects.requireNonNull(joinType, "joinType");
    Objects.requireNonNull(table, "table");
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
