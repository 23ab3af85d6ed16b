package io.intellixity.sqlforge.node;

/** Sentinel: the database assigns this column's value, so the column is left out of the statement. */
public record GeneratedNode() implements Node {
  public static final GeneratedNode INSTANCE = new GeneratedNode();

  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
