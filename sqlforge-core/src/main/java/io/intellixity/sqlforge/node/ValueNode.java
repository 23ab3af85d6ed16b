package io.intellixity.sqlforge.node;

/** A literal that is never inlined: it becomes one bound parameter. {@code value} may be null. */
public record ValueNode(Object value) implements Node {
  @Override
  public <R> R accept(NodeVisitor<R> visitor) { return visitor.visit(this); }
}
