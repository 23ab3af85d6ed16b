package io.intellixity.sqlforge.node;

/** Anything that can hand out a node tree: nodes themselves and every query builder. */
@FunctionalInterface
public interface NodeSource {
  Node toNode();
}
