package io.intellixity.sqlforge.builder;

import io.intellixity.sqlforge.node.NodeSource;
import io.intellixity.sqlforge.node.OnConflictNode;

/** Result of an {@code onConflict} callback. */
public interface OnConflictSource extends NodeSource {
  @Override
  OnConflictNode toNode();
}
