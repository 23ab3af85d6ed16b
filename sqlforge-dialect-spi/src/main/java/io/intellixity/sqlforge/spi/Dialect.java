package io.intellixity.sqlforge.spi;

import io.intellixity.sqlforge.node.Node;
import io.intellixity.sqlforge.node.NodeSource;

/**
 * Renders node trees for one database.
 *
 * <p>Implementations hold no per-call state: the same tree may be compiled concurrently by any number of
 * dialects.</p>
 */
public interface Dialect {
  default String id() {
    return descriptor().id();
  }

  DialectDescriptor descriptor();

  /**
   * @throws UnsupportedFeatureException the tree needs syntax this dialect lacks
   * @throws MalformedTreeException      a node has children of an invalid shape
   */
  CompiledQuery compile(Node root);

  default CompiledQuery compile(NodeSource source) {
    return compile(source.toNode());
  }
}
