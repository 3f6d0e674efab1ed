package org.replikativ.persistent_rope;

/**
 * A node of the rope tree, either a {@link Block} of items or a {@link Branch}
 * over two subtrees. Nodes never change after construction, so any subtree can
 * be shared between rope versions.
 */
public abstract class ANode<T> {
  // Rough object header plus fields, in bytes
  public static final int NODE_BYTES = 32;

  // Items under this node
  public abstract int count();

  // Bytes held by this node alone, children excluded
  public abstract long footprint(Settings settings);

  public abstract String str();
}
