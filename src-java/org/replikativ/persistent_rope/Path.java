package org.replikativ.persistent_rope;

import java.util.*;

/**
 * Branches visited on the way from a root down to the block holding an offset.
 * Edits rewrite the block and then copy only these branches, sharing every
 * sibling subtree with the old tree.
 */
@SuppressWarnings("unchecked")
class Path<T> {
  Branch<T>[] _branches = new Branch[16];
  boolean[] _wentLeft = new boolean[16];
  int _len = 0;

  Block<T> _block;
  // offset local to _block
  int _offset;

  static <T> Path<T> descend(ANode<T> root, int off) {
    Path<T> path = new Path<T>();
    ANode<T> node = root;
    while (node instanceof Branch) {
      Branch<T> branch = (Branch<T>) node;
      if (off < branch._weight) {
        path.push(branch, true);
        node = branch._left;
      } else {
        path.push(branch, false);
        off -= branch._weight;
        node = branch._right;
      }
    }
    path._block = (Block<T>) node;
    path._offset = off;
    return path;
  }

  private void push(Branch<T> branch, boolean wentLeft) {
    if (_len == _branches.length) {
      _branches = Arrays.copyOf(_branches, _len * 2);
      _wentLeft = Arrays.copyOf(_wentLeft, _len * 2);
    }
    _branches[_len] = branch;
    _wentLeft[_len] = wentLeft;
    _len += 1;
  }

  // nodes from root to block, inclusive
  int depth() {
    return _len + 1;
  }

  /**
   * Replaces the block at the bottom of this path with {@code node} and copies the
   * branches above it. {@code delta} is added to the weight of every branch the
   * path left through its left child.
   */
  ANode<T> rebuild(ANode<T> node, int delta) {
    for (int i = _len - 1; i >= 0; --i) {
      Branch<T> branch = _branches[i];
      if (_wentLeft[i]) {
        node = new Branch<T>(branch._weight + delta, node, branch._right);
      } else {
        node = new Branch<T>(branch._weight, branch._left, node);
      }
    }
    return node;
  }
}
