package org.replikativ.persistent_rope;

import java.util.*;

public class Branch<T> extends ANode<T> {
  // == _left.count()
  public final int _weight;
  public final ANode<T> _left;
  public final ANode<T> _right;
  // _weight + _right.count(), cached so counting never walks the right spine
  public final int _count;

  public Branch(int weight, ANode<T> left, ANode<T> right) {
    assert weight == left.count() : weight + " != " + left.count();
    _weight = weight;
    _left   = left;
    _right  = right;
    _count  = weight + right.count();
  }

  @Override
  public int count() {
    return _count;
  }

  @Override
  public long footprint(Settings settings) {
    return NODE_BYTES;
  }

  /**
   * Pairs up {@code blocks}, popped from the end, into a tree {@code depth} branches
   * high. Slots left over once blocks run out are filled with empty blocks.
   */
  public static <T> ANode<T> buildBottomsUp(int depth, ArrayList<Block<T>> blocks) {
    if (blocks.isEmpty()) {
      return Block.empty();
    }
    if (depth <= 1) {
      Block<T> left = blocks.remove(blocks.size() - 1);
      ANode<T> right = blocks.isEmpty() ? Block.<T>empty() : blocks.remove(blocks.size() - 1);
      return new Branch<T>(left.count(), left, right);
    }
    ANode<T> left = buildBottomsUp(depth - 1, blocks);
    ANode<T> right = buildBottomsUp(depth - 1, blocks);
    return new Branch<T>(left.count(), left, right);
  }

  @Override
  public String str() {
    return "<" + _weight + "/" + _count + ">";
  }
}
