package org.replikativ.persistent_rope;

import java.util.*;

@SuppressWarnings("unchecked")
public class Block<T> extends ANode<T> {
  // NotNull, exactly as long as the number of items
  public final Object[] _items;

  public Block(Object[] items) {
    _items = items;
  }

  public static <T> Block<T> empty() {
    return new Block<T>(new Object[0]);
  }

  @Override
  public int count() {
    return _items.length;
  }

  @Override
  public long footprint(Settings settings) {
    return NODE_BYTES + (long) _items.length * settings.elementSize();
  }

  public T get(int idx) {
    return (T) _items[idx];
  }

  /**
   * Returns a block with {@code value} spliced in at {@code off}, or a branch over
   * two halves when this block is already at capacity.
   */
  public ANode<T> insert(int off, T value, Settings settings) {
    int len = _items.length;
    assert 0 <= off && off <= len;

    // simply adding to array
    if (len < settings.leafCapacity()) {
      Object[] items = new Object[len + 1];
      new Stitch(items, 0)
        .copyAll(_items, 0, off)
        .copyOne(value)
        .copyAll(_items, off, len);
      return new Block<T>(items);
    }

    // splitting, a block of 0 or 1 items keeps them all on the left
    int half1 = (len + 1) >>> 1;

    // goes to first half
    if (off < half1) {
      Object[] left = new Object[half1 + 1];
      new Stitch(left, 0)
        .copyAll(_items, 0, off)
        .copyOne(value)
        .copyAll(_items, off, half1);
      Object[] right = Arrays.copyOfRange(_items, half1, len);
      return new Branch<T>(left.length, new Block<T>(left), new Block<T>(right));
    }

    // copy first, insert to second
    Object[] left = Arrays.copyOfRange(_items, 0, half1);
    Object[] right = new Object[len - half1 + 1];
    new Stitch(right, 0)
      .copyAll(_items, half1, off)
      .copyOne(value)
      .copyAll(_items, off, len);
    return new Branch<T>(left.length, new Block<T>(left), new Block<T>(right));
  }

  public Block<T> set(int off, T value) {
    Object[] items = Arrays.copyOf(_items, _items.length);
    items[off] = value;
    return new Block<T>(items);
  }

  public Block<T> delete(int off) {
    int len = _items.length;
    Object[] items = new Object[len - 1];
    new Stitch(items, 0)
      .copyAll(_items, 0, off)
      .copyAll(_items, off + 1, len);
    return new Block<T>(items);
  }

  @Override
  public String str() {
    StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < _items.length; ++i) {
      if (i > 0) sb.append(" ");
      sb.append(_items[i]);
    }
    return sb.append("}").toString();
  }
}
