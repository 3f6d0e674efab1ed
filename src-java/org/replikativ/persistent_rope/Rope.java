package org.replikativ.persistent_rope;

import java.util.*;
import java.util.function.*;
import clojure.lang.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persistent indexed sequence stored as a binary tree of array blocks.
 *
 * <p>Every edit returns a new rope that copies only the branches on the path to
 * the edited block and shares all other nodes with the receiver. Ropes are
 * immutable, so any number of threads may read the same rope without locking.
 * Two edits made to the same rope produce two unrelated ropes; callers that need
 * a single next version must serialize their edits themselves.
 *
 * <p>After an insert the rope may rebuild itself into a balanced tree, see
 * {@link Settings#canRebalance(int, int)}. Use {@link #setAutoRebalance(boolean)}
 * to turn that off and {@link #rebalance()} to rebuild at a moment of your choice.
 */
@SuppressWarnings("unchecked")
public class Rope<T> implements IObj, Indexed {
  private static final Logger LOG = LoggerFactory.getLogger(Rope.class);

  // Rough object header plus fields, in bytes
  public static final int ROPE_BYTES = 32;

  public static final Keyword ERROR    = Keyword.intern("error");
  public static final Keyword EXPECTED = Keyword.intern("expected");
  public static final Keyword ACTUAL   = Keyword.intern("actual");
  public static final Keyword REBALANCE_FATAL = Keyword.intern("rope", "rebalance-fatal");

  public static final Rope EMPTY = new Rope();

  public final IPersistentMap _meta;
  public final int _len;
  public final ANode<T> _root;
  public final boolean _autoRebalance;
  public final Settings _settings;

  public Rope() {
    this(Settings.DEFAULT);
  }

  public Rope(Settings settings) {
    this(null, 0, Block.<T>empty(), true, settings);
  }

  public Rope(IPersistentMap meta, int len, ANode<T> root, boolean autoRebalance, Settings settings) {
    assert len == root.count() : len + " != " + root.count();
    _meta          = meta;
    _len           = len;
    _root          = root;
    _autoRebalance = autoRebalance;
    _settings      = settings;
  }

  public static <T> Rope<T> empty() {
    return (Rope<T>) EMPTY;
  }

  public ANode<T> root() {
    return _root;
  }

  public Settings settings() {
    return _settings;
  }

  public boolean autoRebalance() {
    return _autoRebalance;
  }

  /**
   * Same contents and tree, with rebalancing after inserts switched on or off.
   */
  public Rope<T> setAutoRebalance(boolean autoRebalance) {
    if (autoRebalance == _autoRebalance) {
      return this;
    }
    return new Rope<T>(_meta, _len, _root, autoRebalance, _settings);
  }

  // Counted
  public int count() {
    return _len;
  }

  /**
   * Estimated bytes used by this rope and every node reachable from it. Nodes
   * shared with other ropes are counted in full.
   */
  public long footprint() {
    long[] acc = new long[] {ROPE_BYTES};
    walk((node, depth) -> acc[0] += node.footprint(_settings));
    return acc[0];
  }

  public T get(int index) {
    checkIndex(index, _len);
    ANode<T> node = _root;
    while (node instanceof Branch) {
      Branch<T> branch = (Branch<T>) node;
      if (index < branch._weight) {
        node = branch._left;
      } else {
        index -= branch._weight;
        node = branch._right;
      }
    }
    return ((Block<T>) node).get(index);
  }

  // Indexed
  public T nth(int index) {
    return get(index);
  }

  public Object nth(int index, Object notFound) {
    if (index < 0 || index >= _len) {
      return notFound;
    }
    return get(index);
  }

  /**
   * Rope with {@code value} at {@code off}, shifting later items right by one.
   * {@code off == count()} appends.
   */
  public Rope<T> insert(int off, T value) {
    if (off < 0 || off > _len) {
      throw new IndexOutOfBoundsException("Offset " + off + " out of bounds for insert into length " + _len);
    }
    Path<T> path = Path.descend(_root, off);
    ANode<T> root = path.rebuild(path._block.insert(path._offset, value, _settings), 1);
    int len = _len + 1;
    int maxDepth = path.depth();
    if (_autoRebalance && _settings.canRebalance(maxDepth, len)) {
      root = rebuild(root, len, maxDepth);
    }
    return new Rope<T>(_meta, len, root, _autoRebalance, _settings);
  }

  public Rope<T> set(int off, T value) {
    checkIndex(off, _len);
    Path<T> path = Path.descend(_root, off);
    ANode<T> root = path.rebuild(path._block.set(path._offset, value), 0);
    return new Rope<T>(_meta, _len, root, _autoRebalance, _settings);
  }

  public Rope<T> delete(int off) {
    checkIndex(off, _len);
    Path<T> path = Path.descend(_root, off);
    ANode<T> root = path.rebuild(path._block.delete(path._offset), -1);
    return new Rope<T>(_meta, _len - 1, root, _autoRebalance, _settings);
  }

  /**
   * Same contents in a freshly built balanced tree. Runs regardless of
   * {@link #autoRebalance()}.
   */
  public Rope<T> rebalance() {
    return new Rope<T>(_meta, _len, rebuild(_root, _len, -1), _autoRebalance, _settings);
  }

  // maxDepth is informational, -1 when the rebuild was requested explicitly
  static <T> ANode<T> rebuild(ANode<T> root, int len, int maxDepth) {
    ArrayList<Block<T>> blocks = collectBlocks(root);
    Collections.reverse(blocks);
    int depth = ceilLog2(len) + 1;
    LOG.debug("Rebalancing {} blocks into depth {}, max depth was {}", blocks.size(), depth, maxDepth);
    return verify(Branch.buildBottomsUp(depth, blocks), len);
  }

  static <T> ANode<T> verify(ANode<T> root, int expected) {
    int actual = root.count();
    if (actual != expected) {
      throw new ExceptionInfo("Rebalance length mismatch " + actual + " != " + expected,
                              RT.mapUniqueKeys(ERROR, REBALANCE_FATAL, EXPECTED, expected, ACTUAL, actual));
    }
    return root;
  }

  // Non-empty blocks, left to right
  static <T> ArrayList<Block<T>> collectBlocks(ANode<T> root) {
    ArrayList<Block<T>> acc = new ArrayList<>();
    ArrayDeque<ANode<T>> stack = new ArrayDeque<>();
    ANode<T> node = root;
    while (true) {
      if (node instanceof Branch) {
        Branch<T> branch = (Branch<T>) node;
        stack.push(branch._right);
        node = branch._left;
      } else {
        if (node.count() > 0) {
          acc.add((Block<T>) node);
        }
        if (stack.isEmpty()) {
          return acc;
        }
        node = stack.pop();
      }
    }
  }

  static int ceilLog2(int n) {
    return n <= 1 ? 0 : 32 - Integer.numberOfLeadingZeros(n - 1);
  }

  // Pre-order, left before right. Depth of the root is 1.
  void walk(ObjIntConsumer<ANode<T>> onNode) {
    ArrayDeque<ANode<T>> nodes = new ArrayDeque<>();
    ArrayDeque<Integer> depths = new ArrayDeque<>();
    nodes.push(_root);
    depths.push(1);
    while (!nodes.isEmpty()) {
      ANode<T> node = nodes.pop();
      int depth = depths.pop();
      onNode.accept(node, depth);
      if (node instanceof Branch) {
        Branch<T> branch = (Branch<T>) node;
        nodes.push(branch._right);
        depths.push(depth + 1);
        nodes.push(branch._left);
        depths.push(depth + 1);
      }
    }
  }

  /**
   * Nodes on the longest root-to-block path, block included.
   */
  public int depth() {
    int[] max = new int[] {0};
    walk((node, depth) -> max[0] = Math.max(max[0], depth));
    return max[0];
  }

  public int blockCount() {
    int[] acc = new int[] {0};
    walk((node, depth) -> {
      if (node instanceof Block) acc[0] += 1;
    });
    return acc[0];
  }

  private static void checkIndex(int index, int len) {
    if (index < 0 || index >= len) {
      throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + len);
    }
  }

  // IObj
  public IPersistentMap meta() {
    return _meta;
  }

  public Rope<T> withMeta(IPersistentMap meta) {
    if (_meta == meta) {
      return this;
    }
    return new Rope<T>(meta, _len, _root, _autoRebalance, _settings);
  }

  public String str() {
    StringBuilder sb = new StringBuilder();
    walk((node, depth) -> {
      if (sb.length() > 0) sb.append("\n");
      for (int i = 1; i < depth; ++i)
        sb.append("| ");
      sb.append(node.str());
    });
    return sb.toString();
  }

  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (Block<T> block: collectBlocks(_root)) {
      for (Object item: block._items) {
        if (sb.length() > 1) sb.append(" ");
        sb.append(item);
      }
    }
    return sb.append("]").toString();
  }
}
