package org.replikativ.persistent_rope;

public class Settings {
  public static final int    DEFAULT_LEAF_CAP_BYTES      = 1024;
  public static final int    DEFAULT_ELEMENT_SIZE        = 8;
  public static final int    DEFAULT_MIN_REBALANCE_DEPTH = 30;
  public static final double DEFAULT_DEPTH_FACTOR        = 3.0;

  public static final Settings DEFAULT = new Settings();

  public final int _leafCapBytes;
  public final int _elementSize;
  // Empirical guards, kept tunable
  public final int _minRebalanceDepth;
  public final double _depthFactor;

  public Settings() {
    this(0, 0);
  }

  public Settings(int elementSize) {
    this(0, elementSize);
  }

  public Settings(int leafCapBytes, int elementSize) {
    this(leafCapBytes, elementSize, 0, 0.0);
  }

  public Settings(int leafCapBytes, int elementSize, int minRebalanceDepth, double depthFactor) {
    if (leafCapBytes <= 0) {
      leafCapBytes = DEFAULT_LEAF_CAP_BYTES;
    }
    if (elementSize <= 0) {
      elementSize = DEFAULT_ELEMENT_SIZE;
    }
    if (minRebalanceDepth <= 0) {
      minRebalanceDepth = DEFAULT_MIN_REBALANCE_DEPTH;
    }
    if (depthFactor <= 0.0) {
      depthFactor = DEFAULT_DEPTH_FACTOR;
    }
    _leafCapBytes      = leafCapBytes;
    _elementSize       = elementSize;
    _minRebalanceDepth = minRebalanceDepth;
    _depthFactor       = depthFactor;
  }

  public int leafCapBytes() {
    return _leafCapBytes;
  }

  public int elementSize() {
    return _elementSize;
  }

  /**
   * Max number of items a block holds before the next insert splits it.
   */
  public int leafCapacity() {
    return _leafCapBytes / _elementSize + 1;
  }

  public int minRebalanceDepth() {
    return _minRebalanceDepth;
  }

  public double depthFactor() {
    return _depthFactor;
  }

  /**
   * Whether a tree whose last insert descended {@code maxDepth} nodes, holding
   * {@code len} items, is deep enough to be worth rebuilding.
   */
  public boolean canRebalance(int maxDepth, int len) {
    if (maxDepth < _minRebalanceDepth) {
      return false;
    }
    int blocks = len / leafCapacity();
    // log2(0) is -Infinity, so a deep tree over less than one block always qualifies
    return maxDepth > log2(blocks) * _depthFactor;
  }

  static double log2(int n) {
    return Math.log(n) / Math.log(2);
  }

  @Override
  public String toString() {
    return "Settings{leafCapBytes=" + _leafCapBytes + ", elementSize=" + _elementSize
      + ", minRebalanceDepth=" + _minRebalanceDepth + ", depthFactor=" + _depthFactor + "}";
  }
}
