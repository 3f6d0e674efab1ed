package org.replikativ.persistent_rope;

/**
 * Sequential writer into a preallocated array.
 */
class Stitch {
  final Object[] _target;
  int _offset;

  Stitch(Object[] target, int offset) {
    _target = target;
    _offset = offset;
  }

  Stitch copyAll(Object[] source, int from, int to) {
    if (to > from) {
      System.arraycopy(source, from, _target, _offset, to - from);
      _offset += to - from;
    }
    return this;
  }

  Stitch copyOne(Object val) {
    _target[_offset] = val;
    _offset += 1;
    return this;
  }
}
