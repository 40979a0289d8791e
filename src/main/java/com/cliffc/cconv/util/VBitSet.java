package com.cliffc.cconv.util;

import java.util.BitSet;

// Visit bits, used for the interface-fixed constraint ids
public class VBitSet extends BitSet {
  public boolean test(int idx) { return get(idx); }
}
