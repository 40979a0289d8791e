package com.cliffc.cconv.ast;

// Half-open character extent [lo,hi) in one physical file
public final class SrcRange {
  public final int _lo, _hi;
  public SrcRange( int lo, int hi ) { assert 0 <= lo && lo <= hi; _lo=lo; _hi=hi; }
  public boolean overlaps( SrcRange r ) { return _lo < r._hi && r._lo < _hi; }
  @Override public boolean equals(Object o) {
    return o instanceof SrcRange r && _lo==r._lo && _hi==r._hi;
  }
  @Override public int hashCode() { return _lo*1031+_hi; }
  @Override public String toString() { return "["+_lo+","+_hi+")"; }
}
