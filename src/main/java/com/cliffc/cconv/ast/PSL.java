package com.cliffc.cconv.ast;

import org.jetbrains.annotations.NotNull;

/** Persistent source location.
 *
 *  Identifies a declaration by file, line and column.  Unlike AST object
 *  identity this survives leaving one translation unit and entering the
 *  next, so the same header declaration seen by two units maps to the same
 *  constraint variables.
 */
public final class PSL implements Comparable<PSL> {
  public final String _file;
  public final int _line, _col;
  public PSL( String file, int line, int col ) { _file=file; _line=line; _col=col; }

  @Override public int compareTo(@NotNull PSL psl) {
    int cmp = _file.compareTo(psl._file);
    if( cmp != 0 ) return cmp;
    if( _line != psl._line ) return Integer.compare(_line,psl._line);
    return Integer.compare(_col,psl._col);
  }
  @Override public boolean equals(Object o) {
    if( this==o ) return true;
    return o instanceof PSL psl && _line==psl._line && _col==psl._col && _file.equals(psl._file);
  }
  @Override public int hashCode() { return (_file.hashCode()*31+_line)*31+_col; }
  @Override public String toString() { return _file+":"+_line+":"+_col; }
}
