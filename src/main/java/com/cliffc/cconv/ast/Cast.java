package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

// Explicit C-style cast "(T)e".  Implicit conversions are not modeled.
public class Cast extends Expr {
  public final CType _to;
  public final Expr _e;
  public Cast( CType to, Expr e ) { _to=to; _e=e; }
  @Override public CType type() { return _to; }
  @Override public Expr[] kids() { return new Expr[]{_e}; }
  @Override public SB str(SB sb) { return _e.str(_to.str(sb.p('('),"").p(')')); }
}
