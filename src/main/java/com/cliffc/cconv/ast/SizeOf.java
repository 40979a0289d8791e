package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

// sizeof(T), the type form only
public class SizeOf extends Expr {
  public final CType _t;
  public SizeOf( CType t ) { _t = t; }
  @Override public CType type() { return CType.ULONG; }
  @Override public Expr[] kids() { return new Expr[0]; }
  @Override public SB str(SB sb) { return _t.str(sb.p("sizeof("),"").p(')'); }
}
