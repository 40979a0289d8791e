package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

public class IntLit extends Expr {
  public final long _val;
  public IntLit( long val ) { _val = val; }
  @Override public CType type() { return CType.INT; }
  @Override public Expr[] kids() { return new Expr[0]; }
  @Override public SB str(SB sb) { return sb.p(_val); }
}
