package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

// String literal; has no declaration, hence no constraint variables
public class StrLit extends Expr {
  public final String _s;
  public StrLit( String s ) { _s = s; }
  @Override public CType type() { return CType.CHAR.ptr(); }
  @Override public Expr[] kids() { return new Expr[0]; }
  @Override public SB str(SB sb) { return sb.p('"').p(_s).p('"'); }
}
