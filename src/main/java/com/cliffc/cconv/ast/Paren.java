package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

public class Paren extends Expr {
  public final Expr _e;
  public Paren( Expr e ) { _e = e; }
  @Override public CType type() { return _e.type(); }
  @Override public Expr[] kids() { return new Expr[]{_e}; }
  @Override public SB str(SB sb) { return _e.str(sb.p('(')).p(')'); }
}
