package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

public class DeclRef extends Expr {
  public final Decl _d;
  public DeclRef( Decl d ) { _d = d; }
  @Override public CType type() { return _d._type; }
  @Override public Expr[] kids() { return new Expr[0]; }
  @Override public SB str(SB sb) { return sb.p(_d._name); }
}
