package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

// Field access, "s.f" or "p->f"
public class Member extends Expr {
  public final Expr _base;
  public final FieldDecl _fld;
  public final boolean _arrow;
  public Member( Expr base, FieldDecl fld, boolean arrow ) { _base=base; _fld=fld; _arrow=arrow; }
  @Override public CType type() { return _fld._type; }
  @Override public Expr[] kids() { return new Expr[]{_base}; }
  @Override public SB str(SB sb) { return _base.str(sb).p(_arrow ? "->" : ".").p(_fld._name); }
}
