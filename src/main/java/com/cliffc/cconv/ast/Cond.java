package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

// "p ? t : f"; may resolve to the variables of either arm
public class Cond extends Expr {
  public final Expr _p, _t, _f;
  public Cond( Expr p, Expr t, Expr f ) { _p=p; _t=t; _f=f; }
  @Override public CType type() {
    CType t = _t.type();
    return t==null || _t.is_null_ptr() ? _f.type() : t;
  }
  @Override public Expr[] kids() { return new Expr[]{_p,_t,_f}; }
  @Override public SB str(SB sb) { return _f.str(_t.str(_p.str(sb).p(" ? ")).p(" : ")); }
}
