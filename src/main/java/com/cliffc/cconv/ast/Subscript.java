package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

public class Subscript extends Expr {
  public final Expr _base, _idx;
  public Subscript( Expr base, Expr idx ) { _base=base; _idx=idx; }
  @Override public CType type() {
    CType t = _base.type();
    return t==null ? null : t.elem();
  }
  @Override public Expr[] kids() { return new Expr[]{_base,_idx}; }
  @Override public SB str(SB sb) { return _idx.str(_base.str(sb).p('[')).p(']'); }
}
