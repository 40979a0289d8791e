package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

public class ExprStmt extends Stmt {
  public final Expr _e;
  public ExprStmt( Expr e ) { _e = e; }
  @Override public SB str(SB sb) { return _e.str(sb).p(';'); }
}
