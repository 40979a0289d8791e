package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

public class Return extends Stmt {
  public final Expr _e;         // Null for a bare "return;"
  public Return( Expr e ) { _e = e; }
  @Override public SB str(SB sb) {
    sb.p("return");
    if( _e!=null ) _e.str(sb.p(' '));
    return sb.p(';');
  }
}
