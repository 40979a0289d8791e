package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

// If/else; also stands in for while loops
public class If extends Stmt {
  public final Expr _pred;
  public final Stmt _t, _f;     // _f may be null
  public final boolean _loop;   // A "while", not an "if"
  public If( Expr pred, Stmt t, Stmt f ) { this(pred,t,f,false); }
  private If( Expr pred, Stmt t, Stmt f, boolean loop ) { _pred=pred; _t=t; _f=f; _loop=loop; }
  public static If loop( Expr pred, Stmt body ) { return new If(pred,body,null,true); }
  @Override public SB str(SB sb) {
    _pred.str(sb.p(_loop ? "while( " : "if( ")).p(" ) ");
    _t.str(sb);
    if( _f!=null ) _f.str(sb.p(" else "));
    return sb;
  }
}
