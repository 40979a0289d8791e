package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

public class Unary extends Expr {
  public enum Op {
    PRE_INC("++",true), POST_INC("++",false), PRE_DEC("--",true), POST_DEC("--",false),
    ADDR_OF("&",true), DEREF("*",true), NEG("-",true), NOT("!",true);
    final String _s;
    final boolean _prefix;
    Op(String s, boolean prefix) { _s=s; _prefix=prefix; }
    public boolean incdec() { return this==PRE_INC || this==POST_INC || this==PRE_DEC || this==POST_DEC; }
  }
  public final Op _op;
  public final Expr _e;
  public Unary( Op op, Expr e ) { _op=op; _e=e; }

  @Override public CType type() {
    CType t = _e.type();
    if( t==null ) return null;
    return switch( _op ) {
    case ADDR_OF -> t.ptr();
    case DEREF -> t.elem();
    case NOT -> CType.INT;
    default -> t;
    };
  }
  @Override public Expr[] kids() { return new Expr[]{_e}; }
  @Override public SB str(SB sb) {
    return _op._prefix ? _e.str(sb.p(_op._s)) : _e.str(sb).p(_op._s);
  }
}
