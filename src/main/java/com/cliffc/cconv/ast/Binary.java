package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

public class Binary extends Expr {
  public enum Op {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"),
    LT("<"), LE("<="), GT(">"), GE(">="), EQ("=="), NE("!="), AND("&&"), OR("||"),
    ASSIGN("="), ADD_ASSIGN("+="), SUB_ASSIGN("-=");
    final String _s;
    Op(String s) { _s=s; }
    public boolean arith() { return this==ADD || this==SUB; }
    public boolean compound() { return this==ADD_ASSIGN || this==SUB_ASSIGN; }
    public boolean assign() { return this==ASSIGN || compound(); }
    boolean compare() { return ordinal() >= LT.ordinal() && ordinal() <= OR.ordinal(); }
  }
  public final Op _op;
  public final Expr _l, _r;
  public Binary( Op op, Expr l, Expr r ) { _op=op; _l=l; _r=r; }

  @Override public CType type() {
    if( _op.assign() ) return _l.type();
    if( _op.compare() ) return CType.INT;
    boolean lp = _l.type_is_ptr(), rp = _r.type_is_ptr();
    if( _op==Op.SUB && lp && rp ) return CType.LONG; // Pointer difference
    if( lp ) return decay(_l.type());
    if( rp && _op==Op.ADD ) return decay(_r.type());
    return _l.type();
  }
  // Arrays used in arithmetic decay to pointers
  private static CType decay( CType t ) { return t.is_ary() ? t.elem().ptr() : t; }

  @Override public Expr[] kids() { return new Expr[]{_l,_r}; }
  @Override public SB str(SB sb) { return _r.str(_l.str(sb).p(' ').p(_op._s).p(' ')); }
}
