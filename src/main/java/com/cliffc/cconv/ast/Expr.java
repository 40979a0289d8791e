package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;
import org.jetbrains.annotations.Nullable;

/** An expression inside a function body.
 *
 *  Each expression can compute its own C type from its parts; declaration
 *  references resolve straight back to the declarations seen earlier in the
 *  unit.  The optional extent is where cast insertion places its text.
 */
public abstract class Expr {
  @Nullable public SrcRange _range;

  public Expr at( int lo, int hi ) { _range = new SrcRange(lo,hi); return this; }

  // Result type; null if the frontend could not type it
  public abstract CType type();
  // Direct sub-expressions, for generic walks
  public abstract Expr[] kids();
  // Everybody has to have a pretty print
  public abstract SB str(SB sb);
  @Override public final String toString() { return str(new SB()).toString(); }

  public Expr strip_parens() {
    Expr e = this;
    while( e instanceof Paren p ) e = p._e;
    return e;
  }
  // Strip parens and explicit casts
  public Expr strip_casts() {
    Expr e = strip_parens();
    while( e instanceof Cast c ) e = c._e.strip_parens();
    return e;
  }

  // Integer constant expression, looking through parens and casts.  Returns
  // null if not a constant.
  public Long int_value() {
    Expr e = strip_casts();
    if( e instanceof IntLit lit ) return lit._val;
    if( e instanceof Unary u && u._op==Unary.Op.NEG ) {
      Long v = u._e.int_value();
      return v==null ? null : -v;
    }
    return null;
  }
  public boolean is_int_const() { return int_value()!=null; }
  // Integer constant zero, the C null pointer constant
  public boolean is_null_ptr() { Long v = int_value(); return v!=null && v==0; }

  boolean type_is_ptr() { CType t = type(); return t!=null && t.is_ptr_or_ary(); }
}
