package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;
import org.jetbrains.annotations.Nullable;

public class CallE extends Expr {
  public final Expr _fcn;
  public final Expr[] _args;
  public CallE( Expr fcn, Expr... args ) { _fcn=fcn; _args=args; }

  // Statically known callee declaration: a function, or a variable holding a
  // function pointer.  Null for computed callees.
  public @Nullable Decl callee() {
    return _fcn.strip_parens() instanceof DeclRef ref ? ref._d : null;
  }
  // Function type being called, through one pointer level if needed
  public @Nullable CType fun_type() {
    CType t = _fcn.type();
    if( t==null ) return null;
    if( t.is_ptr() ) t = t.elem();
    return t.is_fun() ? t : null;
  }

  @Override public CType type() {
    CType ft = fun_type();
    return ft==null ? null : ft.ret();
  }
  @Override public Expr[] kids() {
    Expr[] ks = new Expr[_args.length+1];
    ks[0] = _fcn;
    System.arraycopy(_args,0,ks,1,_args.length);
    return ks;
  }
  @Override public SB str(SB sb) {
    _fcn.str(sb).p('(');
    for( Expr a : _args ) a.str(sb).p(", ");
    if( _args.length>0 ) sb.unchar(2);
    return sb.p(')');
  }
}
