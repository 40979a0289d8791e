package com.cliffc.cconv.cvar;

import com.cliffc.cconv.ast.CType;
import com.cliffc.cconv.solve.Atom;
import com.cliffc.cconv.solve.AtomEnv;
import com.cliffc.cconv.solve.Constraints;
import com.cliffc.cconv.util.AryInt;
import com.cliffc.cconv.util.SB;
import org.jetbrains.annotations.Nullable;

/** Function variable: constraints on a signature.
 *
 *  Owns a return chain and one chain per parameter, all by arena index.
 *  For a declared function the parameter chains are the parameter
 *  declarations' own {@link PVar}s, so a parameter's location and the
 *  signature share ids.  For a function-pointer type every chain is fresh.
 *  Owns no ids directly.
 */
public class FVar extends CVar {
  final int _ret;               // Arena index of the return chain
  final AryInt _params;         // Arena indices of the parameter chains
  public final boolean _proto, _body, _varargs;

  // Signature embedded in a function-pointer type
  FVar( CVars arena, Constraints cs, CType fun, String name ) {
    super(Kind.FUN,arena,base(fun),name,true);
    _ret = new PVar(arena,cs,fun.ret(),name)._cvx;
    _params = new AryInt();
    for( CType a : fun._args ) _params.push(new PVar(arena,cs,a,"")._cvx);
    _proto = fun._proto; _body = false; _varargs = fun._varargs;
  }

  // A declared function, over its parameters' own chains
  public FVar( CVars arena, Constraints cs, CType fun, String name, PVar[] params, boolean body ) {
    super(Kind.FUN,arena,base(fun),name,true);
    _ret = new PVar(arena,cs,fun.ret(),name)._cvx;
    _params = new AryInt();
    for( PVar p : params ) _params.push(p._cvx);
    _proto = fun._proto; _body = body; _varargs = fun._varargs;
  }

  private static String base( CType fun ) {
    CType r = fun.ret().strip();
    return r.is_fun() ? "" : r._base;
  }

  public PVar ret() { return _arena.pvar(_ret); }
  public int nparams() { return _params._len; }
  public PVar param( int i ) { return _arena.pvar(_params.at(i)); }

  // "R name(P1, P2)", or "R (P1, P2)" without a name; no space after a '*' 
  @Override public String render( AtomEnv env, @Nullable String name ) {
    String r = ret().render(env,null);
    SB sb = new SB(r);
    if( !r.endsWith("*") ) sb.p(' ');
    if( name!=null ) sb.p(name);
    sb.p('(');
    for( int i=0; i<_params._len; i++ ) sb.p(param(i).render(env,null)).p(", ");
    if( _varargs ) sb.p("...");
    else if( _params._len>0 ) sb.unchar(2);
    else if( _proto ) sb.p("void");
    return sb.p(')').toString();
  }

  @Override public void force( Constraints cs, Atom a, boolean honor_fixed ) {
    ret().force(cs,a,honor_fixed);
    for( int i=0; i<_params._len; i++ )
      param(i).force(cs,a,honor_fixed);
  }

  // Only the return chain counts; parameters are rewritten on their own
  @Override public boolean changed( AtomEnv env ) { return ret().changed(env); }

  @Override boolean lift( CVar o, AtomEnv env, int[] acc ) {
    if( o instanceof PVar p ) return p.has_fv() && lift(p.fv(),env,acc);
    FVar f = (FVar)o;
    if( _params._len != f._params._len ) return false;
    if( !ret().lift(f.ret(),env,acc) ) return false;
    for( int i=0; i<_params._len; i++ )
      if( !param(i).lift(f.param(i),env,acc) )
        return false;
    return true;
  }

  @Override public SB str( SB sb ) {
    ret().str(sb.p("( ")).p(" ) ").p(_name).p("( ");
    for( int i=0; i<_params._len; i++ ) param(i).str(sb).p(", ");
    if( _params._len>0 ) sb.unchar(2);
    return sb.p(" )");
  }
}
