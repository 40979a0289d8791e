package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;
import org.jetbrains.annotations.Nullable;

/** A function declaration or definition.
 *
 *  Redeclarations, in this unit or another, are only related by name; tying
 *  them together is the linker's business.
 */
public class FunDecl extends Decl {
  public final ParmDecl[] _params;
  @Nullable Block _body;
  @Nullable public SrcRange _ret_range; // Extent of the return type text

  public FunDecl( String name, CType fun, PSL loc, ParmDecl... params ) {
    super(name,fun,loc);
    assert fun.is_fun() && (fun.nargs()==params.length || !fun._proto);
    _params = params;
  }
  public FunDecl body( Block body ) { _body = body; return this; }
  public FunDecl ret_range( int lo, int hi ) { _ret_range = new SrcRange(lo,hi); return this; }

  public @Nullable Block body() { return _body; }
  public boolean has_body() { return _body!=null; }
  public boolean varargs() { return _type._varargs; }
  public boolean has_proto() { return _type._proto; }
  public CType ret() { return _type.ret(); }
  public int nparams() { return _params.length; }
  public ParmDecl param( int i ) { return _params[i]; }

  @Override public SB str( SB sb ) {
    // Use the parameter names, not just the types
    SB args = new SB().p('(');
    for( ParmDecl p : _params ) p.str(args).p(", ");
    if( varargs() ) args.p("...");
    else if( _params.length>0 ) args.unchar(2);
    else if( has_proto() ) args.p("void");
    return ret().str(sb,CType.paren(_name)+args.p(')'));
  }
}
