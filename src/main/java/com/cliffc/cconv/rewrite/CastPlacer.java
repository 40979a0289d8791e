package com.cliffc.cconv.rewrite;

import com.cliffc.cconv.CConv;
import com.cliffc.cconv.ProgramInfo;
import com.cliffc.cconv.ast.*;
import com.cliffc.cconv.cvar.CVar;
import com.cliffc.cconv.cvar.FVar;
import com.cliffc.cconv.cvar.PVar;
import com.cliffc.cconv.solve.AtomEnv;
import com.cliffc.cconv.util.Ary;
import com.cliffc.cconv.util.SB;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/** Places casts where a checked and an unchecked value meet: call
 *  arguments against their parameters, and pointer initializers and
 *  assignments against their left sides.
 *
 *  The receiving side (parameter, or left side) is compared with the value:
 *  <ul>
 *  <li>value safer: a plain C cast {@code (T)} down to the receiver's type</li>
 *  <li>receiver safer: {@code _Assume_bounds_cast<T>( ... )} up to it</li>
 *  <li>equally safe: nothing</li>
 *  </ul>
 *  An explicit cast already on the value is superseded and commented out.
 *  Statements the planner re-emitted whole carry their initializer casts in
 *  the new text, so no separate wrap is made for those.
 */
class CastPlacer {
  final ProgramInfo _info;
  final AtomEnv _env;
  final EditSet _edits;
  final Set<DeclStmt> _reemitted;
  private String _file;         // File of the function being walked

  CastPlacer( ProgramInfo info, AtomEnv env, EditSet edits, Set<DeclStmt> reemitted ) {
    _info=info; _env=env; _edits=edits; _reemitted=reemitted;
  }

  void place( TransUnit tu ) {
    for( Decl d : tu._decls )
      if( d instanceof FunDecl fd && fd.has_body() && _info._opts.can_write(fd.file()) ) {
        _file = fd.file();
        stmt(fd.body());
      }
  }

  private void stmt( Stmt s ) {
    if( s instanceof Block b ) {
      for( Stmt k : b._stmts ) stmt(k);
    } else if( s instanceof DeclStmt ds ) {
      boolean whole = _reemitted.contains(ds);
      for( VarDecl vd : ds._decls )
        if( vd._init!=null ) {
          expr(vd._init);
          if( vd._type.is_ptr() && !whole ) assign(single(_info.getVariable(vd)),vd._init);
        }
    } else if( s instanceof ExprStmt es ) {
      expr(es._e);
    } else if( s instanceof Return ret ) {
      if( ret._e!=null ) expr(ret._e);
    } else if( s instanceof If iff ) {
      expr(iff._pred);
      stmt(iff._t);
      if( iff._f!=null ) stmt(iff._f);
    }
  }

  private void expr( Expr e ) {
    for( Expr k : e.kids() ) expr(k);
    if( e instanceof CallE call ) call(call);
    else if( e instanceof Binary b && b._op==Binary.Op.ASSIGN ) {
      CType lt = b._l.type();
      if( lt!=null && lt.is_ptr() ) assign(_info.getVariable(b._l),b._r);
    }
  }

  private void assign( Ary<CVar> lhs, Expr rhs ) {
    Expr r = rhs.strip_parens();
    CVar[] sides = sides(lhs,r);
    if( sides!=null ) place(sides[0],sides[1],r);
  }

  // Receiver and value for "lhs = r", or null if no cast can apply
  private @Nullable CVar[] sides( Ary<CVar> lhs, Expr r ) {
    if( lhs.isEmpty() ) return null;
    // Callees with an interface already convert their result
    if( r instanceof CallE call && call.callee()!=null && call.callee()._itype!=null )
      return null;
    Ary<CVar> rvs = _info.getVariable(r);
    if( rvs.isEmpty() ) return null;
    return new CVar[]{CVar.highest(lhs,_env),CVar.highest(rvs,_env)};
  }

  /** Initializer text for a re-emitted declaration, with the cast it needs
   *  printed in and a superseded explicit cast commented out. */
  String init_text( VarDecl vd ) {
    Expr r = vd._init.strip_parens();
    CVar[] sides = vd._type.is_ptr() ? sides(single(_info.getVariable(vd)),r) : null;
    String[] w = sides==null ? null : wrap(sides[0],sides[1]);
    if( w==null ) return vd._init.toString();
    SB sb = new SB();
    Expr target = r;
    if( r instanceof Cast c ) { c._to.str(sb.p("/*("),"").p(")*/"); target = c._e; }
    return target.str(sb.p(w[0])).p(w[1]).toString();
  }

  private void call( CallE call ) {
    if( !(call.callee() instanceof FunDecl fd) || fd.varargs() ) return;
    FVar decl = _info.fvar(fd);
    if( decl==null ) return;
    FVar def = _info.definition(fd._name);
    int n = Math.min(call._args.length,Math.min(fd.nparams(),decl.nparams()));
    for( int i=0; i<n; i++ ) {
      if( fd.param(i)._itype!=null ) continue;
      Expr a = call._args[i];
      CType at = a.type();
      if( at==null || !at.is_ptr_or_ary() ) continue;
      Ary<CVar> avs = _info.getVariable(a);
      if( avs.isEmpty() ) continue;
      // The definition's parameter wins when it is the less safe one
      PVar parm = decl.param(i);
      if( def!=null && i<def.nparams() && def.param(i).lessSafe(parm,_env) )
        parm = def.param(i);
      place(parm,CVar.highest(avs,_env),a.strip_parens());
    }
  }

  // Prefix and suffix fitting a value of class 'have' to a receiver of class
  // 'want'; null when they are equally safe
  private @Nullable String[] wrap( CVar want, CVar have ) {
    if( want.equallySafe(have,_env) ) return null;
    String t = want.render(_env,null);
    return have.lessSafe(want,_env)
      ? new String[]{CConv.ASSUME+"<"+t+">(",")"}
      : new String[]{"("+t+")",""};
  }

  // Wrap 'val' so a value of class 'have' fits a receiver of class 'want'
  private void place( CVar want, CVar have, Expr val ) {
    String[] w = wrap(want,have);
    if( w==null ) return;
    Expr target = val;
    Cast old = null;
    if( val instanceof Cast c ) { old = c; target = c._e; }
    if( target._range==null || (old!=null && old._range==null) ) {
      if( _info._opts._verbose ) _info._opts._err.println("Cannot place cast on "+val+"; no source extent");
      return;
    }
    _edits.add(Edit.wrap(_file,target._range,w[0],w[1]));
    if( old!=null )
      _edits.add(Edit.wrap(_file,new SrcRange(old._range._lo,target._range._lo),"/*","*/"));
  }

  private static Ary<CVar> single( CVar cv ) {
    Ary<CVar> cvs = new Ary<>(CVar.class);
    return cv==null ? cvs : cvs.add(cv);
  }
}
