package com.cliffc.cconv.gen;

import com.cliffc.cconv.CConv;
import com.cliffc.cconv.ExternPolicy;
import com.cliffc.cconv.ProgramInfo;
import com.cliffc.cconv.ast.*;
import com.cliffc.cconv.cvar.CVar;
import com.cliffc.cconv.cvar.FVar;
import com.cliffc.cconv.cvar.PVar;
import com.cliffc.cconv.solve.Atom;
import com.cliffc.cconv.solve.Constraints;
import com.cliffc.cconv.util.Ary;

/** Walks one translation unit, making variables for its declarations and
 *  constraints for its statements and expressions.
 *
 *  The analysis is flow-insensitive: every expression is visited once, in
 *  source order, children before parents, and adds constraints according to
 *  its form:
 *  <ul>
 *  <li>assignment and initialization: equate left and right chains, with
 *      special cases for constants, address-of, casts and allocators</li>
 *  <li>call: equate each argument with its parameter; surplus arguments to
 *      a variadic callee, and every argument to an unknown callee, go Wild</li>
 *  <li>return: equate with the enclosing function's return chain</li>
 *  <li>pointer arithmetic, increment and decrement: the operand is not a
 *      single-object pointer</li>
 *  <li>subscript: the base is an array</li>
 *  <li>cast between structurally different pointer types: the source goes
 *      Wild</li>
 *  </ul>
 */
public class ConstraintBuilder {
  final ProgramInfo _info;
  final Constraints _cs;
  final ExternPolicy _externs;
  private FunDecl _fun;         // Enclosing function of the body being walked

  public ConstraintBuilder( ProgramInfo info ) {
    _info = info;
    _cs = info._cs;
    _externs = info._opts._externs;
  }

  /** Generate constraints for one unit. */
  public void build( TransUnit tu ) {
    _info.enterUnit(tu);
    log("Analyzing file "+tu._file);
    for( Decl d : tu._decls ) {
      if( d instanceof FunDecl fd ) fun(fd);
      else if( d instanceof VarDecl vd ) global(vd);
      else if( d instanceof RecordDecl rd ) record(rd);
    }
    log("Done analyzing "+tu._file);
    _info.exitUnit();
  }

  private void log( String s ) { if( _info._opts._verbose ) _info._opts._err.println(s); }

  // ---------------------------------------------------------------------
  // Declarations

  private void fun( FunDecl fd ) {
    FVar fv = (FVar)_info.addVariable(fd);
    _info.seeFunctionDecl(fd);
    // Trusted externs keep their void pointers
    if( !_externs.trusted(fd._name) ) {
      special_case(fd.ret(),fv.ret());
      for( int i=0; i<fd.nparams(); i++ )
        special_case(fd.param(i)._type,fv.param(i));
    }
    if( !fd.has_body() ) return;
    _fun = fd;
    stmt(fd.body());
    _fun = null;
  }

  private void global( VarDecl vd ) {
    local(vd);
    _info.seeGlobalDecl(vd);
  }

  private void record( RecordDecl rd ) {
    for( FieldDecl f : rd._fields )
      intro(f);
  }

  // Variable introduction, then its initializer
  private void local( VarDecl vd ) {
    PVar pv = intro(vd);
    if( vd._init==null ) return;
    expr(vd._init);
    if( pv!=null ) assign(single(pv),vd.checked_type(),vd._init);
  }

  // Variables for a variable or field.  Layers declared as arrays already
  // are arrays; void and va_list pointees go Wild.
  private PVar intro( Decl d ) {
    PVar pv = (PVar)_info.addVariable(d);
    if( pv==null ) return null;
    for( int i=0; i<pv.depth(); i++ )
      if( pv.shape(i)!=PVar.O_PTR )
        _cs.add_force(pv.id(i),Atom.ARR);
    special_case(d._type,pv);
    return pv;
  }

  private void special_case( CType t, PVar pv ) {
    CType r = t.strip();
    if( pv.depth()>0 && (r.is_void() || r.is_valist()) )
      pv.force(_cs,Atom.WILD,true);
  }

  // ---------------------------------------------------------------------
  // Statements

  private void stmt( Stmt s ) {
    if( s instanceof Block b ) {
      for( Stmt k : b._stmts ) stmt(k);
    } else if( s instanceof DeclStmt ds ) {
      for( VarDecl vd : ds._decls ) local(vd);
    } else if( s instanceof ExprStmt es ) {
      expr(es._e);
    } else if( s instanceof Return ret ) {
      if( ret._e==null ) return;
      expr(ret._e);
      FVar fv = _info.fvar(_fun);
      assign(single(fv.ret()),_fun.ret(),ret._e);
    } else if( s instanceof If iff ) {
      expr(iff._pred);
      stmt(iff._t);
      if( iff._f!=null ) stmt(iff._f);
    } else throw CConv.unimpl("statement "+s.getClass().getSimpleName());
  }

  // ---------------------------------------------------------------------
  // Expressions

  private void expr( Expr e ) {
    for( Expr k : e.kids() ) expr(k);
    if( e instanceof Cast c ) cast(c);
    else if( e instanceof CallE call ) call(call);
    else if( e instanceof Subscript s ) first_arr(s._base);
    else if( e instanceof Unary u ) {
      if( u._op.incdec() ) first_not_ptr(u._e);
    } else if( e instanceof Binary b ) {
      if( b._op==Binary.Op.ASSIGN ) assign(_info.getVariable(b._l),checked_type(b._l),b._r);
      else if( b._op.compound() || b._op.arith() ) { first_not_ptr(b._l); first_not_ptr(b._r); }
    }
  }

  // A cast between structurally different types makes the source Wild
  private void cast( Cast c ) {
    CType from = checked_type(c._e);
    if( from==null || from.shape_eq(c._to) ) return;
    force(_info.getVariable(c._e),Atom.WILD);
  }

  // Declared type of an expression, with a named declaration's interface
  // annotation in place of its raw type
  static CType checked_type( Expr e ) {
    Expr x = e.strip_parens();
    if( x instanceof DeclRef r ) return r._d.checked_type();
    if( x instanceof Member m ) return m._fld.checked_type();
    return x.type();
  }

  private void call( CallE call ) {
    FVar fv = _info.callee(call);
    if( fv==null ) {
      // Unknown callee: nothing can be trusted
      for( Expr a : call._args ) wild(a);
      Decl d = call.callee();
      CVar cv = d==null ? null : _info.getVariable(d);
      if( cv!=null ) cv.force(_cs,Atom.WILD,false);
      return;
    }
    for( int i=0; i<call._args.length; i++ ) {
      Expr a = call._args[i];
      if( i < fv.nparams() ) {
        PVar p = fv.param(i);
        assign(single(p),p._type,a);
      } else wild(a);           // Surplus variadic argument
    }
  }

  private void wild( Expr e ) {
    for( CVar cv : _info.getVariable(e) )
      cv.force(_cs,Atom.WILD,false);
  }
  private void first_arr( Expr e ) {
    for( CVar cv : _info.getVariable(e) )
      if( cv instanceof PVar pv && pv.depth()>0 )
        _cs.add_force(pv.outer(),Atom.ARR);
  }
  private void first_not_ptr( Expr e ) {
    for( CVar cv : _info.getVariable(e) )
      if( cv instanceof PVar pv && pv.depth()>0 )
        _cs.add_not_ptr(pv.outer());
  }

  /** Constraints for {@code lhs = rhs}, where {@code lhs} are the chains the
   *  left side may resolve to and {@code lty} its declared type.
   *  <ol>
   *  <li>A trusted allocator sized for the left side's pointee: nothing.</li>
   *  <li>Any other allocator call: nothing is shared with it; a sizeof of
   *      the wrong shape makes the left side Wild.</li>
   *  <li>Null constant: nothing.  Any other integer constant: Wild.</li>
   *  <li>Address-of: nothing.</li>
   *  <li>Cast: equate across a structurally equal cast, otherwise both sides
   *      go Wild.</li>
   *  <li>Anything else: equate with every chain the right side may resolve
   *      to.</li>
   *  </ol> */
  void assign( Ary<CVar> lhs, CType lty, Expr rhs ) {
    if( lhs.isEmpty() ) return;
    Expr r = rhs.strip_parens();
    Expr src = r instanceof Cast c ? c._e.strip_parens() : r;
    if( is_alloc(src) ) {
      CType sized = _externs.allocated(src);
      boolean ok = sized!=null && sized.ptr().shape_eq(lty);
      if( r instanceof Cast c ) ok &= sized!=null && sized.ptr().shape_eq(c._to);
      else if( sized==null ) return;   // Fresh storage, not yet typed
      if( !ok ) {
        force(lhs,Atom.WILD);
        if( r instanceof Cast ) force(_info.getVariable(src),Atom.WILD);
      }
      return;
    }
    if( r.is_int_const() ) {
      if( !r.is_null_ptr() ) force(lhs,Atom.WILD);
      return;
    }
    if( r instanceof Unary u && u._op==Unary.Op.ADDR_OF ) return;
    Ary<CVar> rvs = _info.getVariable(r);
    if( r instanceof Cast c ) {
      CType from = checked_type(c._e);
      boolean same = lty.shape_eq(c._to) && (from==null || from.shape_eq(c._to));
      if( !same ) {
        force(lhs,Atom.WILD);
        force(rvs,Atom.WILD);
        return;
      }
    }
    for( CVar l : lhs )
      for( CVar rv : rvs )
        constrainEq(_cs,l,rv);
  }

  private boolean is_alloc( Expr e ) {
    return e instanceof CallE call && call.callee() instanceof FunDecl fd
      && _externs.sizeof_idx(fd._name) != ExternPolicy.NOT_ALLOC;
  }

  // Interface-pinned ids keep their annotation
  private void force( Ary<CVar> cvs, Atom a ) {
    for( CVar cv : cvs ) cv.force(_cs,a,true);
  }
  private static Ary<CVar> single( CVar cv ) { return new Ary<>(CVar.class).add(cv); }

  // ---------------------------------------------------------------------

  /** Equate two variables.  Pointer chains are equated level by level, or
   *  every id with every other when their depths differ.  Signatures are
   *  equated on return and parameters, and forced Wild on an arity
   *  mismatch.  A function pointer compares through its signature; any
   *  other kind mismatch forces both Wild. */
  public static void constrainEq( Constraints cs, CVar l, CVar r ) {
    if( l==r ) return;
    if( l instanceof PVar pl && r instanceof PVar pr ) {
      if( pl.depth()==pr.depth() ) {
        for( int i=0; i<pl.depth(); i++ )
          cs.add_eq(pl.id(i),pr.id(i));
        if( pl.has_fv() && pr.has_fv() )
          constrainEq(cs,pl.fv(),pr.fv());
      } else {
        for( int i=0; i<pl.depth(); i++ )
          for( int j=0; j<pr.depth(); j++ )
            cs.add_eq(pl.id(i),pr.id(j));
      }
      return;
    }
    if( l instanceof FVar fl && r instanceof FVar fr ) {
      constrainEq(cs,fl.ret(),fr.ret());
      if( fl.nparams()==fr.nparams() ) {
        for( int i=0; i<fl.nparams(); i++ )
          constrainEq(cs,fl.param(i),fr.param(i));
      } else {
        fl.force(cs,Atom.WILD,false);
        fr.force(cs,Atom.WILD,false);
      }
      return;
    }
    PVar p = l instanceof PVar pl ? pl : (PVar)r;
    FVar f = l instanceof FVar fl ? fl : (FVar)r;
    if( p.has_fv() ) constrainEq(cs,p.fv(),f);
    else {
      p.force(cs,Atom.WILD,false);
      f.force(cs,Atom.WILD,false);
    }
  }
}
