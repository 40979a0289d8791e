package com.cliffc.cconv;

import com.cliffc.cconv.ast.*;
import com.cliffc.cconv.cvar.CVar;
import com.cliffc.cconv.cvar.CVars;
import com.cliffc.cconv.cvar.FVar;
import com.cliffc.cconv.cvar.PVar;
import com.cliffc.cconv.gen.ConstraintBuilder;
import com.cliffc.cconv.solve.Atom;
import com.cliffc.cconv.solve.AtomEnv;
import com.cliffc.cconv.solve.Constraint;
import com.cliffc.cconv.solve.Constraints;
import com.cliffc.cconv.util.Ary;
import com.cliffc.cconv.util.SB;
import org.jetbrains.annotations.Nullable;

import java.io.PrintStream;
import java.util.*;
import java.util.function.Consumer;

/** The analysis session: every constraint variable, the constraint graph
 *  and the global symbol tables for one run.
 *
 *  Variables are keyed by persistent source location, which is the only
 *  identity that survives from one translation unit to the next.  While a
 *  unit is open, an identity map from that unit's declarations to their
 *  variables serves the AST-keyed lookups; it is dropped when the unit is
 *  closed.
 *
 *  Function and global-variable declarations are also tracked by name, so
 *  that {@link #link} can tie together separately compiled declarations of
 *  the same symbol.
 */
public class ProgramInfo {
  public final Options _opts;
  public final Constraints _cs = new Constraints();
  public final CVars _cvars = new CVars();

  // All variables, by location.  Persists across units.
  private final TreeMap<PSL,CVar> _vars = new TreeMap<>();

  // Current unit, and its declaration-keyed lookups.  Null between units.
  private TransUnit _unit;
  private IdentityHashMap<Decl,CVar> _unit_vars;

  // Global symbols.  Signatures by function name, and whether a body was
  // seen anywhere; pointer globals by name, and whether a non-extern
  // definition was seen anywhere.
  private final TreeMap<String,Ary<FVar>> _global_funs = new TreeMap<>();
  private final TreeMap<String,Boolean> _fun_bodies = new TreeMap<>();
  private final TreeMap<String,Ary<PVar>> _global_vars = new TreeMap<>();
  private final TreeMap<String,Boolean> _var_defs = new TreeMap<>();

  private boolean _linked;
  private Constraints.Solution _sol;

  public ProgramInfo( Options opts ) { _opts = opts; }

  void log( String s ) { if( _opts._verbose ) _opts._err.println(s); }

  // ---------------------------------------------------------------------
  // Compilation units

  /** Open a unit: rebuild the declaration-keyed lookups for this tree,
   *  reusing variables already made for the same locations. */
  public void enterUnit( TransUnit tu ) {
    assert _unit==null : "unit "+_unit._file+" still open";
    _unit = tu;
    _unit_vars = new IdentityHashMap<>();
    walk_decls(tu, d -> {
        CVar cv = _vars.get(d._loc);
        if( cv!=null ) _unit_vars.put(d,cv);
      });
  }
  /** Close a unit, dropping all references into its tree. */
  public void exitUnit() {
    assert _unit!=null;
    _unit = null;
    _unit_vars = null;
  }
  public @Nullable TransUnit unit() { return _unit; }

  /** Visit every declaration in the unit: top-level declarations, function
   *  parameters, record fields and local variables, in source order. */
  public static void walk_decls( TransUnit tu, Consumer<Decl> visit ) {
    for( Decl d : tu._decls ) {
      visit.accept(d);
      if( d instanceof FunDecl fd ) {
        for( ParmDecl p : fd._params ) visit.accept(p);
        if( fd.has_body() ) walk_locals(fd.body(),visit);
      } else if( d instanceof RecordDecl rd ) {
        for( FieldDecl f : rd._fields ) visit.accept(f);
      }
    }
  }
  private static void walk_locals( Stmt s, Consumer<Decl> visit ) {
    if( s instanceof Block b ) { for( Stmt k : b._stmts ) walk_locals(k,visit); }
    else if( s instanceof DeclStmt ds ) { for( VarDecl vd : ds._decls ) visit.accept(vd); }
    else if( s instanceof If iff ) {
      walk_locals(iff._t,visit);
      if( iff._f!=null ) walk_locals(iff._f,visit);
    }
  }

  // ---------------------------------------------------------------------
  // Variables

  /** Make (or find) the variables for a declaration.  Idempotent per
   *  location.  Returns null for declarations that carry no pointers. */
  public @Nullable CVar addVariable( Decl d ) {
    assert _unit!=null && !_linked;
    CVar cv = _vars.get(d._loc);
    if( cv==null ) {
      cv = make(d);
      if( cv==null ) return null;
      _vars.put(d._loc,cv);
      if( d._itype!=null ) pin(cv,d._itype);
      if( _opts._verbose ) log("Variable "+d._name+" at "+d._loc+": "+cv);
    }
    _unit_vars.put(d,cv);
    return cv;
  }

  private @Nullable CVar make( Decl d ) {
    if( d instanceof FunDecl fd ) {
      PVar[] ps = new PVar[fd.nparams()];
      for( int i=0; i<ps.length; i++ )
        ps[i] = (PVar)addVariable(fd.param(i));
      return new FVar(_cvars,_cs,fd._type,fd._name,ps,fd.has_body());
    }
    // Parameters always get a chain, to keep positions in the signature
    if( d instanceof ParmDecl ) return new PVar(_cvars,_cs,d._type,d._name);
    if( d instanceof RecordDecl ) return null;
    if( !d.is_ptr_or_ary() ) return null;
    return new PVar(_cvars,_cs,d._type,d._name);
  }

  // Pin ids to an interface annotation's shape: array layers force ARR, and
  // every pinned id is recorded as fixed.  On a function the annotation
  // covers the return.
  private void pin( CVar cv, CType itype ) {
    PVar pv = cv instanceof FVar fv ? fv.ret() : (PVar)cv;
    CType t = itype;
    for( int i=0; i<pv.depth() && t.is_ptr_or_ary(); i++, t=t._elem ) {
      pv.fix(pv.id(i));
      if( t.is_ary() ) _cs.add_force(pv.id(i),Atom.ARR);
    }
  }

  /** Variables of a declaration, or null if it has none. */
  public @Nullable CVar getVariable( Decl d ) {
    CVar cv = _unit_vars==null ? null : _unit_vars.get(d);
    return cv!=null ? cv : _vars.get(d._loc);
  }
  public @Nullable FVar fvar( FunDecl fd ) { return (FVar)getVariable(fd); }
  public @Nullable PVar pvar( Decl d ) {
    CVar cv = getVariable(d);
    return cv instanceof PVar pv ? pv : null;
  }

  /** The variables an expression may resolve to.  Conditionals yield both
   *  arms; dereferences and subscripts yield the base's chain with the
   *  outermost layer stripped; calls yield the callee's return chain.
   *  Empty for constants, address-of and anything else without a chain. */
  public Ary<CVar> getVariable( Expr e ) {
    Ary<CVar> cvs = new Ary<>(CVar.class);
    vars(e,cvs);
    return cvs;
  }
  private void vars( Expr e, Ary<CVar> cvs ) {
    if( e instanceof Paren p ) { vars(p._e,cvs); return; }
    if( e instanceof Cast c ) { vars(c._e,cvs); return; }
    if( e instanceof DeclRef r ) { add(cvs,getVariable(r._d)); return; }
    if( e instanceof Member m ) { add(cvs,getVariable(m._fld)); return; }
    if( e instanceof Subscript s ) { derefs(s._base,cvs); return; }
    if( e instanceof Cond c ) { vars(c._t,cvs); vars(c._f,cvs); return; }
    if( e instanceof Unary u ) {
      if( u._op==Unary.Op.DEREF ) derefs(u._e,cvs);
      else if( u._op.incdec() ) vars(u._e,cvs);
      return;
    }
    if( e instanceof Binary b ) {
      if( b._op.assign() ) vars(b._l,cvs);
      else if( b._op.arith() ) {
        CType lt = b._l.type(), rt = b._r.type();
        if( lt!=null && lt.is_ptr_or_ary() ) vars(b._l,cvs);
        if( rt!=null && rt.is_ptr_or_ary() ) vars(b._r,cvs);
      }
      return;
    }
    if( e instanceof CallE call ) {
      FVar fv = callee(call);
      if( fv!=null ) add(cvs,fv.ret());
    }
  }
  private void derefs( Expr base, Ary<CVar> cvs ) {
    for( CVar cv : getVariable(base) )
      if( cv instanceof PVar pv )
        add(cvs,pv.deref());
  }
  private static void add( Ary<CVar> cvs, @Nullable CVar cv ) {
    if( cv!=null && cvs.find(cv)==-1 ) cvs.add(cv);
  }

  /** Signature being called: a function's own, or the one embedded in a
   *  function-pointer variable.  Null for computed or unknown callees. */
  public @Nullable FVar callee( CallE call ) {
    Decl d = call.callee();
    if( d==null ) return null;
    CVar cv = getVariable(d);
    if( cv instanceof FVar fv ) return fv;
    if( cv instanceof PVar pv ) return pv.fv();
    return null;
  }

  // ---------------------------------------------------------------------
  // Global symbols and linking

  /** Record a file-scope function declaration under its name. */
  public void seeFunctionDecl( FunDecl fd ) {
    FVar fv = fvar(fd);
    assert fv!=null;
    Ary<FVar> fvs = _global_funs.computeIfAbsent(fd._name, k -> new Ary<>(FVar.class));
    if( fvs.find(fv)==-1 ) fvs.add(fv);
    _fun_bodies.merge(fd._name,fd.has_body(),Boolean::logicalOr);
  }
  /** Record a file-scope variable declaration under its name. */
  public void seeGlobalDecl( VarDecl vd ) {
    assert vd._global;
    PVar pv = pvar(vd);
    if( pv==null ) return;      // Not a pointer; nothing to link
    Ary<PVar> pvs = _global_vars.computeIfAbsent(vd._name, k -> new Ary<>(PVar.class));
    if( pvs.find(pv)==-1 ) pvs.add(pv);
    _var_defs.merge(vd._name,vd.defines(),Boolean::logicalOr);
  }

  /** Tie together all declarations of each external symbol.  Called once,
   *  after every unit has been processed.
   *  <ul>
   *  <li>Return chains of every declaration of a function are equated.</li>
   *  <li>Parameter chains are equated among the declarations without a
   *      body; the definition keeps its own, so planning can compare the
   *      uses with the definition.</li>
   *  <li>Prototyped declarations of different arity are forced Wild.</li>
   *  <li>Symbols never defined anywhere are opaque and forced Wild, unless
   *      trusted.</li>
   *  </ul>
   *  Forcings here honor interface-pinned ids. */
  public void link() {
    assert _unit==null && !_linked;
    _linked = true;
    for( Map.Entry<String,Ary<FVar>> e : _global_funs.entrySet() ) {
      String name = e.getKey();
      Ary<FVar> fvs = e.getValue();
      FVar f0 = fvs.at(0), u0 = null;
      for( FVar fv : fvs ) {
        if( fv!=f0 ) {
          ConstraintBuilder.constrainEq(_cs,f0.ret(),fv.ret());
          if( f0._proto && fv._proto && f0.nparams()!=fv.nparams() ) {
            log("Arity mismatch for "+name+"; forcing Wild");
            f0.force(_cs,Atom.WILD,true);
            fv.force(_cs,Atom.WILD,true);
          }
        }
        if( fv._body ) continue;
        if( u0==null ) { u0 = fv; continue; }
        int n = Math.min(u0.nparams(),fv.nparams());
        for( int i=0; i<n; i++ )
          ConstraintBuilder.constrainEq(_cs,u0.param(i),fv.param(i));
      }
      if( !_fun_bodies.get(name) && !_opts._externs.trusted(name) ) {
        log("Opaque extern function "+name+"; forcing Wild");
        for( FVar fv : fvs ) fv.force(_cs,Atom.WILD,true);
      }
    }
    for( Map.Entry<String,Ary<PVar>> e : _global_vars.entrySet() ) {
      Ary<PVar> pvs = e.getValue();
      for( int i=1; i<pvs.len(); i++ )
        ConstraintBuilder.constrainEq(_cs,pvs.at(0),pvs.at(i));
      if( !_var_defs.get(e.getKey()) ) {
        log("Opaque extern variable "+e.getKey()+"; forcing Wild");
        for( PVar pv : pvs ) pv.force(_cs,Atom.WILD,true);
      }
    }
  }
  public boolean linked() { return _linked; }

  // All declarations of a function, across every unit
  public Ary<FVar> declarations( String name ) {
    Ary<FVar> fvs = _global_funs.get(name);
    return fvs==null ? new Ary<>(FVar.class) : fvs;
  }
  // The defining declaration of a function, from any unit; null if none
  public @Nullable FVar definition( String name ) {
    for( FVar fv : declarations(name) ) if( fv._body ) return fv;
    return null;
  }

  // ---------------------------------------------------------------------
  // Solving

  /** Solve the constraint graph.  A solution that leaves any constraint
   *  unsatisfied is an internal error. */
  public AtomEnv solve() {
    assert _linked && _sol==null;
    log("Solving constraints");
    _sol = _cs.solve();
    if( !_sol._ok ) throw new IllegalStateException("Constraint solving failed to reach a fixed point");
    log("Constraints solved");
    return _sol._env;
  }
  public AtomEnv env() { return _sol==null ? AtomEnv.EMPTY : _sol._env; }

  // ---------------------------------------------------------------------
  // Diagnostics

  /** Every variable by location, then the constraints and, once solved,
   *  the environment. */
  public SB str( SB sb ) {
    for( Map.Entry<PSL,CVar> e : _vars.entrySet() ) {
      CVar cv = e.getValue();
      sb.p(e.getKey().toString()).p(' ').p(cv._name).p(" : ");
      cv.str(sb);
      if( _sol!=null ) sb.p(" => ").p(cv.mkString(_sol._env,true));
      sb.nl();
    }
    sb.p("Constraints:").nl().ii(1);
    for( Constraint c : _cs.constraints() ) c.str(sb.i()).nl();
    sb.di(1);
    if( _sol!=null ) _sol._env.str(sb.p("Environment:").nl());
    return sb;
  }
  public void dump( PrintStream out ) { out.print(str(new SB())); }

  /** Count solved ids per file, over the given files only, then the total.
   *  Functions count only their return chain; parameters are counted under
   *  their own locations. */
  public void print_stats( Collection<String> files, PrintStream out ) {
    TreeMap<String,int[]> per = new TreeMap<>();
    int[] tot = new int[Atom.values().length];
    AtomEnv env = env();
    for( Map.Entry<PSL,CVar> e : _vars.entrySet() ) {
      String file = e.getKey()._file;
      if( !files.contains(file) ) continue;
      CVar cv = e.getValue();
      PVar pv = cv instanceof FVar fv ? fv.ret() : (PVar)cv;
      int[] cnt = per.computeIfAbsent(file, k -> new int[Atom.values().length]);
      for( int i=0; i<pv.depth(); i++ ) {
        int a = env.get(pv.id(i)).ordinal();
        cnt[a]++; tot[a]++;
      }
    }
    SB sb = new SB();
    for( Map.Entry<String,int[]> e : per.entrySet() )
      stat(sb.p(e.getKey()).p(": "),e.getValue()).nl();
    stat(sb.p("Summary: "),tot).nl();
    out.print(sb);
  }
  private static SB stat( SB sb, int[] cnt ) {
    return sb.p("ptr ").p(cnt[Atom.PTR.ordinal()])
      .p(" arr ").p(cnt[Atom.ARR.ordinal()])
      .p(" wild ").p(cnt[Atom.WILD.ordinal()]);
  }
}
