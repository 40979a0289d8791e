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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/** Turns the solved environment into declaration edits for one unit at a
 *  time, then hands the unit to {@link CastPlacer}.  Read-only against the
 *  registry and environment.
 *
 *  A declaration is rewritten when its rendered type differs from the
 *  original spelling; an all-PTR chain still changes spelling.
 *
 *  Edit forms:
 *  <ul>
 *  <li>A variable replaces its "type name" text; with an initializer the
 *      replaced text runs up to the initializer and ends in " = ".</li>
 *  <li>A statement declaring several variables is re-emitted whole, one
 *      declaration per line.</li>
 *  <li>A function's return type replaces the return-type text.</li>
 *  <li>A parameter replaces its own declaration text, per redeclaration,
 *      according to the {@link InterfaceCase} for its position.</li>
 *  <li>A field replaces the field declaration text.</li>
 *  </ul>
 *  Declarations with no source extent (macro expansions) and files that
 *  may not be written are skipped.
 */
public class RewritePlanner {
  final ProgramInfo _info;
  final AtomEnv _env;
  final EditSet _edits;
  // Multi-declaration statements already visited, and those replaced whole,
  // in this unit
  private Set<DeclStmt> _done, _reemitted;
  private CastPlacer _casts;

  public RewritePlanner( ProgramInfo info, EditSet edits ) {
    _info = info;
    _env = info.env();
    _edits = edits;
  }

  public void plan( TransUnit tu ) {
    _info.enterUnit(tu);
    _done = Collections.newSetFromMap(new IdentityHashMap<>());
    _reemitted = Collections.newSetFromMap(new IdentityHashMap<>());
    _casts = new CastPlacer(_info,_env,_edits,_reemitted);
    for( Decl d : tu._decls ) {
      if( d instanceof FunDecl fd ) fun(fd);
      else if( d instanceof VarDecl vd ) var(vd);
      else if( d instanceof RecordDecl rd )
        for( FieldDecl f : rd._fields ) field(f);
    }
    _casts.place(tu);
    _done = _reemitted = null;
    _casts = null;
    _info.exitUnit();
  }

  private void log( String s ) { if( _info._opts._verbose ) _info._opts._err.println(s); }

  // Original "type name" spelling of a declaration
  static String orig( Decl d ) { return d._type.str(new SB(),d._name).toString(); }

  // True if the edit was taken
  private boolean add( Decl d, Edit.Kind kind, @Nullable SrcRange range, String text ) {
    if( range==null ) { log("Cannot rewrite "+d._name+" at "+d._loc+"; no source extent"); return false; }
    if( !_info._opts.can_write(d.file()) ) return false;
    log("Replacing type of "+d._name+" at "+d._loc+" with "+text);
    return _edits.add(Edit.replace(kind,d.file(),range,text));
  }

  // ---------------------------------------------------------------------
  private void fun( FunDecl fd ) {
    FVar fv = _info.fvar(fd);
    if( fv==null ) return;
    String ret = fv.ret().render(_env,null);
    if( !ret.equals(fd.ret().toString()) )
      add(fd,Edit.Kind.RETURN_TYPE,fd._ret_range,ret);
    for( int i=0; i<fd.nparams(); i++ )
      param(fd,i,fv.param(i));
    if( fd.has_body() ) locals(fd.body());
  }

  private void param( FunDecl fd, int i, PVar own ) {
    ParmDecl pd = fd.param(i);
    if( !pd.is_ptr_or_ary() ) return;
    InterfaceCase ic = interface_case(fd,i);
    String text;
    switch( ic ) {
    case MAKE_BOUNDARY: {
      PVar def = _info.definition(fd._name).param(i);
      text = orig(pd)+" : "+CConv.ITYPE+"("+def.render(_env,null)+")";
      break;
    }
    case EQUAL: {
      text = _info.definition(fd._name).param(i).render(_env,pd._name);
      break;
    }
    case INCREASE_CALLERS:
      log("Parameter "+pd._name+" of "+fd._name+": uses safer than definition; left alone");
      return;
    default:
      text = own.render(_env,pd._name);
    }
    log("Parameter "+pd._name+" of "+fd._name+": "+ic);
    if( !text.equals(orig(pd)) )
      add(pd,Edit.Kind.DECL_TYPE,pd._range,text);
  }

  /** Decide how parameter {@code i} of the named function is rewritten,
   *  looking at its declarations in every unit.  */
  public InterfaceCase interface_case( FunDecl fd, int i ) {
    FVar def = _info.definition(fd._name);
    if( def==null || fd.varargs() || def._varargs ) return InterfaceCase.DO_NOTHING;
    Ary<CVar> uses = new Ary<>(CVar.class);
    for( FVar fv : _info.declarations(fd._name) )
      if( !fv._body && i < fv.nparams() )
        uses.add(fv.param(i));
    if( uses.isEmpty() || i >= def.nparams() ) return InterfaceCase.DO_NOTHING;
    CVar use = CVar.lowest(uses,_env);
    int cmp = use.cmp(def.param(i),_env);
    if( cmp < 0 ) return InterfaceCase.MAKE_BOUNDARY;
    if( cmp > 0 ) return InterfaceCase.INCREASE_CALLERS;
    return InterfaceCase.EQUAL;
  }

  // ---------------------------------------------------------------------
  private void locals( Stmt s ) {
    if( s instanceof Block b ) { for( Stmt k : b._stmts ) locals(k); }
    else if( s instanceof DeclStmt ds ) { for( VarDecl vd : ds._decls ) var(vd); }
    else if( s instanceof If iff ) {
      locals(iff._t);
      if( iff._f!=null ) locals(iff._f);
    }
  }

  private void var( VarDecl vd ) {
    DeclStmt ds = vd.stmt();
    if( ds!=null && !ds.single() ) { multi(ds); return; }
    PVar pv = _info.pvar(vd);
    if( pv==null ) return;
    String text = pv.render(_env,vd._name);
    if( text.equals(orig(vd)) ) return;
    SrcRange range = vd._range;
    if( vd._init!=null && range!=null ) {
      if( vd._init._range==null ) range = null;
      else {
        range = new SrcRange(range._lo,vd._init._range._lo);
        text += " = ";
      }
    }
    add(vd,Edit.Kind.DECL_TYPE,range,text);
  }

  // Re-emit a multi-declaration statement, one declaration per line
  private void multi( DeclStmt ds ) {
    if( !_done.add(ds) ) return;
    boolean any = false;
    SB sb = new SB();
    for( VarDecl vd : ds._decls ) {
      PVar pv = _info.pvar(vd);
      String text = orig(vd);
      if( pv!=null ) {
        String t = pv.render(_env,vd._name);
        any |= !t.equals(text);
        text = t;
      }
      sb.p(text);
      if( vd._init!=null ) sb.p(" = ").p(_casts.init_text(vd));
      sb.p(';').nl();
    }
    if( !any ) return;
    sb.unchar();                // Last newline
    if( add(ds._decls[0],Edit.Kind.DECL_TYPE,ds._range,sb.toString()) )
      _reemitted.add(ds);
  }

  private void field( FieldDecl f ) {
    PVar pv = _info.pvar(f);
    if( pv==null ) return;
    String text = pv.render(_env,f._name);
    if( !text.equals(orig(f)) )
      add(f,Edit.Kind.FIELD_TYPE,f._range,text);
  }
}
