package com.cliffc.cconv.cvar;

import com.cliffc.cconv.CConv;
import com.cliffc.cconv.ast.CType;
import com.cliffc.cconv.solve.Atom;
import com.cliffc.cconv.solve.AtomEnv;
import com.cliffc.cconv.solve.Constraints;
import com.cliffc.cconv.util.AryInt;
import com.cliffc.cconv.util.SB;
import org.jetbrains.annotations.Nullable;

/** Pointer variable: one constraint id per pointer or array layer of a type.
 *
 *  For {@code int **p} the chain is {@code int * q_(i+1) * q_i p}: the
 *  outermost layer gets the lowest id, and {@code _ids[0]} says what kind
 *  of pointer {@code p} itself is.  Each layer also records its original
 *  shape, so a fixed-size array can be rendered back as a checked array of
 *  the same extent.  A chain ending in a function type embeds the
 *  function's signature as an {@link FVar}, by arena index.
 */
public class PVar extends CVar {
  // Original layer shapes
  public static final byte O_PTR=0, O_SIZED=1, O_UNSIZED=2;

  public final CType _type;     // Declared type this chain was built from
  final AryInt _ids;            // Outermost first
  final byte[] _shape;
  final int[] _lens;            // Extent, for O_SIZED layers
  final int _fv;                // Embedded function signature, or -1

  // Mint a fresh id per layer of 't'
  public PVar( CVars arena, Constraints cs, CType t, String name ) {
    super(Kind.PTR,arena,base(t),name,true);
    _type = t;
    int d = t.depth();
    _ids = new AryInt();
    _shape = new byte[d];
    _lens = new int[d];
    CType x = t;
    for( int i=0; i<d; i++, x=x._elem ) {
      _ids.push(cs.fresh());
      _shape[i] = x.is_ptr() ? O_PTR : (x._len<0 ? O_UNSIZED : O_SIZED);
      _lens[i] = x._len;
    }
    _fv = x.is_fun() ? new FVar(arena,cs,x,name)._cvx : -1;
  }

  // Dereference view: the same ids less the outermost.  Not in the arena.
  private PVar( PVar p ) {
    super(Kind.PTR,p._arena,p._base,p._name,false);
    _type = p._type.elem();
    int d = p._ids._len-1;
    _ids = new AryInt(java.util.Arrays.copyOfRange(p._ids._es,1,d+1));
    _shape = java.util.Arrays.copyOfRange(p._shape,1,d+1);
    _lens  = java.util.Arrays.copyOfRange(p._lens ,1,d+1);
    _fv = p._fv;
    _fixed.or(p._fixed);
  }

  private static String base( CType t ) {
    CType r = t.strip();
    return r.is_fun() ? "" : r._base;
  }

  public int depth() { return _ids._len; }
  public int id( int i ) { return _ids.at(i); }
  // Outermost id, or -1 for a chain with no pointer layers
  public int outer() { return _ids._len==0 ? -1 : _ids.at(0); }
  public byte shape( int i ) { return _shape[i]; }
  public boolean has_fv() { return _fv >= 0; }
  public @Nullable FVar fv() { return _fv<0 ? null : _arena.fvar(_fv); }

  // What "*p" or "p[i]" refers to; null if nothing is left
  public @Nullable PVar deref() { return _ids._len==0 ? null : new PVar(this); }

  @Override public String render( AtomEnv env, @Nullable String name ) {
    int n = _ids._len;
    String nm = name==null ? "" : name;
    if( n>0 && env.get(_ids.at(0))==Atom.WILD )
      return unchecked(0,nm);
    // Checked fixed-size arrays keep the extent after the name
    SB dims = new SB();
    int i=0;
    while( i<n && _shape[i]==O_SIZED && env.get(_ids.at(i))==Atom.ARR )
      dims.p('[').p(_lens[i++]).p(']');
    SB sb = new SB(inner(i,env));
    if( !nm.isEmpty() ) sb.p(' ').p(nm);
    if( dims.len() > 0 ) sb.p(' ').p(CConv.CHECKED).p(dims.toString());
    return sb.toString();
  }

  // Abstract type text of layers i and deeper
  private String inner( int i, AtomEnv env ) {
    if( i==_ids._len )
      return _fv<0 ? _base : fv().render(env,null);
    return switch( env.get(_ids.at(i)) ) {
    case WILD -> unchecked(i,"");
    case PTR  -> CConv.PTR+"<"+inner(i+1,env)+">";
    case ARR  -> _shape[i]==O_SIZED
      ? inner(i+1,env)+" "+CConv.CHECKED+"["+_lens[i]+"]"
      : CConv.ARRPTR+"<"+inner(i+1,env)+">";
    };
  }

  // Plain C spelling of layers i and deeper
  private String unchecked( int i, String d ) {
    CType t = _type;
    for( int j=0; j<i; j++ ) t = t._elem;
    return t.str(new SB(),d).toString();
  }

  @Override public void force( Constraints cs, Atom a, boolean honor_fixed ) {
    if( a!=Atom.PTR )
      for( int i=0; i<_ids._len; i++ ) {
        int id = _ids.at(i);
        if( !(honor_fixed && is_fixed(id)) )
          cs.add_force(id,a);
      }
    if( _fv>=0 ) fv().force(cs,a,honor_fixed);
  }

  @Override public boolean changed( AtomEnv env ) {
    for( int i=0; i<_ids._len; i++ )
      if( env.get(_ids.at(i))!=Atom.PTR )
        return true;
    return _fv>=0 && fv().changed(env);
  }

  @Override boolean lift( CVar o, AtomEnv env, int[] acc ) {
    // Function pointer against a bare function compares through the signature
    if( o instanceof FVar ) return _fv>=0 && fv().lift(o,env,acc);
    PVar p = (PVar)o;
    if( _ids._len != p._ids._len ) return false;
    for( int i=0; i<_ids._len; i++ )
      acc[0] |= lift_atom(env.get(_ids.at(i)),env.get(p._ids.at(i)));
    if( (_fv<0) != (p._fv<0) ) return false;
    return _fv<0 || fv().lift(p.fv(),env,acc);
  }

  @Override public SB str( SB sb ) {
    sb.p("{ ");
    for( int i=0; i<_ids._len; i++ ) sb.p("q_").p(_ids.at(i)).p(' ');
    sb.p('}');
    if( _fv>=0 ) fv().str(sb.p(' '));
    return sb;
  }
}
