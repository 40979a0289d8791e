package com.cliffc.cconv.cvar;

import com.cliffc.cconv.solve.Atom;
import com.cliffc.cconv.solve.AtomEnv;
import com.cliffc.cconv.solve.Constraints;
import com.cliffc.cconv.util.SB;
import com.cliffc.cconv.util.VBitSet;
import org.jetbrains.annotations.Nullable;

/** Constraint variable base class.
 *
 *  A closed variant over two kinds, discriminated by {@link Kind}:
 *  <ul>
 *  <li>{@link PVar}: a chain of constraint-variable ids, one per pointer or
 *      array layer of a declared type, outermost first.</li>
 *  <li>{@link FVar}: a function signature, holding a return chain and one
 *      chain per parameter.</li>
 *  </ul>
 *
 *  All variables live in a {@link CVars} arena and refer to each other by
 *  arena index, never by owning reference.  Ids are minted from the shared
 *  {@link Constraints} and are never reused.
 *
 *  BNF for the debug print:
 *  <pre>
 *    PVar = { q_i q_j ... } [F]     // outermost id first; F if a function pointer
 *    FVar = ( R ) name( P, P ... )
 *  </pre>
 */
public abstract class CVar {
  public enum Kind { PTR, FUN }

  public final Kind _kind;
  public final CVars _arena;
  public final int _cvx;        // Dense arena index
  public final String _base;    // Declared base type spelling
  public final String _name;    // Declared name, may be empty
  // Ids pinned by a bounds-safe interface; never forced Wild when honoring
  final VBitSet _fixed = new VBitSet();

  // Views are not registered, and have index -1
  CVar( Kind kind, CVars arena, String base, String name, boolean register ) {
    _kind = kind; _arena = arena; _base = base; _name = name;
    _cvx = register ? arena.add(this) : -1;
  }

  public boolean is_ptr() { return _kind==Kind.PTR; }
  public boolean is_fun() { return _kind==Kind.FUN; }

  /** Rewritten type text, in the original's declarator order.  A null name
   *  prints an abstract type, for casts and interface annotations. */
  public abstract String render( AtomEnv env, @Nullable String name );
  public String mkString( AtomEnv env, boolean with_name ) { return render(env, with_name ? _name : null); }

  /** Force every owned id to {@code a}.  When {@code honor_fixed}, ids pinned
   *  by an interface are skipped. */
  public abstract void force( Constraints cs, Atom a, boolean honor_fixed );

  // True if any id resolved to something other than the default PTR
  public abstract boolean changed( AtomEnv env );

  public boolean is_fixed( int id ) { return _fixed.test(id); }
  public void fix( int id ) { _fixed.set(id); }

  // Lifted level-by-level comparison.  Returns false on a shape or kind
  // mismatch; otherwise ORs LT into acc[0] if some level of this is less
  // safe than the matching level of o, and GT if some level is safer.
  static final int LT=1, GT=2;
  abstract boolean lift( CVar o, AtomEnv env, int[] acc );

  // -1 if strictly less safe than o, +1 if strictly safer, 0 if equally
  // safe or not comparable
  public int cmp( CVar o, AtomEnv env ) {
    int[] acc = new int[1];
    if( !lift(o,env,acc) ) return 0;
    return switch( acc[0] ) {
    case LT -> -1;
    case GT ->  1;
    default ->  0;
    };
  }
  public boolean lessSafe   ( CVar o, AtomEnv env ) { return cmp(o,env) < 0; }
  public boolean equallySafe( CVar o, AtomEnv env ) { return cmp(o,env)== 0; }

  static int lift_atom( Atom a, Atom b ) {
    if( a.lt(b) ) return LT;
    if( b.lt(a) ) return GT;
    return 0;
  }

  // Safest member of the set, first one wins ties.  Null if empty.
  public static @Nullable CVar highest( Iterable<? extends CVar> cvs, AtomEnv env ) {
    CVar best = null;
    for( CVar cv : cvs )
      if( best==null || best.lessSafe(cv,env) )
        best = cv;
    return best;
  }
  // Least safe member of the set, first one wins ties.  Null if empty.
  public static @Nullable CVar lowest( Iterable<? extends CVar> cvs, AtomEnv env ) {
    CVar worst = null;
    for( CVar cv : cvs )
      if( worst==null || cv.lessSafe(worst,env) )
        worst = cv;
    return worst;
  }

  public abstract SB str( SB sb );
  @Override public String toString() { return str(new SB()).toString(); }
}
