package com.cliffc.cconv.solve;

import com.cliffc.cconv.util.SB;

/** One constraint over constraint-variable ids.
 *  <ul>
 *  <li>EQ: {@code q_a == q_b}, merges the two ids' components</li>
 *  <li>FORCE: {@code q_a == C} for a constant atom C</li>
 *  <li>NOT_PTR: {@code q_a != PTR}, a one-sided marker</li>
 *  </ul>
 */
public final class Constraint {
  public static final byte EQ=0, FORCE=1, NOT_PTR=2;
  public final byte _kind;
  public final int _a, _b;      // _b only for EQ
  public final Atom _atom;      // Only for FORCE

  private Constraint( byte kind, int a, int b, Atom atom ) { _kind=kind; _a=a; _b=b; _atom=atom; }
  // Equalities are stored low-id first, so q1==q2 and q2==q1 dedup
  static Constraint eq( int a, int b ) { return new Constraint(EQ,Math.min(a,b),Math.max(a,b),null); }
  static Constraint force( int a, Atom c ) { return new Constraint(FORCE,a,-1,c); }
  static Constraint not_ptr( int a ) { return new Constraint(NOT_PTR,a,-1,null); }

  // True if the solved environment satisfies this constraint
  boolean holds( AtomEnv env ) {
    return switch( _kind ) {
    case EQ    -> env.get(_a)==env.get(_b);
    case FORCE -> env.get(_a).meet(_atom)==env.get(_a);
    default    -> env.get(_a)!=Atom.PTR;
    };
  }

  @Override public boolean equals( Object o ) {
    return o instanceof Constraint c && _kind==c._kind && _a==c._a && _b==c._b && _atom==c._atom;
  }
  @Override public int hashCode() { return ((_kind*31+_a)*31+_b)*31+(_atom==null ? 0 : _atom.ordinal()+1); }

  public SB str( SB sb ) {
    sb.p("q_").p(_a);
    return switch( _kind ) {
    case EQ    -> sb.p(" == q_").p(_b);
    case FORCE -> sb.p(" == ").p(_atom.name());
    default    -> sb.p(" != PTR");
    };
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
