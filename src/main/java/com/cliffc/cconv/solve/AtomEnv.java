package com.cliffc.cconv.solve;

import com.cliffc.cconv.util.SB;

/** Solved environment: constraint-variable id to atom.
 *  Read-only once built; ids past the end read as the default PTR. */
public final class AtomEnv {
  private final Atom[] _env;
  AtomEnv( Atom[] env ) { _env = env; }
  // Unsolved environment; everything PTR.  Used before solving.
  public static final AtomEnv EMPTY = new AtomEnv(new Atom[0]);

  public Atom get( int id ) { return id < _env.length ? _env[id] : Atom.PTR; }
  public int len() { return _env.length; }

  @Override public boolean equals( Object o ) {
    return o instanceof AtomEnv env && java.util.Arrays.equals(_env,env._env);
  }
  @Override public int hashCode() { return java.util.Arrays.hashCode(_env); }

  public SB str( SB sb ) {
    for( int i=0; i<_env.length; i++ )
      sb.p("q_").p(i).p(" = ").p(_env[i].name()).nl();
    return sb;
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
