package com.cliffc.cconv.solve;

import com.cliffc.cconv.util.AryInt;
import com.cliffc.cconv.util.SB;

import java.util.LinkedHashSet;

/** The constraint graph and its solver.
 *
 *  Nodes are constraint-variable ids, minted densely from 0.  Equality
 *  constraints union their two ids (Tarjan Union-Find, with rollup on every
 *  find); forcings and not-PTR markers hang off single ids and never merge
 *  anything.  Constraints are kept in insertion order and deduped, so dumps
 *  and solutions are deterministic.
 *
 *  Solving is one pass: every forcing is met into its component leader
 *  (WILD beats ARR beats PTR), then every node takes its leader's atom,
 *  with a PTR component holding a not-PTR marker resolved to ARR.  Atoms
 *  only ever move down the lattice, so adding constraints and re-solving
 *  never turns a WILD back into something checked.
 */
public class Constraints {
  private final AryInt _uf = new AryInt(); // Union-Find parent; self for leaders
  private final LinkedHashSet<Constraint> _cons = new LinkedHashSet<>();

  // Mint a fresh id, initially its own component
  public int fresh() {
    int id = _uf._len;
    _uf.push(id);
    return id;
  }
  public int nvars() { return _uf._len; }
  // Ids referenced but never minted get created at the default
  private void touch( int id ) {
    assert id >= 0;
    while( _uf._len <= id ) fresh();
  }

  // Find the leader, with rollup.
  int find( int id ) {
    int leader = id;
    while( _uf.at(leader)!=leader ) leader = _uf.at(leader);
    while( id!=leader ) { int next = _uf.at(id); _uf.set(id,leader); id = next; }
    return leader;
  }
  // Lower id leads, so components do not depend on union order
  private void union( int a, int b ) {
    int la = find(a), lb = find(b);
    if( la==lb ) return;
    if( la < lb ) _uf.set(lb,la);
    else          _uf.set(la,lb);
  }
  public boolean same( int a, int b ) { touch(a); touch(b); return find(a)==find(b); }

  // Add constraints; returns false if already present
  public boolean add_eq( int a, int b ) {
    if( a==b ) return false;
    touch(a); touch(b);
    if( !_cons.add(Constraint.eq(a,b)) ) return false;
    union(a,b);
    return true;
  }
  public boolean add_force( int a, Atom c ) {
    assert c!=Atom.PTR : "PTR is the default; forcing it adds nothing";
    touch(a);
    return _cons.add(Constraint.force(a,c));
  }
  public boolean add_not_ptr( int a ) {
    touch(a);
    return _cons.add(Constraint.not_ptr(a));
  }
  public int len() { return _cons.size(); }
  public Iterable<Constraint> constraints() { return _cons; }

  /** Compute the fixed point.  Never fails structurally for this lattice;
   *  the flag reports a final check that every constraint holds. */
  public Solution solve() {
    int n = nvars();
    Atom[] lead = new Atom[n];
    boolean[] not_ptr = new boolean[n];
    for( Constraint c : _cons ) {
      int l = find(c._a);
      if( c._kind==Constraint.FORCE )
        lead[l] = lead[l]==null ? c._atom : lead[l].meet(c._atom);
      else if( c._kind==Constraint.NOT_PTR )
        not_ptr[l] = true;
    }
    Atom[] env = new Atom[n];
    for( int i=0; i<n; i++ ) {
      int l = find(i);
      Atom a = lead[l]==null ? Atom.PTR : lead[l];
      if( a==Atom.PTR && not_ptr[l] ) a = Atom.ARR;
      env[i] = a;
    }
    AtomEnv aenv = new AtomEnv(env);
    boolean ok = true;
    for( Constraint c : _cons )
      if( !c.holds(aenv) ) { ok = false; break; }
    return new Solution(aenv,ok);
  }

  public SB str( SB sb ) {
    for( Constraint c : _cons ) c.str(sb).nl();
    return sb;
  }
  @Override public String toString() { return str(new SB()).toString(); }

  // Environment plus success flag
  public static final class Solution {
    public final AtomEnv _env;
    public final boolean _ok;
    Solution( AtomEnv env, boolean ok ) { _env=env; _ok=ok; }
  }
}
