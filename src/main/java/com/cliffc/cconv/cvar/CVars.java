package com.cliffc.cconv.cvar;

import com.cliffc.cconv.util.Ary;

import java.util.Iterator;

// Arena of all constraint variables for one run, indexed by CVar._cvx
public class CVars implements Iterable<CVar> {
  private final Ary<CVar> _cvs = new Ary<>(CVar.class);

  int add( CVar cv ) { _cvs.add(cv); return _cvs._len-1; }
  public CVar at( int cvx ) { return _cvs.at(cvx); }
  public PVar pvar( int cvx ) { return (PVar)_cvs.at(cvx); }
  public FVar fvar( int cvx ) { return (FVar)_cvs.at(cvx); }
  public int len() { return _cvs._len; }

  @Override public Iterator<CVar> iterator() { return _cvs.iterator(); }
}
