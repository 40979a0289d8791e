package com.cliffc.cconv.solve;

/** The pointer-safety lattice.
 *
 *  <pre>
 *     PTR     ARR      checked: single object, or bounds-checked array
 *       \     /
 *        WILD          unchecked; the absorbing bottom
 *  </pre>
 *
 *  PTR and ARR are incomparable as rewrite shapes.  The solver resolves a
 *  PTR/ARR conflict to ARR, since an array pointer can also point at one
 *  object; WILD absorbs everything.
 */
public enum Atom {
  WILD, PTR, ARR;

  // Meet as used by the solver: WILD absorbs, ARR beats PTR
  public Atom meet( Atom a ) {
    if( this==WILD || a==WILD ) return WILD;
    if( this==ARR  || a==ARR  ) return ARR;
    return PTR;
  }
  // Strictly less safe: only WILD sits below anything
  public boolean lt( Atom a ) { return this==WILD && a!=WILD; }
  public boolean checked() { return this!=WILD; }
}
