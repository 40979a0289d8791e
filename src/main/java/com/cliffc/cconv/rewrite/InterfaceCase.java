package com.cliffc.cconv.rewrite;

/** How a pointer parameter is rewritten across a function's declarations,
 *  comparing the least safe of the declarations without a body (the uses)
 *  against the definition.
 */
public enum InterfaceCase {
  // Uses less safe than the definition: keep the unchecked exterior for
  // callers and give the definition its checked type through an itype.
  MAKE_BOUNDARY,
  // Equally safe: every declaration gets the same checked type.
  EQUAL,
  // Uses safer than the definition.  Callers could be strengthened; not
  // done, so nothing is rewritten.
  INCREASE_CALLERS,
  // No body anywhere, a variadic function, or no separate declaration.
  DO_NOTHING
}
