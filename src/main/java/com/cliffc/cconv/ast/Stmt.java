package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;

// Statements are only walked for the expressions and local declarations
// inside them; control flow does not matter to a flow-insensitive analysis.
public abstract class Stmt {
  // Everybody has to have a pretty print
  abstract public SB str(SB sb);
  @Override public final String toString() { return str(new SB()).toString(); }
}
