package com.cliffc.cconv;

import com.cliffc.cconv.ast.CallE;
import com.cliffc.cconv.ast.CType;
import com.cliffc.cconv.ast.Decl;
import com.cliffc.cconv.ast.Expr;
import com.cliffc.cconv.ast.FunDecl;
import com.cliffc.cconv.ast.SizeOf;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;

/** Trusted external primitives.
 *
 *  Functions never given a body anywhere are opaque, and their variables are
 *  forced Wild at link time; names listed here are exempt.  Names mapped to
 *  a non-negative index are allocators: a call whose argument at that index
 *  is {@code sizeof(T)} yields storage for a {@code T*}, which is what lets
 *  {@code int *p = malloc(sizeof(int));} stay checked.
 */
public class ExternPolicy {
  public static final int NOT_ALLOC = -1;
  private final LinkedHashMap<String,Integer> _trusted = new LinkedHashMap<>();

  public static ExternPolicy standard() {
    return new ExternPolicy()
      .alloc("malloc",0)
      .alloc("calloc",1)
      .alloc("realloc",1)
      .trust("free");
  }

  public ExternPolicy trust( String name ) { _trusted.put(name,NOT_ALLOC); return this; }
  public ExternPolicy alloc( String name, int sizeof_idx ) { assert sizeof_idx>=0; _trusted.put(name,sizeof_idx); return this; }

  public boolean trusted( String name ) { return _trusted.containsKey(name); }
  public int sizeof_idx( String name ) { return _trusted.getOrDefault(name,NOT_ALLOC); }

  /** The {@code T} in {@code alloc(... sizeof(T) ...)}, if {@code e} is a
   *  call to a trusted allocator with a type-sized argument in the right
   *  position; null otherwise. */
  public @Nullable CType allocated( Expr e ) {
    if( !(e.strip_parens() instanceof CallE call) ) return null;
    Decl d = call.callee();
    if( !(d instanceof FunDecl) ) return null;
    int idx = sizeof_idx(d._name);
    if( idx<0 || idx>=call._args.length ) return null;
    return call._args[idx].strip_parens() instanceof SizeOf sz ? sz._t : null;
  }
}
