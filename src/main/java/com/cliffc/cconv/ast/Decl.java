package com.cliffc.cconv.ast;

import com.cliffc.cconv.util.SB;
import org.jetbrains.annotations.Nullable;

/** A named declaration: variable, parameter, function, field or record.
 *
 *  Carries the declared type, the persistent location used as the registry
 *  key, the extent of the declaration text (null when the text cannot be
 *  rewritten, e.g. it sits inside a macro expansion) and any bounds-safe
 *  interface annotation already written on it.
 */
public abstract class Decl {
  public final String _name;
  public final CType _type;
  public final PSL _loc;
  @Nullable public SrcRange _range; // Extent of "type name" text
  @Nullable public CType _itype;    // Existing itype(...) annotation

  Decl( String name, CType type, PSL loc ) { _name=name; _type=type; _loc=loc; }

  public Decl range( int lo, int hi ) { _range = new SrcRange(lo,hi); return this; }
  public Decl itype( CType t ) { _itype = t; return this; }

  public String file() { return _loc._file; }
  public boolean is_ptr_or_ary() { return _type.is_ptr_or_ary(); }
  // Type used for shape checks: an interface annotation overrides the raw type
  public CType checked_type() { return _itype==null ? _type : _itype; }

  // C spelling of the declaration, without initializer or body
  public SB str( SB sb ) { return _type.str(sb,_name); }
  @Override public String toString() { return str(new SB()).toString(); }
}
