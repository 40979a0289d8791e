package com.cliffc.cconv.rewrite;

import com.cliffc.cconv.ast.SrcRange;
import com.cliffc.cconv.util.SB;

/** One textual edit in one file.
 *
 *  Type edits replace the text in their range.  Wraps leave the range alone
 *  and insert a prefix before it and a suffix after it.
 */
public final class Edit implements Comparable<Edit> {
  public enum Kind {
    DECL_TYPE,                  // Variable or parameter declaration
    RETURN_TYPE,                // Function return type
    FIELD_TYPE,                 // Record field
    EXPR_WRAP                   // Cast inserted around an expression
  }

  public final Kind _kind;
  public final String _file;
  public final SrcRange _range;
  public final String _text;    // Replacement text; empty for wraps
  public final String _prefix, _suffix; // Wraps only

  private Edit( Kind kind, String file, SrcRange range, String text, String prefix, String suffix ) {
    _kind=kind; _file=file; _range=range; _text=text; _prefix=prefix; _suffix=suffix;
  }
  public static Edit replace( Kind kind, String file, SrcRange range, String text ) {
    assert kind!=Kind.EXPR_WRAP;
    return new Edit(kind,file,range,text,"","");
  }
  public static Edit wrap( String file, SrcRange range, String prefix, String suffix ) {
    return new Edit(Kind.EXPR_WRAP,file,range,"",prefix,suffix);
  }

  public boolean is_wrap() { return _kind==Kind.EXPR_WRAP; }

  // Offset order; ties broken on everything else so the order is total
  @Override public int compareTo( Edit e ) {
    int cmp = Integer.compare(_range._lo,e._range._lo);
    if( cmp!=0 ) return cmp;
    if( (cmp = Integer.compare(_range._hi,e._range._hi))!=0 ) return cmp;
    if( (cmp = _kind.compareTo(e._kind))!=0 ) return cmp;
    if( (cmp = _text.compareTo(e._text))!=0 ) return cmp;
    if( (cmp = _prefix.compareTo(e._prefix))!=0 ) return cmp;
    return _suffix.compareTo(e._suffix);
  }

  @Override public boolean equals( Object o ) {
    return o instanceof Edit e && _kind==e._kind && _file.equals(e._file) && _range.equals(e._range) &&
      _text.equals(e._text) && _prefix.equals(e._prefix) && _suffix.equals(e._suffix);
  }
  @Override public int hashCode() {
    return ((_file.hashCode()*31+_range.hashCode())*31+_kind.ordinal())*31+(_text+_prefix+_suffix).hashCode();
  }

  public SB str( SB sb ) {
    sb.p(_file).p(_range.toString()).p(' ').p(_kind.name()).p(' ');
    return is_wrap() ? sb.p(_prefix).p("...").p(_suffix) : sb.p('"').p(_text).p('"');
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
