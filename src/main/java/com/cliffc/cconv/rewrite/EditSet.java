package com.cliffc.cconv.rewrite;

import com.cliffc.cconv.util.Ary;
import com.cliffc.cconv.util.SB;
import org.jetbrains.annotations.Nullable;

import java.io.PrintStream;
import java.util.Set;
import java.util.TreeMap;

/** All edits planned for a run, grouped per file in offset order.
 *
 *  Headers are seen by several units, so the same edit can be planned more
 *  than once; exact duplicates are dropped.  An edit overlapping a
 *  replacement already accepted in the same file is rejected, as is a
 *  replacement overlapping an accepted wrap: the first edit wins.
 */
public class EditSet {
  private final TreeMap<String,Ary<Edit>> _edits = new TreeMap<>();
  private final @Nullable PrintStream _log; // Rejections reported here, if any
  private int _rejected;

  public EditSet() { this(null); }
  public EditSet( @Nullable PrintStream log ) { _log = log; }

  /** Add an edit.  Returns false if it was a duplicate or was rejected. */
  public boolean add( Edit e ) {
    Ary<Edit> es = _edits.computeIfAbsent(e._file, k -> new Ary<>(Edit.class));
    for( Edit x : es ) {
      if( x.equals(e) ) return false;
      if( (!x.is_wrap() || !e.is_wrap()) && x._range.overlaps(e._range) ) {
        _rejected++;
        if( _log!=null ) _log.println("Rejecting "+e+"; overlaps "+x);
        return false;
      }
    }
    es.add(e);
    es.sort_update(Edit::compareTo);
    return true;
  }

  public Set<String> files() { return _edits.keySet(); }
  public Ary<Edit> edits( String file ) {
    Ary<Edit> es = _edits.get(file);
    return es==null ? new Ary<>(Edit.class) : es;
  }
  public int len() {
    int n=0;
    for( Ary<Edit> es : _edits.values() ) n += es.len();
    return n;
  }
  public int rejected() { return _rejected; }
  public boolean isEmpty() { return len()==0; }

  public SB str( SB sb ) {
    for( Ary<Edit> es : _edits.values() )
      for( Edit e : es )
        e.str(sb).nl();
    return sb;
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
