package com.cliffc.cconv;

import com.cliffc.cconv.util.Ary;
import org.jetbrains.annotations.Nullable;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Run configuration.
 *
 *  Parsed from {@code -flag} and {@code -key=value} strings; anything not
 *  starting with '-' is an input file.  Configuration errors throw
 *  {@link ConfigException} before any analysis runs.
 */
public class Options {
  public boolean _verbose;          // Progress and decision traces on _err
  public boolean _dump_intermediate;// Dump the registry after solving
  public boolean _dump_stats;       // Wild/Ptr/Arr counts after rewriting
  public String _output_postfix = STDOUT;
  public String _base_dir = "";     // Empty means the working directory
  public ExternPolicy _externs = ExternPolicy.standard();
  public final Ary<String> _inputs = new Ary<>(String.class);
  public PrintStream _err = System.err;

  public static final String STDOUT = "-";

  public static Options parse( String... args ) {
    Options opts = new Options();
    for( String arg : args ) {
      if( !arg.startsWith("-") || arg.equals(STDOUT) ) { opts._inputs.add(arg); continue; }
      int eq = arg.indexOf('=');
      String key = eq == -1 ? arg.substring(1) : arg.substring(1,eq);
      String val = eq == -1 ? null : arg.substring(eq+1);
      switch( key ) {
      case "verbose"          -> opts._verbose           = flag(key,val);
      case "dump-intermediate"-> opts._dump_intermediate = flag(key,val);
      case "dump-stats"       -> opts._dump_stats        = flag(key,val);
      case "output-postfix"   -> opts._output_postfix    = value(key,val);
      case "base-dir"         -> opts._base_dir          = value(key,val);
      case "trust"            -> opts._externs.trust(value(key,val));
      case "alloc"            -> alloc(opts._externs,value(key,val));
      default -> throw new ConfigException("Unknown option '"+arg+"'");
      }
    }
    return opts;
  }

  private static boolean flag( String key, @Nullable String val ) {
    if( val!=null ) throw new ConfigException("Option -"+key+" takes no value");
    return true;
  }
  private static String value( String key, @Nullable String val ) {
    if( val==null || val.isEmpty() ) throw new ConfigException("Option -"+key+" needs a value");
    return val;
  }
  // "-alloc=name:idx", the index of the sizeof argument
  private static void alloc( ExternPolicy ep, String val ) {
    int colon = val.indexOf(':');
    if( colon <= 0 ) throw new ConfigException("Expected -alloc=name:index, found '"+val+"'");
    try {
      int idx = Integer.parseInt(val.substring(colon+1));
      if( idx < 0 ) throw new ConfigException("Negative sizeof index in '"+val+"'");
      ep.alloc(val.substring(0,colon),idx);
    } catch( NumberFormatException nfe ) {
      throw new ConfigException("Bad sizeof index in '"+val+"'",nfe);
    }
  }

  /** Check the options against the input list. */
  public Options validate() {
    if( _inputs.isEmpty() ) throw new ConfigException("No input files");
    if( _output_postfix.equals(STDOUT) && _inputs.len() > 1 )
      throw new ConfigException("If rewriting more than one file, can't output to stdout");
    return this;
  }

  public boolean to_stdout() { return _output_postfix.equals(STDOUT); }

  /** Output name for a rewritten file: "dir/a.c" becomes "dir/a.P.c" for
   *  postfix P.  Null when writing a single stream. */
  public @Nullable String output_name( String file ) {
    if( to_stdout() ) return null;
    int slash = file.lastIndexOf('/');
    String dir  = file.substring(0,slash+1);
    String name = file.substring(slash+1);
    int dot = name.lastIndexOf('.');
    String stem = dot <= 0 ? name : name.substring(0,dot);
    String ext  = dot <= 0 ? ""   : name.substring(dot);
    return dir+stem+"."+_output_postfix+ext;
  }

  /** A file may be written if it was an input, or lies under the base
   *  directory. */
  public boolean can_write( String file ) {
    Path f = abs(file);
    for( String in : _inputs )
      if( abs(in).equals(f) )
        return true;
    return f.startsWith(abs(_base_dir));
  }
  private static Path abs( String s ) { return Paths.get(s).toAbsolutePath().normalize(); }
}
