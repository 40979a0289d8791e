package com.cliffc.cconv;

import com.cliffc.cconv.ast.TransUnit;
import com.cliffc.cconv.cvar.CVar;
import com.cliffc.cconv.gen.ConstraintBuilder;
import com.cliffc.cconv.rewrite.EditSet;
import com.cliffc.cconv.rewrite.RewritePlanner;
import com.cliffc.cconv.solve.AtomEnv;
import com.cliffc.cconv.util.Ary;

import java.io.PrintStream;
import java.util.Collection;
import java.util.TreeSet;

/** The pipeline: generate constraints for each unit, link, solve, then plan
 *  edits for each unit.
 *
 *  Phases run strictly in order; each owns the {@link ProgramInfo} session
 *  in turn.  The options are validated up front, so a configuration error
 *  stops the run before any analysis.  Dumps and statistics go to the
 *  output stream, progress to the options' error stream.
 */
public class Driver {
  public enum Phase { GEN, LINK, SOLVE, PLAN, DONE }

  public final Options _opts;
  public final ProgramInfo _info;
  private final PrintStream _out;
  private Phase _phase = Phase.GEN;
  private final Ary<TransUnit> _units = new Ary<>(TransUnit.class);

  public Driver( Options opts, PrintStream out ) {
    _opts = opts.validate();
    _out = out;
    _info = new ProgramInfo(opts);
  }
  public Driver( Options opts ) { this(opts,System.out); }

  public Phase phase() { return _phase; }

  private void expect( Phase p ) {
    if( _phase!=p ) throw new IllegalStateException("In phase "+_phase+", expected "+p);
  }

  /** Generate constraints for one unit. */
  public Driver generate( TransUnit tu ) {
    expect(Phase.GEN);
    new ConstraintBuilder(_info).build(tu);
    _units.add(tu);
    return this;
  }

  public Driver link() {
    expect(Phase.GEN);
    _info.link();
    _phase = Phase.LINK;
    return this;
  }

  public AtomEnv solve() {
    expect(Phase.LINK);
    AtomEnv env = _info.solve();
    _phase = Phase.SOLVE;
    if( _opts._verbose ) {
      int n=0;
      for( CVar cv : _info._cvars ) if( cv.changed(env) ) n++;
      _opts._err.println(n+" of "+_info._cvars.len()+" variables changed");
    }
    if( _opts._dump_intermediate ) _info.dump(_out);
    return env;
  }

  /** Plan edits for every unit seen by {@link #generate}. */
  public EditSet plan() {
    expect(Phase.SOLVE);
    _phase = Phase.PLAN;
    EditSet edits = new EditSet(_opts._verbose ? _opts._err : null);
    RewritePlanner planner = new RewritePlanner(_info,edits);
    for( TransUnit tu : _units ) planner.plan(tu);
    if( _opts._verbose ) {
      for( String file : edits.files() )
        _opts._err.println("Rewriting "+file+" to "+output(file)+", "+edits.edits(file).len()+" edits");
      _opts._err.println("Planned "+edits.len()+" edits, rejected "+edits.rejected());
    }
    if( _opts._dump_stats ) _info.print_stats(stat_files(),_out);
    _phase = Phase.DONE;
    return edits;
  }

  // Statistics cover the named inputs only
  private Collection<String> stat_files() {
    TreeSet<String> files = new TreeSet<>();
    for( String f : _opts._inputs ) files.add(f);
    return files;
  }

  /** Where the rewritten text of a file goes: its postfixed name, or the
   *  single output stream. */
  public String output( String file ) {
    return _opts.to_stdout() ? "stdout" : _opts.output_name(file);
  }

  /** All four phases over the given units. */
  public EditSet run( TransUnit... units ) {
    for( TransUnit tu : units ) generate(tu);
    link();
    solve();
    return plan();
  }
}
