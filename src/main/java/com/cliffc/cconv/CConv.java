package com.cliffc.cconv;

/** Pointer-safety inference and rewrite planning for C.
 *
 *  The pipeline is driven by {@link Driver}; all analysis state for one run
 *  lives in a single {@link ProgramInfo} session.
 */
public abstract class CConv {
  public static RuntimeException unimpl( String msg) { throw new RuntimeException(msg); }

  // Checked C spellings used by rendering and cast insertion
  public static final String PTR    = "_Ptr";
  public static final String ARRPTR = "_Array_ptr";
  public static final String CHECKED= "_Checked";
  public static final String ITYPE  = "itype";
  public static final String ASSUME = "_Assume_bounds_cast";
}
