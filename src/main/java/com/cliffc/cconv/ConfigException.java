package com.cliffc.cconv;

// Bad run configuration; reported before any analysis starts.
public class ConfigException extends RuntimeException {
  public ConfigException( String msg ) { super(msg); }
  public ConfigException( String msg, Throwable cause ) { super(msg,cause); }
}
