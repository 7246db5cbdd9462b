package com.soartech.cmakels.cmake;

/** Raised by the parser for malformed command invocations and unbalanced block commands. */
public class CMakeParserException extends CMakeException {
  private static final long serialVersionUID = 1L;

  public CMakeParserException(String message, SourceSpan span) {
    super(message, span);
  }
}
