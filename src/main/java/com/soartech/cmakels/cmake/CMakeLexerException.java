package com.soartech.cmakels.cmake;

/** Raised by the lexer for unterminated quotes and brackets and for invalid escape sequences. */
public class CMakeLexerException extends CMakeException {
  private static final long serialVersionUID = 1L;

  public CMakeLexerException(String message, SourceSpan span) {
    super(message, span);
  }
}
