package com.soartech.cmakels.cmake;

/**
 * Raised when the condition of an {@code if()}, {@code elseif()} or {@code while()} command is
 * malformed.
 */
public class CMakeEvalException extends CMakeException {
  private static final long serialVersionUID = 1L;

  public CMakeEvalException(String message, SourceSpan span) {
    super(message, span);
  }
}
