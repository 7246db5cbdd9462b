package com.soartech.cmakels.cmake;

/**
 * Base class for failures while reading or evaluating CMake code. Every failure carries the span of
 * the text that caused it.
 */
public abstract class CMakeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final SourceSpan span;

  protected CMakeException(String message, SourceSpan span) {
    super(message);
    this.span = span == null ? SourceSpan.NONE : span;
  }

  public SourceSpan getSpan() {
    return span;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " at " + span + ": " + getMessage();
  }
}
