package com.soartech.cmakels.cmake.eval;

import com.soartech.cmakels.cmake.SourceSpan;
import java.util.Objects;

/**
 * One argument after variable expansion and list splitting. An unquoted argument may produce
 * several of these, or none at all if it expanded to an empty list.
 */
public final class ExpandedArgument {
  public final String value;

  /** Whether the argument was written quoted or in brackets. */
  public final boolean quoted;

  /** The span of the argument this value came from. */
  public final SourceSpan span;

  public ExpandedArgument(String value, boolean quoted, SourceSpan span) {
    this.value = value;
    this.quoted = quoted;
    this.span = span;
  }

  public static ExpandedArgument unquoted(String value) {
    return new ExpandedArgument(value, false, SourceSpan.NONE);
  }

  public static ExpandedArgument quoted(String value) {
    return new ExpandedArgument(value, true, SourceSpan.NONE);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ExpandedArgument)) {
      return false;
    }
    ExpandedArgument that = (ExpandedArgument) other;
    return quoted == that.quoted && value.equals(that.value) && span.equals(that.span);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, quoted, span);
  }

  @Override
  public String toString() {
    return quoted ? "\"" + value + "\"" : value;
  }
}
