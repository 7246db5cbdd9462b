package com.soartech.cmakels.cmake.eval;

import java.util.Objects;

/**
 * A variable reference found in a piece of text. Positions are indices into that text, so a
 * caller that knows where the text came from can map them back to the source.
 */
public final class VariableReference {
  public final Namespace namespace;

  /** The name exactly as written between the braces, possibly containing nested references. */
  public final String rawName;

  /** The name after nested references were expanded. */
  public final String name;

  /** The value the reference expanded to; empty if the variable was not set. */
  public final String value;

  /** Index of the first character of the opener. */
  public final int start;

  /** Index of the character after the closing brace. */
  public final int end;

  /** How many references enclose this one; zero for an outermost reference. */
  public final int depth;

  public VariableReference(
      Namespace namespace,
      String rawName,
      String name,
      String value,
      int start,
      int end,
      int depth) {
    this.namespace = namespace;
    this.rawName = rawName;
    this.name = name;
    this.value = value;
    this.start = start;
    this.end = end;
    this.depth = depth;
  }

  /** Check whether an index falls between the opener and the closing brace. */
  public boolean contains(int index) {
    return index >= start && index < end;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof VariableReference)) {
      return false;
    }
    VariableReference that = (VariableReference) other;
    return namespace == that.namespace
        && rawName.equals(that.rawName)
        && name.equals(that.name)
        && value.equals(that.value)
        && start == that.start
        && end == that.end
        && depth == that.depth;
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, rawName, name, value, start, end, depth);
  }

  @Override
  public String toString() {
    return namespace.opener + rawName + "} [" + start + ", " + end + ") = " + value;
  }
}
