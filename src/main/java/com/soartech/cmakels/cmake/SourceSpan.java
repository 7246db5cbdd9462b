package com.soartech.cmakels.cmake;

import java.util.Objects;

/**
 * A region of script text. Lines and columns are 1-based; the offset is the 0-based index of the
 * first character in the source string.
 */
public final class SourceSpan {
  /** Placeholder for values that were not read from a script. */
  public static final SourceSpan NONE = new SourceSpan(0, 0, 0, 0);

  private final int line;
  private final int column;
  private final int offset;
  private final int length;

  public SourceSpan(int line, int column, int offset, int length) {
    this.line = line;
    this.column = column;
    this.offset = offset;
    this.length = length;
  }

  /** Create a span that starts where {@code first} starts and ends where {@code last} ends. */
  public static SourceSpan cover(SourceSpan first, SourceSpan last) {
    return new SourceSpan(
        first.line, first.column, first.offset, Math.max(0, last.getEnd() - first.offset));
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public int getOffset() {
    return offset;
  }

  public int getLength() {
    return length;
  }

  /** Get the offset of the character after the span. */
  public int getEnd() {
    return offset + length;
  }

  public boolean containsOffset(int offset) {
    return offset >= this.offset && offset < getEnd();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SourceSpan)) {
      return false;
    }
    SourceSpan that = (SourceSpan) other;
    return line == that.line
        && column == that.column
        && offset == that.offset
        && length == that.length;
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, column, offset, length);
  }

  @Override
  public String toString() {
    return line + ":" + column + " [" + offset + ", " + length + ")";
  }
}
