package com.soartech.cmakels.cmake.ast;

import com.soartech.cmakels.cmake.SourceSpan;
import java.util.Objects;

/**
 * A single argument of a command invocation, as written in the script.
 *
 * <p>The text has its delimiters removed but still contains its escape sequences and variable
 * references; the variable expander resolves both.
 */
public final class Argument {
  public final ArgumentKind kind;

  public final String text;

  public final SourceSpan span;

  public Argument(ArgumentKind kind, String text, SourceSpan span) {
    this.kind = kind;
    this.text = text;
    this.span = span;
  }

  public static Argument unquoted(String text) {
    return new Argument(ArgumentKind.UNQUOTED, text, SourceSpan.NONE);
  }

  public static Argument quoted(String text) {
    return new Argument(ArgumentKind.QUOTED, text, SourceSpan.NONE);
  }

  public static Argument bracket(String text) {
    return new Argument(ArgumentKind.BRACKET, text, SourceSpan.NONE);
  }

  /** Whether variable references and escapes in the text are resolved. */
  public boolean isExpandable() {
    return kind != ArgumentKind.BRACKET;
  }

  /** Whether the expanded text is split into list elements. */
  public boolean isListSplittable() {
    return kind == ArgumentKind.UNQUOTED;
  }

  /**
   * Whether the argument counts as quoted for condition evaluation. Bracket arguments are treated
   * like quoted ones there.
   */
  public boolean isQuoted() {
    return kind != ArgumentKind.UNQUOTED;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Argument)) {
      return false;
    }
    Argument that = (Argument) other;
    return kind == that.kind && text.equals(that.text) && span.equals(that.span);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text, span);
  }

  @Override
  public String toString() {
    switch (kind) {
      case QUOTED:
        return "\"" + text + "\"";
      case BRACKET:
        return "[[" + text + "]]";
      default:
        return text;
    }
  }
}
