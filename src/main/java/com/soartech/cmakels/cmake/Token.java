package com.soartech.cmakels.cmake;

import java.util.Objects;

/**
 * A token read from a CMake script.
 *
 * <p>The text is the exact source slice. The value is what the token carries for later stages:
 * quotes and bracket delimiters are removed, line continuations are elided and the first newline
 * after a bracket opener is dropped. Escape sequences in quoted and unquoted arguments are left in
 * place; they are resolved during variable expansion.
 */
public final class Token {
  public final TokenKind kind;

  public final String text;

  public final String value;

  public final SourceSpan span;

  public Token(TokenKind kind, String text, String value, SourceSpan span) {
    this.kind = kind;
    this.text = text;
    this.value = value;
    this.span = span;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Token)) {
      return false;
    }
    Token that = (Token) other;
    return kind == that.kind
        && text.equals(that.text)
        && value.equals(that.value)
        && span.equals(that.span);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text, value, span);
  }

  @Override
  public String toString() {
    return kind + " " + span + ": " + value;
  }
}
