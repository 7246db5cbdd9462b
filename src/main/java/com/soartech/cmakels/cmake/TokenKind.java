package com.soartech.cmakels.cmake;

/** The kinds of tokens produced by the {@link CMakeLexer}. */
public enum TokenKind {
  /** A command name at command level. */
  IDENTIFIER,
  LEFT_PAREN,
  RIGHT_PAREN,
  UNQUOTED_ARGUMENT,
  QUOTED_ARGUMENT,
  BRACKET_ARGUMENT,
  LINE_COMMENT,
  BRACKET_COMMENT,
  NEWLINE,
  EOF;

  /** @return true if tokens of this kind become command arguments */
  public boolean isArgument() {
    return this == UNQUOTED_ARGUMENT || this == QUOTED_ARGUMENT || this == BRACKET_ARGUMENT;
  }

  public boolean isComment() {
    return this == LINE_COMMENT || this == BRACKET_COMMENT;
  }
}
