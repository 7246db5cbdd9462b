package com.soartech.cmakels.cmake.ast;

/** The three syntactic forms of a command argument. */
public enum ArgumentKind {
  /** A bare run of characters. Expanded, and split on semicolons by list consumers. */
  UNQUOTED,

  /** Text between double quotes. Expanded, but always a single element. */
  QUOTED,

  /** Text between matching brackets such as {@code [=[ ]=]}. Taken verbatim. */
  BRACKET
}
