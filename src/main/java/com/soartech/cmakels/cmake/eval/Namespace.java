package com.soartech.cmakels.cmake.eval;

/** The three independent variable namespaces, each with its own reference syntax. */
public enum Namespace {
  /** Ordinary variables, referenced as {@code ${NAME}}. */
  NORMAL("${"),

  /** Environment variables, referenced as {@code $ENV{NAME}}. */
  ENVIRONMENT("$ENV{"),

  /** Cache entries, referenced as {@code $CACHE{NAME}}. */
  CACHE("$CACHE{");

  /** The text that opens a reference, up to and including the brace. */
  public final String opener;

  Namespace(String opener) {
    this.opener = opener;
  }

  /** Find the namespace whose reference opener starts at the given index, if any. */
  static Namespace openedAt(String text, int index) {
    for (Namespace namespace : values()) {
      if (text.startsWith(namespace.opener, index)) {
        return namespace;
      }
    }
    return null;
  }
}
