package com.soartech.cmakels.cmake.ast;

import com.soartech.cmakels.cmake.SourceSpan;

/** A node of a parsed CMake script. Nodes are immutable once the parser returns them. */
public abstract class AstNode {
  /** The region of the script this node was parsed from. */
  public final SourceSpan span;

  protected AstNode(SourceSpan span) {
    this.span = span;
  }

  public abstract <R> R accept(AstVisitor<R> visitor);
}
