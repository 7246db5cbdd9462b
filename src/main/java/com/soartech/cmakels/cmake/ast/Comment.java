package com.soartech.cmakels.cmake.ast;

import com.soartech.cmakels.cmake.SourceSpan;

/** A line or bracket comment. Only present when the parser was asked to keep comments. */
public final class Comment extends AstNode {
  /** The comment text without the leading '#' and without any brackets. */
  public final String text;

  public final boolean bracket;

  public Comment(String text, boolean bracket, SourceSpan span) {
    super(span);
    this.text = text;
    this.bracket = bracket;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitComment(this);
  }

  @Override
  public String toString() {
    return bracket ? "#[[" + text + "]]" : "#" + text;
  }
}
