package com.soartech.cmakels.cmake.ast;

import java.util.List;

/** {@code block() ... endblock()}, which introduces a variable and policy scope. */
public final class ScopeBlock extends BodyBlock {
  public ScopeBlock(CommandInvocation header, List<AstNode> body, CommandInvocation footer) {
    super(header, body, footer);
  }
}
