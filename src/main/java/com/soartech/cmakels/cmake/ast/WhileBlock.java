package com.soartech.cmakels.cmake.ast;

import java.util.List;

/** {@code while() ... endwhile()} */
public final class WhileBlock extends BodyBlock {
  public WhileBlock(CommandInvocation header, List<AstNode> body, CommandInvocation footer) {
    super(header, body, footer);
  }
}
