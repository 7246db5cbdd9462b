package com.soartech.cmakels.cmake.ast;

import java.util.List;

/** {@code foreach() ... endforeach()} */
public final class ForEachBlock extends BodyBlock {
  public ForEachBlock(CommandInvocation header, List<AstNode> body, CommandInvocation footer) {
    super(header, body, footer);
  }
}
