package com.soartech.cmakels.cmake.ast;

import java.util.List;

/** {@code function(name params...) ... endfunction()} */
public final class FunctionBlock extends DefinitionBlock {
  public FunctionBlock(CommandInvocation header, List<AstNode> body, CommandInvocation footer) {
    super(header, body, footer);
  }
}
