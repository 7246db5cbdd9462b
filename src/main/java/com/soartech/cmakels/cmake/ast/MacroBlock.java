package com.soartech.cmakels.cmake.ast;

import java.util.List;

/** {@code macro(name params...) ... endmacro()} */
public final class MacroBlock extends DefinitionBlock {
  public MacroBlock(CommandInvocation header, List<AstNode> body, CommandInvocation footer) {
    super(header, body, footer);
  }
}
