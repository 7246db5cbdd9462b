package com.soartech.cmakels.cmake.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/** A block that defines a new command: a function or a macro. */
public abstract class DefinitionBlock extends BodyBlock {
  protected DefinitionBlock(
      CommandInvocation header, List<AstNode> body, CommandInvocation footer) {
    super(header, body, footer);
  }

  /** The name of the defined command, which is the first argument of the header. */
  public Optional<Argument> nameArgument() {
    return header.arguments.stream().findFirst();
  }

  public Optional<String> name() {
    return nameArgument().map(argument -> argument.text);
  }

  /** The names of the declared parameters. */
  public ImmutableList<String> parameters() {
    return header.arguments.stream()
        .skip(1)
        .map(argument -> argument.text)
        .collect(ImmutableList.toImmutableList());
  }
}
