package com.soartech.cmakels.cmake.ast;

import static java.util.stream.Collectors.joining;

import com.google.common.collect.ImmutableList;
import com.soartech.cmakels.cmake.SourceSpan;
import java.util.List;
import java.util.Locale;

/**
 * A command invocation such as {@code add_library(foo STATIC foo.c)}. Command names are
 * case-insensitive; {@link #identifier()} gives the normalized form.
 */
public final class CommandInvocation extends AstNode {
  /** The command name as written. */
  public final String name;

  /** The span of the command name alone. */
  public final SourceSpan nameSpan;

  /**
   * The arguments in the order they were written. Parentheses nested inside the argument list
   * appear as unquoted arguments {@code (} and {@code )}.
   */
  public final ImmutableList<Argument> arguments;

  public CommandInvocation(
      String name, SourceSpan nameSpan, List<Argument> arguments, SourceSpan span) {
    super(span);
    this.name = name;
    this.nameSpan = nameSpan;
    this.arguments = ImmutableList.copyOf(arguments);
  }

  /** The lower-cased command name, used as the key for dispatching on commands. */
  public String identifier() {
    return name.toLowerCase(Locale.ROOT);
  }

  /** Check whether this invokes the given command, ignoring case. */
  public boolean is(String command) {
    return name.equalsIgnoreCase(command);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitCommand(this);
  }

  @Override
  public String toString() {
    return name + arguments.stream().map(Argument::toString).collect(joining(" ", "(", ")"));
  }
}
