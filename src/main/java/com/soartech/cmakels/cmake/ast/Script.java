package com.soartech.cmakels.cmake.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

/** The parse result of one file: its top level nodes in order. */
public final class Script {
  public final ImmutableList<AstNode> nodes;

  public Script(List<AstNode> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
  }

  /** Get every command invocation in the script, in source order. */
  public ImmutableList<CommandInvocation> flatten() {
    ImmutableList.Builder<CommandInvocation> commands = ImmutableList.builder();
    for (AstNode node : nodes) {
      if (node instanceof CommandInvocation) {
        commands.add((CommandInvocation) node);
      } else if (node instanceof BlockNode) {
        commands.addAll(((BlockNode) node).flatten());
      }
    }
    return commands.build();
  }

  /** Visit every node depth first, each block before its children. */
  public void traverse(Consumer<AstNode> visitor) {
    nodes.forEach(node -> traverse(node, visitor));
  }

  private static void traverse(AstNode node, Consumer<AstNode> visitor) {
    visitor.accept(node);
    if (node instanceof BlockNode) {
      ((BlockNode) node).children().forEach(child -> traverse(child, visitor));
    }
  }
}
