package com.soartech.cmakels.cmake.ast;

import com.google.common.collect.ImmutableList;
import com.soartech.cmakels.cmake.SourceSpan;

/**
 * A control block: the commands from an opening command such as {@code foreach()} to its matching
 * closer such as {@code endforeach()}, inclusive.
 */
public abstract class BlockNode extends AstNode {
  /** The command that opened the block. */
  public final CommandInvocation header;

  /** The command that closed the block. */
  public final CommandInvocation footer;

  protected BlockNode(CommandInvocation header, CommandInvocation footer) {
    super(SourceSpan.cover(header.span, footer.span));
    this.header = header;
    this.footer = footer;
  }

  /** The direct children of this block in source order, including header and footer. */
  public abstract ImmutableList<AstNode> children();

  /**
   * Get every command invocation in this block, nested blocks included, in the order they were
   * written.
   */
  public ImmutableList<CommandInvocation> flatten() {
    ImmutableList.Builder<CommandInvocation> commands = ImmutableList.builder();
    for (AstNode child : children()) {
      if (child instanceof CommandInvocation) {
        commands.add((CommandInvocation) child);
      } else if (child instanceof BlockNode) {
        commands.addAll(((BlockNode) child).flatten());
      }
    }
    return commands.build();
  }
}
