package com.soartech.cmakels.cmake.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A block with a single body between its header and footer. */
public abstract class BodyBlock extends BlockNode {
  public final ImmutableList<AstNode> body;

  protected BodyBlock(CommandInvocation header, List<AstNode> body, CommandInvocation footer) {
    super(header, footer);
    this.body = ImmutableList.copyOf(body);
  }

  @Override
  public ImmutableList<AstNode> children() {
    return ImmutableList.<AstNode>builder().add(header).addAll(body).add(footer).build();
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitBody(this);
  }
}
