package com.soartech.cmakels.cmake.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/**
 * An {@code if()} block. The first branch is the {@code if()} itself, followed by one branch per
 * {@code elseif()}. The {@code else()} branch, if there is one, is kept separately since it has no
 * condition.
 */
public final class IfBlock extends BlockNode {
  public final ImmutableList<Branch> branches;

  public final Optional<Branch> elseBranch;

  public IfBlock(List<Branch> branches, Branch elseBranch, CommandInvocation footer) {
    super(first(branches), footer);
    this.branches = ImmutableList.copyOf(branches);
    this.elseBranch = Optional.ofNullable(elseBranch);
  }

  private static CommandInvocation first(List<Branch> branches) {
    Preconditions.checkArgument(!branches.isEmpty(), "an if block needs at least one branch");
    return branches.get(0).command;
  }

  @Override
  public ImmutableList<AstNode> children() {
    ImmutableList.Builder<AstNode> children = ImmutableList.builder();
    for (Branch branch : branches) {
      children.add(branch.command).addAll(branch.body);
    }
    elseBranch.ifPresent(branch -> children.add(branch.command).addAll(branch.body));
    return children.add(footer).build();
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitIf(this);
  }

  /** A condition command ({@code if}, {@code elseif} or {@code else}) and the body it guards. */
  public static final class Branch {
    public final CommandInvocation command;

    public final ImmutableList<AstNode> body;

    public Branch(CommandInvocation command, List<AstNode> body) {
      this.command = command;
      this.body = ImmutableList.copyOf(body);
    }
  }
}
