package com.soartech.cmakels.cmake.ast;

/**
 * Double dispatch over the node types of a script. Blocks that only have a single body, which is
 * all of them except {@code if()}, share {@link #visitBody(BodyBlock)}.
 */
public interface AstVisitor<R> {
  R visitCommand(CommandInvocation command);

  R visitComment(Comment comment);

  R visitIf(IfBlock block);

  R visitBody(BodyBlock block);
}
