package com.soartech.cmakels.cmake;

import com.google.common.collect.ImmutableMap;
import com.soartech.cmakels.cmake.ast.AstNode;
import com.soartech.cmakels.cmake.ast.BodyBlock;
import com.soartech.cmakels.cmake.ast.CommandInvocation;
import com.soartech.cmakels.cmake.ast.ForEachBlock;
import com.soartech.cmakels.cmake.ast.FunctionBlock;
import com.soartech.cmakels.cmake.ast.MacroBlock;
import com.soartech.cmakels.cmake.ast.ScopeBlock;
import com.soartech.cmakels.cmake.ast.WhileBlock;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * The commands that open and close control blocks. Every other command name is opaque to the
 * parser.
 */
public enum BlockFamily {
  IF("if", "endif"),
  FOREACH("foreach", "endforeach"),
  WHILE("while", "endwhile"),
  FUNCTION("function", "endfunction"),
  MACRO("macro", "endmacro"),
  BLOCK("block", "endblock");

  private static final ImmutableMap<String, BlockFamily> OPENERS =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(family -> family.opener, Function.identity()));

  private static final ImmutableMap<String, BlockFamily> CLOSERS =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(family -> family.closer, Function.identity()));

  /** The lower-cased name of the command that opens the block. */
  public final String opener;

  /** The lower-cased name of the command that closes the block. */
  public final String closer;

  BlockFamily(String opener, String closer) {
    this.opener = opener;
    this.closer = closer;
  }

  /** Look up the family opened by a command identifier. */
  public static Optional<BlockFamily> openedBy(String identifier) {
    return Optional.ofNullable(OPENERS.get(identifier));
  }

  /** Look up the family closed by a command identifier. */
  public static Optional<BlockFamily> closedBy(String identifier) {
    return Optional.ofNullable(CLOSERS.get(identifier));
  }

  /** Whether the identifier is {@code elseif} or {@code else}, which only occur inside an if. */
  public static boolean isBranch(String identifier) {
    return identifier.equals("elseif") || identifier.equals("else");
  }

  /**
   * Build a block with a single body. The if family has branches and is built by the parser
   * directly.
   */
  BodyBlock build(CommandInvocation header, List<AstNode> body, CommandInvocation footer) {
    switch (this) {
      case FOREACH:
        return new ForEachBlock(header, body, footer);
      case WHILE:
        return new WhileBlock(header, body, footer);
      case FUNCTION:
        return new FunctionBlock(header, body, footer);
      case MACRO:
        return new MacroBlock(header, body, footer);
      case BLOCK:
        return new ScopeBlock(header, body, footer);
      default:
        throw new IllegalStateException(this + " blocks do not have a single body");
    }
  }
}
