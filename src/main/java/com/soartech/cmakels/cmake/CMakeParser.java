package com.soartech.cmakels.cmake;

import com.google.common.collect.ImmutableList;
import com.soartech.cmakels.cmake.ast.Argument;
import com.soartech.cmakels.cmake.ast.ArgumentKind;
import com.soartech.cmakels.cmake.ast.AstNode;
import com.soartech.cmakels.cmake.ast.CommandInvocation;
import com.soartech.cmakels.cmake.ast.Comment;
import com.soartech.cmakels.cmake.ast.IfBlock;
import com.soartech.cmakels.cmake.ast.Script;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Script} from CMake source or from a token stream.
 *
 * <p>Parsing happens in two stages. The first reads the flat sequence of command invocations (and
 * comments, if they are kept). The second groups that sequence into blocks using a stack of open
 * frames: an opening command such as {@code foreach()} pushes a frame, other commands are added to
 * the innermost frame, and the matching closer pops the frame and adds the finished block to the
 * frame below it, or to the script itself.
 *
 * <p>Parsing is fail-fast: the first error aborts with a {@link CMakeParserException}, and errors
 * from the lexer propagate as {@link CMakeLexerException}. A parser holds no state between calls
 * and may be shared between threads.
 */
public class CMakeParser {
  private static final Logger LOG = LoggerFactory.getLogger(CMakeParser.class);

  private final boolean keepComments;

  public CMakeParser() {
    this(false);
  }

  private CMakeParser(boolean keepComments) {
    this.keepComments = keepComments;
  }

  /** Get a parser that keeps comments in the syntax tree, for editor tooling. */
  public CMakeParser withComments() {
    return new CMakeParser(true);
  }

  public Script parse(String source) {
    return parse(new CMakeLexer(source));
  }

  public Script parse(Iterator<Token> tokens) {
    ImmutableList<AstNode> commands = parseCommands(tokens);
    Script script = structure(commands);
    LOG.trace("Parsed {} commands into {} top level nodes", commands.size(), script.nodes.size());
    return script;
  }

  public ImmutableList<AstNode> parseCommands(String source) {
    return parseCommands(new CMakeLexer(source));
  }

  /**
   * Read the flat sequence of command invocations without grouping them into blocks. Comments are
   * included if this parser keeps them.
   */
  public ImmutableList<AstNode> parseCommands(Iterator<Token> tokens) {
    ImmutableList.Builder<AstNode> nodes = ImmutableList.builder();
    while (true) {
      Token token = nextToken(tokens);
      switch (token.kind) {
        case EOF:
          return nodes.build();
        case NEWLINE:
          break;
        case LINE_COMMENT:
        case BRACKET_COMMENT:
          if (keepComments) {
            nodes.add(
                new Comment(token.value, token.kind == TokenKind.BRACKET_COMMENT, token.span));
          }
          break;
        case IDENTIFIER:
          nodes.add(parseInvocation(token, tokens));
          break;
        default:
          throw new CMakeParserException(
              "Expected a command name but found " + describe(token), token.span);
      }
    }
  }

  private CommandInvocation parseInvocation(Token name, Iterator<Token> tokens) {
    Token open = nextToken(tokens);
    if (open.kind != TokenKind.LEFT_PAREN) {
      throw new CMakeParserException(
          "Expected '(' after command name " + name.value + " but found " + describe(open),
          open.kind == TokenKind.EOF ? name.span : open.span);
    }

    List<Argument> arguments = new ArrayList<>();
    int depth = 1;
    Token last = open;
    while (depth > 0) {
      Token token = nextToken(tokens);
      switch (token.kind) {
        case EOF:
          throw new CMakeParserException(
              "Missing ')' to close " + name.value + "()", SourceSpan.cover(name.span, last.span));
        case LEFT_PAREN:
          ++depth;
          arguments.add(new Argument(ArgumentKind.UNQUOTED, "(", token.span));
          break;
        case RIGHT_PAREN:
          --depth;
          if (depth > 0) {
            arguments.add(new Argument(ArgumentKind.UNQUOTED, ")", token.span));
          }
          break;
        case UNQUOTED_ARGUMENT:
          arguments.add(new Argument(ArgumentKind.UNQUOTED, token.value, token.span));
          break;
        case QUOTED_ARGUMENT:
          arguments.add(new Argument(ArgumentKind.QUOTED, token.value, token.span));
          break;
        case BRACKET_ARGUMENT:
          arguments.add(new Argument(ArgumentKind.BRACKET, token.value, token.span));
          break;
        default:
          // Newlines and comments may appear between arguments.
          break;
      }
      last = token;
    }

    return new CommandInvocation(
        name.value, name.span, arguments, SourceSpan.cover(name.span, last.span));
  }

  /** Group a flat command sequence into blocks. */
  Script structure(List<AstNode> commands) {
    List<AstNode> root = new ArrayList<>();
    Deque<Frame> frames = new ArrayDeque<>();

    for (AstNode node : commands) {
      if (!(node instanceof CommandInvocation)) {
        body(frames, root).add(node);
        continue;
      }

      CommandInvocation command = (CommandInvocation) node;
      String identifier = command.identifier();

      Optional<BlockFamily> opened = BlockFamily.openedBy(identifier);
      if (opened.isPresent()) {
        frames.push(new Frame(opened.get(), command));
        continue;
      }

      Optional<BlockFamily> closed = BlockFamily.closedBy(identifier);
      if (closed.isPresent()) {
        Frame frame = frames.peek();
        if (frame == null) {
          throw new CMakeParserException(
              command.name + "() has no matching " + closed.get().opener + "()", command.span);
        }
        if (frame.family != closed.get()) {
          throw new CMakeParserException(
              "Expected "
                  + frame.family.closer
                  + "() to close "
                  + frame.describeOpener()
                  + " but found "
                  + command.name
                  + "()",
              command.span);
        }
        frames.pop();
        body(frames, root).add(frame.finish(command));
        continue;
      }

      if (BlockFamily.isBranch(identifier)) {
        Frame frame = frames.peek();
        if (frame == null) {
          throw new CMakeParserException(
              command.name + "() is not inside an if() block", command.span);
        }
        if (frame.family != BlockFamily.IF) {
          throw new CMakeParserException(
              command.name
                  + "() is not inside an if() block; expected "
                  + frame.family.closer
                  + "() to close "
                  + frame.describeOpener(),
              command.span);
        }
        frame.startBranch(command);
        continue;
      }

      body(frames, root).add(command);
    }

    if (!frames.isEmpty()) {
      Frame frame = frames.peek();
      throw new CMakeParserException(
          frame.describeOpener() + " has no matching " + frame.family.closer + "()",
          frame.opener.span);
    }

    return new Script(root);
  }

  private static List<AstNode> body(Deque<Frame> frames, List<AstNode> root) {
    Frame frame = frames.peek();
    return frame == null ? root : frame.body;
  }

  private static Token nextToken(Iterator<Token> tokens) {
    if (!tokens.hasNext()) {
      return new Token(TokenKind.EOF, "", "", SourceSpan.NONE);
    }
    return tokens.next();
  }

  private static String describe(Token token) {
    switch (token.kind) {
      case EOF:
        return "end of input";
      case NEWLINE:
        return "end of line";
      default:
        return "'" + token.text + "'";
    }
  }

  /** A block that has been opened but not yet closed. */
  private static class Frame {
    final BlockFamily family;

    final CommandInvocation opener;

    /** The body currently being filled. For if blocks, this is the body of the last branch. */
    List<AstNode> body = new ArrayList<>();

    // Only used by if blocks.
    final List<IfBlock.Branch> branches = new ArrayList<>();
    CommandInvocation branchCommand;
    IfBlock.Branch elseBranch;

    Frame(BlockFamily family, CommandInvocation opener) {
      this.family = family;
      this.opener = opener;
      this.branchCommand = opener;
    }

    String describeOpener() {
      return opener.name + "() at line " + opener.span.getLine();
    }

    void startBranch(CommandInvocation command) {
      if (branchCommand.is("else")) {
        throw new CMakeParserException(
            command.name + "() after else() in " + describeOpener(), command.span);
      }
      closeBranch();
      branchCommand = command;
    }

    private void closeBranch() {
      IfBlock.Branch branch = new IfBlock.Branch(branchCommand, body);
      if (branchCommand.is("else")) {
        elseBranch = branch;
      } else {
        branches.add(branch);
      }
      body = new ArrayList<>();
    }

    AstNode finish(CommandInvocation footer) {
      if (family != BlockFamily.IF) {
        return family.build(opener, body, footer);
      }
      closeBranch();
      return new IfBlock(branches, elseBranch, footer);
    }
  }
}
