package com.soartech.cmakels.cmake;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Tokenizer for CMake scripts, following the grammar in the <a
 * href="https://cmake.org/cmake/help/latest/manual/cmake-language.7.html">cmake-language(7)</a>
 * manual page.
 *
 * <p>A script is a sequence of command invocations:
 *
 * <pre>
 * command_invocation := identifier space* '(' arguments ')'
 * </pre>
 *
 * <p>An argument takes 3 forms:
 *
 * <ul>
 *   <li>A bracket argument, {@code [==[ ... ]==]}, taken verbatim. The closing bracket must have
 *       the same number of equal signs as the opening one.
 *   <li>A quoted argument, {@code " ... "}, which may span lines and contain escape sequences.
 *   <li>An unquoted argument, a run of characters up to whitespace or a parenthesis. Whitespace
 *       may be escaped, and an embedded pair of quotes may enclose whitespace.
 * </ul>
 *
 * <p>Tokens are produced lazily. Once an error has been thrown, the lexer produces no more tokens;
 * to read the script again, create a new lexer.
 */
public class CMakeLexer implements Iterator<Token> {
  private static final char EOF = 0;

  /** The current input buffer */
  private final char input[];

  private final int end;

  /** Current position within the input buffer */
  private int cursor = 0;

  private int line = 1;

  /** Offset of the first character of the current line. */
  private int lineStart = 0;

  /**
   * Parenthesis depth. At depth zero the lexer reads command names; anywhere else it reads
   * arguments.
   */
  private int depth = 0;

  private boolean finished = false;

  // Position of the token currently being read.
  private int tokenStart;
  private int tokenLine;
  private int tokenColumn;

  public CMakeLexer(String source) {
    this.input = source.toCharArray();
    this.end = input.length;
  }

  @Override
  public boolean hasNext() {
    return !finished;
  }

  /**
   * Read the next token. The last token of every script is {@link TokenKind#EOF}.
   *
   * @throws CMakeLexerException if the script is malformed at this point
   */
  @Override
  public Token next() {
    if (finished) {
      throw new NoSuchElementException();
    }
    try {
      return readToken();
    } catch (CMakeLexerException e) {
      finished = true;
      throw e;
    }
  }

  private Token readToken() {
    consumeSeparators();
    markTokenStart();

    if (isEof()) {
      finished = true;
      return makeToken(TokenKind.EOF, "");
    }

    char c = lookAhead(0);
    if (c == '\n') {
      consume();
      return makeToken(TokenKind.NEWLINE, "\n");
    } else if (c == '\r' && lookAhead(1) == '\n') {
      // Windows-style new-line
      consume();
      consume();
      return makeToken(TokenKind.NEWLINE, "\n");
    } else if (c == '#') {
      return consumeComment();
    } else if (c == '(') {
      consume();
      ++depth;
      return makeToken(TokenKind.LEFT_PAREN, "(");
    } else if (c == ')') {
      consume();
      if (depth > 0) {
        --depth;
      }
      return makeToken(TokenKind.RIGHT_PAREN, ")");
    } else if (depth == 0 && isIdentifierStart(c)) {
      return consumeIdentifier();
    } else if (c == '"') {
      return consumeQuotedArgument();
    } else if (c == '[' && bracketLevel(cursor) >= 0) {
      return consumeBracketArgument();
    } else {
      return consumeUnquotedArgument();
    }
  }

  private Token consumeIdentifier() {
    while (!isEof() && isIdentifierPart(lookAhead(0))) {
      consume();
    }
    return makeToken(TokenKind.IDENTIFIER, new String(input, tokenStart, cursor - tokenStart));
  }

  private Token consumeComment() {
    assert lookAhead(0) == '#';
    int level = lookAhead(1) == '[' ? bracketLevel(cursor + 1) : -1;
    consume();

    if (level >= 0) {
      String body = consumeBracketBody(level, "bracket comment");
      return makeToken(TokenKind.BRACKET_COMMENT, body);
    }

    int bodyStart = cursor;
    while (!isEof() && !atLineEnd()) {
      consume();
    }
    return makeToken(TokenKind.LINE_COMMENT, new String(input, bodyStart, cursor - bodyStart));
  }

  private Token consumeBracketArgument() {
    String body = consumeBracketBody(bracketLevel(cursor), "bracket argument");
    return makeToken(TokenKind.BRACKET_ARGUMENT, body);
  }

  /**
   * Consume a bracket opener, its content and the matching closer, and return the content. A
   * newline directly after the opener is not part of the content.
   */
  private String consumeBracketBody(int level, String what) {
    assert lookAhead(0) == '[';
    for (int i = 0; i < level + 2; ++i) {
      consume();
    }

    if (lookAhead(0) == '\n') {
      consume();
    } else if (lookAhead(0) == '\r' && lookAhead(1) == '\n') {
      consume();
      consume();
    }

    int bodyStart = cursor;
    while (!isEof()) {
      if (lookAhead(0) == ']' && closesBracket(cursor, level)) {
        String body = new String(input, bodyStart, cursor - bodyStart);
        for (int i = 0; i < level + 2; ++i) {
          consume();
        }
        return body;
      }
      consume();
    }

    throw new CMakeLexerException(
        "Missing closing bracket ]" + "=".repeat(level) + "] for " + what, tokenSpan());
  }

  private Token consumeQuotedArgument() {
    assert lookAhead(0) == '"';
    consume();

    StringBuilder value = new StringBuilder();
    while (!isEof()) {
      char c = lookAhead(0);
      if (c == '"') {
        consume();
        return makeToken(TokenKind.QUOTED_ARGUMENT, value.toString());
      } else if (c == '\\') {
        consumeEscapedCharacter(value);
      } else {
        value.append(c);
        consume();
      }
    }

    throw new CMakeLexerException("Missing closing quote", tokenSpan());
  }

  private Token consumeUnquotedArgument() {
    StringBuilder value = new StringBuilder();
    while (!isEof()) {
      char c = lookAhead(0);
      // Stop at first whitespace or parenthesis
      if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '(' || c == ')') {
        break;
      } else if (c == '\\') {
        consumeEscapedCharacter(value);
      } else if (c == '"') {
        consumeEmbeddedQuote(value);
      } else {
        value.append(c);
        consume();
      }
    }
    return makeToken(TokenKind.UNQUOTED_ARGUMENT, value.toString());
  }

  /** A quoted section inside an unquoted argument, as in {@code -DFOO="a b"}. */
  private void consumeEmbeddedQuote(StringBuilder value) {
    assert lookAhead(0) == '"';
    int quoteStart = cursor;
    int quoteLine = line;
    int quoteColumn = cursor - lineStart + 1;

    value.append('"');
    consume();
    while (!isEof()) {
      char c = lookAhead(0);
      if (c == '"') {
        value.append(c);
        consume();
        return;
      } else if (c == '\\') {
        consumeEscapedCharacter(value);
      } else {
        value.append(c);
        consume();
      }
    }

    throw new CMakeLexerException(
        "Missing closing quote in unquoted argument",
        new SourceSpan(quoteLine, quoteColumn, quoteStart, cursor - quoteStart));
  }

  /**
   * Consume an escape sequence. Escaped newlines are line continuations and are dropped; every
   * other valid sequence is copied to the value unchanged.
   */
  private void consumeEscapedCharacter(StringBuilder value) {
    assert lookAhead(0) == '\\';
    SourceSpan escapeSpan = new SourceSpan(line, cursor - lineStart + 1, cursor, 2);

    if (cursor + 1 >= end) {
      throw new CMakeLexerException(
          "Invalid escape sequence at end of input",
          new SourceSpan(line, cursor - lineStart + 1, cursor, 1));
    }

    char c = lookAhead(1);
    if (c == '\n') {
      consume();
      consume();
    } else if (c == '\r' && lookAhead(2) == '\n') {
      consume();
      consume();
      consume();
    } else if (isAsciiAlphanumeric(c) && c != 't' && c != 'r' && c != 'n') {
      throw new CMakeLexerException("Invalid escape sequence \\" + c, escapeSpan);
    } else {
      value.append('\\').append(c);
      consume();
      consume();
    }
  }

  /** Only ASCII letters and digits are reserved; any other character may be escaped. */
  private static boolean isAsciiAlphanumeric(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }

  /** Skip spaces, tabs, stray carriage returns and line continuations between tokens. */
  private void consumeSeparators() {
    while (!isEof()) {
      char c = lookAhead(0);
      if (c == ' ' || c == '\t' || (c == '\r' && lookAhead(1) != '\n')) {
        consume();
      } else if (c == '\\' && lookAhead(1) == '\n') {
        consume();
        consume();
      } else if (c == '\\' && lookAhead(1) == '\r' && lookAhead(2) == '\n') {
        consume();
        consume();
        consume();
      } else {
        break;
      }
    }
  }

  /**
   * Get the number of equal signs in a bracket opener at the given offset, or -1 if there is no
   * opener there.
   */
  private int bracketLevel(int offset) {
    if (offset >= end || input[offset] != '[') {
      return -1;
    }
    int level = 0;
    int i = offset + 1;
    while (i < end && input[i] == '=') {
      ++level;
      ++i;
    }
    return i < end && input[i] == '[' ? level : -1;
  }

  /** Check whether a closing bracket with exactly the given level starts at the offset. */
  private boolean closesBracket(int offset, int level) {
    int close = offset + level + 1;
    if (close >= end || input[close] != ']') {
      return false;
    }
    for (int i = offset + 1; i < close; ++i) {
      if (input[i] != '=') {
        return false;
      }
    }
    return true;
  }

  private boolean atLineEnd() {
    char c = lookAhead(0);
    return c == '\n' || (c == '\r' && lookAhead(1) == '\n');
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || (c >= '0' && c <= '9');
  }

  private void markTokenStart() {
    tokenStart = cursor;
    tokenLine = line;
    tokenColumn = cursor - lineStart + 1;
  }

  private SourceSpan tokenSpan() {
    return new SourceSpan(tokenLine, tokenColumn, tokenStart, cursor - tokenStart);
  }

  private Token makeToken(TokenKind kind, String value) {
    String text = new String(input, tokenStart, cursor - tokenStart);
    return new Token(kind, text, value, tokenSpan());
  }

  private boolean isEof() {
    return cursor >= end;
  }

  private void consume() {
    if (cursor < end) {
      char c = input[cursor++];
      if (c == '\n') {
        ++line;
        lineStart = cursor;
      }
    }
  }

  private char lookAhead(int amount) {
    int newCursor = cursor + amount;
    if (newCursor < 0 || newCursor >= end) {
      return EOF;
    }
    return input[newCursor];
  }
}
