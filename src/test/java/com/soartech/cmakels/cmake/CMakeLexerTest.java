package com.soartech.cmakels.cmake;

import static java.util.stream.Collectors.toList;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

public class CMakeLexerTest {
  static List<Token> tokens(String source) {
    List<Token> tokens = new ArrayList<>();
    CMakeScripts.tokenize(source).forEach(tokens::add);
    return tokens;
  }

  static List<TokenKind> kinds(String source) {
    return tokens(source).stream().map(token -> token.kind).collect(toList());
  }

  /** The tokens that carry arguments, as their values. */
  static List<String> argumentValues(String source) {
    return tokens(source).stream()
        .filter(token -> token.kind.isArgument())
        .map(token -> token.value)
        .collect(toList());
  }

  @Test
  public void commandInvocation() {
    assertEquals(
        Arrays.asList(
            TokenKind.IDENTIFIER,
            TokenKind.LEFT_PAREN,
            TokenKind.UNQUOTED_ARGUMENT,
            TokenKind.QUOTED_ARGUMENT,
            TokenKind.RIGHT_PAREN,
            TokenKind.NEWLINE,
            TokenKind.EOF),
        kinds("set(A \"b c\")\n"));
  }

  @Test
  public void emptyInput() {
    assertEquals(Arrays.asList(TokenKind.EOF), kinds(""));
  }

  @Test
  public void namesInsideParenthesesAreArguments() {
    List<Token> tokens = tokens("if(foo)");
    assertEquals(TokenKind.IDENTIFIER, tokens.get(0).kind);
    assertEquals(TokenKind.UNQUOTED_ARGUMENT, tokens.get(2).kind);
    assertEquals("foo", tokens.get(2).value);
  }

  @Test
  public void nestedParentheses() {
    assertEquals(
        Arrays.asList(
            TokenKind.IDENTIFIER,
            TokenKind.LEFT_PAREN,
            TokenKind.LEFT_PAREN,
            TokenKind.UNQUOTED_ARGUMENT,
            TokenKind.RIGHT_PAREN,
            TokenKind.RIGHT_PAREN,
            TokenKind.EOF),
        kinds("if((A))"));
  }

  @Test
  public void tokenSpans() {
    Token a = tokens("\nset(A)").get(3);
    assertEquals("A", a.value);
    assertEquals(new SourceSpan(2, 5, 5, 1), a.span);
  }

  @Test
  public void quotedArgumentStripsQuotes() {
    Token quoted = tokens("message(\"a b\")").get(2);
    assertEquals("\"a b\"", quoted.text);
    assertEquals("a b", quoted.value);
  }

  @Test
  public void quotedArgumentSpansLines() {
    assertEquals(Arrays.asList("a\nb"), argumentValues("message(\"a\nb\")"));
  }

  @Test
  public void lineContinuationIsElided() {
    assertEquals(Arrays.asList("ab"), argumentValues("message(\"a\\\nb\")"));
  }

  @Test
  public void escapesAreKeptForExpansion() {
    assertEquals(Arrays.asList("a\\$b", "x\\;y"), argumentValues("set(A a\\$b \"x\\;y\")"));
  }

  @Test
  public void nonAsciiCharactersAreIdentityEscapes() {
    assertEquals(Arrays.asList("caf\\é", "\\ß"), argumentValues("message(caf\\é \"\\ß\")"));
  }

  @Test
  public void invalidEscape() {
    CMakeLexerException e =
        assertThrows(CMakeLexerException.class, () -> tokens("set(A \\q)"));
    assertEquals("Invalid escape sequence \\q", e.getMessage());
    assertEquals(6, e.getSpan().getOffset());
  }

  @Test
  public void bracketArgument() {
    assertEquals(Arrays.asList("a]]b"), argumentValues("set(A [==[a]]b]==])"));
  }

  @Test
  public void bracketArgumentDropsFirstNewline() {
    assertEquals(Arrays.asList("x\n"), argumentValues("set(A [[\nx\n]])"));
  }

  @Test
  public void bracketArgumentIsVerbatim() {
    assertEquals(Arrays.asList("${A} \\n"), argumentValues("set(A [[${A} \\n]])"));
  }

  @Test
  public void mismatchedBracket() {
    CMakeLexerException e =
        assertThrows(CMakeLexerException.class, () -> tokens("set(A [==[abc]=])"));
    assertEquals("Missing closing bracket ]==] for bracket argument", e.getMessage());
    assertEquals(6, e.getSpan().getOffset());
  }

  @Test
  public void unterminatedQuote() {
    CMakeLexerException e =
        assertThrows(CMakeLexerException.class, () -> tokens("set(A \"abc)\n"));
    assertEquals("Missing closing quote", e.getMessage());
    assertEquals(6, e.getSpan().getOffset());
  }

  @Test
  public void lineComment() {
    List<Token> tokens = tokens("# hello\nset(A)");
    assertEquals(TokenKind.LINE_COMMENT, tokens.get(0).kind);
    assertEquals(" hello", tokens.get(0).value);
    assertEquals(TokenKind.NEWLINE, tokens.get(1).kind);
  }

  @Test
  public void bracketComment() {
    List<Token> tokens = tokens("#[[ spans\nlines ]]set(A)");
    assertEquals(TokenKind.BRACKET_COMMENT, tokens.get(0).kind);
    assertEquals(" spans\nlines ", tokens.get(0).value);
    assertEquals(TokenKind.IDENTIFIER, tokens.get(1).kind);
  }

  @Test
  public void hashInsideArgumentIsLiteral() {
    assertEquals(Arrays.asList("a#b"), argumentValues("set(A a#b)"));
  }

  @Test
  public void embeddedQuotes() {
    assertEquals(Arrays.asList("-DFOO=\"a b\""), argumentValues("add_definitions(-DFOO=\"a b\")"));
  }

  @Test
  public void windowsLineEndings() {
    List<Token> tokens = tokens("set(A)\r\nset(B)");
    assertEquals(TokenKind.NEWLINE, tokens.get(4).kind);
    assertEquals(2, tokens.get(5).span.getLine());
  }
}
