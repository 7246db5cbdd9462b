package com.soartech.cmakels;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.eclipse.lsp4j.FoldingRange;
import org.eclipse.lsp4j.FoldingRangeKind;
import org.eclipse.lsp4j.FoldingRangeRequestParams;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.junit.jupiter.api.Test;

/**
 * Tests for textDocument/foldingRange request.
 *
 * <p>We fold runs of comments, bracket comments, blocks and commands whose arguments span several
 * lines.
 */
public class FoldingRangeTest extends SingleFileTestFixture {
  final List<FoldingRange> ranges;

  public FoldingRangeTest() throws Exception {
    super("folding", "CMakeLists.txt");

    FoldingRangeRequestParams params = new FoldingRangeRequestParams(fileId(file));
    this.ranges = languageServer.getTextDocumentService().foldingRange(params).get();
  }

  @Test
  public void checkCapabilities() {
    assertEquals(capabilities.getFoldingRangeProvider(), Either.forLeft(true));
  }

  @Test
  public void foldFileComment() {
    assertRange(FoldingRangeKind.Comment, 0, 2);
  }

  @Test
  public void foldBracketComment() {
    assertRange(FoldingRangeKind.Comment, 5, 7);
  }

  @Test
  public void foldMultiLineCommand() {
    assertRange(FoldingRangeKind.Region, 8, 11);
  }

  @Test
  public void singleLineCommentsDoNotFold() {
    assertNoRange(13);
  }

  @Test
  public void foldBlocks() {
    assertRange(FoldingRangeKind.Region, 14, 16);
    assertRange(FoldingRangeKind.Region, 18, 20);
  }

  @Test
  public void singleLineCommandsDoNotFold() {
    assertNoRange(3);
  }

  /** Test that a range exists matching the given parameters. */
  void assertRange(String kind, int startLine, int endLine) {
    FoldingRange range =
        ranges.stream().filter(r -> r.getStartLine() == startLine).findFirst().orElse(null);
    if (range == null) {
      fail("no range starting at line " + startLine);
    }
    assertEquals(range.getEndLine(), endLine);
    assertEquals(range.getKind(), kind);
  }

  /** Test for the _absence_ of a range at the given line. */
  void assertNoRange(int line) {
    boolean present =
        ranges.stream()
            .filter(r -> r.getStartLine() <= line)
            .filter(r -> r.getEndLine() >= line)
            .findAny()
            .isPresent();

    if (present) {
      fail("there should be no range covering line " + line);
    }
  }
}
