package com.soartech.cmakels;

import com.google.common.collect.ImmutableList;
import com.soartech.cmakels.cmake.CMakeException;
import com.soartech.cmakels.cmake.CMakeParser;
import com.soartech.cmakels.cmake.SourceSpan;
import com.soartech.cmakels.cmake.ast.CommandInvocation;
import com.soartech.cmakels.cmake.ast.Script;
import java.net.URI;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.stream.IntStream;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;

/**
 * This class keeps track of the contents of a CMake source file along with its syntax tree and some
 * utilities for converting between offsets and line/column positions.
 *
 * <p>Note that this class should be treated as immutable after construction. To apply edits to the
 * file, use the withChanges() method, which returns a new CMakeFile.
 */
public class CMakeFile {
  private static final CMakeParser PARSER = new CMakeParser().withComments();

  public final URI uri;

  public final String contents;

  /**
   * The syntax tree of this file, including comments. It is absent if the file could not be
   * parsed, in which case the diagnostics describe why.
   */
  public final Optional<Script> script;

  /** Errors from reading the file. There is at most one, since parsing stops at the first. */
  public final ImmutableList<Diagnostic> diagnostics;

  /** Offsets of the first character of each line. */
  private final int[] lineStarts;

  public CMakeFile(URI uri, String contents) {
    this.uri = uri;
    this.contents = fixLineEndings(contents);
    this.lineStarts = lineStarts(this.contents);

    Script script = null;
    ImmutableList<Diagnostic> diagnostics = ImmutableList.of();
    try {
      script = PARSER.parse(this.contents);
    } catch (CMakeException e) {
      Diagnostic diagnostic =
          new Diagnostic(rangeFor(e.getSpan()), e.getMessage(), DiagnosticSeverity.Error, "cmake");
      diagnostics = ImmutableList.of(diagnostic);
    }
    this.script = Optional.ofNullable(script);
    this.diagnostics = diagnostics;
  }

  /** Apply the changes from a textDocument/didChange notification and returns a new file. */
  CMakeFile withChanges(List<TextDocumentContentChangeEvent> changes) {
    BiFunction<StringBuilder, TextDocumentContentChangeEvent, StringBuilder> applyChange =
        (buffer, change) -> {
          // The parameters which are set depends on whether we are
          // using full or incremental updates.
          if (change.getRange() == null) {
            return new StringBuilder(change.getText());
          } else {
            // Offsets are computed against the buffer as it is after the earlier changes.
            String current = buffer.toString();
            int[] currentLineStarts = lineStarts(current);
            int start = offset(currentLineStarts, current, change.getRange().getStart());
            int end = offset(currentLineStarts, current, change.getRange().getEnd());
            return buffer.replace(start, end, change.getText());
          }
        };

    String newContents =
        changes.stream()
            .reduce(new StringBuilder(this.contents), applyChange, (u, v) -> v)
            .toString();

    return new CMakeFile(this.uri, newContents);
  }

  /** A special case of the withChanges function, where there is only a single change to apply. */
  CMakeFile withChange(TextDocumentContentChangeEvent change) {
    return this.withChanges(Arrays.asList(change));
  }

  /** Get the innermost command invocation that contains the given offset. */
  public Optional<CommandInvocation> command(int offset) {
    return script.flatMap(
        s ->
            s.flatten().stream()
                .filter(command -> command.span.containsOffset(offset))
                .min(Comparator.comparingInt(command -> command.span.getLength())));
  }

  /** Get a single line as a string, including its line ending. */
  public String line(int lineNumber) {
    int start = offset(new Position(lineNumber, 0));
    int end = offset(new Position(lineNumber + 1, 0));
    return contents.substring(start, end);
  }

  /** Get the 0-based offset at the given position. */
  public int offset(Position position) {
    return offset(lineStarts, contents, position);
  }

  private static int offset(int[] lineStarts, String contents, Position position) {
    if (position.getLine() >= lineStarts.length) {
      return contents.length();
    }
    int offset = lineStarts[position.getLine()] + position.getCharacter();
    return Math.min(offset, contents.length());
  }

  /** Get the line/column of the given 0-based offset. */
  public Position position(int offset) {
    offset = Math.max(0, Math.min(offset, contents.length()));
    int line = Arrays.binarySearch(lineStarts, offset);
    if (line < 0) {
      line = -line - 2;
    }
    return new Position(line, offset - lineStarts[line]);
  }

  /** Get the range that covers a span of this file. */
  public Range rangeFor(SourceSpan span) {
    return new Range(position(span.getOffset()), position(span.getEnd()));
  }

  public boolean isInRange(Position position, Range range) {
    int offset = offset(position);
    return offset >= offset(range.getStart()) && offset <= offset(range.getEnd());
  }

  private static String fixLineEndings(String contents) {
    contents = contents.replace("\r\n", "\n");
    contents = contents.replace("\r", "\n");
    return contents;
  }

  private static int[] lineStarts(String contents) {
    return IntStream.concat(
            IntStream.of(0),
            IntStream.range(0, contents.length())
                .filter(i -> contents.charAt(i) == '\n')
                .map(i -> i + 1))
        .toArray();
  }
}
