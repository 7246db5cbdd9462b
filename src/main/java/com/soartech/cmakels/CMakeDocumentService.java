package com.soartech.cmakels;

import static java.util.Collections.singletonList;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.soartech.cmakels.analysis.Analysis;
import com.soartech.cmakels.analysis.FileAnalysis;
import com.soartech.cmakels.analysis.VariableRetrieval;
import com.soartech.cmakels.cmake.ast.AstNode;
import com.soartech.cmakels.cmake.ast.BlockNode;
import com.soartech.cmakels.cmake.ast.CommandInvocation;
import com.soartech.cmakels.cmake.ast.Comment;
import com.soartech.cmakels.util.Debouncer;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.FoldingRange;
import org.eclipse.lsp4j.FoldingRangeKind;
import org.eclipse.lsp4j.FoldingRangeRequestParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CMakeDocumentService implements TextDocumentService {
  private static final Logger LOG = LoggerFactory.getLogger(CMakeDocumentService.class);

  /**
   * CMake files in the workspace. This is just for maintaining the state of the files, which
   * includes their raw contents, parsed syntax tree, and convenience methods for working with this
   * representation. It does not include analysis information.
   */
  public final Documents documents = new Documents();

  /**
   * The most recently completed analysis of each file. This includes things like the functions and
   * variables that are defined, the values that variables have at each reference, and the results
   * of conditions. The analyseDirtyFiles method is the entry point for how this information gets
   * generated.
   */
  private final ConcurrentHashMap<URI, FileAnalysis> analyses = new ConcurrentHashMap<>();

  /** Handles to analyses that are currently being computed. */
  private final ConcurrentHashMap<URI, CompletableFuture<FileAnalysis>> pendingAnalyses =
      new ConcurrentHashMap<>();

  /** Files that have changed since they were last analysed. */
  private final Set<URI> dirtyUris = ConcurrentHashMap.newKeySet();

  /**
   * The debouncer is used to schedule analysis runs. They can be submitted as often as you like,
   * but they will only be run periodically.
   */
  private final Debouncer debouncer = new Debouncer(Duration.ofMillis(1000));

  /** The contents of the cmakels.json manifest, or the defaults if there is none. */
  private volatile ProjectConfiguration projectConfig = new ProjectConfiguration();

  private LanguageClient client;

  /**
   * Configuration sent by the client in a workspace/didChangeConfiguration notification. It is
   * received by the workspace service and then updated here. This object can be replaced at any
   * time, so it should always be accessed via this class; never store a reference to it, as it may
   * be out of date.
   */
  private volatile Configuration config = new Configuration();

  /**
   * Retrieve the most recently completed analysis for the given file. If an analysis has already
   * been completed then the future will resolve immediately. If one is in progress, the future will
   * resolve when it completes. Files that were never scheduled for analysis, such as files that are
   * not open, are analysed on the spot.
   */
  public CompletableFuture<FileAnalysis> getAnalysis(URI uri) {
    FileAnalysis analysis = analyses.get(uri);
    if (analysis != null) {
      return CompletableFuture.completedFuture(analysis);
    }
    CompletableFuture<FileAnalysis> pending = pendingAnalyses.get(uri);
    if (pending != null) {
      return pending;
    }
    CMakeFile file = documents.get(uri);
    if (file == null) {
      return CompletableFuture.completedFuture(null);
    }
    return CompletableFuture.completedFuture(Analysis.analyse(file, projectConfig));
  }

  /** Block until the analysis that is scheduled for the given file, if any, has completed. */
  void waitForAnalysis(URI uri) throws Exception {
    CompletableFuture<FileAnalysis> pending = pendingAnalyses.get(uri);
    if (pending != null) {
      pending.get();
    }
  }

  @Override
  public void didOpen(DidOpenTextDocumentParams params) {
    TextDocumentItem doc = params.getTextDocument();
    CMakeFile file = documents.open(doc);
    scheduleAnalysis(file.uri);
  }

  @Override
  public void didSave(DidSaveTextDocumentParams params) {}

  @Override
  public void didClose(DidCloseTextDocumentParams params) {
    URI uri = uri(params.getTextDocument().getUri());
    documents.close(uri);
    analyses.remove(uri);
  }

  @Override
  public void didChange(DidChangeTextDocumentParams params) {
    CMakeFile file = documents.applyChanges(params);
    scheduleAnalysis(file.uri);
  }

  @Override
  public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>> documentSymbol(
      DocumentSymbolParams params) {
    URI uri = uri(params.getTextDocument().getUri());
    List<Either<SymbolInformation, DocumentSymbol>> symbols =
        Optional.ofNullable(documents.get(uri))
            .map(
                file ->
                    DocumentSymbolRequest.symbols(file)
                        .map(symbol -> Either.<SymbolInformation, DocumentSymbol>forRight(symbol))
                        .collect(toList()))
            .orElseGet(ArrayList::new);
    return CompletableFuture.completedFuture(symbols);
  }

  /**
   * Blocks and multi-line commands fold as regions. Runs of comment lines fold as comments, as do
   * bracket comments that span several lines.
   */
  @Override
  public CompletableFuture<List<FoldingRange>> foldingRange(FoldingRangeRequestParams params) {
    URI uri = uri(params.getTextDocument().getUri());
    CMakeFile file = documents.get(uri);
    if (file == null || !file.script.isPresent()) {
      return CompletableFuture.completedFuture(new ArrayList<>());
    }

    List<FoldingRange> ranges = new ArrayList<>();
    List<Comment> commentRun = new ArrayList<>();
    Function<AstNode, FoldingRange> makeRange =
        node ->
            new FoldingRange(
                file.position(node.span.getOffset()).getLine(),
                file.position(node.span.getEnd() - 1).getLine());
    Runnable closeCommentRun =
        () -> {
          if (commentRun.size() > 1) {
            FoldingRange range =
                new FoldingRange(
                    file.position(commentRun.get(0).span.getOffset()).getLine(),
                    file.position(commentRun.get(commentRun.size() - 1).span.getOffset())
                        .getLine());
            range.setKind(FoldingRangeKind.Comment);
            ranges.add(range);
          }
          commentRun.clear();
        };

    file.script
        .get()
        .traverse(
            node -> {
              if (node instanceof Comment && !((Comment) node).bracket) {
                Comment comment = (Comment) node;
                int line = file.position(comment.span.getOffset()).getLine();
                boolean adjacent =
                    !commentRun.isEmpty()
                        && file.position(commentRun.get(commentRun.size() - 1).span.getOffset())
                                .getLine()
                            == line - 1;
                if (!adjacent) {
                  closeCommentRun.run();
                }
                commentRun.add(comment);
                return;
              }
              closeCommentRun.run();

              FoldingRange range = makeRange.apply(node);
              if (range.getStartLine() >= range.getEndLine()) {
                return;
              }
              if (node instanceof Comment) {
                range.setKind(FoldingRangeKind.Comment);
                ranges.add(range);
              } else if (node instanceof BlockNode || node instanceof CommandInvocation) {
                range.setKind(FoldingRangeKind.Region);
                ranges.add(range);
              }
            });
    closeCommentRun.run();

    return CompletableFuture.completedFuture(ranges);
  }

  @Override
  public CompletableFuture<Hover> hover(HoverParams params) {
    URI uri = uri(params.getTextDocument().getUri());

    Function<FileAnalysis, Hover> getHover =
        analysis -> {
          CMakeFile file = analysis.file;
          int offset = file.offset(params.getPosition());

          Optional<VariableRetrieval> retrieval = analysis.variableRetrieval(offset);
          if (retrieval.isPresent()) {
            return new Hover(
                new MarkupContent(MarkupKind.PLAINTEXT, retrieval.get().value()),
                retrieval.get().readSiteLocation.getRange());
          }

          return file.command(offset)
              .filter(command -> command.nameSpan.containsOffset(offset))
              .map(command -> hoverCommand(analysis, command))
              .orElse(null);
        };

    return getAnalysis(uri)
        .thenApply(analysis -> Optional.ofNullable(analysis).map(getHover).orElse(null));
  }

  /** Hover text for the name of a command: a condition's result, or a call's documentation. */
  private Hover hoverCommand(FileAnalysis analysis, CommandInvocation command) {
    Range range = analysis.file.rangeFor(command.nameSpan);

    Optional<Hover> condition =
        analysis
            .condition(command)
            .map(
                evaluation ->
                    new Hover(
                        new MarkupContent(
                            MarkupKind.PLAINTEXT,
                            "Condition is " + (evaluation.result ? "true" : "false")),
                        range));
    if (condition.isPresent()) {
      return condition.get();
    }

    String prefix = config.renderHoverVerbatim ? "    " : "";
    return analysis
        .commandCall(command)
        .flatMap(call -> call.definition)
        .map(
            definition -> {
              String text =
                  definition
                      .commentText
                      .flatMap(
                          comment -> {
                            List<String> lines =
                                Arrays.stream(comment.split("\n"))
                                    .map(line -> prefix + line)
                                    .collect(toList());
                            return config.fullCommentHover
                                ? Optional.of(String.join("\n", lines))
                                : lines.stream().filter(line -> !line.trim().isEmpty()).findFirst();
                          })
                      .orElse(prefix + definition.signature());
              return new Hover(new MarkupContent(MarkupKind.MARKDOWN, text), range);
            })
        .orElse(null);
  }

  @Override
  public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>>
      definition(DefinitionParams params) {
    URI uri = uri(params.getTextDocument().getUri());

    Function<FileAnalysis, List<Location>> findDefinition =
        analysis -> {
          int offset = analysis.file.offset(params.getPosition());

          Optional<Location> variable =
              analysis
                  .variableRetrieval(offset)
                  .flatMap(retrieval -> retrieval.definition)
                  .map(definition -> definition.location);
          if (variable.isPresent()) {
            return singletonList(variable.get());
          }

          return analysis
              .file
              .command(offset)
              .filter(command -> command.nameSpan.containsOffset(offset))
              .flatMap(analysis::commandCall)
              .flatMap(call -> call.definition)
              .map(definition -> singletonList(definition.location))
              .orElseGet(ArrayList::new);
        };

    return getAnalysis(uri)
        .thenApply(
            analysis ->
                Either.forLeft(
                    analysis == null ? new ArrayList<Location>() : findDefinition.apply(analysis)));
  }

  /** Wire up a reference to the client, so that we can send diagnostics. */
  void connect(LanguageClient client) {
    this.client = client;
  }

  /** Replace the project configuration and analyse every open file again. */
  void setProjectConfig(ProjectConfiguration projectConfig) {
    this.projectConfig = projectConfig;
    scheduleAnalysisOfOpenFiles();
  }

  void setConfiguration(Configuration config) {
    this.config = config;
    if (config.debounceTime != null) {
      LOG.info("Updating debounce time to {} ms", config.debounceTime);
      debouncer.setDelay(Duration.ofMillis(config.debounceTime));
      scheduleAnalysisOfOpenFiles();
    }
  }

  void shutdown() {
    debouncer.shutdown();
  }

  private void scheduleAnalysisOfOpenFiles() {
    documents.openUris().forEach(this::scheduleAnalysis);
  }

  /**
   * Schedule an analysis run for a file. It is safe to call this multiple times in quick
   * succession, because the requests are debounced.
   */
  private void scheduleAnalysis(URI uri) {
    pendingAnalyses.compute(
        uri,
        (key, future) ->
            future == null || future.isDone() ? new CompletableFuture<FileAnalysis>() : future);
    dirtyUris.add(uri);
    debouncer.submit(this::analyseDirtyFiles);
  }

  /** Analyse all the files that changed since the last run. Runs on the debouncer's thread. */
  private void analyseDirtyFiles() {
    for (URI uri : ImmutableSet.copyOf(dirtyUris)) {
      dirtyUris.remove(uri);
      CompletableFuture<FileAnalysis> future = pendingAnalyses.get(uri);
      try {
        CMakeFile file = documents.get(uri);
        if (file == null) {
          throw new IllegalStateException("No contents for " + uri);
        }
        FileAnalysis analysis = Analysis.analyse(file, projectConfig);
        analyses.put(uri, analysis);
        reportDiagnostics(analysis);
        if (future != null) {
          future.complete(analysis);
        }
      } catch (Exception e) {
        LOG.error("Analysis of {} failed", uri, e);
        if (future != null) {
          future.completeExceptionally(e);
        }
      } finally {
        if (future != null) {
          pendingAnalyses.remove(uri, future);
        }
      }
    }
  }

  /** Report diagnostics from the given analysis, which include the file's syntax errors. */
  private void reportDiagnostics(FileAnalysis analysis) {
    if (client == null) {
      return;
    }
    LOG.debug(
        "Publishing {} diagnostics for {}: {}",
        analysis.diagnostics.size(),
        analysis.uri,
        analysis.diagnostics.stream().map(d -> d.getMessage()).collect(joining("; ")));
    client.publishDiagnostics(
        new PublishDiagnosticsParams(
            analysis.uri.toString(), ImmutableList.copyOf(analysis.diagnostics)));
  }

  // Helpers

  /**
   * Convert a String to a URI. Constructing a URI can throw a URISyntaxException. However, a well
   * behaved LSP client should never send badly formed URIs, so it is more convenient to turn this
   * into an unchecked exception. The lsp4j library will handle them gracefully anyway.
   */
  static URI uri(String uriString) {
    try {
      return new URI(uriString).normalize();
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }
}
