package com.soartech.cmakels.analysis;

import com.soartech.cmakels.CMakeFile;
import com.soartech.cmakels.ProjectConfiguration;
import com.soartech.cmakels.cmake.CMakeEvalException;
import com.soartech.cmakels.cmake.SourceSpan;
import com.soartech.cmakels.cmake.ast.Argument;
import com.soartech.cmakels.cmake.ast.ArgumentKind;
import com.soartech.cmakels.cmake.ast.AstNode;
import com.soartech.cmakels.cmake.ast.AstVisitor;
import com.soartech.cmakels.cmake.ast.BodyBlock;
import com.soartech.cmakels.cmake.ast.CommandInvocation;
import com.soartech.cmakels.cmake.ast.Comment;
import com.soartech.cmakels.cmake.ast.DefinitionBlock;
import com.soartech.cmakels.cmake.ast.ForEachBlock;
import com.soartech.cmakels.cmake.ast.FunctionBlock;
import com.soartech.cmakels.cmake.ast.IfBlock;
import com.soartech.cmakels.cmake.ast.ScopeBlock;
import com.soartech.cmakels.cmake.ast.Script;
import com.soartech.cmakels.cmake.ast.WhileBlock;
import com.soartech.cmakels.cmake.eval.DereferencePolicy;
import com.soartech.cmakels.cmake.eval.ExpandedArgument;
import com.soartech.cmakels.cmake.eval.ExpressionEvaluator;
import com.soartech.cmakels.cmake.eval.ListValues;
import com.soartech.cmakels.cmake.eval.MapVariableContext;
import com.soartech.cmakels.cmake.eval.Namespace;
import com.soartech.cmakels.cmake.eval.VariableContext;
import com.soartech.cmakels.cmake.eval.VariableExpander;
import com.soartech.cmakels.cmake.eval.VariableReference;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An analyser for a single CMake file. Run via the analyse() static method.
 *
 * <p>This is not an interpreter. The file is walked once from top to bottom, entering the body of
 * every block and every branch of every if() regardless of its condition, while keeping track of
 * the variables that set(), unset() and option() change along the way. Function, macro and block()
 * bodies are walked where they are written, in a copy of the enclosing scope, so that variables
 * they set do not leak out.
 */
public class Analysis implements AstVisitor<Void> {
  private static final Logger LOG = LoggerFactory.getLogger(Analysis.class);

  static final String DIAGNOSTIC_SOURCE = "cmake-analysis";

  private final CMakeFile file;

  /** From the manifest file as it was when the analysis was started. */
  private final DereferencePolicy policy;

  /** The comments that directly precede each command, by identity of the command. */
  private final Map<CommandInvocation, String> leadingComments = new IdentityHashMap<>();

  // These are mutable counterparts of the fields in FileAnalysis. They
  // are copied to an immutable FileAnalysis at the end.

  private final Map<String, CommandDefinition> commandDefinitions = new LinkedHashMap<>();
  private final Map<CommandInvocation, CommandCall> commandCalls = new LinkedHashMap<>();
  private final List<VariableDefinition> variableDefinitions = new ArrayList<>();
  private final List<VariableRetrieval> variableRetrievals = new ArrayList<>();
  private final Map<CommandInvocation, ConditionEvaluation> conditions = new LinkedHashMap<>();
  private final Set<String> targets = new LinkedHashSet<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  /** Ordinary variables of the scope currently being walked. */
  private Variables normal;

  // Environment variables and cache entries are global.
  private final Variables environment;
  private final Variables cache;

  /** How many function or macro bodies enclose the node currently being walked. */
  private int definitionDepth = 0;

  private final VariableContext context = new ScopeContext();

  private final AnalysisTestOracle oracle;

  private Analysis(CMakeFile file, ProjectConfiguration projectConfig) {
    this.file = file;
    this.policy = projectConfig.dereferencePolicy();

    MapVariableContext initial = projectConfig.initialVariables();
    this.normal = new Variables(initial.normal);
    this.environment = new Variables(initial.environment);
    this.cache = new Variables(initial.cache);

    this.oracle =
        new AnalysisTestOracle(
            file.uri, projectConfig, context, commandDefinitions.keySet(), targets);
  }

  /** Perform a full analysis of a single file. */
  public static FileAnalysis analyse(CMakeFile file, ProjectConfiguration projectConfig) {
    Analysis analysis = new Analysis(file, projectConfig);
    analysis.diagnostics.addAll(file.diagnostics);
    file.script.ifPresent(analysis::analyseScript);
    LOG.info("Completed analysis of {}", file.uri);
    return analysis.toFileAnalysis();
  }

  private FileAnalysis toFileAnalysis() {
    return new FileAnalysis(
        file,
        commandCalls,
        commandDefinitions.values(),
        variableDefinitions,
        variableRetrievals,
        conditions,
        targets,
        diagnostics);
  }

  private void analyseScript(Script script) {
    collectLeadingComments(script);
    collectDefinitions(script);
    for (AstNode node : script.nodes) {
      node.accept(this);
    }
  }

  /**
   * Find the run of comments directly above each command. The run is broken by blank lines, and a
   * comment at the end of a line of code is not part of it.
   */
  private void collectLeadingComments(Script script) {
    List<Comment> pending = new ArrayList<>();
    int[] lastLine = {-1};
    script.traverse(
        node -> {
          if (node instanceof Comment) {
            Comment comment = (Comment) node;
            if (comment.span.getLine() != lastLine[0] + 1 || isTrailing(comment)) {
              pending.clear();
            }
            if (!isTrailing(comment)) {
              pending.add(comment);
            }
            lastLine[0] = endLine(comment.span);
          } else if (node instanceof CommandInvocation) {
            CommandInvocation command = (CommandInvocation) node;
            if (!pending.isEmpty() && command.span.getLine() == lastLine[0] + 1) {
              leadingComments.put(command, commentText(pending));
            }
            pending.clear();
            lastLine[0] = endLine(command.span);
          }
        });
  }

  private boolean isTrailing(Comment comment) {
    int offset = comment.span.getOffset();
    int lineStart = offset - file.position(offset).getCharacter();
    return !file.contents.substring(lineStart, comment.span.getOffset()).trim().isEmpty();
  }

  /** The 1-based line of the last character of a span. */
  private int endLine(SourceSpan span) {
    return file.position(Math.max(span.getOffset(), span.getEnd() - 1)).getLine() + 1;
  }

  private static String commentText(List<Comment> comments) {
    return comments.stream()
        .map(comment -> comment.bracket ? comment.text.trim() : stripCommentLine(comment.text))
        .collect(Collectors.joining("\n"));
  }

  private static String stripCommentLine(String text) {
    // Lines like "####" are decoration.
    String stripped = text.replaceFirst("^#+", "");
    return stripped.startsWith(" ") ? stripped.substring(1).trim() : stripped.trim();
  }

  /** Collect functions and macros up front, so they can be linked to calls above them. */
  private void collectDefinitions(Script script) {
    script.traverse(
        node -> {
          if (!(node instanceof DefinitionBlock)) {
            return;
          }
          DefinitionBlock block = (DefinitionBlock) node;
          Optional<Argument> nameArgument = block.nameArgument();
          if (!nameArgument.isPresent()) {
            return;
          }
          Argument name = nameArgument.get();
          CommandDefinition definition =
              new CommandDefinition(
                  name.text,
                  location(name.span),
                  block.parameters(),
                  block,
                  leadingComments.get(block.header));
          // As in CMake, a later definition replaces an earlier one.
          commandDefinitions.put(name.text.toLowerCase(Locale.ROOT), definition);
        });
  }

  @Override
  public Void visitCommand(CommandInvocation command) {
    recordCommand(command);
    List<ExpandedArgument> arguments = VariableExpander.expandArguments(command.arguments, context);
    switch (command.identifier()) {
      case "set":
        set(command, arguments);
        break;
      case "unset":
        unset(arguments);
        break;
      case "option":
        option(command, arguments);
        break;
      case "add_executable":
      case "add_library":
      case "add_custom_target":
        if (!arguments.isEmpty()) {
          targets.add(arguments.get(0).value);
        }
        break;
      default:
        break;
    }
    return null;
  }

  @Override
  public Void visitComment(Comment comment) {
    return null;
  }

  @Override
  public Void visitIf(IfBlock block) {
    for (IfBlock.Branch branch : block.branches) {
      recordCommand(branch.command);
      evaluateCondition(branch.command);
      branch.body.forEach(node -> node.accept(this));
    }
    block.elseBranch.ifPresent(
        branch -> {
          recordCommand(branch.command);
          branch.body.forEach(node -> node.accept(this));
        });
    recordCommand(block.footer);
    return null;
  }

  @Override
  public Void visitBody(BodyBlock block) {
    recordCommand(block.header);

    if (block instanceof DefinitionBlock) {
      walkDefinition((DefinitionBlock) block);
    } else if (block instanceof ScopeBlock) {
      walkInNewScope(block.body);
    } else {
      if (block instanceof WhileBlock) {
        evaluateCondition(block.header);
      } else if (block instanceof ForEachBlock) {
        defineLoopVariable(block.header);
      }
      block.body.forEach(node -> node.accept(this));
    }

    recordCommand(block.footer);
    return null;
  }

  private void walkDefinition(DefinitionBlock block) {
    Variables enclosing = normal;
    normal = normal.copy();
    ++definitionDepth;
    try {
      // Parameters have no value until the command is called.
      for (String parameter : block.parameters()) {
        define(normal, Namespace.NORMAL, parameter, "", block.header);
      }
      if (block instanceof FunctionBlock) {
        define(normal, Namespace.NORMAL, "ARGN", "", block.header);
      }
      block.body.forEach(node -> node.accept(this));
    } finally {
      --definitionDepth;
      normal = enclosing;
    }
  }

  private void walkInNewScope(List<AstNode> body) {
    Variables enclosing = normal;
    normal = normal.copy();
    try {
      body.forEach(node -> node.accept(this));
    } finally {
      normal = enclosing;
    }
  }

  /** Record a command call along with the variable references in its arguments. */
  private void recordCommand(CommandInvocation command) {
    CommandDefinition definition = commandDefinitions.get(command.identifier());
    commandCalls.put(command, new CommandCall(location(command.span), command, definition));

    for (Argument argument : command.arguments) {
      if (!argument.isExpandable()) {
        continue;
      }
      for (VariableReference reference : VariableExpander.references(argument.text, context)) {
        int start = sourceOffset(argument, reference.start);
        int end = sourceOffset(argument, reference.end - 1) + 1;
        Location location =
            new Location(file.uri.toString(), new Range(file.position(start), file.position(end)));
        VariableDefinition variable = definition(reference.namespace, reference.name).orElse(null);
        variableRetrievals.add(
            new VariableRetrieval(location, start, end, reference, command, variable));
      }
    }
  }

  /**
   * Map an index into an argument's text back to the file. The text is the source slice except for
   * line continuations, which the lexer drops; escape sequences are kept as written.
   */
  private int sourceOffset(Argument argument, int index) {
    String contents = file.contents;
    int offset = argument.span.getOffset() + (argument.kind == ArgumentKind.QUOTED ? 1 : 0);
    int remaining = index;
    while (offset < contents.length()) {
      boolean escape = contents.charAt(offset) == '\\' && offset + 1 < contents.length();
      if (escape && contents.charAt(offset + 1) == '\n') {
        offset += 2;
      } else if (remaining <= 0) {
        break;
      } else if (escape) {
        offset += 2;
        remaining -= 2;
      } else {
        offset += 1;
        remaining -= 1;
      }
    }
    return offset;
  }

  private void evaluateCondition(CommandInvocation command) {
    // Inside a function or macro, the variables depend on the caller.
    if (definitionDepth > 0) {
      return;
    }
    try {
      boolean result = ExpressionEvaluator.evaluate(command.arguments, context, oracle, policy);
      conditions.put(command, new ConditionEvaluation(command, result));
    } catch (CMakeEvalException e) {
      LOG.debug("Failed to evaluate condition of {}", command, e);
      SourceSpan span = e.getSpan().equals(SourceSpan.NONE) ? command.span : e.getSpan();
      diagnostics.add(
          new Diagnostic(
              file.rangeFor(span), e.getMessage(), DiagnosticSeverity.Error, DIAGNOSTIC_SOURCE));
    }
  }

  /**
   * set(NAME value...) sets an ordinary variable to the list of values. set(NAME value... CACHE
   * type docstring [FORCE]) sets a cache entry unless it already exists. set(ENV{NAME} value) sets
   * an environment variable. Without values, the variable is removed.
   */
  private void set(CommandInvocation command, List<ExpandedArgument> arguments) {
    if (arguments.isEmpty()) {
      return;
    }
    String name = arguments.get(0).value;
    List<String> values =
        arguments.stream().skip(1).map(argument -> argument.value).collect(Collectors.toList());

    Optional<String> environmentName = environmentName(name);
    if (environmentName.isPresent()) {
      if (values.isEmpty() || values.get(0).isEmpty()) {
        environment.remove(environmentName.get());
      } else {
        define(environment, Namespace.ENVIRONMENT, environmentName.get(), values.get(0), command);
      }
      return;
    }

    int cacheIndex = values.indexOf("CACHE");
    if (cacheIndex >= 0) {
      boolean force = values.subList(cacheIndex, values.size()).contains("FORCE");
      if (force || !cache.value(name).isPresent()) {
        String value = ListValues.join(values.subList(0, cacheIndex));
        define(cache, Namespace.CACHE, name, value, command);
      }
      return;
    }

    // Parent scopes are not tracked.
    if (!values.isEmpty() && values.get(values.size() - 1).equals("PARENT_SCOPE")) {
      return;
    }

    if (values.isEmpty()) {
      normal.remove(name);
    } else {
      define(normal, Namespace.NORMAL, name, ListValues.join(values), command);
    }
  }

  /** unset(NAME [CACHE | PARENT_SCOPE]) and unset(ENV{NAME}). */
  private void unset(List<ExpandedArgument> arguments) {
    if (arguments.isEmpty()) {
      return;
    }
    String name = arguments.get(0).value;
    Optional<String> environmentName = environmentName(name);
    if (environmentName.isPresent()) {
      environment.remove(environmentName.get());
      return;
    }
    boolean hasCache =
        arguments.stream().skip(1).anyMatch(argument -> argument.value.equals("CACHE"));
    boolean hasParentScope =
        arguments.stream().skip(1).anyMatch(argument -> argument.value.equals("PARENT_SCOPE"));
    if (hasCache) {
      cache.remove(name);
    } else if (!hasParentScope) {
      normal.remove(name);
    }
  }

  /** option(NAME docstring [value]) creates a cache entry, OFF by default, unless it is set. */
  private void option(CommandInvocation command, List<ExpandedArgument> arguments) {
    if (arguments.isEmpty()) {
      return;
    }
    String name = arguments.get(0).value;
    if (normal.value(name).isPresent() || cache.value(name).isPresent()) {
      return;
    }
    String value = arguments.size() > 2 ? arguments.get(2).value : "OFF";
    define(cache, Namespace.CACHE, name, value, command);
  }

  /**
   * foreach(VAR items...), foreach(VAR IN ITEMS|LISTS ...) and foreach(VAR RANGE ...) define the
   * loop variable. Its value is the first item, since the body is only walked once.
   */
  private void defineLoopVariable(CommandInvocation header) {
    List<ExpandedArgument> arguments = VariableExpander.expandArguments(header.arguments, context);
    if (arguments.isEmpty()) {
      return;
    }
    String name = arguments.get(0).value;
    List<String> rest =
        arguments.stream().skip(1).map(argument -> argument.value).collect(Collectors.toList());

    List<String> items = new ArrayList<>();
    if (!rest.isEmpty() && rest.get(0).equals("RANGE")) {
      items.add(rest.size() == 2 ? "0" : rest.size() > 2 ? rest.get(1) : "");
    } else if (!rest.isEmpty() && rest.get(0).equals("IN")) {
      boolean lists = false;
      for (String item : rest.subList(1, rest.size())) {
        if (item.equals("LISTS") || item.equals("ITEMS")) {
          lists = item.equals("LISTS");
        } else if (lists) {
          context.normal(item).ifPresent(value -> items.addAll(ListValues.split(value)));
        } else {
          items.add(item);
        }
      }
    } else {
      items.addAll(rest);
    }

    define(normal, Namespace.NORMAL, name, items.isEmpty() ? "" : items.get(0), header);
  }

  private void define(
      Variables variables,
      Namespace namespace,
      String name,
      String value,
      CommandInvocation command) {
    VariableDefinition definition =
        new VariableDefinition(
            name, namespace, location(command.span), command, value, leadingComments.get(command));
    variables.put(name, value, definition);
    variableDefinitions.add(definition);
  }

  private static Optional<String> environmentName(String name) {
    if (name.startsWith("ENV{") && name.endsWith("}")) {
      return Optional.of(name.substring(4, name.length() - 1));
    }
    return Optional.empty();
  }

  /** Find the command that set the variable a reference reads. */
  private Optional<VariableDefinition> definition(Namespace namespace, String name) {
    switch (namespace) {
      case ENVIRONMENT:
        return environment.definition(name);
      case CACHE:
        return cache.definition(name);
      default:
        // ${NAME} falls back to the cache entry when there is no ordinary variable.
        return normal.value(name).isPresent() ? normal.definition(name) : cache.definition(name);
    }
  }

  private Location location(SourceSpan span) {
    return new Location(file.uri.toString(), file.rangeFor(span));
  }

  /** The variables of one namespace in one scope, along with where they were set. */
  private static class Variables {
    final Map<String, String> values;

    final Map<String, VariableDefinition> definitions;

    Variables(Map<String, String> initial) {
      this(new HashMap<>(initial), new HashMap<>());
    }

    private Variables(Map<String, String> values, Map<String, VariableDefinition> definitions) {
      this.values = values;
      this.definitions = definitions;
    }

    Optional<String> value(String name) {
      return Optional.ofNullable(values.get(name));
    }

    Optional<VariableDefinition> definition(String name) {
      return Optional.ofNullable(definitions.get(name));
    }

    void put(String name, String newValue, VariableDefinition definition) {
      values.put(name, newValue);
      definitions.put(name, definition);
    }

    void remove(String name) {
      values.remove(name);
      definitions.remove(name);
    }

    Variables copy() {
      return new Variables(new HashMap<>(values), new HashMap<>(definitions));
    }
  }

  /** A live view of the variables at the point of the walk. */
  private class ScopeContext implements VariableContext {
    @Override
    public Optional<String> normal(String name) {
      Optional<String> value = Analysis.this.normal.value(name);
      return value.isPresent() ? value : cache.value(name);
    }

    @Override
    public Optional<String> environment(String name) {
      return Analysis.this.environment.value(name);
    }

    @Override
    public Optional<String> cache(String name) {
      return Analysis.this.cache.value(name);
    }
  }
}
