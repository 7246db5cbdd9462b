package com.soartech.cmakels.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.soartech.cmakels.CMakeFile;
import com.soartech.cmakels.cmake.ast.CommandInvocation;
import java.net.URI;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.eclipse.lsp4j.Diagnostic;

/** Complete analysis information for a single file. */
public class FileAnalysis {
  /** The URI of the file that was analysed. */
  public final URI uri;

  /** The state of the file that was analysed. */
  public final CMakeFile file;

  /**
   * All the command invocations in this file. The keys to this map are the AST nodes of the
   * invocations, which are compared by identity.
   */
  public final ImmutableMap<CommandInvocation, CommandCall> commandCalls;

  /** Functions and macros defined in this file, in source order. */
  public final ImmutableList<CommandDefinition> commandDefinitions;

  /** Variables set in this file, in the order that the analysis encountered them. */
  public final ImmutableList<VariableDefinition> variableDefinitions;

  /** Every variable reference in this file, nested references included. */
  public final ImmutableList<VariableRetrieval> variableRetrievals;

  /** The results of the conditions of if(), elseif() and while() commands. */
  public final ImmutableMap<CommandInvocation, ConditionEvaluation> conditions;

  /** The names of the targets created in this file. */
  public final ImmutableSet<String> targets;

  /**
   * Errors and warnings that were detected in this file. This includes the syntax error, if the
   * file could not be parsed.
   */
  public final ImmutableList<Diagnostic> diagnostics;

  // Helpers

  /** Get the call record of the given command. */
  public Optional<CommandCall> commandCall(CommandInvocation command) {
    return Optional.ofNullable(commandCalls.get(command));
  }

  /** Find a function or macro definition by name, ignoring case. */
  public Optional<CommandDefinition> commandDefinition(String name) {
    String key = name.toLowerCase(Locale.ROOT);
    return commandDefinitions.stream()
        .filter(definition -> definition.name.toLowerCase(Locale.ROOT).equals(key))
        .reduce((first, second) -> second);
  }

  /** Get the innermost variable reference that contains the given offset. */
  public Optional<VariableRetrieval> variableRetrieval(int offset) {
    return variableRetrievals.stream()
        .filter(retrieval -> retrieval.containsOffset(offset))
        .min(Comparator.comparingInt(retrieval -> retrieval.endOffset - retrieval.startOffset));
  }

  /** Get the result of the condition of an if(), elseif() or while() command. */
  public Optional<ConditionEvaluation> condition(CommandInvocation command) {
    return Optional.ofNullable(conditions.get(command));
  }

  FileAnalysis(
      CMakeFile file,
      Map<CommandInvocation, CommandCall> commandCalls,
      Collection<CommandDefinition> commandDefinitions,
      List<VariableDefinition> variableDefinitions,
      List<VariableRetrieval> variableRetrievals,
      Map<CommandInvocation, ConditionEvaluation> conditions,
      Collection<String> targets,
      List<Diagnostic> diagnostics) {
    this.uri = file.uri;
    this.file = file;
    this.commandCalls = ImmutableMap.copyOf(commandCalls);
    this.commandDefinitions = ImmutableList.copyOf(commandDefinitions);
    this.variableDefinitions = ImmutableList.copyOf(variableDefinitions);
    this.variableRetrievals = ImmutableList.copyOf(variableRetrievals);
    this.conditions = ImmutableMap.copyOf(conditions);
    this.targets = ImmutableSet.copyOf(targets);
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }
}
