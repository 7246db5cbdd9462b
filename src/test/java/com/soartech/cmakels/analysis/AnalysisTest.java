package com.soartech.cmakels.analysis;

import static java.util.stream.Collectors.toList;
import static org.junit.jupiter.api.Assertions.*;

import com.soartech.cmakels.CMakeFile;
import com.soartech.cmakels.ProjectConfiguration;
import com.soartech.cmakels.cmake.ast.CommandInvocation;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the analysis of a single file, without a language server around it. Each test writes
 * a small script and checks what the analysis recorded about it.
 */
public class AnalysisTest {
  static final URI DOCUMENT = URI.create("file:///workspace/project/CMakeLists.txt");

  @TempDir Path directory;

  static FileAnalysis analyse(String source) {
    return analyse(source, new ProjectConfiguration());
  }

  static FileAnalysis analyse(String source, ProjectConfiguration config) {
    return Analysis.analyse(new CMakeFile(DOCUMENT, source), config);
  }

  /** The offset of the nth occurrence of some text, counting from zero. */
  static int offsetOf(String source, String text, int occurrence) {
    int offset = source.indexOf(text);
    for (int i = 0; i < occurrence; ++i) {
      offset = source.indexOf(text, offset + 1);
    }
    assertTrue(offset >= 0, "no occurrence " + occurrence + " of " + text);
    return offset;
  }

  /** The value read by the reference that starts at the nth occurrence of some text. */
  static String valueAt(FileAnalysis analysis, String text, int occurrence) {
    int offset = offsetOf(analysis.file.contents, text, occurrence);
    VariableRetrieval retrieval = analysis.variableRetrieval(offset + 2).orElse(null);
    assertNotNull(retrieval, "no reference at " + text);
    return retrieval.value();
  }

  static String valueAt(FileAnalysis analysis, String text) {
    return valueAt(analysis, text, 0);
  }

  /** The result of the nth condition command with the given name. */
  static Optional<Boolean> conditionResult(FileAnalysis analysis, String name, int occurrence) {
    List<CommandInvocation> commands =
        analysis.file.script.get().flatten().stream()
            .filter(command -> command.is(name))
            .collect(toList());
    return analysis.condition(commands.get(occurrence)).map(evaluation -> evaluation.result);
  }

  static Range range(int startLine, int startCharacter, int endLine, int endCharacter) {
    return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
  }

  @Test
  public void variableValues() {
    FileAnalysis analysis = analyse("set(A 1)\nset(B \"${A} two\")\nmessage(STATUS ${B})\n");
    assertEquals("1", valueAt(analysis, "${A}"));
    assertEquals("1 two", valueAt(analysis, "${B}"));
    assertTrue(analysis.diagnostics.isEmpty());
  }

  @Test
  public void retrievalLocations() {
    FileAnalysis analysis = analyse("set(A 1)\nset(B \"${A} two\")\n");
    VariableRetrieval retrieval = analysis.variableRetrieval(17).get();
    assertEquals(16, retrieval.startOffset);
    assertEquals(20, retrieval.endOffset);
    assertEquals(range(1, 7, 1, 11), retrieval.readSiteLocation.getRange());
    assertEquals("A", retrieval.reference.name);
    assertTrue(retrieval.command.is("set"));
  }

  @Test
  public void retrievalLocationsAfterLineContinuations() {
    String source = "set(X v)\nmessage(\"ab\\\ncd${X}\")\nmessage(a\\\n${X} \"\\n${X}\")\n";
    FileAnalysis analysis = analyse(source);

    int quoted = offsetOf(source, "${X}", 0);
    VariableRetrieval retrieval = analysis.variableRetrieval(quoted).get();
    assertEquals(quoted, retrieval.startOffset);
    assertEquals(quoted + 4, retrieval.endOffset);
    assertEquals(range(2, 2, 2, 6), retrieval.readSiteLocation.getRange());

    int unquoted = offsetOf(source, "${X}", 1);
    retrieval = analysis.variableRetrieval(unquoted).get();
    assertEquals(unquoted, retrieval.startOffset);
    assertEquals(range(4, 0, 4, 4), retrieval.readSiteLocation.getRange());

    int escaped = offsetOf(source, "${X}", 2);
    retrieval = analysis.variableRetrieval(escaped).get();
    assertEquals(escaped, retrieval.startOffset);
    assertEquals(escaped + 4, retrieval.endOffset);
    assertEquals("v", retrieval.value());
  }

  @Test
  public void retrievalsLinkToDefinitions() {
    FileAnalysis analysis = analyse("set(A 1)\nset(A 2)\nmessage(${A})\n");
    int offset = offsetOf(analysis.file.contents, "${A}", 0);
    VariableRetrieval retrieval = analysis.variableRetrieval(offset + 2).get();
    VariableDefinition definition = retrieval.definition.get();
    assertEquals("2", definition.value);
    assertEquals(range(1, 0, 1, 8), definition.location.getRange());
    assertEquals(2, analysis.variableDefinitions.size());
  }

  @Test
  public void valuesAreReadAtTheReference() {
    FileAnalysis analysis = analyse("set(A 1)\nmessage(${A})\nset(A 2)\nmessage(${A})\n");
    assertEquals("1", valueAt(analysis, "${A}", 0));
    assertEquals("2", valueAt(analysis, "${A}", 1));
  }

  @Test
  public void missingVariable() {
    FileAnalysis analysis = analyse("message(${MISSING})\n");
    VariableRetrieval retrieval = analysis.variableRetrieval(10).get();
    assertEquals("", retrieval.value());
    assertFalse(retrieval.definition.isPresent());
  }

  @Test
  public void nestedReferences() {
    FileAnalysis analysis = analyse("set(OTHER X)\nset(X value)\nmessage(${${OTHER}})\n");
    int outer = offsetOf(analysis.file.contents, "${${", 0);
    assertEquals("value", analysis.variableRetrieval(outer).get().value());
    assertEquals("X", analysis.variableRetrieval(outer + 4).get().value());
  }

  @Test
  public void bracketArgumentsHaveNoReferences() {
    FileAnalysis analysis = analyse("set(A 1)\nmessage([[${A}]])\n");
    assertTrue(analysis.variableRetrievals.isEmpty());
  }

  @Test
  public void unset() {
    FileAnalysis analysis = analyse("set(A 1)\nunset(A)\nmessage(${A})\n");
    assertEquals("", valueAt(analysis, "${A}"));
  }

  @Test
  public void setWithoutValueRemoves() {
    FileAnalysis analysis = analyse("set(A 1)\nset(A)\nmessage(${A})\n");
    assertEquals("", valueAt(analysis, "${A}"));
  }

  @Test
  public void listValues() {
    FileAnalysis analysis = analyse("set(L a b \"c;d\")\nmessage(\"${L}\")\n");
    assertEquals("a;b;c;d", valueAt(analysis, "${L}"));
  }

  @Test
  public void parentScopeIsIgnored() {
    FileAnalysis analysis = analyse("set(A 1)\nset(A 2 PARENT_SCOPE)\nmessage(${A})\n");
    assertEquals("1", valueAt(analysis, "${A}"));
  }

  @Test
  public void cacheEntries() {
    String source =
        "set(C first CACHE STRING \"doc\")\n"
            + "set(C second CACHE STRING \"doc\")\n"
            + "message(${C} $CACHE{C})\n"
            + "set(C third CACHE STRING \"doc\" FORCE)\n"
            + "message(${C})\n"
            + "set(C normal)\n"
            + "message(${C} $CACHE{C})\n";
    FileAnalysis analysis = analyse(source);
    assertEquals("first", valueAt(analysis, "${C}", 0));
    assertEquals("first", valueAt(analysis, "$CACHE{C}", 0));
    assertEquals("third", valueAt(analysis, "${C}", 1));
    assertEquals("normal", valueAt(analysis, "${C}", 2));
    assertEquals("third", valueAt(analysis, "$CACHE{C}", 1));
  }

  @Test
  public void environmentVariables() {
    String source =
        "set(ENV{TOOL_HOME} /opt/tool)\n"
            + "message($ENV{TOOL_HOME})\n"
            + "unset(ENV{TOOL_HOME})\n"
            + "message($ENV{TOOL_HOME} ${TOOL_HOME})\n";
    FileAnalysis analysis = analyse(source);
    assertEquals("/opt/tool", valueAt(analysis, "$ENV{TOOL_HOME}", 0));
    assertEquals("", valueAt(analysis, "$ENV{TOOL_HOME}", 1));
    assertEquals("", valueAt(analysis, "${TOOL_HOME}", 0));
  }

  @Test
  public void options() {
    String source =
        "option(WITH_A \"A\")\n"
            + "option(WITH_B \"B\" ON)\n"
            + "set(WITH_C yes)\n"
            + "option(WITH_C \"C\" OFF)\n"
            + "message(${WITH_A} ${WITH_B} ${WITH_C})\n";
    FileAnalysis analysis = analyse(source);
    assertEquals("OFF", valueAt(analysis, "${WITH_A}"));
    assertEquals("ON", valueAt(analysis, "${WITH_B}"));
    assertEquals("yes", valueAt(analysis, "${WITH_C}"));
  }

  @Test
  public void loopVariables() {
    String source =
        "set(ITEMS x;y)\n"
            + "foreach(a one two)\n  message(${a})\nendforeach()\n"
            + "foreach(b IN LISTS ITEMS)\n  message(${b})\nendforeach()\n"
            + "foreach(c RANGE 3)\n  message(${c})\nendforeach()\n"
            + "foreach(d RANGE 2 5)\n  message(${d})\nendforeach()\n";
    FileAnalysis analysis = analyse(source);
    assertEquals("one", valueAt(analysis, "${a}"));
    assertEquals("x", valueAt(analysis, "${b}"));
    assertEquals("0", valueAt(analysis, "${c}"));
    assertEquals("2", valueAt(analysis, "${d}"));
  }

  @Test
  public void functionScopeDoesNotLeak() {
    String source =
        "set(X outer)\n"
            + "function(f param)\n"
            + "  set(X inner)\n"
            + "  message(${X} ${param} ${ARGN})\n"
            + "endfunction()\n"
            + "message(${X} ${param})\n";
    FileAnalysis analysis = analyse(source);
    assertEquals("inner", valueAt(analysis, "${X}", 0));
    assertEquals("", valueAt(analysis, "${param}", 0));
    int argn = offsetOf(source, "${ARGN}", 0);
    assertTrue(analysis.variableRetrieval(argn + 2).get().definition.isPresent());
    assertEquals("outer", valueAt(analysis, "${X}", 1));
    assertFalse(
        analysis
            .variableRetrieval(offsetOf(source, "${param}", 1) + 2)
            .get()
            .definition
            .isPresent());
  }

  @Test
  public void blockScopeDoesNotLeak() {
    String source =
        "set(X outer)\nblock()\n  set(X inner)\n  message(${X})\nendblock()\nmessage(${X})\n";
    FileAnalysis analysis = analyse(source);
    assertEquals("inner", valueAt(analysis, "${X}", 0));
    assertEquals("outer", valueAt(analysis, "${X}", 1));
  }

  @Test
  public void ifBranchesAreAllWalked() {
    String source = "if(OFF)\n  set(A 1)\nelse()\n  set(B 2)\nendif()\nmessage(${A} ${B})\n";
    FileAnalysis analysis = analyse(source);
    assertEquals("1", valueAt(analysis, "${A}"));
    assertEquals("2", valueAt(analysis, "${B}"));
  }

  @Test
  public void conditions() {
    String source =
        "set(A 1)\n"
            + "if(A)\n"
            + "elseif(NOT A)\n"
            + "endif()\n"
            + "while(A STREQUAL 2)\n"
            + "endwhile()\n";
    FileAnalysis analysis = analyse(source);
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 0));
    assertEquals(Optional.of(false), conditionResult(analysis, "elseif", 0));
    assertEquals(Optional.of(false), conditionResult(analysis, "while", 0));
    assertEquals(Optional.empty(), conditionResult(analysis, "endif", 0));
  }

  @Test
  public void conditionsUseValuesAtThatPoint() {
    FileAnalysis analysis = analyse("set(A 0)\nif(A)\nendif()\nset(A 1)\nif(A)\nendif()\n");
    assertEquals(Optional.of(false), conditionResult(analysis, "if", 0));
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 1));
  }

  @Test
  public void conditionsInsideDefinitionsAreNotEvaluated() {
    FileAnalysis analysis = analyse("function(f x)\n  if(x)\n  endif()\nendfunction()\n");
    assertEquals(Optional.empty(), conditionResult(analysis, "if", 0));
  }

  @Test
  public void malformedCondition() {
    FileAnalysis analysis = analyse("set(A 1)\nif(A AND)\nendif()\n");
    assertEquals(1, analysis.diagnostics.size());
    Diagnostic diagnostic = analysis.diagnostics.get(0);
    assertEquals("Missing operand after 'AND' in condition", diagnostic.getMessage());
    assertEquals(DiagnosticSeverity.Error, diagnostic.getSeverity());
    assertEquals(Analysis.DIAGNOSTIC_SOURCE, diagnostic.getSource());
    assertEquals(range(1, 5, 1, 8), diagnostic.getRange());
    assertEquals(Optional.empty(), conditionResult(analysis, "if", 0));
  }

  @Test
  public void parseErrorsAreKept() {
    FileAnalysis analysis = analyse("set(A 1)\nif(A)\n");
    assertEquals(1, analysis.diagnostics.size());
    assertEquals("cmake", analysis.diagnostics.get(0).getSource());
    assertTrue(analysis.commandCalls.isEmpty());
  }

  @Test
  public void commandDefinitions() {
    String source =
        "greet(world)\n"
            + "function(greet name)\nendfunction()\n"
            + "macro(Log value)\nendmacro()\n"
            + "LOG(x)\n"
            + "unknown()\n";
    FileAnalysis analysis = analyse(source);
    assertEquals(2, analysis.commandDefinitions.size());

    CommandDefinition greet = analysis.commandDefinition("GREET").get();
    assertFalse(greet.isMacro());
    assertEquals("greet(name)", greet.signature());
    assertEquals(range(1, 9, 1, 14), greet.location.getRange());

    CommandDefinition log = analysis.commandDefinition("log").get();
    assertTrue(log.isMacro());
    assertEquals(Arrays.asList("value"), log.parameters);

    List<CommandInvocation> commands = analysis.file.script.get().flatten();
    // Calls before the definition are linked too.
    assertEquals(greet, analysis.commandCall(commands.get(0)).get().definition.get());
    CommandInvocation logCall =
        commands.stream().filter(command -> command.name.equals("LOG")).findFirst().get();
    assertEquals(log, analysis.commandCall(logCall).get().definition.get());
    CommandInvocation unknown = commands.get(commands.size() - 1);
    assertFalse(analysis.commandCall(unknown).get().definition.isPresent());
  }

  @Test
  public void laterDefinitionsReplaceEarlierOnes() {
    FileAnalysis analysis =
        analyse("function(f)\nendfunction()\nfunction(f a b)\nendfunction()\nf(1 2)\n");
    assertEquals(1, analysis.commandDefinitions.size());
    assertEquals("f(a b)", analysis.commandDefinition("f").get().signature());
  }

  @Test
  public void leadingComments() {
    String source =
        "# Unrelated.\n"
            + "\n"
            + "## Adds two numbers.\n"
            + "#\n"
            + "# Really.\n"
            + "function(add a b)\n"
            + "endfunction()\n"
            + "set(A 1) # trailing\n"
            + "function(bare)\n"
            + "endfunction()\n"
            + "# Detached.\n"
            + "\n"
            + "set(B 2)\n";
    FileAnalysis analysis = analyse(source);
    assertEquals(
        "Adds two numbers.\n\nReally.", analysis.commandDefinition("add").get().commentText.get());
    assertFalse(analysis.commandDefinition("bare").get().commentText.isPresent());
    VariableDefinition b =
        analysis.variableDefinitions.stream().filter(v -> v.name.equals("B")).findFirst().get();
    assertFalse(b.commentText.isPresent());
  }

  @Test
  public void variableComments() {
    FileAnalysis analysis = analyse("# The answer.\nset(ANSWER 42)\n");
    assertEquals("The answer.", analysis.variableDefinitions.get(0).commentText.get());
  }

  @Test
  public void targets() {
    String source =
        "set(NAME app)\n"
            + "add_executable(${NAME} main.c)\n"
            + "add_library(lib STATIC lib.c)\n"
            + "if(TARGET app AND TARGET lib)\nendif()\n"
            + "if(TARGET missing)\nendif()\n";
    FileAnalysis analysis = analyse(source);
    assertEquals(Arrays.asList("app", "lib"), analysis.targets.asList());
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 0));
    assertEquals(Optional.of(false), conditionResult(analysis, "if", 1));
  }

  @Test
  public void commandTests() {
    String source =
        "function(mine)\nendfunction()\n"
            + "if(COMMAND mine AND COMMAND message)\nendif()\n"
            + "if(COMMAND theirs)\nendif()\n";
    FileAnalysis analysis = analyse(source);
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 0));
    assertEquals(Optional.of(false), conditionResult(analysis, "if", 1));
  }

  @Test
  public void policyTests() {
    FileAnalysis analysis =
        analyse("if(POLICY CMP0054)\nendif()\nif(POLICY CMP9999)\nendif()\n");
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 0));
    assertEquals(Optional.of(false), conditionResult(analysis, "if", 1));

    ProjectConfiguration config = new ProjectConfiguration();
    config.policies.add("CMP9999");
    analysis = analyse("if(POLICY CMP0054)\nendif()\nif(POLICY CMP9999)\nendif()\n", config);
    assertEquals(Optional.of(false), conditionResult(analysis, "if", 0));
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 1));
  }

  @Test
  public void definedTests() {
    FileAnalysis analysis =
        analyse("set(A 1)\nif(DEFINED A AND NOT DEFINED B)\nendif()\n");
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 0));
  }

  @Test
  public void projectConfiguration() {
    ProjectConfiguration config = new ProjectConfiguration();
    config.variables.put("CMAKE_SYSTEM_NAME", "Linux");
    config.environment.put("HOME", "/home/demo");
    config.cache.put("WITH_DOCS", "ON");
    config.commands.add("external_function");
    config.targets.add("external_lib");

    String source =
        "message(${CMAKE_SYSTEM_NAME} $ENV{HOME} ${WITH_DOCS})\n"
            + "if(COMMAND external_function AND TARGET external_lib)\nendif()\n";
    FileAnalysis analysis = analyse(source, config);
    assertEquals("Linux", valueAt(analysis, "${CMAKE_SYSTEM_NAME}"));
    assertEquals("/home/demo", valueAt(analysis, "$ENV{HOME}"));
    assertEquals("ON", valueAt(analysis, "${WITH_DOCS}"));
    int reference = offsetOf(source, "${CMAKE_SYSTEM_NAME}", 0);
    assertFalse(analysis.variableRetrieval(reference + 2).get().definition.isPresent());
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 0));
  }

  @Test
  public void dereferencePolicy() {
    String source = "set(A demo)\nif(\"A\" STREQUAL \"demo\")\nendif()\n";
    assertEquals(Optional.of(false), conditionResult(analyse(source), "if", 0));

    ProjectConfiguration config = new ProjectConfiguration();
    config.policy = "OLD";
    assertEquals(Optional.of(true), conditionResult(analyse(source, config), "if", 0));
  }

  @Test
  public void fileTestsAreRelativeToTheDocument() throws Exception {
    Files.createFile(directory.resolve("present.txt"));
    Files.createDirectory(directory.resolve("sub"));
    URI document = directory.resolve("CMakeLists.txt").toUri();
    String source =
        "if(EXISTS present.txt)\nendif()\n"
            + "if(EXISTS missing.txt)\nendif()\n"
            + "if(IS_DIRECTORY sub)\nendif()\n"
            + "if(IS_DIRECTORY present.txt)\nendif()\n"
            + "if(present.txt IS_NEWER_THAN missing.txt)\nendif()\n";
    FileAnalysis analysis =
        Analysis.analyse(new CMakeFile(document, source), new ProjectConfiguration());
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 0));
    assertEquals(Optional.of(false), conditionResult(analysis, "if", 1));
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 2));
    assertEquals(Optional.of(false), conditionResult(analysis, "if", 3));
    assertEquals(Optional.of(true), conditionResult(analysis, "if", 4));
  }
}
