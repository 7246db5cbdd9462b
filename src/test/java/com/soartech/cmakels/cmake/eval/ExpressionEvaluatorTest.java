package com.soartech.cmakels.cmake.eval;

import static java.util.stream.Collectors.toList;
import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableSet;
import com.soartech.cmakels.cmake.CMakeEvalException;
import com.soartech.cmakels.cmake.CMakeScripts;
import com.soartech.cmakels.cmake.ast.Argument;
import com.soartech.cmakels.cmake.ast.IfBlock;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ExpressionEvaluatorTest {
  final MapVariableContext context =
      MapVariableContext.builder()
          .normal("ZERO", "0")
          .normal("ONE", "1")
          .normal("NAME", "demo")
          .normal("LIST", "a;b;c")
          .normal("A", "1")
          .environment("HOME", "/home/demo")
          .cache("CACHED", "ON")
          .build();

  final TestOracle oracle =
      TestOracle.builder()
          .exists(ImmutableSet.of("/usr/include")::contains)
          .command(ImmutableSet.of("message", "my_function")::contains)
          .target(ImmutableSet.of("app")::contains)
          .defined(context)
          .policy(id -> id.equals("CMP0054"))
          .build();

  /** The arguments of a condition, as the parser reads them from {@code if(...)}. */
  static List<Argument> condition(String text) {
    IfBlock block = (IfBlock) CMakeScripts.parse("if(" + text + ")\nendif()").nodes.get(0);
    return block.branches.get(0).command.arguments;
  }

  boolean evaluate(String text) {
    return evaluate(text, DereferencePolicy.NEW);
  }

  boolean evaluate(String text, DereferencePolicy policy) {
    return ExpressionEvaluator.evaluate(condition(text), context, oracle, policy);
  }

  boolean evaluateValues(String... values) {
    List<ExpandedArgument> arguments =
        Arrays.stream(values).map(ExpandedArgument::unquoted).collect(toList());
    return ExpressionEvaluator.evaluateExpanded(
        arguments, context, oracle, DereferencePolicy.NEW);
  }

  CMakeEvalException evaluationError(String text) {
    return assertThrows(CMakeEvalException.class, () -> evaluate(text));
  }

  @Test
  public void falseConstants() {
    for (String value :
        Arrays.asList("", "0", "FALSE", "OFF", "NO", "N", "IGNORE", "NOTFOUND", "X-NOTFOUND")) {
      assertFalse(evaluateValues(value), value);
      assertFalse(evaluateValues(value.toLowerCase()), value.toLowerCase());
    }
    assertFalse(evaluateValues("0.0"));
  }

  @Test
  public void trueConstants() {
    for (String value : Arrays.asList("1", "ON", "YES", "TRUE", "Y", "hello", "2", "-1")) {
      assertTrue(evaluateValues(value), value);
    }
  }

  @Test
  public void noArgumentsIsFalse() {
    assertFalse(
        ExpressionEvaluator.evaluateExpanded(
            Arrays.asList(), context, oracle, DereferencePolicy.NEW));
  }

  @Test
  public void bareVariablesAreDereferenced() {
    assertFalse(evaluate("ZERO"));
    assertTrue(evaluate("ONE"));
    assertTrue(evaluate("${ONE}"));
  }

  @Test
  public void constantsAreNeverDereferenced() {
    MapVariableContext tricky = MapVariableContext.builder().normal("ON", "0").build();
    assertTrue(
        ExpressionEvaluator.evaluate(condition("ON"), tricky, oracle, DereferencePolicy.NEW));
  }

  @Test
  public void notBindsTighterThanAnd() {
    // (NOT ZERO) AND ZERO, rather than NOT (ZERO AND ZERO)
    assertFalse(evaluate("NOT ZERO AND ZERO"));
    assertTrue(evaluate("NOT ZERO AND ONE"));
    assertTrue(evaluate("NOT NOT ONE"));
  }

  @Test
  public void andAndOrApplyLeftToRight() {
    // (ONE OR ZERO) AND ZERO
    assertFalse(evaluate("ONE OR ZERO AND ZERO"));
    assertTrue(evaluate("ZERO AND ZERO OR ONE"));
  }

  @Test
  public void parentheses() {
    assertTrue(evaluate("ONE OR (ZERO AND ZERO)"));
    assertFalse(evaluate("NOT (ONE OR ZERO)"));
    assertTrue(evaluate("((ONE))"));
  }

  @Test
  public void stringComparisons() {
    assertTrue(evaluate("NAME STREQUAL \"demo\""));
    assertTrue(evaluate("NAME STREQUAL demo"));
    assertFalse(evaluate("\"NAME\" STREQUAL \"demo\""));
    assertTrue(evaluate("abc STRLESS abd"));
    assertTrue(evaluate("b STRGREATER_EQUAL b"));
  }

  @Test
  public void quotedArgumentsUnderOldPolicy() {
    assertTrue(evaluate("\"NAME\" STREQUAL \"demo\"", DereferencePolicy.OLD));
    assertTrue(evaluate("\"ONE\"", DereferencePolicy.OLD));
    assertTrue(evaluate("\"ZERO\"", DereferencePolicy.NEW));
  }

  @Test
  public void quotedKeywordsAreStringsUnderNewPolicy() {
    assertTrue(evaluate("\"AND\" STREQUAL \"AND\""));
    assertTrue(evaluate("\"NOT\""));
  }

  @Test
  public void numericComparisons() {
    assertTrue(evaluate("10 GREATER 9"));
    assertTrue(evaluate("ONE EQUAL 1.0"));
    assertTrue(evaluate("2 LESS_EQUAL 2"));
    assertFalse(evaluate("abc LESS 1"));
  }

  @Test
  public void versionComparisons() {
    assertTrue(evaluate("3.10 VERSION_GREATER 3.9"));
    assertTrue(evaluate("1.2 VERSION_EQUAL 1.2.0"));
    assertFalse(evaluate("1.2 VERSION_LESS 1.2"));
  }

  @Test
  public void matches() {
    assertTrue(evaluate("NAME MATCHES \"^de\""));
    assertFalse(evaluate("NAME MATCHES \"^mo\""));
  }

  @Test
  public void invalidRegularExpression() {
    CMakeEvalException e = evaluationError("NAME MATCHES \"[\"");
    assertTrue(e.getMessage().startsWith("Invalid regular expression '['"), e.getMessage());
  }

  @Test
  public void inList() {
    assertTrue(evaluate("b IN_LIST LIST"));
    assertFalse(evaluate("d IN_LIST LIST"));
    assertFalse(evaluate("a IN_LIST MISSING"));
  }

  @Test
  public void pathEqual() {
    assertTrue(evaluate("/a//b PATH_EQUAL /a/b"));
    assertFalse(evaluate("/a/b PATH_EQUAL /a/c"));
  }

  @Test
  public void unaryTests() {
    assertTrue(evaluate("EXISTS /usr/include"));
    assertFalse(evaluate("EXISTS /nowhere"));
    assertTrue(evaluate("COMMAND my_function"));
    assertTrue(evaluate("TARGET app"));
    assertFalse(evaluate("TARGET lib"));
    assertTrue(evaluate("POLICY CMP0054"));
    assertFalse(evaluate("TEST unit"));
  }

  @Test
  public void defined() {
    assertTrue(evaluate("DEFINED NAME"));
    assertTrue(evaluate("DEFINED CACHED"));
    assertTrue(evaluate("DEFINED ENV{HOME}"));
    assertFalse(evaluate("DEFINED ENV{NAME}"));
    assertTrue(evaluate("DEFINED CACHE{CACHED}"));
    assertFalse(evaluate("DEFINED MISSING"));
  }

  @Test
  public void isAbsolute() {
    assertTrue(evaluate("IS_ABSOLUTE /usr"));
    assertTrue(evaluate("IS_ABSOLUTE C:/Windows"));
    assertFalse(evaluate("IS_ABSOLUTE src/main.c"));
  }

  @Test
  public void oracleDefaultsAreFalse() {
    assertFalse(
        ExpressionEvaluator.evaluate(
            condition("EXISTS /usr/include"), context, TestOracle.NONE, DereferencePolicy.NEW));
  }

  @Test
  public void missingOperand() {
    CMakeEvalException e = evaluationError("ONE AND");
    assertEquals("Missing operand after 'AND' in condition", e.getMessage());
    assertEquals(7, e.getSpan().getOffset());

    assertEquals("Missing operand after 'NOT' in condition", evaluationError("NOT").getMessage());
    assertEquals(
        "Missing operand after 'STREQUAL' in condition",
        evaluationError("ONE STREQUAL").getMessage());
    assertEquals(
        "Missing operand after 'EXISTS' in condition", evaluationError("EXISTS").getMessage());
  }

  @Test
  public void missingOperandBeforeOperator() {
    assertEquals(
        "Missing operand before 'OR' in condition", evaluationError("OR ONE").getMessage());
  }

  @Test
  public void unbalancedParentheses() {
    CMakeEvalException e =
        assertThrows(CMakeEvalException.class, () -> evaluateValues("(", "ONE"));
    assertEquals("Missing ')' in condition", e.getMessage());

    e = assertThrows(CMakeEvalException.class, () -> evaluateValues("ONE", ")"));
    assertEquals("Unbalanced ')' in condition", e.getMessage());
  }

  @Test
  public void leftoverArguments() {
    assertEquals(
        "Unexpected argument 'demo' in condition", evaluationError("ONE demo").getMessage());
  }

  @Test
  public void unknownKeywordsAreOperands() {
    assertTrue(evaluate("FROBNICATE"));
  }
}
