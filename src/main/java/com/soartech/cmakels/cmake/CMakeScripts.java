package com.soartech.cmakels.cmake;

import com.google.common.collect.ImmutableList;
import com.soartech.cmakels.cmake.ast.Argument;
import com.soartech.cmakels.cmake.ast.Script;
import com.soartech.cmakels.cmake.eval.DereferencePolicy;
import com.soartech.cmakels.cmake.eval.ExpressionEvaluator;
import com.soartech.cmakels.cmake.eval.TestOracle;
import com.soartech.cmakels.cmake.eval.VariableContext;
import com.soartech.cmakels.cmake.eval.VariableExpander;
import java.util.List;

/**
 * Entry points for reading and evaluating CMake code without a language server.
 *
 * <pre>
 * Script script = CMakeScripts.parse(source);
 * String value = CMakeScripts.expand("${CMAKE_SOURCE_DIR}/src", variables);
 * </pre>
 *
 * <p>All of these are pure functions of their arguments.
 */
public final class CMakeScripts {
  private static final CMakeParser PARSER = new CMakeParser();

  private CMakeScripts() {}

  /**
   * Get the tokens of a script. Each iteration lexes the text from the start; errors are thrown
   * as {@link CMakeLexerException} when the offending token is reached.
   */
  public static Iterable<Token> tokenize(String text) {
    return () -> new CMakeLexer(text);
  }

  /**
   * Parse a script into commands and blocks.
   *
   * @throws CMakeLexerException if the text cannot be tokenized
   * @throws CMakeParserException if the commands are malformed or blocks are not matched
   */
  public static Script parse(String text) {
    return PARSER.parse(text);
  }

  /** Resolve the escape sequences and variable references in some text. Never fails. */
  public static String expand(String text, VariableContext context) {
    return VariableExpander.expand(text, context);
  }

  /** Expand arguments into the list of values a command would receive. */
  public static ImmutableList<String> resolve(List<Argument> arguments, VariableContext context) {
    return VariableExpander.resolve(arguments, context);
  }

  /**
   * Evaluate the arguments of an {@code if()}, {@code elseif()} or {@code while()} command.
   *
   * @throws CMakeEvalException if the condition is malformed
   */
  public static boolean evaluate(
      List<Argument> arguments,
      VariableContext context,
      TestOracle oracle,
      DereferencePolicy policy) {
    return ExpressionEvaluator.evaluate(arguments, context, oracle, policy);
  }
}
