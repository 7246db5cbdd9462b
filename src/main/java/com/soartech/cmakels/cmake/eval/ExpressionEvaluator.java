package com.soartech.cmakels.cmake.eval;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Doubles;
import com.soartech.cmakels.cmake.CMakeEvalException;
import com.soartech.cmakels.cmake.SourceSpan;
import com.soartech.cmakels.cmake.ast.Argument;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the conditions of {@code if()}, {@code elseif()} and {@code while()}.
 *
 * <p>From highest to lowest precedence, a condition is made of:
 *
 * <ol>
 *   <li>parenthesized sub-expressions;
 *   <li>unary tests such as {@code EXISTS path} or {@code DEFINED name}, answered by a {@link
 *       TestOracle};
 *   <li>binary comparisons such as {@code a STREQUAL b} or {@code a VERSION_LESS b};
 *   <li>{@code NOT};
 *   <li>{@code AND} and {@code OR}, which have equal precedence and are applied left to right.
 * </ol>
 *
 * <p>Operands of comparisons and bare operands are dereferenced: if a variable with the operand's
 * name is set in the normal namespace, its value is used instead of the operand itself. Whether
 * quoted operands are dereferenced, and whether they can be keywords, depends on the {@link
 * DereferencePolicy}.
 */
public final class ExpressionEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

  private static final ImmutableSet<String> UNARY_TESTS =
      ImmutableSet.of(
          "EXISTS",
          "COMMAND",
          "TARGET",
          "DEFINED",
          "POLICY",
          "TEST",
          "IS_DIRECTORY",
          "IS_SYMLINK",
          "IS_ABSOLUTE");

  private static final ImmutableSet<String> BINARY_TESTS =
      ImmutableSet.of(
          "STREQUAL",
          "STRLESS",
          "STRGREATER",
          "STRLESS_EQUAL",
          "STRGREATER_EQUAL",
          "MATCHES",
          "LESS",
          "GREATER",
          "EQUAL",
          "LESS_EQUAL",
          "GREATER_EQUAL",
          "VERSION_LESS",
          "VERSION_GREATER",
          "VERSION_EQUAL",
          "VERSION_LESS_EQUAL",
          "VERSION_GREATER_EQUAL",
          "IS_NEWER_THAN",
          "IN_LIST",
          "PATH_EQUAL");

  private static final ImmutableSet<String> TRUE_CONSTANTS =
      ImmutableSet.of("ON", "YES", "TRUE", "Y");

  private static final ImmutableSet<String> FALSE_CONSTANTS =
      ImmutableSet.of("OFF", "NO", "FALSE", "N", "IGNORE", "NOTFOUND");

  private static final Pattern WINDOWS_ABSOLUTE = Pattern.compile("^[A-Za-z]:[/\\\\].*");

  private final List<ExpandedArgument> arguments;
  private final VariableContext context;
  private final TestOracle oracle;
  private final DereferencePolicy policy;

  /** Index of the next argument to consume. */
  private int position = 0;

  private ExpressionEvaluator(
      List<ExpandedArgument> arguments,
      VariableContext context,
      TestOracle oracle,
      DereferencePolicy policy) {
    this.arguments = arguments;
    this.context = context;
    this.oracle = oracle;
    this.policy = policy;
  }

  /**
   * Expand the arguments of a condition command and evaluate them.
   *
   * @throws CMakeEvalException if the condition is malformed
   */
  public static boolean evaluate(
      List<Argument> arguments,
      VariableContext context,
      TestOracle oracle,
      DereferencePolicy policy) {
    return evaluateExpanded(
        VariableExpander.expandArguments(arguments, context), context, oracle, policy);
  }

  /**
   * Evaluate arguments that have already been expanded.
   *
   * @throws CMakeEvalException if the condition is malformed
   */
  public static boolean evaluateExpanded(
      List<ExpandedArgument> arguments,
      VariableContext context,
      TestOracle oracle,
      DereferencePolicy policy) {
    if (arguments.isEmpty()) {
      return false;
    }
    boolean result = new ExpressionEvaluator(arguments, context, oracle, policy).evaluate();
    LOG.trace("Evaluated {} to {}", arguments, result);
    return result;
  }

  /**
   * Check whether a value is true as a condition constant. False values are the empty string,
   * {@code 0} and other numbers equal to zero, {@code OFF}, {@code NO}, {@code FALSE}, {@code N},
   * {@code IGNORE}, {@code NOTFOUND} and anything ending in {@code -NOTFOUND}, ignoring case.
   * Everything else is true.
   */
  public static boolean isTrue(String value) {
    String upper = value.toUpperCase(Locale.ROOT);
    if (value.isEmpty() || FALSE_CONSTANTS.contains(upper) || upper.endsWith("-NOTFOUND")) {
      return false;
    }
    Double number = Doubles.tryParse(value.trim());
    return number == null || number != 0.0;
  }

  /** Whether a value is a named boolean constant or a number, which is never dereferenced. */
  private static boolean isConstant(String value) {
    String upper = value.toUpperCase(Locale.ROOT);
    return value.isEmpty()
        || TRUE_CONSTANTS.contains(upper)
        || FALSE_CONSTANTS.contains(upper)
        || upper.endsWith("-NOTFOUND")
        || Doubles.tryParse(value) != null;
  }

  private boolean evaluate() {
    boolean result = orExpression();
    if (position < arguments.size()) {
      ExpandedArgument unexpected = arguments.get(position);
      if (isKeyword(unexpected, ")")) {
        throw new CMakeEvalException("Unbalanced ')' in condition", unexpected.span);
      }
      throw new CMakeEvalException(
          "Unexpected argument '" + unexpected.value + "' in condition", unexpected.span);
    }
    return result;
  }

  private boolean orExpression() {
    boolean result = notExpression();
    while (position < arguments.size()
        && (isKeyword(peek(), "AND") || isKeyword(peek(), "OR"))) {
      ExpandedArgument operator = next();
      if (position >= arguments.size()) {
        throw missingOperand(operator);
      }
      boolean right = notExpression();
      result = operator.value.equals("AND") ? result && right : result || right;
    }
    return result;
  }

  private boolean notExpression() {
    if (isKeyword(peek(), "NOT")) {
      ExpandedArgument not = next();
      if (position >= arguments.size()) {
        throw missingOperand(not);
      }
      return !notExpression();
    }
    return truth(comparison());
  }

  private Operand comparison() {
    Operand left = primary();
    while (position < arguments.size() && isBinaryTest(peek())) {
      ExpandedArgument operator = next();
      if (position >= arguments.size()) {
        throw missingOperand(operator);
      }
      ExpandedArgument right = next();
      boolean result = compare(operator, left, right);
      left = Operand.result(result, SourceSpan.cover(left.span, right.span));
    }
    return left;
  }

  private Operand primary() {
    if (position >= arguments.size()) {
      throw missingOperand(arguments.get(arguments.size() - 1));
    }

    ExpandedArgument argument = peek();
    if (isKeyword(argument, "(")) {
      next();
      boolean result = orExpression();
      if (position >= arguments.size() || !isKeyword(peek(), ")")) {
        throw new CMakeEvalException("Missing ')' in condition", argument.span);
      }
      ExpandedArgument close = next();
      return Operand.result(result, SourceSpan.cover(argument.span, close.span));
    }

    if (isUnaryTest(argument)) {
      ExpandedArgument test = next();
      if (position >= arguments.size()) {
        throw missingOperand(test);
      }
      ExpandedArgument operand = next();
      return Operand.result(
          unaryTest(test.value, operand.value), SourceSpan.cover(test.span, operand.span));
    }

    if (isKeyword(argument, "AND") || isKeyword(argument, "OR") || isKeyword(argument, ")")) {
      throw new CMakeEvalException(
          "Missing operand before '" + argument.value + "' in condition", argument.span);
    }

    return Operand.argument(next());
  }

  private boolean unaryTest(String test, String operand) {
    switch (test) {
      case "EXISTS":
        return oracle.exists(operand);
      case "COMMAND":
        return oracle.command(operand);
      case "TARGET":
        return oracle.target(operand);
      case "DEFINED":
        return oracle.defined(operand);
      case "POLICY":
        return oracle.policy(operand);
      case "TEST":
        return oracle.test(operand);
      case "IS_DIRECTORY":
        return oracle.isDirectory(operand);
      case "IS_SYMLINK":
        return oracle.isSymlink(operand);
      case "IS_ABSOLUTE":
        return isAbsolute(operand);
      default:
        throw new IllegalArgumentException("Not a unary test: " + test);
    }
  }

  private boolean compare(ExpandedArgument operator, Operand left, ExpandedArgument right) {
    switch (operator.value) {
      case "MATCHES":
        return matches(value(left), right);
      case "IN_LIST":
        return context
            .normal(right.value)
            .map(list -> ListValues.split(list).contains(value(left)))
            .orElse(false);
      case "IS_NEWER_THAN":
        return oracle.isNewerThan(literal(left), right.value);
      default:
        break;
    }

    String leftValue = value(left);
    String rightValue = dereference(right);
    switch (operator.value) {
      case "STREQUAL":
        return leftValue.equals(rightValue);
      case "STRLESS":
        return leftValue.compareTo(rightValue) < 0;
      case "STRGREATER":
        return leftValue.compareTo(rightValue) > 0;
      case "STRLESS_EQUAL":
        return leftValue.compareTo(rightValue) <= 0;
      case "STRGREATER_EQUAL":
        return leftValue.compareTo(rightValue) >= 0;
      case "PATH_EQUAL":
        return normalizePath(leftValue).equals(normalizePath(rightValue));
      case "VERSION_LESS":
        return VersionComparator.INSTANCE.compare(leftValue, rightValue) < 0;
      case "VERSION_GREATER":
        return VersionComparator.INSTANCE.compare(leftValue, rightValue) > 0;
      case "VERSION_EQUAL":
        return VersionComparator.INSTANCE.compare(leftValue, rightValue) == 0;
      case "VERSION_LESS_EQUAL":
        return VersionComparator.INSTANCE.compare(leftValue, rightValue) <= 0;
      case "VERSION_GREATER_EQUAL":
        return VersionComparator.INSTANCE.compare(leftValue, rightValue) >= 0;
      default:
        return compareNumbers(operator.value, leftValue, rightValue);
    }
  }

  /** Numeric comparisons are false, not errors, when either side is not a number. */
  private static boolean compareNumbers(String operator, String left, String right) {
    Double leftNumber = Doubles.tryParse(left.trim());
    Double rightNumber = Doubles.tryParse(right.trim());
    if (leftNumber == null || rightNumber == null) {
      return false;
    }
    int result = Double.compare(leftNumber, rightNumber);
    switch (operator) {
      case "LESS":
        return result < 0;
      case "GREATER":
        return result > 0;
      case "EQUAL":
        return result == 0;
      case "LESS_EQUAL":
        return result <= 0;
      case "GREATER_EQUAL":
        return result >= 0;
      default:
        throw new IllegalArgumentException("Not a binary test: " + operator);
    }
  }

  private static boolean matches(String value, ExpandedArgument regex) {
    Pattern pattern;
    try {
      pattern = Pattern.compile(regex.value);
    } catch (PatternSyntaxException e) {
      throw new CMakeEvalException(
          "Invalid regular expression '" + regex.value + "': " + e.getDescription(), regex.span);
    }
    return pattern.matcher(value).find();
  }

  private static boolean isAbsolute(String path) {
    return path.startsWith("/")
        || path.startsWith("~")
        || path.startsWith("\\\\")
        || WINDOWS_ABSOLUTE.matcher(path).matches();
  }

  /** Collapse repeated separators, so {@code a//b} and {@code a/b} name the same path. */
  private static String normalizePath(String path) {
    return path.replace('\\', '/').replaceAll("/+", "/");
  }

  private boolean truth(Operand operand) {
    if (operand.argument == null) {
      return operand.result;
    }
    ExpandedArgument argument = operand.argument;
    if (!isConstant(argument.value) && mayDereference(argument)) {
      Optional<String> value = context.normal(argument.value);
      if (value.isPresent()) {
        return isTrue(value.get());
      }
    }
    return isTrue(argument.value);
  }

  /** The value an operand stands for in a comparison. */
  private String value(Operand operand) {
    if (operand.argument == null) {
      return operand.result ? "1" : "0";
    }
    return dereference(operand.argument);
  }

  private static String literal(Operand operand) {
    if (operand.argument == null) {
      return operand.result ? "1" : "0";
    }
    return operand.argument.value;
  }

  private String dereference(ExpandedArgument argument) {
    if (!mayDereference(argument)) {
      return argument.value;
    }
    return context.normal(argument.value).orElse(argument.value);
  }

  private boolean mayDereference(ExpandedArgument argument) {
    return policy == DereferencePolicy.OLD || !argument.quoted;
  }

  private boolean isKeyword(ExpandedArgument argument, String keyword) {
    return argument != null && mayDereference(argument) && argument.value.equals(keyword);
  }

  private boolean isUnaryTest(ExpandedArgument argument) {
    return mayDereference(argument) && UNARY_TESTS.contains(argument.value);
  }

  private boolean isBinaryTest(ExpandedArgument argument) {
    return mayDereference(argument) && BINARY_TESTS.contains(argument.value);
  }

  private ExpandedArgument peek() {
    return position < arguments.size() ? arguments.get(position) : null;
  }

  private ExpandedArgument next() {
    return arguments.get(position++);
  }

  private static CMakeEvalException missingOperand(ExpandedArgument operator) {
    return new CMakeEvalException(
        "Missing operand after '" + operator.value + "' in condition", operator.span);
  }

  /** Either a literal argument or the result of a sub-expression. */
  private static final class Operand {
    final ExpandedArgument argument;
    final boolean result;
    final SourceSpan span;

    private Operand(ExpandedArgument argument, boolean result, SourceSpan span) {
      this.argument = argument;
      this.result = result;
      this.span = span;
    }

    static Operand argument(ExpandedArgument argument) {
      return new Operand(argument, false, argument.span);
    }

    static Operand result(boolean result, SourceSpan span) {
      return new Operand(null, result, span);
    }
  }
}
