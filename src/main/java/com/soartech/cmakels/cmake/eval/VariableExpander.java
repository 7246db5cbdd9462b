package com.soartech.cmakels.cmake.eval;

import com.google.common.collect.ImmutableList;
import com.soartech.cmakels.cmake.ast.Argument;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Resolves escape sequences and variable references in argument text.
 *
 * <p>The text is scanned once from left to right. Each reference opener (<code>${</code>,
 * <code>$ENV{</code> or <code>$CACHE{</code>) pushes a frame that collects the characters up to
 * its closing brace; nested openers push further frames. When a brace closes the innermost frame,
 * the collected text is the variable name, and the value it resolves to is appended to the
 * enclosing frame. A substituted value is never scanned again, so it can form part of an enclosing
 * name but cannot itself introduce references.
 *
 * <p>Expansion never fails. Variables that are not set resolve to the empty string, and a
 * reference that is still open at the end of the text is kept literally.
 */
public final class VariableExpander {
  private VariableExpander() {}

  public static String expand(String text, VariableContext context) {
    return scan(text, context, null);
  }

  /** Expand an argument. Bracket arguments are returned unchanged. */
  public static String expand(Argument argument, VariableContext context) {
    return argument.isExpandable() ? expand(argument.text, context) : argument.text;
  }

  /** Find all references in the text, innermost first, without any variables set. */
  public static ImmutableList<VariableReference> references(String text) {
    return references(text, VariableContext.EMPTY);
  }

  /** Find all references in the text, innermost first, with their values in the context. */
  public static ImmutableList<VariableReference> references(String text, VariableContext context) {
    List<VariableReference> references = new ArrayList<>();
    scan(text, context, references);
    return ImmutableList.copyOf(references);
  }

  /**
   * Expand arguments the way commands receive them: unquoted arguments are split into list
   * elements, dropping empty ones, while quoted and bracket arguments stay single values.
   */
  public static ImmutableList<ExpandedArgument> expandArguments(
      List<Argument> arguments, VariableContext context) {
    ImmutableList.Builder<ExpandedArgument> expanded = ImmutableList.builder();
    for (Argument argument : arguments) {
      String value = expand(argument, context);
      if (argument.isListSplittable()) {
        for (String element : ListValues.split(value)) {
          expanded.add(new ExpandedArgument(element, argument.isQuoted(), argument.span));
        }
      } else {
        expanded.add(new ExpandedArgument(value, argument.isQuoted(), argument.span));
      }
    }
    return expanded.build();
  }

  /** Like {@link #expandArguments(List, VariableContext)}, but only the values. */
  public static ImmutableList<String> resolve(List<Argument> arguments, VariableContext context) {
    return expandArguments(arguments, context).stream()
        .map(argument -> argument.value)
        .collect(ImmutableList.toImmutableList());
  }

  private static String scan(
      String text, VariableContext context, List<VariableReference> references) {
    StringBuilder root = new StringBuilder(text.length());
    Deque<Frame> frames = new ArrayDeque<>();

    int i = 0;
    while (i < text.length()) {
      StringBuilder out = frames.isEmpty() ? root : frames.peek().name;
      char c = text.charAt(i);

      if (c == '\\' && i + 1 < text.length()) {
        appendEscaped(out, text.charAt(i + 1));
        i += 2;
        continue;
      }

      if (c == '$') {
        Namespace namespace = Namespace.openedAt(text, i);
        if (namespace != null) {
          frames.push(new Frame(namespace, i));
          i += namespace.opener.length();
          continue;
        }
      }

      if (c == '}' && !frames.isEmpty()) {
        Frame frame = frames.pop();
        String name = frame.name.toString();
        String value = context.lookup(frame.namespace, name).orElse("");
        if (references != null) {
          String rawName = text.substring(frame.start + frame.namespace.opener.length(), i);
          references.add(
              new VariableReference(
                  frame.namespace, rawName, name, value, frame.start, i + 1, frames.size()));
        }
        (frames.isEmpty() ? root : frames.peek().name).append(value);
        ++i;
        continue;
      }

      out.append(c);
      ++i;
    }

    // Unterminated references are kept as written, apart from what was expanded inside them.
    while (!frames.isEmpty()) {
      Frame frame = frames.pop();
      StringBuilder out = frames.isEmpty() ? root : frames.peek().name;
      out.append(frame.namespace.opener).append(frame.name);
    }

    return root.toString();
  }

  private static void appendEscaped(StringBuilder out, char c) {
    switch (c) {
      case 't':
        out.append('\t');
        break;
      case 'n':
        out.append('\n');
        break;
      case 'r':
        out.append('\r');
        break;
      case ';':
        // Kept so that list splitting does not treat it as a separator.
        out.append("\\;");
        break;
      default:
        out.append(c);
        break;
    }
  }

  private static class Frame {
    final Namespace namespace;

    /** Index of the opener in the text. */
    final int start;

    final StringBuilder name = new StringBuilder();

    Frame(Namespace namespace, int start) {
      this.namespace = namespace;
      this.start = start;
    }
  }
}
